package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.AstScanner;
import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a CallGraph by scanning every procedure body of a program.
 * Both call statements and call expressions count as call sites.
 */
public class CallGraphBuilder extends AstScanner<CallGraph> {

    private static final Logger logger = LoggerFactory.getLogger(CallGraphBuilder.class);

    private String currentProcedure = "";

    /**
     * Builds a call graph from a program's procedure table.
     *
     * @param program The parsed program
     * @return The constructed call graph
     */
    public CallGraph build(Program program) {
        CallGraph callGraph = new CallGraph();

        for (String name : program.getProcedures().keySet()) {
            callGraph.addProcedure(name);
        }

        for (Procedure procedure : program.getProcedures().values()) {
            String previous = currentProcedure;
            currentProcedure = procedure.name();
            scan(procedure.body(), callGraph);
            currentProcedure = previous;
        }

        logger.debug("Call graph built: {}", callGraph.getStatistics());
        return callGraph;
    }

    @Override
    public Void visit(Ast.CallStmt call, CallGraph callGraph) {
        record(call, callGraph);
        return super.visit(call, callGraph);
    }

    @Override
    public Void visit(Ast.CallExpr call, CallGraph callGraph) {
        record(call, callGraph);
        return super.visit(call, callGraph);
    }

    private void record(Ast.Invocation call, CallGraph callGraph) {
        if (!currentProcedure.isEmpty() && call.name() != null) {
            callGraph.addCall(currentProcedure, call.name());
            logger.trace("Call: {} -> {}", currentProcedure, call.name());
        }
    }
}
