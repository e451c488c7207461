package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.Expr;
import com.complexity.inferrer.ast.Ast.Stmt;
import com.complexity.inferrer.ast.AstVisitor;
import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.ast.SourceLocation;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.model.CaseComplexity;
import com.complexity.inferrer.model.ComplexityExpression;
import com.complexity.inferrer.model.ProcedureAnalysis;
import com.complexity.inferrer.model.RecursionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a program and combines the cost of every construct into worst, best and average bounds.
 *
 * Loops take their counts from {@link CaseAnalyzer}, calls to recursive procedures take the
 * closed form from {@link RecurrenceSolver}, and calls to other declared procedures cost what
 * their bodies cost. Procedure results are memoized for the lifetime of the instance, which
 * serves exactly one analysis. Derivation steps go to the caller's {@link DerivationTrace}.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final Program program;
    private final Map<String, RecursionInfo> recursionInfo;
    private final CallGraph callGraph;
    private final DerivationTrace trace;
    private final CaseAnalyzer caseAnalyzer;
    private final RecurrenceSolver solver;

    private final Map<String, RecurrenceSolver.Result> solutions = new HashMap<>();
    private final Map<String, CaseComplexity> bodyCosts = new HashMap<>();
    private final Map<String, String> failures = new HashMap<>();
    private final Deque<String> inProgress = new ArrayDeque<>();
    private final StatementCost statementCost = new StatementCost();

    public ComplexityAnalyzer(Program program, Map<String, RecursionInfo> recursionInfo, CallGraph callGraph,
                              AnalyzerConfig config, DerivationTrace trace) {
        this.program = program;
        this.recursionInfo = recursionInfo;
        this.callGraph = callGraph;
        this.trace = trace;
        this.caseAnalyzer = new CaseAnalyzer(config);
        this.solver = new RecurrenceSolver(config);
    }

    /**
     * Bounds of the program's main body. Failures here are not isolated.
     */
    public CaseComplexity analyzeBody() {
        trace.step("Main body");
        CaseComplexity bounds;
        trace.enter();
        try {
            bounds = cost(program.getBody());
        } finally {
            trace.exit();
        }
        trace.step("Main body: %s", bounds.reduce());
        return bounds;
    }

    /**
     * Everything derived for one procedure. An {@link AnalysisException} inside the procedure is
     * turned into a failed result; a {@link CyclicCallGraphException} propagates.
     */
    public ProcedureAnalysis analyzeProcedure(String name) {
        RecursionInfo info = recursionInfo.getOrDefault(name, RecursionInfo.nonRecursive(List.of()));
        try {
            if (info.recursive()) {
                RecurrenceSolver.Result result = solution(name);
                CaseComplexity bounds = CaseComplexity.uniform(result.solution().getComplexity(),
                        result.solution().getExplanation());
                return ProcedureAnalysis.analyzed(name, info, result.relation(), result.solution(), bounds);
            }
            CaseComplexity bounds = procedureCost(name, SourceLocation.UNKNOWN);
            if (failures.containsKey(name)) {
                return ProcedureAnalysis.failed(name, info, failures.get(name));
            }
            return ProcedureAnalysis.analyzed(name, info, null, null, bounds.reduce());
        } catch (CyclicCallGraphException e) {
            throw e;
        } catch (AnalysisException e) {
            logger.warn("Analysis of procedure {} failed: {}", name, e.getMessage());
            failures.put(name, e.getMessage());
            trace.step("%s could not be analyzed: %s", name, e.getMessage());
            return ProcedureAnalysis.failed(name, info, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Procedures
    // ------------------------------------------------------------------

    private RecurrenceSolver.Result solution(String name) {
        RecurrenceSolver.Result cached = solutions.get(name);
        if (cached != null) {
            return cached;
        }
        Procedure procedure = program.getProcedures().get(name);
        RecursionInfo info = recursionInfo.get(name);
        Set<String> targets = callGraph.getCycleMembers(name);
        enter(name, procedure.location());
        try {
            trace.step("%s: %s recursion, %d recursive call(s), subproblem %s", name,
                    info.type().name().toLowerCase(Locale.ROOT), info.callCount(), info.subproblem());
            RecurrenceSolver.Result result = solver.solve(procedure, info, targets, program, this::calleeWorst);
            trace.step("%s: %s", name, result.solution());
            solutions.put(name, result);
            return result;
        } finally {
            leave();
        }
    }

    private Optional<ComplexityExpression> calleeWorst(String name) {
        return Optional.of(procedureCost(name, SourceLocation.UNKNOWN).getWorst());
    }

    /**
     * Cost of calling a procedure, by name.
     */
    private CaseComplexity procedureCost(String name, SourceLocation callSite) {
        Procedure procedure = program.getProcedures().get(name);
        if (procedure == null) {
            return CaseComplexity.constant();
        }
        RecursionInfo info = recursionInfo.get(name);
        if (info != null && info.recursive()) {
            return recursiveCost(name, info);
        }
        if (failures.containsKey(name)) {
            trace.step("call to %s costs O(1): its analysis failed (%s)", name, failures.get(name));
            return CaseComplexity.constant();
        }
        CaseComplexity cached = bodyCosts.get(name);
        if (cached != null) {
            return cached;
        }
        enter(name, callSite);
        CaseComplexity bounds;
        try {
            trace.step("%s: walking the body", name);
            bounds = cost(procedure.body()).reduce();
            trace.step("%s: %s", name, bounds);
        } catch (CyclicCallGraphException e) {
            throw e;
        } catch (AnalysisException e) {
            logger.warn("Cost of procedure {} could not be derived: {}", name, e.getMessage());
            failures.put(name, e.getMessage());
            trace.step("call to %s costs O(1): its analysis failed (%s)", name, e.getMessage());
            return CaseComplexity.constant();
        } finally {
            leave();
        }
        bodyCosts.put(name, bounds);
        return bounds;
    }

    private CaseComplexity recursiveCost(String name, RecursionInfo info) {
        if (!failures.containsKey(name)) {
            try {
                RecurrenceSolver.Result result = solution(name);
                return CaseComplexity.uniform(result.solution().getComplexity(), result.solution().getLabel());
            } catch (CyclicCallGraphException e) {
                throw e;
            } catch (AnalysisException e) {
                logger.warn("Recurrence of {} could not be solved: {}", name, e.getMessage());
                failures.put(name, e.getMessage());
            }
        }
        ComplexityExpression fallback = depthFallback(info.depthPattern());
        trace.step("%s: no solution, falling back to %s from its %s depth pattern", name, fallback.bigO(),
                info.depthPattern());
        return CaseComplexity.uniform(fallback, "depth-pattern fallback");
    }

    static ComplexityExpression depthFallback(RecursionInfo.DepthPattern pattern) {
        switch (pattern) {
            case LINEAR:
                return ComplexityExpression.linear();
            case TREE:
                return ComplexityExpression.nLogN();
            default:
                return ComplexityExpression.linear();
        }
    }

    private void enter(String name, SourceLocation location) {
        if (inProgress.contains(name)) {
            List<String> path = new ArrayList<>(inProgress);
            Collections.reverse(path);
            path.add(name);
            throw new CyclicCallGraphException(path, location);
        }
        inProgress.push(name);
        trace.enter();
    }

    private void leave() {
        trace.exit();
        inProgress.pop();
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    CaseComplexity cost(Stmt stmt) {
        return stmt == null ? CaseComplexity.constant() : stmt.accept(statementCost, null);
    }

    /**
     * Cost of the calls made while evaluating an expression, nested calls included.
     */
    private CaseComplexity cost(Expr expr) {
        if (expr == null) {
            return CaseComplexity.constant();
        }
        List<CaseComplexity> parts = new ArrayList<>();
        for (Ast.CallExpr call : expr.findAll(Ast.CallExpr.class)) {
            parts.add(procedureCost(call.name(), call.location()));
        }
        return sequence(parts);
    }

    private CaseComplexity costOf(List<? extends Expr> exprs) {
        List<CaseComplexity> parts = new ArrayList<>();
        for (Expr expr : exprs) {
            parts.add(cost(expr));
        }
        return sequence(parts);
    }

    /**
     * Sequential composition, component by component.
     */
    static CaseComplexity sequence(List<CaseComplexity> parts) {
        if (parts.isEmpty()) {
            return CaseComplexity.constant();
        }
        List<ComplexityExpression> worst = new ArrayList<>();
        List<ComplexityExpression> best = new ArrayList<>();
        List<ComplexityExpression> average = new ArrayList<>();
        boolean differs = false;
        for (CaseComplexity part : parts) {
            worst.add(part.getWorst());
            best.add(part.getBest());
            average.add(part.getAverage());
            differs |= part.differs();
        }
        return new CaseComplexity(ComplexityExpression.sumSequential(worst), ComplexityExpression.sumSequential(best),
                ComplexityExpression.sumSequential(average), differs, "sequence");
    }

    static CaseComplexity sequence(CaseComplexity... parts) {
        return sequence(List.of(parts));
    }

    /**
     * Either branch may run: worst takes the dearer, best the cheaper, average the unweighted mean.
     */
    static CaseComplexity branches(CaseComplexity then, CaseComplexity otherwise) {
        return new CaseComplexity(
                ComplexityExpression.dominant(then.getWorst(), otherwise.getWorst()),
                ComplexityExpression.min(then.getBest(), otherwise.getBest()),
                ComplexityExpression.mean(then.getAverage(), otherwise.getAverage()),
                then.differs() || otherwise.differs() || !then.equals(otherwise),
                "branches");
    }

    private final class StatementCost implements AstVisitor<CaseComplexity, Void> {

        @Override
        public CaseComplexity visit(Ast.Block n, Void arg) {
            List<CaseComplexity> parts = new ArrayList<>();
            for (Stmt stmt : n.statements()) {
                parts.add(cost(stmt));
            }
            return sequence(parts);
        }

        @Override
        public CaseComplexity visit(Ast.For n, Void arg) {
            CaseComplexity iterations = caseAnalyzer.analyze(n);
            trace.step("for %s at %s: %s", n.variable(), n.location(), iterations);
            trace.enter();
            try {
                CaseComplexity body = cost(n.body());
                return sequence(cost(n.start()), cost(n.end()), iterations.times(body));
            } finally {
                trace.exit();
            }
        }

        @Override
        public CaseComplexity visit(Ast.While n, Void arg) {
            CaseComplexity iterations = caseAnalyzer.analyze(n);
            trace.step("while at %s: %s", n.location(), iterations);
            trace.enter();
            try {
                CaseComplexity total = iterations.times(sequence(cost(n.condition()), cost(n.body())));
                return new CaseComplexity(total.getWorst(), ComplexityExpression.constant(), total.getAverage(),
                        true, "the condition may be false immediately");
            } finally {
                trace.exit();
            }
        }

        @Override
        public CaseComplexity visit(Ast.Repeat n, Void arg) {
            CaseComplexity iterations = caseAnalyzer.analyze(n);
            trace.step("repeat at %s: %s", n.location(), iterations);
            trace.enter();
            try {
                return iterations.times(sequence(cost(n.body()), cost(n.condition())));
            } finally {
                trace.exit();
            }
        }

        @Override
        public CaseComplexity visit(Ast.If n, Void arg) {
            Expr condition = MalformedNodeException.require(n.condition(), "condition", n);
            MalformedNodeException.require(n.thenBranch(), "then branch", n);
            CaseComplexity chosen = branches(cost(n.thenBranch()), cost(n.elseBranch()));
            return sequence(cost(condition), chosen);
        }

        @Override
        public CaseComplexity visit(Ast.CallStmt n, Void arg) {
            if (!program.declares(n.name())) {
                logger.debug("Call to undeclared procedure {} costs O(1)", n.name());
            }
            return sequence(costOf(n.args()), procedureCost(n.name(), n.location()));
        }

        @Override
        public CaseComplexity visit(Ast.Assign n, Void arg) {
            Expr target = MalformedNodeException.require(n.target(), "assignment target", n);
            if (!(target instanceof Ast.Var || target instanceof Ast.ArrayAccess
                    || target instanceof Ast.FieldAccess)) {
                throw new MalformedNodeException("Cannot assign to " + target.kind(), n);
            }
            return sequence(cost(target), cost(MalformedNodeException.require(n.value(), "assigned value", n)));
        }

        @Override
        public CaseComplexity visit(Ast.Return n, Void arg) {
            return cost(n.value());
        }

        @Override
        public CaseComplexity visit(Ast.VarDecl n, Void arg) {
            return cost(n.initializer());
        }

        @Override
        public CaseComplexity visit(Ast.ArrayDecl n, Void arg) {
            return costOf(n.dimensions());
        }

        @Override
        public CaseComplexity visit(Ast.ObjectDecl n, Void arg) {
            return CaseComplexity.constant();
        }

        @Override
        public CaseComplexity visit(Ast.NumberLiteral n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.BooleanLiteral n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.StringLiteral n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.NullLiteral n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.Var n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.BinOp n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.UnOp n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.CallExpr n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.ArrayAccess n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.ArrayRange n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.FieldAccess n, Void arg) {
            return cost(n);
        }

        @Override
        public CaseComplexity visit(Ast.StringFunc n, Void arg) {
            return cost(n);
        }
    }
}
