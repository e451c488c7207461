package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.Node;
import com.complexity.inferrer.ast.AstVisitor;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.model.ComplexityExpression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Estimates the non-recursive work {@code f(n)} of a procedure body.
 *
 * Loops multiply their iteration count with the cost of their body, sequences add up,
 * conditionals take the dearer branch. Calls to the recursion targets are free here because
 * the recurrence accounts for them; calls to other declared procedures cost what the callee
 * lookup reports; anything else is constant.
 */
public final class WorkEstimator implements AstVisitor<ComplexityExpression, Void> {

    private final Program program;
    private final Set<String> targets;
    private final int maxCalleeDepth;
    private final CaseAnalyzer caseAnalyzer;
    private final LoopBoundEstimator boundEstimator;
    private final Function<String, Optional<ComplexityExpression>> calleeCost;
    private final Deque<String> visiting = new ArrayDeque<>();

    /**
     * @param calleeCost cost of a declared, non-target procedure, empty when unknown
     */
    public WorkEstimator(Program program, Set<String> targets, AnalyzerConfig config,
                         Function<String, Optional<ComplexityExpression>> calleeCost) {
        this.program = program;
        this.targets = targets;
        this.maxCalleeDepth = config.getMaxCalleeDepth();
        this.caseAnalyzer = new CaseAnalyzer(config);
        this.boundEstimator = new LoopBoundEstimator(config.getMaxSearchDepth());
        this.calleeCost = calleeCost;
    }

    /**
     * Standalone estimator that costs declared callees by walking their bodies, up to the
     * configured callee depth.
     */
    public WorkEstimator(Program program, Set<String> targets, AnalyzerConfig config) {
        this.program = program;
        this.targets = targets;
        this.maxCalleeDepth = config.getMaxCalleeDepth();
        this.caseAnalyzer = new CaseAnalyzer(config);
        this.boundEstimator = new LoopBoundEstimator(config.getMaxSearchDepth());
        this.calleeCost = this::walkCallee;
    }

    public ComplexityExpression estimate(Node node) {
        return node == null ? ComplexityExpression.constant() : node.accept(this, null);
    }

    private Optional<ComplexityExpression> walkCallee(String name) {
        if (visiting.contains(name) || visiting.size() >= maxCalleeDepth) {
            return Optional.empty();
        }
        visiting.push(name);
        try {
            return Optional.of(estimate(program.getProcedures().get(name).body()));
        } finally {
            visiting.pop();
        }
    }

    private ComplexityExpression callCost(String name) {
        if (targets.contains(name) || program == null || !program.declares(name)) {
            return ComplexityExpression.constant();
        }
        return calleeCost.apply(name).orElse(ComplexityExpression.constant());
    }

    private ComplexityExpression sum(List<? extends Node> nodes) {
        List<ComplexityExpression> costs = new ArrayList<>();
        for (Node node : nodes) {
            costs.add(estimate(node));
        }
        return ComplexityExpression.sumSequential(costs);
    }

    private ComplexityExpression children(Node node) {
        List<Node> nodes = node.getChildNodes();
        return nodes.isEmpty() ? ComplexityExpression.constant() : sum(nodes);
    }

    @Override
    public ComplexityExpression visit(Ast.Block n, Void arg) {
        return sum(n.statements());
    }

    @Override
    public ComplexityExpression visit(Ast.For n, Void arg) {
        Ast.Expr start = MalformedNodeException.require(n.start(), "lower bound", n);
        Ast.Expr end = MalformedNodeException.require(n.end(), "upper bound", n);
        ComplexityExpression iterations = caseAnalyzer.iterationCount(start, end);
        ComplexityExpression bounds = ComplexityExpression.sumSequential(estimate(start), estimate(end));
        return ComplexityExpression.sumSequential(bounds, iterations.times(estimate(n.body())));
    }

    @Override
    public ComplexityExpression visit(Ast.While n, Void arg) {
        ComplexityExpression iterations = boundEstimator.estimate(n.condition(), n.body());
        return iterations.times(ComplexityExpression.sumSequential(estimate(n.condition()), estimate(n.body())));
    }

    @Override
    public ComplexityExpression visit(Ast.Repeat n, Void arg) {
        ComplexityExpression iterations = boundEstimator.estimate(n.condition(), n.body());
        return iterations.times(ComplexityExpression.sumSequential(estimate(n.body()), estimate(n.condition())));
    }

    @Override
    public ComplexityExpression visit(Ast.If n, Void arg) {
        ComplexityExpression branches = ComplexityExpression.dominant(estimate(n.thenBranch()),
                estimate(n.elseBranch()));
        return ComplexityExpression.sumSequential(estimate(n.condition()), branches);
    }

    @Override
    public ComplexityExpression visit(Ast.CallStmt n, Void arg) {
        return ComplexityExpression.sumSequential(sum(n.args()), callCost(n.name()));
    }

    @Override
    public ComplexityExpression visit(Ast.Assign n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.Return n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.VarDecl n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.ArrayDecl n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.ObjectDecl n, Void arg) {
        return ComplexityExpression.constant();
    }

    @Override
    public ComplexityExpression visit(Ast.NumberLiteral n, Void arg) {
        return ComplexityExpression.constant();
    }

    @Override
    public ComplexityExpression visit(Ast.BooleanLiteral n, Void arg) {
        return ComplexityExpression.constant();
    }

    @Override
    public ComplexityExpression visit(Ast.StringLiteral n, Void arg) {
        return ComplexityExpression.constant();
    }

    @Override
    public ComplexityExpression visit(Ast.NullLiteral n, Void arg) {
        return ComplexityExpression.constant();
    }

    @Override
    public ComplexityExpression visit(Ast.Var n, Void arg) {
        return ComplexityExpression.constant();
    }

    @Override
    public ComplexityExpression visit(Ast.BinOp n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.UnOp n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.CallExpr n, Void arg) {
        return ComplexityExpression.sumSequential(sum(n.args()), callCost(n.name()));
    }

    @Override
    public ComplexityExpression visit(Ast.ArrayAccess n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.ArrayRange n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.FieldAccess n, Void arg) {
        return children(n);
    }

    @Override
    public ComplexityExpression visit(Ast.StringFunc n, Void arg) {
        return children(n);
    }
}
