package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.BinOp;
import com.complexity.inferrer.ast.Ast.Expr;
import com.complexity.inferrer.ast.Ast.Stmt;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.config.HeuristicRules;
import com.complexity.inferrer.model.CaseComplexity;
import com.complexity.inferrer.model.ComplexityExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Estimates worst, best and average iteration counts of a single loop.
 *
 * Counting loops run their full range unless the body has an early exit; condition-controlled
 * loops get their count from {@link LoopBoundEstimator} and distinguish cases when the body
 * looks like an element search. All searches are structural and depth-capped.
 */
public class CaseAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CaseAnalyzer.class);

    private final int maxSearchDepth;
    private final HeuristicRules rules;
    private final LoopBoundEstimator boundEstimator;

    public CaseAnalyzer(AnalyzerConfig config) {
        this.maxSearchDepth = config.getMaxSearchDepth();
        this.rules = config.getHeuristicRules();
        this.boundEstimator = new LoopBoundEstimator(maxSearchDepth);
    }

    public CaseAnalyzer() {
        this(AnalyzerConfig.defaults());
    }

    /**
     * Iteration counts of a {@code for}, {@code while} or {@code repeat} loop.
     *
     * @throws MalformedNodeException if the loop lacks a required part
     * @throws IllegalArgumentException if the statement is not a loop
     */
    public CaseComplexity analyze(Stmt loop) {
        if (loop instanceof Ast.For) {
            return analyzeFor((Ast.For) loop);
        }
        if (loop instanceof Ast.While) {
            Ast.While whileLoop = (Ast.While) loop;
            return analyzeConditional(whileLoop,
                    MalformedNodeException.require(whileLoop.condition(), "loop condition", loop),
                    MalformedNodeException.require(whileLoop.body(), "loop body", loop), false);
        }
        if (loop instanceof Ast.Repeat) {
            Ast.Repeat repeat = (Ast.Repeat) loop;
            return analyzeConditional(repeat,
                    MalformedNodeException.require(repeat.condition(), "loop condition", loop),
                    MalformedNodeException.require(repeat.body(), "loop body", loop), true);
        }
        throw new IllegalArgumentException("Not a loop: " + (loop == null ? "null" : loop.kind()));
    }

    private CaseComplexity analyzeFor(Ast.For loop) {
        Expr start = MalformedNodeException.require(loop.start(), "lower bound", loop);
        Expr end = MalformedNodeException.require(loop.end(), "upper bound", loop);
        Stmt body = MalformedNodeException.require(loop.body(), "loop body", loop);

        ComplexityExpression range = iterationCount(start, end);
        if (hasEarlyExit(body, loop.variable())) {
            logger.debug("Early exit detected in loop over {}", loop.variable());
            return new CaseComplexity(range, ComplexityExpression.constant(), range.scale(0.5), true,
                    "loop over " + loop.variable() + " may stop early: worst runs the full range, "
                            + "best stops on the first iteration, average halfway");
        }
        return CaseComplexity.uniform(range, "loop over " + loop.variable() + " always runs " + range.label()
                + (range.isConstant() ? " (" + formatCount(range) + " iterations)" : " iterations"));
    }

    private CaseComplexity analyzeConditional(Stmt loop, Expr condition, Stmt body, boolean runsOnce) {
        ComplexityExpression iterations = boundEstimator.estimate(condition, body);
        String kind = runsOnce ? "repeat-until" : "while";
        if (looksLikeSearch(body)) {
            return new CaseComplexity(iterations, ComplexityExpression.constant(), iterations.scale(0.5), true,
                    kind + " loop with a search pattern: worst " + iterations.bigO()
                            + ", best finds the element at once, average halfway");
        }
        if (runsOnce) {
            return new CaseComplexity(iterations, ComplexityExpression.constant(), iterations, true,
                    "repeat-until runs at least once and at most " + iterations.bigO() + " times");
        }
        return CaseComplexity.uniform(iterations,
                "while loop runs " + iterations.bigO() + " times depending on its condition");
    }

    /**
     * Number of iterations of {@code for v = start to end}. Literal bounds give the exact count.
     */
    ComplexityExpression iterationCount(Expr start, Expr end) {
        OptionalDouble s = Shapes.integralValue(start);
        OptionalDouble e = Shapes.integralValue(end);
        if (s.isPresent() && e.isPresent()) {
            return ComplexityExpression.constant(Math.max(1, e.getAsDouble() - s.getAsDouble() + 1));
        }
        ComplexityExpression size = sizeOf(end);
        return size.isConstant() ? ComplexityExpression.linear() : size;
    }

    /**
     * Growth of a bound expression in terms of the input size.
     */
    private ComplexityExpression sizeOf(Expr expr) {
        if (expr instanceof Ast.NumberLiteral) {
            return ComplexityExpression.constant();
        }
        if (expr instanceof Ast.UnOp) {
            return sizeOf(((Ast.UnOp) expr).operand());
        }
        if (expr instanceof BinOp) {
            BinOp bin = (BinOp) expr;
            switch (bin.op()) {
                case TIMES:
                    return sizeOf(bin.left()).times(sizeOf(bin.right()));
                case PLUS:
                case MINUS:
                    return ComplexityExpression.dominant(sizeOf(bin.left()), sizeOf(bin.right()));
                case DIV:
                case DIV_INT: {
                    OptionalInt k = Shapes.intValue(bin.right());
                    return k.isPresent() && k.getAsInt() > 0
                            ? sizeOf(bin.left()).scale(1.0 / k.getAsInt())
                            : sizeOf(bin.left());
                }
                case POW: {
                    OptionalInt k = Shapes.intValue(bin.right());
                    if (k.isPresent() && k.getAsInt() >= 0) {
                        return ComplexityExpression.polynomial(k.getAsInt());
                    }
                    return ComplexityExpression.exponential(2);
                }
                default:
                    return ComplexityExpression.linear();
            }
        }
        return ComplexityExpression.linear();
    }

    /**
     * An {@code if} whose taken branch sets a flag or sentinel, overwrites the loop variable or returns.
     */
    boolean hasEarlyExit(Stmt body, String controlVariable) {
        return Shapes.containsWithin(body, node -> node instanceof Ast.If
                && exitsLoop(((Ast.If) node).thenBranch(), controlVariable), maxSearchDepth);
    }

    private boolean exitsLoop(Stmt branch, String controlVariable) {
        if (branch == null) {
            return false;
        }
        if (branch instanceof Ast.Block) {
            for (Stmt stmt : ((Ast.Block) branch).statements()) {
                if (exitsLoop(stmt, controlVariable)) {
                    return true;
                }
            }
            return false;
        }
        if (branch instanceof Ast.Return) {
            return true;
        }
        if (!(branch instanceof Ast.Assign)) {
            return false;
        }
        Ast.Assign assign = (Ast.Assign) branch;
        Expr value = assign.value();
        if (value instanceof Ast.BooleanLiteral) {
            return true;
        }
        String valueName = Shapes.varName(value);
        if (valueName != null && rules.isSentinelName(valueName)) {
            return true;
        }
        String target = Shapes.varName(assign.target());
        if (target == null) {
            return false;
        }
        return rules.isFlagName(target) || target.equals(controlVariable);
    }

    /**
     * An {@code if} testing a comparison somewhere in the loop body.
     */
    boolean looksLikeSearch(Stmt body) {
        return Shapes.containsWithin(body, node -> node instanceof Ast.If
                && ((Ast.If) node).condition() != null
                && ((Ast.If) node).condition().anyMatch(c -> c instanceof Expr && Shapes.isComparison((Expr) c)),
                maxSearchDepth);
    }

    private static String formatCount(ComplexityExpression constant) {
        double value = constant.getCoefficient();
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
