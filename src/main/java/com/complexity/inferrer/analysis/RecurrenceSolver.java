package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.BinOp;
import com.complexity.inferrer.ast.Ast.Expr;
import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.model.ComplexityExpression;
import com.complexity.inferrer.model.RecurrenceRelation;
import com.complexity.inferrer.model.RecurrenceRelation.ReductionType;
import com.complexity.inferrer.model.RecurrenceSolution;
import com.complexity.inferrer.model.RecurrenceSolution.SolutionMethod;
import com.complexity.inferrer.model.RecursionInfo;
import com.complexity.inferrer.model.Subproblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds the recurrence of a recursive procedure and solves it.
 *
 * Divide reductions go through the Master Theorem, generalised to {@code f(n) = n^d log^k n};
 * subtract reductions are expanded directly. The two-constant subtract shape of Fibonacci has a
 * closed form of its own. Whenever no relation can be built the result is a heuristic label,
 * so solving never fails the caller.
 */
public class RecurrenceSolver {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceSolver.class);

    private static final double TOLERANCE = 0.01;

    /**
     * A solution plus the relation it came from, {@code null} for heuristic solutions.
     */
    public record Result(RecurrenceRelation relation, RecurrenceSolution solution) {
    }

    private final AnalyzerConfig config;

    public RecurrenceSolver(AnalyzerConfig config) {
        this.config = config;
    }

    public RecurrenceSolver() {
        this(AnalyzerConfig.defaults());
    }

    /**
     * Solves the recurrence of one procedure, costing callees by walking their bodies.
     */
    public Result solve(Procedure procedure, RecursionInfo info, Set<String> targets, Program program) {
        return solve(procedure, info, targets, new WorkEstimator(program, targets, config));
    }

    /**
     * Solves the recurrence of one procedure, costing declared callees through the given lookup.
     */
    public Result solve(Procedure procedure, RecursionInfo info, Set<String> targets, Program program,
                        Function<String, Optional<ComplexityExpression>> calleeCost) {
        return solve(procedure, info, targets, new WorkEstimator(program, targets, config, calleeCost));
    }

    private Result solve(Procedure procedure, RecursionInfo info, Set<String> targets, WorkEstimator work) {
        int a = info.callCount();
        if (!info.recursive() || a < 1) {
            return heuristicResult(procedure.name(), info, "no active recursive call site was found");
        }
        ComplexityExpression f = work.estimate(procedure.body()).reduce();

        if (a >= 2 && info.subproblem().kind() == Subproblem.Kind.MIXED_CONSTANT_SUBTRACT) {
            RecurrenceSolution fibonacci = fibonacci(f);
            logger.debug("{}: {}", procedure.name(), fibonacci);
            return new Result(null, fibonacci);
        }

        RecurrenceRelation relation;
        try {
            relation = buildRelation(a, f, info.subproblem(), procedure.body(), targets);
        } catch (IllegalArgumentException e) {
            return heuristicResult(procedure.name(), info, e.getMessage());
        }
        RecurrenceSolution solution = solve(relation);
        logger.debug("{}: {}", procedure.name(), solution);
        return new Result(relation, solution);
    }

    private Result heuristicResult(String name, RecursionInfo info, String reason) {
        logger.debug("{}: no recurrence could be built ({}), using a heuristic", name, reason);
        return new Result(null, heuristic(info));
    }

    RecurrenceRelation buildRelation(int a, ComplexityExpression f, Subproblem subproblem, Ast.Block body,
                                     Set<String> targets) {
        if (hasModuloArgument(body, targets)) {
            return new RecurrenceRelation(a, 2, f, ReductionType.DIVIDE);
        }
        switch (subproblem.kind()) {
            case N_OVER_K:
                return new RecurrenceRelation(a, subproblem.factor(), f, ReductionType.DIVIDE);
            case N_MINUS_1:
                return new RecurrenceRelation(a, subproblem.factor(), f, ReductionType.SUBTRACT);
            case SLICE: {
                OptionalInt k = sliceDivisor(body, targets);
                return k.isPresent()
                        ? new RecurrenceRelation(a, k.getAsInt(), f, ReductionType.DIVIDE)
                        : new RecurrenceRelation(a, 1, f, ReductionType.SUBTRACT);
            }
            default:
                return new RecurrenceRelation(a, 1, f, ReductionType.SUBTRACT);
        }
    }

    private static boolean hasModuloArgument(Ast.Block body, Set<String> targets) {
        for (Ast.Invocation site : Shapes.callSites(body, targets)) {
            for (Expr arg : site.args()) {
                if (arg instanceof BinOp && ((BinOp) arg).op() == BinOp.Operator.MOD) {
                    return true;
                }
            }
        }
        return false;
    }

    private static OptionalInt sliceDivisor(Ast.Block body, Set<String> targets) {
        for (Ast.Invocation site : Shapes.callSites(body, targets)) {
            for (Expr arg : site.args()) {
                if (!(arg instanceof Ast.ArrayRange)) {
                    continue;
                }
                for (BinOp bin : arg.findAll(BinOp.class)) {
                    OptionalInt k = Shapes.constantDivisor(bin);
                    if (k.isPresent()) {
                        return k;
                    }
                }
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Closed form of a formal relation.
     */
    public RecurrenceSolution solve(RecurrenceRelation relation) {
        return relation.isDivide() ? solveDivide(relation) : solveSubtract(relation);
    }

    private RecurrenceSolution solveDivide(RecurrenceRelation relation) {
        ComplexityExpression f = relation.getFComplexity();
        String text = relation.toString();
        double c = criticalExponent(relation.getA(), relation.getB());
        String critical = String.format(Locale.ROOT, "c = log_%d(%d) = %.2f", relation.getB(), relation.getA(), c);

        if (f.isExponential()) {
            return new RecurrenceSolution(text, f, SolutionMethod.MASTER_CASE_3,
                    critical + "; f(n) = " + f.label() + " is exponential and dominates the recursion");
        }
        double d = f.getDegree();
        if (d < c - TOLERANCE) {
            ComplexityExpression leaves = ComplexityExpression.polynomial(c);
            return new RecurrenceSolution(text, leaves, SolutionMethod.MASTER_CASE_1,
                    critical + "; f(n) = " + f.label() + " grows slower than n^c, the leaves dominate");
        }
        if (Math.abs(d - c) <= TOLERANCE) {
            int k = f.getLogPower();
            ComplexityExpression balanced = ComplexityExpression.of(1, c, k + 1, f.getLogLogPower(), 1);
            SolutionMethod method = k == 0 ? SolutionMethod.MASTER_CASE_2 : SolutionMethod.MASTER_SPECIAL_LOG;
            return new RecurrenceSolution(text, balanced, method,
                    critical + "; f(n) = " + f.label() + " matches n^c, every level costs the same over "
                            + "log n levels");
        }
        return new RecurrenceSolution(text, f, SolutionMethod.MASTER_CASE_3,
                critical + "; f(n) = " + f.label() + " grows faster than n^c, the root dominates");
    }

    private RecurrenceSolution solveSubtract(RecurrenceRelation relation) {
        ComplexityExpression f = relation.getFComplexity();
        String text = relation.toString();
        int a = relation.getA();
        if (a == 1) {
            ComplexityExpression result = f.times(ComplexityExpression.linear());
            return new RecurrenceSolution(text, result, SolutionMethod.LINEAR_EXPANSION,
                    "expanding gives a chain of n calls, each doing " + f.label() + " work");
        }
        double base = Math.pow(a, 1.0 / relation.getB());
        ComplexityExpression result = ComplexityExpression.exponential(base).times(f);
        return new RecurrenceSolution(text, result, SolutionMethod.LINEAR_EXPANSION,
                "expanding gives a recursion tree with branching factor " + a + " and height n/"
                        + relation.getB() + ", each node doing " + f.label() + " work");
    }

    private static RecurrenceSolution fibonacci(ComplexityExpression f) {
        ComplexityExpression result = ComplexityExpression.exponential(2);
        if (!f.isConstant()) {
            result = result.times(f);
        }
        return new RecurrenceSolution("T(n) = T(n-1) + T(n-2) + " + f.bigO(), result,
                SolutionMethod.FIBONACCI_CLOSED_FORM,
                "calls on n-1 and n-2 form a recursion tree with branching factor 2 and height n");
    }

    /**
     * Coarse label from the recursion shape alone.
     */
    public RecurrenceSolution heuristic(RecursionInfo info) {
        int count = info.callCount();
        Subproblem subproblem = info.subproblem();
        ComplexityExpression result;
        String reason;
        if (subproblem.kind() == Subproblem.Kind.MIXED_CONSTANT_SUBTRACT) {
            result = ComplexityExpression.exponential(2);
            reason = "calls on two different smaller sizes";
        } else if (info.depthPattern() == RecursionInfo.DepthPattern.DIVIDE_AND_CONQUER) {
            if (count <= 1) {
                result = ComplexityExpression.logarithmic();
            } else if (count == 2) {
                result = ComplexityExpression.nLogN();
            } else {
                int k = subproblem.isDivide() ? subproblem.factor() : 2;
                result = ComplexityExpression.polynomial(criticalExponent(count, k));
            }
            reason = count + " call(s) on a divided input";
        } else if (info.depthPattern() == RecursionInfo.DepthPattern.LINEAR) {
            result = ComplexityExpression.linear();
            reason = "a single chain of calls";
        } else if (info.depthPattern() == RecursionInfo.DepthPattern.TREE) {
            result = ComplexityExpression.exponential(count);
            reason = count + " calls per level";
        } else {
            result = ComplexityExpression.linear();
            reason = "unrecognised recursion shape";
        }
        return new RecurrenceSolution(null, result, SolutionMethod.HEURISTIC, "heuristic: " + reason);
    }

    static double criticalExponent(int a, int b) {
        double c = Math.log(a) / Math.log(b);
        double rounded = Math.rint(c);
        return Math.abs(c - rounded) < 1e-9 ? rounded : c;
    }
}
