package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.BinOp;
import com.complexity.inferrer.ast.Ast.Expr;
import com.complexity.inferrer.model.ComplexityExpression;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Estimates how often a condition-controlled loop runs from the way its body updates the
 * variables read by its condition.
 *
 * <ul>
 *   <li>squaring ({@code x = x * x}, {@code x = x ^ 2}): log log n</li>
 *   <li>multiplying or dividing by a constant, or moving to a midpoint: log n</li>
 *   <li>adding or subtracting: n</li>
 * </ul>
 * When several updates exist the fastest-growing count wins. With no recognised update the
 * count defaults to n.
 */
public final class LoopBoundEstimator {

    /**
     * How one assignment moves a control variable.
     */
    public enum StepKind {
        SQUARING, GEOMETRIC, ADDITIVE, OTHER
    }

    private final int maxSearchDepth;

    public LoopBoundEstimator(int maxSearchDepth) {
        this.maxSearchDepth = maxSearchDepth;
    }

    public ComplexityExpression estimate(Expr condition, Ast.Stmt body) {
        Set<String> controls = Shapes.variablesOf(condition);
        if (controls.isEmpty() || body == null) {
            return ComplexityExpression.linear();
        }
        Set<String> midpoints = midpointVariables(body);

        ComplexityExpression result = null;
        for (Ast.Stmt stmt : Shapes.findWithin(body, Ast.Stmt.class, maxSearchDepth)) {
            String target = Shapes.assignedVariable(stmt);
            Expr value = Shapes.assignedValue(stmt);
            if (target == null || value == null || !controls.contains(target)) {
                continue;
            }
            ComplexityExpression count = iterationsFor(classify(target, value, midpoints));
            if (count != null) {
                result = result == null ? count : ComplexityExpression.dominant(result, count);
            }
        }
        return result == null ? ComplexityExpression.linear() : result;
    }

    /**
     * Classifies one update {@code target = value}.
     */
    public StepKind classify(String target, Expr value, Set<String> midpoints) {
        Expr inner = Shapes.unwrapRounding(value);
        if (!(inner instanceof BinOp)) {
            String source = Shapes.varName(inner);
            return source != null && midpoints.contains(source) ? StepKind.GEOMETRIC : StepKind.OTHER;
        }
        BinOp bin = (BinOp) inner;
        String left = Shapes.varName(bin.left());
        String right = Shapes.varName(bin.right());

        if (bin.op() == BinOp.Operator.TIMES && target.equals(left) && target.equals(right)) {
            return StepKind.SQUARING;
        }
        if (bin.op() == BinOp.Operator.POW && target.equals(left)) {
            OptionalInt exponent = Shapes.intValue(bin.right());
            if (exponent.isPresent() && exponent.getAsInt() >= 2) {
                return StepKind.SQUARING;
            }
        }
        if (Shapes.isMidpointExpression(inner)) {
            return StepKind.GEOMETRIC;
        }
        if ((bin.op() == BinOp.Operator.PLUS || bin.op() == BinOp.Operator.MINUS)
                && left != null && midpoints.contains(left) && Shapes.isConstant(bin.right())) {
            return StepKind.GEOMETRIC;
        }
        if (mentions(bin, target)) {
            if (isScaling(bin)) {
                return StepKind.GEOMETRIC;
            }
            if (bin.op() == BinOp.Operator.PLUS || bin.op() == BinOp.Operator.MINUS) {
                return StepKind.ADDITIVE;
            }
        }
        return StepKind.OTHER;
    }

    private static ComplexityExpression iterationsFor(StepKind kind) {
        switch (kind) {
            case SQUARING:
                return ComplexityExpression.logLog();
            case GEOMETRIC:
                return ComplexityExpression.logarithmic();
            case ADDITIVE:
                return ComplexityExpression.linear();
            default:
                return null;
        }
    }

    private static boolean isScaling(BinOp bin) {
        OptionalInt factor = Shapes.intValue(bin.right());
        if (factor.isEmpty() || factor.getAsInt() < 2) {
            return false;
        }
        switch (bin.op()) {
            case TIMES:
            case DIV:
            case DIV_INT:
                return true;
            default:
                return false;
        }
    }

    private static boolean mentions(Expr expr, String name) {
        return Shapes.variablesOf(expr).contains(name);
    }

    private Set<String> midpointVariables(Ast.Stmt body) {
        Set<String> found = new LinkedHashSet<>();
        List<Ast.Stmt> statements = Shapes.findWithin(body, Ast.Stmt.class, maxSearchDepth);
        for (Ast.Stmt stmt : statements) {
            String target = Shapes.assignedVariable(stmt);
            Expr value = Shapes.assignedValue(stmt);
            if (target != null && value != null && Shapes.isMidpointExpression(value)) {
                found.add(target);
            }
        }
        return found;
    }
}
