package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.BinOp;
import com.complexity.inferrer.ast.Ast.Expr;
import com.complexity.inferrer.ast.Ast.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Shape predicates over expressions and statements shared by the structural heuristics.
 */
final class Shapes {

    private Shapes() {
    }

    /**
     * Integer value of a literal, also through unary minus. Empty for values outside the int range.
     */
    static OptionalInt intValue(Expr expr) {
        if (expr instanceof Ast.NumberLiteral) {
            Ast.NumberLiteral number = (Ast.NumberLiteral) expr;
            long value = number.longValue();
            if (number.isInteger() && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return OptionalInt.of((int) value);
            }
        }
        if (expr instanceof Ast.UnOp) {
            Ast.UnOp unary = (Ast.UnOp) expr;
            if (unary.op() == Ast.UnOp.Operator.NEG) {
                OptionalInt inner = intValue(unary.operand());
                if (inner.isPresent()) {
                    return OptionalInt.of(-inner.getAsInt());
                }
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Value of an integral literal of any magnitude, also through unary minus.
     */
    static OptionalDouble integralValue(Expr expr) {
        if (expr instanceof Ast.NumberLiteral) {
            Ast.NumberLiteral number = (Ast.NumberLiteral) expr;
            return number.isInteger() ? OptionalDouble.of(number.value()) : OptionalDouble.empty();
        }
        if (expr instanceof Ast.UnOp && ((Ast.UnOp) expr).op() == Ast.UnOp.Operator.NEG) {
            OptionalDouble inner = integralValue(((Ast.UnOp) expr).operand());
            return inner.isPresent() ? OptionalDouble.of(-inner.getAsDouble()) : inner;
        }
        return OptionalDouble.empty();
    }

    static boolean isConstant(Expr expr) {
        return expr instanceof Ast.NumberLiteral;
    }

    static String varName(Expr expr) {
        return expr instanceof Ast.Var ? ((Ast.Var) expr).name() : null;
    }

    /**
     * Strips {@code floor}/{@code ceil} wrappers.
     */
    static Expr unwrapRounding(Expr expr) {
        Expr current = expr;
        while (current instanceof Ast.UnOp) {
            Ast.UnOp unary = (Ast.UnOp) current;
            if (unary.op() != Ast.UnOp.Operator.FLOOR && unary.op() != Ast.UnOp.Operator.CEIL) {
                break;
            }
            current = unary.operand();
        }
        return current;
    }

    /**
     * Divisor of {@code x / k} or {@code x div k} with a constant {@code k >= 2}, else empty.
     */
    static OptionalInt constantDivisor(Expr expr) {
        Expr inner = unwrapRounding(expr);
        if (inner instanceof BinOp) {
            BinOp bin = (BinOp) inner;
            if (bin.op().isDivision()) {
                OptionalInt k = intValue(bin.right());
                if (k.isPresent() && k.getAsInt() >= 2) {
                    return k;
                }
            }
        }
        return OptionalInt.empty();
    }

    /**
     * {@code (x + y) / 2} or {@code x + (y - x) / 2}, optionally under floor/ceil.
     */
    static boolean isMidpointExpression(Expr expr) {
        Expr inner = unwrapRounding(expr);
        if (!(inner instanceof BinOp)) {
            return false;
        }
        BinOp bin = (BinOp) inner;
        OptionalInt divisor = constantDivisor(bin);
        if (divisor.isPresent() && divisor.getAsInt() == 2) {
            Expr numerator = bin.left();
            return numerator instanceof BinOp && ((BinOp) numerator).op() == BinOp.Operator.PLUS;
        }
        if (bin.op() == BinOp.Operator.PLUS) {
            OptionalInt half = constantDivisor(bin.right());
            Expr right = unwrapRounding(bin.right());
            return half.isPresent() && half.getAsInt() == 2
                    && ((BinOp) right).left() instanceof BinOp
                    && ((BinOp) ((BinOp) right).left()).op() == BinOp.Operator.MINUS;
        }
        return false;
    }

    static boolean isComparison(Expr expr) {
        return expr instanceof BinOp && ((BinOp) expr).op().isComparison();
    }

    static boolean isConjunction(Expr expr) {
        return expr instanceof BinOp && ((BinOp) expr).op() == BinOp.Operator.AND;
    }

    /**
     * Variable names read by an expression, in order of appearance.
     */
    static Set<String> variablesOf(Expr expr) {
        Set<String> names = new LinkedHashSet<>();
        if (expr != null) {
            for (Ast.Var var : expr.findAll(Ast.Var.class)) {
                names.add(var.name());
            }
        }
        return names;
    }

    /**
     * Name of the plain variable a statement writes, or null.
     */
    static String assignedVariable(Ast.Stmt stmt) {
        if (stmt instanceof Ast.Assign) {
            return varName(((Ast.Assign) stmt).target());
        }
        if (stmt instanceof Ast.VarDecl) {
            return ((Ast.VarDecl) stmt).name();
        }
        return null;
    }

    /**
     * Value a statement writes, or null.
     */
    static Expr assignedValue(Ast.Stmt stmt) {
        if (stmt instanceof Ast.Assign) {
            return ((Ast.Assign) stmt).value();
        }
        if (stmt instanceof Ast.VarDecl) {
            return ((Ast.VarDecl) stmt).initializer();
        }
        return null;
    }

    /**
     * Call sites, statements and expressions alike, whose callee is one of the targets.
     */
    static List<Ast.Invocation> callSites(Node root, Set<String> targets) {
        List<Ast.Invocation> sites = new ArrayList<>();
        if (root == null) {
            return sites;
        }
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            if (current instanceof Ast.Invocation && targets.contains(((Ast.Invocation) current).name())) {
                sites.add((Ast.Invocation) current);
            }
            List<Node> children = current.getChildNodes();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return sites;
    }

    /**
     * Depth-capped search: true if a node within {@code maxDepth} levels below root matches.
     */
    static boolean containsWithin(Node root, Predicate<Node> predicate, int maxDepth) {
        return root != null && search(root, predicate, 0, maxDepth);
    }

    private static boolean search(Node node, Predicate<Node> predicate, int depth, int maxDepth) {
        if (depth > maxDepth) {
            return false;
        }
        if (predicate.test(node)) {
            return true;
        }
        for (Node child : node.getChildNodes()) {
            if (search(child, predicate, depth + 1, maxDepth)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Depth-capped collection of every node of the given type.
     */
    static <T extends Node> List<T> findWithin(Node root, Class<T> type, int maxDepth) {
        List<T> found = new ArrayList<>();
        if (root != null) {
            collect(root, type, 0, maxDepth, found);
        }
        return found;
    }

    private static <T extends Node> void collect(Node node, Class<T> type, int depth, int maxDepth, List<T> found) {
        if (depth > maxDepth) {
            return;
        }
        if (type.isInstance(node)) {
            found.add(type.cast(node));
        }
        for (Node child : node.getChildNodes()) {
            collect(child, type, depth + 1, maxDepth, found);
        }
    }
}
