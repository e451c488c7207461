package com.complexity.inferrer.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * The pseudocode abstract syntax tree.
 *
 * Nodes are immutable records grouped under two sealed interfaces, {@link Stmt} and {@link Expr}.
 * Consumers dispatch through {@link AstVisitor}, so adding a node kind is a compile error in
 * every analysis that has not handled it yet.
 *
 * Optional parts are {@code null} (the {@code else} branch of an {@link If}, the value of a bare
 * {@link Return}, the initializer of a {@link VarDecl}). Required parts that are missing make the
 * node malformed; analyses report those rather than guessing.
 */
public final class Ast {

    private Ast() {
    }

    /**
     * Common contract of every node.
     */
    public sealed interface Node permits Stmt, Expr {

        NodeKind kind();

        SourceLocation location();

        <R, A> R accept(AstVisitor<R, A> visitor, A arg);

        /**
         * Direct children in source order, skipping absent optional parts.
         */
        default List<Node> getChildNodes() {
            return accept(ChildCollector.INSTANCE, null);
        }

        /**
         * Pre-order search of this subtree, this node included.
         */
        default <T extends Node> List<T> findAll(Class<T> type) {
            List<T> found = new ArrayList<>();
            Deque<Node> pending = new ArrayDeque<>();
            pending.push(this);
            while (!pending.isEmpty()) {
                Node current = pending.pop();
                if (type.isInstance(current)) {
                    found.add(type.cast(current));
                }
                List<Node> children = current.getChildNodes();
                for (int i = children.size() - 1; i >= 0; i--) {
                    pending.push(children.get(i));
                }
            }
            return found;
        }

        default boolean anyMatch(Predicate<Node> predicate) {
            Deque<Node> pending = new ArrayDeque<>();
            pending.push(this);
            while (!pending.isEmpty()) {
                Node current = pending.pop();
                if (predicate.test(current)) {
                    return true;
                }
                current.getChildNodes().forEach(pending::push);
            }
            return false;
        }
    }

    public sealed interface Stmt extends Node
            permits Block, For, While, Repeat, If, CallStmt, Assign, Return, VarDecl, ArrayDecl, ObjectDecl {
    }

    public sealed interface Expr extends Node
            permits NumberLiteral, BooleanLiteral, StringLiteral, NullLiteral, Var, BinOp, UnOp, CallExpr,
            ArrayAccess, ArrayRange, FieldAccess, StringFunc {
    }

    /**
     * A procedure invocation, either as a statement or inside an expression.
     */
    public sealed interface Invocation permits CallStmt, CallExpr {

        String name();

        List<Expr> args();

        SourceLocation location();
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    public record Block(List<Stmt> statements, SourceLocation location) implements Stmt {
        public Block {
            statements = statements == null ? List.of() : List.copyOf(statements);
        }

        public boolean isEmpty() {
            return statements.isEmpty();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BLOCK;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * Counting loop {@code for variable = start to end}, both bounds inclusive.
     */
    public record For(String variable, Expr start, Expr end, Stmt body, SourceLocation location) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.FOR;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record While(Expr condition, Stmt body, SourceLocation location) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.WHILE;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * {@code repeat body until condition}: the body runs at least once.
     */
    public record Repeat(Stmt body, Expr condition, SourceLocation location) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.REPEAT;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record If(Expr condition, Stmt thenBranch, Stmt elseBranch, SourceLocation location) implements Stmt {

        public boolean hasElse() {
            return elseBranch != null;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record CallStmt(String name, List<Expr> args, SourceLocation location) implements Stmt, Invocation {
        public CallStmt {
            args = args == null ? List.of() : List.copyOf(args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record Assign(Expr target, Expr value, SourceLocation location) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.ASSIGN;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record Return(Expr value, SourceLocation location) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.RETURN;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record VarDecl(String name, Expr initializer, SourceLocation location) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.VAR_DECL;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record ArrayDecl(String name, List<Expr> dimensions, SourceLocation location) implements Stmt {
        public ArrayDecl {
            dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY_DECL;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record ObjectDecl(String className, String name, SourceLocation location) implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.OBJECT_DECL;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    public record NumberLiteral(double value, SourceLocation location) implements Expr {

        public boolean isInteger() {
            return value == Math.rint(value) && !Double.isInfinite(value);
        }

        public long longValue() {
            return (long) value;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.NUMBER;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record BooleanLiteral(boolean value, SourceLocation location) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.BOOLEAN;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record StringLiteral(String value, SourceLocation location) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.STRING;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record NullLiteral(SourceLocation location) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.NULL;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record Var(String name, SourceLocation location) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.VAR;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record BinOp(Operator op, Expr left, Expr right, SourceLocation location) implements Expr {

        public enum Operator {
            PLUS, MINUS, TIMES, DIV, DIV_INT, MOD, POW,
            AND, OR,
            EQ, NE, LT, LE, GT, GE,
            BIT_AND, BIT_OR, BIT_XOR, SHL, SHR;

            public boolean isComparison() {
                return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
            }

            public boolean isLogical() {
                return this == AND || this == OR;
            }

            public boolean isDivision() {
                return this == DIV || this == DIV_INT;
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BIN_OP;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record UnOp(Operator op, Expr operand, SourceLocation location) implements Expr {

        public enum Operator {
            NEG, NOT, FLOOR, CEIL
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UN_OP;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record CallExpr(String name, List<Expr> args, SourceLocation location) implements Expr, Invocation {
        public CallExpr {
            args = args == null ? List.of() : List.copyOf(args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL_EXPR;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record ArrayAccess(Expr array, List<Expr> indices, SourceLocation location) implements Expr {
        public ArrayAccess {
            indices = indices == null ? List.of() : List.copyOf(indices);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY_ACCESS;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * Sub-range {@code array[from..to]} of an array.
     */
    public record ArrayRange(Expr array, Expr from, Expr to, SourceLocation location) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY_RANGE;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    public record FieldAccess(Expr target, String field, SourceLocation location) implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.FIELD_ACCESS;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    /**
     * Built-in function such as {@code length(A)}.
     */
    public record StringFunc(String function, List<Expr> args, SourceLocation location) implements Expr {
        public StringFunc {
            args = args == null ? List.of() : List.copyOf(args);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STRING_FUNC;
        }

        @Override
        public <R, A> R accept(AstVisitor<R, A> visitor, A arg) {
            return visitor.visit(this, arg);
        }
    }

    // ------------------------------------------------------------------

    private static final class ChildCollector implements AstVisitor<List<Node>, Void> {

        private static final ChildCollector INSTANCE = new ChildCollector();

        private static List<Node> of(Node... nodes) {
            List<Node> children = new ArrayList<>(nodes.length);
            for (Node node : nodes) {
                if (node != null) {
                    children.add(node);
                }
            }
            return children;
        }

        private static List<Node> of(Node first, List<? extends Node> rest) {
            List<Node> children = of(first);
            children.addAll(rest);
            return children;
        }

        @Override
        public List<Node> visit(Block n, Void arg) {
            return new ArrayList<>(n.statements());
        }

        @Override
        public List<Node> visit(For n, Void arg) {
            return of(n.start(), n.end(), n.body());
        }

        @Override
        public List<Node> visit(While n, Void arg) {
            return of(n.condition(), n.body());
        }

        @Override
        public List<Node> visit(Repeat n, Void arg) {
            return of(n.body(), n.condition());
        }

        @Override
        public List<Node> visit(If n, Void arg) {
            return of(n.condition(), n.thenBranch(), n.elseBranch());
        }

        @Override
        public List<Node> visit(CallStmt n, Void arg) {
            return new ArrayList<>(n.args());
        }

        @Override
        public List<Node> visit(Assign n, Void arg) {
            return of(n.target(), n.value());
        }

        @Override
        public List<Node> visit(Return n, Void arg) {
            return of(n.value());
        }

        @Override
        public List<Node> visit(VarDecl n, Void arg) {
            return of(n.initializer());
        }

        @Override
        public List<Node> visit(ArrayDecl n, Void arg) {
            return new ArrayList<>(n.dimensions());
        }

        @Override
        public List<Node> visit(ObjectDecl n, Void arg) {
            return of();
        }

        @Override
        public List<Node> visit(NumberLiteral n, Void arg) {
            return of();
        }

        @Override
        public List<Node> visit(BooleanLiteral n, Void arg) {
            return of();
        }

        @Override
        public List<Node> visit(StringLiteral n, Void arg) {
            return of();
        }

        @Override
        public List<Node> visit(NullLiteral n, Void arg) {
            return of();
        }

        @Override
        public List<Node> visit(Var n, Void arg) {
            return of();
        }

        @Override
        public List<Node> visit(BinOp n, Void arg) {
            return of(n.left(), n.right());
        }

        @Override
        public List<Node> visit(UnOp n, Void arg) {
            return of(n.operand());
        }

        @Override
        public List<Node> visit(CallExpr n, Void arg) {
            return new ArrayList<>(n.args());
        }

        @Override
        public List<Node> visit(ArrayAccess n, Void arg) {
            return of(n.array(), n.indices());
        }

        @Override
        public List<Node> visit(ArrayRange n, Void arg) {
            return of(n.array(), n.from(), n.to());
        }

        @Override
        public List<Node> visit(FieldAccess n, Void arg) {
            return of(n.target());
        }

        @Override
        public List<Node> visit(StringFunc n, Void arg) {
            return new ArrayList<>(n.args());
        }
    }
}
