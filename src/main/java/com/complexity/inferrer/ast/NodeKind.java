package com.complexity.inferrer.ast;

/**
 * Closed set of AST node kinds. Every {@link Ast.Node} reports exactly one of these.
 */
public enum NodeKind {
    // statements
    BLOCK, FOR, WHILE, REPEAT, IF, CALL, ASSIGN, RETURN, VAR_DECL, ARRAY_DECL, OBJECT_DECL,
    // expressions
    NUMBER, BOOLEAN, STRING, NULL, VAR, BIN_OP, UN_OP, CALL_EXPR, ARRAY_ACCESS, ARRAY_RANGE,
    FIELD_ACCESS, STRING_FUNC;

    public boolean isStatement() {
        return ordinal() <= OBJECT_DECL.ordinal();
    }

    public boolean isLoop() {
        return this == FOR || this == WHILE || this == REPEAT;
    }

    public boolean isCall() {
        return this == CALL || this == CALL_EXPR;
    }
}
