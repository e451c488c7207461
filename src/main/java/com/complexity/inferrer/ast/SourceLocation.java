package com.complexity.inferrer.ast;

/**
 * Line/column metadata carried by every AST node for diagnostics.
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation UNKNOWN = new SourceLocation(-1, -1);

    public static SourceLocation of(int line, int column) {
        return new SourceLocation(line, column);
    }

    public boolean isKnown() {
        return line >= 0;
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "unknown location";
        }
        return "line " + line + ", column " + column;
    }
}
