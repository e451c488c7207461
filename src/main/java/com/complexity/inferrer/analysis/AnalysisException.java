package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.SourceLocation;

/**
 * Structured analysis failure pointing at the offending node.
 */
public class AnalysisException extends RuntimeException {

    private final String nodeKind;
    private final SourceLocation location;
    private final String detail;

    public AnalysisException(String detail, String nodeKind, SourceLocation location) {
        this(detail, nodeKind, location, null);
    }

    public AnalysisException(String detail, String nodeKind, SourceLocation location, Throwable cause) {
        super(format(detail, nodeKind, location), cause);
        this.detail = detail;
        this.nodeKind = nodeKind;
        this.location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public AnalysisException(String detail, Ast.Node node) {
        this(detail, node == null ? "unknown" : node.kind().name(),
                node == null ? SourceLocation.UNKNOWN : node.location());
    }

    private static String format(String detail, String nodeKind, SourceLocation location) {
        SourceLocation where = location == null ? SourceLocation.UNKNOWN : location;
        return detail + " [" + nodeKind + " at " + where + "]";
    }

    public String getNodeKind() {
        return nodeKind;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * The message without the node and location suffix.
     */
    public String getDetail() {
        return detail;
    }
}
