package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;

/**
 * A node is missing a required part or has a part of the wrong shape.
 */
public class MalformedNodeException extends AnalysisException {

    public MalformedNodeException(String detail, Ast.Node node) {
        super(detail, node);
    }

    static <T> T require(T part, String description, Ast.Node owner) {
        if (part == null) {
            throw new MalformedNodeException("Missing " + description, owner);
        }
        return part;
    }
}
