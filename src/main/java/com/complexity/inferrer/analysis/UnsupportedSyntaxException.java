package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.SourceLocation;

/**
 * Source construct with no counterpart in the pseudocode vocabulary.
 */
public class UnsupportedSyntaxException extends AnalysisException {

    public UnsupportedSyntaxException(String detail, String syntaxKind, SourceLocation location) {
        super(detail, syntaxKind, location);
    }
}
