package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.SourceLocation;

import java.util.List;

/**
 * The cost walk re-entered a procedure it was already costing although the recursion analysis
 * did not mark it recursive. Indicates inconsistent inputs and is never recovered from.
 */
public class CyclicCallGraphException extends AnalysisException {

    private final List<String> path;

    public CyclicCallGraphException(List<String> path, SourceLocation location) {
        super("Procedure re-entered while being analyzed: " + String.join(" -> ", path), "CALL", location);
        this.path = List.copyOf(path);
    }

    public List<String> getPath() {
        return path;
    }
}
