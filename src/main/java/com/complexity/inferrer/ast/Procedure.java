package com.complexity.inferrer.ast;

import java.util.List;
import java.util.Objects;

/**
 * A declared procedure: name, ordered parameters and the body it owns.
 */
public record Procedure(String name, List<String> parameters, Ast.Block body, SourceLocation location) {

    public Procedure {
        Objects.requireNonNull(name, "name");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        body = body == null ? new Ast.Block(List.of(), location) : body;
        location = location == null ? SourceLocation.UNKNOWN : location;
    }

    public Procedure(String name, List<String> parameters, Ast.Block body) {
        this(name, parameters, body, SourceLocation.UNKNOWN);
    }
}
