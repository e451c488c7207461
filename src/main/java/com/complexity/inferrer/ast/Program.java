package com.complexity.inferrer.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of a parsed pseudocode program: the procedure table plus the main body.
 * Procedure names are unique; a later declaration with an existing name is rejected.
 */
public final class Program {

    private final Map<String, Procedure> procedures;
    private final Ast.Block body;

    public Program(List<Procedure> procedures, Ast.Block body) {
        Map<String, Procedure> table = new LinkedHashMap<>();
        for (Procedure procedure : procedures) {
            if (table.putIfAbsent(procedure.name(), procedure) != null) {
                throw new IllegalArgumentException("Duplicate procedure: " + procedure.name());
            }
        }
        this.procedures = Collections.unmodifiableMap(table);
        this.body = body == null ? new Ast.Block(List.of(), SourceLocation.UNKNOWN) : body;
    }

    public static Program of(Ast.Block body, Procedure... procedures) {
        return new Program(List.of(procedures), body);
    }

    /**
     * Procedures in declaration order, keyed by name.
     */
    public Map<String, Procedure> getProcedures() {
        return procedures;
    }

    public Optional<Procedure> getProcedure(String name) {
        return Optional.ofNullable(procedures.get(name));
    }

    public boolean declares(String name) {
        return procedures.containsKey(name);
    }

    public Ast.Block getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "Program" + procedures.keySet() + " (" + body.statements().size() + " top-level statements)";
    }
}
