package com.complexity.inferrer.model;

import java.util.Objects;

/**
 * Everything derived for one procedure during an analysis.
 * A procedure whose analysis failed carries a diagnostic and the placeholder bound {@code O(?)}.
 */
public final class ProcedureAnalysis {

    public static final String UNKNOWN_BOUND = "O(?)";

    private final String name;
    private final RecursionInfo recursionInfo;
    private final RecurrenceRelation relation;
    private final RecurrenceSolution solution;
    private final CaseComplexity bounds;
    private final PatternClassification classification;
    private final String diagnostic;

    private ProcedureAnalysis(String name, RecursionInfo recursionInfo, RecurrenceRelation relation,
                              RecurrenceSolution solution, CaseComplexity bounds,
                              PatternClassification classification, String diagnostic) {
        this.name = Objects.requireNonNull(name, "name");
        this.recursionInfo = recursionInfo;
        this.relation = relation;
        this.solution = solution;
        this.bounds = bounds;
        this.classification = classification;
        this.diagnostic = diagnostic;
    }

    public static ProcedureAnalysis analyzed(String name, RecursionInfo info, RecurrenceRelation relation,
                                             RecurrenceSolution solution, CaseComplexity bounds) {
        return new ProcedureAnalysis(name, info, relation, solution, Objects.requireNonNull(bounds, "bounds"),
                null, null);
    }

    public static ProcedureAnalysis failed(String name, RecursionInfo info, String diagnostic) {
        return new ProcedureAnalysis(name, info, null, null, null, null,
                Objects.requireNonNull(diagnostic, "diagnostic"));
    }

    public ProcedureAnalysis withClassification(PatternClassification pattern) {
        return new ProcedureAnalysis(name, recursionInfo, relation, solution, bounds, pattern, diagnostic);
    }

    public String getName() {
        return name;
    }

    public RecursionInfo getRecursionInfo() {
        return recursionInfo;
    }

    /**
     * Formal relation, or {@code null} for non-recursive procedures and heuristic solutions.
     */
    public RecurrenceRelation getRelation() {
        return relation;
    }

    public RecurrenceSolution getSolution() {
        return solution;
    }

    public CaseComplexity getBounds() {
        return bounds;
    }

    public PatternClassification getClassification() {
        return classification;
    }

    public String getDiagnostic() {
        return diagnostic;
    }

    public boolean isFailed() {
        return diagnostic != null;
    }

    public String getBigO() {
        return isFailed() ? UNKNOWN_BOUND : bounds.getWorst().bigO();
    }

    @Override
    public String toString() {
        return name + ": " + getBigO() + (isFailed() ? " (" + diagnostic + ")" : "");
    }
}
