package com.complexity.inferrer.model;

import java.util.Objects;

/**
 * Closed form of a recurrence together with how it was obtained.
 */
public final class RecurrenceSolution {

    public enum SolutionMethod {
        MASTER_CASE_1, MASTER_CASE_2, MASTER_CASE_3, MASTER_SPECIAL_LOG,
        LINEAR_EXPANSION, FIBONACCI_CLOSED_FORM, HEURISTIC
    }

    private final String relation;
    private final ComplexityExpression complexity;
    private final SolutionMethod method;
    private final String explanation;

    public RecurrenceSolution(String relation, ComplexityExpression complexity, SolutionMethod method,
                              String explanation) {
        this.relation = relation == null ? "" : relation;
        this.complexity = Objects.requireNonNull(complexity, "complexity").reduce();
        this.method = Objects.requireNonNull(method, "method");
        this.explanation = explanation == null ? "" : explanation;
    }

    public String getRelation() {
        return relation;
    }

    public ComplexityExpression getComplexity() {
        return complexity;
    }

    /**
     * Display label such as {@code O(n log n)}.
     */
    public String getLabel() {
        return complexity.bigO();
    }

    public SolutionMethod getMethod() {
        return method;
    }

    public boolean isHeuristic() {
        return method == SolutionMethod.HEURISTIC;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return (relation.isEmpty() ? "" : relation + " => ") + getLabel() + " [" + method + "]";
    }
}
