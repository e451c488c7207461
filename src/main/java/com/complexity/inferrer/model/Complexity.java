package com.complexity.inferrer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final result of one analysis: Big-O, Omega and Theta of the program body, the ordered
 * derivation steps and the per-procedure results.
 */
public final class Complexity {

    private final ComplexityExpression bigO;
    private final ComplexityExpression omega;
    private final ComplexityExpression theta;
    private final String explanation;
    private final List<String> steps;
    private final Map<String, ProcedureAnalysis> procedures;

    public Complexity(CaseComplexity bounds, String explanation, List<String> steps,
                      Map<String, ProcedureAnalysis> procedures) {
        CaseComplexity reduced = Objects.requireNonNull(bounds, "bounds").reduce();
        this.bigO = reduced.getWorst();
        this.omega = reduced.getBest();
        this.theta = reduced.getAverage();
        this.explanation = explanation == null ? "" : explanation;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
        this.procedures = procedures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(procedures));
    }

    public ComplexityExpression getBigO() {
        return bigO;
    }

    public ComplexityExpression getOmega() {
        return omega;
    }

    public ComplexityExpression getTheta() {
        return theta;
    }

    public String getBigOLabel() {
        return bigO.bigO();
    }

    public String getOmegaLabel() {
        return "Ω(" + omega.label() + ")";
    }

    public String getThetaLabel() {
        return "Θ(" + theta.label() + ")";
    }

    public String getExplanation() {
        return explanation;
    }

    public List<String> getSteps() {
        return steps;
    }

    public Map<String, ProcedureAnalysis> getProcedures() {
        return procedures;
    }

    public ProcedureAnalysis getProcedure(String name) {
        return procedures.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Complexity)) {
            return false;
        }
        Complexity that = (Complexity) o;
        return bigO.equals(that.bigO) && omega.equals(that.omega) && theta.equals(that.theta)
                && explanation.equals(that.explanation) && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bigO, omega, theta, explanation, steps);
    }

    @Override
    public String toString() {
        return String.format("%s, %s, %s", getBigOLabel(), getOmegaLabel(), getThetaLabel());
    }
}
