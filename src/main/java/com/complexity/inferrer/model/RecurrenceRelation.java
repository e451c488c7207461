package com.complexity.inferrer.model;

import java.util.Objects;

/**
 * {@code T(n) = a T(n/b) + f(n)} for divide reductions, {@code T(n) = a T(n-b) + f(n)} for subtract ones.
 */
public final class RecurrenceRelation {

    public enum ReductionType {
        DIVIDE, SUBTRACT
    }

    private final int a;
    private final int b;
    private final ComplexityExpression fComplexity;
    private final ReductionType reductionType;

    public RecurrenceRelation(int a, int b, ComplexityExpression fComplexity, ReductionType reductionType) {
        if (a < 1) {
            throw new IllegalArgumentException("A recurrence needs at least one recursive call, got a=" + a);
        }
        Objects.requireNonNull(reductionType, "reductionType");
        if (reductionType == ReductionType.DIVIDE && b < 2) {
            throw new IllegalArgumentException("Divide reduction needs b >= 2, got b=" + b);
        }
        if (b < 1) {
            throw new IllegalArgumentException("Reduction factor must be at least 1, got b=" + b);
        }
        this.a = a;
        this.b = b;
        this.fComplexity = Objects.requireNonNull(fComplexity, "fComplexity").reduce();
        this.reductionType = reductionType;
    }

    public int getA() {
        return a;
    }

    public int getB() {
        return b;
    }

    public ComplexityExpression getFComplexity() {
        return fComplexity;
    }

    public ReductionType getReductionType() {
        return reductionType;
    }

    public boolean isDivide() {
        return reductionType == ReductionType.DIVIDE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecurrenceRelation)) {
            return false;
        }
        RecurrenceRelation that = (RecurrenceRelation) o;
        return a == that.a && b == that.b && fComplexity.equals(that.fComplexity)
                && reductionType == that.reductionType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b, fComplexity, reductionType);
    }

    @Override
    public String toString() {
        String coefficient = a == 1 ? "" : Integer.toString(a);
        String argument = reductionType == ReductionType.DIVIDE ? "n/" + b : "n-" + b;
        return "T(n) = " + coefficient + "T(" + argument + ") + " + fComplexity.bigO();
    }
}
