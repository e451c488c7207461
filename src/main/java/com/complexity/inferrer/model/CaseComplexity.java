package com.complexity.inferrer.model;

import java.util.Objects;

/**
 * Worst, best and average cost of one construct.
 * Construction fails unless {@code best <= average <= worst} in growth order.
 */
public final class CaseComplexity {

    private final ComplexityExpression worst;
    private final ComplexityExpression best;
    private final ComplexityExpression average;
    private final boolean differs;
    private final String explanation;

    public CaseComplexity(ComplexityExpression worst, ComplexityExpression best, ComplexityExpression average,
                          boolean differs, String explanation) {
        this.worst = Objects.requireNonNull(worst, "worst");
        this.best = Objects.requireNonNull(best, "best");
        this.average = Objects.requireNonNull(average, "average");
        if (best.compareGrowth(average) > 0 || average.compareGrowth(worst) > 0) {
            throw new IllegalArgumentException(String.format(
                    "Case bounds out of order: best=%s, average=%s, worst=%s", best, average, worst));
        }
        this.differs = differs;
        this.explanation = explanation == null ? "" : explanation;
    }

    /**
     * Same cost in every case.
     */
    public static CaseComplexity uniform(ComplexityExpression cost, String explanation) {
        return new CaseComplexity(cost, cost, cost, false, explanation);
    }

    public static CaseComplexity constant() {
        return uniform(ComplexityExpression.constant(), "constant work");
    }

    /**
     * Component-wise product, used for a loop count times its body.
     */
    public CaseComplexity times(CaseComplexity other) {
        return new CaseComplexity(worst.times(other.worst), best.times(other.best), average.times(other.average),
                differs || other.differs, explanation);
    }

    public CaseComplexity reduce() {
        return new CaseComplexity(worst.reduce(), best.reduce(), average.reduce(), differs, explanation);
    }

    public ComplexityExpression getWorst() {
        return worst;
    }

    public ComplexityExpression getBest() {
        return best;
    }

    public ComplexityExpression getAverage() {
        return average;
    }

    public boolean differs() {
        return differs;
    }

    public String getExplanation() {
        return explanation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CaseComplexity)) {
            return false;
        }
        CaseComplexity that = (CaseComplexity) o;
        return differs == that.differs && worst.equals(that.worst) && best.equals(that.best)
                && average.equals(that.average);
    }

    @Override
    public int hashCode() {
        return Objects.hash(worst, best, average, differs);
    }

    @Override
    public String toString() {
        return String.format("worst=%s, best=%s, average=%s%s", worst.bigO(), best.bigO(), average.bigO(),
                differs ? " (cases differ)" : "");
    }
}
