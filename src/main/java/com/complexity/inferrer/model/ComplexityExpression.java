package com.complexity.inferrer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A growth class in product form {@code c * n^d * log^k n * (log log n)^j * b^n}.
 *
 * Covers constant, logarithmic, linear, polynomial, poly-logarithmic and exponential costs.
 * The growth order compares the exponential base first, then the polynomial degree, then the
 * log and log-log powers; the coefficient only breaks ties in {@link #compareTo}.
 *
 * Instances are immutable.
 */
public final class ComplexityExpression implements Comparable<ComplexityExpression> {

    private static final double EPSILON = 1e-9;

    /**
     * Coarse shape of an expression, in increasing growth order.
     */
    public enum Shape {
        CONSTANT, LOG_LOG, LOGARITHMIC, LINEAR, POLYNOMIAL, POLY_LOG, EXPONENTIAL
    }

    public static final ComplexityExpression CONSTANT = new ComplexityExpression(1, 0, 0, 0, 1);
    public static final ComplexityExpression LINEAR = new ComplexityExpression(1, 1, 0, 0, 1);
    public static final ComplexityExpression LOGARITHMIC = new ComplexityExpression(1, 0, 1, 0, 1);

    private final double coefficient;
    private final double degree;
    private final int logPower;
    private final int logLogPower;
    private final double expBase;

    private ComplexityExpression(double coefficient, double degree, int logPower, int logLogPower, double expBase) {
        if (!(coefficient > 0) || Double.isInfinite(coefficient)) {
            throw new IllegalArgumentException("Coefficient must be positive and finite: " + coefficient);
        }
        if (degree < -EPSILON || logPower < 0 || logLogPower < 0) {
            throw new IllegalArgumentException("Negative exponent in growth class");
        }
        if (expBase < 1 - EPSILON) {
            throw new IllegalArgumentException("Exponential base must be at least 1: " + expBase);
        }
        this.coefficient = coefficient;
        this.degree = Math.abs(degree) < EPSILON ? 0 : degree;
        this.logPower = logPower;
        this.logLogPower = logLogPower;
        this.expBase = Math.abs(expBase - 1) < EPSILON ? 1 : expBase;
    }

    public static ComplexityExpression of(double coefficient, double degree, int logPower, int logLogPower,
                                          double expBase) {
        return new ComplexityExpression(coefficient, degree, logPower, logLogPower, expBase);
    }

    public static ComplexityExpression constant() {
        return CONSTANT;
    }

    public static ComplexityExpression constant(double value) {
        return new ComplexityExpression(value, 0, 0, 0, 1);
    }

    public static ComplexityExpression linear() {
        return LINEAR;
    }

    public static ComplexityExpression logarithmic() {
        return LOGARITHMIC;
    }

    public static ComplexityExpression logLog() {
        return new ComplexityExpression(1, 0, 0, 1, 1);
    }

    public static ComplexityExpression polynomial(double degree) {
        return new ComplexityExpression(1, degree, 0, 0, 1);
    }

    /**
     * {@code n^degree * log^logPower n}.
     */
    public static ComplexityExpression polyLog(double degree, int logPower) {
        return new ComplexityExpression(1, degree, logPower, 0, 1);
    }

    public static ComplexityExpression nLogN() {
        return polyLog(1, 1);
    }

    public static ComplexityExpression exponential(double base) {
        return new ComplexityExpression(1, 0, 0, 0, base);
    }

    // ------------------------------------------------------------------
    // Combinators
    // ------------------------------------------------------------------

    /**
     * Product of two costs, e.g. a loop count times its body.
     */
    public ComplexityExpression times(ComplexityExpression other) {
        return new ComplexityExpression(coefficient * other.coefficient, degree + other.degree,
                logPower + other.logPower, logLogPower + other.logLogPower, expBase * other.expBase);
    }

    public static ComplexityExpression times(ComplexityExpression a, ComplexityExpression b) {
        return a.times(b);
    }

    /**
     * The faster-growing of two costs; the larger coefficient wins a growth tie.
     */
    public static ComplexityExpression dominant(ComplexityExpression a, ComplexityExpression b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * The slower-growing of two costs.
     */
    public static ComplexityExpression min(ComplexityExpression a, ComplexityExpression b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Cost of running the given terms one after another. Constants add up; once a non-constant
     * term is present the fastest-growing class dominates and its coefficients add.
     */
    public static ComplexityExpression sumSequential(Collection<ComplexityExpression> terms) {
        if (terms.isEmpty()) {
            return CONSTANT;
        }
        ComplexityExpression top = null;
        for (ComplexityExpression term : terms) {
            if (top == null || term.compareGrowth(top) > 0) {
                top = term;
            }
        }
        double total = 0;
        for (ComplexityExpression term : terms) {
            if (term.compareGrowth(top) == 0) {
                total += term.coefficient;
            }
        }
        return top.withCoefficient(total);
    }

    public static ComplexityExpression sumSequential(ComplexityExpression... terms) {
        return sumSequential(List.of(terms));
    }

    /**
     * Unweighted mean of two costs.
     */
    public static ComplexityExpression mean(ComplexityExpression a, ComplexityExpression b) {
        return sumSequential(a, b).scale(0.5);
    }

    public ComplexityExpression scale(double factor) {
        return withCoefficient(coefficient * factor);
    }

    /**
     * Drops the coefficient, leaving only the growth class.
     */
    public ComplexityExpression reduce() {
        return coefficient == 1 ? this : withCoefficient(1);
    }

    private ComplexityExpression withCoefficient(double value) {
        return new ComplexityExpression(value, degree, logPower, logLogPower, expBase);
    }

    // ------------------------------------------------------------------
    // Ordering
    // ------------------------------------------------------------------

    /**
     * Compares growth classes only, ignoring the coefficient.
     */
    public int compareGrowth(ComplexityExpression other) {
        int cmp = compareDouble(expBase, other.expBase);
        if (cmp != 0) {
            return cmp;
        }
        cmp = compareDouble(degree, other.degree);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(logPower, other.logPower);
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(logLogPower, other.logLogPower);
    }

    public boolean sameGrowth(ComplexityExpression other) {
        return compareGrowth(other) == 0;
    }

    public boolean growsFasterThan(ComplexityExpression other) {
        return compareGrowth(other) > 0;
    }

    @Override
    public int compareTo(ComplexityExpression other) {
        int cmp = compareGrowth(other);
        return cmp != 0 ? cmp : compareDouble(coefficient, other.coefficient);
    }

    private static int compareDouble(double a, double b) {
        if (Math.abs(a - b) < EPSILON) {
            return 0;
        }
        return a < b ? -1 : 1;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public Shape getShape() {
        if (expBase > 1) {
            return Shape.EXPONENTIAL;
        }
        if (degree > 0) {
            if (logPower > 0 || logLogPower > 0) {
                return Shape.POLY_LOG;
            }
            return isIntegral(degree) && (long) Math.rint(degree) == 1 ? Shape.LINEAR : Shape.POLYNOMIAL;
        }
        if (logPower > 0) {
            return Shape.LOGARITHMIC;
        }
        return logLogPower > 0 ? Shape.LOG_LOG : Shape.CONSTANT;
    }

    public boolean isConstant() {
        return getShape() == Shape.CONSTANT;
    }

    public boolean isExponential() {
        return expBase > 1;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public double getDegree() {
        return degree;
    }

    public int getLogPower() {
        return logPower;
    }

    public int getLogLogPower() {
        return logLogPower;
    }

    public double getExpBase() {
        return expBase;
    }

    // ------------------------------------------------------------------
    // Rendering
    // ------------------------------------------------------------------

    /**
     * Human-readable growth class without the coefficient: {@code 1}, {@code log n},
     * {@code n^2}, {@code n log^2 n}, {@code n * 2^n}, {@code n^1.58} and so on.
     */
    public String label() {
        List<String> factors = new ArrayList<>();
        if (degree > 0) {
            factors.add(isIntegral(degree) && Math.rint(degree) == 1 ? "n" : "n^" + formatNumber(degree));
        }
        if (logPower > 0) {
            factors.add(logPower == 1 ? "log n" : "log^" + logPower + " n");
        }
        if (logLogPower > 0) {
            factors.add(logLogPower == 1 ? "log log n" : "(log log n)^" + logLogPower);
        }
        String polyPart = String.join(" ", factors);
        if (expBase > 1) {
            String expPart = formatNumber(expBase) + "^n";
            return polyPart.isEmpty() ? expPart : polyPart + " * " + expPart;
        }
        return polyPart.isEmpty() ? "1" : polyPart;
    }

    public String bigO() {
        return "O(" + label() + ")";
    }

    private static boolean isIntegral(double value) {
        return Math.abs(value - Math.rint(value)) < EPSILON;
    }

    private static String formatNumber(double value) {
        if (isIntegral(value)) {
            return Long.toString((long) Math.rint(value));
        }
        String text = String.format(Locale.ROOT, "%.2f", value);
        while (text.endsWith("0")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ComplexityExpression)) {
            return false;
        }
        ComplexityExpression that = (ComplexityExpression) o;
        return compareTo(that) == 0;
    }

    /**
     * Log powers only: the other fields compare within a tolerance.
     */
    @Override
    public int hashCode() {
        return Objects.hash(logPower, logLogPower);
    }

    @Override
    public String toString() {
        return coefficient == 1 ? label() : formatNumber(coefficient) + " * " + label();
    }
}
