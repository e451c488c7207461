package com.complexity.inferrer.model;

/**
 * How a recursive call shrinks its input.
 *
 * @param kind       reduction shape
 * @param factor     k for {@code N_OVER_K}, the subtracted constant for {@code N_MINUS_1}, 0 otherwise
 * @param rangeSplit true when the halving evidence came from a midpoint of an index range
 */
public record Subproblem(Kind kind, int factor, boolean rangeSplit) {

    public enum Kind {
        N_MINUS_1, N_OVER_K, SLICE, MIXED_CONSTANT_SUBTRACT, UNKNOWN
    }

    public static final Subproblem UNKNOWN = new Subproblem(Kind.UNKNOWN, 0, false);
    public static final Subproblem SLICE = new Subproblem(Kind.SLICE, 0, false);
    public static final Subproblem MIXED_CONSTANT_SUBTRACT = new Subproblem(Kind.MIXED_CONSTANT_SUBTRACT, 0, false);

    public Subproblem {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (kind == Kind.N_OVER_K && factor < 2) {
            throw new IllegalArgumentException("N/k needs k >= 2, got " + factor);
        }
    }

    public static Subproblem minus(int constant) {
        return new Subproblem(Kind.N_MINUS_1, Math.max(1, constant), false);
    }

    public static Subproblem over(int k) {
        return new Subproblem(Kind.N_OVER_K, k, false);
    }

    public static Subproblem midpoint() {
        return new Subproblem(Kind.N_OVER_K, 2, true);
    }

    public boolean isDivide() {
        return kind == Kind.N_OVER_K;
    }

    @Override
    public String toString() {
        switch (kind) {
            case N_MINUS_1:
                return "n-" + factor;
            case N_OVER_K:
                return "n/" + factor + (rangeSplit ? " (midpoint)" : "");
            case SLICE:
                return "slice";
            case MIXED_CONSTANT_SUBTRACT:
                return "n-1 and n-2";
            default:
                return "unknown";
        }
    }
}
