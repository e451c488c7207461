package com.complexity.inferrer.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of matching a procedure against the classical algorithm signatures.
 */
public final class PatternClassification {

    /**
     * Recognised algorithm families.
     */
    public enum AlgorithmPattern {
        BINARY_SEARCH("Binary Search"),
        MERGE_SORT("Merge Sort"),
        QUICK_SORT("Quick Sort"),
        FIBONACCI("Fibonacci"),
        FACTORIAL("Factorial"),
        TOWER_OF_HANOI("Tower of Hanoi"),
        GCD_EUCLIDEAN("Euclidean GCD"),
        POWER_RECURSIVE("Recursive Power"),
        KARATSUBA("Karatsuba Multiplication"),
        N_QUEENS("N-Queens (backtracking)"),
        PERMUTATIONS("Permutations (backtracking)"),
        NON_RECURSIVE("Non-recursive"),
        UNKNOWN("Unknown");

        private final String displayName;

        AlgorithmPattern(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }

        public boolean isBacktracking() {
            return this == N_QUEENS || this == PERMUTATIONS;
        }
    }

    /**
     * Coarse confidence bucket.
     */
    public enum ConfidenceLevel {
        HIGH, MEDIUM, LOW;

        public static ConfidenceLevel of(double confidence) {
            if (confidence >= 0.9) {
                return HIGH;
            }
            return confidence >= 0.7 ? MEDIUM : LOW;
        }
    }

    private final AlgorithmPattern pattern;
    private final String complexity;
    private final double confidence;
    private final String rationale;
    private final List<String> characteristics;

    public PatternClassification(AlgorithmPattern pattern, String complexity, double confidence, String rationale,
                                 List<String> characteristics) {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Confidence must lie in [0, 1]: " + confidence);
        }
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.complexity = complexity;
        this.confidence = confidence;
        this.rationale = rationale == null ? "" : rationale;
        this.characteristics = characteristics == null ? List.of() : List.copyOf(characteristics);
    }

    public AlgorithmPattern getPattern() {
        return pattern;
    }

    public String getComplexity() {
        return complexity;
    }

    public double getConfidence() {
        return confidence;
    }

    public ConfidenceLevel getConfidenceLevel() {
        return ConfidenceLevel.of(confidence);
    }

    public String getRationale() {
        return rationale;
    }

    public List<String> getCharacteristics() {
        return characteristics;
    }

    @Override
    public String toString() {
        return String.format("%s %s (confidence %.2f)", pattern.getDisplayName(), complexity, confidence);
    }
}
