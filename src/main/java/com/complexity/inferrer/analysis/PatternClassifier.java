package com.complexity.inferrer.analysis;

import com.complexity.inferrer.model.ComplexityExpression;
import com.complexity.inferrer.model.PatternClassification;
import com.complexity.inferrer.model.PatternClassification.AlgorithmPattern;
import com.complexity.inferrer.model.RecurrenceRelation;
import com.complexity.inferrer.model.RecurrenceSolution;
import com.complexity.inferrer.model.RecursionInfo;
import com.complexity.inferrer.model.RecursionInfo.DepthPattern;
import com.complexity.inferrer.model.Subproblem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Matches a recursive procedure against an ordered table of classical algorithm signatures.
 *
 * The first signature whose structural predicate holds wins. A keyword in the procedure name
 * only raises the confidence; it is never needed for a match.
 */
public class PatternClassifier {

    private static final Logger logger = LoggerFactory.getLogger(PatternClassifier.class);

    static final double UNKNOWN_CONFIDENCE = 0.6;

    /**
     * What the classifier knows about one procedure.
     */
    record Facts(String name, RecursionInfo info, RecurrenceSolution solution, RecurrenceRelation relation) {

        int calls() {
            return info.callCount();
        }

        Subproblem subproblem() {
            return info.subproblem();
        }

        DepthPattern depth() {
            return info.depthPattern();
        }

        ComplexityExpression complexity() {
            return solution.getComplexity();
        }

        boolean halves() {
            return subproblem().isDivide() && subproblem().factor() == 2;
        }

        boolean logarithmic() {
            return complexity().getShape() == ComplexityExpression.Shape.LOGARITHMIC;
        }

        boolean nLogN() {
            return complexity().sameGrowth(ComplexityExpression.nLogN());
        }
    }

    private record Signature(AlgorithmPattern pattern, Predicate<Facts> matches, double confidence,
                             double namedConfidence, List<String> keywords, Function<Facts, String> label,
                             String rationale, List<String> characteristics) {
    }

    private static final List<Signature> SIGNATURES = List.of(
            new Signature(AlgorithmPattern.BINARY_SEARCH,
                    f -> f.calls() == 1 && f.depth() == DepthPattern.DIVIDE_AND_CONQUER && f.halves()
                            && f.subproblem().rangeSplit() && f.logarithmic(),
                    1.0, 1.0, List.of("binary", "busqueda", "search"), f -> "O(log n)",
                    "T(n) = T(n/2) + O(1): one call on half of an index range",
                    List.of("one recursive call", "range split at its midpoint", "constant work per call")),
            new Signature(AlgorithmPattern.MERGE_SORT,
                    f -> f.calls() >= 2 && f.depth() == DepthPattern.DIVIDE_AND_CONQUER && f.halves()
                            && f.info().hasCombiningWork() && f.nLogN(),
                    0.99, 1.0, List.of("merge", "sort", "ordenar"), f -> "O(n log n)",
                    "T(n) = 2T(n/2) + O(n): two halves combined by a linear merge",
                    List.of("two recursive calls", "input split in halves", "linear merge phase")),
            new Signature(AlgorithmPattern.QUICK_SORT,
                    f -> f.calls() >= 2 && f.depth() == DepthPattern.DIVIDE_AND_CONQUER
                            && !f.info().hasCombiningWork() && f.nLogN(),
                    0.90, 0.98, List.of("quick", "rapido", "partition"),
                    f -> "O(n log n) average, O(n^2) worst",
                    "two calls around a partition point and no merge phase",
                    List.of("two recursive calls", "partition may be unbalanced", "no combining phase",
                            "works in place")),
            new Signature(AlgorithmPattern.FIBONACCI,
                    f -> f.calls() == 2 && f.subproblem().kind() == Subproblem.Kind.MIXED_CONSTANT_SUBTRACT
                            && f.complexity().isExponential(),
                    0.95, 1.0, List.of("fib"), f -> "O(2^n)",
                    "T(n) = T(n-1) + T(n-2): a binary recursion tree of height n",
                    List.of("calls on n-1 and n-2", "recomputes overlapping subproblems",
                            "linear with memoization")),
            new Signature(AlgorithmPattern.FACTORIAL,
                    f -> f.calls() == 1 && f.subproblem().kind() == Subproblem.Kind.N_MINUS_1
                            && f.depth() == DepthPattern.LINEAR
                            && f.complexity().sameGrowth(ComplexityExpression.linear()),
                    0.85, 1.0, List.of("fact"), f -> "O(n)",
                    "T(n) = T(n-1) + O(1): a single chain of n calls",
                    List.of("one recursive call", "input shrinks by one", "constant work per call")),
            new Signature(AlgorithmPattern.TOWER_OF_HANOI,
                    f -> f.calls() == 2 && f.subproblem().kind() == Subproblem.Kind.N_MINUS_1
                            && f.depth() == DepthPattern.TREE && f.complexity().isExponential()
                            && Math.abs(f.complexity().getExpBase() - 2) < 1e-9,
                    0.80, 1.0, List.of("hanoi", "torre", "tower"), f -> "O(2^n)",
                    "T(n) = 2T(n-1) + O(1): 2^n - 1 moves",
                    List.of("two recursive calls", "each on n-1 elements", "exponential number of moves")),
            new Signature(AlgorithmPattern.GCD_EUCLIDEAN,
                    f -> f.calls() == 1
                            && (f.depth() == DepthPattern.LINEAR || f.depth() == DepthPattern.DIVIDE_AND_CONQUER)
                            && f.logarithmic() && f.subproblem().kind() == Subproblem.Kind.UNKNOWN,
                    0.70, 0.95, List.of("gcd", "mcd", "euclid"), f -> "O(log min(a, b))",
                    "the remainder at least halves every two calls",
                    List.of("one recursive call", "uses the remainder operation",
                            "logarithmic in the smaller argument")),
            new Signature(AlgorithmPattern.POWER_RECURSIVE,
                    f -> f.calls() == 1 && f.subproblem().isDivide()
                            && f.depth() == DepthPattern.DIVIDE_AND_CONQUER && f.logarithmic(),
                    0.75, 0.95, List.of("pow", "power", "potencia", "exp"), f -> "O(log n)",
                    "fast exponentiation: one call on half the exponent",
                    List.of("one recursive call on n/2", "squares the partial result")),
            new Signature(AlgorithmPattern.KARATSUBA,
                    f -> f.calls() == 3 && f.halves() && f.depth() == DepthPattern.DIVIDE_AND_CONQUER,
                    0.80, 0.95, List.of("karatsuba", "mult"), f -> f.solution().getLabel(),
                    "T(n) = 3T(n/2) + O(n): sub-quadratic multiplication",
                    List.of("three recursive calls", "operands split in halves")),
            new Signature(AlgorithmPattern.PERMUTATIONS,
                    f -> f.calls() >= 4 && f.depth() == DepthPattern.TREE && f.complexity().isExponential(),
                    0.65, 0.90, List.of("queen", "reina", "permut", "backtrack"), f -> f.solution().getLabel(),
                    "explores many branches of a decision tree",
                    List.of("four or more recursive calls", "explores a decision tree",
                            "exponential or factorial growth")));

    /**
     * Classifies one procedure. Non-recursive procedures need no solution.
     */
    public PatternClassification classify(String name, RecursionInfo info, RecurrenceSolution solution,
                                          RecurrenceRelation relation) {
        if (!info.recursive()) {
            return new PatternClassification(AlgorithmPattern.NON_RECURSIVE, null, 1.0,
                    "no procedure on its call paths calls it back", List.of("no recursive calls"));
        }
        if (solution == null) {
            throw new IllegalArgumentException("A recursive procedure needs a recurrence solution: " + name);
        }
        Facts facts = new Facts(name, info, solution, relation);
        String lowerName = name.toLowerCase(Locale.ROOT);
        for (Signature signature : SIGNATURES) {
            if (!signature.matches().test(facts)) {
                continue;
            }
            boolean named = signature.keywords().stream().anyMatch(lowerName::contains);
            AlgorithmPattern pattern = signature.pattern();
            if (pattern.isBacktracking()) {
                pattern = lowerName.contains("queen") || lowerName.contains("reina")
                        ? AlgorithmPattern.N_QUEENS : AlgorithmPattern.PERMUTATIONS;
            }
            PatternClassification result = new PatternClassification(pattern, signature.label().apply(facts),
                    named ? signature.namedConfidence() : signature.confidence(), signature.rationale(),
                    signature.characteristics());
            logger.debug("{} classified as {}", name, result);
            return result;
        }
        return new PatternClassification(AlgorithmPattern.UNKNOWN, solution.getLabel(), UNKNOWN_CONFIDENCE,
                "no known signature matches; estimated " + solution.getLabel(),
                List.of("recursion: " + info.type(), "depth pattern: " + info.depthPattern(),
                        info.callCount() + " recursive call(s)", "subproblem: " + info.subproblem()));
    }
}
