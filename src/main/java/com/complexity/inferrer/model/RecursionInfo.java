package com.complexity.inferrer.model;

import java.util.List;

/**
 * Recursive structure of one procedure, computed once per analysis.
 *
 * @param recursive          whether the procedure reaches itself through calls
 * @param type               how it recurses
 * @param callCount          active recursive call sites, exclusive branches counted once
 * @param callsTo            every callee name found in the body, duplicates kept, in source order
 * @param depthPattern       shape of the recursion tree
 * @param subproblem         how each call shrinks the input
 * @param hasCombiningWork   whether a merge-style combining loop was found
 */
public record RecursionInfo(boolean recursive, RecursionType type, int callCount, List<String> callsTo,
                            DepthPattern depthPattern, Subproblem subproblem, boolean hasCombiningWork) {

    public enum RecursionType {
        NONE, DIRECT, INDIRECT, TAIL
    }

    public enum DepthPattern {
        LINEAR, TREE, DIVIDE_AND_CONQUER, UNKNOWN
    }

    public RecursionInfo {
        if (callCount < 0) {
            throw new IllegalArgumentException("callCount must be non-negative: " + callCount);
        }
        callsTo = callsTo == null ? List.of() : List.copyOf(callsTo);
        type = type == null ? RecursionType.NONE : type;
        depthPattern = depthPattern == null ? DepthPattern.UNKNOWN : depthPattern;
        subproblem = subproblem == null ? Subproblem.UNKNOWN : subproblem;
        if (recursive == (type == RecursionType.NONE)) {
            throw new IllegalArgumentException("Recursion flag " + recursive + " contradicts type " + type);
        }
    }

    public static RecursionInfo nonRecursive(List<String> callsTo) {
        return new RecursionInfo(false, RecursionType.NONE, 0, callsTo, DepthPattern.UNKNOWN,
                Subproblem.UNKNOWN, false);
    }
}
