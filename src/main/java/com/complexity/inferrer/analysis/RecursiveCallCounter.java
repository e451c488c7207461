package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.Ast.Node;

import java.util.Set;

/**
 * Counts the recursive calls active in one execution of a body.
 *
 * Branches of an {@code if} are mutually exclusive, so only the larger branch counts; sequential
 * statements add up. Calls inside loops count once per call site.
 */
public final class RecursiveCallCounter {

    private final Set<String> targets;

    /**
     * @param targets names whose calls are recursive: the procedure itself, or its cycle members
     */
    public RecursiveCallCounter(Set<String> targets) {
        this.targets = Set.copyOf(targets);
    }

    public int count(Node node) {
        if (node == null) {
            return 0;
        }
        if (node instanceof Ast.If) {
            Ast.If branch = (Ast.If) node;
            return count(branch.condition()) + Math.max(count(branch.thenBranch()), count(branch.elseBranch()));
        }
        int total = 0;
        if (node instanceof Ast.Invocation && targets.contains(((Ast.Invocation) node).name())) {
            total = 1;
        }
        for (Node child : node.getChildNodes()) {
            total += count(child);
        }
        return total;
    }
}
