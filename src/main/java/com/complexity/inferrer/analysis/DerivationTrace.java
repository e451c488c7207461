package com.complexity.inferrer.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered derivation steps of one analysis. Owned by the caller and passed in explicitly.
 */
public final class DerivationTrace {

    private static final String INDENT = "  ";

    private final List<String> steps = new ArrayList<>();
    private int depth;

    public void step(String format, Object... args) {
        String text = args.length == 0 ? format : String.format(format, args);
        steps.add(INDENT.repeat(depth) + text);
    }

    public void enter() {
        depth++;
    }

    public void exit() {
        if (depth > 0) {
            depth--;
        }
    }

    public List<String> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public int size() {
        return steps.size();
    }

    @Override
    public String toString() {
        return String.join(System.lineSeparator(), steps);
    }
}
