package com.complexity.inferrer.processor;

import com.complexity.inferrer.model.Complexity;

import java.nio.file.Path;
import java.util.Map;

/**
 * Outcome of analyzing one class of the codebase.
 *
 * @param file         source file the class was declared in
 * @param className    simple name of the class
 * @param complexity   analysis result, {@code null} when the whole analysis failed
 * @param untranslated methods dropped by the front end, with their diagnostics
 * @param error        why the analysis failed, {@code null} on success
 */
public record ClassResult(Path file, String className, Complexity complexity, Map<String, String> untranslated,
                          String error) {

    public ClassResult {
        untranslated = untranslated == null ? Map.of() : Map.copyOf(untranslated);
    }

    public boolean isFailed() {
        return error != null;
    }
}
