package com.complexity.inferrer.config;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Ranked identifier rules used as secondary evidence by the structural heuristics.
 *
 * Shape evidence is always consulted first; these rules only add evidence for identifiers that
 * carry a conventional meaning, such as a loop-exit flag called {@code found}. Lower rank wins.
 */
public final class HeuristicRules {

    public enum MatchMode {
        EQUALS, CONTAINS
    }

    /**
     * One identifier rule. Matching ignores case.
     */
    public record NameRule(String pattern, MatchMode match, int rank) {

        public NameRule {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("Name rule pattern must not be blank");
            }
            pattern = pattern.trim().toLowerCase(Locale.ROOT);
            match = match == null ? MatchMode.EQUALS : match;
        }

        public boolean matches(String identifier) {
            if (identifier == null) {
                return false;
            }
            String candidate = identifier.toLowerCase(Locale.ROOT);
            return match == MatchMode.EQUALS ? candidate.equals(pattern) : candidate.contains(pattern);
        }
    }

    private final List<NameRule> flagNames;
    private final List<NameRule> sentinelNames;
    private final List<NameRule> midpointNames;

    public HeuristicRules(List<NameRule> flagNames, List<NameRule> sentinelNames, List<NameRule> midpointNames) {
        this.flagNames = ranked(flagNames);
        this.sentinelNames = ranked(sentinelNames);
        this.midpointNames = ranked(midpointNames);
    }

    public static HeuristicRules defaults() {
        return new HeuristicRules(
                rules(MatchMode.CONTAINS, "found", "encontrado", "done", "flag", "terminar"),
                rules(MatchMode.EQUALS, "T", "F"),
                rules(MatchMode.EQUALS, "medio", "mid", "mitad", "middle", "m"));
    }

    /**
     * Builds rules ranked in the order given.
     */
    public static List<NameRule> rules(MatchMode match, String... patterns) {
        List<NameRule> result = new ArrayList<>();
        for (int i = 0; i < patterns.length; i++) {
            result.add(new NameRule(patterns[i], match, i));
        }
        return result;
    }

    public HeuristicRules withFlagNames(List<NameRule> rules) {
        return new HeuristicRules(rules, sentinelNames, midpointNames);
    }

    public HeuristicRules withSentinelNames(List<NameRule> rules) {
        return new HeuristicRules(flagNames, rules, midpointNames);
    }

    public HeuristicRules withMidpointNames(List<NameRule> rules) {
        return new HeuristicRules(flagNames, sentinelNames, rules);
    }

    public boolean isFlagName(String identifier) {
        return firstMatch(flagNames, identifier).isPresent();
    }

    public boolean isSentinelName(String identifier) {
        return firstMatch(sentinelNames, identifier).isPresent();
    }

    public boolean isMidpointName(String identifier) {
        return firstMatch(midpointNames, identifier).isPresent();
    }

    /**
     * The best-ranked rule matching the identifier, if any.
     */
    public static Optional<NameRule> firstMatch(List<NameRule> rules, String identifier) {
        return rules.stream().filter(rule -> rule.matches(identifier)).findFirst();
    }

    public List<NameRule> getFlagNames() {
        return flagNames;
    }

    public List<NameRule> getSentinelNames() {
        return sentinelNames;
    }

    public List<NameRule> getMidpointNames() {
        return midpointNames;
    }

    private static List<NameRule> ranked(List<NameRule> rules) {
        List<NameRule> sorted = new ArrayList<>(rules == null ? List.of() : rules);
        sorted.sort(Comparator.comparingInt(NameRule::rank));
        return List.copyOf(sorted);
    }

    @Override
    public String toString() {
        return String.format("HeuristicRules: %d flag, %d sentinel, %d midpoint rules",
                flagNames.size(), sentinelNames.size(), midpointNames.size());
    }
}
