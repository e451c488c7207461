package com.complexity.inferrer.evaluation;

import com.complexity.inferrer.model.Complexity;
import com.complexity.inferrer.model.PatternClassification;
import com.complexity.inferrer.model.ProcedureAnalysis;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects metrics over a codebase run: what was analyzed, what failed, how long it took,
 * and how the inferred bounds and patterns are distributed.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    // Timing metrics
    private Instant startTime;
    private Instant endTime;
    private long totalAnalysisTimeMs = 0;

    // File and code metrics
    private int totalFiles = 0;
    private int parseFailures = 0;
    private int totalClasses = 0;
    private int failedClasses = 0;
    private int totalProcedures = 0;
    private int untranslatedMethods = 0;

    // Analysis outcome
    private int recursiveProcedures = 0;
    private int failedProcedures = 0;
    private int classifiedProcedures = 0;

    private final Map<String, Integer> bigODistribution = new TreeMap<>();
    private final Map<String, Integer> patternDistribution = new TreeMap<>();
    private final Map<String, Integer> recursionTypeDistribution = new TreeMap<>();

    /**
     * Start timing the analysis.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
        logger.info("Metrics collection started");
    }

    /**
     * End timing the analysis.
     */
    public void endAnalysis() {
        this.endTime = Instant.now();
        if (startTime != null) {
            this.totalAnalysisTimeMs = Duration.between(startTime, endTime).toMillis();
        }
        logger.info("Metrics collection completed in {}ms", totalAnalysisTimeMs);
    }

    /**
     * Record a file that parsed.
     */
    public void recordFile() {
        totalFiles++;
    }

    /**
     * Record a file that did not parse.
     */
    public void recordParseFailure() {
        totalFiles++;
        parseFailures++;
    }

    /**
     * Record methods the front end could not translate.
     */
    public void recordUntranslated(int methods) {
        untranslatedMethods += methods;
    }

    /**
     * Record a class whose whole analysis failed.
     */
    public void recordFailedClass() {
        totalClasses++;
        failedClasses++;
    }

    /**
     * Record the analysis of one class.
     */
    public void recordClass(Complexity complexity) {
        totalClasses++;
        for (ProcedureAnalysis procedure : complexity.getProcedures().values()) {
            recordProcedure(procedure);
        }
    }

    private void recordProcedure(ProcedureAnalysis procedure) {
        totalProcedures++;
        if (procedure.getRecursionInfo() != null) {
            if (procedure.getRecursionInfo().recursive()) {
                recursiveProcedures++;
            }
            recursionTypeDistribution.merge(procedure.getRecursionInfo().type().name(), 1, Integer::sum);
        }
        if (procedure.isFailed()) {
            failedProcedures++;
        }
        bigODistribution.merge(procedure.getBigO(), 1, Integer::sum);

        PatternClassification pattern = procedure.getClassification();
        if (pattern != null) {
            classifiedProcedures++;
            patternDistribution.merge(pattern.getPattern().getDisplayName(), 1, Integer::sum);
        }
    }

    /**
     * Generate a metrics report.
     */
    public MetricsReport generateReport() {
        MetricsReport report = new MetricsReport();

        report.totalAnalysisTimeMs = totalAnalysisTimeMs;
        report.averageTimePerFile = totalFiles > 0 ? (double) totalAnalysisTimeMs / totalFiles : 0;
        report.averageTimePerProcedure = totalProcedures > 0 ? (double) totalAnalysisTimeMs / totalProcedures : 0;

        report.totalFiles = totalFiles;
        report.parseFailures = parseFailures;
        report.totalClasses = totalClasses;
        report.failedClasses = failedClasses;
        report.totalProcedures = totalProcedures;
        report.untranslatedMethods = untranslatedMethods;

        report.recursiveProcedures = recursiveProcedures;
        report.failedProcedures = failedProcedures;
        report.recursiveShare = calculatePercentage(recursiveProcedures, totalProcedures);
        report.successRate = calculatePercentage(totalProcedures - failedProcedures, totalProcedures);
        report.classificationCoverage = calculatePercentage(classifiedProcedures, totalProcedures);

        report.bigODistribution = new TreeMap<>(bigODistribution);
        report.patternDistribution = new TreeMap<>(patternDistribution);
        report.recursionTypeDistribution = new TreeMap<>(recursionTypeDistribution);
        return report;
    }

    /**
     * Export metrics to JSON for further analysis.
     */
    public void exportJSON(Path outputPath) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), generateReport());
        logger.info("Metrics exported to: {}", outputPath);
    }

    /**
     * Print a human-readable report to console.
     */
    public void printReport() {
        MetricsReport report = generateReport();

        System.out.println("\n" + "=".repeat(80));
        System.out.println("COMPLEXITY INFERENCE - METRICS REPORT");
        System.out.println("=".repeat(80));

        System.out.println("\n[TIMING METRICS]");
        System.out.printf("  Total Analysis Time: %.2f seconds%n", report.totalAnalysisTimeMs / 1000.0);
        System.out.printf("  Average Time per File: %.2f ms%n", report.averageTimePerFile);
        System.out.printf("  Average Time per Procedure: %.2f ms%n", report.averageTimePerProcedure);

        System.out.println("\n[CODE METRICS]");
        System.out.printf("  Files Analyzed: %d (%d did not parse)%n", report.totalFiles, report.parseFailures);
        System.out.printf("  Classes: %d (%d failed)%n", report.totalClasses, report.failedClasses);
        System.out.printf("  Procedures: %d%n", report.totalProcedures);
        System.out.printf("  Methods Not Translated: %d%n", report.untranslatedMethods);

        System.out.println("\n[ANALYSIS OUTCOME]");
        System.out.printf("  Recursive Procedures: %.1f%% (%d/%d)%n",
                report.recursiveShare, recursiveProcedures, totalProcedures);
        System.out.printf("  Procedures with Bounds: %.1f%% (%d/%d)%n",
                report.successRate, totalProcedures - failedProcedures, totalProcedures);
        System.out.printf("  Procedures Classified: %.1f%% (%d/%d)%n",
                report.classificationCoverage, classifiedProcedures, totalProcedures);

        System.out.println("\n[RECURSION TYPES]");
        report.recursionTypeDistribution.forEach((type, count) -> System.out.printf("  %-15s: %,6d%n", type, count));

        System.out.println("\n[BIG-O DISTRIBUTION]");
        report.bigODistribution.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> System.out.printf("  %-20s: %,6d procedures%n", entry.getKey(), entry.getValue()));

        System.out.println("\n[ALGORITHM PATTERNS]");
        report.patternDistribution.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> System.out.printf("  %-30s: %,6d%n", entry.getKey(), entry.getValue()));

        System.out.println("\n" + "=".repeat(80) + "\n");
    }

    private double calculatePercentage(int part, int total) {
        return total > 0 ? (100.0 * part / total) : 0.0;
    }

    /**
     * Data class holding all metrics for reporting.
     */
    public static class MetricsReport {
        // Timing
        public long totalAnalysisTimeMs;
        public double averageTimePerFile;
        public double averageTimePerProcedure;

        // Code metrics
        public int totalFiles;
        public int parseFailures;
        public int totalClasses;
        public int failedClasses;
        public int totalProcedures;
        public int untranslatedMethods;

        // Outcome
        public int recursiveProcedures;
        public int failedProcedures;
        public double recursiveShare;
        public double successRate;
        public double classificationCoverage;

        // Distributions
        public Map<String, Integer> bigODistribution;
        public Map<String, Integer> patternDistribution;
        public Map<String, Integer> recursionTypeDistribution;
    }
}
