package com.complexity.inferrer.processor;

import com.complexity.inferrer.analysis.AnalysisException;
import com.complexity.inferrer.analysis.ComplexityInferrer;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.evaluation.MetricsCollector;
import com.complexity.inferrer.frontend.JavaProgramTranslator;
import com.complexity.inferrer.frontend.JavaProgramTranslator.TranslationResult;
import com.complexity.inferrer.model.Complexity;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Infers the complexity of every class in a Java codebase and exports the results.
 */
public class CodebaseProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CodebaseProcessor.class);

    public static final String REPORT_FILE = "complexity-report.json";
    public static final String METRICS_FILE = "complexity-metrics.json";

    private final JavaProgramTranslator translator;
    private final ComplexityInferrer inferrer;
    private final AnalysisReportWriter reportWriter = new AnalysisReportWriter();
    private final MetricsCollector metricsCollector;
    private final boolean collectMetrics;
    private final List<ClassResult> results = new ArrayList<>();

    public CodebaseProcessor() {
        this(true);
    }

    public CodebaseProcessor(boolean collectMetrics) {
        this(AnalyzerConfig.load(), collectMetrics);
    }

    public CodebaseProcessor(AnalyzerConfig config, boolean collectMetrics) {
        this.translator = new JavaProgramTranslator();
        this.inferrer = new ComplexityInferrer(config);
        this.collectMetrics = collectMetrics;
        this.metricsCollector = collectMetrics ? new MetricsCollector() : null;
    }

    /**
     * Processes all Java files in the given codebase path.
     * Pass 1 parses every file; pass 2 translates and analyzes each top-level class.
     * The report is written to {@value #REPORT_FILE} in the codebase root, the metrics to
     * {@value #METRICS_FILE}.
     *
     * @param codebasePath Path to the root directory of the Java codebase
     * @return Number of files analyzed
     * @throws IOException If the directory cannot be walked or the report cannot be written
     */
    public int processCodebase(Path codebasePath) throws IOException {
        if (!Files.exists(codebasePath)) {
            throw new IOException("Path does not exist: " + codebasePath);
        }
        results.clear();

        if (collectMetrics) {
            metricsCollector.startAnalysis();
        }

        List<Path> javaFiles = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(codebasePath)) {
            paths.filter(Files::isRegularFile)
                 .filter(path -> path.toString().endsWith(".java"))
                 .sorted()
                 .forEach(javaFiles::add);
        }

        logger.info("Found {} Java files. Starting analysis...", javaFiles.size());

        // Pass 1: parse
        Map<Path, CompilationUnit> compilationUnits = new LinkedHashMap<>();
        for (Path javaFile : javaFiles) {
            try {
                ParseResult<CompilationUnit> parsed = translator.getJavaParser().parse(javaFile);
                if (!parsed.isSuccessful()) {
                    throw new IOException("Failed to parse file: " + javaFile + " " + parsed.getProblems());
                }
                CompilationUnit cu = parsed.getResult()
                    .orElseThrow(() -> new IOException("Failed to parse file: " + javaFile));
                compilationUnits.put(javaFile, cu);
                if (collectMetrics) {
                    metricsCollector.recordFile();
                }
            } catch (IOException e) {
                logger.error("Error parsing file: {}", javaFile, e);
                if (collectMetrics) {
                    metricsCollector.recordParseFailure();
                }
            }
        }

        // Pass 2: translate and analyze
        logger.info("Analyzing {} parsed files...", compilationUnits.size());
        int processedCount = 0;
        for (Map.Entry<Path, CompilationUnit> entry : compilationUnits.entrySet()) {
            processFile(entry.getKey(), entry.getValue());
            processedCount++;
        }

        reportWriter.write(results, codebasePath.resolve(REPORT_FILE));

        if (collectMetrics) {
            metricsCollector.endAnalysis();
            metricsCollector.printReport();
            try {
                metricsCollector.exportJSON(codebasePath.resolve(METRICS_FILE));
            } catch (IOException e) {
                logger.error("Failed to export metrics to JSON", e);
            }
        }

        return processedCount;
    }

    private void processFile(Path javaFile, CompilationUnit cu) {
        TranslationResult translation = translator.translate(cu);
        for (Map.Entry<String, Program> program : translation.programs().entrySet()) {
            String className = program.getKey();
            Map<String, String> untranslated = untranslatedMethods(className, translation);
            if (collectMetrics) {
                metricsCollector.recordUntranslated(untranslated.size());
            }
            try {
                Complexity complexity = inferrer.analyze(program.getValue());
                logger.info("{}: {}", className, complexity);
                results.add(new ClassResult(javaFile, className, complexity, untranslated, null));
                if (collectMetrics) {
                    metricsCollector.recordClass(complexity);
                }
            } catch (AnalysisException e) {
                logger.warn("Analysis of {} in {} failed: {}", className, javaFile, e.getMessage());
                results.add(new ClassResult(javaFile, className, null, untranslated, e.getMessage()));
                if (collectMetrics) {
                    metricsCollector.recordFailedClass();
                }
            }
        }
    }

    private static Map<String, String> untranslatedMethods(String className, TranslationResult translation) {
        Map<String, String> untranslated = new LinkedHashMap<>();
        String prefix = className + ".";
        translation.failures().forEach((key, failure) -> {
            if (key.startsWith(prefix)) {
                untranslated.put(key.substring(prefix.length()), failure.getMessage());
            }
        });
        return untranslated;
    }

    /**
     * Results of the last run, in file order.
     */
    public List<ClassResult> getResults() {
        return List.copyOf(results);
    }

    /**
     * Get the metrics collector for external access.
     */
    public MetricsCollector getMetricsCollector() {
        return metricsCollector;
    }
}
