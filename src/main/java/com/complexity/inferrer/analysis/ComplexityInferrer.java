package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.model.CaseComplexity;
import com.complexity.inferrer.model.Complexity;
import com.complexity.inferrer.model.PatternClassification;
import com.complexity.inferrer.model.ProcedureAnalysis;
import com.complexity.inferrer.model.RecursionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point of the inference pipeline: recursion analysis, recurrence solving, cost
 * propagation and pattern classification for one program.
 *
 * Every call to {@link #analyze(Program)} builds fresh analyzers and a fresh trace, so an
 * instance can be reused and separate instances can run concurrently on separate programs.
 */
public class ComplexityInferrer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityInferrer.class);

    private final AnalyzerConfig config;
    private final PatternClassifier classifier = new PatternClassifier();

    public ComplexityInferrer(AnalyzerConfig config) {
        this.config = config;
    }

    public ComplexityInferrer() {
        this(AnalyzerConfig.defaults());
    }

    /**
     * Analyzes a whole program.
     *
     * @throws CyclicCallGraphException if the cost walk cannot terminate
     * @throws AnalysisException if the main body itself is malformed
     */
    public Complexity analyze(Program program) {
        DerivationTrace trace = new DerivationTrace();
        RecursionAnalyzer recursionAnalyzer = new RecursionAnalyzer(config);
        Map<String, RecursionInfo> infos = recursionAnalyzer.analyze(program);
        CallGraph callGraph = recursionAnalyzer.getCallGraph();
        logger.debug(callGraph.getStatistics());

        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(program, infos, callGraph, config, trace);
        Map<String, ProcedureAnalysis> procedures = new LinkedHashMap<>();
        for (String name : program.getProcedures().keySet()) {
            ProcedureAnalysis analysis = analyzer.analyzeProcedure(name);
            if (config.isEnablePatterns() && !analysis.isFailed()) {
                analysis = analysis.withClassification(classify(analysis));
            }
            procedures.put(name, analysis);
        }

        CaseComplexity bounds = analyzer.analyzeBody();
        Complexity result = new Complexity(bounds, explain(bounds, procedures), trace.getSteps(), procedures);
        logger.debug("Program analyzed: {}", result);
        return result;
    }

    private PatternClassification classify(ProcedureAnalysis analysis) {
        try {
            return classifier.classify(analysis.getName(), analysis.getRecursionInfo(), analysis.getSolution(),
                    analysis.getRelation());
        } catch (RuntimeException e) {
            logger.warn("Pattern classification of {} failed: {}", analysis.getName(), e.getMessage());
            return null;
        }
    }

    private static String explain(CaseComplexity bounds, Map<String, ProcedureAnalysis> procedures) {
        CaseComplexity reduced = bounds.reduce();
        StringBuilder text = new StringBuilder();
        text.append("Worst case ").append(reduced.getWorst().bigO())
                .append(", best case ").append(reduced.getBest().label())
                .append(", average case ").append(reduced.getAverage().label()).append('.');
        if (reduced.differs()) {
            text.append(" The cases differ because of early exits or data-dependent branches.");
        }
        for (ProcedureAnalysis analysis : procedures.values()) {
            text.append(System.lineSeparator()).append(analysis);
            PatternClassification pattern = analysis.getClassification();
            if (pattern != null && pattern.getPattern() != PatternClassification.AlgorithmPattern.NON_RECURSIVE) {
                text.append(" [").append(pattern).append(']');
            }
        }
        return text.toString();
    }
}
