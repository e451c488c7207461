package com.complexity.inferrer.processor;

import com.complexity.inferrer.model.CaseComplexity;
import com.complexity.inferrer.model.Complexity;
import com.complexity.inferrer.model.PatternClassification;
import com.complexity.inferrer.model.ProcedureAnalysis;
import com.complexity.inferrer.model.RecurrenceSolution;
import com.complexity.inferrer.model.RecursionInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the per-class, per-procedure analysis results as a JSON document.
 */
public class AnalysisReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisReportWriter.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public void write(List<ClassResult> results, Path outputPath) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), toJson(results));
        logger.info("Analysis report exported to: {}", outputPath);
    }

    public ObjectNode toJson(List<ClassResult> results) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode classes = root.putArray("classes");
        for (ClassResult result : results) {
            classes.add(classNode(result));
        }
        return root;
    }

    private ObjectNode classNode(ClassResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("class", result.className());
        node.put("file", result.file() == null ? null : result.file().toString());
        if (result.isFailed()) {
            node.put("error", result.error());
        }
        Complexity complexity = result.complexity();
        if (complexity != null) {
            node.put("bigO", complexity.getBigOLabel());
            node.put("omega", complexity.getOmegaLabel());
            node.put("theta", complexity.getThetaLabel());
            ObjectNode procedures = node.putObject("procedures");
            complexity.getProcedures().forEach((name, analysis) -> procedures.set(name, procedureNode(analysis)));
        }
        if (!result.untranslated().isEmpty()) {
            ObjectNode untranslated = node.putObject("untranslated");
            result.untranslated().forEach(untranslated::put);
        }
        return node;
    }

    private ObjectNode procedureNode(ProcedureAnalysis analysis) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("bigO", analysis.getBigO());

        RecursionInfo info = analysis.getRecursionInfo();
        if (info != null) {
            ObjectNode recursion = node.putObject("recursion");
            recursion.put("recursive", info.recursive());
            recursion.put("type", info.type().name());
            recursion.put("callCount", info.callCount());
            recursion.put("depthPattern", info.depthPattern().name());
            recursion.put("subproblem", info.subproblem().toString());
            recursion.put("combiningWork", info.hasCombiningWork());
            ArrayNode callsTo = recursion.putArray("callsTo");
            info.callsTo().forEach(callsTo::add);
        }
        if (analysis.getRelation() != null) {
            node.put("relation", analysis.getRelation().toString());
        }
        RecurrenceSolution solution = analysis.getSolution();
        if (solution != null) {
            ObjectNode solved = node.putObject("solution");
            solved.put("complexity", solution.getLabel());
            solved.put("method", solution.getMethod().name());
            solved.put("explanation", solution.getExplanation());
        }
        CaseComplexity bounds = analysis.getBounds();
        if (bounds != null) {
            CaseComplexity reduced = bounds.reduce();
            ObjectNode cases = node.putObject("bounds");
            cases.put("worst", reduced.getWorst().label());
            cases.put("best", reduced.getBest().label());
            cases.put("average", reduced.getAverage().label());
            cases.put("casesDiffer", reduced.differs());
        }
        PatternClassification pattern = analysis.getClassification();
        if (pattern != null) {
            ObjectNode classified = node.putObject("pattern");
            classified.put("name", pattern.getPattern().getDisplayName());
            classified.put("complexity", pattern.getComplexity());
            classified.put("confidence", pattern.getConfidence());
            classified.put("rationale", pattern.getRationale());
        }
        if (analysis.isFailed()) {
            node.put("diagnostic", analysis.getDiagnostic());
        }
        return node;
    }
}
