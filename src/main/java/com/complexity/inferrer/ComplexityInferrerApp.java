package com.complexity.inferrer;

import com.complexity.inferrer.processor.CodebaseProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Main application entry point for the Complexity Inferrer.
 * Infers worst, best and average case bounds for every method of a Java codebase.
 */
public class ComplexityInferrerApp {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityInferrerApp.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: java -jar complexity-inferrer.jar <path-to-java-sources>");
            System.err.println("Example: java -jar complexity-inferrer.jar /path/to/project/src");
            System.exit(1);
        }

        String codebasePath = args[0];
        logger.info("Starting Complexity Inferrer");
        logger.info("Target codebase: {}", codebasePath);

        try {
            Path path = Paths.get(codebasePath);
            CodebaseProcessor processor = new CodebaseProcessor();

            logger.info("Processing codebase...");
            int processedFiles = processor.processCodebase(path);

            logger.info("Processing complete!");
            logger.info("Total files analyzed: {}", processedFiles);
            logger.info("Report written to {}", path.resolve(CodebaseProcessor.REPORT_FILE));

        } catch (Exception e) {
            logger.error("Error processing codebase", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }
}
