package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.model.CaseComplexity;
import com.complexity.inferrer.model.Complexity;
import com.complexity.inferrer.model.ComplexityExpression;
import com.complexity.inferrer.model.PatternClassification.AlgorithmPattern;
import com.complexity.inferrer.model.ProcedureAnalysis;
import com.complexity.inferrer.model.RecurrenceSolution;
import com.complexity.inferrer.model.RecursionInfo;
import com.complexity.inferrer.model.RecursionInfo.DepthPattern;
import com.complexity.inferrer.model.RecursionInfo.RecursionType;
import com.complexity.inferrer.model.Subproblem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.complexity.inferrer.ast.AstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class ComplexityInferrerTest {

    private final ComplexityInferrer inferrer = new ComplexityInferrer();

    @Test
    void factorialChain() {
        Complexity result = inferrer.analyze(Programs.program(Programs.factorial("p")));
        ProcedureAnalysis p = result.getProcedure("p");

        RecursionInfo info = p.getRecursionInfo();
        assertEquals(RecursionType.DIRECT, info.type());
        assertEquals(1, info.callCount());
        assertEquals(DepthPattern.LINEAR, info.depthPattern());
        assertEquals(Subproblem.Kind.N_MINUS_1, info.subproblem().kind());
        assertEquals("O(n)", p.getSolution().getLabel());
        assertEquals(AlgorithmPattern.FACTORIAL, p.getClassification().getPattern());
    }

    @Test
    void halvedRangeSearch() {
        ProcedureAnalysis p = inferrer.analyze(Programs.program(Programs.binarySearch("p"))).getProcedure("p");

        assertEquals(DepthPattern.DIVIDE_AND_CONQUER, p.getRecursionInfo().depthPattern());
        assertEquals(Subproblem.Kind.N_OVER_K, p.getRecursionInfo().subproblem().kind());
        assertEquals(2, p.getRecursionInfo().subproblem().factor());
        assertEquals("O(log n)", p.getSolution().getLabel());
        assertEquals(AlgorithmPattern.BINARY_SEARCH, p.getClassification().getPattern());
        assertEquals(1.0, p.getClassification().getConfidence(), 1e-9);
    }

    @Test
    void halvesWithMerge() {
        Complexity result = inferrer.analyze(Programs.program(Programs.mergeSort("p", "q"), Programs.merge("q")));
        ProcedureAnalysis p = result.getProcedure("p");

        assertTrue(p.getRecursionInfo().hasCombiningWork());
        assertEquals("O(n log n)", p.getSolution().getLabel());
        assertEquals(AlgorithmPattern.MERGE_SORT, p.getClassification().getPattern());
        assertEquals(AlgorithmPattern.NON_RECURSIVE, result.getProcedure("q").getClassification().getPattern());
    }

    @Test
    void nestedLoopsInTheMainBodyAreQuadratic() {
        Complexity result = inferrer.analyze(Program.of(Programs.nestedLoops("unused").body()));

        assertEquals(ComplexityExpression.polynomial(2), result.getBigO());
        assertEquals("O(n^2)", result.getBigOLabel());
        assertEquals("Θ(n^2)", result.getThetaLabel());
    }

    @Test
    void earlyExitSplitsTheBounds() {
        Program program = Program.of(block(
                varDecl("found", bool(false)),
                forLoop("i", num(1), ref("n"),
                        ifThen(eq(index("a", ref("i")), ref("x")), assign("found", bool(true))))));

        Complexity result = inferrer.analyze(program);

        assertEquals("O(n)", result.getBigOLabel());
        assertEquals("Ω(1)", result.getOmegaLabel());
        assertEquals("Θ(n)", result.getThetaLabel());
        assertTrue(result.getExplanation().contains("The cases differ"));
    }

    @Test
    void mutualRecursionIsLinear() {
        Complexity result = inferrer.analyze(Program.of(block(call("p", ref("n"))),
                Programs.parity("p", "q"), Programs.parity("q", "p")));

        assertEquals(RecursionType.INDIRECT, result.getProcedure("p").getRecursionInfo().type());
        assertEquals("O(n)", result.getProcedure("p").getBigO());
        assertEquals("Θ(n)", result.getThetaLabel());
    }

    @Test
    void everyBoundIsOrdered() {
        Complexity result = inferrer.analyze(Programs.program(
                Programs.factorial("a"), Programs.binarySearch("b"), Programs.mergeSort("c", "d"),
                Programs.merge("d"), Programs.quickSort("e", "f"), Programs.partition("f"), Programs.fibonacci("g"),
                Programs.hanoi("h"), Programs.gcd("i"), Programs.power("j"), Programs.karatsuba("k"),
                Programs.backtracking("l"), Programs.nestedLoops("m")));

        for (ProcedureAnalysis analysis : result.getProcedures().values()) {
            assertFalse(analysis.isFailed(), analysis.getName());
            CaseComplexity bounds = analysis.getBounds();
            assertTrue(bounds.getBest().compareGrowth(bounds.getAverage()) <= 0, analysis.getName());
            assertTrue(bounds.getAverage().compareGrowth(bounds.getWorst()) <= 0, analysis.getName());
            RecurrenceSolution solution = analysis.getSolution();
            if (analysis.getRecursionInfo().recursive()) {
                assertNotNull(solution, analysis.getName());
            }
        }
    }

    @Test
    void repeatedAnalysisGivesTheSameResult() {
        Program program = Program.of(block(call("s", ref("a"), num(0), ref("n"))),
                Programs.mergeSort("s", "m"), Programs.merge("m"));

        Complexity first = inferrer.analyze(program);
        Complexity second = inferrer.analyze(program);

        assertEquals(first, second);
        assertEquals(first.getSteps(), second.getSteps());
        assertFalse(first.getSteps().isEmpty());
    }

    @Test
    void failedProcedureDoesNotStopTheOthers() {
        Complexity result = inferrer.analyze(Programs.program(
                procedure("bad", List.of(), assign(num(1), num(2))),
                Programs.fibonacci("fib")));

        assertTrue(result.getProcedure("bad").isFailed());
        assertNull(result.getProcedure("bad").getClassification());
        assertEquals("O(2^n)", result.getProcedure("fib").getBigO());
        assertTrue(result.getExplanation().contains("bad: O(?)"));
    }

    @Test
    void patternsCanBeDisabled() {
        ComplexityInferrer plain = new ComplexityInferrer(AnalyzerConfig.builder().enablePatterns(false).build());

        Complexity result = plain.analyze(Programs.program(Programs.fibonacci("p")));

        assertNull(result.getProcedure("p").getClassification());
        assertEquals("O(2^n)", result.getProcedure("p").getBigO());
    }

    @Test
    void emptyProgramIsConstant() {
        Complexity result = inferrer.analyze(Program.of(block()));

        assertEquals("O(1)", result.getBigOLabel());
        assertTrue(result.getProcedures().isEmpty());
    }
}
