package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Procedure;
import com.complexity.inferrer.ast.Program;
import com.complexity.inferrer.model.ComplexityExpression;
import com.complexity.inferrer.model.RecurrenceRelation;
import com.complexity.inferrer.model.RecurrenceRelation.ReductionType;
import com.complexity.inferrer.model.RecurrenceSolution;
import com.complexity.inferrer.model.RecurrenceSolution.SolutionMethod;
import com.complexity.inferrer.model.RecursionInfo;
import com.complexity.inferrer.model.RecursionInfo.DepthPattern;
import com.complexity.inferrer.model.RecursionInfo.RecursionType;
import com.complexity.inferrer.model.Subproblem;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceSolverTest {

    private final RecurrenceSolver solver = new RecurrenceSolver();

    private RecurrenceSolution solve(int a, int b, ComplexityExpression f, ReductionType type) {
        return solver.solve(new RecurrenceRelation(a, b, f, type));
    }

    @Test
    void halvingWithConstantWorkIsLogarithmic() {
        RecurrenceSolution solution = solve(1, 2, ComplexityExpression.constant(), ReductionType.DIVIDE);

        assertEquals("O(log n)", solution.getLabel());
        assertEquals(SolutionMethod.MASTER_CASE_2, solution.getMethod());
        assertEquals("T(n) = T(n/2) + O(1)", solution.getRelation());
    }

    @Test
    void twoHalvesWithLinearMergeIsNLogN() {
        RecurrenceSolution solution = solve(2, 2, ComplexityExpression.linear(), ReductionType.DIVIDE);

        assertEquals("O(n log n)", solution.getLabel());
        assertEquals(SolutionMethod.MASTER_CASE_2, solution.getMethod());
    }

    @Test
    void dominantRootWorkIsCaseThree() {
        RecurrenceSolution solution = solve(1, 2, ComplexityExpression.linear(), ReductionType.DIVIDE);

        assertEquals("O(n)", solution.getLabel());
        assertEquals(SolutionMethod.MASTER_CASE_3, solution.getMethod());
    }

    @Test
    void dominantLeavesAreCaseOne() {
        RecurrenceSolution karatsuba = solve(3, 2, ComplexityExpression.linear(), ReductionType.DIVIDE);
        RecurrenceSolution four = solve(4, 2, ComplexityExpression.linear(), ReductionType.DIVIDE);

        assertEquals("O(n^1.58)", karatsuba.getLabel());
        assertEquals(SolutionMethod.MASTER_CASE_1, karatsuba.getMethod());
        assertEquals("O(n^2)", four.getLabel());
    }

    @Test
    void logFactorInTheWorkRaisesTheLogPower() {
        RecurrenceSolution solution = solve(2, 2, ComplexityExpression.nLogN(), ReductionType.DIVIDE);

        assertEquals("O(n log^2 n)", solution.getLabel());
        assertEquals(SolutionMethod.MASTER_SPECIAL_LOG, solution.getMethod());
    }

    @Test
    void exponentialWorkDominates() {
        RecurrenceSolution solution = solve(2, 2, ComplexityExpression.exponential(2), ReductionType.DIVIDE);

        assertEquals("O(2^n)", solution.getLabel());
        assertEquals(SolutionMethod.MASTER_CASE_3, solution.getMethod());
    }

    @Test
    void singleSubtractChainIsLinearTimesWork() {
        assertEquals("O(n)", solve(1, 1, ComplexityExpression.constant(), ReductionType.SUBTRACT).getLabel());
        assertEquals("O(n^2)", solve(1, 1, ComplexityExpression.linear(), ReductionType.SUBTRACT).getLabel());
    }

    @Test
    void branchingSubtractIsExponential() {
        RecurrenceSolution solution = solve(2, 1, ComplexityExpression.constant(), ReductionType.SUBTRACT);

        assertEquals("O(2^n)", solution.getLabel());
        assertEquals(SolutionMethod.LINEAR_EXPANSION, solution.getMethod());
        assertEquals("T(n) = 2T(n-1) + O(1)", solution.getRelation());
    }

    @Test
    void criticalExponentSnapsToIntegers() {
        assertEquals(2.0, RecurrenceSolver.criticalExponent(4, 2));
        assertEquals(0.0, RecurrenceSolver.criticalExponent(1, 2));
        assertEquals(1.585, RecurrenceSolver.criticalExponent(3, 2), 1e-3);
    }

    @Test
    void heuristicFollowsTheRecursionShape() {
        RecursionInfo halves = new RecursionInfo(true, RecursionType.DIRECT, 2, List.of("p", "p"),
                DepthPattern.DIVIDE_AND_CONQUER, Subproblem.over(2), false);
        RecursionInfo tree = new RecursionInfo(true, RecursionType.DIRECT, 3, List.of("p", "p", "p"),
                DepthPattern.TREE, Subproblem.minus(1), false);
        RecursionInfo chain = new RecursionInfo(true, RecursionType.DIRECT, 1, List.of("p"),
                DepthPattern.LINEAR, Subproblem.UNKNOWN, false);

        assertEquals("O(n log n)", solver.heuristic(halves).getLabel());
        assertEquals("O(3^n)", solver.heuristic(tree).getLabel());
        assertEquals("O(n)", solver.heuristic(chain).getLabel());
        assertTrue(solver.heuristic(chain).isHeuristic());
    }

    @Test
    void fibonacciUsesItsClosedForm() {
        Procedure fib = Programs.fibonacci("p");
        Program program = Programs.program(fib);
        RecursionAnalyzer analyzer = new RecursionAnalyzer();
        RecursionInfo info = analyzer.analyze(program).get("p");

        RecurrenceSolver.Result result = solver.solve(fib, info, analyzer.recursiveTargets("p"), program);

        assertNull(result.relation());
        assertEquals(SolutionMethod.FIBONACCI_CLOSED_FORM, result.solution().getMethod());
        assertEquals("O(2^n)", result.solution().getLabel());
    }

    @Test
    void singleActiveCallIsNotSolvedAsFibonacci() {
        Procedure step = Programs.alternatingStep("p");
        Program program = Programs.program(step);
        RecursionAnalyzer analyzer = new RecursionAnalyzer();
        RecursionInfo info = analyzer.analyze(program).get("p");

        RecurrenceSolver.Result result = solver.solve(step, info, analyzer.recursiveTargets("p"), program);

        assertNotNull(result.relation());
        assertEquals(1, result.relation().getA());
        assertEquals(ReductionType.SUBTRACT, result.relation().getReductionType());
        assertNotEquals(SolutionMethod.FIBONACCI_CLOSED_FORM, result.solution().getMethod());
        assertEquals("O(n)", result.solution().getLabel());
    }

    @Test
    void mixedShapeWithOneCallFallsBackToTheChain() {
        Procedure step = Programs.alternatingStep("p");
        Program program = Programs.program(step);
        RecursionInfo info = new RecursionInfo(true, RecursionType.DIRECT, 1, List.of("p", "p"),
                DepthPattern.LINEAR, Subproblem.MIXED_CONSTANT_SUBTRACT, false);

        RecurrenceSolver.Result result = solver.solve(step, info, Set.of("p"), program);

        assertNotEquals(SolutionMethod.FIBONACCI_CLOSED_FORM, result.solution().getMethod());
        assertEquals("O(n)", result.solution().getLabel());
    }

    @Test
    void moduloArgumentIsTreatedAsHalving() {
        Procedure gcd = Programs.gcd("p");
        Program program = Programs.program(gcd);
        RecursionAnalyzer analyzer = new RecursionAnalyzer();
        RecursionInfo info = analyzer.analyze(program).get("p");

        RecurrenceSolver.Result result = solver.solve(gcd, info, analyzer.recursiveTargets("p"), program);

        assertEquals(ReductionType.DIVIDE, result.relation().getReductionType());
        assertEquals(2, result.relation().getB());
        assertEquals("O(log n)", result.solution().getLabel());
    }

    @Test
    void mergeWorkComesFromTheCallee() {
        Procedure sort = Programs.mergeSort("p", "q");
        Program program = Programs.program(sort, Programs.merge("q"));
        RecursionAnalyzer analyzer = new RecursionAnalyzer();
        RecursionInfo info = analyzer.analyze(program).get("p");

        RecurrenceSolver.Result result = solver.solve(sort, info, analyzer.recursiveTargets("p"), program);

        assertEquals(new RecurrenceRelation(2, 2, ComplexityExpression.linear(), ReductionType.DIVIDE),
                result.relation());
        assertEquals("O(n log n)", result.solution().getLabel());
    }

    @Test
    void nonRecursiveProcedureGetsAHeuristic() {
        Procedure loops = Programs.nestedLoops("p");
        Program program = Programs.program(loops);
        RecursionInfo info = new RecursionAnalyzer().analyze(program).get("p");

        RecurrenceSolver.Result result = solver.solve(loops, info, Set.of("p"), program);

        assertNull(result.relation());
        assertTrue(result.solution().isHeuristic());
    }

    @Test
    void invalidRelationsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new RecurrenceRelation(0, 2, ComplexityExpression.constant(), ReductionType.DIVIDE));
        assertThrows(IllegalArgumentException.class,
                () -> new RecurrenceRelation(2, 1, ComplexityExpression.constant(), ReductionType.DIVIDE));
    }
}
