package com.complexity.inferrer.analysis;

import com.complexity.inferrer.ast.Ast;
import com.complexity.inferrer.ast.SourceLocation;
import com.complexity.inferrer.config.AnalyzerConfig;
import com.complexity.inferrer.model.CaseComplexity;
import com.complexity.inferrer.model.ComplexityExpression;
import org.junit.jupiter.api.Test;

import static com.complexity.inferrer.ast.AstFactory.*;
import static org.junit.jupiter.api.Assertions.*;

class CaseAnalyzerTest {

    private final CaseAnalyzer analyzer = new CaseAnalyzer();

    @Test
    void literalBoundsGiveAnExactConstant() {
        CaseComplexity cases = analyzer.analyze(forLoop("i", num(1), num(10), assign("x", ref("i"))));

        assertTrue(cases.getWorst().isConstant());
        assertEquals(10.0, cases.getWorst().getCoefficient(), 1e-9);
        assertFalse(cases.differs());
    }

    @Test
    void literalBoundsBeyondIntRangeKeepTheirValue() {
        CaseComplexity cases = analyzer.analyze(forLoop("i", num(1), num(3_000_000_000d), assign("x", ref("i"))));

        assertTrue(cases.getWorst().isConstant());
        assertEquals(3.0E9, cases.getWorst().getCoefficient(), 1e-3);
    }

    @Test
    void negativeLiteralBoundsCountTheSpan() {
        CaseComplexity cases = analyzer.analyze(forLoop("i", neg(num(5)), num(4), assign("x", ref("i"))));

        assertEquals(10.0, cases.getWorst().getCoefficient(), 1e-9);
    }

    @Test
    void emptyLiteralRangeStillCountsOnce() {
        CaseComplexity cases = analyzer.analyze(forLoop("i", num(5), num(1), assign("x", ref("i"))));

        assertEquals(ComplexityExpression.constant(), cases.getWorst());
    }

    @Test
    void fullRangeLoopIsUniform() {
        CaseComplexity cases = analyzer.analyze(forLoop("i", num(1), ref("n"),
                assign("s", plus(ref("s"), index("a", ref("i"))))));

        assertEquals(ComplexityExpression.linear(), cases.getWorst());
        assertEquals(ComplexityExpression.linear(), cases.getBest());
        assertFalse(cases.differs());
    }

    @Test
    void boundExpressionsScaleTheCount() {
        CaseComplexity square = analyzer.analyze(forLoop("i", num(1), times(ref("n"), ref("n")), call("visit")));
        CaseComplexity half = analyzer.analyze(forLoop("i", num(1), div(ref("n"), num(2)), call("visit")));

        assertTrue(square.getWorst().sameGrowth(ComplexityExpression.polynomial(2)));
        assertTrue(half.getWorst().sameGrowth(ComplexityExpression.linear()));
    }

    @Test
    void flagSetInsideAnIfIsAnEarlyExit() {
        CaseComplexity cases = analyzer.analyze(forLoop("i", num(1), ref("n"),
                ifThen(eq(index("a", ref("i")), ref("x")), assign("found", bool(true)))));

        assertTrue(cases.differs());
        assertEquals(ComplexityExpression.linear(), cases.getWorst());
        assertEquals(ComplexityExpression.constant(), cases.getBest());
        assertTrue(cases.getAverage().sameGrowth(ComplexityExpression.linear()));
        assertEquals(0.5, cases.getAverage().getCoefficient(), 1e-9);
    }

    /** An early-exit {@code if} wrapped in the given number of nested blocks. */
    private static Ast.Stmt buriedExit(int depth) {
        Ast.Stmt stmt = ifThen(eq(index("a", ref("i")), ref("x")), assign("found", bool(true)));
        for (int level = 0; level < depth; level++) {
            stmt = block(stmt);
        }
        return forLoop("i", num(1), ref("n"), stmt);
    }

    @Test
    void earlyExitBelowTheSearchDepthIsIgnored() {
        CaseComplexity cases = analyzer.analyze(buriedExit(12));

        assertFalse(cases.differs());
        assertEquals(ComplexityExpression.linear(), cases.getBest());
    }

    @Test
    void deeperSearchFindsABuriedEarlyExit() {
        CaseAnalyzer deep = new CaseAnalyzer(AnalyzerConfig.builder().maxSearchDepth(20).build());

        CaseComplexity cases = deep.analyze(buriedExit(12));

        assertTrue(cases.differs());
        assertEquals(ComplexityExpression.constant(), cases.getBest());
    }

    @Test
    void overwritingTheControlVariableIsAnEarlyExit() {
        assertTrue(analyzer.hasEarlyExit(
                ifThen(eq(index("a", ref("i")), ref("x")), assign("i", plus(ref("n"), num(1)))), "i"));
        assertFalse(analyzer.hasEarlyExit(
                ifThen(eq(index("a", ref("i")), ref("x")), assign("count", plus(ref("count"), num(1)))), "i"));
    }

    @Test
    void searchingWhileLoopHasConstantBestCase() {
        CaseComplexity cases = analyzer.analyze(whileLoop(le(ref("lo"), ref("hi")),
                varDecl("mid", div(plus(ref("lo"), ref("hi")), num(2))),
                ifElse(eq(index("a", ref("mid")), ref("x")),
                        ret(ref("mid")),
                        ifElse(lt(index("a", ref("mid")), ref("x")),
                                assign("lo", plus(ref("mid"), num(1))),
                                assign("hi", minus(ref("mid"), num(1)))))));

        assertEquals(ComplexityExpression.logarithmic(), cases.getWorst());
        assertEquals(ComplexityExpression.constant(), cases.getBest());
        assertTrue(cases.differs());
    }

    @Test
    void whileLoopWithoutSearchIsUniform() {
        CaseComplexity cases = analyzer.analyze(whileLoop(lt(ref("i"), ref("n")),
                assign("i", plus(ref("i"), num(1)))));

        assertEquals(ComplexityExpression.linear(), cases.getWorst());
        assertFalse(cases.differs());
    }

    @Test
    void repeatRunsAtLeastOnce() {
        CaseComplexity cases = analyzer.analyze(repeatUntil(ge(ref("i"), ref("n")),
                assign("i", times(ref("i"), num(2)))));

        assertEquals(ComplexityExpression.logarithmic(), cases.getWorst());
        assertEquals(ComplexityExpression.constant(), cases.getBest());
        assertEquals(ComplexityExpression.logarithmic(), cases.getAverage());
        assertTrue(cases.differs());
    }

    @Test
    void nonLoopsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(ret()));
    }

    @Test
    void missingBoundIsMalformed() {
        Ast.For loop = new Ast.For("i", null, ref("n"), block(), SourceLocation.UNKNOWN);

        MalformedNodeException error = assertThrows(MalformedNodeException.class, () -> analyzer.analyze(loop));
        assertEquals("FOR", error.getNodeKind());
    }
}
