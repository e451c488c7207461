package com.complexity.inferrer.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityExpressionTest {

    @Test
    void equalValuesHashAlikeAcrossARoundingBoundary() {
        ComplexityExpression below = ComplexityExpression.of(1.0000004999, 1.0000004999, 0, 0, 1);
        ComplexityExpression above = ComplexityExpression.of(1.0000005001, 1.0000005001, 0, 0, 1);

        assertEquals(below, above);
        assertEquals(below.hashCode(), above.hashCode());

        Set<ComplexityExpression> set = new HashSet<>(List.of(below, above));
        assertEquals(1, set.size());
    }

    @Test
    void labelsCommonGrowthClasses() {
        assertEquals("1", ComplexityExpression.constant().label());
        assertEquals("log n", ComplexityExpression.logarithmic().label());
        assertEquals("log log n", ComplexityExpression.logLog().label());
        assertEquals("n", ComplexityExpression.linear().label());
        assertEquals("n log n", ComplexityExpression.nLogN().label());
        assertEquals("n log^2 n", ComplexityExpression.polyLog(1, 2).label());
        assertEquals("n^2", ComplexityExpression.polynomial(2).label());
        assertEquals("2^n", ComplexityExpression.exponential(2).label());
        assertEquals("n * 2^n", ComplexityExpression.linear().times(ComplexityExpression.exponential(2)).label());
        assertEquals("n^1.58", ComplexityExpression.polynomial(Math.log(3) / Math.log(2)).label());
    }

    @Test
    void bigOWrapsTheLabelAndIgnoresTheCoefficient() {
        assertEquals("O(n)", ComplexityExpression.linear().scale(0.5).bigO());
        assertEquals("0.5 * n", ComplexityExpression.linear().scale(0.5).toString());
    }

    @Test
    void growthOrderComparesBaseThenDegreeThenLogs() {
        List<ComplexityExpression> ascending = List.of(
                ComplexityExpression.constant(),
                ComplexityExpression.logLog(),
                ComplexityExpression.logarithmic(),
                ComplexityExpression.linear(),
                ComplexityExpression.nLogN(),
                ComplexityExpression.polynomial(2),
                ComplexityExpression.exponential(2),
                ComplexityExpression.exponential(3));

        for (int i = 1; i < ascending.size(); i++) {
            assertTrue(ascending.get(i).growsFasterThan(ascending.get(i - 1)),
                    ascending.get(i) + " should outgrow " + ascending.get(i - 1));
        }
    }

    @Test
    void coefficientOnlyBreaksTies() {
        ComplexityExpression half = ComplexityExpression.linear().scale(0.5);

        assertTrue(half.sameGrowth(ComplexityExpression.linear()));
        assertNotEquals(ComplexityExpression.linear(), half);
        assertTrue(ComplexityExpression.linear().compareTo(half) > 0);
        assertEquals(ComplexityExpression.linear(), half.reduce());
    }

    @Test
    void productAddsExponents() {
        ComplexityExpression product = ComplexityExpression.linear().times(ComplexityExpression.logarithmic());

        assertTrue(product.sameGrowth(ComplexityExpression.nLogN()));
        assertEquals(ComplexityExpression.Shape.POLY_LOG, product.getShape());
    }

    @Test
    void sequentialSumKeepsTheDominantClass() {
        ComplexityExpression sum = ComplexityExpression.sumSequential(
                ComplexityExpression.constant(3), ComplexityExpression.linear(), ComplexityExpression.linear());

        assertTrue(sum.sameGrowth(ComplexityExpression.linear()));
        assertEquals(2.0, sum.getCoefficient(), 1e-9);
    }

    @Test
    void constantsAddUp() {
        ComplexityExpression sum = ComplexityExpression.sumSequential(
                ComplexityExpression.constant(2), ComplexityExpression.constant(3));

        assertTrue(sum.isConstant());
        assertEquals(5.0, sum.getCoefficient(), 1e-9);
        assertEquals(ComplexityExpression.constant(), ComplexityExpression.sumSequential(List.of()));
    }

    @Test
    void dominantAndMinPickByGrowth() {
        ComplexityExpression n = ComplexityExpression.linear();
        ComplexityExpression logN = ComplexityExpression.logarithmic();

        assertSame(n, ComplexityExpression.dominant(n, logN));
        assertSame(logN, ComplexityExpression.min(n, logN));
    }

    @Test
    void meanOfTwoBranchesHasTheFasterGrowth() {
        ComplexityExpression mean = ComplexityExpression.mean(ComplexityExpression.constant(),
                ComplexityExpression.linear());

        assertTrue(mean.sameGrowth(ComplexityExpression.linear()));
        assertEquals(0.5, mean.getCoefficient(), 1e-9);
    }

    @Test
    void shapesFollowTheDominantFactor() {
        assertEquals(ComplexityExpression.Shape.CONSTANT, ComplexityExpression.constant(7).getShape());
        assertEquals(ComplexityExpression.Shape.LOG_LOG, ComplexityExpression.logLog().getShape());
        assertEquals(ComplexityExpression.Shape.LOGARITHMIC, ComplexityExpression.logarithmic().getShape());
        assertEquals(ComplexityExpression.Shape.LINEAR, ComplexityExpression.linear().getShape());
        assertEquals(ComplexityExpression.Shape.POLYNOMIAL, ComplexityExpression.polynomial(3).getShape());
        assertEquals(ComplexityExpression.Shape.EXPONENTIAL, ComplexityExpression.exponential(2).getShape());
    }

    @Test
    void rejectsImpossibleTerms() {
        assertThrows(IllegalArgumentException.class, () -> ComplexityExpression.constant(0));
        assertThrows(IllegalArgumentException.class, () -> ComplexityExpression.polynomial(-1));
        assertThrows(IllegalArgumentException.class, () -> ComplexityExpression.exponential(0.5));
    }
}
