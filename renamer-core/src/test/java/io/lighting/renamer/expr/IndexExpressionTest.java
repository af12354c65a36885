package io.lighting.renamer.expr;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class IndexExpressionTest {

    @Test
    void evaluatesExplicitAndImplicitMultiplication() {
        assertEquals(11, IndexExpression.compile("2*i+1").applyAsInt(5));
        assertEquals(11, IndexExpression.compile("2i+1").applyAsInt(5));
        assertEquals(10, IndexExpression.compile("i2").applyAsInt(5));
        assertEquals(11, IndexExpression.compile(" 2 * I + 1 ").applyAsInt(5));
    }

    @Test
    void normalizesOnceAtCompileTime() {
        assertEquals("2*i+1", IndexExpression.compile("2i + 1").formula());
        assertEquals("(i*3)/2", IndexExpression.compile("(i3)/2").formula());
    }

    @Test
    void respectsPrecedenceAndParentheses() {
        assertEquals(16, IndexExpression.compile("(i+3)*2").applyAsInt(5));
        assertEquals(4, IndexExpression.compile("i-3/3").applyAsInt(5));
        assertEquals(-5, IndexExpression.compile("-i").applyAsInt(5));
    }

    @Test
    void roundsHalfToEven() {
        assertEquals(2, IndexExpression.compile("i/2").applyAsInt(5));
        assertEquals(4, IndexExpression.compile("i/2").applyAsInt(7));
        assertEquals(2, IndexExpression.compile("i/3").applyAsInt(5));
    }

    @Test
    void resultOutsideIntRangeFallsBackToRawIndex() {
        assertEquals(1, IndexExpression.compile("i*10000000000").applyAsInt(1));
        assertEquals(1, IndexExpression.compile("-i*10000000000").applyAsInt(1));
        assertEquals(2147483647, IndexExpression.compile("i+2147483646").applyAsInt(1));
    }

    @Test
    void fallsBackToRawIndexOnAnyFailure() {
        assertEquals(5, IndexExpression.compile("i+x").applyAsInt(5));
        assertEquals(5, IndexExpression.compile("i/0").applyAsInt(5));
        assertEquals(5, IndexExpression.compile("(i+1").applyAsInt(5));
        assertEquals(5, IndexExpression.compile("i**2").applyAsInt(5));
        assertEquals(5, IndexExpression.compile("").applyAsInt(5));
    }
}
