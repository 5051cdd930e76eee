package com.portablespreadsheet.app.operations;

import com.portablespreadsheet.app.exceptions.InvalidTypeException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CellValuesTest {

    @Test
    void testIntegralArithmeticStaysIntegral() {
        assertEquals(12, CellValues.add(5, 7));
        assertEquals(-2, CellValues.subtract(5, 7));
        assertEquals(35, CellValues.multiply(5, 7));
        assertEquals(12L, CellValues.add(5L, 7));
        assertEquals(5_000_000_000L, CellValues.multiply(50_000, 100_000));
    }

    @Test
    void testIntegralOverflowFallsBackToDouble() {
        assertEquals(2_147_483_648L, CellValues.add(Integer.MAX_VALUE, 1));
        assertEquals(0x1p63, CellValues.add(Long.MAX_VALUE, 1));
        assertEquals(-0x1p63, CellValues.subtract(Long.MIN_VALUE, 1));
        assertEquals(0x1p64, CellValues.multiply(Long.MIN_VALUE, -2));
        assertEquals(0x1p63, CellValues.abs(Long.MIN_VALUE));
        assertEquals(0x1p64, CellValues.sum(List.<Object>of(Long.MAX_VALUE, Long.MAX_VALUE, 2L)));
        assertEquals(1.0e25, CellValues.product(List.<Object>of(100_000, 100_000, 100_000, 100_000, 100_000)));
    }

    @Test
    void testFloatingOperandGivesDouble() {
        assertEquals(7.5, CellValues.add(5, 2.5));
        assertEquals(2.5, CellValues.divide(5, 2));
        assertEquals(2.0, CellValues.divide(4, 2));
    }

    @Test
    void testModulo() {
        assertEquals(1, CellValues.modulo(7, 3));
        assertEquals(2, CellValues.modulo(-7, 3));
        assertEquals(-2, CellValues.modulo(7, -3));
        assertEquals(1.5, CellValues.modulo(7.5, 3));
        assertThrows(InvalidTypeException.class, () -> CellValues.modulo(7, 0));
    }

    @Test
    void testPower() {
        assertEquals(1024, CellValues.power(2, 10));
        assertEquals(0.5, CellValues.power(2, -1));
        assertEquals(2.25, CellValues.power(1.5, 2));
    }

    @Test
    void testComparisons() {
        assertEquals(true, CellValues.equalTo(2, 2.0));
        assertEquals(false, CellValues.notEqualTo("a", "a"));
        assertEquals(true, CellValues.lessThan("apple", "banana"));
        assertEquals(true, CellValues.greaterThanOrEqualTo(3, 3));
        assertThrows(InvalidTypeException.class, () -> CellValues.greaterThan("3", 2));
    }

    @Test
    void testTruthiness() {
        assertFalse(CellValues.isTruthy(null));
        assertFalse(CellValues.isTruthy(0));
        assertFalse(CellValues.isTruthy(""));
        assertTrue(CellValues.isTruthy("no"));
        assertEquals(true, CellValues.logicalDisjunction(0, 2.5));
        assertEquals(false, CellValues.logicalConjunction(true, 0));
    }

    @Test
    void testConcatenate() {
        assertEquals("a1", CellValues.concatenate("a", 1));
        assertEquals("2.5", CellValues.concatenate(null, 2.5));
    }

    @Test
    void testTextIsNotANumber() {
        assertThrows(InvalidTypeException.class, () -> CellValues.add("1", 2));
        assertThrows(InvalidTypeException.class, () -> CellValues.sqrt("four"));
        assertThrows(InvalidTypeException.class, () -> CellValues.sum(Arrays.<Object>asList(1, null)));
    }

    @Test
    void testAggregates() {
        List<Object> values = List.of(3, 1, 4, 1, 5);

        assertEquals(14, CellValues.sum(values));
        assertEquals(60, CellValues.product(values));
        assertEquals(2.8, (Double) CellValues.mean(values), 1e-12);
        assertEquals(1, CellValues.minimum(values));
        assertEquals(5, CellValues.maximum(values));
        assertEquals(3.0, CellValues.median(values));
        assertEquals(5, CellValues.count(values));
        assertEquals(Math.sqrt(2.56), (Double) CellValues.stdev(values), 1e-12);
    }

    @Test
    void testMinimumKeepsTheMemberType() {
        assertEquals(0.5, CellValues.minimum(List.of(2, 0.5, 7)));
    }

    @Test
    void testIrr() {
        assertEquals(0.28095, (Double) CellValues.irr(List.of(-100, 39, 59, 55, 20)), 1e-5);
        assertEquals(0.0, (Double) CellValues.irr(List.of(-100, 50, 50)), 1e-9);
        assertTrue(((Double) CellValues.irr(List.of(-1, -2))).isNaN());
    }

    @Test
    void testMatchNegativeBeforePositive() {
        assertEquals(3, CellValues.matchNegativeBeforePositive(List.of(-5, -1, -0.5, 0, 4)));
        assertEquals(0, CellValues.matchNegativeBeforePositive(List.of(-5, -1)));
    }

    @Test
    void testToIndex() {
        assertEquals(3, CellValues.toIndex(3.0, "offset"));
        assertThrows(InvalidTypeException.class, () -> CellValues.toIndex(1.5, "offset"));
        assertThrows(InvalidTypeException.class, () -> CellValues.toIndex("x", "offset"));
    }
}
