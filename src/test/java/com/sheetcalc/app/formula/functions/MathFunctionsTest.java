package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the math functions, evaluated through the engine.
 */
class MathFunctionsTest extends FunctionTestSupport {

    /**
     * Text and booleans inside a range are skipped; passed directly they are coerced.
     */
    @Test
    void testSumCoercion() {
        set("A1", 1);
        set("A2", "x");
        set("A3", CellValue.bool(true));
        set("A4", "7");

        assertEquals(6, evalNumber("SUM(1,2,3)"));
        assertEquals(1, evalNumber("SUM(A1:A4)"));
        assertEquals(5, evalNumber("SUM(\"2\",3)"));
        assertEquals(2, evalNumber("SUM(TRUE,1)"));
        assertEquals(0, evalNumber("SUM(B1:B5)"));
        assertEquals(ErrorKind.VALUE, evalError("SUM(\"abc\")"));
    }

    @Test
    void testSumPropagatesErrorsFromRanges() {
        set("A1", 1);
        set("A2", CellValue.error(ErrorKind.DIV_BY_ZERO));
        assertEquals(ErrorKind.DIV_BY_ZERO, evalError("SUM(A1:A2)"));
        assertEquals(ErrorKind.REF, evalError("SUM(Missing!A1:A2)"));
    }

    @Test
    void testProduct() {
        assertEquals(24, evalNumber("PRODUCT(2,3,4)"));
        assertEquals(0, evalNumber("PRODUCT(B1:B3)"));
    }

    @Test
    void testRounding() {
        assertEquals(3, evalNumber("ROUND(2.5,0)"));
        assertEquals(-3, evalNumber("ROUND(-2.5,0)"));
        assertEquals(3.14, evalNumber("ROUND(3.14159,2)"));
        assertEquals(1200, evalNumber("ROUND(1234.5678,-2)"));
        assertEquals(1.3, evalNumber("ROUNDUP(1.21,1)"));
        assertEquals(-1.2, evalNumber("ROUNDDOWN(-1.29,1)"));
        assertEquals(-3, evalNumber("INT(-2.5)"));
    }

    /**
     * MOD takes the sign of the divisor.
     */
    @Test
    void testModAndQuotient() {
        assertEquals(1, evalNumber("MOD(-3,2)"));
        assertEquals(-1, evalNumber("MOD(3,-2)"));
        assertEquals(ErrorKind.DIV_BY_ZERO, evalError("MOD(5,0)"));
        assertEquals(-3, evalNumber("QUOTIENT(-7,2)"));
        assertEquals(ErrorKind.DIV_BY_ZERO, evalError("QUOTIENT(1,0)"));
    }

    @Test
    void testPowersAndRoots() {
        assertEquals(8, evalNumber("POWER(2,3)"));
        assertEquals(ErrorKind.DIV_BY_ZERO, evalError("POWER(0,-1)"));
        assertEquals(3, evalNumber("SQRT(9)"));
        assertEquals(ErrorKind.NUM, evalError("SQRT(-1)"));
        assertEquals(1, evalNumber("EXP(0)"));
        assertEquals(2, evalNumber("LOG(100)"), 1e-12);
        assertEquals(3, evalNumber("LOG(8,2)"), 1e-12);
        assertEquals(3, evalNumber("LOG10(1000)"), 1e-12);
        assertEquals(ErrorKind.NUM, evalError("LN(0)"));
        assertEquals(ErrorKind.DIV_BY_ZERO, evalError("LOG(5,1)"));
    }

    @Test
    void testCeilingAndFloor() {
        assertEquals(3, evalNumber("CEILING(2.5,1)"));
        assertEquals(4.5, evalNumber("CEILING(4.2,0.5)"));
        assertEquals(0, evalNumber("CEILING(4.2,0)"));
        assertEquals(ErrorKind.NUM, evalError("CEILING(2.5,-1)"));
        assertEquals(2, evalNumber("FLOOR(2.5,1)"));
        assertEquals(ErrorKind.DIV_BY_ZERO, evalError("FLOOR(2.5,0)"));
    }

    @Test
    void testMiscellaneous() {
        assertEquals(120, evalNumber("FACT(5)"));
        assertEquals(1, evalNumber("FACT(0)"));
        assertEquals(ErrorKind.NUM, evalError("FACT(-1)"));
        assertEquals(-1, evalNumber("SIGN(-4)"));
        assertEquals(4, evalNumber("ABS(-4)"));
        assertEquals(Math.PI, evalNumber("PI()"));
    }

    @Test
    void testRandomFunctions() {
        for (int i = 0; i < 20; i++) {
            double r = evalNumber("RAND()");
            assertTrue(r >= 0 && r < 1);
            double n = evalNumber("RANDBETWEEN(1,3)");
            assertTrue(n == 1 || n == 2 || n == 3);
        }
        assertEquals(ErrorKind.NUM, evalError("RANDBETWEEN(5,1)"));
    }

    @Test
    void testRandBetweenBoundsBeyondExactIntegers() {
        assertEquals(ErrorKind.NUM, evalError("RANDBETWEEN(1,1E300)"));
        assertEquals(ErrorKind.NUM, evalError("RANDBETWEEN(-1E300,1)"));
        double n = evalNumber("RANDBETWEEN(-1E15,1E15)");
        assertTrue(n >= -1e15 && n <= 1e15);
        assertEquals(n, Math.floor(n));
    }

    @Test
    void testSumIf() {
        set("A1", 1);
        set("A2", 2);
        set("A3", 3);
        set("A4", 4);
        set("B1", "apple");
        set("B2", "pear");
        set("B3", "Apple");
        set("B4", "plum");

        assertEquals(7, evalNumber("SUMIF(A1:A4,\">2\")"));
        assertEquals(4, evalNumber("SUMIF(B1:B4,\"apple\",A1:A4)"));
        assertEquals(6, evalNumber("SUMIF(B1:B4,\"p*\",A1:A4)"));
        assertEquals(2, evalNumber("SUMIF(A1:A4,2)"));
    }

    @Test
    void testSumIfs() {
        set("A1", 1);
        set("A2", 2);
        set("A3", 3);
        set("B1", "a1");
        set("B2", "a2");
        set("B3", "b3");
        set("C1", 10);
        set("C2", 20);
        set("C3", 30);

        assertEquals(20, evalNumber("SUMIFS(C1:C3,B1:B3,\"a*\",A1:A3,\">1\")"));
        assertEquals(60, evalNumber("SUMIFS(C1:C3,A1:A3,\"<>0\")"));
        assertEquals(ErrorKind.VALUE, evalError("SUMIFS(C1:C3,A1:A3,\">1\",B1:B3)"));
        assertEquals(ErrorKind.VALUE, evalError("SUMIFS(C1:C3,A1:A2,\">1\")"));
    }

    @Test
    void testSumProduct() {
        set("A1", 1);
        set("A2", 2);
        set("B1", 3);
        set("B2", 4);
        assertEquals(11, evalNumber("SUMPRODUCT(A1:A2,B1:B2)"));
        assertEquals(ErrorKind.VALUE, evalError("SUMPRODUCT(A1:A2,B1:B1)"));
    }
}
