package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.models.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the IS* family, TYPE and ERROR.TYPE.
 */
class InformationFunctionsTest extends FunctionTestSupport {

    @Test
    void testTypePredicates() {
        set("A2", "");
        assertTrue(evalBool("ISNUMBER(1)"));
        assertFalse(evalBool("ISNUMBER(\"1\")"));
        assertTrue(evalBool("ISNUMBER(DATE(2024,1,1))"));
        assertTrue(evalBool("ISTEXT(\"a\")"));
        assertTrue(evalBool("ISNONTEXT(1)"));
        assertTrue(evalBool("ISBLANK(A1)"));
        assertFalse(evalBool("ISBLANK(A2)"));
        assertTrue(evalBool("ISLOGICAL(TRUE)"));
        assertFalse(evalBool("ISLOGICAL(1)"));
    }

    @Test
    void testErrorPredicates() {
        assertTrue(evalBool("ISERROR(1/0)"));
        assertTrue(evalBool("ISERR(1/0)"));
        assertFalse(evalBool("ISERR(NA())"));
        assertTrue(evalBool("ISNA(NA())"));
        assertFalse(evalBool("ISNA(1)"));
        assertEquals(ErrorKind.NOT_AVAILABLE, evalError("NA()"));
    }

    /**
     * Non-integers are truncated before the parity check.
     */
    @Test
    void testParity() {
        assertTrue(evalBool("ISEVEN(4)"));
        assertTrue(evalBool("ISEVEN(2.9)"));
        assertFalse(evalBool("ISEVEN(-3)"));
        assertTrue(evalBool("ISODD(-3)"));
        assertEquals(ErrorKind.VALUE, evalError("ISODD(TRUE)"));
        assertEquals(ErrorKind.VALUE, evalError("ISEVEN(\"x\")"));
    }

    @Test
    void testTypeCodes() {
        assertEquals(1, evalNumber("TYPE(1)"));
        assertEquals(2, evalNumber("TYPE(\"a\")"));
        assertEquals(4, evalNumber("TYPE(TRUE)"));
        assertEquals(16, evalNumber("TYPE(1/0)"));
        assertEquals(64, evalNumber("TYPE(A1:A2)"));
        assertEquals(2, evalNumber("ERROR.TYPE(1/0)"));
        assertEquals(7, evalNumber("ERROR.TYPE(#N/A)"));
        assertEquals(ErrorKind.NOT_AVAILABLE, evalError("ERROR.TYPE(1)"));
    }
}
