package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.models.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IF, AND/OR/XOR/NOT and the error-trapping functions.
 */
class LogicalFunctionsTest extends FunctionTestSupport {

    @Test
    void testIf() {
        assertEquals("yes", evalText("IF(TRUE,\"yes\",\"no\")"));
        assertEquals("no", evalText("IF(0,\"yes\",\"no\")"));
        assertFalse(evalBool("IF(FALSE,1)"));
        assertTrue(evalBool("IF(1)"));
        assertEquals(ErrorKind.VALUE, evalError("IF(\"abc\",1,2)"));
        assertEquals(ErrorKind.NOT_AVAILABLE, evalError("IF(NA(),1,2)"));
    }

    /**
     * Only the branch taken is evaluated.
     */
    @Test
    void testIfIsLazy() {
        assertEquals(5, evalNumber("IF(1>2,1/0,5)"));
        assertEquals(1, evalNumber("IF(TRUE,1,UNKNOWNFN())"));
    }

    @Test
    void testAndOrXorNot() {
        assertTrue(evalBool("AND(TRUE,1)"));
        assertFalse(evalBool("AND(TRUE,0)"));
        assertFalse(evalBool("OR(FALSE,0)"));
        assertTrue(evalBool("OR(FALSE,\"true\")"));
        assertTrue(evalBool("XOR(TRUE,TRUE,TRUE)"));
        assertFalse(evalBool("XOR(TRUE,TRUE)"));
        assertTrue(evalBool("NOT(0)"));
        assertTrue(evalBool("TRUE()"));
        assertFalse(evalBool("FALSE()"));
    }

    /**
     * Text in a referenced range is ignored; a range with nothing logical is #VALUE!.
     */
    @Test
    void testLogicalsFromRanges() {
        set("A1", "text");
        set("A2", 1);
        assertTrue(evalBool("AND(A1:A2)"));
        assertEquals(ErrorKind.VALUE, evalError("AND(A1)"));
        assertEquals(ErrorKind.VALUE, evalError("OR(\"maybe\")"));
    }

    @Test
    void testIfErrorAndIfNa() {
        assertEquals("x", evalText("IFERROR(1/0,\"x\")"));
        assertEquals(3, evalNumber("IFERROR(3,\"x\")"));
        assertEquals(0, evalNumber("IFNA(NA(),0)"));
        assertEquals(ErrorKind.DIV_BY_ZERO, evalError("IFNA(1/0,0)"));
    }

    @Test
    void testIfs() {
        assertEquals("b", evalText("IFS(1>2,\"a\",TRUE,\"b\")"));
        assertEquals(ErrorKind.NOT_AVAILABLE, evalError("IFS(FALSE,1)"));
        assertEquals(ErrorKind.VALUE, evalError("IFS(TRUE,1,FALSE)"));
    }

    @Test
    void testSwitch() {
        assertEquals("two", evalText("SWITCH(2,1,\"one\",2,\"two\",\"other\")"));
        assertEquals("other", evalText("SWITCH(9,1,\"one\",\"other\")"));
        assertEquals(ErrorKind.NOT_AVAILABLE, evalError("SWITCH(9,1,\"one\")"));
        assertEquals(2, evalNumber("SWITCH(\"B\",\"a\",1,\"b\",2)"));
        assertEquals(ErrorKind.NOT_AVAILABLE, evalError("SWITCH(1,\"1\",\"text one\")"));
    }
}
