package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for COUNTIF-style criteria and wildcard matching.
 */
class CriteriaTest {

    @Test
    void testNumericComparisons() {
        Criteria greater = Criteria.parse(">5");
        assertTrue(greater.matches(CellValue.number(6)));
        assertFalse(greater.matches(CellValue.number(5)));
        assertTrue(greater.matches(CellValue.text("7")));
        assertFalse(greater.matches(CellValue.text("seven")));

        assertTrue(Criteria.parse("<=5").matches(CellValue.number(5)));
        assertTrue(Criteria.parse("<>5").matches(CellValue.text("x")));
        assertTrue(Criteria.of(CellValue.number(3)).matches(CellValue.number(3)));
    }

    @Test
    void testTextEquality() {
        Criteria apple = Criteria.parse("apple");
        assertTrue(apple.matches(CellValue.text("APPLE")));
        assertFalse(apple.matches(CellValue.text("apples")));
        assertFalse(apple.matches(CellValue.number(1)));
        assertTrue(Criteria.parse("<>apple").matches(CellValue.text("pear")));
        assertTrue(Criteria.parse("<b").matches(CellValue.text("Apple")));
    }

    /**
     * An empty operand tests for blank cells.
     */
    @Test
    void testBlankCriteria() {
        assertTrue(Criteria.parse("").matches(CellValue.empty()));
        assertTrue(Criteria.parse("=").matches(CellValue.text("")));
        assertFalse(Criteria.parse("=").matches(CellValue.number(0)));
        assertTrue(Criteria.parse("<>").matches(CellValue.number(0)));
        assertFalse(Criteria.parse("<>").matches(CellValue.empty()));
    }

    @Test
    void testBooleansAndErrors() {
        assertTrue(Criteria.of(CellValue.bool(true)).matches(CellValue.bool(true)));
        assertFalse(Criteria.parse("TRUE").matches(CellValue.bool(false)));
        assertTrue(Criteria.parse("#N/A").matches(CellValue.error(ErrorKind.NOT_AVAILABLE)));
        assertFalse(Criteria.parse(">0").matches(CellValue.error(ErrorKind.DIV_BY_ZERO)));
    }

    @Test
    void testWildcards() {
        assertTrue(Criteria.wildcardMatch("ap*", "Apricot"));
        assertTrue(Criteria.wildcardMatch("*", ""));
        assertTrue(Criteria.wildcardMatch("?at", "cat"));
        assertFalse(Criteria.wildcardMatch("?at", "at"));
        assertTrue(Criteria.wildcardMatch("a*c*e", "abcde"));
        assertTrue(Criteria.wildcardMatch("what~?", "What?"));
        assertFalse(Criteria.wildcardMatch("what~?", "whats"));
        assertTrue(Criteria.wildcardMatch("~*", "*"));
        assertTrue(Criteria.hasWildcards("a?"));
        assertFalse(Criteria.hasWildcards("plain"));
    }
}
