package com.sheetcalc.app.formula.eval;

import com.sheetcalc.app.exceptions.RecursionLimitException;
import com.sheetcalc.app.exceptions.UnknownFunctionException;
import com.sheetcalc.app.formula.functions.FunctionRegistry;
import com.sheetcalc.app.formula.parser.FormulaParser;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Evaluator: operator semantics, coercion, error propagation
 * and the nesting limit. Cells are supplied through a hand-filled snapshot.
 */
class EvaluatorTest {

    private Evaluator evaluator;
    private CellSnapshot snapshot;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        evaluator = new Evaluator(FunctionRegistry.createDefault());
        snapshot = CellSnapshot.of(Arrays.asList("Sheet1", "Sheet2"));
        context = new EvaluationContext("Sheet1", snapshot);
    }

    private void put(String sheet, String a1, CellValue value) {
        snapshot.put(CellAddress.parse(sheet, a1), value);
    }

    private CellValue eval(String formula) {
        return evaluator.evaluate(FormulaParser.parse(formula), context);
    }

    private static String nested(String function, int depth, String innermost) {
        StringBuilder sb = new StringBuilder("=");
        for (int i = 0; i < depth; i++) {
            sb.append(function).append('(');
        }
        sb.append(innermost);
        for (int i = 0; i < depth; i++) {
            sb.append(')');
        }
        return sb.toString();
    }

    /**
     * Operands are coerced to numbers: numeric text parses, booleans are 1/0, blanks are 0.
     */
    @Test
    void testArithmeticCoercion() {
        assertEquals(CellValue.number(5), eval("=\"3\"+2"));
        assertEquals(CellValue.number(2), eval("=TRUE+1"));
        assertEquals(CellValue.number(1), eval("=A1+1"));
        assertEquals(CellValue.number(0), eval("=+A1"));
        assertEquals(CellValue.error(ErrorKind.VALUE), eval("=\"a\"+1"));
        assertEquals(CellValue.error(ErrorKind.VALUE), eval("=-\"x\""));
    }

    @Test
    void testArithmeticResults() {
        assertEquals(CellValue.number(4), eval("=-2^2"));
        assertEquals(CellValue.number(64), eval("=2^3^2"));
        assertEquals(CellValue.number(0.1), eval("=10%"));
        assertEquals(CellValue.number(7), eval("=1+2*3"));
        assertEquals(CellValue.error(ErrorKind.DIV_BY_ZERO), eval("=1/0"));
        assertEquals(CellValue.error(ErrorKind.DIV_BY_ZERO), eval("=0^-1"));
        assertEquals(CellValue.error(ErrorKind.NUM), eval("=(-8)^(1/3)"));
        assertEquals(CellValue.error(ErrorKind.NUM), eval("=1E308*10"));
    }

    /**
     * Numbers sort before text, text before booleans; text compares ignoring case.
     */
    @Test
    void testComparison() {
        assertEquals(CellValue.bool(true), eval("=\"abc\"=\"ABC\""));
        assertEquals(CellValue.bool(true), eval("=1<\"a\""));
        assertEquals(CellValue.bool(true), eval("=\"a\"<TRUE"));
        assertEquals(CellValue.bool(false), eval("=2<>2"));
        assertEquals(CellValue.bool(true), eval("=\"b\">=\"A\""));
    }

    @Test
    void testBlankComparesAsTheOtherType() {
        assertEquals(CellValue.bool(true), eval("=A1=0"));
        assertEquals(CellValue.bool(true), eval("=A1=\"\""));
        assertEquals(CellValue.bool(true), eval("=A1=FALSE"));
    }

    @Test
    void testConcatenation() {
        assertEquals(CellValue.text("12"), eval("=1&2"));
        assertEquals(CellValue.text("0.3"), eval("=0.1+0.2&\"\""));
        assertEquals(CellValue.text("0.333333333333333"), eval("=1/3&\"\""));
        assertEquals(CellValue.text("TRUEx"), eval("=TRUE&\"x\""));
        assertEquals(CellValue.text("a"), eval("=\"a\"&A1"));
    }

    @Test
    void testErrorPropagation() {
        assertEquals(CellValue.error(ErrorKind.NOT_AVAILABLE), eval("=#N/A+1"));
        assertEquals(CellValue.error(ErrorKind.REF), eval("=1+#REF!"));
        assertEquals(CellValue.error(ErrorKind.DIV_BY_ZERO), eval("=(1/0)&\"x\""));
        put("Sheet1", "B1", CellValue.error(ErrorKind.NUM));
        assertEquals(CellValue.error(ErrorKind.NUM), eval("=B1*2"));
    }

    @Test
    void testReferences() {
        put("Sheet1", "A1", CellValue.number(5));
        put("Sheet2", "A1", CellValue.number(7));
        assertEquals(CellValue.number(5), eval("=A1"));
        assertEquals(CellValue.number(14), eval("=sheet2!A1*2"));
        assertEquals(CellValue.error(ErrorKind.REF), eval("=Nope!A1"));
        assertEquals(CellValue.error(ErrorKind.VALUE), eval("=A1:A2"));
        assertEquals(CellValue.error(ErrorKind.VALUE), eval("=A1:A2+1"));
        assertTrue(eval("=C9").isEmpty());
    }

    /**
     * A referenced formula cell is computed on demand and its result remembered.
     */
    @Test
    void testReferencedFormulaIsComputed() {
        put("Sheet1", "A1", CellValue.number(5));
        put("Sheet1", "A2", CellValue.formula("A1+1", null));
        put("Sheet1", "A3", CellValue.formula("Z99", null));

        assertEquals(CellValue.number(12), eval("=A2*2"));
        assertEquals(CellValue.number(6), snapshot.get(CellAddress.parse("Sheet1", "A2")));
        assertEquals(CellValue.number(0), eval("=A3"));
    }

    @Test
    void testFunctionLookup() {
        assertEquals(CellValue.number(3), eval("=sum(1,2)"));
        assertEquals(CellValue.error(ErrorKind.NAME), eval("=FOO(1)"));
        assertEquals(CellValue.error(ErrorKind.VALUE), eval("=ABS()"));
        assertEquals(CellValue.error(ErrorKind.VALUE), eval("=ABS(1,2)"));

        Evaluator strict = new Evaluator(FunctionRegistry.createDefault(), true);
        UnknownFunctionException e = assertThrows(UnknownFunctionException.class,
                () -> strict.evaluate(FormulaParser.parse("=FOO(1)"), context));
        assertEquals("FOO", e.getFunctionName());
    }

    /**
     * 256 levels of nesting evaluate; the 257th throws.
     */
    @Test
    void testNestingLimit() {
        assertEquals(CellValue.bool(true), eval(nested("NOT", 256, "TRUE")));
        assertEquals(0, context.getDepth());
        assertThrows(RecursionLimitException.class, () -> eval(nested("NOT", 257, "TRUE")));
    }

    @Test
    void testChainedFormulaCellsCountTowardsTheLimit() {
        put("Sheet1", "A1", CellValue.number(1));
        for (int row = 2; row <= 300; row++) {
            put("Sheet1", "A" + row, CellValue.formula("A" + (row - 1) + "+1", null));
        }
        assertThrows(RecursionLimitException.class, () -> eval("=A300"));
    }

    @Test
    void testToCellResult() {
        assertEquals(CellValue.number(0), Evaluator.toCellResult(CellValue.empty()));
        assertEquals(CellValue.text(""), Evaluator.toCellResult(CellValue.text("")));
        assertEquals(CellValue.number(3), Evaluator.toCellResult(CellValue.formula("1+2", CellValue.number(3))));
    }
}
