package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.FormulaEngine;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;
import com.sheetcalc.app.models.Workbook;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shared fixture for the function tests: a two-sheet workbook and an engine
 * whose clock is pinned to 2024-03-15 10:30 UTC.
 */
abstract class FunctionTestSupport {

    static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);

    protected Workbook workbook;
    protected FormulaEngine engine;

    @BeforeEach
    void setUpWorkbook() {
        workbook = new Workbook();
        workbook.addSheet("Sheet1");
        workbook.addSheet("Data");
        engine = new FormulaEngine(FunctionRegistry.createDefault(), FIXED_CLOCK, 256, false);
    }

    protected void set(String a1, CellValue value) {
        CellAddress address = CellAddress.parse("Sheet1", a1);
        workbook.getSheet("Sheet1").setCell(address.getRow(), address.getCol(), value);
    }

    protected void set(String a1, double number) {
        set(a1, CellValue.number(number));
    }

    protected void set(String a1, String text) {
        set(a1, CellValue.text(text));
    }

    protected CellValue eval(String formula) {
        return engine.evaluateFormula(workbook, "Sheet1", formula);
    }

    protected double evalNumber(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isNumeric(), formula + " gave " + value);
        return value.getNumber();
    }

    protected String evalText(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isText(), formula + " gave " + value);
        return value.getText();
    }

    protected boolean evalBool(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isBool(), formula + " gave " + value);
        return value.getBool();
    }

    protected ErrorKind evalError(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isError(), formula + " gave " + value);
        return value.getError();
    }
}
