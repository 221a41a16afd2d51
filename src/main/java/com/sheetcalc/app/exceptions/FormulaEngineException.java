package com.sheetcalc.app.exceptions;

/**
 * Base class of the engine-level failures that abort an evaluateFormula or
 * calculateAll call. Spreadsheet errors such as #DIV/0! are cell values,
 * never exceptions.
 */
public abstract class FormulaEngineException extends RuntimeException {
    protected FormulaEngineException(String message) {
        super(message);
    }
}
