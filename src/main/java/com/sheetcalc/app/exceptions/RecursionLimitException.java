package com.sheetcalc.app.exceptions;

/**
 * Thrown when nested function, operator or formula-cell evaluation goes
 * deeper than the configured limit. Aborts the whole evaluation call.
 */
public class RecursionLimitException extends FormulaEngineException {
    public RecursionLimitException(int limit) {
        super("Formula nesting exceeds the maximum depth of " + limit);
    }
}
