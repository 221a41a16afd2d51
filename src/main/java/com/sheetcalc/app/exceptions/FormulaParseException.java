package com.sheetcalc.app.exceptions;

/**
 * Thrown when formula text cannot be parsed: an unterminated string,
 * unbalanced parentheses, an unexpected token, or an empty expression.
 * Carries the 0-based offset into the formula text where parsing failed.
 */
public class FormulaParseException extends FormulaEngineException {
    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
