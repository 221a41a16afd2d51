package com.sheetcalc.app.exceptions;

/**
 * Thrown when a user supplies a cell address that is not a valid
 * A1-style reference, e.g. "1A" or "ZZZZ1".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
