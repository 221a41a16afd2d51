package com.sheetcalc.app.exceptions;

/**
 * Thrown when a sheet name doesn't exist in the target workbook,
 * e.g. evaluating a formula "in the context of" a missing sheet.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
