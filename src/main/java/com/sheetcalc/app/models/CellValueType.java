package com.sheetcalc.app.models;

/**
 * Enumerates the kinds of value a cell can hold.
 */
public enum CellValueType {
    EMPTY,
    NUMBER,
    TEXT,
    BOOL,
    DATE,
    ERROR,
    FORMULA
}
