package com.sheetcalc.app.models;

import java.util.Objects;

/**
 * Immutable content of a single spreadsheet cell.
 * A value is one of: empty, number, text, boolean, date (serial day number),
 * error, or a formula together with its last computed result.
 */
public final class CellValue {

    private static final CellValue EMPTY = new CellValue(CellValueType.EMPTY, 0, null, false, null, null);
    private static final CellValue TRUE = new CellValue(CellValueType.BOOL, 0, null, true, null, null);
    private static final CellValue FALSE = new CellValue(CellValueType.BOOL, 0, null, false, null, null);

    private final CellValueType type;
    private final double number;
    // text content, or the expression text of a formula
    private final String text;
    private final boolean bool;
    private final ErrorKind error;
    private final CellValue cachedResult;

    private CellValue(CellValueType type, double number, String text, boolean bool,
                      ErrorKind error, CellValue cachedResult) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
        this.cachedResult = cachedResult;
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue number(double value) {
        return new CellValue(CellValueType.NUMBER, value, null, false, null, null);
    }

    public static CellValue text(String value) {
        return new CellValue(CellValueType.TEXT, 0, Objects.requireNonNull(value), false, null, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue date(double serial) {
        return new CellValue(CellValueType.DATE, serial, null, false, null, null);
    }

    public static CellValue error(ErrorKind kind) {
        return new CellValue(CellValueType.ERROR, 0, null, false, Objects.requireNonNull(kind), null);
    }

    /**
     * A formula cell. The expression is stored without a leading '='.
     * cachedResult may be null when the formula has never been calculated.
     */
    public static CellValue formula(String expression, CellValue cachedResult) {
        if (cachedResult != null && cachedResult.isFormula()) {
            throw new IllegalArgumentException("A formula result cannot itself be a formula");
        }
        return new CellValue(CellValueType.FORMULA, 0, Objects.requireNonNull(expression), false, null, cachedResult);
    }

    public CellValueType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == CellValueType.EMPTY;
    }

    public boolean isNumber() {
        return type == CellValueType.NUMBER;
    }

    /** True for numbers and dates, both of which carry a numeric payload. */
    public boolean isNumeric() {
        return type == CellValueType.NUMBER || type == CellValueType.DATE;
    }

    public boolean isText() {
        return type == CellValueType.TEXT;
    }

    public boolean isBool() {
        return type == CellValueType.BOOL;
    }

    public boolean isDate() {
        return type == CellValueType.DATE;
    }

    public boolean isError() {
        return type == CellValueType.ERROR;
    }

    public boolean isFormula() {
        return type == CellValueType.FORMULA;
    }

    public double getNumber() {
        if (!isNumeric()) {
            throw new IllegalStateException("Not a numeric value: " + this);
        }
        return number;
    }

    public String getText() {
        if (type != CellValueType.TEXT) {
            throw new IllegalStateException("Not a text value: " + this);
        }
        return text;
    }

    public boolean getBool() {
        if (type != CellValueType.BOOL) {
            throw new IllegalStateException("Not a boolean value: " + this);
        }
        return bool;
    }

    public ErrorKind getError() {
        if (type != CellValueType.ERROR) {
            throw new IllegalStateException("Not an error value: " + this);
        }
        return error;
    }

    /** Expression text of a formula cell, without the leading '='. */
    public String getFormula() {
        if (type != CellValueType.FORMULA) {
            throw new IllegalStateException("Not a formula: " + this);
        }
        return text;
    }

    /** Last computed result of a formula cell, or null if never calculated. */
    public CellValue getCachedResult() {
        if (type != CellValueType.FORMULA) {
            throw new IllegalStateException("Not a formula: " + this);
        }
        return cachedResult;
    }

    /** Returns a copy of this formula with the given result cached. */
    public CellValue withCachedResult(CellValue result) {
        return formula(getFormula(), result);
    }

    /**
     * The value other cells observe: the cached result for a formula
     * (empty if none yet), otherwise the value itself.
     */
    public CellValue resolved() {
        if (type == CellValueType.FORMULA) {
            return cachedResult == null ? EMPTY : cachedResult;
        }
        return this;
    }

    /**
     * Plain Java representation used in JSON responses:
     * Double, String, Boolean, the error code, or null for empty.
     */
    public Object toDisplayValue() {
        switch (type) {
            case NUMBER:
            case DATE:
                return number;
            case TEXT:
                return text;
            case BOOL:
                return bool;
            case ERROR:
                return error.getCode();
            case FORMULA:
                return resolved().toDisplayValue();
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
            case DATE:
                return Double.compare(number, other.number) == 0;
            case TEXT:
                return text.equals(other.text);
            case BOOL:
                return bool == other.bool;
            case ERROR:
                return error == other.error;
            case FORMULA:
                return text.equals(other.text) && Objects.equals(cachedResult, other.cachedResult);
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error, cachedResult);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return "Number(" + number + ")";
            case DATE:
                return "Date(" + number + ")";
            case TEXT:
                return "Text(\"" + text + "\")";
            case BOOL:
                return "Bool(" + bool + ")";
            case ERROR:
                return "Error(" + error.getCode() + ")";
            case FORMULA:
                return "Formula(=" + text + ", " + cachedResult + ")";
            default:
                return "Empty";
        }
    }
}
