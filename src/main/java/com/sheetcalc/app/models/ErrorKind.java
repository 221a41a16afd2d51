package com.sheetcalc.app.models;

/**
 * Spreadsheet error values. These are ordinary cell contents, not exceptions:
 * they flow through arithmetic and function calls like any other value.
 */
public enum ErrorKind {
    NULL("#NULL!", 1),
    DIV_BY_ZERO("#DIV/0!", 2),
    VALUE("#VALUE!", 3),
    REF("#REF!", 4),
    NAME("#NAME?", 5),
    NUM("#NUM!", 6),
    NOT_AVAILABLE("#N/A", 7);

    private final String code;
    private final int typeNumber;

    ErrorKind(String code, int typeNumber) {
        this.code = code;
        this.typeNumber = typeNumber;
    }

    /** Display text, e.g. "#DIV/0!". */
    public String getCode() {
        return code;
    }

    /** Number reported by ERROR.TYPE. */
    public int getTypeNumber() {
        return typeNumber;
    }

    /**
     * Looks up an error by its display text, or returns null if the text is
     * not a known error code.
     */
    public static ErrorKind fromCode(String code) {
        for (ErrorKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) {
                return kind;
            }
        }
        return null;
    }
}
