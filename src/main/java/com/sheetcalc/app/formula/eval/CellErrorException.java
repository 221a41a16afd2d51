package com.sheetcalc.app.formula.eval;

import com.sheetcalc.app.models.ErrorKind;

/**
 * Raised inside the evaluator when an operand cannot be used (an error
 * operand, or a value that does not coerce). The evaluator turns it back
 * into an error cell value at the nearest operator or function boundary,
 * so it never escapes an evaluation call.
 */
public class CellErrorException extends RuntimeException {
    private final ErrorKind kind;

    public CellErrorException(ErrorKind kind) {
        super(kind.getCode(), null, false, false);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
