package com.sheetcalc.app.formula.ast;

import com.sheetcalc.app.models.ErrorKind;

/**
 * An error constant typed into a formula, e.g. #N/A.
 */
public final class ErrorLiteral extends AstNode {
    private final ErrorKind kind;

    public ErrorLiteral(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toFormula() {
        return kind.getCode();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorLiteral && kind == ((ErrorLiteral) o).kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
