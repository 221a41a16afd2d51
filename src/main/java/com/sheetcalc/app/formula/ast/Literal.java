package com.sheetcalc.app.formula.ast;

import com.sheetcalc.app.models.CellValue;

import java.util.Objects;

/**
 * A number, text or boolean constant written directly in a formula.
 */
public final class Literal extends AstNode {
    private final CellValue value;

    private Literal(CellValue value) {
        this.value = value;
    }

    public static Literal number(double value) {
        return new Literal(CellValue.number(value));
    }

    public static Literal text(String value) {
        return new Literal(CellValue.text(value));
    }

    public static Literal bool(boolean value) {
        return new Literal(CellValue.bool(value));
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public String toFormula() {
        if (value.isText()) {
            return "\"" + value.getText().replace("\"", "\"\"") + "\"";
        }
        if (value.isBool()) {
            return value.getBool() ? "TRUE" : "FALSE";
        }
        double n = value.getNumber();
        if (n == Math.rint(n) && Math.abs(n) < 1e15) {
            return Long.toString((long) n);
        }
        return Double.toString(n);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Literal && value.equals(((Literal) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }
}
