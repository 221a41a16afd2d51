package com.sheetcalc.app.formula.ast;

import com.sheetcalc.app.models.CellAddress;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single-cell reference such as A1, $B$2 or Sheet2!C$3.
 * The sheet is null for references to the formula's own sheet.
 */
public final class CellRef extends AstNode {
    private static final Pattern PLAIN_SHEET_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final String sheet;
    private final int col;
    private final int row;
    private final boolean colAbsolute;
    private final boolean rowAbsolute;

    public CellRef(String sheet, int col, int row, boolean colAbsolute, boolean rowAbsolute) {
        this.sheet = sheet;
        this.col = col;
        this.row = row;
        this.colAbsolute = colAbsolute;
        this.rowAbsolute = rowAbsolute;
    }

    public CellRef(int col, int row) {
        this(null, col, row, false, false);
    }

    public String getSheet() {
        return sheet;
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    public boolean isColAbsolute() {
        return colAbsolute;
    }

    public boolean isRowAbsolute() {
        return rowAbsolute;
    }

    /** Same cell, re-homed onto the given sheet. */
    public CellRef withSheet(String newSheet) {
        return new CellRef(newSheet, col, row, colAbsolute, rowAbsolute);
    }

    /** Resolves the reference, falling back to the given sheet when unqualified. */
    public CellAddress toAddress(String currentSheet) {
        return new CellAddress(sheet == null ? currentSheet : sheet, row, col);
    }

    /** Reference text without any sheet prefix. */
    public String toLocalFormula() {
        return (colAbsolute ? "$" : "") + CellAddress.columnNumberToName(col)
                + (rowAbsolute ? "$" : "") + row;
    }

    /** "Sheet1!" or "'My Sheet'!" for names that need quoting. */
    public static String sheetPrefix(String sheet) {
        if (PLAIN_SHEET_NAME.matcher(sheet).matches()) {
            return sheet + "!";
        }
        return "'" + sheet.replace("'", "''") + "'!";
    }

    @Override
    public String toFormula() {
        return (sheet == null ? "" : sheetPrefix(sheet)) + toLocalFormula();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRef)) {
            return false;
        }
        CellRef that = (CellRef) o;
        return col == that.col && row == that.row
                && colAbsolute == that.colAbsolute && rowAbsolute == that.rowAbsolute
                && Objects.equals(sheet, that.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, col, row, colAbsolute, rowAbsolute);
    }
}
