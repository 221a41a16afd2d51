package com.sheetcalc.app.formula.ast;

import java.util.Objects;

/**
 * A rectangular range such as A1:B10. Both corners live on the same sheet;
 * the sheet, if any, is carried by the start corner.
 */
public final class RangeRef extends AstNode {
    private final CellRef start;
    private final CellRef end;

    public RangeRef(CellRef start, CellRef end) {
        this.start = start;
        this.end = end.getSheet() == null ? end : end.withSheet(null);
    }

    public CellRef getStart() {
        return start;
    }

    public CellRef getEnd() {
        return end;
    }

    public String getSheet() {
        return start.getSheet();
    }

    public int getFirstRow() {
        return Math.min(start.getRow(), end.getRow());
    }

    public int getLastRow() {
        return Math.max(start.getRow(), end.getRow());
    }

    public int getFirstCol() {
        return Math.min(start.getCol(), end.getCol());
    }

    public int getLastCol() {
        return Math.max(start.getCol(), end.getCol());
    }

    public int getRowCount() {
        return getLastRow() - getFirstRow() + 1;
    }

    public int getColCount() {
        return getLastCol() - getFirstCol() + 1;
    }

    @Override
    public String toFormula() {
        return start.toFormula() + ":" + end.toLocalFormula();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RangeRef)) {
            return false;
        }
        RangeRef that = (RangeRef) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }
}
