package com.sheetcalc.app.exceptions;

import com.sheetcalc.app.models.CellAddress;

/**
 * Thrown when the formula cells of a workbook reference each other in a
 * loop (a cell referencing itself, or a multi-cell cycle), so no
 * evaluation order exists. No cell is updated when this is raised.
 */
public class CircularReferenceException extends FormulaEngineException {
    private final CellAddress cell;

    public CircularReferenceException(CellAddress cell) {
        super("Circular reference involving " + cell);
        this.cell = cell;
    }

    /** One cell that lies on the offending cycle. */
    public CellAddress getCell() {
        return cell;
    }
}
