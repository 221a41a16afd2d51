package com.sheetcalc.app.formula;

import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The narrow view of cell storage the formula engine works against.
 * The engine only reads through this interface while evaluating, and writes
 * formula results back in a single pass at the end of a recalculation.
 */
public interface CellStore {

    /** Sheet names in workbook order. */
    List<String> sheetNames();

    /** Value at the given 1-based coordinates, or empty if the cell is unset. */
    CellValue getCellValue(String sheet, int row, int col);

    /** Every populated cell of the workbook. */
    Map<CellAddress, CellValue> cells();

    /** Addresses of the cells on one sheet that hold a formula. */
    List<CellAddress> formulaCells(String sheet);

    /** Stores the computed result of the formula cell at the given address. */
    void setCachedResult(CellAddress address, CellValue result);

    /** Addresses of every formula cell in the workbook. */
    default List<CellAddress> formulaCells() {
        List<CellAddress> result = new ArrayList<>();
        for (String sheet : sheetNames()) {
            result.addAll(formulaCells(sheet));
        }
        return result;
    }

    /**
     * Case-insensitive sheet lookup. Returns the stored spelling of the name,
     * or null if no such sheet exists.
     */
    default String resolveSheetName(String name) {
        for (String sheet : sheetNames()) {
            if (sheet.equalsIgnoreCase(name)) {
                return sheet;
            }
        }
        return null;
    }
}
