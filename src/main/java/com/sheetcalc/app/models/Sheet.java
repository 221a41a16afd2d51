package com.sheetcalc.app.models;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A single worksheet: a name and a sparse map of populated cells.
 * Unset cells are simply absent from the map.
 */
public class Sheet {

    private final String name;
    // Key: address on this sheet -> cell content
    private final Map<CellAddress, CellValue> cells = new ConcurrentHashMap<>();

    public Sheet(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Map<CellAddress, CellValue> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    /**
     * Retrieves the cell content, or empty if the cell was never set.
     */
    public CellValue getCell(int row, int col) {
        CellValue value = cells.get(new CellAddress(name, row, col));
        return value == null ? CellValue.empty() : value;
    }

    /**
     * Inserts or replaces a cell. Setting an empty value clears the cell.
     */
    public void setCell(int row, int col, CellValue value) {
        CellAddress key = new CellAddress(name, row, col);
        if (value == null || value.isEmpty()) {
            cells.remove(key);
        } else {
            cells.put(key, value);
        }
    }
}
