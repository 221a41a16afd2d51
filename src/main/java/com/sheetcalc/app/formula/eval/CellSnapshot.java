package com.sheetcalc.app.formula.eval;

import com.sheetcalc.app.formula.CellStore;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The cell values an evaluation reads from.
 *
 * An eager snapshot copies every populated cell up front and is updated in
 * place as a recalculation computes formula results. A lazy snapshot reads
 * through to the store on first access and remembers what it read.
 * Addresses must carry the canonical sheet spelling (see {@link #resolveSheet}).
 */
public class CellSnapshot {

    private final List<String> sheetNames;
    private final Map<CellAddress, CellValue> cells = new HashMap<>();
    // null for eager snapshots
    private final CellStore source;

    private CellSnapshot(List<String> sheetNames, CellStore source) {
        this.sheetNames = new ArrayList<>(sheetNames);
        this.source = source;
    }

    /** Copies every populated cell of the store. */
    public static CellSnapshot capture(CellStore store) {
        CellSnapshot snapshot = new CellSnapshot(store.sheetNames(), null);
        snapshot.cells.putAll(store.cells());
        return snapshot;
    }

    /** Reads cells from the store only when they are first asked for. */
    public static CellSnapshot lazy(CellStore store) {
        return new CellSnapshot(store.sheetNames(), store);
    }

    /** An empty snapshot over the given sheets, filled with {@link #put}. */
    public static CellSnapshot of(List<String> sheetNames) {
        return new CellSnapshot(sheetNames, null);
    }

    /**
     * Case-insensitive sheet lookup. Returns the canonical name, or null.
     */
    public String resolveSheet(String name) {
        if (name == null) {
            return null;
        }
        for (String sheet : sheetNames) {
            if (sheet.equalsIgnoreCase(name)) {
                return sheet;
            }
        }
        return null;
    }

    public List<String> getSheetNames() {
        return Collections.unmodifiableList(sheetNames);
    }

    public CellValue get(CellAddress address) {
        CellValue value = cells.get(address);
        if (value != null) {
            return value;
        }
        if (source == null) {
            return CellValue.empty();
        }
        value = source.getCellValue(address.getSheet(), address.getRow(), address.getCol());
        cells.put(address, value);
        return value;
    }

    public void put(CellAddress address, CellValue value) {
        cells.put(address, value == null ? CellValue.empty() : value);
    }
}
