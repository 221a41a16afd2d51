package com.sheetcalc.app.models;

import com.sheetcalc.app.formula.CellStore;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire workbook:
 * - Has a unique ID
 * - An ordered collection of named Sheets
 * - A read/write lock, since the formula engine itself is not thread-safe
 *
 * This is the cell store the formula engine reads from and writes results to.
 */
public class Workbook implements CellStore {

    // Generates unique IDs for newly created workbooks
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    // Insertion order is the workbook's sheet order
    private final Map<String, Sheet> sheets = Collections.synchronizedMap(new LinkedHashMap<>());

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Workbook() {
        this.id = ID_GENERATOR.getAndIncrement();
    }

    public long getId() {
        return id;
    }

    /**
     * Adds a new empty sheet. Sheet names are unique ignoring case.
     */
    public Sheet addSheet(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sheet name must not be blank");
        }
        if (resolveSheetName(name) != null) {
            throw new IllegalArgumentException("Sheet already exists: " + name);
        }
        Sheet sheet = new Sheet(name);
        sheets.put(name, sheet);
        return sheet;
    }

    /**
     * Retrieves a sheet by name (case-insensitive), or null if absent.
     */
    public Sheet getSheet(String name) {
        String resolved = resolveSheetName(name);
        return resolved == null ? null : sheets.get(resolved);
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    // ------------------------
    // CellStore
    // ------------------------

    @Override
    public List<String> sheetNames() {
        synchronized (sheets) {
            return new ArrayList<>(sheets.keySet());
        }
    }

    @Override
    public CellValue getCellValue(String sheet, int row, int col) {
        Sheet s = getSheet(sheet);
        return s == null ? CellValue.empty() : s.getCell(row, col);
    }

    @Override
    public Map<CellAddress, CellValue> cells() {
        Map<CellAddress, CellValue> all = new HashMap<>();
        for (String name : sheetNames()) {
            all.putAll(sheets.get(name).getCells());
        }
        return all;
    }

    @Override
    public List<CellAddress> formulaCells(String sheet) {
        Sheet s = getSheet(sheet);
        if (s == null) {
            return Collections.emptyList();
        }
        List<CellAddress> result = new ArrayList<>();
        for (Map.Entry<CellAddress, CellValue> entry : s.getCells().entrySet()) {
            if (entry.getValue().isFormula()) {
                result.add(entry.getKey());
            }
        }
        Collections.sort(result);
        return result;
    }

    @Override
    public void setCachedResult(CellAddress address, CellValue result) {
        Sheet s = getSheet(address.getSheet());
        if (s == null) {
            throw new IllegalStateException("No sheet for " + address);
        }
        CellValue current = s.getCell(address.getRow(), address.getCol());
        if (!current.isFormula()) {
            throw new IllegalStateException("Cell " + address + " does not hold a formula");
        }
        s.setCell(address.getRow(), address.getCol(), current.withCachedResult(result));
    }
}
