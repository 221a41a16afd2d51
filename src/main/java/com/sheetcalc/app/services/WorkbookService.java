package com.sheetcalc.app.services;

import com.sheetcalc.app.exceptions.InvalidCellReferenceException;
import com.sheetcalc.app.exceptions.SheetNotFoundException;
import com.sheetcalc.app.exceptions.WorkbookNotFoundException;
import com.sheetcalc.app.formula.FormulaEngine;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.formula.parser.FormulaParser;
import com.sheetcalc.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic for creating workbooks, editing cells, and running
 * the formula engine against them.
 */
@Service
public class WorkbookService {

    private static final Logger log = LoggerFactory.getLogger(WorkbookService.class);

    private static final String DEFAULT_SHEET = "Sheet1";

    // All workbooks live here in memory; there is no persistent store
    private final Map<Long, Workbook> workbooks = new ConcurrentHashMap<>();

    private final FormulaEngine formulaEngine;

    public WorkbookService(FormulaEngine formulaEngine) {
        this.formulaEngine = formulaEngine;
    }

    /**
     * Creates a workbook with the given sheets (one "Sheet1" if none are
     * given) and returns its ID.
     */
    public long createWorkbook(List<String> sheetNames) {
        Workbook workbook = new Workbook();
        List<String> names = sheetNames == null || sheetNames.isEmpty()
                ? Collections.singletonList(DEFAULT_SHEET) : sheetNames;
        for (String name : names) {
            workbook.addSheet(name);
        }
        workbooks.put(workbook.getId(), workbook);
        log.info("Created workbook {} with sheets {}", workbook.getId(), names);
        return workbook.getId();
    }

    /**
     * Retrieves a Workbook by ID. Throws if not found.
     */
    public Workbook getWorkbook(long workbookId) {
        Workbook workbook = workbooks.get(workbookId);
        if (workbook == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return workbook;
    }

    /**
     * Sets a cell from user input:
     * - a leading '=' stores a formula (checked for syntax, not yet calculated)
     * - TRUE / FALSE (any case) store a boolean
     * - numeric text stores a number
     * - an empty string clears the cell
     * - anything else is stored as text
     */
    public void setCellValue(long workbookId, String sheetName, String reference, String rawValue) {
        Workbook workbook = getWorkbook(workbookId);

        workbook.getLock().writeLock().lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetName);
            CellAddress address = CellAddress.parse(sheet.getName(), reference);
            if (address == null) {
                throw new InvalidCellReferenceException("Invalid cell reference: " + reference);
            }
            CellValue value = parseRawValue(rawValue);
            sheet.setCell(address.getRow(), address.getCol(), value);
            log.debug("Set {} in workbook {} to {}", address, workbookId, value);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Returns A1 reference -> display value for every populated cell of a
     * sheet, in row-major order. Formula cells show their cached result,
     * or null before the first calculation.
     */
    public Map<String, Object> getSheetData(long workbookId, String sheetName) {
        Workbook workbook = getWorkbook(workbookId);

        workbook.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(workbook, sheetName);
            Map<CellAddress, CellValue> sorted = new TreeMap<>(sheet.getCells());
            Map<String, Object> data = new LinkedHashMap<>();
            for (Map.Entry<CellAddress, CellValue> entry : sorted.entrySet()) {
                data.put(entry.getKey().toA1(), entry.getValue().toDisplayValue());
            }
            return data;
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Evaluates an ad hoc formula against the workbook without changing it.
     */
    public CellValue evaluateFormula(long workbookId, String sheetName, String formula) {
        Workbook workbook = getWorkbook(workbookId);

        workbook.getLock().readLock().lock();
        try {
            return formulaEngine.evaluateFormula(workbook, sheetName, formula);
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Recalculates every formula cell of the workbook.
     */
    public void calculateAll(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);

        workbook.getLock().writeLock().lock();
        try {
            formulaEngine.calculateAll(workbook);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private Sheet requireSheet(Workbook workbook, String sheetName) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet " + sheetName + " not found in workbook " + workbook.getId());
        }
        return sheet;
    }

    static CellValue parseRawValue(String rawValue) {
        if (rawValue == null || rawValue.isEmpty()) {
            return CellValue.empty();
        }
        if (rawValue.startsWith("=")) {
            String expression = rawValue.substring(1);
            // Reject malformed formulas up front; throws FormulaParseException
            FormulaParser.parse(expression);
            return CellValue.formula(expression, null);
        }
        if ("TRUE".equalsIgnoreCase(rawValue.trim())) {
            return CellValue.bool(true);
        }
        if ("FALSE".equalsIgnoreCase(rawValue.trim())) {
            return CellValue.bool(false);
        }
        Double number = Coercions.parseNumber(rawValue);
        if (number != null) {
            return CellValue.number(number);
        }
        return CellValue.text(rawValue);
    }
}
