package com.sheetcalc.app.formula.eval;

import com.sheetcalc.app.models.CellValue;

import java.util.Collections;
import java.util.List;

/**
 * The values of a rectangular range, row-major. Formula cells are already
 * resolved to their results.
 */
public class RangeValues {

    private final int rows;
    private final int cols;
    private final List<CellValue> values;

    public RangeValues(int rows, int cols, List<CellValue> values) {
        if (values.size() != rows * cols) {
            throw new IllegalArgumentException("Expected " + rows * cols + " values but got " + values.size());
        }
        this.rows = rows;
        this.cols = cols;
        this.values = Collections.unmodifiableList(values);
    }

    public static RangeValues single(CellValue value) {
        return new RangeValues(1, 1, Collections.singletonList(value));
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /** 0-based row and column within the range. */
    public CellValue get(int row, int col) {
        return values.get(row * cols + col);
    }

    public List<CellValue> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }
}
