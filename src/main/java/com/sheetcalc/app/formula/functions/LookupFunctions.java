package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.ast.AstNode;
import com.sheetcalc.app.formula.ast.CellRef;
import com.sheetcalc.app.formula.ast.RangeRef;
import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.formula.eval.RangeValues;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;

import static com.sheetcalc.app.formula.functions.FunctionRegistry.VARIADIC;

/**
 * Lookup and reference functions.
 *
 * Approximate searches assume ascending data (descending for MATCH type -1)
 * and do not check it. Exact text matches ignore case and honor the
 * {@code *} and {@code ?} wildcards.
 */
public final class LookupFunctions {

    private LookupFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("VLOOKUP", 3, 4, args -> tableLookup(args, true));
        registry.register("HLOOKUP", 3, 4, args -> tableLookup(args, false));
        registry.register("INDEX", 2, 3, LookupFunctions::index);
        registry.register("MATCH", 2, 3, LookupFunctions::match);
        registry.register("LOOKUP", 2, 3, LookupFunctions::lookup);
        registry.register("ROW", 0, 1, args -> position(args, true));
        registry.register("COLUMN", 0, 1, args -> position(args, false));
        registry.register("ROWS", 1, 1, args -> CellValue.number(dimension(args.node(0), true)));
        registry.register("COLUMNS", 1, 1, args -> CellValue.number(dimension(args.node(0), false)));
        registry.register("CHOOSE", 2, VARIADIC, LookupFunctions::choose);
        registry.register("ADDRESS", 2, 5, LookupFunctions::address);
    }

    /**
     * VLOOKUP searches the first column and returns from column N;
     * HLOOKUP searches the first row and returns from row N.
     */
    private static CellValue tableLookup(FunctionArgs args, boolean vertical) {
        CellValue target = args.scalar(0);
        RangeValues table = args.range(1);
        int index = args.integer(2);
        boolean exact = args.size() > 3 && !args.bool(3);
        int limit = vertical ? table.getCols() : table.getRows();
        if (index < 1) {
            return CellValue.error(ErrorKind.VALUE);
        }
        if (index > limit) {
            return CellValue.error(ErrorKind.REF);
        }
        List<CellValue> keys = new ArrayList<>();
        int length = vertical ? table.getRows() : table.getCols();
        for (int i = 0; i < length; i++) {
            keys.add(vertical ? table.get(i, 0) : table.get(0, i));
        }
        int found = exact ? findExact(keys, target) : findLastNotGreater(keys, target);
        if (found < 0) {
            return CellValue.error(ErrorKind.NOT_AVAILABLE);
        }
        return vertical ? table.get(found, index - 1) : table.get(index - 1, found);
    }

    private static CellValue match(FunctionArgs args) {
        CellValue target = args.scalar(0);
        RangeValues range = args.range(1);
        if (range.getRows() != 1 && range.getCols() != 1) {
            return CellValue.error(ErrorKind.NOT_AVAILABLE);
        }
        double matchType = args.number(2, 1);
        int found;
        if (matchType == 0) {
            found = findExact(range.getValues(), target);
        } else if (matchType > 0) {
            found = findLastNotGreater(range.getValues(), target);
        } else {
            found = findLastNotLess(range.getValues(), target);
        }
        return found < 0 ? CellValue.error(ErrorKind.NOT_AVAILABLE) : CellValue.number(found + 1);
    }

    private static CellValue index(FunctionArgs args) {
        RangeValues range = args.range(0);
        int row = args.integer(1);
        int col = args.integer(2, 0);
        if (args.size() == 2 && range.getRows() == 1) {
            col = row;
            row = 1;
        }
        if (row < 0 || col < 0) {
            return CellValue.error(ErrorKind.VALUE);
        }
        if (row == 0) {
            if (range.getRows() != 1) {
                return CellValue.error(ErrorKind.VALUE);
            }
            row = 1;
        }
        if (col == 0) {
            if (range.getCols() != 1) {
                return CellValue.error(ErrorKind.VALUE);
            }
            col = 1;
        }
        if (row > range.getRows() || col > range.getCols()) {
            return CellValue.error(ErrorKind.REF);
        }
        return range.get(row - 1, col - 1);
    }

    /**
     * LOOKUP(value, lookup_vector, [result_vector]). Without a result vector a
     * two-dimensional range is searched along its longer side and the answer
     * taken from its last row or column.
     */
    private static CellValue lookup(FunctionArgs args) {
        CellValue target = args.scalar(0);
        RangeValues range = args.range(1);
        List<CellValue> keys = new ArrayList<>();
        List<CellValue> results = new ArrayList<>();
        if (range.getRows() == 1 || range.getCols() == 1) {
            keys.addAll(range.getValues());
            results.addAll(args.size() > 2 ? args.range(2).getValues() : range.getValues());
        } else if (range.getCols() > range.getRows()) {
            for (int c = 0; c < range.getCols(); c++) {
                keys.add(range.get(0, c));
                results.add(range.get(range.getRows() - 1, c));
            }
        } else {
            for (int r = 0; r < range.getRows(); r++) {
                keys.add(range.get(r, 0));
                results.add(range.get(r, range.getCols() - 1));
            }
        }
        if (range.getRows() != 1 && range.getCols() != 1 && args.size() > 2) {
            results = new ArrayList<>(args.range(2).getValues());
        }
        int found = findLastNotGreater(keys, target);
        if (found < 0) {
            return CellValue.error(ErrorKind.NOT_AVAILABLE);
        }
        if (found >= results.size()) {
            return CellValue.error(ErrorKind.REF);
        }
        return results.get(found);
    }

    static int findExact(List<CellValue> values, CellValue target) {
        for (int i = 0; i < values.size(); i++) {
            CellValue v = values.get(i);
            if (target.isText()) {
                if (v.isText() && Criteria.wildcardMatch(target.getText(), v.getText())) {
                    return i;
                }
            } else if (!v.isError() && Coercions.sameTypeEquals(v, target)) {
                return i;
            }
        }
        return -1;
    }

    /** Last position holding a value <= target, stopping at the first greater one. */
    static int findLastNotGreater(List<CellValue> values, CellValue target) {
        int found = -1;
        for (int i = 0; i < values.size(); i++) {
            CellValue v = values.get(i);
            if (!comparable(v, target)) {
                continue;
            }
            if (Coercions.compare(v, target) > 0) {
                break;
            }
            found = i;
        }
        return found;
    }

    /** Last position holding a value >= target on descending data. */
    static int findLastNotLess(List<CellValue> values, CellValue target) {
        int found = -1;
        for (int i = 0; i < values.size(); i++) {
            CellValue v = values.get(i);
            if (!comparable(v, target)) {
                continue;
            }
            if (Coercions.compare(v, target) < 0) {
                break;
            }
            found = i;
        }
        return found;
    }

    private static boolean comparable(CellValue v, CellValue target) {
        if (v.isEmpty() || v.isError()) {
            return false;
        }
        return v.isNumeric() == target.isNumeric() && v.isText() == target.isText();
    }

    private static CellValue position(FunctionArgs args, boolean row) {
        if (args.size() == 0) {
            CellAddress current = args.currentCell();
            if (current == null) {
                return CellValue.number(1);
            }
            return CellValue.number(row ? current.getRow() : current.getCol());
        }
        AstNode node = args.node(0);
        if (node instanceof CellRef) {
            CellRef ref = (CellRef) node;
            return CellValue.number(row ? ref.getRow() : ref.getCol());
        }
        if (node instanceof RangeRef) {
            RangeRef range = (RangeRef) node;
            return CellValue.number(row ? range.getFirstRow() : range.getFirstCol());
        }
        return CellValue.error(ErrorKind.VALUE);
    }

    private static int dimension(AstNode node, boolean rows) {
        if (node instanceof CellRef) {
            return 1;
        }
        if (node instanceof RangeRef) {
            RangeRef range = (RangeRef) node;
            return rows ? range.getRowCount() : range.getColCount();
        }
        throw new CellErrorException(ErrorKind.VALUE);
    }

    private static CellValue choose(FunctionArgs args) {
        int index = args.integer(0);
        if (index < 1 || index >= args.size()) {
            return CellValue.error(ErrorKind.VALUE);
        }
        return args.value(index);
    }

    /**
     * ADDRESS(row, column, [abs_num], [a1], [sheet]). abs_num 1 is $A$1,
     * 2 is A$1, 3 is $A1 and 4 is A1.
     */
    private static CellValue address(FunctionArgs args) {
        int row = args.integer(0);
        int col = args.integer(1);
        int absNum = args.integer(2, 1);
        boolean a1 = args.bool(3, true);
        if (row < 1 || row > CellAddress.MAX_ROWS || col < 1 || col > CellAddress.MAX_COLUMNS
                || absNum < 1 || absNum > 4) {
            return CellValue.error(ErrorKind.VALUE);
        }
        boolean absRow = absNum == 1 || absNum == 2;
        boolean absCol = absNum == 1 || absNum == 3;
        String ref;
        if (a1) {
            ref = (absCol ? "$" : "") + CellAddress.columnNumberToName(col) + (absRow ? "$" : "") + row;
        } else {
            ref = "R" + (absRow ? row : "[" + row + "]") + "C" + (absCol ? col : "[" + col + "]");
        }
        if (args.size() > 4) {
            ref = CellRef.sheetPrefix(args.text(4)) + ref;
        }
        return CellValue.text(ref);
    }
}
