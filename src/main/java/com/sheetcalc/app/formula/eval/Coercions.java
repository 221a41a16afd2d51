package com.sheetcalc.app.formula.eval;

import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Type coercion rules shared by operators and functions.
 * Every method that cannot produce a value throws {@link CellErrorException};
 * an error operand is re-thrown with its own kind so it propagates unchanged.
 */
public final class Coercions {

    private static final Pattern NUMERIC_TEXT =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?%?");

    private Coercions() {
    }

    /**
     * Numbers and dates as-is, booleans 1/0, empty 0, numeric text parsed.
     */
    public static double toNumber(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
            case DATE:
                return value.getNumber();
            case BOOL:
                return value.getBool() ? 1 : 0;
            case EMPTY:
                return 0;
            case TEXT:
                Double parsed = parseNumber(value.getText());
                if (parsed == null) {
                    throw new CellErrorException(ErrorKind.VALUE);
                }
                return parsed;
            case ERROR:
                throw new CellErrorException(value.getError());
            default:
                return toNumber(value.resolved());
        }
    }

    /**
     * Numbers in General format, booleans as TRUE/FALSE, empty as "".
     */
    public static String toText(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
            case DATE:
                return NumberFormatting.format(value.getNumber());
            case BOOL:
                return value.getBool() ? "TRUE" : "FALSE";
            case EMPTY:
                return "";
            case TEXT:
                return value.getText();
            case ERROR:
                throw new CellErrorException(value.getError());
            default:
                return toText(value.resolved());
        }
    }

    /**
     * Non-zero numbers are true, empty is false, text must read TRUE or FALSE.
     */
    public static boolean toBool(CellValue value) {
        switch (value.getType()) {
            case BOOL:
                return value.getBool();
            case NUMBER:
            case DATE:
                return value.getNumber() != 0;
            case EMPTY:
                return false;
            case TEXT:
                String upper = value.getText().trim().toUpperCase(Locale.ROOT);
                if ("TRUE".equals(upper)) {
                    return true;
                }
                if ("FALSE".equals(upper)) {
                    return false;
                }
                throw new CellErrorException(ErrorKind.VALUE);
            case ERROR:
                throw new CellErrorException(value.getError());
            default:
                return toBool(value.resolved());
        }
    }

    /**
     * Parses numeric text such as "42", " -1.5e3 " or "50%".
     * Returns null if the text is not a number or lies beyond the double range.
     */
    public static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (!NUMERIC_TEXT.matcher(trimmed).matches()) {
            return null;
        }
        double value = trimmed.endsWith("%")
                ? Double.parseDouble(trimmed.substring(0, trimmed.length() - 1)) / 100
                : Double.parseDouble(trimmed);
        return Double.isInfinite(value) ? null : value;
    }

    /**
     * Spreadsheet ordering of two non-error values. An empty operand takes
     * the other operand's type (0, "" or FALSE); otherwise numbers sort before
     * text, and text before booleans. Text compares case-insensitively.
     */
    public static int compare(CellValue a, CellValue b) {
        CellValue left = a.resolved();
        CellValue right = b.resolved();
        if (left.isError()) {
            throw new CellErrorException(left.getError());
        }
        if (right.isError()) {
            throw new CellErrorException(right.getError());
        }
        if (left.isEmpty() && right.isEmpty()) {
            return 0;
        }
        if (left.isEmpty()) {
            left = blankOfType(right);
        } else if (right.isEmpty()) {
            right = blankOfType(left);
        }
        int rankDiff = typeRank(left) - typeRank(right);
        if (rankDiff != 0) {
            return Integer.signum(rankDiff);
        }
        if (left.isNumeric()) {
            return Double.compare(left.getNumber(), right.getNumber());
        }
        if (left.isText()) {
            return Integer.signum(left.getText().toLowerCase(Locale.ROOT)
                    .compareTo(right.getText().toLowerCase(Locale.ROOT)));
        }
        return Boolean.compare(left.getBool(), right.getBool());
    }

    /** Same-type equality used by lookups and SWITCH: never coerces across types. */
    public static boolean sameTypeEquals(CellValue a, CellValue b) {
        CellValue left = a.resolved();
        CellValue right = b.resolved();
        if (left.isError() || right.isError()) {
            return left.equals(right);
        }
        if (left.isEmpty() || right.isEmpty()) {
            return left.isEmpty() && right.isEmpty();
        }
        if (typeRank(left) != typeRank(right)) {
            return false;
        }
        return compare(left, right) == 0;
    }

    static int typeRank(CellValue value) {
        if (value.isNumeric()) {
            return 0;
        }
        if (value.isText()) {
            return 1;
        }
        return 2;
    }

    private static CellValue blankOfType(CellValue other) {
        if (other.isNumeric()) {
            return CellValue.number(0);
        }
        if (other.isText()) {
            return CellValue.text("");
        }
        return CellValue.bool(false);
    }
}
