package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.util.Locale;

/**
 * A COUNTIF-style condition such as {@code ">5"}, {@code "<>done"} or
 * {@code "ap*"}. Numeric conditions compare numerically against numeric
 * cells; anything else compares case-insensitively against text cells, with
 * {@code *} and {@code ?} wildcards for equality ({@code ~} escapes them).
 */
public final class Criteria {

    private enum Operator {
        EQUAL, NOT_EQUAL, LESS, LESS_OR_EQUAL, GREATER, GREATER_OR_EQUAL
    }

    private final Operator op;
    private final String operand;
    private final Double number;
    private final ErrorKind error;

    private Criteria(Operator op, String operand) {
        this.op = op;
        this.operand = operand;
        this.number = Coercions.parseNumber(operand);
        this.error = ErrorKind.fromCode(operand.trim());
    }

    /**
     * Builds a condition from a criteria argument. A number or boolean means
     * "equal to"; text may carry a comparison prefix.
     */
    public static Criteria of(CellValue criterion) {
        CellValue value = criterion.resolved();
        if (value.isNumeric() || value.isBool() || value.isEmpty()) {
            return new Criteria(Operator.EQUAL, Coercions.toText(value));
        }
        if (value.isError()) {
            return new Criteria(Operator.EQUAL, value.getError().getCode());
        }
        return parse(value.getText());
    }

    public static Criteria parse(String text) {
        String[] prefixes = {"<=", ">=", "<>", "<", ">", "="};
        Operator[] ops = {Operator.LESS_OR_EQUAL, Operator.GREATER_OR_EQUAL, Operator.NOT_EQUAL,
                Operator.LESS, Operator.GREATER, Operator.EQUAL};
        for (int i = 0; i < prefixes.length; i++) {
            if (text.startsWith(prefixes[i])) {
                return new Criteria(ops[i], text.substring(prefixes[i].length()));
            }
        }
        return new Criteria(Operator.EQUAL, text);
    }

    public boolean matches(CellValue cell) {
        CellValue value = cell.resolved();
        if (operand.isEmpty()) {
            boolean blank = value.isEmpty() || (value.isText() && value.getText().isEmpty());
            switch (op) {
                case EQUAL:
                    return blank;
                case NOT_EQUAL:
                    return !blank;
                default:
                    return false;
            }
        }
        if (value.isError()) {
            boolean same = error != null && value.getError() == error;
            return op == Operator.EQUAL ? same : op == Operator.NOT_EQUAL && !same;
        }
        if (number != null) {
            Double cellNumber = numericValue(value);
            if (cellNumber == null) {
                return op == Operator.NOT_EQUAL;
            }
            return test(Double.compare(cellNumber, number));
        }
        String upper = operand.toUpperCase(Locale.ROOT);
        if (value.isBool() && ("TRUE".equals(upper) || "FALSE".equals(upper))) {
            boolean same = value.getBool() == "TRUE".equals(upper);
            return op == Operator.EQUAL ? same : op == Operator.NOT_EQUAL && !same;
        }
        if (!value.isText()) {
            return op == Operator.NOT_EQUAL;
        }
        String text = value.getText();
        switch (op) {
            case EQUAL:
                return wildcardMatch(operand, text);
            case NOT_EQUAL:
                return !wildcardMatch(operand, text);
            default:
                return test(Integer.signum(text.toLowerCase(Locale.ROOT).compareTo(operand.toLowerCase(Locale.ROOT))));
        }
    }

    private boolean test(int cmp) {
        switch (op) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case LESS:
                return cmp < 0;
            case LESS_OR_EQUAL:
                return cmp <= 0;
            case GREATER:
                return cmp > 0;
            default:
                return cmp >= 0;
        }
    }

    private static Double numericValue(CellValue value) {
        if (value.isNumeric()) {
            return value.getNumber();
        }
        if (value.isText()) {
            return Coercions.parseNumber(value.getText());
        }
        return null;
    }

    /**
     * Case-insensitive match of text against a pattern where {@code *} is
     * any run of characters, {@code ?} any single character and {@code ~}
     * makes the next character literal.
     */
    public static boolean wildcardMatch(String pattern, String text) {
        String p = pattern.toLowerCase(Locale.ROOT);
        String t = text.toLowerCase(Locale.ROOT);
        // tokens: '*' -> -1, '?' -> -2, literal -> the char
        int[] tokens = new int[p.length()];
        int n = 0;
        for (int i = 0; i < p.length(); i++) {
            char c = p.charAt(i);
            if (c == '~' && i + 1 < p.length()) {
                tokens[n++] = p.charAt(++i);
            } else if (c == '*') {
                tokens[n++] = -1;
            } else if (c == '?') {
                tokens[n++] = -2;
            } else {
                tokens[n++] = c;
            }
        }
        boolean[] prev = new boolean[t.length() + 1];
        prev[0] = true;
        for (int i = 0; i < n; i++) {
            boolean[] next = new boolean[t.length() + 1];
            int token = tokens[i];
            if (token == -1) {
                next[0] = prev[0];
            }
            for (int j = 1; j <= t.length(); j++) {
                if (token == -1) {
                    next[j] = prev[j] || next[j - 1];
                } else if (token == -2) {
                    next[j] = prev[j - 1];
                } else {
                    next[j] = prev[j - 1] && t.charAt(j - 1) == token;
                }
            }
            prev = next;
        }
        return prev[t.length()];
    }

    /** True if the pattern uses any wildcard character. */
    public static boolean hasWildcards(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('~') >= 0;
    }
}
