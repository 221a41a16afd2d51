package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.util.Locale;

import static com.sheetcalc.app.formula.functions.FunctionRegistry.VARIADIC;

/**
 * Text functions. Positions are 1-based as in spreadsheets.
 */
public final class TextFunctions {

    /** Longest text a cell can hold. */
    public static final int MAX_TEXT_LENGTH = 32_767;

    private TextFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("LEN", 1, 1, args -> CellValue.number(args.text(0).length()));
        registry.register("LOWER", 1, 1, args -> CellValue.text(args.text(0).toLowerCase(Locale.ROOT)));
        registry.register("UPPER", 1, 1, args -> CellValue.text(args.text(0).toUpperCase(Locale.ROOT)));
        registry.register("TRIM", 1, 1, args -> CellValue.text(args.text(0).trim().replaceAll(" {2,}", " ")));
        registry.register("LEFT", 1, 2, TextFunctions::left);
        registry.register("RIGHT", 1, 2, TextFunctions::right);
        registry.register("MID", 3, 3, TextFunctions::mid);
        registry.register("CONCATENATE", 1, VARIADIC, TextFunctions::concatenate);
        registry.register("CONCAT", 1, VARIADIC, TextFunctions::concat);
        registry.register("FIND", 2, 3, TextFunctions::find);
        registry.register("SEARCH", 2, 3, TextFunctions::search);
        registry.register("SUBSTITUTE", 3, 4, TextFunctions::substitute);
        registry.register("REPLACE", 4, 4, TextFunctions::replace);
        registry.register("REPT", 2, 2, TextFunctions::rept);
        registry.register("EXACT", 2, 2, args -> CellValue.bool(args.text(0).equals(args.text(1))));
        registry.register("PROPER", 1, 1, args -> CellValue.text(proper(args.text(0))));
        registry.register("CHAR", 1, 1, TextFunctions::charFunction);
        registry.register("CODE", 1, 1, TextFunctions::code);
    }

    private static CellValue left(FunctionArgs args) {
        String text = args.text(0);
        int count = nonNegative(args.integer(1, 1));
        return CellValue.text(text.substring(0, Math.min(count, text.length())));
    }

    private static CellValue right(FunctionArgs args) {
        String text = args.text(0);
        int count = nonNegative(args.integer(1, 1));
        return CellValue.text(text.substring(text.length() - Math.min(count, text.length())));
    }

    private static CellValue mid(FunctionArgs args) {
        String text = args.text(0);
        int start = args.integer(1);
        int count = nonNegative(args.integer(2));
        if (start < 1) {
            return CellValue.error(ErrorKind.VALUE);
        }
        if (start > text.length()) {
            return CellValue.text("");
        }
        int end = (int) Math.min((long) start - 1 + count, text.length());
        return CellValue.text(text.substring(start - 1, end));
    }

    private static CellValue concatenate(FunctionArgs args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            sb.append(args.text(i));
        }
        return checkedText(sb);
    }

    private static CellValue concat(FunctionArgs args) {
        StringBuilder sb = new StringBuilder();
        for (CellValue v : args.allValues()) {
            sb.append(Coercions.toText(v));
        }
        return checkedText(sb);
    }

    private static CellValue find(FunctionArgs args) {
        String needle = args.text(0);
        String haystack = args.text(1);
        int start = args.integer(2, 1);
        if (start < 1 || start > haystack.length() + 1) {
            return CellValue.error(ErrorKind.VALUE);
        }
        int index = haystack.indexOf(needle, start - 1);
        return index < 0 ? CellValue.error(ErrorKind.VALUE) : CellValue.number(index + 1);
    }

    /**
     * SEARCH is FIND without case sensitivity and with wildcards.
     */
    private static CellValue search(FunctionArgs args) {
        String needle = args.text(0);
        String haystack = args.text(1);
        int start = args.integer(2, 1);
        if (start < 1 || start > haystack.length() + 1) {
            return CellValue.error(ErrorKind.VALUE);
        }
        if (!Criteria.hasWildcards(needle)) {
            int index = haystack.toLowerCase(Locale.ROOT).indexOf(needle.toLowerCase(Locale.ROOT), start - 1);
            return index < 0 ? CellValue.error(ErrorKind.VALUE) : CellValue.number(index + 1);
        }
        for (int from = start - 1; from <= haystack.length(); from++) {
            for (int to = from; to <= haystack.length(); to++) {
                if (Criteria.wildcardMatch(needle, haystack.substring(from, to))) {
                    return CellValue.number(from + 1);
                }
            }
        }
        return CellValue.error(ErrorKind.VALUE);
    }

    private static CellValue substitute(FunctionArgs args) {
        String text = args.text(0);
        String oldText = args.text(1);
        String newText = args.text(2);
        if (oldText.isEmpty()) {
            return CellValue.text(text);
        }
        if (args.size() < 4) {
            return checkedText(new StringBuilder(text.replace(oldText, newText)));
        }
        int instance = args.integer(3);
        if (instance < 1) {
            return CellValue.error(ErrorKind.VALUE);
        }
        int index = -1;
        for (int n = 0; n < instance; n++) {
            index = text.indexOf(oldText, index + 1);
            if (index < 0) {
                return CellValue.text(text);
            }
        }
        return checkedText(new StringBuilder(text).replace(index, index + oldText.length(), newText));
    }

    private static CellValue replace(FunctionArgs args) {
        String text = args.text(0);
        int start = args.integer(1);
        int count = nonNegative(args.integer(2));
        String newText = args.text(3);
        if (start < 1) {
            return CellValue.error(ErrorKind.VALUE);
        }
        int from = Math.min(start - 1, text.length());
        int to = (int) Math.min((long) from + count, text.length());
        return checkedText(new StringBuilder(text).replace(from, to, newText));
    }

    private static CellValue rept(FunctionArgs args) {
        String text = args.text(0);
        int times = nonNegative(args.integer(1));
        if ((long) text.length() * times > MAX_TEXT_LENGTH) {
            return CellValue.error(ErrorKind.VALUE);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < times; i++) {
            sb.append(text);
        }
        return CellValue.text(sb.toString());
    }

    static String proper(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }

    private static CellValue charFunction(FunctionArgs args) {
        int code = args.integer(0);
        if (code < 1 || code > 255) {
            return CellValue.error(ErrorKind.VALUE);
        }
        return CellValue.text(String.valueOf((char) code));
    }

    private static CellValue code(FunctionArgs args) {
        String text = args.text(0);
        if (text.isEmpty()) {
            return CellValue.error(ErrorKind.VALUE);
        }
        return CellValue.number(text.codePointAt(0));
    }

    private static int nonNegative(int n) {
        if (n < 0) {
            throw new CellErrorException(ErrorKind.VALUE);
        }
        return n;
    }

    private static CellValue checkedText(StringBuilder sb) {
        if (sb.length() > MAX_TEXT_LENGTH) {
            return CellValue.error(ErrorKind.VALUE);
        }
        return CellValue.text(sb.toString());
    }
}
