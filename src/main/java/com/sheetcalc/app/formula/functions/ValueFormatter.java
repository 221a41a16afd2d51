package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.NumberFormatting;
import com.sheetcalc.app.models.ErrorKind;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DayOfWeek;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Number format codes for TEXT(): digit placeholders ({@code 0 # , .}),
 * percent, scientific ({@code 0.00E+00}), quoted literals, and the date/time
 * codes {@code y m d h s AM/PM}.
 */
final class ValueFormatter {

    private ValueFormatter() {
    }

    static String format(double value, String format) {
        if (format.isEmpty()) {
            return "";
        }
        if ("general".equalsIgnoreCase(format) || "@".equals(format)) {
            return NumberFormatting.format(value);
        }
        if (isDateFormat(format)) {
            return formatDate(value, format);
        }
        return formatNumber(value, format);
    }

    static boolean isDateFormat(String format) {
        boolean quoted = false;
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (!quoted && "yYdDhHsS".indexOf(c) >= 0) {
                return true;
            } else if (!quoted && (c == 'm' || c == 'M') && format.indexOf('0') < 0 && format.indexOf('#') < 0) {
                return true;
            }
        }
        return false;
    }

    private static String formatNumber(double value, String format) {
        StringBuilder pattern = new StringBuilder();
        boolean scientificPlus = false;
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c == '"') {
                int end = format.indexOf('"', i + 1);
                if (end < 0) {
                    throw new CellErrorException(ErrorKind.VALUE);
                }
                appendLiteral(pattern, format.substring(i + 1, end));
                i = end;
            } else if (c == '\\' && i + 1 < format.length()) {
                appendLiteral(pattern, String.valueOf(format.charAt(++i)));
            } else if ((c == 'E' || c == 'e') && i + 1 < format.length()
                    && (format.charAt(i + 1) == '+' || format.charAt(i + 1) == '-')) {
                scientificPlus = format.charAt(i + 1) == '+';
                pattern.append('E');
                i++;
            } else if ("0#,.%".indexOf(c) >= 0) {
                pattern.append(c);
            } else {
                appendLiteral(pattern, String.valueOf(c));
            }
        }
        DecimalFormat decimalFormat;
        try {
            decimalFormat = new DecimalFormat(pattern.toString(), DecimalFormatSymbols.getInstance(Locale.US));
        } catch (IllegalArgumentException e) {
            throw new CellErrorException(ErrorKind.VALUE);
        }
        decimalFormat.setRoundingMode(RoundingMode.HALF_UP);
        String result = decimalFormat.format(value);
        if (scientificPlus) {
            int e = result.indexOf('E');
            if (e >= 0 && e + 1 < result.length() && result.charAt(e + 1) != '-') {
                result = result.substring(0, e + 1) + "+" + result.substring(e + 1);
            }
        }
        return result;
    }

    private static void appendLiteral(StringBuilder pattern, String literal) {
        if (literal.isEmpty()) {
            return;
        }
        pattern.append('\'').append(literal.replace("'", "''")).append('\'');
    }

    private static String formatDate(double serial, String format) {
        int[] parts = ExcelDates.dateParts(serial);
        int secondOfDay = ExcelDates.secondOfDay(serial);
        int hour = secondOfDay / 3600;
        int minute = secondOfDay / 60 % 60;
        int second = secondOfDay % 60;
        String upper = format.toUpperCase(Locale.ROOT);
        boolean twelveHour = upper.contains("AM/PM") || upper.contains("A/P");

        StringBuilder out = new StringBuilder();
        char previousCode = 0;
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            char lower = Character.toLowerCase(c);
            if (c == '"') {
                int end = format.indexOf('"', i + 1);
                if (end < 0) {
                    throw new CellErrorException(ErrorKind.VALUE);
                }
                out.append(format, i + 1, end);
                i = end + 1;
                continue;
            }
            if (c == '\\' && i + 1 < format.length()) {
                out.append(format.charAt(i + 1));
                i += 2;
                continue;
            }
            if (upper.startsWith("AM/PM", i)) {
                out.append(hour < 12 ? "AM" : "PM");
                i += 5;
                continue;
            }
            if (upper.startsWith("A/P", i)) {
                out.append(hour < 12 ? "A" : "P");
                i += 3;
                continue;
            }
            if ("ymdhs".indexOf(lower) < 0) {
                out.append(c);
                i++;
                continue;
            }
            int run = i;
            while (run < format.length() && Character.toLowerCase(format.charAt(run)) == lower) {
                run++;
            }
            int len = run - i;
            switch (lower) {
                case 'y':
                    out.append(len <= 2 ? pad(parts[0] % 100) : String.valueOf(parts[0]));
                    break;
                case 'm':
                    if (previousCode == 'h' || nextCodeIsSeconds(format, run)) {
                        out.append(len >= 2 ? pad(minute) : String.valueOf(minute));
                    } else {
                        out.append(monthText(parts[1], len));
                    }
                    break;
                case 'd':
                    out.append(dayText(serial, parts[2], len));
                    break;
                case 'h':
                    int h = twelveHour ? (hour % 12 == 0 ? 12 : hour % 12) : hour;
                    out.append(len >= 2 ? pad(h) : String.valueOf(h));
                    break;
                default:
                    out.append(len >= 2 ? pad(second) : String.valueOf(second));
                    break;
            }
            previousCode = lower;
            i = run;
        }
        return out.toString();
    }

    private static boolean nextCodeIsSeconds(String format, int from) {
        for (int i = from; i < format.length(); i++) {
            char c = Character.toLowerCase(format.charAt(i));
            if ("ymdh".indexOf(c) >= 0) {
                return false;
            }
            if (c == 's') {
                return true;
            }
        }
        return false;
    }

    private static String monthText(int month, int len) {
        switch (len) {
            case 1:
                return String.valueOf(month);
            case 2:
                return pad(month);
            case 3:
                return Month.of(month).getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
            default:
                return Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        }
    }

    private static String dayText(double serial, int day, int len) {
        if (len <= 2) {
            return len == 1 ? String.valueOf(day) : pad(day);
        }
        DayOfWeek weekday = DayOfWeek.of((ExcelDates.weekdayIndex(serial) + 6) % 7 + 1);
        return weekday.getDisplayName(len == 3 ? TextStyle.SHORT : TextStyle.FULL, Locale.ENGLISH);
    }

    private static String pad(int n) {
        return n < 10 ? "0" + n : String.valueOf(n);
    }
}
