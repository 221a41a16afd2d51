package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Conversions between serial day numbers and calendar dates.
 *
 * Serial 1 is 1900-01-01. Serial 60 stands for 1900-02-29, a day that never
 * existed but that spreadsheets have always counted, so every later serial is
 * one higher than a plain day count would give. Serial 0 reads as 1900-01-00.
 */
public final class ExcelDates {

    public static final double MAX_SERIAL = 2_958_465; // 9999-12-31
    public static final double SECONDS_PER_DAY = 86_400;

    private static final int FAKE_LEAP_DAY = 60;
    private static final LocalDate EPOCH_BEFORE_LEAP_DAY = LocalDate.of(1899, 12, 31);
    private static final LocalDate EPOCH_AFTER_LEAP_DAY = LocalDate.of(1899, 12, 30);
    private static final LocalDate FIRST_REAL_MARCH = LocalDate.of(1900, 3, 1);

    private static final List<DateTimeFormatter> DATE_FORMATS = Arrays.asList(
            strict("uuuu-M-d"),
            strict("M/d/uuuu"),
            strict("uuuu/M/d"),
            caseInsensitive("d-MMM-uuuu"),
            caseInsensitive("MMMM d, uuuu"),
            caseInsensitive("MMM d, uuuu"));

    private ExcelDates() {
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder().parseCaseInsensitive().appendPattern(pattern)
                .toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }

    /** Serial number of a calendar date. Dates before 1899-12-31 are #NUM!. */
    public static double toSerial(LocalDate date) {
        if (date.isBefore(EPOCH_BEFORE_LEAP_DAY)) {
            throw new CellErrorException(ErrorKind.NUM);
        }
        if (date.isBefore(FIRST_REAL_MARCH)) {
            return ChronoUnit.DAYS.between(EPOCH_BEFORE_LEAP_DAY, date);
        }
        return ChronoUnit.DAYS.between(EPOCH_AFTER_LEAP_DAY, date);
    }

    public static double toSerial(LocalDateTime dateTime) {
        return toSerial(dateTime.toLocalDate()) + dateTime.toLocalTime().toSecondOfDay() / SECONDS_PER_DAY;
    }

    /**
     * Serial for DATE(year, month, day): years 0..1899 count from 1900, and
     * months or days outside their usual range roll over into neighbours.
     */
    public static double fromParts(int year, int month, int day) {
        if (year < 0 || year > 9999) {
            throw new CellErrorException(ErrorKind.NUM);
        }
        int fullYear = year < 1900 ? year + 1900 : year;
        long totalMonths = fullYear * 12L + (month - 1L);
        long normalizedYear = Math.floorDiv(totalMonths, 12L);
        int normalizedMonth = (int) Math.floorMod(totalMonths, 12L) + 1;
        if (normalizedYear < 1900 || normalizedYear > 9999) {
            throw new CellErrorException(ErrorKind.NUM);
        }
        double serial = toSerial(LocalDate.of((int) normalizedYear, normalizedMonth, 1)) + day - 1;
        return checkSerial(serial);
    }

    public static double checkSerial(double serial) {
        if (Double.isNaN(serial) || serial < 0 || serial >= MAX_SERIAL + 1) {
            throw new CellErrorException(ErrorKind.NUM);
        }
        return serial;
    }

    /**
     * Year, month and day as a spreadsheet reports them, including the
     * 1900-01-00 and 1900-02-29 serials.
     */
    public static int[] dateParts(double serial) {
        long day = (long) Math.floor(checkSerial(serial));
        if (day == 0) {
            return new int[]{1900, 1, 0};
        }
        if (day == FAKE_LEAP_DAY) {
            return new int[]{1900, 2, 29};
        }
        LocalDate date = toLocalDate(day);
        return new int[]{date.getYear(), date.getMonthValue(), date.getDayOfMonth()};
    }

    /**
     * The calendar date used for date arithmetic. Serial 0 becomes 1899-12-31
     * and the phantom leap day becomes 1900-02-28.
     */
    public static LocalDate toCalendarDate(double serial) {
        long day = (long) Math.floor(checkSerial(serial));
        if (day == FAKE_LEAP_DAY) {
            return LocalDate.of(1900, 2, 28);
        }
        return toLocalDate(day);
    }

    private static LocalDate toLocalDate(long day) {
        if (day < FAKE_LEAP_DAY) {
            return EPOCH_BEFORE_LEAP_DAY.plusDays(day);
        }
        return EPOCH_AFTER_LEAP_DAY.plusDays(day);
    }

    /** Seconds since midnight for the fractional part of a serial. */
    public static int secondOfDay(double serial) {
        checkSerial(serial);
        double fraction = serial - Math.floor(serial);
        long seconds = Math.round(fraction * SECONDS_PER_DAY);
        return (int) Math.min(seconds, (long) SECONDS_PER_DAY - 1);
    }

    /** Weekday index with Sunday as 0, matching the serial calendar. */
    public static int weekdayIndex(double serial) {
        long day = (long) Math.floor(checkSerial(serial));
        return (int) ((day + 6) % 7);
    }

    /**
     * Parses a date string in ISO, US (M/d/yyyy) or month-name form.
     * Returns null if the text is not a recognised date.
     */
    public static LocalDate parseDate(String text) {
        String trimmed = text.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = tryParseDate(trimmed, format);
            if (date != null) {
                return date;
            }
        }
        return null;
    }

    private static LocalDate tryParseDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Parses "HH:mm" or "HH:mm:ss", optionally with AM/PM. Returns null if not a time. */
    public static LocalTime parseTime(String text) {
        String trimmed = text.trim().toUpperCase(Locale.ROOT);
        String[] patterns = {"H:mm", "H:mm:ss", "h:mm a", "h:mm:ss a"};
        for (String pattern : patterns) {
            LocalTime time = tryParseTime(trimmed, DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH));
            if (time != null) {
                return time;
            }
        }
        return null;
    }

    private static LocalTime tryParseTime(String text, DateTimeFormatter format) {
        try {
            return LocalTime.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Serial of a date argument: numbers and dates as-is, text parsed as a
     * date, a time or a number, booleans are #VALUE!.
     */
    public static double toSerial(CellValue value) {
        if (value.isError()) {
            throw new CellErrorException(value.getError());
        }
        if (value.isBool()) {
            throw new CellErrorException(ErrorKind.VALUE);
        }
        if (value.isText()) {
            LocalDate date = parseDate(value.getText());
            if (date != null) {
                return toSerial(date);
            }
            LocalTime time = parseTime(value.getText());
            if (time != null) {
                return time.toSecondOfDay() / SECONDS_PER_DAY;
            }
        }
        return checkSerial(Coercions.toNumber(value));
    }
}
