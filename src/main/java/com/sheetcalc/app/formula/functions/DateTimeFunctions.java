package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Date and time functions over serial day numbers (see {@link ExcelDates}).
 */
public final class DateTimeFunctions {

    private DateTimeFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("DATE", 3, 3, args -> CellValue.date(
                ExcelDates.fromParts(args.integer(0), args.integer(1), args.integer(2))));
        registry.register("TIME", 3, 3, DateTimeFunctions::time);
        registry.register("TODAY", 0, 0, args -> CellValue.date(ExcelDates.toSerial(LocalDate.now(args.clock()))));
        registry.register("NOW", 0, 0, args -> CellValue.date(ExcelDates.toSerial(LocalDateTime.now(args.clock()))));
        registry.register("YEAR", 1, 1, args -> CellValue.number(ExcelDates.dateParts(serial(args, 0))[0]));
        registry.register("MONTH", 1, 1, args -> CellValue.number(ExcelDates.dateParts(serial(args, 0))[1]));
        registry.register("DAY", 1, 1, args -> CellValue.number(ExcelDates.dateParts(serial(args, 0))[2]));
        registry.register("HOUR", 1, 1, args -> CellValue.number(ExcelDates.secondOfDay(serial(args, 0)) / 3600));
        registry.register("MINUTE", 1, 1, args -> CellValue.number(ExcelDates.secondOfDay(serial(args, 0)) / 60 % 60));
        registry.register("SECOND", 1, 1, args -> CellValue.number(ExcelDates.secondOfDay(serial(args, 0)) % 60));
        registry.register("DATEDIF", 3, 3, DateTimeFunctions::dateDif);
        registry.register("EDATE", 2, 2, args -> CellValue.date(ExcelDates.toSerial(addMonths(args))));
        registry.register("EOMONTH", 2, 2, args -> {
            LocalDate shifted = addMonths(args);
            return CellValue.date(ExcelDates.toSerial(shifted.withDayOfMonth(shifted.lengthOfMonth())));
        });
        registry.register("DATEVALUE", 1, 1, args -> {
            LocalDate date = ExcelDates.parseDate(args.text(0));
            return date == null ? CellValue.error(ErrorKind.VALUE) : CellValue.date(ExcelDates.toSerial(date));
        });
        registry.register("WEEKDAY", 1, 2, DateTimeFunctions::weekday);
        registry.register("WEEKNUM", 1, 2, DateTimeFunctions::weekNum);
        registry.register("NETWORKDAYS", 2, 3, DateTimeFunctions::networkDays);
        registry.register("WORKDAY", 2, 3, DateTimeFunctions::workday);
    }

    private static double serial(FunctionArgs args, int index) {
        return ExcelDates.toSerial(args.value(index));
    }

    private static CellValue time(FunctionArgs args) {
        long seconds = args.integer(0) * 3600L + args.integer(1) * 60L + args.integer(2);
        if (seconds < 0) {
            return CellValue.error(ErrorKind.NUM);
        }
        return CellValue.number((seconds % 86_400) / ExcelDates.SECONDS_PER_DAY);
    }

    private static LocalDate addMonths(FunctionArgs args) {
        LocalDate start = ExcelDates.toCalendarDate(serial(args, 0));
        LocalDate shifted = start.plusMonths(args.integer(1));
        if (shifted.getYear() < 1900 || shifted.getYear() > 9999) {
            throw new CellErrorException(ErrorKind.NUM);
        }
        return shifted;
    }

    /**
     * DATEDIF(start, end, unit) with units Y, M, D, YM, YD and MD.
     */
    private static CellValue dateDif(FunctionArgs args) {
        double startSerial = serial(args, 0);
        double endSerial = serial(args, 1);
        String unit = args.text(2).toUpperCase(Locale.ROOT);
        if (startSerial > endSerial) {
            return CellValue.error(ErrorKind.NUM);
        }
        LocalDate start = ExcelDates.toCalendarDate(startSerial);
        LocalDate end = ExcelDates.toCalendarDate(endSerial);
        switch (unit) {
            case "Y":
                return CellValue.number(ChronoUnit.YEARS.between(start, end));
            case "M":
                return CellValue.number(ChronoUnit.MONTHS.between(start, end));
            case "D":
                return CellValue.number(Math.floor(endSerial) - Math.floor(startSerial));
            case "YM":
                return CellValue.number(ChronoUnit.MONTHS.between(start, end) % 12);
            case "YD": {
                LocalDate anniversary = sameDayIn(start, end.getYear());
                if (anniversary.isAfter(end)) {
                    anniversary = sameDayIn(start, end.getYear() - 1);
                }
                return CellValue.number(ChronoUnit.DAYS.between(anniversary, end));
            }
            case "MD": {
                int days = end.getDayOfMonth() - start.getDayOfMonth();
                if (days < 0) {
                    days += YearMonth.from(end.minusMonths(1)).lengthOfMonth();
                }
                return CellValue.number(days);
            }
            default:
                return CellValue.error(ErrorKind.NUM);
        }
    }

    private static LocalDate sameDayIn(LocalDate date, int year) {
        YearMonth month = YearMonth.of(year, date.getMonthValue());
        return month.atDay(Math.min(date.getDayOfMonth(), month.lengthOfMonth()));
    }

    /**
     * return_type 1: Sunday=1..Saturday=7, 2: Monday=1..Sunday=7,
     * 3: Monday=0..Sunday=6.
     */
    private static CellValue weekday(FunctionArgs args) {
        int sundayBased = ExcelDates.weekdayIndex(serial(args, 0));
        int mondayBased = (sundayBased + 6) % 7;
        switch (args.integer(1, 1)) {
            case 1:
                return CellValue.number(sundayBased + 1);
            case 2:
                return CellValue.number(mondayBased + 1);
            case 3:
                return CellValue.number(mondayBased);
            default:
                return CellValue.error(ErrorKind.NUM);
        }
    }

    /** Week of the year; weeks start on Sunday (type 1) or Monday (type 2). */
    private static CellValue weekNum(FunctionArgs args) {
        double serial = Math.floor(serial(args, 0));
        int returnType = args.integer(1, 1);
        if (returnType != 1 && returnType != 2) {
            return CellValue.error(ErrorKind.NUM);
        }
        int year = ExcelDates.dateParts(serial)[0];
        double januaryFirst = ExcelDates.fromParts(year, 1, 1);
        int jan1Weekday = ExcelDates.weekdayIndex(januaryFirst);
        int offset = returnType == 1 ? jan1Weekday : (jan1Weekday + 6) % 7;
        long dayOfYear = (long) (serial - januaryFirst) + 1;
        return CellValue.number((dayOfYear - 1 + offset) / 7 + 1);
    }

    private static CellValue networkDays(FunctionArgs args) {
        long start = (long) Math.floor(serial(args, 0));
        long end = (long) Math.floor(serial(args, 1));
        Set<Long> holidays = holidays(args, 2);
        int sign = 1;
        if (start > end) {
            long tmp = start;
            start = end;
            end = tmp;
            sign = -1;
        }
        long count = 0;
        for (long day = start; day <= end; day++) {
            if (isWorkday(day, holidays)) {
                count++;
            }
        }
        return CellValue.number(sign * count);
    }

    private static CellValue workday(FunctionArgs args) {
        long day = (long) Math.floor(serial(args, 0));
        int days = args.integer(1);
        Set<Long> holidays = holidays(args, 2);
        int step = days >= 0 ? 1 : -1;
        int remaining = Math.abs(days);
        while (remaining > 0) {
            day += step;
            ExcelDates.checkSerial(day);
            if (isWorkday(day, holidays)) {
                remaining--;
            }
        }
        return CellValue.date(day);
    }

    private static boolean isWorkday(long day, Set<Long> holidays) {
        int weekday = ExcelDates.weekdayIndex(day);
        return weekday != 0 && weekday != 6 && !holidays.contains(day);
    }

    private static Set<Long> holidays(FunctionArgs args, int index) {
        Set<Long> result = new HashSet<>();
        if (index >= args.size()) {
            return result;
        }
        for (CellValue v : args.values(index)) {
            if (!v.isEmpty()) {
                result.add((long) Math.floor(ExcelDates.toSerial(v)));
            }
        }
        return result;
    }
}
