package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the serial date calendar, including its 1900 leap-year quirk.
 */
class ExcelDatesTest {

    @Test
    void testSerialsAroundTheFakeLeapDay() {
        assertEquals(1, ExcelDates.fromParts(1900, 1, 1));
        assertEquals(59, ExcelDates.fromParts(1900, 2, 28));
        assertEquals(60, ExcelDates.fromParts(1900, 2, 29));
        assertEquals(61, ExcelDates.fromParts(1900, 3, 1));
        assertEquals(61, ExcelDates.toSerial(LocalDate.of(1900, 3, 1)));
        assertEquals(45306, ExcelDates.toSerial(LocalDate.of(2024, 1, 15)));
        assertEquals(2958465, ExcelDates.fromParts(9999, 12, 31));
    }

    @Test
    void testDateParts() {
        assertArrayEquals(new int[]{1900, 1, 0}, ExcelDates.dateParts(0));
        assertArrayEquals(new int[]{1900, 2, 29}, ExcelDates.dateParts(60));
        assertArrayEquals(new int[]{1900, 3, 1}, ExcelDates.dateParts(61));
        assertArrayEquals(new int[]{2024, 1, 15}, ExcelDates.dateParts(45306.75));
    }

    /**
     * The phantom 1900-02-29 behaves as 1900-02-28 in calendar arithmetic.
     */
    @Test
    void testCalendarDate() {
        assertEquals(LocalDate.of(1900, 2, 28), ExcelDates.toCalendarDate(60));
        assertEquals(LocalDate.of(1900, 2, 28), ExcelDates.toCalendarDate(59));
        assertEquals(LocalDate.of(1900, 3, 1), ExcelDates.toCalendarDate(61));
    }

    @Test
    void testTimeOfDayAndWeekday() {
        assertEquals(43200, ExcelDates.secondOfDay(0.5));
        assertEquals(0, ExcelDates.secondOfDay(45306));
        // serial 1 (1900-01-01) reads as a Sunday
        assertEquals(0, ExcelDates.weekdayIndex(1));
        assertEquals(1, ExcelDates.weekdayIndex(45306));
    }

    @Test
    void testOutOfRangeSerials() {
        CellErrorException negative = assertThrows(CellErrorException.class, () -> ExcelDates.checkSerial(-1));
        assertEquals(ErrorKind.NUM, negative.getKind());
        assertThrows(CellErrorException.class, () -> ExcelDates.checkSerial(2958466));
        assertThrows(CellErrorException.class, () -> ExcelDates.fromParts(-1, 1, 1));
        assertThrows(CellErrorException.class, () -> ExcelDates.toSerial(LocalDate.of(1899, 12, 1)));
    }

    @Test
    void testParsing() {
        assertEquals(LocalDate.of(2024, 3, 5), ExcelDates.parseDate("March 5, 2024"));
        assertEquals(LocalDate.of(2024, 3, 5), ExcelDates.parseDate("5-mar-2024"));
        assertEquals(LocalDate.of(2024, 3, 5), ExcelDates.parseDate("2024/3/5"));
        assertNull(ExcelDates.parseDate("5th of March"));
        assertEquals(LocalTime.of(14, 45), ExcelDates.parseTime("2:45 pm"));
        assertEquals(LocalTime.of(8, 5, 30), ExcelDates.parseTime("8:05:30"));
        assertNull(ExcelDates.parseTime("noon"));
    }

    @Test
    void testSerialOfCellValues() {
        assertEquals(45306, ExcelDates.toSerial(CellValue.text("2024-01-15")));
        assertEquals(0.25, ExcelDates.toSerial(CellValue.text("6:00")));
        assertEquals(12.5, ExcelDates.toSerial(CellValue.text("12.5")));
        assertEquals(0, ExcelDates.toSerial(CellValue.empty()));
        assertThrows(CellErrorException.class, () -> ExcelDates.toSerial(CellValue.bool(true)));
        CellErrorException error = assertThrows(CellErrorException.class,
                () -> ExcelDates.toSerial(CellValue.error(ErrorKind.REF)));
        assertEquals(ErrorKind.REF, error.getKind());
    }
}
