package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * VALUE, TEXT, N and T.
 */
public final class ConversionFunctions {

    private ConversionFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("VALUE", 1, 1, ConversionFunctions::value);
        registry.register("TEXT", 2, 2, ConversionFunctions::text);
        registry.register("N", 1, 1, ConversionFunctions::n);
        registry.register("T", 1, 1, args -> {
            CellValue v = args.scalar(0);
            return v.isText() ? v : CellValue.text("");
        });
    }

    /**
     * Reads numbers, dates and times out of text.
     */
    private static CellValue value(FunctionArgs args) {
        CellValue v = args.scalar(0);
        if (v.isNumeric() || v.isEmpty()) {
            return CellValue.number(Coercions.toNumber(v));
        }
        if (!v.isText()) {
            return CellValue.error(ErrorKind.VALUE);
        }
        String text = v.getText();
        Double number = Coercions.parseNumber(text);
        if (number != null) {
            return CellValue.number(number);
        }
        LocalDate date = ExcelDates.parseDate(text);
        if (date != null) {
            return CellValue.number(ExcelDates.toSerial(date));
        }
        LocalTime time = ExcelDates.parseTime(text);
        if (time != null) {
            return CellValue.number(time.toSecondOfDay() / ExcelDates.SECONDS_PER_DAY);
        }
        return CellValue.error(ErrorKind.VALUE);
    }

    private static CellValue text(FunctionArgs args) {
        CellValue v = args.scalar(0);
        String format = args.text(1);
        if (v.isText()) {
            Double number = Coercions.parseNumber(v.getText());
            if (number == null) {
                return v;
            }
            return CellValue.text(ValueFormatter.format(number, format));
        }
        if (v.isBool()) {
            return CellValue.text(Coercions.toText(v));
        }
        return CellValue.text(ValueFormatter.format(Coercions.toNumber(v), format));
    }

    private static CellValue n(FunctionArgs args) {
        CellValue v = args.scalar(0);
        if (v.isNumeric()) {
            return CellValue.number(v.getNumber());
        }
        if (v.isBool()) {
            return CellValue.number(v.getBool() ? 1 : 0);
        }
        return CellValue.number(0);
    }
}
