package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.ast.RangeRef;
import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

/**
 * IS* predicates and the other functions that inspect a value's type.
 * All of them see error values instead of propagating them, except
 * ISEVEN and ISODD.
 */
public final class InformationFunctions {

    private InformationFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("ISNUMBER", 1, 1, args -> CellValue.bool(args.value(0).isNumeric()));
        registry.register("ISTEXT", 1, 1, args -> CellValue.bool(args.value(0).isText()));
        registry.register("ISNONTEXT", 1, 1, args -> CellValue.bool(!args.value(0).isText()));
        registry.register("ISBLANK", 1, 1, args -> CellValue.bool(args.value(0).isEmpty()));
        registry.register("ISERROR", 1, 1, args -> CellValue.bool(args.value(0).isError()));
        registry.register("ISERR", 1, 1, args -> {
            CellValue v = args.value(0);
            return CellValue.bool(v.isError() && v.getError() != ErrorKind.NOT_AVAILABLE);
        });
        registry.register("ISNA", 1, 1, args -> {
            CellValue v = args.value(0);
            return CellValue.bool(v.isError() && v.getError() == ErrorKind.NOT_AVAILABLE);
        });
        registry.register("ISLOGICAL", 1, 1, args -> CellValue.bool(args.value(0).isBool()));
        registry.register("ISEVEN", 1, 1, args -> CellValue.bool(truncated(args) % 2 == 0));
        registry.register("ISODD", 1, 1, args -> CellValue.bool(truncated(args) % 2 != 0));
        registry.register("TYPE", 1, 1, InformationFunctions::type);
        registry.register("NA", 0, 0, args -> CellValue.error(ErrorKind.NOT_AVAILABLE));
        registry.register("ERROR.TYPE", 1, 1, args -> {
            CellValue v = args.value(0);
            if (!v.isError()) {
                return CellValue.error(ErrorKind.NOT_AVAILABLE);
            }
            return CellValue.number(v.getError().getTypeNumber());
        });
    }

    private static long truncated(FunctionArgs args) {
        CellValue v = args.scalar(0);
        if (v.isBool()) {
            throw new CellErrorException(ErrorKind.VALUE);
        }
        return (long) Coercions.toNumber(v);
    }

    /** 1 number, 2 text, 4 logical, 16 error, 64 array. */
    private static CellValue type(FunctionArgs args) {
        if (args.node(0) instanceof RangeRef) {
            return CellValue.number(64);
        }
        CellValue v = args.value(0);
        if (v.isText()) {
            return CellValue.number(2);
        }
        if (v.isBool()) {
            return CellValue.number(4);
        }
        if (v.isError()) {
            return CellValue.number(16);
        }
        return CellValue.number(1);
    }
}
