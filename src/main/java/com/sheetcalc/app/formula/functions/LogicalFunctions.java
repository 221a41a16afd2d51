package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;

import static com.sheetcalc.app.formula.functions.FunctionRegistry.VARIADIC;

/**
 * Logical functions. IF, IFS, SWITCH, IFERROR and IFNA only evaluate the
 * arguments they need.
 */
public final class LogicalFunctions {

    private LogicalFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("IF", 1, 3, LogicalFunctions::ifFunction);
        registry.register("AND", 1, VARIADIC, args -> {
            boolean result = true;
            for (boolean b : logicals(args)) {
                result &= b;
            }
            return CellValue.bool(result);
        });
        registry.register("OR", 1, VARIADIC, args -> {
            boolean result = false;
            for (boolean b : logicals(args)) {
                result |= b;
            }
            return CellValue.bool(result);
        });
        registry.register("XOR", 1, VARIADIC, args -> {
            int trues = 0;
            for (boolean b : logicals(args)) {
                if (b) {
                    trues++;
                }
            }
            return CellValue.bool(trues % 2 == 1);
        });
        registry.register("NOT", 1, 1, args -> CellValue.bool(!args.bool(0)));
        registry.register("TRUE", 0, 0, args -> CellValue.bool(true));
        registry.register("FALSE", 0, 0, args -> CellValue.bool(false));
        registry.register("IFERROR", 2, 2, args -> {
            CellValue value = args.value(0);
            return value.isError() ? args.value(1) : value;
        });
        registry.register("IFNA", 2, 2, args -> {
            CellValue value = args.value(0);
            return value.isError() && value.getError() == ErrorKind.NOT_AVAILABLE ? args.value(1) : value;
        });
        registry.register("IFS", 2, VARIADIC, LogicalFunctions::ifs);
        registry.register("SWITCH", 3, VARIADIC, LogicalFunctions::switchFunction);
    }

    private static CellValue ifFunction(FunctionArgs args) {
        if (args.bool(0)) {
            return args.size() > 1 ? args.value(1) : CellValue.bool(true);
        }
        return args.size() > 2 ? args.value(2) : CellValue.bool(false);
    }

    private static CellValue ifs(FunctionArgs args) {
        if (args.size() % 2 != 0) {
            return CellValue.error(ErrorKind.VALUE);
        }
        for (int i = 0; i < args.size(); i += 2) {
            if (args.bool(i)) {
                return args.value(i + 1);
            }
        }
        return CellValue.error(ErrorKind.NOT_AVAILABLE);
    }

    /**
     * SWITCH(expression, value1, result1, ..., [default]). Values must match
     * the expression's type exactly; text matches ignoring case.
     */
    private static CellValue switchFunction(FunctionArgs args) {
        CellValue target = args.scalar(0);
        int i = 1;
        for (; i + 1 < args.size(); i += 2) {
            if (Coercions.sameTypeEquals(target, args.scalar(i))) {
                return args.value(i + 1);
            }
        }
        if (i < args.size()) {
            return args.value(i);
        }
        return CellValue.error(ErrorKind.NOT_AVAILABLE);
    }

    /**
     * Logical values of every argument. References contribute only their
     * booleans and numbers; direct arguments must coerce. #VALUE! when there
     * is nothing logical at all.
     */
    private static List<Boolean> logicals(FunctionArgs args) {
        List<Boolean> result = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            if (args.isReference(i)) {
                for (CellValue v : args.values(i)) {
                    if (v.isError()) {
                        throw new CellErrorException(v.getError());
                    }
                    if (v.isBool() || v.isNumeric()) {
                        result.add(Coercions.toBool(v));
                    }
                }
            } else {
                result.add(args.bool(i));
            }
        }
        if (result.isEmpty()) {
            throw new CellErrorException(ErrorKind.VALUE);
        }
        return result;
    }
}
