package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.RangeValues;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import static com.sheetcalc.app.formula.eval.Evaluator.number;
import static com.sheetcalc.app.formula.functions.FunctionRegistry.VARIADIC;

/**
 * Math and trigonometry functions.
 */
public final class MathFunctions {

    // 2^53, beyond which a double no longer holds every integer
    private static final double MAX_EXACT_INTEGER = 9_007_199_254_740_992d;

    private MathFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("SUM", 1, VARIADIC, MathFunctions::sum);
        registry.register("PRODUCT", 1, VARIADIC, MathFunctions::product);
        registry.register("ABS", 1, 1, args -> number(Math.abs(args.number(0))));
        registry.register("INT", 1, 1, args -> number(Math.floor(args.number(0))));
        registry.register("ROUND", 2, 2, args -> round(args, RoundingMode.HALF_UP));
        registry.register("ROUNDUP", 2, 2, args -> round(args, RoundingMode.UP));
        registry.register("ROUNDDOWN", 2, 2, args -> round(args, RoundingMode.DOWN));
        registry.register("MOD", 2, 2, MathFunctions::mod);
        registry.register("POWER", 2, 2, MathFunctions::power);
        registry.register("SQRT", 1, 1, MathFunctions::sqrt);
        registry.register("SIGN", 1, 1, args -> number(Math.signum(args.number(0))));
        registry.register("CEILING", 2, 2, MathFunctions::ceiling);
        registry.register("FLOOR", 2, 2, MathFunctions::floor);
        registry.register("QUOTIENT", 2, 2, MathFunctions::quotient);
        registry.register("FACT", 1, 1, MathFunctions::fact);
        registry.register("PI", 0, 0, args -> CellValue.number(Math.PI));
        registry.register("EXP", 1, 1, args -> number(Math.exp(args.number(0))));
        registry.register("LN", 1, 1, args -> number(Math.log(positive(args.number(0)))));
        registry.register("LOG", 1, 2, MathFunctions::log);
        registry.register("LOG10", 1, 1, args -> number(Math.log10(positive(args.number(0)))));
        registry.register("RAND", 0, 0, args -> CellValue.number(ThreadLocalRandom.current().nextDouble()));
        registry.register("RANDBETWEEN", 2, 2, MathFunctions::randBetween);
        registry.register("SUMIF", 2, 3, MathFunctions::sumIf);
        registry.register("SUMIFS", 3, VARIADIC, MathFunctions::sumIfs);
        registry.register("SUMPRODUCT", 1, VARIADIC, MathFunctions::sumProduct);
    }

    private static CellValue sum(FunctionArgs args) {
        double total = 0;
        for (double n : args.numbers()) {
            total += n;
        }
        return number(total);
    }

    private static CellValue product(FunctionArgs args) {
        List<Double> numbers = args.numbers();
        if (numbers.isEmpty()) {
            return CellValue.number(0);
        }
        double result = 1;
        for (double n : numbers) {
            result *= n;
        }
        return number(result);
    }

    private static CellValue round(FunctionArgs args, RoundingMode mode) {
        double value = args.number(0);
        int digits = args.integer(1);
        return number(round(value, digits, mode));
    }

    static double round(double value, int digits, RoundingMode mode) {
        return BigDecimal.valueOf(value).setScale(digits, mode).doubleValue();
    }

    private static CellValue mod(FunctionArgs args) {
        double n = args.number(0);
        double d = args.number(1);
        if (d == 0) {
            return CellValue.error(ErrorKind.DIV_BY_ZERO);
        }
        return number(n - d * Math.floor(n / d));
    }

    private static CellValue power(FunctionArgs args) {
        double base = args.number(0);
        double exponent = args.number(1);
        if (base == 0 && exponent < 0) {
            return CellValue.error(ErrorKind.DIV_BY_ZERO);
        }
        return number(Math.pow(base, exponent));
    }

    private static CellValue sqrt(FunctionArgs args) {
        double n = args.number(0);
        if (n < 0) {
            return CellValue.error(ErrorKind.NUM);
        }
        return number(Math.sqrt(n));
    }

    private static CellValue ceiling(FunctionArgs args) {
        double n = args.number(0);
        double significance = args.number(1);
        if (significance == 0) {
            return CellValue.number(0);
        }
        if (n > 0 && significance < 0) {
            return CellValue.error(ErrorKind.NUM);
        }
        return number(Math.ceil(n / significance) * significance);
    }

    private static CellValue floor(FunctionArgs args) {
        double n = args.number(0);
        double significance = args.number(1);
        if (significance == 0) {
            return CellValue.error(ErrorKind.DIV_BY_ZERO);
        }
        if (n > 0 && significance < 0) {
            return CellValue.error(ErrorKind.NUM);
        }
        return number(Math.floor(n / significance) * significance);
    }

    private static CellValue quotient(FunctionArgs args) {
        double n = args.number(0);
        double d = args.number(1);
        if (d == 0) {
            return CellValue.error(ErrorKind.DIV_BY_ZERO);
        }
        double q = n / d;
        return number(q < 0 ? Math.ceil(q) : Math.floor(q));
    }

    private static CellValue fact(FunctionArgs args) {
        double n = Math.floor(args.number(0));
        if (n < 0) {
            return CellValue.error(ErrorKind.NUM);
        }
        double result = 1;
        for (int i = 2; i <= n && Double.isFinite(result); i++) {
            result *= i;
        }
        return number(result);
    }

    private static CellValue log(FunctionArgs args) {
        double n = positive(args.number(0));
        double base = positive(args.number(1, 10));
        if (base == 1) {
            return CellValue.error(ErrorKind.DIV_BY_ZERO);
        }
        return number(Math.log(n) / Math.log(base));
    }

    private static double positive(double n) {
        if (n <= 0) {
            throw new CellErrorException(ErrorKind.NUM);
        }
        return n;
    }

    private static CellValue randBetween(FunctionArgs args) {
        double low = Math.ceil(args.number(0));
        double high = Math.floor(args.number(1));
        if (low > high || Math.abs(low) > MAX_EXACT_INTEGER || Math.abs(high) > MAX_EXACT_INTEGER) {
            return CellValue.error(ErrorKind.NUM);
        }
        return CellValue.number(ThreadLocalRandom.current().nextLong((long) low, (long) high + 1));
    }

    private static CellValue sumIf(FunctionArgs args) {
        RangeValues range = args.range(0);
        Criteria criteria = Criteria.of(args.value(1));
        RangeValues sumRange = args.size() > 2 ? args.range(2) : range;
        double total = 0;
        for (int i = 0; i < range.size(); i++) {
            if (criteria.matches(range.getValues().get(i))) {
                total += numericOrZero(cellAt(sumRange, range, i));
            }
        }
        return number(total);
    }

    private static CellValue sumIfs(FunctionArgs args) {
        if (args.size() % 2 == 0) {
            return CellValue.error(ErrorKind.VALUE);
        }
        RangeValues sumRange = args.range(0);
        List<Integer> matching = matchAll(args, 1, sumRange);
        double total = 0;
        for (int i : matching) {
            total += numericOrZero(sumRange.getValues().get(i));
        }
        return number(total);
    }

    /**
     * Indexes (into a range shaped like {@code shape}) of the cells that meet
     * every criteria_range/criteria pair starting at argument {@code first}.
     */
    static List<Integer> matchAll(FunctionArgs args, int first, RangeValues shape) {
        List<RangeValues> ranges = new ArrayList<>();
        List<Criteria> criteria = new ArrayList<>();
        for (int i = first; i + 1 < args.size(); i += 2) {
            RangeValues range = args.range(i);
            if (range.getRows() != shape.getRows() || range.getCols() != shape.getCols()) {
                throw new CellErrorException(ErrorKind.VALUE);
            }
            ranges.add(range);
            criteria.add(Criteria.of(args.value(i + 1)));
        }
        List<Integer> matching = new ArrayList<>();
        for (int cell = 0; cell < shape.size(); cell++) {
            boolean all = true;
            for (int c = 0; c < ranges.size() && all; c++) {
                all = criteria.get(c).matches(ranges.get(c).getValues().get(cell));
            }
            if (all) {
                matching.add(cell);
            }
        }
        return matching;
    }

    /**
     * The cell of {@code target} at the same row/column offset as index
     * {@code i} of {@code source}, or empty outside the target.
     */
    static CellValue cellAt(RangeValues target, RangeValues source, int i) {
        int row = i / source.getCols();
        int col = i % source.getCols();
        if (row >= target.getRows() || col >= target.getCols()) {
            return CellValue.empty();
        }
        return target.get(row, col);
    }

    private static double numericOrZero(CellValue value) {
        if (value.isError()) {
            throw new CellErrorException(value.getError());
        }
        return value.isNumeric() ? value.getNumber() : 0;
    }

    private static CellValue sumProduct(FunctionArgs args) {
        List<List<CellValue>> arrays = new ArrayList<>();
        int rows = -1;
        int cols = -1;
        for (int i = 0; i < args.size(); i++) {
            RangeValues values = args.isReference(i) ? args.range(i) : RangeValues.single(args.scalar(i));
            if (rows >= 0 && (values.getRows() != rows || values.getCols() != cols)) {
                return CellValue.error(ErrorKind.VALUE);
            }
            rows = values.getRows();
            cols = values.getCols();
            arrays.add(values.getValues());
        }
        double total = 0;
        for (int cell = 0; cell < rows * cols; cell++) {
            double product = 1;
            for (List<CellValue> array : arrays) {
                product *= numericOrZero(array.get(cell));
            }
            total += product;
        }
        return number(total);
    }
}
