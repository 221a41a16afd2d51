package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.formula.eval.RangeValues;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.sheetcalc.app.formula.eval.Evaluator.number;
import static com.sheetcalc.app.formula.functions.FunctionRegistry.VARIADIC;

/**
 * Statistical functions.
 */
public final class StatisticalFunctions {

    private StatisticalFunctions() {
    }

    public static void register(FunctionRegistry registry) {
        registry.register("AVERAGE", 1, VARIADIC, args -> average(args.numbers()));
        registry.register("AVERAGEIF", 2, 3, StatisticalFunctions::averageIf);
        registry.register("AVERAGEIFS", 3, VARIADIC, StatisticalFunctions::averageIfs);
        registry.register("COUNT", 1, VARIADIC, StatisticalFunctions::count);
        registry.register("COUNTA", 1, VARIADIC, StatisticalFunctions::countA);
        registry.register("COUNTBLANK", 1, 1, StatisticalFunctions::countBlank);
        registry.register("COUNTIF", 2, 2, StatisticalFunctions::countIf);
        registry.register("COUNTIFS", 2, VARIADIC, StatisticalFunctions::countIfs);
        registry.register("MIN", 1, VARIADIC, args -> extreme(args.numbers(), false));
        registry.register("MAX", 1, VARIADIC, args -> extreme(args.numbers(), true));
        registry.register("MEDIAN", 1, VARIADIC, StatisticalFunctions::median);
        registry.register("MODE", 1, VARIADIC, StatisticalFunctions::mode);
        registry.register("LARGE", 2, 2, args -> kth(args, true));
        registry.register("SMALL", 2, 2, args -> kth(args, false));
        registry.register("RANK", 2, 3, StatisticalFunctions::rank);
        registry.register("STDEV", 1, VARIADIC, args -> {
            double variance = sampleVariance(args.numbers());
            return number(Math.sqrt(variance));
        });
        registry.register("VAR", 1, VARIADIC, args -> number(sampleVariance(args.numbers())));
    }

    private static CellValue average(List<Double> numbers) {
        if (numbers.isEmpty()) {
            return CellValue.error(ErrorKind.DIV_BY_ZERO);
        }
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return number(total / numbers.size());
    }

    private static CellValue averageIf(FunctionArgs args) {
        RangeValues range = args.range(0);
        Criteria criteria = Criteria.of(args.value(1));
        RangeValues averageRange = args.size() > 2 ? args.range(2) : range;
        List<Double> matched = new ArrayList<>();
        for (int i = 0; i < range.size(); i++) {
            if (criteria.matches(range.getValues().get(i))) {
                addIfNumeric(MathFunctions.cellAt(averageRange, range, i), matched);
            }
        }
        return average(matched);
    }

    private static CellValue averageIfs(FunctionArgs args) {
        if (args.size() % 2 == 0) {
            return CellValue.error(ErrorKind.VALUE);
        }
        RangeValues averageRange = args.range(0);
        List<Double> matched = new ArrayList<>();
        for (int i : MathFunctions.matchAll(args, 1, averageRange)) {
            addIfNumeric(averageRange.getValues().get(i), matched);
        }
        return average(matched);
    }

    private static void addIfNumeric(CellValue value, List<Double> into) {
        if (value.isError()) {
            throw new CellErrorException(value.getError());
        }
        if (value.isNumeric()) {
            into.add(value.getNumber());
        }
    }

    private static CellValue count(FunctionArgs args) {
        int count = 0;
        for (int i = 0; i < args.size(); i++) {
            if (args.isReference(i)) {
                for (CellValue v : args.values(i)) {
                    if (v.isNumeric()) {
                        count++;
                    }
                }
            } else {
                CellValue v = args.value(i);
                if (v.isNumeric() || v.isBool() || (v.isText() && Coercions.parseNumber(v.getText()) != null)) {
                    count++;
                }
            }
        }
        return CellValue.number(count);
    }

    private static CellValue countA(FunctionArgs args) {
        int count = 0;
        for (CellValue v : args.allValues()) {
            if (!v.isEmpty()) {
                count++;
            }
        }
        return CellValue.number(count);
    }

    private static CellValue countBlank(FunctionArgs args) {
        int count = 0;
        for (CellValue v : args.range(0).getValues()) {
            if (v.isEmpty() || (v.isText() && v.getText().isEmpty())) {
                count++;
            }
        }
        return CellValue.number(count);
    }

    private static CellValue countIf(FunctionArgs args) {
        Criteria criteria = Criteria.of(args.value(1));
        int count = 0;
        for (CellValue v : args.range(0).getValues()) {
            if (criteria.matches(v)) {
                count++;
            }
        }
        return CellValue.number(count);
    }

    private static CellValue countIfs(FunctionArgs args) {
        if (args.size() % 2 != 0) {
            return CellValue.error(ErrorKind.VALUE);
        }
        RangeValues shape = args.range(0);
        return CellValue.number(MathFunctions.matchAll(args, 0, shape).size());
    }

    private static CellValue extreme(List<Double> numbers, boolean max) {
        if (numbers.isEmpty()) {
            return CellValue.number(0);
        }
        double result = numbers.get(0);
        for (double n : numbers) {
            result = max ? Math.max(result, n) : Math.min(result, n);
        }
        return number(result);
    }

    private static CellValue median(FunctionArgs args) {
        List<Double> numbers = new ArrayList<>(args.numbers());
        if (numbers.isEmpty()) {
            return CellValue.error(ErrorKind.NUM);
        }
        Collections.sort(numbers);
        int mid = numbers.size() / 2;
        if (numbers.size() % 2 == 1) {
            return number(numbers.get(mid));
        }
        return number((numbers.get(mid - 1) + numbers.get(mid)) / 2);
    }

    /**
     * Most frequent value; ties go to the value seen first. #N/A when no
     * value repeats.
     */
    private static CellValue mode(FunctionArgs args) {
        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (double n : args.numbers()) {
            counts.merge(n, 1, Integer::sum);
        }
        Double best = null;
        int bestCount = 1;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best == null ? CellValue.error(ErrorKind.NOT_AVAILABLE) : CellValue.number(best);
    }

    private static CellValue kth(FunctionArgs args, boolean largest) {
        List<Double> numbers = new ArrayList<>(args.numbers(0));
        double k = Math.ceil(args.number(1));
        if (k < 1 || k > numbers.size()) {
            return CellValue.error(ErrorKind.NUM);
        }
        Collections.sort(numbers);
        int index = largest ? numbers.size() - (int) k : (int) k - 1;
        return number(numbers.get(index));
    }

    private static CellValue rank(FunctionArgs args) {
        double target = args.number(0);
        List<Double> numbers = args.numbers(1);
        boolean ascending = args.number(2, 0) != 0;
        if (!numbers.contains(target)) {
            return CellValue.error(ErrorKind.NOT_AVAILABLE);
        }
        int rank = 1;
        for (double n : numbers) {
            if (ascending ? n < target : n > target) {
                rank++;
            }
        }
        return CellValue.number(rank);
    }

    private static double sampleVariance(List<Double> numbers) {
        if (numbers.size() < 2) {
            throw new CellErrorException(ErrorKind.DIV_BY_ZERO);
        }
        double mean = 0;
        for (double n : numbers) {
            mean += n;
        }
        mean /= numbers.size();
        double squares = 0;
        for (double n : numbers) {
            squares += (n - mean) * (n - mean);
        }
        return squares / (numbers.size() - 1);
    }
}
