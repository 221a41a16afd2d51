package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.formula.ast.AstNode;
import com.sheetcalc.app.formula.ast.CellRef;
import com.sheetcalc.app.formula.ast.RangeRef;
import com.sheetcalc.app.formula.eval.CellErrorException;
import com.sheetcalc.app.formula.eval.Coercions;
import com.sheetcalc.app.formula.eval.EvaluationContext;
import com.sheetcalc.app.formula.eval.Evaluator;
import com.sheetcalc.app.formula.eval.RangeValues;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The arguments of one function call, evaluated on demand.
 *
 * The typed accessors ({@link #number}, {@link #text}, {@link #bool}) throw
 * {@link CellErrorException} for error operands and values that do not
 * coerce; the evaluator turns that into the call's error result. Functions
 * that must see errors use {@link #value} instead.
 */
public class FunctionArgs {

    private final Evaluator evaluator;
    private final List<AstNode> nodes;
    private final EvaluationContext context;

    public FunctionArgs(Evaluator evaluator, List<AstNode> nodes, EvaluationContext context) {
        this.evaluator = evaluator;
        this.nodes = nodes;
        this.context = context;
    }

    public int size() {
        return nodes.size();
    }

    public AstNode node(int index) {
        return nodes.get(index);
    }

    public EvaluationContext context() {
        return context;
    }

    public Clock clock() {
        return context.getClock();
    }

    /** The cell whose formula is being computed, or null for ad hoc formulas. */
    public CellAddress currentCell() {
        return context.getCurrentCell();
    }

    // ------------------------
    // Scalar access
    // ------------------------

    /**
     * The evaluated argument, error values included. A bare range is #VALUE!.
     */
    public CellValue value(int index) {
        return evaluator.evaluate(nodes.get(index), context);
    }

    /** The evaluated argument; an error value is raised. */
    public CellValue scalar(int index) {
        CellValue v = value(index);
        if (v.isError()) {
            throw new CellErrorException(v.getError());
        }
        return v;
    }

    public double number(int index) {
        return Coercions.toNumber(value(index));
    }

    public double number(int index, double defaultValue) {
        return index < nodes.size() ? number(index) : defaultValue;
    }

    /** The argument as a number truncated toward zero. */
    public int integer(int index) {
        double n = number(index);
        if (Math.abs(n) >= Integer.MAX_VALUE) {
            throw new CellErrorException(ErrorKind.NUM);
        }
        return (int) n;
    }

    public int integer(int index, int defaultValue) {
        return index < nodes.size() ? integer(index) : defaultValue;
    }

    public String text(int index) {
        return Coercions.toText(value(index));
    }

    public String text(int index, String defaultValue) {
        return index < nodes.size() ? text(index) : defaultValue;
    }

    public boolean bool(int index) {
        return Coercions.toBool(value(index));
    }

    public boolean bool(int index, boolean defaultValue) {
        return index < nodes.size() ? bool(index) : defaultValue;
    }

    // ------------------------
    // Reference access
    // ------------------------

    public boolean isReference(int index) {
        AstNode node = nodes.get(index);
        return node instanceof CellRef || node instanceof RangeRef;
    }

    /**
     * The argument as a rectangular block. A single cell reference is a 1x1
     * block; anything that is not a reference is #VALUE!.
     */
    public RangeValues range(int index) {
        AstNode node = nodes.get(index);
        if (node instanceof RangeRef) {
            return evaluator.expandRange((RangeRef) node, context);
        }
        if (node instanceof CellRef) {
            CellAddress address = evaluator.resolveAddress((CellRef) node, context);
            if (address == null) {
                throw new CellErrorException(ErrorKind.REF);
            }
            return RangeValues.single(evaluator.readCell(address, context));
        }
        throw new CellErrorException(ErrorKind.VALUE);
    }

    /**
     * The argument flattened to a list: every cell of a reference, or the
     * single evaluated value otherwise. Errors are kept as values.
     */
    public List<CellValue> values(int index) {
        if (isReference(index)) {
            try {
                return range(index).getValues();
            } catch (CellErrorException e) {
                return Collections.singletonList(CellValue.error(e.getKind()));
            }
        }
        return Collections.singletonList(value(index));
    }

    /** Every argument flattened, in order. */
    public List<CellValue> allValues() {
        List<CellValue> all = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            all.addAll(values(i));
        }
        return all;
    }

    /**
     * Numbers for aggregate functions. Values from references contribute
     * only when numeric; directly passed values are coerced. Any error is
     * raised.
     */
    public List<Double> numbers() {
        List<Double> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            collectNumbers(i, result);
        }
        return result;
    }

    /** {@link #numbers()} for a single argument. */
    public List<Double> numbers(int index) {
        List<Double> result = new ArrayList<>();
        collectNumbers(index, result);
        return result;
    }

    private void collectNumbers(int index, List<Double> result) {
        if (isReference(index)) {
            for (CellValue v : values(index)) {
                if (v.isError()) {
                    throw new CellErrorException(v.getError());
                }
                if (v.isNumeric()) {
                    result.add(v.getNumber());
                }
            }
            return;
        }
        CellValue v = value(index);
        if (v.isEmpty()) {
            return;
        }
        result.add(Coercions.toNumber(v));
    }
}
