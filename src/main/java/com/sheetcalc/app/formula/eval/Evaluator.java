package com.sheetcalc.app.formula.eval;

import com.sheetcalc.app.exceptions.CircularReferenceException;
import com.sheetcalc.app.exceptions.UnknownFunctionException;
import com.sheetcalc.app.formula.ast.*;
import com.sheetcalc.app.formula.functions.FunctionArgs;
import com.sheetcalc.app.formula.functions.FunctionDefinition;
import com.sheetcalc.app.formula.functions.FunctionRegistry;
import com.sheetcalc.app.formula.parser.FormulaParser;
import com.sheetcalc.app.models.CellAddress;
import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.models.ErrorKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking evaluator. Spreadsheet errors come back as error values;
 * only engine-fatal conditions (recursion limit, a reference loop met while
 * computing cells on the fly, unknown function in strict mode, an
 * unparseable referenced formula) are thrown.
 */
public class Evaluator {

    private final FunctionRegistry functions;
    private final boolean strictFunctionNames;

    public Evaluator(FunctionRegistry functions) {
        this(functions, false);
    }

    public Evaluator(FunctionRegistry functions, boolean strictFunctionNames) {
        this.functions = functions;
        this.strictFunctionNames = strictFunctionNames;
    }

    /**
     * Evaluates a node. The result is never a formula value; it may be empty
     * when the node is a reference to an unset cell.
     */
    public CellValue evaluate(AstNode node, EvaluationContext ctx) {
        if (node instanceof Literal) {
            return ((Literal) node).getValue();
        }
        if (node instanceof ErrorLiteral) {
            return CellValue.error(((ErrorLiteral) node).getKind());
        }
        if (node instanceof CellRef) {
            CellAddress address = resolveAddress((CellRef) node, ctx);
            if (address == null) {
                return CellValue.error(ErrorKind.REF);
            }
            return readCell(address, ctx);
        }
        if (node instanceof RangeRef) {
            // a range only means something as a function argument
            return CellValue.error(ErrorKind.VALUE);
        }
        if (node instanceof UnaryOp) {
            return evaluateUnary((UnaryOp) node, ctx);
        }
        if (node instanceof BinaryOp) {
            return evaluateBinary((BinaryOp) node, ctx);
        }
        if (node instanceof FunctionCall) {
            return evaluateFunction((FunctionCall) node, ctx);
        }
        throw new IllegalArgumentException("Unsupported node " + node.getClass().getSimpleName());
    }

    /**
     * The value a formula cell ends up holding: an unset reference reads as 0.
     */
    public static CellValue toCellResult(CellValue value) {
        if (value == null || value.isEmpty()) {
            return CellValue.number(0);
        }
        return value.resolved();
    }

    /**
     * Reads a cell, computing a formula cell on the fly when the snapshot
     * holds its expression rather than its result.
     *
     * @throws CircularReferenceException if that computation leads back to the cell
     */
    public CellValue readCell(CellAddress address, EvaluationContext ctx) {
        CellSnapshot snapshot = ctx.getSnapshot();
        CellValue value = snapshot.get(address);
        if (!value.isFormula()) {
            return value;
        }
        AstNode ast = FormulaParser.parse(value.getFormula());
        CellValue result;
        ctx.beginCell(address);
        try {
            ctx.enter();
            try {
                result = toCellResult(evaluate(ast, ctx.forCell(address)));
            } finally {
                ctx.exit();
            }
        } finally {
            ctx.endCell(address);
        }
        snapshot.put(address, result);
        return result;
    }

    /**
     * Values of a range, row-major.
     *
     * @throws CellErrorException with #REF! when the range names an unknown sheet
     */
    public RangeValues expandRange(RangeRef range, EvaluationContext ctx) {
        String sheet = ctx.getSnapshot().resolveSheet(range.getSheet() == null ? ctx.getSheet() : range.getSheet());
        if (sheet == null) {
            throw new CellErrorException(ErrorKind.REF);
        }
        List<CellValue> values = new ArrayList<>(range.getRowCount() * range.getColCount());
        for (int row = range.getFirstRow(); row <= range.getLastRow(); row++) {
            for (int col = range.getFirstCol(); col <= range.getLastCol(); col++) {
                values.add(readCell(new CellAddress(sheet, row, col), ctx));
            }
        }
        return new RangeValues(range.getRowCount(), range.getColCount(), values);
    }

    /** Absolute address of a reference, or null if its sheet does not exist. */
    public CellAddress resolveAddress(CellRef ref, EvaluationContext ctx) {
        String sheet = ctx.getSnapshot().resolveSheet(ref.getSheet() == null ? ctx.getSheet() : ref.getSheet());
        if (sheet == null) {
            return null;
        }
        return new CellAddress(sheet, ref.getRow(), ref.getCol());
    }

    private CellValue evaluateUnary(UnaryOp node, EvaluationContext ctx) {
        ctx.enter();
        try {
            CellValue operand = evaluate(node.getOperand(), ctx);
            if (operand.isError()) {
                return operand;
            }
            switch (node.getOp()) {
                case NEGATE:
                    return number(-Coercions.toNumber(operand));
                case PERCENT:
                    return number(Coercions.toNumber(operand) / 100);
                default:
                    return operand.isEmpty() ? CellValue.number(0) : operand;
            }
        } catch (CellErrorException e) {
            return CellValue.error(e.getKind());
        } finally {
            ctx.exit();
        }
    }

    private CellValue evaluateBinary(BinaryOp node, EvaluationContext ctx) {
        ctx.enter();
        try {
            CellValue lhs = evaluate(node.getLhs(), ctx);
            if (lhs.isError()) {
                return lhs;
            }
            CellValue rhs = evaluate(node.getRhs(), ctx);
            if (rhs.isError()) {
                return rhs;
            }
            BinaryOperator op = node.getOp();
            if (op == BinaryOperator.CONCAT) {
                return CellValue.text(Coercions.toText(lhs) + Coercions.toText(rhs));
            }
            if (op.isComparison()) {
                return CellValue.bool(compare(op, Coercions.compare(lhs, rhs)));
            }
            return arithmetic(op, Coercions.toNumber(lhs), Coercions.toNumber(rhs));
        } catch (CellErrorException e) {
            return CellValue.error(e.getKind());
        } finally {
            ctx.exit();
        }
    }

    private static boolean compare(BinaryOperator op, int cmp) {
        switch (op) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case LESS:
                return cmp < 0;
            case LESS_OR_EQUAL:
                return cmp <= 0;
            case GREATER:
                return cmp > 0;
            case GREATER_OR_EQUAL:
                return cmp >= 0;
            default:
                throw new IllegalArgumentException("Not a comparison: " + op);
        }
    }

    private static CellValue arithmetic(BinaryOperator op, double a, double b) {
        switch (op) {
            case ADD:
                return number(a + b);
            case SUBTRACT:
                return number(a - b);
            case MULTIPLY:
                return number(a * b);
            case DIVIDE:
                if (b == 0) {
                    return CellValue.error(ErrorKind.DIV_BY_ZERO);
                }
                return number(a / b);
            case POWER:
                if (a == 0 && b < 0) {
                    return CellValue.error(ErrorKind.DIV_BY_ZERO);
                }
                return number(Math.pow(a, b));
            default:
                throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        }
    }

    private CellValue evaluateFunction(FunctionCall call, EvaluationContext ctx) {
        FunctionDefinition definition = functions.lookup(call.getName());
        if (definition == null) {
            if (strictFunctionNames) {
                throw new UnknownFunctionException(call.getName());
            }
            return CellValue.error(ErrorKind.NAME);
        }
        ctx.enter();
        try {
            if (!definition.accepts(call.getArgs().size())) {
                return CellValue.error(ErrorKind.VALUE);
            }
            CellValue result = definition.getFunction().apply(new FunctionArgs(this, call.getArgs(), ctx));
            if (result == null) {
                return CellValue.empty();
            }
            if (result.isNumeric() && !Double.isFinite(result.getNumber())) {
                return CellValue.error(ErrorKind.NUM);
            }
            return result.resolved();
        } catch (CellErrorException e) {
            return CellValue.error(e.getKind());
        } finally {
            ctx.exit();
        }
    }

    /** Wraps a computed number, mapping NaN and infinities to #NUM!. */
    public static CellValue number(double n) {
        if (Double.isNaN(n) || Double.isInfinite(n)) {
            return CellValue.error(ErrorKind.NUM);
        }
        return CellValue.number(n);
    }
}
