package com.sheetcalc.app.formula.ast;

import java.util.Objects;

/**
 * Prefix negation / plus, or postfix percent.
 */
public final class UnaryOp extends AstNode {
    private final UnaryOperator op;
    private final AstNode operand;

    public UnaryOp(UnaryOperator op, AstNode operand) {
        this.op = op;
        this.operand = operand;
    }

    public UnaryOperator getOp() {
        return op;
    }

    public AstNode getOperand() {
        return operand;
    }

    @Override
    public String toFormula() {
        String inner = operand.toFormula();
        switch (op) {
            case NEGATE:
                return "-" + inner;
            case PLUS:
                return "+" + inner;
            default:
                return inner + "%";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryOp)) {
            return false;
        }
        UnaryOp that = (UnaryOp) o;
        return op == that.op && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, operand);
    }
}
