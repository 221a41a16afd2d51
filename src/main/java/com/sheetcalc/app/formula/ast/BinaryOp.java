package com.sheetcalc.app.formula.ast;

import java.util.Objects;

/**
 * An infix operation. Rendered fully parenthesized so the text re-parses
 * to the same tree shape regardless of precedence.
 */
public final class BinaryOp extends AstNode {
    private final BinaryOperator op;
    private final AstNode lhs;
    private final AstNode rhs;

    public BinaryOp(BinaryOperator op, AstNode lhs, AstNode rhs) {
        this.op = op;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public BinaryOperator getOp() {
        return op;
    }

    public AstNode getLhs() {
        return lhs;
    }

    public AstNode getRhs() {
        return rhs;
    }

    @Override
    public String toFormula() {
        return "(" + lhs.toFormula() + op.getSymbol() + rhs.toFormula() + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryOp)) {
            return false;
        }
        BinaryOp that = (BinaryOp) o;
        return op == that.op && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, lhs, rhs);
    }
}
