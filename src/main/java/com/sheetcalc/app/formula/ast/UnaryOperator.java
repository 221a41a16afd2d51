package com.sheetcalc.app.formula.ast;

public enum UnaryOperator {
    NEGATE,
    PLUS,
    PERCENT
}
