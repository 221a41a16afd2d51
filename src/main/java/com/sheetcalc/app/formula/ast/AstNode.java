package com.sheetcalc.app.formula.ast;

/**
 * A node of a parsed formula. Nodes are immutable once built.
 */
public abstract class AstNode {

    /**
     * Renders this node back to formula text (without a leading '=').
     * Re-parsing the text yields a tree that evaluates to the same value,
     * though the text need not match what was originally typed.
     */
    public abstract String toFormula();

    @Override
    public String toString() {
        return toFormula();
    }
}
