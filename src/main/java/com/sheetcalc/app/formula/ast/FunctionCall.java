package com.sheetcalc.app.formula.ast;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call such as SUM(A1:A3, 4). The name is stored upper-cased.
 */
public final class FunctionCall extends AstNode {
    private final String name;
    private final List<AstNode> args;

    public FunctionCall(String name, List<AstNode> args) {
        this.name = name.toUpperCase(Locale.ROOT);
        this.args = Collections.unmodifiableList(args);
    }

    public String getName() {
        return name;
    }

    public List<AstNode> getArgs() {
        return args;
    }

    @Override
    public String toFormula() {
        return name + "(" + args.stream().map(AstNode::toFormula).collect(Collectors.joining(",")) + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCall)) {
            return false;
        }
        FunctionCall that = (FunctionCall) o;
        return name.equals(that.name) && args.equals(that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args);
    }
}
