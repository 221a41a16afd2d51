package com.sheetcalc.app.formula.functions;

/**
 * A registered function: its canonical name, accepted argument counts and
 * implementation.
 */
public class FunctionDefinition {

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final FormulaFunction function;

    public FunctionDefinition(String name, int minArgs, int maxArgs, FormulaFunction function) {
        if (minArgs < 0 || maxArgs < minArgs) {
            throw new IllegalArgumentException("Invalid argument bounds for " + name + ": " + minArgs + ".." + maxArgs);
        }
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.function = function;
    }

    public String getName() {
        return name;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public FormulaFunction getFunction() {
        return function;
    }

    public boolean accepts(int argCount) {
        return argCount >= minArgs && argCount <= maxArgs;
    }
}
