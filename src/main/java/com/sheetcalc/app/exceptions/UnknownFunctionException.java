package com.sheetcalc.app.exceptions;

/**
 * Thrown for a call to a function name the library does not define, when
 * strict function names are enabled. Otherwise such calls yield #NAME?.
 */
public class UnknownFunctionException extends FormulaEngineException {
    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function: " + functionName);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
