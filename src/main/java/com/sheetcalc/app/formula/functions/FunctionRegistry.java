package com.sheetcalc.app.formula.functions;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name to function lookup. Names are matched case-insensitively.
 */
public class FunctionRegistry {

    /** Upper bound used for functions that take any number of arguments. */
    public static final int VARIADIC = 255;

    private final Map<String, FunctionDefinition> functions = new TreeMap<>();

    /**
     * Registry holding every built-in function.
     */
    public static FunctionRegistry createDefault() {
        FunctionRegistry registry = new FunctionRegistry();
        MathFunctions.register(registry);
        StatisticalFunctions.register(registry);
        LogicalFunctions.register(registry);
        TextFunctions.register(registry);
        InformationFunctions.register(registry);
        ConversionFunctions.register(registry);
        DateTimeFunctions.register(registry);
        LookupFunctions.register(registry);
        return registry;
    }

    /**
     * Registers a function, replacing any previous one with the same name.
     */
    public void register(String name, int minArgs, int maxArgs, FormulaFunction function) {
        String key = name.toUpperCase(Locale.ROOT);
        functions.put(key, new FunctionDefinition(key, minArgs, maxArgs, function));
    }

    /**
     * Retrieves a function by name, or null if no such function exists.
     */
    public FunctionDefinition lookup(String name) {
        return functions.get(name.toUpperCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public int size() {
        return functions.size();
    }
}
