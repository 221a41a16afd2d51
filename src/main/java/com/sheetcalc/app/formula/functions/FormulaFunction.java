package com.sheetcalc.app.formula.functions;

import com.sheetcalc.app.models.CellValue;

/**
 * A built-in function. Arguments arrive unevaluated so that functions such
 * as IF can skip branches and aggregates can expand ranges themselves.
 */
@FunctionalInterface
public interface FormulaFunction {

    CellValue apply(FunctionArgs args);
}
