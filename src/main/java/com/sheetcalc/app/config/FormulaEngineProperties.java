package com.sheetcalc.app.config;

import com.sheetcalc.app.formula.eval.EvaluationContext;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Formula engine settings, bound from "sheetcalc.formula.*".
 */
@ConfigurationProperties(prefix = "sheetcalc.formula")
public class FormulaEngineProperties {

    // Deepest allowed nesting of calls, operators and referenced formula cells
    private int maxDepth = EvaluationContext.DEFAULT_MAX_DEPTH;

    // Throw UnknownFunctionException instead of returning #NAME?
    private boolean strictFunctionNames = false;

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public boolean isStrictFunctionNames() {
        return strictFunctionNames;
    }

    public void setStrictFunctionNames(boolean strictFunctionNames) {
        this.strictFunctionNames = strictFunctionNames;
    }
}
