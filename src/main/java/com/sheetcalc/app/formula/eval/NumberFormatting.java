package com.sheetcalc.app.formula.eval;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Renders numbers the way a spreadsheet's General format does when a number
 * is turned into text: integers without a decimal point, everything else
 * rounded to 15 significant digits with trailing zeros removed.
 */
public final class NumberFormatting {
    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(15);

    private NumberFormatting() {
    }

    public static String format(double n) {
        if (Double.isNaN(n) || Double.isInfinite(n)) {
            return Double.toString(n);
        }
        if (n == Math.rint(n) && Math.abs(n) < 1e15) {
            return Long.toString((long) n);
        }
        BigDecimal rounded = new BigDecimal(n).round(SIGNIFICANT_DIGITS).stripTrailingZeros();
        double abs = Math.abs(n);
        if (abs >= 1e-9 && abs < 1e15) {
            return rounded.toPlainString();
        }
        return rounded.toString();
    }
}
