package com.designcontext.simplifier.util;

import java.math.BigDecimal;

/**
 * Helpers for rendering platform numbers as compact CSS values.
 */
public class CssUtil {

    private CssUtil() {
        // Utility class
    }

    /**
     * Renders a number without a trailing {@code .0}: 16.0 -> "16", 0.5 -> "0.5".
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "0";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String px(double value) {
        return formatNumber(value) + "px";
    }

    /**
     * Rounds to two decimals, which is as precise as layout output needs to be.
     */
    public static double pixelRound(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Builds the shortest CSS box shorthand for four sides, e.g. {@code "8px 16px"}.
     * Returns null when all sides are zero.
     */
    public static String boxShorthand(double top, double right, double bottom, double left) {
        if (top == 0 && right == 0 && bottom == 0 && left == 0) {
            return null;
        }
        if (top == right && right == bottom && bottom == left) {
            return px(top);
        }
        if (right == left) {
            if (top == bottom) {
                return px(top) + " " + px(right);
            }
            return px(top) + " " + px(right) + " " + px(bottom);
        }
        return px(top) + " " + px(right) + " " + px(bottom) + " " + px(left);
    }
}
