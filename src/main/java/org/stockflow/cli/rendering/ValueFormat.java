package org.stockflow.cli.rendering;

/**
 * Formats stock values for display.
 */
public final class ValueFormat {

    private ValueFormat() {
    }

    /**
     * Integral values print without a fraction ({@code 5}, not {@code 5.0}), positive
     * infinity prints as {@code inf}.
     */
    public static String format(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return "inf";
        } else if (value == Double.NEGATIVE_INFINITY) {
            return "-inf";
        } else if (Double.isNaN(value)) {
            return "NaN";
        } else if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
