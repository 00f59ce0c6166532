package shaderir.glsl;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Lexical formatting of literal values.
 */
public final class GlslLiterals {

    private GlslLiterals() {
    }

    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(10, RoundingMode.HALF_EVEN);

    /**
     * Formats a float literal in scientific notation with nine fraction digits,
     * e.g. {@code 0.000000000e+00}. The exact binary value is rounded half to
     * even, and the output is locale independent.
     */
    public static String numeric(double value) {
        if (value == 0) {
            // BigDecimal has no negative zero
            return (Math.copySign(1.0, value) < 0 ? "-" : "") + "0.000000000e+00";
        }
        BigDecimal rounded = new BigDecimal(value).round(SIGNIFICANT_DIGITS);
        return String.format(Locale.ROOT, "%.9e", rounded);
    }

    public static String integer(int value) {
        return Integer.toString(value);
    }

    /**
     * The increment clause of a counted loop over {@code counter}.
     */
    public static String increment(String counter, int delta) {
        if (delta == 1) {
            return counter + "++";
        } else if (delta == -1) {
            return counter + "--";
        }
        return counter + " += " + delta;
    }
}
