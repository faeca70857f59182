package io.github.cyfko.filterexpr.core.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Conversion helpers shared by the token model, the analyzer and backend adapters.
 *
 * <h2>Numeric Normalization</h2>
 * <p>
 * Numeric literals are carried as text. Before being stored in a token, the text is parsed as a
 * 64-bit floating point value and re-emitted in its shortest round-trip decimal form, without
 * exponent and without trailing zeros:
 * </p>
 * <pre>{@code
 * TypeConversionUtils.normalizeNumber("123.000");   // "123"
 * TypeConversionUtils.normalizeNumber("1.23e+02");  // "123"
 * TypeConversionUtils.normalizeNumber("0.000123");  // "0.000123"
 * TypeConversionUtils.normalizeNumber("00123");     // "123"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TypeConversionUtils {

    private static final Pattern DECIMAL_PATTERN =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private TypeConversionUtils() {
        // Utility class
    }

    /**
     * Normalizes a decimal number text.
     *
     * @param text the number as written in source or produced by a formatter
     * @return the canonical decimal form
     * @throws NumberFormatException if {@code text} is not a finite decimal number
     */
    public static String normalizeNumber(String text) {
        return toCanonicalText(parseNumber(text));
    }

    /**
     * Parses a decimal number text into a finite {@code double}.
     *
     * @param text the number text
     * @return the parsed value
     * @throws NumberFormatException if {@code text} is null, malformed or not finite
     */
    public static double parseNumber(String text) {
        if (text == null || !DECIMAL_PATTERN.matcher(text).matches()) {
            throw new NumberFormatException("Invalid number literal: '" + text + "'");
        }
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new NumberFormatException("Number literal out of range: '" + text + "'");
        }
        return value;
    }

    /**
     * Formats a Java number into the canonical decimal form.
     * <p>
     * Integral types are widened through their decimal text; {@code float} values go through
     * {@link Float#toString(float)} so that {@code 1.1f} reads as {@code "1.1"}.
     * </p>
     *
     * @param number any boxed primitive number, {@link BigDecimal} or {@link BigInteger}
     * @return the canonical decimal form
     * @throws NumberFormatException if the value is not finite
     * @throws IllegalArgumentException if the number type is not supported
     */
    public static String formatNumber(Number number) {
        Objects.requireNonNull(number, "Number cannot be null");
        if (number instanceof Double d) {
            return toCanonicalText(checkFinite(d));
        }
        if (number instanceof Float f) {
            checkFinite(f.doubleValue());
            return normalizeNumber(Float.toString(f));
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger || number instanceof BigDecimal) {
            return normalizeNumber(number.toString());
        }
        throw new IllegalArgumentException("Unsupported number type: " + number.getClass().getName());
    }

    /**
     * Strict boolean coercion: only {@code "true"} and {@code "false"} (any case) are accepted.
     *
     * @param text the boolean text
     * @return the boolean value
     * @throws IllegalArgumentException if {@code text} is not a boolean literal
     */
    public static boolean parseBoolean(String text) {
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean literal: '" + text + "'");
    }

    private static double checkFinite(double value) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new NumberFormatException("Number is not finite: " + value);
        }
        return value;
    }

    private static String toCanonicalText(double value) {
        if (value == 0) {
            return "0";
        }
        // Double.toString is not always the shortest form before JDK 19 (1e23 prints 1.0000000000000001E23)
        BigDecimal exact = new BigDecimal(value);
        for (int digits = 1; digits < 17; digits++) {
            BigDecimal candidate = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == value) {
                return candidate.stripTrailingZeros().toPlainString();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros().toPlainString();
    }
}
