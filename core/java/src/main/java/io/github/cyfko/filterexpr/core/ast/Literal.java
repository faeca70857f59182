package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.exception.ErrorCode;
import io.github.cyfko.filterexpr.core.exception.FilterValidationException;
import io.github.cyfko.filterexpr.core.token.Kind;
import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;
import io.github.cyfko.filterexpr.core.utils.TypeConversionUtils;

import java.util.Objects;

/**
 * Scalar constant: a string, a number or a boolean.
 * <p>
 * The value is kept in textual form. Numbers are stored in their normalized decimal form and
 * booleans as the canonical {@code true} / {@code false} literal.
 * </p>
 *
 * <pre>{@code
 * Literal n = Exprs.literal(18);
 * n.isNumber();   // true
 * n.asNumber();   // 18.0
 *
 * Exprs.literal(true).isSameKind(Exprs.literal(false)); // true
 * }</pre>
 *
 * @param token the literal token (STRING, NUMBER, TRUE or FALSE)
 * @param value textual form of the value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Literal(Token token, String value) implements Expr {

    public Literal {
        Objects.requireNonNull(token, "Literal token cannot be null");
        Objects.requireNonNull(value, "Literal value cannot be null");
    }

    @Override
    public Position start() {
        return token.start();
    }

    @Override
    public Position end() {
        return token.end();
    }

    public Kind kind() {
        return token.kind();
    }

    public boolean isString() {
        return token.is(Kind.STRING);
    }

    public boolean isNumber() {
        return token.is(Kind.NUMBER);
    }

    public boolean isBool() {
        return token.is(Kind.TRUE) || token.is(Kind.FALSE);
    }

    /**
     * Tells whether both literals hold the same scalar type. {@code true} and {@code false} share
     * the boolean type.
     *
     * @param other the literal to compare with
     * @return true when both are strings, both numbers, or both booleans
     */
    public boolean isSameKind(Literal other) {
        if (other == null) {
            return false;
        }
        return (isString() && other.isString())
                || (isNumber() && other.isNumber())
                || (isBool() && other.isBool());
    }

    /**
     * @return the string value
     * @throws FilterValidationException if this literal is not a string
     */
    public String asString() {
        if (!isString()) {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_LITERAL_KIND,
                    "literal of kind " + kind().name() + " is not a string", start());
        }
        return value;
    }

    /**
     * @return the numeric value
     * @throws FilterValidationException if this literal is not a valid number
     */
    public double asNumber() {
        if (!isNumber()) {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_LITERAL_KIND,
                    "literal of kind " + kind().name() + " is not a number", start());
        }
        try {
            return TypeConversionUtils.parseNumber(value);
        } catch (NumberFormatException e) {
            throw new FilterValidationException(ErrorCode.INVALID_NUMBER_LITERAL, e.getMessage(), start(), e);
        }
    }

    /**
     * @return the boolean value
     * @throws FilterValidationException if this literal is not a valid boolean
     */
    public boolean asBool() {
        if (!isBool()) {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_LITERAL_KIND,
                    "literal of kind " + kind().name() + " is not a boolean", start());
        }
        if (!value.equals(kind().literal())) {
            throw new FilterValidationException(ErrorCode.INVALID_BOOLEAN_LITERAL,
                    "value '" + value + "' does not match boolean kind " + kind().name(), start());
        }
        return TypeConversionUtils.parseBoolean(value);
    }
}
