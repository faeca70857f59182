package io.github.cyfko.filterexpr.core.exception;

import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

/**
 * Exception thrown when a filter expression text cannot be tokenized or parsed.
 * <p>
 * Raised by {@link io.github.cyfko.filterexpr.core.parsing.Parser} for illegal characters,
 * unterminated strings, unexpected tokens, malformed list literals and trailing input, and by
 * {@link io.github.cyfko.filterexpr.core.impl.BasicDslParser} when a {@code DslPolicy} limit is
 * exceeded.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");
 * // → "DSL expression cannot be null or empty"
 *
 * parser.parse("age >= 18 and");
 * // → "Parsing failed: unexpected end of expression (at 1:14, token: '')"
 *
 * parser.parse("name == 'bob' @");
 * // → "Parsing failed: illegal character '@' at 1:15 (at 1:15, token: 'illegal character ...')"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DSLSyntaxException extends RuntimeException {

    private final transient Token token;

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the cause of the exception
     */
    public DSLSyntaxException(String message) {
        this(message, (Throwable) null);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the cause of the exception
     * @param cause   the original cause of this exception
     */
    public DSLSyntaxException(String message, Throwable cause) {
        super(message, cause);
        this.token = null;
    }

    /**
     * Constructor for failures located at a token.
     *
     * @param detail what went wrong
     * @param token  the offending token
     */
    public DSLSyntaxException(String detail, Token token) {
        super(String.format("Parsing failed: %s (at %s, token: '%s')", detail, locationOf(token), token.literal()));
        this.token = token;
    }

    /**
     * @return the offending token, or {@code null} when the failure is not tied to a token
     */
    public Token getToken() {
        return token;
    }

    /**
     * @return where the failure occurred, {@link Position#NO_POSITION} when unknown
     */
    public Position getPosition() {
        return token == null ? Position.NO_POSITION : locationOf(token);
    }

    private static Position locationOf(Token token) {
        return token.start().isValid() ? token.start() : token.end();
    }
}
