package io.github.cyfko.filterexpr.core.token;

import io.github.cyfko.filterexpr.core.utils.TypeConversionUtils;

import java.util.Objects;

/**
 * Lexical unit of a filter expression: a {@link Kind}, its source text and the span it covers.
 * <p>
 * Tokens are produced by the lexer and also synthesized by the AST builders, in which case their
 * positions are {@link Position#NO_POSITION}. Lexing failures are represented as {@link Kind#ERROR}
 * tokens whose literal holds the error message, so that a token stream never throws.
 * </p>
 *
 * <h2>Factory Methods</h2>
 * <ul>
 *   <li>{@link #of(Kind, String, Position, Position)} - raw token, no normalization</li>
 *   <li>{@link #ofKind(Kind, Position, Position)} - literal derived from the kind</li>
 *   <li>{@link #ofIdent(String, Position, Position)} - identifier</li>
 *   <li>{@link #ofLiteral(Kind, String, Position, Position)} - scalar literal, numbers normalized</li>
 *   <li>{@link #ofEof(Position)}, {@link #ofError(String, Position)}, {@link #ofIllegal(int, Position)}</li>
 * </ul>
 *
 * @param kind    the token kind
 * @param literal the token text (error message for {@link Kind#ERROR})
 * @param start   where the token begins
 * @param end     where the token ends
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(Kind kind, String literal, Position start, Position end) {

    public Token {
        Objects.requireNonNull(kind, "Token kind cannot be null");
        Objects.requireNonNull(literal, "Token literal cannot be null");
        Objects.requireNonNull(start, "Token start cannot be null");
        Objects.requireNonNull(end, "Token end cannot be null");
    }

    public static Token of(Kind kind, String literal, Position start, Position end) {
        return new Token(kind, literal, start, end);
    }

    public static Token of(Kind kind, String literal) {
        return new Token(kind, literal, Position.NO_POSITION, Position.NO_POSITION);
    }

    public static Token ofKind(Kind kind, Position start, Position end) {
        return new Token(kind, kind.literal(), start, end);
    }

    public static Token ofKind(Kind kind) {
        return ofKind(kind, Position.NO_POSITION, Position.NO_POSITION);
    }

    public static Token ofIdent(String value, Position start, Position end) {
        return new Token(Kind.IDENT, value, start, end);
    }

    /**
     * End-of-input marker. It covers no source text, so its start is {@link Position#NO_POSITION}.
     *
     * @param pos where the input ends
     * @return the EOF token
     */
    public static Token ofEof(Position pos) {
        return new Token(Kind.EOF, "", Position.NO_POSITION, pos);
    }

    /**
     * Error token carrying {@code message} as its literal. Errors are point events, so the end
     * position is {@link Position#NO_POSITION}.
     *
     * @param message the error description, {@code "unexpected error"} when null
     * @param pos     where the error was detected
     * @return the ERROR token
     */
    public static Token ofError(String message, Position pos) {
        return new Token(Kind.ERROR, message == null ? "unexpected error" : message, pos, Position.NO_POSITION);
    }

    /**
     * Error token for a character that cannot start any token.
     *
     * @param codePoint the offending character
     * @param pos       where it was found
     * @return an ERROR token reading {@code illegal character 'X' at L:C}
     */
    public static Token ofIllegal(int codePoint, Position pos) {
        return ofError(String.format("illegal character '%s' at %s", new String(Character.toChars(codePoint)), pos), pos);
    }

    /**
     * Builds a scalar literal token.
     * <p>
     * Only {@link Kind#STRING}, {@link Kind#NUMBER}, {@link Kind#TRUE} and {@link Kind#FALSE} are
     * accepted. Number text is normalized; invalid number text and unsupported kinds yield an
     * {@link Kind#ERROR} token instead.
     * </p>
     *
     * @param kind    the literal kind
     * @param literal the literal text
     * @param start   where the literal begins
     * @param end     where the literal ends
     * @return the literal token, or an ERROR token
     */
    public static Token ofLiteral(Kind kind, String literal, Position start, Position end) {
        switch (kind) {
            case STRING:
                return new Token(kind, literal, start, end);
            case TRUE:
            case FALSE:
                return new Token(kind, kind.literal(), start, end);
            case NUMBER:
                try {
                    return new Token(kind, TypeConversionUtils.normalizeNumber(literal), start, end);
                } catch (NumberFormatException e) {
                    return ofError(e.getMessage(), start);
                }
            default:
                return ofError("unsupported literal kind " + kind.name(), start);
        }
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return String.format("Token{kind=%s, start=%s, end=%s, literal='%s'}", kind.name(), start, end, literal);
    }
}
