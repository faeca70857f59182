package io.github.cyfko.filterexpr.core.exception;

import io.github.cyfko.filterexpr.core.token.Position;

import java.util.Objects;

/**
 * Exception raised when an expression tree is not semantically well-formed or cannot be lowered
 * to a backend filter.
 * <p>
 * Every instance carries an {@link ErrorCode} and the position of the offending node. The message
 * follows the pattern {@code "<Tag>: <detail> at L:C"}; the position suffix is omitted for nodes
 * built without source text.
 * </p>
 *
 * <p><strong>Validation Error Examples:</strong></p>
 * <pre>{@code
 * FilterExpressions.analyze(Exprs.gt("age", Exprs.literal("eighteen")));
 * // → "OrderingRightNotNumeric: right operand of > must be a number literal, got STRING"
 *
 * FilterExpressions.analyze(FilterExpressions.parse("tags in ()"));
 * // → DSLSyntaxException, empty lists are rejected by the parser already
 *
 * FilterExpressions.analyze(Exprs.in("status", Exprs.list()));
 * // → "EmptyList: list literal must contain at least one value"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     Filter filter = QdrantFilters.toFilter(userExpression);
 * } catch (FilterValidationException e) {
 *     if (e.getErrorCode() == ErrorCode.ORDERING_RIGHT_NOT_NUMERIC) {
 *         // report a typed error to the caller
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ErrorCode
 */
public class FilterValidationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Position position;

    /**
     * Creates an exception for a node located at {@code position}.
     *
     * @param errorCode the error tag
     * @param detail    human readable description of the failure
     * @param position  position of the offending node, {@link Position#NO_POSITION} when unknown
     */
    public FilterValidationException(ErrorCode errorCode, String detail, Position position) {
        this(errorCode, detail, position, null);
    }

    /**
     * Creates an exception for a node located at {@code position}, wrapping an underlying cause.
     *
     * @param errorCode the error tag
     * @param detail    human readable description of the failure
     * @param position  position of the offending node, {@link Position#NO_POSITION} when unknown
     * @param cause     the original cause, e.g. a {@link NumberFormatException}
     */
    public FilterValidationException(ErrorCode errorCode, String detail, Position position, Throwable cause) {
        super(formatMessage(errorCode, detail, position), cause);
        this.errorCode = errorCode;
        this.position = position == null ? Position.NO_POSITION : position;
    }

    /**
     * Creates an exception without source location.
     *
     * @param errorCode the error tag
     * @param detail    human readable description of the failure
     */
    public FilterValidationException(ErrorCode errorCode, String detail) {
        this(errorCode, detail, Position.NO_POSITION, null);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Position getPosition() {
        return position;
    }

    private static String formatMessage(ErrorCode errorCode, String detail, Position position) {
        Objects.requireNonNull(errorCode, "Error code cannot be null");
        StringBuilder message = new StringBuilder(errorCode.tag()).append(": ").append(detail);
        if (position != null && position.isValid()) {
            message.append(" at ").append(position);
        }
        return message.toString();
    }
}
