package io.github.cyfko.filterexpr.core.exception;

/**
 * Tags identifying the cause of a {@link FilterValidationException}.
 * <p>
 * Each code carries a stable tag that prefixes the exception message, so errors can be compared
 * by tag rather than by message text.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ErrorCode {

    // Structural
    NIL_EXPRESSION("NilExpression"),
    UNSUPPORTED_EXPRESSION("UnsupportedExpression"),

    // Identifier
    IDENT_TOKEN_MISMATCH("IdentTokenMismatch"),
    INVALID_IDENTIFIER("InvalidIdentifier"),

    // Literal
    UNSUPPORTED_LITERAL_KIND("UnsupportedLiteralKind"),
    INVALID_NUMBER_LITERAL("InvalidNumberLiteral"),
    INVALID_BOOLEAN_LITERAL("InvalidBooleanLiteral"),

    // List
    EMPTY_LIST("EmptyList"),
    HETEROGENEOUS_LIST("HeterogeneousList"),
    EMPTY_IN_LIST("EmptyInList"),

    // Shape
    COMPARISON_LEFT_SHAPE("ComparisonLeftShape"),
    INDEX_LEFT_SHAPE("IndexLeftShape"),
    INDEX_NOT_SCALAR("IndexNotScalar"),
    LOGICAL_OPERAND_NOT_COMPUTED("LogicalOperandNotComputed"),
    PAREN_INNER_NOT_COMPUTED("ParenInnerNotComputed"),

    // Operator
    UNSUPPORTED_UNARY_OPERATOR("UnsupportedUnaryOperator"),
    UNSUPPORTED_BINARY_OPERATOR("UnsupportedBinaryOperator"),
    EQUALITY_RIGHT_NOT_LITERAL("EqualityRightNotLiteral"),
    ORDERING_RIGHT_NOT_NUMERIC("OrderingRightNotNumeric"),
    IN_RIGHT_NOT_LIST("InRightNotList"),
    LIKE_RIGHT_NOT_STRING("LikeRightNotString"),

    // Translation
    NOT_A_NUMBER("NotANumber");

    private final String tag;

    ErrorCode(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
