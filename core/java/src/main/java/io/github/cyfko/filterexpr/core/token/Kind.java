package io.github.cyfko.filterexpr.core.token;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of token kinds recognized by the filter expression language.
 * <p>
 * Every kind carries its canonical literal (empty for kinds whose literal depends on the source,
 * such as identifiers and numbers) and its binding power in the operator precedence ladder.
 * </p>
 *
 * <h2>Precedence Ladder</h2>
 * <table border="1">
 * <caption>Operator precedence (higher binds tighter)</caption>
 * <thead>
 * <tr><th>Level</th><th>Operators</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>6</td><td>in, like</td></tr>
 * <tr><td>5</td><td>&lt;, &lt;=, &gt;, &gt;=</td></tr>
 * <tr><td>4</td><td>==, !=</td></tr>
 * <tr><td>3</td><td>not</td></tr>
 * <tr><td>2</td><td>and</td></tr>
 * <tr><td>1</td><td>or</td></tr>
 * </tbody>
 * </table>
 * <p>Non-operator kinds have precedence 0.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Kind {
    ERROR("", 0),
    EOF("", 0),

    IDENT("", 0),
    NUMBER("", 0),
    STRING("", 0),
    TRUE("true", 0),
    FALSE("false", 0),

    EQ("==", 4),
    NE("!=", 4),
    LT("<", 5),
    LE("<=", 5),
    GT(">", 5),
    GE(">=", 5),

    AND("and", 2),
    OR("or", 1),
    NOT("not", 3),
    IN("in", 6),
    LIKE("like", 6),

    LPAREN("(", 0),
    RPAREN(")", 0),
    LBRACK("[", 0),
    RBRACK("]", 0),
    COMMA(",", 0);

    /** Lowest precedence, used as the starting binding power when parsing. */
    public static final int LOWEST_PRECEDENCE = 0;

    private static final Map<String, Kind> KEYWORDS = Stream.of(TRUE, FALSE, AND, OR, NOT, IN, LIKE)
            .collect(Collectors.toUnmodifiableMap(Kind::literal, Function.identity()));

    private final String literal;
    private final int precedence;

    Kind(String literal, int precedence) {
        this.literal = literal;
        this.precedence = precedence;
    }

    /**
     * Canonical source text of this kind, or an empty string when the text is source dependent.
     *
     * @return the canonical literal
     */
    public String literal() {
        return literal;
    }

    /**
     * Binding power of this kind; 0 for non-operators.
     *
     * @return the precedence level
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Equality probe tolerant to {@code null}.
     *
     * @param other kind to compare with
     * @return true when both kinds are the same
     */
    public boolean is(Kind other) {
        return this == other;
    }

    public boolean isKeyword() {
        return KEYWORDS.containsValue(this);
    }

    public boolean isLiteral() {
        return this == NUMBER || this == STRING || this == TRUE || this == FALSE;
    }

    public boolean isBinaryOperator() {
        return isLogicalOperator() || isEqualityOperator() || isOrderingOperator() || this == IN || this == LIKE;
    }

    public boolean isUnaryOperator() {
        return this == NOT;
    }

    public boolean isOperator() {
        return isBinaryOperator() || isUnaryOperator();
    }

    public boolean isLogicalOperator() {
        return this == AND || this == OR;
    }

    public boolean isEqualityOperator() {
        return this == EQ || this == NE;
    }

    public boolean isOrderingOperator() {
        return this == LT || this == LE || this == GT || this == GE;
    }

    /**
     * Looks up a keyword kind from its source text, ignoring case.
     *
     * @param text candidate keyword
     * @return the keyword kind, or {@code null} when {@code text} is not a keyword
     */
    public static Kind lookupKeyword(String text) {
        if (text == null) {
            return null;
        }
        return KEYWORDS.get(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves a kind from its enum name, ignoring case.
     *
     * @param name the kind name, e.g. {@code "and"} or {@code "LPAREN"}
     * @return the matching kind
     * @throws IllegalArgumentException if no kind has this name
     */
    public static Kind fromName(String name) {
        Objects.requireNonNull(name, "Kind name cannot be null");
        for (Kind kind : values()) {
            if (kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown token kind: " + name);
    }

    /**
     * Resolves an operator kind from its canonical literal, ignoring case.
     *
     * @param literal the operator text, e.g. {@code ">="} or {@code "LIKE"}
     * @return the operator kind
     * @throws IllegalArgumentException if no operator has this literal
     */
    public static Kind fromOperatorLiteral(String literal) {
        Objects.requireNonNull(literal, "Operator literal cannot be null");
        for (Kind kind : values()) {
            if (kind.isOperator() && kind.literal.equalsIgnoreCase(literal)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + literal);
    }
}
