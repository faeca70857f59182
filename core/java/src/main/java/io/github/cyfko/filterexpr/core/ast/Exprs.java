package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Kind;
import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;
import io.github.cyfko.filterexpr.core.utils.TypeConversionUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Builders for expression trees.
 * <p>
 * Builders are the programmatic equivalent of parsing: every node they produce carries
 * synthesized tokens (positioned at {@link Position#NO_POSITION})
 * normalized the same way the lexer normalizes source text.
 * </p>
 *
 * <h2>Operand Conversion</h2>
 * <ul>
 *   <li>Left operands of comparisons and index bases accept a field name ({@link String}) or an
 *       existing {@link Expr}.</li>
 *   <li>Values accept {@link String}, {@link Boolean}, any {@link Number} or an existing
 *       {@link Literal}. Numbers are formatted and normalized.</li>
 *   <li>Any other runtime type is rejected with {@link IllegalArgumentException}.</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * // user_type == 'individual' and (age >= 18 or verified == true)
 * Expr filter = Exprs.and(
 *     Exprs.eq("user_type", "individual"),
 *     Exprs.paren(Exprs.or(
 *         Exprs.ge("age", 18),
 *         Exprs.eq("verified", true))));
 *
 * // user['profile']['name'] == 'Alice'
 * Expr nested = Exprs.eq(Exprs.index(Exprs.index("user", "profile"), "name"), "Alice");
 *
 * // status in ('active','pending')
 * Expr in = Exprs.in("status", "active", "pending");
 * }</pre>
 *
 * <p>
 * Builders check operand types but not semantics: use
 * {@link io.github.cyfko.filterexpr.core.FilterExpressions#analyze(Expr)} before translating a
 * tree assembled from untrusted pieces.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Exprs {

    private Exprs() {
        // Utility class
    }

    // ---------------------------------------------------------------- atoms

    public static Ident ident(String name) {
        Objects.requireNonNull(name, "Identifier name cannot be null");
        return new Ident(Token.of(Kind.IDENT, name), name);
    }

    public static Ident ident(Ident ident) {
        return Objects.requireNonNull(ident, "Identifier cannot be null");
    }

    public static Literal literal(String value) {
        Objects.requireNonNull(value, "String literal cannot be null");
        return new Literal(Token.of(Kind.STRING, value), value);
    }

    public static Literal literal(boolean value) {
        Kind kind = value ? Kind.TRUE : Kind.FALSE;
        return new Literal(Token.ofKind(kind), kind.literal());
    }

    public static Literal literal(long value) {
        return number(Long.toString(value));
    }

    public static Literal literal(double value) {
        return number(TypeConversionUtils.formatNumber(value));
    }

    public static Literal literal(Literal literal) {
        return Objects.requireNonNull(literal, "Literal cannot be null");
    }

    /**
     * Builds a literal from a value whose type is only known at runtime.
     *
     * @param value a {@link String}, {@link Boolean}, {@link Number} or {@link Literal}
     * @return the literal
     * @throws IllegalArgumentException if the value type is not supported or the number is not finite
     */
    public static Literal literal(Object value) {
        if (value instanceof Literal literal) {
            return literal;
        }
        if (value instanceof String string) {
            return literal(string);
        }
        if (value instanceof Boolean bool) {
            return literal(bool.booleanValue());
        }
        if (value instanceof Number number) {
            return number(TypeConversionUtils.formatNumber(number));
        }
        throw new IllegalArgumentException("Unsupported literal value type: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Builds a list literal. Each element goes through {@link #literal(Object)}.
     *
     * @param values the list elements
     * @return the list literal
     */
    public static ListLiteral list(Object... values) {
        Objects.requireNonNull(values, "List values cannot be null");
        return list(Arrays.asList(values));
    }

    public static ListLiteral list(Collection<?> values) {
        Objects.requireNonNull(values, "List values cannot be null");
        List<Literal> literals = new ArrayList<>(values.size());
        for (Object value : values) {
            literals.add(literal(value));
        }
        return new ListLiteral(Token.ofKind(Kind.LPAREN), literals, Token.ofKind(Kind.RPAREN));
    }

    public static ListLiteral list(ListLiteral list) {
        return Objects.requireNonNull(list, "List literal cannot be null");
    }

    // ---------------------------------------------------------------- comparisons

    public static BinaryExpr eq(Object left, Object value) {
        return binary(operand(left), Kind.EQ, valueOperand(value));
    }

    public static BinaryExpr ne(Object left, Object value) {
        return binary(operand(left), Kind.NE, valueOperand(value));
    }

    public static BinaryExpr lt(Object left, Number value) {
        return binary(operand(left), Kind.LT, literal(value));
    }

    public static BinaryExpr lt(Object left, Literal value) {
        return binary(operand(left), Kind.LT, value);
    }

    public static BinaryExpr le(Object left, Number value) {
        return binary(operand(left), Kind.LE, literal(value));
    }

    public static BinaryExpr le(Object left, Literal value) {
        return binary(operand(left), Kind.LE, value);
    }

    public static BinaryExpr gt(Object left, Number value) {
        return binary(operand(left), Kind.GT, literal(value));
    }

    public static BinaryExpr gt(Object left, Literal value) {
        return binary(operand(left), Kind.GT, value);
    }

    public static BinaryExpr ge(Object left, Number value) {
        return binary(operand(left), Kind.GE, literal(value));
    }

    public static BinaryExpr ge(Object left, Literal value) {
        return binary(operand(left), Kind.GE, value);
    }

    public static BinaryExpr in(Object left, Object... values) {
        return binary(operand(left), Kind.IN, list(values));
    }

    public static BinaryExpr in(Object left, Collection<?> values) {
        return binary(operand(left), Kind.IN, list(values));
    }

    public static BinaryExpr in(Object left, ListLiteral values) {
        return binary(operand(left), Kind.IN, list(values));
    }

    public static BinaryExpr like(Object left, String pattern) {
        return binary(operand(left), Kind.LIKE, literal(pattern));
    }

    public static BinaryExpr like(Object left, Literal pattern) {
        return binary(operand(left), Kind.LIKE, pattern);
    }

    // ---------------------------------------------------------------- logical

    /**
     * Left-folds the operands with {@code and}: {@code and(a, b, c)} is {@code (a and b) and c}.
     *
     * @param first  first operand
     * @param second second operand
     * @param rest   further operands
     * @return the combined expression
     */
    public static BinaryExpr and(Expr first, Expr second, Expr... rest) {
        return fold(Kind.AND, first, second, rest);
    }

    /**
     * Left-folds the operands with {@code or}.
     *
     * @param first  first operand
     * @param second second operand
     * @param rest   further operands
     * @return the combined expression
     */
    public static BinaryExpr or(Expr first, Expr second, Expr... rest) {
        return fold(Kind.OR, first, second, rest);
    }

    public static UnaryExpr not(Expr operand) {
        Objects.requireNonNull(operand, "Negated expression cannot be null");
        return new UnaryExpr(Token.ofKind(Kind.NOT), operand);
    }

    // ---------------------------------------------------------------- structure

    /**
     * Indexed access. {@code index(index("user", "profile"), "name")} reads {@code user.profile.name}
     * once translated.
     *
     * @param base field name or expression to index
     * @param key  a string, a number or a literal
     * @return the indexed expression
     */
    public static IndexExpr index(Object base, Object key) {
        return new IndexExpr(operand(base), Token.ofKind(Kind.LBRACK), literal(key), Token.ofKind(Kind.RBRACK));
    }

    public static ParenExpr paren(Expr inner) {
        Objects.requireNonNull(inner, "Grouped expression cannot be null");
        return new ParenExpr(Token.ofKind(Kind.LPAREN), inner, Token.ofKind(Kind.RPAREN));
    }

    /**
     * Deep copy. The copy is structurally equal to the source and shares no node with it.
     *
     * @param expr the tree to copy, may be {@code null}
     * @return the copy, or {@code null} for a {@code null} input
     */
    public static Expr copy(Expr expr) {
        if (expr == null) {
            return null;
        }
        if (expr instanceof Ident ident) {
            return new Ident(ident.token(), ident.value());
        }
        if (expr instanceof Literal literal) {
            return copyLiteral(literal);
        }
        if (expr instanceof ListLiteral list) {
            List<Literal> values = new ArrayList<>(list.size());
            for (Literal value : list.values()) {
                values.add(copyLiteral(value));
            }
            return new ListLiteral(list.lparen(), values, list.rparen());
        }
        if (expr instanceof UnaryExpr unary) {
            return new UnaryExpr(unary.op(), copy(unary.right()));
        }
        if (expr instanceof BinaryExpr binary) {
            return new BinaryExpr(copy(binary.left()), binary.op(), copy(binary.right()));
        }
        if (expr instanceof IndexExpr index) {
            return new IndexExpr(copy(index.left()), index.lbrack(), copy(index.index()), index.rbrack());
        }
        ParenExpr paren = (ParenExpr) expr;
        return new ParenExpr(paren.lparen(), copy(paren.inner()), paren.rparen());
    }

    private static Literal copyLiteral(Literal literal) {
        return new Literal(literal.token(), literal.value());
    }

    private static Literal number(String text) {
        Token token = Token.ofLiteral(Kind.NUMBER, text, Position.NO_POSITION, Position.NO_POSITION);
        if (token.is(Kind.ERROR)) {
            throw new IllegalArgumentException(token.literal());
        }
        return new Literal(token, token.literal());
    }

    private static Expr operand(Object left) {
        if (left instanceof Expr expr) {
            return expr;
        }
        if (left instanceof String name) {
            return ident(name);
        }
        throw new IllegalArgumentException("Unsupported operand type: "
                + (left == null ? "null" : left.getClass().getName()));
    }

    private static Expr valueOperand(Object value) {
        if (value instanceof Expr expr) {
            return expr;
        }
        return literal(value);
    }

    private static BinaryExpr binary(Expr left, Kind op, Expr right) {
        return new BinaryExpr(left, Token.ofKind(op), right);
    }

    private static BinaryExpr fold(Kind op, Expr first, Expr second, Expr... rest) {
        Objects.requireNonNull(first, "Left operand cannot be null");
        Objects.requireNonNull(second, "Right operand cannot be null");
        BinaryExpr result = binary(first, op, second);
        for (Expr next : rest) {
            result = binary(result, op, Objects.requireNonNull(next, "Operand cannot be null"));
        }
        return result;
    }
}
