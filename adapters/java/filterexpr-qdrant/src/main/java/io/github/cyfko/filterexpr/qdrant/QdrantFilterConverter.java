package io.github.cyfko.filterexpr.qdrant;

import io.github.cyfko.filterexpr.core.ast.BinaryExpr;
import io.github.cyfko.filterexpr.core.ast.Expr;
import io.github.cyfko.filterexpr.core.ast.Ident;
import io.github.cyfko.filterexpr.core.ast.IndexExpr;
import io.github.cyfko.filterexpr.core.ast.ListLiteral;
import io.github.cyfko.filterexpr.core.ast.Literal;
import io.github.cyfko.filterexpr.core.ast.ParenExpr;
import io.github.cyfko.filterexpr.core.ast.UnaryExpr;
import io.github.cyfko.filterexpr.core.ast.Visitor;
import io.github.cyfko.filterexpr.core.exception.ErrorCode;
import io.github.cyfko.filterexpr.core.exception.FilterValidationException;
import io.github.cyfko.filterexpr.core.token.Identifiers;
import io.github.cyfko.filterexpr.core.token.Kind;
import io.github.cyfko.filterexpr.core.utils.TypeConversionUtils;
import io.qdrant.client.ConditionFactory;
import io.qdrant.client.grpc.Points.Condition;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers an expression tree into a Qdrant points {@link Filter}.
 *
 * <h2>Lowering Rules</h2>
 * <table border="1">
 * <caption>Expression to filter mapping</caption>
 * <thead>
 * <tr><th>Expression</th><th>Group</th><th>Condition</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@code f == 'a'} / {@code f == 3} / {@code f == true}</td><td>must</td><td>keyword / integer / boolean match</td></tr>
 * <tr><td>{@code f != v}</td><td>must_not</td><td>same match as {@code ==}; under {@code and}, a must condition
 * wrapping a filter with that match in must_not</td></tr>
 * <tr><td>{@code f > 1.5} (and {@code < <= >=})</td><td>must</td><td>range with the matching bound</td></tr>
 * <tr><td>{@code f in ('a','b')} / {@code f in (1,2)}</td><td>must</td><td>keywords / integers match</td></tr>
 * <tr><td>{@code f in (true,false)}</td><td>must</td><td>nested filter, one boolean match per value in should</td></tr>
 * <tr><td>{@code f like 'Jo%'}</td><td>must</td><td>text match, pattern passed through</td></tr>
 * <tr><td>{@code not x}</td><td>must_not</td><td>the single condition for {@code x}; wrapped under {@code and}
 * like {@code !=}</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Logical Composition</h2>
 * <p>
 * Chains of the same logical operator are flattened: the operands of nested {@code and}s spread
 * across {@code must}, those of nested {@code or}s across {@code should}. Where the operator
 * changes, the sub-expression is translated into its own filter and embedded as a nested filter
 * condition. Every operand of an {@code and} adds exactly one condition to {@code must}, so the
 * {@code must_not} group is only filled by a root {@code !=} or {@code not}. Parentheses are
 * transparent. Numbers used with {@code ==}, {@code !=} and {@code in} are truncated toward zero,
 * saturating at the {@code long} bounds; range bounds keep the full {@code double}.
 * </p>
 *
 * <p>
 * Index chains become dotted keys: {@code user['profile']['name']} is {@code user.profile.name}
 * and {@code tags[0]} is {@code tags.0}.
 * </p>
 *
 * <p>
 * The first failure is latched and reported by {@link #getError()}; the filter built so far
 * remains available through {@link #getFilter()} for debugging but is not valid in that case.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class QdrantFilterConverter implements Visitor {

    private final Filter.Builder filter = Filter.newBuilder();
    private String currentFieldKey;
    private Object currentFieldValue;
    private FilterValidationException error;

    /**
     * @return the filter built so far
     */
    public Filter getFilter() {
        return filter.build();
    }

    /**
     * @return the first translation error, or {@code null}
     */
    public FilterValidationException getError() {
        return error;
    }

    String currentFieldKey() {
        return currentFieldKey;
    }

    Object currentFieldValue() {
        return currentFieldValue;
    }

    @Override
    public Visitor visit(Expr expr) {
        if (error != null) {
            return null;
        }
        try {
            translate(expr, filter);
        } catch (FilterValidationException e) {
            error = e;
        }
        return null;
    }

    // ---------------------------------------------------------------- dispatch

    private void translate(Expr expr, Filter.Builder target) {
        if (expr == null) {
            throw new FilterValidationException(ErrorCode.NIL_EXPRESSION, "cannot translate a null expression");
        }

        if (expr instanceof ParenExpr paren) {
            translate(paren.inner(), target);
        } else if (expr instanceof BinaryExpr binary) {
            if (binary.op().kind().isLogicalOperator()) {
                translateLogical(binary, target);
            } else {
                translateComparison(binary, target);
            }
        } else if (expr instanceof UnaryExpr unary) {
            translateUnary(unary, target);
        } else if (expr instanceof Ident || expr instanceof IndexExpr) {
            currentFieldKey = fieldKeyOf(expr);
        } else if (expr instanceof Literal || expr instanceof ListLiteral) {
            currentFieldValue = valueOf(expr);
        } else {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_EXPRESSION,
                    "unsupported expression type " + expr.getClass().getSimpleName(), expr.start());
        }
    }

    private void translateLogical(BinaryExpr binary, Filter.Builder target) {
        Kind op = binary.op().kind();
        for (Expr operand : List.of(binary.left(), binary.right())) {
            Expr inner = unwrap(operand);
            requireConditionBearing(inner, op);

            if (op == Kind.AND) {
                if (isLogical(inner, Kind.AND)) {
                    translateLogical((BinaryExpr) inner, target);
                } else {
                    target.addMust(toSingleCondition(inner));
                }
            } else {
                if (isLogical(inner, Kind.OR)) {
                    translateLogical((BinaryExpr) inner, target);
                } else {
                    target.addShould(toSingleCondition(inner));
                }
            }
        }
    }

    private void translateUnary(UnaryExpr unary, Filter.Builder target) {
        if (unary.op().kind() != Kind.NOT) {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_UNARY_OPERATOR,
                    "'" + unary.op().literal() + "' is not a supported unary operator", unary.start());
        }
        Expr operand = unwrap(unary.right());
        requireConditionBearing(operand, Kind.NOT);
        target.addMustNot(toSingleCondition(operand));
    }

    /**
     * Translates {@code expr} into a fresh filter and reduces it to one condition: the lone
     * {@code must} condition when that is all the filter holds, a nested filter otherwise.
     */
    private Condition toSingleCondition(Expr expr) {
        Filter.Builder sub = Filter.newBuilder();
        translate(expr, sub);
        if (sub.getMustCount() == 1 && sub.getShouldCount() == 0 && sub.getMustNotCount() == 0) {
            return sub.getMust(0);
        }
        return ConditionFactory.filter(sub.build());
    }

    // ---------------------------------------------------------------- field conditions

    private void translateComparison(BinaryExpr binary, Filter.Builder target) {
        Kind op = binary.op().kind();
        if (!op.isBinaryOperator()) {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_BINARY_OPERATOR,
                    "unsupported binary operator '" + binary.op().literal() + "'", binary.start());
        }

        String key = extractFieldKey(binary.left());
        if (op.isEqualityOperator()) {
            Condition match = matchCondition(key, binary.right());
            if (op == Kind.EQ) {
                target.addMust(match);
            } else {
                target.addMustNot(match);
            }
        } else if (op.isOrderingOperator()) {
            target.addMust(ConditionFactory.range(key, rangeOf(op, binary.right())));
        } else if (op == Kind.IN) {
            target.addMust(inCondition(key, binary.right()));
        } else {
            target.addMust(likeCondition(key, binary.right()));
        }
    }

    private Condition matchCondition(String key, Expr right) {
        if (!(right instanceof Literal)) {
            throw new FilterValidationException(ErrorCode.EQUALITY_RIGHT_NOT_LITERAL,
                    "equality requires a literal value, got " + right.getClass().getSimpleName(), right.start());
        }
        return scalarMatch(key, extractFieldValue(right));
    }

    private static Condition scalarMatch(String key, Object value) {
        if (value instanceof String keyword) {
            return ConditionFactory.matchKeyword(key, keyword);
        }
        if (value instanceof Double number) {
            return ConditionFactory.match(key, number.longValue());
        }
        return ConditionFactory.match(key, (Boolean) value);
    }

    private Range rangeOf(Kind op, Expr right) {
        double bound = toNumber(extractFieldValue(right), right);
        Range.Builder range = Range.newBuilder();
        switch (op) {
            case LT:
                range.setLt(bound);
                break;
            case LE:
                range.setLte(bound);
                break;
            case GT:
                range.setGt(bound);
                break;
            default:
                range.setGte(bound);
                break;
        }
        return range.build();
    }

    private Condition inCondition(String key, Expr right) {
        if (!(right instanceof ListLiteral list)) {
            throw new FilterValidationException(ErrorCode.IN_RIGHT_NOT_LIST,
                    "in requires a list literal, got " + right.getClass().getSimpleName(), right.start());
        }
        if (list.isEmpty()) {
            throw new FilterValidationException(ErrorCode.EMPTY_IN_LIST, "in requires a non-empty list", list.start());
        }

        List<?> values = (List<?>) extractFieldValue(list);
        Class<?> elementType = values.get(0).getClass();
        for (int i = 1; i < values.size(); i++) {
            if (values.get(i).getClass() != elementType) {
                throw new FilterValidationException(ErrorCode.HETEROGENEOUS_LIST,
                        "list element at index " + i + " does not match the type of the first element",
                        list.values().get(i).start());
            }
        }

        if (elementType == String.class) {
            List<String> keywords = new ArrayList<>(values.size());
            values.forEach(value -> keywords.add((String) value));
            return ConditionFactory.matchKeywords(key, keywords);
        }
        if (elementType == Double.class) {
            List<Long> integers = new ArrayList<>(values.size());
            values.forEach(value -> integers.add(((Double) value).longValue()));
            return ConditionFactory.matchValues(key, integers);
        }
        Filter.Builder anyOf = Filter.newBuilder();
        values.forEach(value -> anyOf.addShould(ConditionFactory.match(key, (Boolean) value)));
        return ConditionFactory.filter(anyOf.build());
    }

    private Condition likeCondition(String key, Expr right) {
        if (!(right instanceof Literal literal) || !literal.isString()) {
            throw new FilterValidationException(ErrorCode.LIKE_RIGHT_NOT_STRING,
                    "like requires a string pattern", right.start());
        }
        return ConditionFactory.matchText(key, (String) extractFieldValue(right));
    }

    // ---------------------------------------------------------------- slots

    /**
     * Resolves the dotted field key of a field reference. The converter's key and value slots are
     * left as they were, whatever the outcome.
     *
     * @param expr an {@link Ident} or {@link IndexExpr}
     * @return the field key
     */
    String extractFieldKey(Expr expr) {
        String savedKey = currentFieldKey;
        Object savedValue = currentFieldValue;
        try {
            if (!(expr instanceof Ident) && !(expr instanceof IndexExpr)) {
                throw new FilterValidationException(ErrorCode.COMPARISON_LEFT_SHAPE,
                        "expected a field reference, got " + describe(expr), expr == null ? null : expr.start());
            }
            currentFieldKey = null;
            translate(expr, filter);
            if (currentFieldKey == null || currentFieldKey.isEmpty()) {
                throw new FilterValidationException(ErrorCode.INVALID_IDENTIFIER,
                        "failed to extract a field key from " + describe(expr), expr.start());
            }
            return currentFieldKey;
        } finally {
            currentFieldKey = savedKey;
            currentFieldValue = savedValue;
        }
    }

    /**
     * Coerces a literal or list literal into a Java value: {@link String}, {@link Double},
     * {@link Boolean}, or a {@link List} of those. The converter's slots are left as they were.
     *
     * @param expr a {@link Literal} or {@link ListLiteral}
     * @return the coerced value
     */
    Object extractFieldValue(Expr expr) {
        String savedKey = currentFieldKey;
        Object savedValue = currentFieldValue;
        try {
            if (!(expr instanceof Literal) && !(expr instanceof ListLiteral)) {
                throw new FilterValidationException(ErrorCode.UNSUPPORTED_EXPRESSION,
                        "expected a literal value, got " + describe(expr), expr == null ? null : expr.start());
            }
            currentFieldValue = null;
            translate(expr, filter);
            return currentFieldValue;
        } finally {
            currentFieldKey = savedKey;
            currentFieldValue = savedValue;
        }
    }

    private static String fieldKeyOf(Expr expr) {
        if (expr instanceof Ident ident) {
            if (!Identifiers.isIdentifier(ident.value())) {
                throw new FilterValidationException(ErrorCode.INVALID_IDENTIFIER,
                        "'" + ident.value() + "' is not a valid field name", ident.start());
            }
            return ident.value();
        }
        if (expr instanceof IndexExpr index) {
            return fieldKeyOf(index.left()) + "." + indexPart(index);
        }
        throw new FilterValidationException(ErrorCode.INDEX_LEFT_SHAPE,
                "indexed base must be a field or an index, got " + describe(expr), expr.start());
    }

    private static String indexPart(IndexExpr index) {
        if (index.index() instanceof Literal key) {
            if (key.isString()) {
                return key.value();
            }
            if (key.isNumber()) {
                try {
                    return TypeConversionUtils.normalizeNumber(key.value());
                } catch (NumberFormatException e) {
                    throw new FilterValidationException(ErrorCode.INVALID_NUMBER_LITERAL, e.getMessage(), key.start(), e);
                }
            }
        }
        throw new FilterValidationException(ErrorCode.INDEX_NOT_SCALAR,
                "index must be a string or number literal, got " + describe(index.index()), index.index().start());
    }

    private static Object valueOf(Expr expr) {
        if (expr instanceof ListLiteral list) {
            List<Object> values = new ArrayList<>(list.size());
            for (Literal literal : list.values()) {
                values.add(scalarOf(literal));
            }
            return values;
        }
        return scalarOf((Literal) expr);
    }

    private static Object scalarOf(Literal literal) {
        if (literal.isString()) {
            return literal.asString();
        }
        if (literal.isNumber()) {
            return literal.asNumber();
        }
        if (literal.isBool()) {
            return literal.asBool();
        }
        throw new FilterValidationException(ErrorCode.UNSUPPORTED_LITERAL_KIND,
                "unsupported literal kind " + literal.kind().name(), literal.start());
    }

    private static double toNumber(Object value, Expr source) {
        if (value instanceof Double number) {
            return number;
        }
        if (value instanceof String text) {
            try {
                return TypeConversionUtils.parseNumber(text);
            } catch (NumberFormatException e) {
                throw new FilterValidationException(ErrorCode.NOT_A_NUMBER,
                        "cannot use '" + text + "' as a range bound", source.start(), e);
            }
        }
        throw new FilterValidationException(ErrorCode.NOT_A_NUMBER,
                "cannot use " + describe(source) + " as a range bound", source.start());
    }

    // ---------------------------------------------------------------- helpers

    private static Expr unwrap(Expr expr) {
        Expr current = expr;
        while (current instanceof ParenExpr paren) {
            current = paren.inner();
        }
        return current;
    }

    private static boolean isLogical(Expr expr, Kind op) {
        return expr instanceof BinaryExpr binary && binary.op().kind() == op;
    }

    private static void requireConditionBearing(Expr operand, Kind op) {
        if (operand instanceof IndexExpr) {
            // The analyzer counts an index as computed, but it names a field, not a condition.
            throw new FilterValidationException(ErrorCode.LOGICAL_OPERAND_NOT_COMPUTED,
                    "operand of '" + op.literal() + "' is an index expression; Qdrant needs a comparison such as "
                            + "'field[key] == value'", operand.start());
        }
        if (!(operand instanceof BinaryExpr) && !(operand instanceof UnaryExpr)) {
            throw new FilterValidationException(ErrorCode.LOGICAL_OPERAND_NOT_COMPUTED,
                    "operand of '" + op.literal() + "' must be a condition, got " + describe(operand),
                    operand == null ? null : operand.start());
        }
    }

    private static String describe(Expr expr) {
        if (expr == null) {
            return "null";
        }
        if (expr instanceof Literal literal) {
            return literal.kind().name() + " literal";
        }
        return expr.getClass().getSimpleName();
    }
}
