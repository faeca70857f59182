package io.github.cyfko.filterexpr.core.visitors;

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

import java.util.List;

/**
 * Semantic validation of expression trees.
 * <p>
 * The analyzer checks operand shapes, operator applicability and list homogeneity. It analyzes the
 * whole tree from the node it is given and never lets {@link Visitor#walk(Visitor, Expr)} descend
 * further. The first failure is latched and exposed through {@link #getError()}; later visits are
 * no-ops.
 * </p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li><strong>Identifier</strong>: IDENT token, valid identifier text</li>
 *   <li><strong>Literal</strong>: string, parseable number, or canonical boolean</li>
 *   <li><strong>List</strong>: non-empty, all elements of the same scalar type</li>
 *   <li><strong>and / or</strong>: both operands computed</li>
 *   <li><strong>== / !=</strong>: field on the left, literal on the right</li>
 *   <li><strong>&lt; &lt;= &gt; &gt;=</strong>: field on the left, number literal on the right</li>
 *   <li><strong>in</strong>: field on the left, list literal on the right</li>
 *   <li><strong>like</strong>: field on the left, string literal on the right</li>
 *   <li><strong>not</strong> and parentheses: computed operand</li>
 *   <li><strong>Index</strong>: base is a field or another index, index is a string or number literal</li>
 * </ul>
 *
 * <pre>{@code
 * Analyzer analyzer = new Analyzer();
 * Visitor.walk(analyzer, Exprs.gt("age", Exprs.literal("eighteen")));
 * analyzer.getError().getErrorCode(); // ORDERING_RIGHT_NOT_NUMERIC
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Analyzer implements Visitor {

    private FilterValidationException error;

    /**
     * @return the first error found, or {@code null} when every visited tree was accepted
     */
    public FilterValidationException getError() {
        return error;
    }

    @Override
    public Visitor visit(Expr expr) {
        if (error != null) {
            return null;
        }
        try {
            analyze(expr);
        } catch (FilterValidationException e) {
            error = e;
        }
        return null;
    }

    private void analyze(Expr expr) {
        if (expr == null) {
            throw new FilterValidationException(ErrorCode.NIL_EXPRESSION, "expression cannot be null");
        }

        if (expr instanceof Ident ident) {
            analyzeIdent(ident);
        } else if (expr instanceof Literal literal) {
            analyzeLiteral(literal);
        } else if (expr instanceof ListLiteral list) {
            analyzeList(list);
        } else if (expr instanceof UnaryExpr unary) {
            analyzeUnary(unary);
        } else if (expr instanceof BinaryExpr binary) {
            analyzeBinary(binary);
        } else if (expr instanceof IndexExpr index) {
            analyzeIndex(index);
        } else if (expr instanceof ParenExpr paren) {
            analyzeParen(paren);
        } else {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_EXPRESSION,
                    "unsupported expression type " + expr.getClass().getSimpleName(), expr.start());
        }
    }

    private void analyzeIdent(Ident ident) {
        if (!ident.token().is(Kind.IDENT)) {
            throw new FilterValidationException(ErrorCode.IDENT_TOKEN_MISMATCH,
                    "identifier token must be IDENT, got " + ident.token().kind().name(), ident.start());
        }
        if (!Identifiers.isIdentifier(ident.value())) {
            throw new FilterValidationException(ErrorCode.INVALID_IDENTIFIER,
                    "'" + ident.value() + "' is not a valid identifier", ident.start());
        }
    }

    private void analyzeLiteral(Literal literal) {
        if (literal.isString()) {
            return;
        }
        if (literal.isNumber()) {
            literal.asNumber();
            return;
        }
        if (literal.isBool()) {
            literal.asBool();
            return;
        }
        throw new FilterValidationException(ErrorCode.UNSUPPORTED_LITERAL_KIND,
                "unsupported literal kind " + literal.kind().name(), literal.start());
    }

    private void analyzeList(ListLiteral list) {
        List<Literal> values = list.values();
        if (values.isEmpty()) {
            throw new FilterValidationException(ErrorCode.EMPTY_LIST,
                    "list literal must contain at least one value", list.start());
        }
        Literal first = values.get(0);
        for (int i = 0; i < values.size(); i++) {
            Literal value = values.get(i);
            if (!first.isSameKind(value)) {
                throw new FilterValidationException(ErrorCode.HETEROGENEOUS_LIST,
                        String.format("list element at index %d has kind %s, expected the kind of %s",
                                i, value.kind().name(), first.kind().name()),
                        value.start());
            }
            analyzeLiteral(value);
        }
    }

    private void analyzeUnary(UnaryExpr unary) {
        if (!unary.op().kind().isUnaryOperator()) {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_UNARY_OPERATOR,
                    "unsupported unary operator " + unary.op().kind().name(), unary.start());
        }
        if (!unary.right().isComputed()) {
            throw new FilterValidationException(ErrorCode.LOGICAL_OPERAND_NOT_COMPUTED,
                    "not requires a computed operand, got " + unary.right().getClass().getSimpleName(),
                    unary.right().start());
        }
        analyze(unary.right());
    }

    private void analyzeBinary(BinaryExpr binary) {
        Kind op = binary.op().kind();
        if (!op.isBinaryOperator()) {
            throw new FilterValidationException(ErrorCode.UNSUPPORTED_BINARY_OPERATOR,
                    "unsupported binary operator " + op.name(), binary.start());
        }

        if (op.isLogicalOperator()) {
            requireComputed(binary.left(), op);
            requireComputed(binary.right(), op);
            analyze(binary.left());
            analyze(binary.right());
            return;
        }

        if (!isFieldReference(binary.left())) {
            throw new FilterValidationException(ErrorCode.COMPARISON_LEFT_SHAPE,
                    String.format("%s requires a field on the left, got %s",
                            op.literal(), binary.left().getClass().getSimpleName()),
                    binary.left().start());
        }

        Expr right = binary.right();
        if (op.isEqualityOperator()) {
            if (!(right instanceof Literal)) {
                throw new FilterValidationException(ErrorCode.EQUALITY_RIGHT_NOT_LITERAL,
                        String.format("%s requires a literal on the right, got %s",
                                op.literal(), right.getClass().getSimpleName()),
                        right.start());
            }
        } else if (op.isOrderingOperator()) {
            if (!(right instanceof Literal literal) || !literal.isNumber()) {
                throw new FilterValidationException(ErrorCode.ORDERING_RIGHT_NOT_NUMERIC,
                        String.format("right operand of %s must be a number literal, got %s",
                                op.literal(), describe(right)),
                        right.start());
            }
        } else if (op == Kind.IN) {
            if (!(right instanceof ListLiteral)) {
                throw new FilterValidationException(ErrorCode.IN_RIGHT_NOT_LIST,
                        "in requires a list literal on the right, got " + describe(right), right.start());
            }
        } else if (!(right instanceof Literal literal) || !literal.isString()) {
            throw new FilterValidationException(ErrorCode.LIKE_RIGHT_NOT_STRING,
                    "like requires a string literal on the right, got " + describe(right), right.start());
        }

        analyze(binary.left());
        analyze(right);
    }

    private void analyzeIndex(IndexExpr index) {
        if (!isFieldReference(index.left())) {
            throw new FilterValidationException(ErrorCode.INDEX_LEFT_SHAPE,
                    "indexed base must be a field or an index, got " + index.left().getClass().getSimpleName(),
                    index.left().start());
        }
        if (!(index.index() instanceof Literal key) || !(key.isNumber() || key.isString())) {
            throw new FilterValidationException(ErrorCode.INDEX_NOT_SCALAR,
                    "index must be a string or number literal, got " + describe(index.index()),
                    index.index().start());
        }
        analyze(index.left());
        analyze(index.index());
    }

    private void analyzeParen(ParenExpr paren) {
        if (!paren.inner().isComputed()) {
            throw new FilterValidationException(ErrorCode.PAREN_INNER_NOT_COMPUTED,
                    "parentheses must group a computed expression, got " + paren.inner().getClass().getSimpleName(),
                    paren.inner().start());
        }
        analyze(paren.inner());
    }

    private static void requireComputed(Expr operand, Kind op) {
        if (!operand.isComputed()) {
            throw new FilterValidationException(ErrorCode.LOGICAL_OPERAND_NOT_COMPUTED,
                    String.format("%s requires computed operands, got %s",
                            op.literal(), operand.getClass().getSimpleName()),
                    operand.start());
        }
    }

    private static boolean isFieldReference(Expr expr) {
        return expr instanceof Ident || expr instanceof IndexExpr;
    }

    private static String describe(Expr expr) {
        if (expr instanceof Literal literal) {
            return literal.kind().name();
        }
        return expr.getClass().getSimpleName();
    }
}
