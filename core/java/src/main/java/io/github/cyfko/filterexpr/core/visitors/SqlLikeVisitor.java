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

/**
 * Renders an expression tree in its canonical SQL-like text form.
 * <p>
 * Operators are printed in lower case, strings between single quotes (without escaping), lists
 * as {@code (a,b)}, and {@code not} always parenthesizes its operand. A binary operand is
 * parenthesized only when it binds looser than its parent.
 * </p>
 *
 * <pre>{@code
 * SqlLikeVisitor printer = new SqlLikeVisitor();
 * Visitor.walk(printer, Exprs.and(Exprs.or(Exprs.eq("a", 1), Exprs.eq("b", 2)), Exprs.eq("c", 3)));
 * printer.getSql(); // "(a == 1 or b == 2) and c == 3"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SqlLikeVisitor implements Visitor {

    private final StringBuilder buffer = new StringBuilder();
    private FilterValidationException error;

    public String getSql() {
        return buffer.toString();
    }

    public FilterValidationException getError() {
        return error;
    }

    @Override
    public Visitor visit(Expr expr) {
        if (error == null) {
            render(expr);
        }
        return null;
    }

    private void render(Expr expr) {
        if (error != null) {
            return;
        }
        if (expr == null) {
            error = new FilterValidationException(ErrorCode.NIL_EXPRESSION, "expression cannot be null");
            return;
        }

        if (expr instanceof Ident ident) {
            buffer.append(ident.value());
        } else if (expr instanceof Literal literal) {
            renderLiteral(literal);
        } else if (expr instanceof ListLiteral list) {
            buffer.append('(');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    buffer.append(',');
                }
                renderLiteral(list.values().get(i));
            }
            buffer.append(')');
        } else if (expr instanceof UnaryExpr unary) {
            buffer.append(unary.op().kind().literal()).append(" (");
            // the operand is always wrapped, so an explicit group would print twice
            render(unary.right() instanceof ParenExpr paren ? paren.inner() : unary.right());
            buffer.append(')');
        } else if (expr instanceof BinaryExpr binary) {
            renderOperand(binary.left(), binary.isLeftLower());
            buffer.append(' ').append(binary.op().kind().literal()).append(' ');
            renderOperand(binary.right(), binary.isRightLower());
        } else if (expr instanceof IndexExpr index) {
            render(index.left());
            buffer.append('[');
            render(index.index());
            buffer.append(']');
        } else if (expr instanceof ParenExpr paren) {
            buffer.append('(');
            render(paren.inner());
            buffer.append(')');
        }
    }

    private void renderOperand(Expr operand, boolean lower) {
        if (lower) {
            buffer.append('(');
        }
        render(operand);
        if (lower) {
            buffer.append(')');
        }
    }

    private void renderLiteral(Literal literal) {
        if (literal.isString()) {
            buffer.append('\'').append(literal.value()).append('\'');
        } else {
            buffer.append(literal.value());
        }
    }
}
