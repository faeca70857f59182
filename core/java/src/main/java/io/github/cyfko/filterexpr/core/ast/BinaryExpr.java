package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.Objects;

/**
 * Infix operation: a comparison ({@code == != < <= > >= in like}) or a logical combination
 * ({@code and or}).
 *
 * <p>
 * {@link #isLeftLower()} and {@link #isRightLower()} report whether an operand is itself an
 * operator node with a strictly lower precedence, i.e. whether it needs parentheses when printed.
 * </p>
 *
 * @param left  the left operand
 * @param op    the operator token
 * @param right the right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record BinaryExpr(Expr left, Token op, Expr right) implements Expr {

    public BinaryExpr {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(op, "Binary operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public Position start() {
        return left.start();
    }

    @Override
    public Position end() {
        return right.end();
    }

    public int precedence() {
        return op.kind().precedence();
    }

    public boolean isLeftLower() {
        return bindsLooser(left, precedence());
    }

    public boolean isRightLower() {
        return bindsLooser(right, precedence());
    }

    static boolean bindsLooser(Expr operand, int precedence) {
        if (operand instanceof BinaryExpr binary) {
            return binary.precedence() < precedence;
        }
        if (operand instanceof UnaryExpr unary) {
            return unary.precedence() < precedence;
        }
        return false;
    }
}
