package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.Objects;

/**
 * Prefix operation; {@code not} is the only unary operator of the language.
 *
 * @param op    the operator token
 * @param right the operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record UnaryExpr(Token op, Expr right) implements Expr {

    public UnaryExpr {
        Objects.requireNonNull(op, "Unary operator cannot be null");
        Objects.requireNonNull(right, "Unary operand cannot be null");
    }

    @Override
    public Position start() {
        return op.start();
    }

    @Override
    public Position end() {
        return right.end();
    }

    public int precedence() {
        return op.kind().precedence();
    }

    /**
     * @return true when the operand is an operator node binding looser than this one
     */
    public boolean isRightLower() {
        return BinaryExpr.bindsLooser(right, precedence());
    }
}
