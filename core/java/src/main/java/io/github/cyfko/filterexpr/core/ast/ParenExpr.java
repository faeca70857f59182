package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.Objects;

/**
 * Explicit grouping: {@code (a == 1 or b == 2)}.
 *
 * @param lparen opening parenthesis
 * @param inner  the grouped expression
 * @param rparen closing parenthesis
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParenExpr(Token lparen, Expr inner, Token rparen) implements Expr {

    public ParenExpr {
        Objects.requireNonNull(lparen, "Opening parenthesis cannot be null");
        Objects.requireNonNull(inner, "Grouped expression cannot be null");
        Objects.requireNonNull(rparen, "Closing parenthesis cannot be null");
    }

    @Override
    public Position start() {
        return lparen.start();
    }

    @Override
    public Position end() {
        return rparen.end();
    }
}
