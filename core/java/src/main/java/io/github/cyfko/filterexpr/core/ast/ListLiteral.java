package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.List;
import java.util.Objects;

/**
 * Parenthesized list of scalar literals, the right operand of {@code in}:
 * {@code status in ('active','pending')}.
 *
 * @param lparen opening parenthesis
 * @param values the elements, in source order
 * @param rparen closing parenthesis
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ListLiteral(Token lparen, List<Literal> values, Token rparen) implements Expr {

    public ListLiteral {
        Objects.requireNonNull(lparen, "List opening token cannot be null");
        Objects.requireNonNull(rparen, "List closing token cannot be null");
        values = List.copyOf(values);
    }

    @Override
    public Position start() {
        return lparen.start();
    }

    @Override
    public Position end() {
        return rparen.end();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
