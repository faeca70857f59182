package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.Objects;

/**
 * Field reference, e.g. {@code age} in {@code age >= 18}.
 *
 * @param token the IDENT token
 * @param value the field name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Ident(Token token, String value) implements Expr {

    public Ident {
        Objects.requireNonNull(token, "Identifier token cannot be null");
        Objects.requireNonNull(value, "Identifier value cannot be null");
    }

    @Override
    public Position start() {
        return token.start();
    }

    @Override
    public Position end() {
        return token.end();
    }
}
