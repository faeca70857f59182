package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.Objects;

/**
 * Indexed access into a nested field: {@code user['profile']['name']} or {@code tags[0]}.
 * <p>
 * Chains lean left: the base of {@code a['b']['c']} is {@code a['b']}. A well-formed chain ends at
 * an {@link Ident} and each index is a string or number {@link Literal}.
 * </p>
 *
 * @param left   the indexed base
 * @param lbrack opening bracket
 * @param index  the index value
 * @param rbrack closing bracket
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record IndexExpr(Expr left, Token lbrack, Expr index, Token rbrack) implements Expr {

    public IndexExpr {
        Objects.requireNonNull(left, "Indexed base cannot be null");
        Objects.requireNonNull(lbrack, "Opening bracket cannot be null");
        Objects.requireNonNull(index, "Index cannot be null");
        Objects.requireNonNull(rbrack, "Closing bracket cannot be null");
    }

    @Override
    public Position start() {
        return left.start();
    }

    @Override
    public Position end() {
        return rbrack.end();
    }
}
