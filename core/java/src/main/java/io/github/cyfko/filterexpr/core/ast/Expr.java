package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Position;

/**
 * Node of a filter expression tree.
 * <p>
 * The node variants form a closed set. Two capabilities partition them:
 * </p>
 * <ul>
 *   <li><strong>Atomic</strong> leaves without sub-expressions: {@link Ident}, {@link Literal}, {@link ListLiteral}</li>
 *   <li><strong>Computed</strong> interior nodes: {@link UnaryExpr}, {@link BinaryExpr}, {@link IndexExpr}, {@link ParenExpr}</li>
 * </ul>
 * <p>
 * Nodes are immutable; a tree never shares a node between two parents. Every node reports the
 * span of source text it was parsed from through {@link #start()} and {@link #end()}. Nodes built
 * programmatically through {@link Exprs} report {@link Position#NO_POSITION}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see Exprs
 * @see Visitor
 */
public sealed interface Expr permits Ident, Literal, ListLiteral, UnaryExpr, BinaryExpr, IndexExpr, ParenExpr {

    /**
     * @return position of the first character covered by this node
     */
    Position start();

    /**
     * @return position of the last character covered by this node
     */
    Position end();

    default boolean isAtomic() {
        return this instanceof Ident || this instanceof Literal || this instanceof ListLiteral;
    }

    default boolean isComputed() {
        return !isAtomic();
    }
}
