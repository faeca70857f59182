package io.github.cyfko.filterexpr.core.ast;

import java.util.Objects;

/**
 * Depth-first traversal protocol over expression trees.
 * <p>
 * {@link #walk(Visitor, Expr)} calls {@link #visit(Expr)} on a node, then continues into the
 * node's children with the visitor returned by that call. Returning {@code null} skips the
 * subtree. Children are visited in a fixed order:
 * </p>
 * <ul>
 *   <li>{@link UnaryExpr}: operand</li>
 *   <li>{@link BinaryExpr}: left, then right</li>
 *   <li>{@link IndexExpr}: base, then index</li>
 *   <li>{@link ParenExpr}: inner expression</li>
 *   <li>{@link ListLiteral}: each element in order</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<String> fields = new ArrayList<>();
 * Visitor collector = new Visitor() {
 *     public Visitor visit(Expr expr) {
 *         if (expr instanceof Ident ident) {
 *             fields.add(ident.value());
 *         }
 *         return this;
 *     }
 * };
 * Visitor.walk(collector, FilterExpressions.parse("a == 1 and b > 2"));
 * // fields = [a, b]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface Visitor {

    /**
     * Visits one node.
     *
     * @param expr the node, possibly {@code null} when a caller walks a missing tree
     * @return the visitor to use for the node's children, or {@code null} to skip them
     */
    Visitor visit(Expr expr);

    /**
     * Traverses {@code expr} depth-first.
     *
     * @param visitor the visitor to apply
     * @param expr    the root of the traversal
     */
    static void walk(Visitor visitor, Expr expr) {
        Objects.requireNonNull(visitor, "Visitor cannot be null");
        Visitor next = visitor.visit(expr);
        if (next == null || expr == null) {
            return;
        }

        if (expr instanceof UnaryExpr unary) {
            walk(next, unary.right());
        } else if (expr instanceof BinaryExpr binary) {
            walk(next, binary.left());
            walk(next, binary.right());
        } else if (expr instanceof IndexExpr index) {
            walk(next, index.left());
            walk(next, index.index());
        } else if (expr instanceof ParenExpr paren) {
            walk(next, paren.inner());
        } else if (expr instanceof ListLiteral list) {
            for (Literal value : list.values()) {
                walk(next, value);
            }
        }
    }
}
