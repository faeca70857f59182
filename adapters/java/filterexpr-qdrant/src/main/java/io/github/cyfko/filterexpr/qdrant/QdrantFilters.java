package io.github.cyfko.filterexpr.qdrant;

import io.github.cyfko.filterexpr.core.FilterExpressions;
import io.github.cyfko.filterexpr.core.ast.Expr;
import io.github.cyfko.filterexpr.core.ast.Visitor;
import io.github.cyfko.filterexpr.core.exception.DSLSyntaxException;
import io.github.cyfko.filterexpr.core.exception.FilterValidationException;
import io.qdrant.client.grpc.Points.Filter;

import java.util.logging.Logger;

/**
 * Entry point for turning filter expressions into Qdrant filters.
 *
 * <pre>{@code
 * Filter filter = QdrantFilters.toFilter("age > 18 and (status == 'active' or status == 'pending')");
 * // must: [range(age, gt=18), filter(should: [keyword(status, active), keyword(status, pending)])]
 *
 * Filter same = QdrantFilters.toFilter(Exprs.and(
 *     Exprs.gt("age", 18),
 *     Exprs.or(Exprs.eq("status", "active"), Exprs.eq("status", "pending"))));
 * }</pre>
 *
 * <p>Each call uses a fresh {@link QdrantFilterConverter}; trees may be translated concurrently.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QdrantFilters {

    private static final Logger log = Logger.getLogger(QdrantFilters.class.getName());

    private QdrantFilters() {
        // Utility class
    }

    /**
     * Translates an expression tree.
     *
     * @param expr the tree to translate
     * @return the Qdrant filter
     * @throws FilterValidationException if the tree cannot be translated
     */
    public static Filter toFilter(Expr expr) {
        QdrantFilterConverter converter = new QdrantFilterConverter();
        Visitor.walk(converter, expr);
        if (converter.getError() != null) {
            log.fine(() -> "Qdrant filter translation failed: " + converter.getError().getMessage());
            throw converter.getError();
        }

        Filter filter = converter.getFilter();
        log.fine(() -> String.format("Translated filter: must=%d, should=%d, must_not=%d",
                filter.getMustCount(), filter.getShouldCount(), filter.getMustNotCount()));
        return filter;
    }

    /**
     * Parses, analyzes and translates filter text.
     *
     * @param text the filter text
     * @return the Qdrant filter
     * @throws DSLSyntaxException if the text is malformed
     * @throws FilterValidationException if the expression is invalid or cannot be translated
     */
    public static Filter toFilter(String text) {
        return toFilter(FilterExpressions.parseAndAnalyze(text));
    }
}
