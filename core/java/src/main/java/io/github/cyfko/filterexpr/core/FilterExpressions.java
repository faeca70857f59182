package io.github.cyfko.filterexpr.core;

import io.github.cyfko.filterexpr.core.ast.Expr;
import io.github.cyfko.filterexpr.core.ast.Visitor;
import io.github.cyfko.filterexpr.core.config.DslPolicy;
import io.github.cyfko.filterexpr.core.exception.DSLSyntaxException;
import io.github.cyfko.filterexpr.core.exception.FilterValidationException;
import io.github.cyfko.filterexpr.core.impl.BasicDslParser;
import io.github.cyfko.filterexpr.core.utils.ValidationResult;
import io.github.cyfko.filterexpr.core.visitors.Analyzer;
import io.github.cyfko.filterexpr.core.visitors.SqlLikeVisitor;

import java.util.logging.Logger;

/**
 * Entry point for parsing, validating and printing filter expressions.
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * // Text to validated tree
 * Expr expr = FilterExpressions.parseAndAnalyze("user_type == 'individual' and (age >= 18 or verified == true)");
 *
 * // Programmatic tree, checked without throwing
 * ValidationResult result = FilterExpressions.validate(Exprs.gt("age", Exprs.literal("x")));
 * result.getErrorCode(); // ORDERING_RIGHT_NOT_NUMERIC
 *
 * // Canonical text
 * FilterExpressions.toSql(expr); // "user_type == 'individual' and (age >= 18 or verified == true)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterExpressions {

    private static final Logger log = Logger.getLogger(FilterExpressions.class.getName());

    private FilterExpressions() {
        // Utility class
    }

    /**
     * Parses filter text with {@link DslPolicy#defaults()}.
     *
     * @param text the filter text
     * @return the expression tree
     * @throws DSLSyntaxException if the text is malformed
     */
    public static Expr parse(String text) {
        return parse(text, DslPolicy.defaults());
    }

    public static Expr parse(String text, DslPolicy policy) {
        return new BasicDslParser(policy).parse(text);
    }

    /**
     * Runs semantic analysis on a tree.
     *
     * @param expr the tree to check
     * @throws FilterValidationException describing the first problem found
     */
    public static void analyze(Expr expr) {
        Analyzer analyzer = new Analyzer();
        Visitor.walk(analyzer, expr);
        if (analyzer.getError() != null) {
            log.fine(() -> "Filter expression rejected: " + analyzer.getError().getMessage());
            throw analyzer.getError();
        }
    }

    /**
     * Non-throwing variant of {@link #analyze(Expr)}.
     *
     * @param expr the tree to check
     * @return the validation outcome
     */
    public static ValidationResult validate(Expr expr) {
        Analyzer analyzer = new Analyzer();
        Visitor.walk(analyzer, expr);
        return analyzer.getError() == null
                ? ValidationResult.success()
                : ValidationResult.failure(analyzer.getError());
    }

    /**
     * Parses then analyzes filter text.
     *
     * @param text the filter text
     * @return the accepted expression tree
     * @throws DSLSyntaxException if the text is malformed
     * @throws FilterValidationException if the tree is not semantically valid
     */
    public static Expr parseAndAnalyze(String text) {
        Expr expr = parse(text);
        analyze(expr);
        return expr;
    }

    /**
     * Renders a tree in canonical SQL-like form.
     *
     * @param expr the tree to render
     * @return the text form
     * @throws FilterValidationException if {@code expr} is null
     */
    public static String toSql(Expr expr) {
        SqlLikeVisitor printer = new SqlLikeVisitor();
        Visitor.walk(printer, expr);
        if (printer.getError() != null) {
            throw printer.getError();
        }
        return printer.getSql();
    }
}
