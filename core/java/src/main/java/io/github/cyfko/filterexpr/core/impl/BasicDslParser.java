package io.github.cyfko.filterexpr.core.impl;

import io.github.cyfko.filterexpr.core.api.DslParser;
import io.github.cyfko.filterexpr.core.ast.Expr;
import io.github.cyfko.filterexpr.core.config.DslPolicy;
import io.github.cyfko.filterexpr.core.exception.DSLSyntaxException;
import io.github.cyfko.filterexpr.core.parsing.Parser;

import java.util.logging.Logger;

/**
 * Default {@link DslParser}, enforcing a {@link DslPolicy} before delegating to {@link Parser}.
 *
 * <h2>DoS Protection (Complexity Limits)</h2>
 * <ul>
 *   <li><strong>Expression Length</strong>: rejects expressions exceeding the configured character size</li>
 *   <li><strong>Nesting Depth</strong>: rejects expressions nested deeper than the configured depth</li>
 * </ul>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * DslParser parser = new BasicDslParser();
 * Expr expr = parser.parse("age >= 18 and status in ('active','pending')");
 *
 * DslParser strictParser = new BasicDslParser(DslPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicDslParser implements DslParser {

    private static final Logger log = Logger.getLogger(BasicDslParser.class.getName());

    private final DslPolicy dslPolicy;

    /**
     * Default constructor using {@link DslPolicy#defaults()}.
     */
    public BasicDslParser() {
        this(DslPolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param dslPolicy the parser configuration with complexity limits
     * @throws IllegalArgumentException if config is null
     */
    public BasicDslParser(DslPolicy dslPolicy) {
        if (dslPolicy == null) {
            throw new IllegalArgumentException("DSL policy is required");
        }
        this.dslPolicy = dslPolicy;
    }

    public DslPolicy getDslPolicy() {
        return dslPolicy;
    }

    @Override
    public Expr parse(String dslExpression) throws DSLSyntaxException {
        if (dslExpression == null || dslExpression.isBlank()) {
            throw new DSLSyntaxException("DSL expression cannot be null or empty");
        }

        if (dslExpression.length() > dslPolicy.maxExpressionLength()) {
            throw new DSLSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    dslExpression.length(), dslPolicy.maxExpressionLength(), dslPolicy.policyName()));
        }

        long start = System.nanoTime();
        Expr expr = new Parser(dslExpression, dslPolicy).parse();
        log.fine(() -> String.format("Parsed filter expression (%d characters) in %d ms",
                dslExpression.length(), (System.nanoTime() - start) / 1_000_000));
        return expr;
    }
}
