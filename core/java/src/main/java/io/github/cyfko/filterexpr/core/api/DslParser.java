package io.github.cyfko.filterexpr.core.api;

import io.github.cyfko.filterexpr.core.ast.Expr;
import io.github.cyfko.filterexpr.core.exception.DSLSyntaxException;

/**
 * Parser for the textual filter language.
 * <p>
 * Implementations turn text such as
 * {@code user_type == 'individual' and (age >= 18 or verified == true)} into an {@link Expr}
 * tree. Parsing checks syntax only; semantic checks are the job of the analyzer.
 * </p>
 *
 * <h2>Operator Reference</h2>
 * <table border="1">
 * <caption>Operators by precedence</caption>
 * <thead>
 * <tr><th>Operators</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>[ ]</td><td>Highest</td><td>Left</td><td>user['name']</td></tr>
 * <tr><td>in, like</td><td>6</td><td>Left</td><td>status in ('a','b')</td></tr>
 * <tr><td>&lt; &lt;= &gt; &gt;=</td><td>5</td><td>Left</td><td>age &gt;= 18</td></tr>
 * <tr><td>== !=</td><td>4</td><td>Left</td><td>verified == true</td></tr>
 * <tr><td>not</td><td>3</td><td>Right</td><td>not (deleted == true)</td></tr>
 * <tr><td>and</td><td>2</td><td>Left</td><td>a == 1 and b == 2</td></tr>
 * <tr><td>or</td><td>1</td><td>Left</td><td>a == 1 or b == 2</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface DslParser {

    /**
     * Parses a filter expression.
     *
     * @param dslExpression the filter text
     * @return the expression tree
     * @throws DSLSyntaxException if the text is empty, exceeds the parser limits or is malformed
     */
    Expr parse(String dslExpression) throws DSLSyntaxException;
}
