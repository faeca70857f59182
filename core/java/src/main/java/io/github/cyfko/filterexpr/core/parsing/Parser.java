package io.github.cyfko.filterexpr.core.parsing;

import io.github.cyfko.filterexpr.core.ast.BinaryExpr;
import io.github.cyfko.filterexpr.core.ast.Expr;
import io.github.cyfko.filterexpr.core.ast.Ident;
import io.github.cyfko.filterexpr.core.ast.IndexExpr;
import io.github.cyfko.filterexpr.core.ast.ListLiteral;
import io.github.cyfko.filterexpr.core.ast.Literal;
import io.github.cyfko.filterexpr.core.ast.ParenExpr;
import io.github.cyfko.filterexpr.core.ast.UnaryExpr;
import io.github.cyfko.filterexpr.core.config.DslPolicy;
import io.github.cyfko.filterexpr.core.exception.DSLSyntaxException;
import io.github.cyfko.filterexpr.core.token.Kind;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Precedence-climbing (Pratt) parser producing expression trees from filter text.
 *
 * <h2>Grammar</h2>
 * <pre>
 * expr    := prefix (infix expr | '[' literal ']')*
 * prefix  := IDENT | literal | 'not' expr | '(' expr ')' | list
 * list    := '(' literal (',' literal)* ')'
 * infix   := 'or' | 'and' | '==' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=' | 'in' | 'like'
 * literal := STRING | NUMBER | 'true' | 'false'
 * </pre>
 * <p>
 * Binary operators are left-associative and bind according to {@link Kind#precedence()}; index
 * access binds tighter than any operator. The right side of {@code in} is always read as a list,
 * so {@code status in ('active')} is a one-element list rather than a grouped literal.
 * </p>
 *
 * <h2>Rejected Input</h2>
 * <ul>
 *   <li>Lexer errors (illegal characters, unterminated strings)</li>
 *   <li>Empty parentheses, trailing commas, non-literal or mixed-type list elements</li>
 *   <li>Boolean indexes, {@code not} applied to a bare field or literal</li>
 *   <li>Tokens left over after a complete expression</li>
 *   <li>Nesting deeper than {@link DslPolicy#maxNestingDepth()}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Parser {

    private final Lexer lexer;
    private final DslPolicy policy;
    private Token current;
    private int depth;

    public Parser(String input) {
        this(input, DslPolicy.defaults());
    }

    public Parser(String input, DslPolicy policy) {
        this(new Lexer(input), policy);
    }

    /**
     * Creates a parser over an existing lexer. The lexer is rewound first.
     *
     * @param lexer  token source
     * @param policy nesting limits
     */
    public Parser(Lexer lexer, DslPolicy policy) {
        this.lexer = Objects.requireNonNull(lexer, "Lexer cannot be null");
        this.policy = Objects.requireNonNull(policy, "DSL policy is required");
        this.lexer.reset();
        this.current = nextToken();
    }

    /**
     * Parses the complete input.
     *
     * @return the expression tree
     * @throws DSLSyntaxException if the input is not a single well-formed expression
     */
    public Expr parse() {
        Expr expr = parseExpression(Kind.LOWEST_PRECEDENCE);
        if (!current.is(Kind.EOF)) {
            throw new DSLSyntaxException(
                    "unexpected token '" + current.literal() + "' after complete expression, expected end of input",
                    current);
        }
        return expr;
    }

    private Expr parseExpression(int precedence) {
        if (++depth > policy.maxNestingDepth()) {
            throw new DSLSyntaxException(String.format(
                    "Expression nesting too deep (max: %d). Policy applied: %s",
                    policy.maxNestingDepth(), policy.policyName()));
        }

        Expr left = parsePrefix();
        while (true) {
            Kind kind = current.kind();
            if (kind == Kind.LBRACK) {
                left = parseIndex(left);
            } else if (kind.isBinaryOperator() && kind.precedence() > precedence) {
                left = parseBinary(left);
            } else {
                break;
            }
        }

        depth--;
        return left;
    }

    private Expr parsePrefix() {
        switch (current.kind()) {
            case IDENT: {
                Token token = consume();
                return new Ident(token, token.literal());
            }
            case STRING:
            case NUMBER:
            case TRUE:
            case FALSE:
                return parseLiteral();
            case NOT:
                return parseUnary();
            case LPAREN:
                return parseGroupOrList();
            case EOF:
                throw new DSLSyntaxException("unexpected end of expression", current);
            default:
                throw new DSLSyntaxException("unexpected token '" + current.literal()
                        + "', expected an identifier, a literal, 'not' or '('", current);
        }
    }

    private Literal parseLiteral() {
        if (!current.kind().isLiteral()) {
            throw new DSLSyntaxException("expected a literal value (number, string, true or false) but found '"
                    + current.literal() + "'", current);
        }
        Token token = consume();
        return new Literal(token, token.literal());
    }

    private Expr parseUnary() {
        Token op = consume();
        Expr operand = parseExpression(op.kind().precedence());
        if (!operand.isComputed()) {
            throw new DSLSyntaxException("'" + op.literal() + "' cannot be applied to a bare field or value", op);
        }
        return new UnaryExpr(op, operand);
    }

    private Expr parseBinary(Expr left) {
        Token op = consume();
        Expr right;
        if (op.is(Kind.IN) && current.is(Kind.LPAREN)) {
            right = parseList(consume());
        } else {
            right = parseExpression(op.kind().precedence());
        }
        return new BinaryExpr(left, op, right);
    }

    private Expr parseIndex(Expr left) {
        Token lbrack = consume();
        Literal index = parseLiteral();
        if (index.isBool()) {
            throw new DSLSyntaxException("index must be a number or a string, not a boolean", index.token());
        }
        Token rbrack = expect(Kind.RBRACK);
        return new IndexExpr(left, lbrack, index, rbrack);
    }

    private Expr parseGroupOrList() {
        Token lparen = consume();
        if (current.is(Kind.RPAREN)) {
            throw new DSLSyntaxException("empty parentheses are not allowed", current);
        }
        Expr first = parseExpression(Kind.LOWEST_PRECEDENCE);
        if (current.is(Kind.COMMA)) {
            if (!(first instanceof Literal literal)) {
                throw new DSLSyntaxException("list elements must be literal values", lparen);
            }
            return continueList(lparen, literal);
        }
        Token rparen = expect(Kind.RPAREN);
        return new ParenExpr(lparen, first, rparen);
    }

    private ListLiteral parseList(Token lparen) {
        if (current.is(Kind.RPAREN)) {
            throw new DSLSyntaxException("empty lists are not allowed", current);
        }
        return continueList(lparen, parseLiteral());
    }

    private ListLiteral continueList(Token lparen, Literal first) {
        List<Literal> values = new ArrayList<>();
        values.add(first);
        while (current.is(Kind.COMMA)) {
            consume();
            if (current.is(Kind.RPAREN)) {
                throw new DSLSyntaxException("trailing commas are not allowed in lists", current);
            }
            Literal next = parseLiteral();
            if (!first.isSameKind(next)) {
                throw new DSLSyntaxException(String.format(
                        "type mismatch in list: all elements must be of kind %s, but found %s",
                        first.kind().name(), next.kind().name()), next.token());
            }
            values.add(next);
        }
        Token rparen = expect(Kind.RPAREN);
        return new ListLiteral(lparen, values, rparen);
    }

    private Token expect(Kind kind) {
        if (!current.is(kind)) {
            String found = current.is(Kind.EOF) ? "end of input" : "'" + current.literal() + "'";
            throw new DSLSyntaxException("expected '" + kind.literal() + "' but found " + found, current);
        }
        return consume();
    }

    private Token consume() {
        Token token = current;
        current = nextToken();
        return token;
    }

    private Token nextToken() {
        Token token = lexer.scan();
        if (token.is(Kind.ERROR)) {
            throw new DSLSyntaxException(token.literal(), token);
        }
        return token;
    }
}
