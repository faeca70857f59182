package io.github.cyfko.filterexpr.core.parsing;

import io.github.cyfko.filterexpr.core.ast.*;
import io.github.cyfko.filterexpr.core.config.DslPolicy;
import io.github.cyfko.filterexpr.core.exception.DSLSyntaxException;
import io.github.cyfko.filterexpr.core.token.Kind;
import io.github.cyfko.filterexpr.core.token.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the precedence-climbing parser: tree shapes, spans and syntax errors.
 */
@DisplayName("Parser Tests")
class ParserTest {

    private static Expr parse(String input) {
        return new Parser(input).parse();
    }

    private static BinaryExpr binary(Expr expr, Kind kind) {
        BinaryExpr binary = assertInstanceOf(BinaryExpr.class, expr);
        assertEquals(kind, binary.op().kind());
        return binary;
    }

    // ==================== Precedence Tests ====================

    @Nested
    @DisplayName("Precedence and associativity")
    class PrecedenceTests {

        @Test
        void andBindsTighterThanOr() {
            BinaryExpr or = binary(parse("a == 1 or b == 2 and c == 3"), Kind.OR);

            binary(or.left(), Kind.EQ);
            BinaryExpr and = binary(or.right(), Kind.AND);
            binary(and.left(), Kind.EQ);
            binary(and.right(), Kind.EQ);
        }

        @Test
        void sameLevelIsLeftAssociative() {
            BinaryExpr outer = binary(parse("a == 1 and b == 2 and c == 3"), Kind.AND);

            binary(outer.left(), Kind.AND);
            binary(outer.right(), Kind.EQ);
        }

        @Test
        void comparisonBindsTighterThanNot() {
            UnaryExpr not = assertInstanceOf(UnaryExpr.class, parse("not a == 1"));

            binary(not.right(), Kind.EQ);
        }

        @Test
        void notBindsTighterThanAnd() {
            BinaryExpr and = binary(parse("not (a == 1) and b == 2"), Kind.AND);

            UnaryExpr not = assertInstanceOf(UnaryExpr.class, and.left());
            assertInstanceOf(ParenExpr.class, not.right());
        }

        @Test
        void parenthesesArePreserved() {
            BinaryExpr and = binary(parse("(a == 1 or b == 2) and c == 3"), Kind.AND);

            ParenExpr group = assertInstanceOf(ParenExpr.class, and.left());
            binary(group.inner(), Kind.OR);
        }

        @Test
        void keywordsAreCaseInsensitive() {
            binary(parse("a == 1 AND b == 2 Or c == 3"), Kind.OR);
        }
    }

    // ==================== Operand Tests ====================

    @Nested
    @DisplayName("Operands")
    class OperandTests {

        @Test
        void inTakesAList() {
            BinaryExpr in = binary(parse("status in ('active', 'pending')"), Kind.IN);

            ListLiteral list = assertInstanceOf(ListLiteral.class, in.right());
            assertEquals(2, list.size());
            assertEquals("pending", list.values().get(1).value());
        }

        @Test
        @DisplayName("A single parenthesized value after 'in' is a one element list")
        void inWithSingleValue() {
            BinaryExpr in = binary(parse("status in ('active')"), Kind.IN);

            assertEquals(1, assertInstanceOf(ListLiteral.class, in.right()).size());
        }

        @Test
        void booleansFormOneKind() {
            BinaryExpr in = binary(parse("flag in (true, false)"), Kind.IN);

            assertEquals(2, ((ListLiteral) in.right()).size());
        }

        @Test
        void listOutsideIn() {
            BinaryExpr eq = binary(parse("x == (1, 2)"), Kind.EQ);

            assertInstanceOf(ListLiteral.class, eq.right());
        }

        @Test
        void chainedIndexes() {
            BinaryExpr eq = binary(parse("user['profile']['name'] == 'Alice'"), Kind.EQ);

            IndexExpr outer = assertInstanceOf(IndexExpr.class, eq.left());
            IndexExpr inner = assertInstanceOf(IndexExpr.class, outer.left());
            assertEquals("user", ((Ident) inner.left()).value());
            assertEquals("profile", ((Literal) inner.index()).value());
            assertEquals("name", ((Literal) outer.index()).value());
        }

        @Test
        void numericIndex() {
            BinaryExpr eq = binary(parse("tags[0] == 'x'"), Kind.EQ);

            IndexExpr index = assertInstanceOf(IndexExpr.class, eq.left());
            assertEquals("0", ((Literal) index.index()).value());
        }

        @Test
        void likeAndOrdering() {
            binary(parse("name like 'Jo%'"), Kind.LIKE);
            BinaryExpr lt = binary(parse("score < -1.5"), Kind.LT);
            assertEquals("-1.5", ((Literal) lt.right()).value());
        }

        @Test
        void parserAcceptsShapesTheAnalyzerRejects() {
            binary(parse("5 == age"), Kind.EQ);
            binary(parse("age > 'x'"), Kind.GT);
            binary(parse("a and b"), Kind.AND);
        }
    }

    // ==================== Span Tests ====================

    @Nested
    @DisplayName("Spans")
    class SpanTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "age >= 18|1|9",
                "not (a == 1)|1|12",
                "(a == 1)|1|8",
                "status in ('a', 'b')|1|20"
        })
        void spansCoverTheSource(String input, int startColumn, int endColumn) {
            Expr expr = parse(input);

            assertEquals(new Position(1, startColumn), expr.start());
            assertEquals(new Position(1, endColumn), expr.end());
        }

        @Test
        void indexSpanEndsAtBracket() {
            BinaryExpr eq = (BinaryExpr) parse("user['name'] == 'x'");

            assertEquals(new Position(1, 12), eq.left().end());
            assertTrue(eq.start().compareTo(eq.end()) <= 0);
        }
    }

    // ==================== Error Tests ====================

    @Nested
    @DisplayName("Syntax errors")
    class ErrorTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "a == |unexpected end of expression",
                "a == 1 b == 2|after complete expression",
                "()|empty parentheses are not allowed",
                "x in ()|empty lists are not allowed",
                "x in (1,)|trailing commas are not allowed",
                "x in (1, 'a')|type mismatch in list",
                "x in (a, b)|expected a literal value",
                "(a == 1, 2)|list elements must be literal values",
                "(a == 1|expected ')' but found end of input",
                "a[true] == 1|index must be a number or a string",
                "a[b] == 1|expected a literal value",
                "a['b' == 1|expected ']'",
                "not a|cannot be applied to a bare field or value",
                "a == 'x|unterminated string literal",
                "a == 1 @|illegal character '@'",
                "== 1|unexpected token '=='",
                "a = 1|illegal character '='"
        })
        void shouldRejectMalformedInput(String input, String expectedFragment) {
            DSLSyntaxException exception = assertThrows(DSLSyntaxException.class, () -> parse(input));

            assertTrue(exception.getMessage().contains(expectedFragment),
                    () -> "Unexpected message: " + exception.getMessage());
            assertTrue(exception.getMessage().startsWith("Parsing failed: "));
        }

        @Test
        void shouldRejectEmptyInput() {
            assertThrows(DSLSyntaxException.class, () -> parse(""));
        }

        @Test
        @DisplayName("Errors carry the offending token position")
        void shouldReportPosition() {
            DSLSyntaxException trailing = assertThrows(DSLSyntaxException.class, () -> parse("a == 1 b"));
            DSLSyntaxException mismatch = assertThrows(DSLSyntaxException.class, () -> parse("x in (1,'a')"));
            DSLSyntaxException eof = assertThrows(DSLSyntaxException.class, () -> parse("a == "));

            assertEquals(new Position(1, 8), trailing.getPosition());
            assertEquals(new Position(1, 9), mismatch.getPosition());
            assertEquals("Parsing failed: unexpected end of expression (at 1:6, token: '')", eof.getMessage());
        }
    }

    // ==================== Nesting Tests ====================

    @Nested
    @DisplayName("Nesting limits")
    class NestingTests {

        @Test
        void shouldRejectTooDeepNesting() {
            DslPolicy policy = DslPolicy.builder().maxNestingDepth(3).build();

            DSLSyntaxException exception = assertThrows(DSLSyntaxException.class,
                    () -> new Parser("((((a == 1))))", policy).parse());

            assertEquals("Expression nesting too deep (max: 3). Policy applied: CUSTOM_POLICY", exception.getMessage());
        }

        @Test
        void shouldAcceptNestingWithinLimit() {
            DslPolicy policy = DslPolicy.builder().maxNestingDepth(2).build();

            assertDoesNotThrow(() -> new Parser("a == 1", policy).parse());
        }

        @Test
        void longFlatChainsDoNotCountAsNesting() {
            DslPolicy policy = DslPolicy.builder().maxNestingDepth(4).build();
            StringBuilder input = new StringBuilder("a == 0");
            for (int i = 1; i < 50; i++) {
                input.append(" and a == ").append(i);
            }

            assertDoesNotThrow(() -> new Parser(input.toString(), policy).parse());
        }
    }
}
