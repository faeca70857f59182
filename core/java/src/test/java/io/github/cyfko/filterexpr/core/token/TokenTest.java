package io.github.cyfko.filterexpr.core.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Token and Position Tests")
class TokenTest {

    private static final Position FROM = new Position(1, 5);
    private static final Position TO = new Position(1, 8);

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("ofKind derives the literal from the kind")
        void ofKindDerivesLiteral() {
            Token token = Token.ofKind(Kind.LE, FROM, TO);

            assertEquals(Kind.LE, token.kind());
            assertEquals("<=", token.literal());
            assertEquals(FROM, token.start());
            assertEquals(TO, token.end());
        }

        @Test
        void ofIdentKeepsValue() {
            Token token = Token.ofIdent("user_type", FROM, TO);

            assertTrue(token.is(Kind.IDENT));
            assertEquals("user_type", token.literal());
        }

        @Test
        @DisplayName("EOF covers no source text")
        void eofStartsAtNoPosition() {
            Token token = Token.ofEof(TO);

            assertEquals(Kind.EOF, token.kind());
            assertEquals("", token.literal());
            assertEquals(Position.NO_POSITION, token.start());
            assertEquals(TO, token.end());
        }

        @Test
        @DisplayName("Errors are point events")
        void errorEndsAtNoPosition() {
            Token token = Token.ofError("boom", FROM);

            assertEquals(Kind.ERROR, token.kind());
            assertEquals("boom", token.literal());
            assertEquals(FROM, token.start());
            assertEquals(Position.NO_POSITION, token.end());
        }

        @Test
        void errorWithoutMessageUsesDefault() {
            assertEquals("unexpected error", Token.ofError(null, FROM).literal());
        }

        @Test
        void illegalCharacterMessage() {
            Token token = Token.ofIllegal('@', new Position(2, 5));

            assertEquals(Kind.ERROR, token.kind());
            assertEquals("illegal character '@' at 2:5", token.literal());
        }

        @Test
        void illegalSupplementaryCharacter() {
            Token token = Token.ofIllegal(0x1F600, Position.start());

            assertEquals("illegal character '😀' at 1:1", token.literal());
        }

        @Test
        void rejectsNullComponents() {
            assertThrows(NullPointerException.class, () -> Token.of(null, "x", FROM, TO));
            assertThrows(NullPointerException.class, () -> Token.of(Kind.IDENT, null, FROM, TO));
        }
    }

    @Nested
    @DisplayName("Literal tokens")
    class LiteralTokens {

        @Test
        @DisplayName("Number literals are normalized")
        void numberIsNormalized() {
            Token token = Token.ofLiteral(Kind.NUMBER, "123.000", FROM, TO);

            assertEquals(Kind.NUMBER, token.kind());
            assertEquals("123", token.literal());
        }

        @ParameterizedTest
        @ValueSource(strings = {"12a", "", "1.2.3", "1e999"})
        @DisplayName("Invalid numbers become ERROR tokens")
        void invalidNumberBecomesError(String text) {
            Token token = Token.ofLiteral(Kind.NUMBER, text, FROM, TO);

            assertEquals(Kind.ERROR, token.kind());
            assertEquals(FROM, token.start());
            assertEquals(Position.NO_POSITION, token.end());
        }

        @Test
        void stringIsKeptVerbatim() {
            assertEquals("  John%  ", Token.ofLiteral(Kind.STRING, "  John%  ", FROM, TO).literal());
        }

        @Test
        void booleanUsesCanonicalLiteral() {
            assertEquals("true", Token.ofLiteral(Kind.TRUE, "TRUE", FROM, TO).literal());
            assertEquals("false", Token.ofLiteral(Kind.FALSE, "False", FROM, TO).literal());
        }

        @Test
        void unsupportedKindBecomesError() {
            Token token = Token.ofLiteral(Kind.IDENT, "age", FROM, TO);

            assertEquals(Kind.ERROR, token.kind());
            assertEquals("unsupported literal kind IDENT", token.literal());
        }
    }

    @Nested
    @DisplayName("Position")
    class Positions {

        @Test
        void noPositionIsNotValid() {
            assertFalse(Position.NO_POSITION.isValid());
            assertTrue(Position.start().isValid());
            assertEquals(new Position(1, 1), Position.start());
        }

        @Test
        void ordersByLineThenColumn() {
            assertTrue(new Position(1, 9).compareTo(new Position(2, 1)) < 0);
            assertTrue(new Position(2, 3).compareTo(new Position(2, 1)) > 0);
            assertEquals(0, new Position(4, 4).compareTo(new Position(4, 4)));
        }

        @Test
        void advancesColumnsAndLines() {
            assertEquals(new Position(1, 2), Position.start().nextColumn());
            assertEquals(new Position(2, 1), new Position(1, 7).nextLine());
        }

        @Test
        void rendersLineAndColumn() {
            assertEquals("3:7", new Position(3, 7).toString());
            assertEquals("0:0", Position.NO_POSITION.toString());
        }

        @Test
        void rejectsNegativeComponents() {
            assertThrows(IllegalArgumentException.class, () -> new Position(-1, 0));
        }
    }
}
