package io.github.cyfko.filterexpr.core.parsing;

import io.github.cyfko.filterexpr.core.token.Kind;
import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Lexer Tests")
class LexerTest {

    private static List<Kind> kinds(String input) {
        return new Lexer(input).tokens().stream().map(Token::kind).toList();
    }

    private static Token first(String input) {
        return new Lexer(input).scan();
    }

    @Test
    @DisplayName("Should record inclusive token spans")
    void shouldRecordSpans() {
        // When
        List<Token> tokens = new Lexer("age >= 18").tokens();

        // Then
        assertEquals(4, tokens.size());
        assertEquals(Token.ofIdent("age", new Position(1, 1), new Position(1, 3)), tokens.get(0));
        assertEquals(Token.ofKind(Kind.GE, new Position(1, 5), new Position(1, 6)), tokens.get(1));
        assertEquals(Token.of(Kind.NUMBER, "18", new Position(1, 8), new Position(1, 9)), tokens.get(2));
        assertEquals(Token.ofEof(new Position(1, 10)), tokens.get(3));
    }

    @Test
    void shouldScanOperatorsAndPunctuation() {
        assertEquals(List.of(Kind.EQ, Kind.NE, Kind.LT, Kind.LE, Kind.GT, Kind.GE,
                        Kind.LPAREN, Kind.RPAREN, Kind.LBRACK, Kind.RBRACK, Kind.COMMA, Kind.EOF),
                kinds("== != < <= > >= ( ) [ ] ,"));
    }

    @Test
    void shouldNotRequireWhitespaceBetweenTokens() {
        assertEquals(List.of(Kind.IDENT, Kind.LBRACK, Kind.NUMBER, Kind.RBRACK, Kind.GE, Kind.NUMBER, Kind.EOF),
                kinds("tags[0]>=-1"));
    }

    @Test
    @DisplayName("Keywords are case-insensitive and carry their canonical literal")
    void shouldRecognizeKeywords() {
        List<Token> tokens = new Lexer("AND Or nOt IN like TRUE false").tokens();

        assertEquals(List.of(Kind.AND, Kind.OR, Kind.NOT, Kind.IN, Kind.LIKE, Kind.TRUE, Kind.FALSE, Kind.EOF),
                tokens.stream().map(Token::kind).toList());
        assertEquals("and", tokens.get(0).literal());
        assertEquals("true", tokens.get(5).literal());
    }

    @Test
    void shouldScanUnicodeIdentifiers() {
        Token token = first("名前 == 'x'");

        assertEquals(Kind.IDENT, token.kind());
        assertEquals("名前", token.literal());
        assertEquals(new Position(1, 2), token.end());
    }

    @Test
    void keywordPrefixIsAnIdentifier() {
        Token token = first("android");

        assertEquals(Kind.IDENT, token.kind());
        assertEquals("android", token.literal());
    }

    @Test
    void shouldTrackLines() {
        List<Token> tokens = new Lexer("a ==\n  1").tokens();

        assertEquals(new Position(2, 3), tokens.get(2).start());
    }

    @Test
    void emptyInputIsEof() {
        assertEquals(Token.ofEof(Position.start()), first(""));
        assertEquals(Token.ofEof(new Position(1, 4)), first("   "));
    }

    // ==================== String Tests ====================

    @Nested
    @DisplayName("Strings")
    class Strings {

        @Test
        void shouldDecodeEscapes() {
            Token token = first("'it\\'s\\n\\t\\\\'");

            assertEquals(Kind.STRING, token.kind());
            assertEquals("it's\n\t\\", token.literal());
            assertEquals(Position.start(), token.start());
            assertEquals(new Position(1, 13), token.end());
        }

        @Test
        void unknownEscapeYieldsTheCharacter() {
            assertEquals("q%", first("'\\q%'").literal());
        }

        @Test
        void emptyString() {
            Token token = first("''");

            assertEquals(Kind.STRING, token.kind());
            assertEquals("", token.literal());
        }

        @Test
        void unterminatedStringIsAnError() {
            Token token = first("'abc");

            assertEquals(Kind.ERROR, token.kind());
            assertEquals("unterminated string literal starting at 1:1", token.literal());
        }

        @Test
        void danglingBackslashIsUnterminated() {
            assertEquals(Kind.ERROR, first("'abc\\").kind());
        }
    }

    // ==================== Number Tests ====================

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @ParameterizedTest
        @CsvSource({"18, 18", "007, 7", "1.50, 1.5", "-12.5, -12.5", "0.000123, 0.000123", "-0, 0"})
        void shouldScanAndNormalize(String input, String expected) {
            Token token = first(input);

            assertEquals(Kind.NUMBER, token.kind());
            assertEquals(expected, token.literal());
        }

        @Test
        void negativeNumberSpanIncludesSign() {
            Token token = first("-12.5");

            assertEquals(Position.start(), token.start());
            assertEquals(new Position(1, 5), token.end());
        }

        @Test
        void trailingDotIsIllegal() {
            Token token = first("12.");

            assertEquals(Kind.ERROR, token.kind());
            assertEquals("illegal character '.' at 1:3", token.literal());
        }

        @Test
        void detachedMinusIsIllegal() {
            assertEquals("illegal character '-' at 1:1", first("- 1").literal());
        }
    }

    // ==================== Error Tests ====================

    @Nested
    @DisplayName("Illegal input")
    class IllegalInput {

        @Test
        void loneEqualsIsIllegal() {
            Token token = first("= 1");

            assertEquals(Kind.ERROR, token.kind());
            assertEquals("illegal character '=' at 1:1", token.literal());
        }

        @Test
        void loneBangIsIllegal() {
            assertEquals(Kind.ERROR, first("!").kind());
        }

        @Test
        void unknownCharacterIsIllegal() {
            List<Token> tokens = new Lexer("a @ b").tokens();

            assertEquals(Kind.ERROR, tokens.get(1).kind());
            assertEquals("illegal character '@' at 1:3", tokens.get(1).literal());
            assertEquals(new Position(1, 3), tokens.get(1).start());
        }
    }

    @Test
    @DisplayName("Should keep returning EOF and rewind on reset")
    void shouldRewindOnReset() {
        // Given
        Lexer lexer = new Lexer("a");
        lexer.tokens();

        // When
        Token afterEnd = lexer.scan();
        lexer.reset();
        Token rewound = lexer.scan();

        // Then
        assertEquals(Kind.EOF, afterEnd.kind());
        assertEquals(Token.ofIdent("a", Position.start(), Position.start()), rewound);
    }
}
