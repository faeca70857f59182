package io.github.cyfko.filterexpr.core.parsing;

import io.github.cyfko.filterexpr.core.token.Identifiers;
import io.github.cyfko.filterexpr.core.token.Kind;
import io.github.cyfko.filterexpr.core.token.Position;
import io.github.cyfko.filterexpr.core.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tokenizer for filter expressions.
 * <p>
 * The lexer never throws: malformed input produces {@link Kind#ERROR} tokens whose literal
 * describes the problem, and the end of input is reported as an {@link Kind#EOF} token, repeated
 * on every further call to {@link #scan()}.
 * </p>
 *
 * <h2>Lexical Rules</h2>
 * <ul>
 *   <li><strong>Operators</strong>: {@code == != < <= > >=}; a lone {@code =} or {@code !} is illegal</li>
 *   <li><strong>Punctuation</strong>: {@code ( ) [ ] ,}</li>
 *   <li><strong>Strings</strong>: single-quoted, escapes {@code \n \t \r \' \\}; any other escaped
 *       character stands for itself</li>
 *   <li><strong>Numbers</strong>: {@code digits[.digits]}, optionally preceded by {@code -};
 *       normalized on creation</li>
 *   <li><strong>Identifiers</strong>: a letter or {@code _} followed by letters, digits or
 *       {@code _}; keywords ({@code and or not in like true false}) are case-insensitive</li>
 * </ul>
 *
 * <p>Token spans are inclusive: {@code end} is the position of the token's last character.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class Lexer {

    private static final int END = -1;

    private final String input;
    private int offset;
    private int line;
    private int column;
    private Position lastPosition;

    public Lexer(String input) {
        this.input = Objects.requireNonNull(input, "Input cannot be null");
        reset();
    }

    /**
     * Rewinds the lexer to the beginning of its input.
     */
    public void reset() {
        offset = 0;
        line = 1;
        column = 1;
        lastPosition = Position.NO_POSITION;
    }

    /**
     * Scans the next token.
     *
     * @return the next token; {@link Kind#EOF} once the input is exhausted
     */
    public Token scan() {
        skipWhitespace();
        if (peek() == END) {
            return Token.ofEof(currentPosition());
        }

        Position start = currentPosition();
        int c = advance();
        switch (c) {
            case '=':
                return fixedOperator(c, start, Kind.EQ);
            case '!':
                return fixedOperator(c, start, Kind.NE);
            case '<':
                return variableOperator(start, Kind.LT, Kind.LE);
            case '>':
                return variableOperator(start, Kind.GT, Kind.GE);
            case '\'':
                return string(start);
            case '-':
                if (!isDigit(peek())) {
                    return Token.ofIllegal(c, start);
                }
                return number(start, "-");
            case '(':
                return Token.ofKind(Kind.LPAREN, start, start);
            case ')':
                return Token.ofKind(Kind.RPAREN, start, start);
            case '[':
                return Token.ofKind(Kind.LBRACK, start, start);
            case ']':
                return Token.ofKind(Kind.RBRACK, start, start);
            case ',':
                return Token.ofKind(Kind.COMMA, start, start);
            default:
                break;
        }

        if (isDigit(c)) {
            return number(start, new String(Character.toChars(c)));
        }
        if (Identifiers.isIdentifierStart(c)) {
            return identifier(start, c);
        }
        return Token.ofIllegal(c, start);
    }

    /**
     * Scans the whole input.
     *
     * @return every token up to and including the first {@link Kind#EOF}
     */
    public List<Token> tokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = scan();
            tokens.add(token);
        } while (!token.is(Kind.EOF));
        return tokens;
    }

    private Token fixedOperator(int first, Position start, Kind kind) {
        if (peek() != '=') {
            return Token.ofIllegal(first, start);
        }
        advance();
        return Token.ofKind(kind, start, lastPosition);
    }

    private Token variableOperator(Position start, Kind single, Kind withEquals) {
        if (peek() == '=') {
            advance();
            return Token.ofKind(withEquals, start, lastPosition);
        }
        return Token.ofKind(single, start, start);
    }

    private Token string(Position start) {
        StringBuilder value = new StringBuilder();
        while (true) {
            int c = advance();
            if (c == END) {
                return Token.ofError("unterminated string literal starting at " + start, start);
            }
            if (c == '\'') {
                break;
            }
            if (c == '\\') {
                int escaped = advance();
                if (escaped == END) {
                    return Token.ofError("unterminated string literal starting at " + start, start);
                }
                value.appendCodePoint(unescape(escaped));
            } else {
                value.appendCodePoint(c);
            }
        }
        return Token.ofLiteral(Kind.STRING, value.toString(), start, lastPosition);
    }

    private Token number(Position start, String prefix) {
        StringBuilder text = new StringBuilder(prefix);
        if (prefix.equals("-")) {
            text.appendCodePoint(advance());
        }
        collectDigits(text);
        if (peek() == '.') {
            advance();
            Position dot = lastPosition;
            if (!isDigit(peek())) {
                return Token.ofIllegal('.', dot);
            }
            text.append('.');
            collectDigits(text);
        }
        return Token.ofLiteral(Kind.NUMBER, text.toString(), start, lastPosition);
    }

    private Token identifier(Position start, int first) {
        StringBuilder text = new StringBuilder().appendCodePoint(first);
        while (peek() != END && Identifiers.isIdentifierChar(peek())) {
            text.appendCodePoint(advance());
        }
        Kind keyword = Kind.lookupKeyword(text.toString());
        if (keyword != null) {
            return Token.ofKind(keyword, start, lastPosition);
        }
        return Token.ofIdent(text.toString(), start, lastPosition);
    }

    private void collectDigits(StringBuilder text) {
        while (isDigit(peek())) {
            text.appendCodePoint(advance());
        }
    }

    private void skipWhitespace() {
        while (peek() != END && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private int peek() {
        return offset < input.length() ? input.codePointAt(offset) : END;
    }

    private int advance() {
        if (offset >= input.length()) {
            return END;
        }
        int c = input.codePointAt(offset);
        offset += Character.charCount(c);
        lastPosition = new Position(line, column);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private Position currentPosition() {
        return new Position(line, column);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static int unescape(int c) {
        switch (c) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            default:
                return c;
        }
    }
}
