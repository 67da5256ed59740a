package org.pragmatica.twistor.lexer;

import com.google.common.collect.ImmutableList;
import org.pragmatica.twistor.error.LexException;
import org.pragmatica.twistor.tree.BracketKind;
import org.pragmatica.twistor.tree.SourceLocation;
import org.pragmatica.twistor.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lexer for momentum-twistor expressions.
 *
 * <p>Recognition order at each position: twistor and dual twistor ({@code Z1}, {@code Z_{1}}, {@code W1}), the
 * infinity twistor {@code I}, numeric literals, 4-index bracket groups, operators, parentheses, and {@code .}.
 * Whitespace separates tokens and is never emitted.
 */
public final class Lexer {
    public static final int DEFAULT_MAX_INPUT_LENGTH = 1_000_000;

    private static final int BRACKET_INDEX_COUNT = 4;

    private final String input;
    private final List<Token> tokens;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.tokens = new ArrayList<>();
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) throws LexException {
        return tokenize(input, DEFAULT_MAX_INPUT_LENGTH);
    }

    public static List<Token> tokenize(String input, int maxInputLength) throws LexException {
        checkNotNull(input, "input");
        if (input.length() > maxInputLength) {
            throw LexException.inputTooLong(input.length(), maxInputLength);
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() throws LexException {
        skipWhitespace();
        while (!isAtEnd()) {
            tokens.add(nextToken());
            skipWhitespace();
        }
        return ImmutableList.copyOf(tokens);
    }

    private Token nextToken() throws LexException {
        var start = currentLocation();
        char c = peek();
        if (c == 'Z' || c == 'W') {
            return scanTwistor(start);
        }
        if (c == 'I') {
            return scanInfinityTwistor(start);
        }
        if (isDigit(c) || (isSign(c) && isDigitAt(pos + 1) && expectsOperand())) {
            return scanNumber(start);
        }
        if (BracketKind.fromOpen(c).isPresent()) {
            return scanBracketGroup(start, BracketKind.fromOpen(c).get());
        }
        return scanOperator(start);
    }

    private Token scanTwistor(SourceLocation start) throws LexException {
        var type = advance() == 'Z'
                   ? TokenType.TWISTOR
                   : TokenType.DUAL_TWISTOR;
        String digits;
        if (match('_')) {
            if (match('{')) {
                digits = scanDigits();
                if (!match('}')) {
                    throw unrecognized(start);
                }
            } else {
                digits = scanDigits();
            }
        } else {
            digits = scanDigits();
        }
        if (digits.isEmpty()) {
            throw unrecognized(start);
        }
        return new Token(type, text(start), List.of(parseIndex(digits, start)), span(start));
    }

    private Token scanInfinityTwistor(SourceLocation start) throws LexException {
        advance();
        if (!isAtEnd() && isIdentifierPart(peek())) {
            throw unrecognized(start);
        }
        return Token.of(TokenType.INFINITY_TWISTOR, text(start), span(start));
    }

    private Token scanNumber(SourceLocation start) {
        if (isSign(peek())) {
            advance();
        }
        scanDigits();
        if (!isAtEnd() && peek() == '.' && isDigitAt(pos + 1)) {
            advance();
            scanDigits();
        }
        if (!isAtEnd() && (peek() == 'e' || peek() == 'E') && isExponentAt(pos + 1)) {
            advance();
            if (isSign(peek())) {
                advance();
            }
            scanDigits();
        }
        return Token.of(TokenType.NUMBER, text(start), span(start));
    }

    private Token scanBracketGroup(SourceLocation start, BracketKind kind) throws LexException {
        advance();
        // skip opener
        var indices = new ArrayList<Integer>(BRACKET_INDEX_COUNT);
        skipWhitespace();
        while (isAtEnd() || !isBracketCloser(peek())) {
            if (isAtEnd()) {
                throw new LexException(span(start), text(start), "Unterminated bracket group");
            }
            if (!isDigit(peek())) {
                throw invalidBracketEntry();
            }
            var indexStart = currentLocation();
            indices.add(parseIndex(scanDigits(), indexStart));
            skipWhitespace();
            if (match(',')) {
                skipWhitespace();
                if (isAtEnd() || !isDigit(peek())) {
                    throw invalidBracketEntry();
                }
            }
        }
        char closer = advance();
        if (closer != kind.close()) {
            throw new LexException(span(start),
                                   text(start),
                                   "Mismatched bracket: '" + kind.open() + "' closed by '" + closer + "'");
        }
        if (indices.size() != BRACKET_INDEX_COUNT) {
            throw new LexException(span(start),
                                   text(start),
                                   "Bracket requires exactly " + BRACKET_INDEX_COUNT + " indices, found "
                                   + indices.size());
        }
        return new Token(TokenType.BRACKET_OPEN, text(start), indices, span(start));
    }

    private Token scanOperator(SourceLocation start) throws LexException {
        char c = advance();
        return switch (c) {
            case'+', '-', '*', '/', '^' -> Token.of(TokenType.OPERATOR, text(start), span(start));
            case'(' -> Token.of(TokenType.BRACKET_OPEN, text(start), span(start));
            case')' -> Token.of(TokenType.BRACKET_CLOSE, text(start), span(start));
            case'.' -> Token.of(TokenType.DOT, text(start), span(start));
            default -> throw LexException.unexpectedCharacter(span(start), c);
        };
    }

    private LexException unrecognized(SourceLocation start) {
        while (!isAtEnd() && (isIdentifierPart(peek()) || peek() == '{' || peek() == '}')) {
            advance();
        }
        return LexException.unrecognized(span(start), text(start));
    }

    private LexException invalidBracketEntry() {
        var start = currentLocation();
        if (isAtEnd()) {
            return new LexException(span(start), "", "Unterminated bracket group");
        }
        char c = advance();
        return new LexException(span(start), String.valueOf(c), "Expected bracket index, found '" + c + "'");
    }

    private int parseIndex(String digits, SourceLocation start) throws LexException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new LexException(span(start), digits, "Index out of range: " + digits);
        }
    }

    private String scanDigits() {
        int from = pos;
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
        return input.substring(from, pos);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    // A sign starts a number only where an operand is due: at the start, after an operator or '('
    private boolean expectsOperand() {
        return tokens.isEmpty() || !tokens.get(tokens.size() - 1).endsOperand();
    }

    private boolean isExponentAt(int index) {
        if (index < input.length() && isSign(input.charAt(index))) {
            index++;
        }
        return isDigitAt(index);
    }

    private boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            advance();
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private String text(SourceLocation start) {
        return input.substring(start.offset(), pos);
    }

    private boolean isDigitAt(int index) {
        return index < input.length() && isDigit(input.charAt(index));
    }

    private static boolean isBracketCloser(char c) {
        return c == '>' || c == ']';
    }

    private static boolean isSign(char c) {
        return c == '+' || c == '-';
    }

    private static boolean isIdentifierPart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
