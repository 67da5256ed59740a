package org.pragmatica.twistor.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.twistor.error.LexException;
import org.pragmatica.twistor.tree.BracketKind;
import org.pragmatica.twistor.tree.SourceLocation;
import org.pragmatica.twistor.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    // === Twistors ===

    @Test
    void tokenize_twistorSum_producesThreeTokens() throws LexException {
        var tokens = Lexer.tokenize("Z1 + Z2");

        assertEquals(3, tokens.size());
        assertToken(tokens.get(0), TokenType.TWISTOR, "Z1", List.of(1));
        assertToken(tokens.get(1), TokenType.OPERATOR, "+", List.of());
        assertToken(tokens.get(2), TokenType.TWISTOR, "Z2", List.of(2));
    }

    @Test
    void tokenize_dualTwistor_carriesIndex() throws LexException {
        var tokens = Lexer.tokenize("W42");

        assertToken(tokens.get(0), TokenType.DUAL_TWISTOR, "W42", List.of(42));
        assertEquals(42, tokens.get(0).index());
    }

    @Test
    void tokenize_canonicalTwistorForms_areAccepted() throws LexException {
        var tokens = Lexer.tokenize("Z_{12} W_3");

        assertToken(tokens.get(0), TokenType.TWISTOR, "Z_{12}", List.of(12));
        assertToken(tokens.get(1), TokenType.DUAL_TWISTOR, "W_3", List.of(3));
    }

    @Test
    void tokenize_twistorWithoutIndex_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("Z + 1"));

        assertEquals("Z", error.lexeme());
        assertEquals(0, error.offset());
    }

    @Test
    void tokenize_adjacentTwistors_splitAfterDigits() throws LexException {
        var tokens = Lexer.tokenize("2 * Z1Z2W3I");

        assertThat(tokens).extracting(Token::type)
                          .containsExactly(TokenType.NUMBER,
                                           TokenType.OPERATOR,
                                           TokenType.TWISTOR,
                                           TokenType.TWISTOR,
                                           TokenType.DUAL_TWISTOR,
                                           TokenType.INFINITY_TWISTOR);
        assertThat(tokens).extracting(Token::value)
                          .containsExactly("2", "*", "Z1", "Z2", "W3", "I");
        assertEquals(6, tokens.get(3).span().start().offset());
    }

    @Test
    void tokenize_twistorFollowedByLetters_failsWithWholeLexeme() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("2 * Zab"));

        assertEquals("Zab", error.lexeme());
        assertEquals(4, error.offset());
    }

    @Test
    void tokenize_unclosedCanonicalTwistor_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("Z_{7"));

        assertThat(error.reason()).startsWith("Unrecognized lexeme");
    }

    // === Infinity twistor ===

    @Test
    void tokenize_infinityTwistor_hasNoIndices() throws LexException {
        var tokens = Lexer.tokenize("I");

        assertToken(tokens.get(0), TokenType.INFINITY_TWISTOR, "I", List.of());
    }

    @Test
    void tokenize_identifierStartingWithI_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("Ix"));

        assertEquals("Ix", error.lexeme());
    }

    // === Numbers ===

    @Test
    void tokenize_numberForms_keepLiteralText() throws LexException {
        var tokens = Lexer.tokenize("3 3.14 1e-5 2.5E+3");

        assertThat(tokens).extracting(Token::type)
                          .containsOnly(TokenType.NUMBER);
        assertThat(tokens).extracting(Token::value)
                          .containsExactly("3", "3.14", "1e-5", "2.5E+3");
    }

    @Test
    void tokenize_leadingSign_bindsToNumber() throws LexException {
        var tokens = Lexer.tokenize("-2 * Z1");

        assertToken(tokens.get(0), TokenType.NUMBER, "-2", List.of());
        assertEquals(3, tokens.size());
    }

    @Test
    void tokenize_signAfterOperand_isOperator() throws LexException {
        var tokens = Lexer.tokenize("Z1 -2");

        assertThat(tokens).extracting(Token::type)
                          .containsExactly(TokenType.TWISTOR, TokenType.OPERATOR, TokenType.NUMBER);
        assertEquals("2", tokens.get(2).value());
    }

    @Test
    void tokenize_signAfterOperatorOrParen_bindsToNumber() throws LexException {
        var tokens = Lexer.tokenize("2^-1 * (-3)");

        assertThat(tokens).extracting(Token::value)
                          .containsExactly("2", "^", "-1", "*", "(", "-3", ")");
    }

    @Test
    void tokenize_exponentWithoutDigits_isNotConsumed() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("2e"));

        assertEquals("e", error.lexeme());
        assertEquals(1, error.offset());
    }

    // === Brackets ===

    @Test
    void tokenize_angleBracket_producesSingleToken() throws LexException {
        var tokens = Lexer.tokenize("<1,2,3,4>");

        assertEquals(1, tokens.size());
        assertToken(tokens.get(0), TokenType.BRACKET_OPEN, "<1,2,3,4>", List.of(1, 2, 3, 4));
        assertEquals(Optional.of(BracketKind.ANGLE), tokens.get(0).bracketKind());
        assertFalse(tokens.get(0).isOpenParen());
    }

    @Test
    void tokenize_squareBracketWithWhitespaceSeparators_isAccepted() throws LexException {
        var tokens = Lexer.tokenize("[ 10 11, 12 ,13 ]");

        assertEquals(List.of(10, 11, 12, 13), tokens.get(0).indices());
        assertEquals(Optional.of(BracketKind.SQUARE), tokens.get(0).bracketKind());
    }

    @Test
    void tokenize_bracketWithThreeIndices_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("<1,2,3>"));

        assertThat(error.reason()).isEqualTo("Bracket requires exactly 4 indices, found 3");
        assertEquals("<1,2,3>", error.lexeme());
    }

    @Test
    void tokenize_bracketWithFiveIndices_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("[1,2,3,4,5]"));

        assertThat(error.reason()).contains("found 5");
    }

    @Test
    void tokenize_mismatchedBracket_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("<1,2,3,4]"));

        assertThat(error.reason()).isEqualTo("Mismatched bracket: '<' closed by ']'");
    }

    @Test
    void tokenize_unterminatedBracket_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("<1,2,3,4"));

        assertThat(error.reason()).isEqualTo("Unterminated bracket group");
    }

    @Test
    void tokenize_bracketWithEmptyEntry_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("<1,,2,3,4>"));

        assertEquals(",", error.lexeme());
        assertEquals(3, error.offset());
    }

    @Test
    void tokenize_bracketWithNegativeIndex_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("<-1,2,3,4>"));

        assertEquals("-", error.lexeme());
    }

    // === Punctuation ===

    @Test
    void tokenize_parentheses_areGroupingTokens() throws LexException {
        var tokens = Lexer.tokenize("(Z1)");

        assertTrue(tokens.get(0).isOpenParen());
        assertEquals(Optional.empty(), tokens.get(0).bracketKind());
        assertTrue(tokens.get(2).isCloseParen());
    }

    @Test
    void tokenize_dot_isEmitted() throws LexException {
        var tokens = Lexer.tokenize("Z1.");

        assertThat(tokens).extracting(Token::type)
                          .containsExactly(TokenType.TWISTOR, TokenType.DOT);
    }

    @Test
    void tokenize_whitespaceOnly_producesNoTokens() throws LexException {
        assertThat(Lexer.tokenize(" \t\r\n ")).isEmpty();
    }

    // === Errors and positions ===

    @Test
    void tokenize_unknownCharacter_reportsPosition() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("Z1 $ Z2"));

        assertEquals("$", error.lexeme());
        assertEquals(3, error.offset());
        assertEquals(SourceLocation.at(1, 4, 3), error.location());
        assertEquals("Unexpected character '$' at 1:4", error.getMessage());
    }

    @Test
    void tokenize_errorOnSecondLine_reportsLineAndColumn() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("Z1 +\n  $"));

        assertEquals(2, error.location().line());
        assertEquals(3, error.location().column());
        assertEquals(7, error.offset());
    }

    @Test
    void tokenize_inputOverLimit_fails() {
        var error = assertThrows(LexException.class, () -> Lexer.tokenize("Z1 + Z2", 3));

        assertThat(error.reason()).contains("exceeds maximum of 3");
    }

    @Test
    void tokens_trackSourceSpans() throws LexException {
        var tokens = Lexer.tokenize("Z1 + <1,2,3,4>");

        assertEquals(SourceSpan.of(SourceLocation.at(1, 6, 5), SourceLocation.at(1, 15, 14)), tokens.get(2).span());
        assertEquals("<1,2,3,4>", tokens.get(2).span().extract("Z1 + <1,2,3,4>"));
    }

    // === Token ===

    @Test
    void token_toString_followsTypeValueIndicesLayout() throws LexException {
        var tokens = Lexer.tokenize("Z1 + <1,2,3,4>");

        assertEquals("TWISTOR(Z1[1])", tokens.get(0).toString());
        assertEquals("OPERATOR(+)", tokens.get(1).toString());
        assertEquals("BRACKET_OPEN(<1,2,3,4>[1, 2, 3, 4])", tokens.get(2).toString());
    }

    @Test
    void token_twistorWithTwoIndices_isRejected() {
        var span = SourceSpan.at(SourceLocation.START);

        assertThrows(IllegalArgumentException.class, () -> new Token(TokenType.TWISTOR, "Z1", List.of(1, 2), span));
    }

    @Test
    void token_bracketWithThreeIndices_isRejected() {
        var span = SourceSpan.at(SourceLocation.START);

        assertThrows(IllegalArgumentException.class,
                     () -> new Token(TokenType.BRACKET_OPEN, "<1,2,3>", List.of(1, 2, 3), span));
    }

    @Test
    void token_indices_areImmutable() throws LexException {
        var token = Lexer.tokenize("<1,2,3,4>").get(0);

        assertThrows(UnsupportedOperationException.class, () -> token.indices().add(5));
    }

    private static void assertToken(Token token, TokenType type, String value, List<Integer> indices) {
        assertEquals(type, token.type());
        assertEquals(value, token.value());
        assertEquals(indices, token.indices());
    }
}
