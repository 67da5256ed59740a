package org.pragmatica.twistor.error;

import org.pragmatica.twistor.tree.SourceLocation;
import org.pragmatica.twistor.tree.SourceSpan;

/**
 * Input text contains a character or lexeme that forms no token.
 */
public final class LexException extends TwistorSyntaxException {
    private final String lexeme;

    public LexException(SourceSpan span, String lexeme, String reason) {
        super(span, reason, null);
        this.lexeme = lexeme;
    }

    public static LexException unexpectedCharacter(SourceSpan span, char c) {
        return new LexException(span, String.valueOf(c), "Unexpected character '" + c + "'");
    }

    public static LexException unrecognized(SourceSpan span, String lexeme) {
        return new LexException(span, lexeme, "Unrecognized lexeme '" + lexeme + "'");
    }

    public static LexException inputTooLong(int length, int limit) {
        return new LexException(SourceSpan.at(SourceLocation.START),
                                "",
                                "Input of " + length + " characters exceeds maximum of " + limit);
    }

    /**
     * The offending text as it appears in the input.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * Character offset of the offending text.
     */
    public int offset() {
        return location().offset();
    }

    @Override
    public String kind() {
        return "lex";
    }
}
