package org.pragmatica.twistor.error;

import org.pragmatica.twistor.tree.SourceLocation;
import org.pragmatica.twistor.tree.SourceSpan;

/**
 * Token sequence violates the expression grammar.
 */
public final class ParseException extends TwistorSyntaxException {
    private final int tokenIndex;

    public ParseException(int tokenIndex, SourceSpan span, String reason) {
        this(tokenIndex, span, reason, null);
    }

    public ParseException(int tokenIndex, SourceSpan span, String reason, Throwable cause) {
        super(span, reason, cause);
        this.tokenIndex = tokenIndex;
    }

    public static ParseException unexpected(int tokenIndex, SourceSpan span, String found, String expected) {
        return new ParseException(tokenIndex, span, "Unexpected '" + found + "', expected " + expected);
    }

    public static ParseException unexpectedEnd(int tokenIndex, SourceSpan span, String expected) {
        return new ParseException(tokenIndex, span, "Unexpected end of input, expected " + expected);
    }

    public static ParseException emptyInput() {
        return new ParseException(0,
                                  SourceSpan.at(SourceLocation.START),
                                  "Empty input, expected expression");
    }

    /**
     * Index of the offending token; equals the token count when input ended early.
     */
    public int tokenIndex() {
        return tokenIndex;
    }

    @Override
    public String kind() {
        return "parse";
    }
}
