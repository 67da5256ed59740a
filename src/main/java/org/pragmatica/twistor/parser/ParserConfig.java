package org.pragmatica.twistor.parser;

import org.pragmatica.twistor.lexer.Lexer;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Parser limits.
 *
 * @param maxInputLength longest accepted expression text, in characters
 * @param maxDepth       tallest accepted tree; bounds recursion in parsing and in both serializers
 */
public record ParserConfig(
    int maxInputLength,
    int maxDepth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        Lexer.DEFAULT_MAX_INPUT_LENGTH,
        256
    );

    public ParserConfig {
        checkArgument(maxInputLength > 0, "maxInputLength must be positive, got %s", maxInputLength);
        checkArgument(maxDepth > 0, "maxDepth must be positive, got %s", maxDepth);
    }
}
