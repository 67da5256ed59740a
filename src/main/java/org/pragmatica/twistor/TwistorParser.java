package org.pragmatica.twistor;

import org.pragmatica.twistor.error.LexException;
import org.pragmatica.twistor.error.ParseException;
import org.pragmatica.twistor.error.TwistorSyntaxException;
import org.pragmatica.twistor.lexer.Lexer;
import org.pragmatica.twistor.lexer.Token;
import org.pragmatica.twistor.parser.ExpressionParser;
import org.pragmatica.twistor.parser.Parser;
import org.pragmatica.twistor.parser.ParserConfig;
import org.pragmatica.twistor.tree.ExpressionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for parsing momentum-twistor expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var tree = TwistorParser.parse("<1,2,3,4> * Z1 + 2^3");
 *
 * tree.toString();           // "(<1, 2, 3, 4> * Z_{1} + (2.0^3.0))"
 * tree.toPrefixNotation();   // [add, mul, angle1234, Z1, pow, 2.0, 3.0]
 * }</pre>
 */
public final class TwistorParser {
    private static final Logger log = LoggerFactory.getLogger(TwistorParser.class);

    private static final Parser DEFAULT = new ConfiguredParser(ParserConfig.DEFAULT);

    private TwistorParser() {}

    /**
     * Split expression text into tokens using the default configuration.
     */
    public static List<Token> tokenize(String text) throws LexException {
        return DEFAULT.tokenize(text);
    }

    /**
     * Parse expression text into a tree using the default configuration.
     */
    public static ExpressionNode parse(String text) throws LexException, ParseException {
        return DEFAULT.parse(text);
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return new ConfiguredParser(checkNotNull(config, "config"));
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxInputLength = ParserConfig.DEFAULT.maxInputLength();
        private int maxDepth = ParserConfig.DEFAULT.maxDepth();

        private Builder() {}

        public Builder maxInputLength(int maxInputLength) {
            this.maxInputLength = maxInputLength;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(maxInputLength, maxDepth));
        }
    }

    private record ConfiguredParser(ParserConfig config) implements Parser {
        @Override
        public List<Token> tokenize(String text) throws LexException {
            checkNotNull(text, "text");
            try {
                var tokens = Lexer.tokenize(text, config.maxInputLength());
                log.debug("Tokenized {} characters into {} tokens", text.length(), tokens.size());
                return tokens;
            } catch (LexException e) {
                log.debug("Tokenization failed: {}", e.getMessage());
                throw e;
            }
        }

        @Override
        public ExpressionNode parse(String text) throws LexException, ParseException {
            checkNotNull(text, "text");
            log.debug("Parsing expression of {} characters", text.length());
            try {
                var tokens = Lexer.tokenize(text, config.maxInputLength());
                var root = ExpressionParser.parse(tokens, config);
                log.debug("Parsed {} tokens", tokens.size());
                return root;
            } catch (TwistorSyntaxException e) {
                log.debug("Parse failed: {}", e.getMessage());
                throw e;
            }
        }
    }
}
