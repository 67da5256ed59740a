package org.pragmatica.twistor.parser;

import org.pragmatica.twistor.error.LexException;
import org.pragmatica.twistor.error.ParseException;
import org.pragmatica.twistor.lexer.Token;
import org.pragmatica.twistor.tree.ExpressionNode;

import java.util.List;

/**
 * Configured twistor expression parser. Implementations are stateless and safe to share between threads.
 */
public interface Parser {

    /**
     * Split expression text into tokens.
     */
    List<Token> tokenize(String text) throws LexException;

    /**
     * Tokenize and build the expression tree.
     *
     * @param text expression text
     * @return root of the expression tree
     * @throws LexException   if the text contains an unrecognized lexeme
     * @throws ParseException if the tokens do not form exactly one expression
     */
    ExpressionNode parse(String text) throws LexException, ParseException;

    /**
     * Get the configuration this parser was created with.
     */
    ParserConfig config();
}
