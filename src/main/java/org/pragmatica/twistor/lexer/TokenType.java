package org.pragmatica.twistor.lexer;

/**
 * Token kinds of the twistor expression language.
 */
public enum TokenType {
    // Z1, Z_{1}
    TWISTOR,
    // W1, W_{1}
    DUAL_TWISTOR,
    // + - * / ^
    OPERATOR,
    NUMBER,
    // '(' or a whole 4-index bracket group <i,j,k,l> / [i,j,k,l]
    BRACKET_OPEN,
    // ')'
    BRACKET_CLOSE,
    DOT,
    // I
    INFINITY_TWISTOR;

    boolean acceptsIndexCount(int count) {
        return switch (this) {
            case TWISTOR, DUAL_TWISTOR -> count == 1;
            case BRACKET_OPEN -> count == 0 || count == 4;
            default -> count == 0;
        };
    }
}
