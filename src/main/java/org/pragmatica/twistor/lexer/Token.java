package org.pragmatica.twistor.lexer;

import com.google.common.collect.ImmutableList;
import org.pragmatica.twistor.tree.BracketKind;
import org.pragmatica.twistor.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lexical token: kind, literal source text and, for twistors and bracket groups, the parsed indices.
 */
public record Token(TokenType type, String value, List<Integer> indices, SourceSpan span) {

    public Token {
        checkNotNull(type, "type");
        checkNotNull(value, "value");
        checkNotNull(span, "span");
        indices = ImmutableList.copyOf(indices);
        checkArgument(type.acceptsIndexCount(indices.size()),
                      "%s token cannot carry %s indices",
                      type,
                      indices.size());
        checkArgument(indices.stream().allMatch(index -> index >= 0),
                      "Token indices must be non-negative: %s",
                      indices);
    }

    public static Token of(TokenType type, String value, SourceSpan span) {
        return new Token(type, value, List.of(), span);
    }

    /**
     * Single index of a twistor or dual twistor token.
     */
    public int index() {
        checkArgument(indices.size() == 1, "%s token has no single index", type);
        return indices.get(0);
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && value.equals(symbol);
    }

    public boolean isOpenParen() {
        return type == TokenType.BRACKET_OPEN && indices.isEmpty();
    }

    public boolean isCloseParen() {
        return type == TokenType.BRACKET_CLOSE;
    }

    /**
     * Kind of a 4-index bracket group; empty for every other token, grouping parentheses included.
     */
    public Optional<BracketKind> bracketKind() {
        if (type != TokenType.BRACKET_OPEN || indices.isEmpty()) {
            return Optional.empty();
        }
        return BracketKind.fromOpen(value.charAt(0));
    }

    /**
     * True if an operand may not directly follow this token, so a following sign is an operator.
     */
    boolean endsOperand() {
        return switch (type) {
            case OPERATOR, DOT -> false;
            case BRACKET_OPEN -> !indices.isEmpty();
            default -> true;
        };
    }

    @Override
    public String toString() {
        if (indices.isEmpty()) {
            return type + "(" + value + ")";
        }
        return type + "(" + value + indices + ")";
    }
}
