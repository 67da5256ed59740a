package org.pragmatica.twistor.tree;

import java.util.Optional;

/**
 * Operators with a dedicated infix form. Any other {@link OperatorNode} tag is rendered in function-call notation.
 */
public enum Operator {
    ADD("add", "+", 2, Integer.MAX_VALUE),
    SUB("sub", "-", 2, 2),
    MUL("mul", "*", 2, Integer.MAX_VALUE),
    DIV("div", "/", 2, 2),
    POW("pow", "^", 2, 2);

    private final String tag;
    private final String symbol;
    private final int minOperands;
    private final int maxOperands;

    Operator(String tag, String symbol, int minOperands, int maxOperands) {
        this.tag = tag;
        this.symbol = symbol;
        this.minOperands = minOperands;
        this.maxOperands = maxOperands;
    }

    public String tag() {
        return tag;
    }

    public String symbol() {
        return symbol;
    }

    public boolean acceptsOperandCount(int count) {
        return count >= minOperands && count <= maxOperands;
    }

    public String arityDescription() {
        return maxOperands == minOperands
               ? "exactly " + minOperands
               : "at least " + minOperands;
    }

    public static Optional<Operator> fromTag(String tag) {
        for (var operator : values()) {
            if (operator.tag.equals(tag)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        for (var operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
