package org.pragmatica.twistor.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Momentum-twistor expression tree.
 *
 * <p>Every node renders itself in two forms: prefix (Polish) notation, a flat token list with the operator tag ahead
 * of its operands, and canonical infix text, also returned by {@link Object#toString()}. Nodes are immutable and own
 * their operands exclusively.
 */
public sealed interface ExpressionNode {

    /**
     * Prefix rendering: one token per leaf, one tag per operator node.
     */
    List<String> toPrefixNotation();

    /**
     * Canonical infix rendering.
     */
    String toInfixString();

    /**
     * Child nodes in order; empty for leaves.
     */
    default List<ExpressionNode> operands() {
        return List.of();
    }

    default boolean isLeaf() {
        return operands().isEmpty();
    }

    // === Interior ===

    /**
     * Operator application. Known tags ({@link Operator}) are checked for arity; any other tag is a function-call node.
     */
    record OperatorNode(String tag, List<ExpressionNode> operands) implements ExpressionNode {
        public OperatorNode {
            checkNotNull(tag, "tag");
            checkArgument(!tag.isBlank(), "Operator tag must not be blank");
            operands = ImmutableList.copyOf(operands);
            var count = operands.size();
            Operator.fromTag(tag)
                    .ifPresent(operator -> checkArgument(operator.acceptsOperandCount(count),
                                                         "Operator '%s' takes %s operands, got %s",
                                                         tag,
                                                         operator.arityDescription(),
                                                         count));
        }

        public static OperatorNode of(Operator operator, ExpressionNode... operands) {
            return new OperatorNode(operator.tag(), List.of(operands));
        }

        public static OperatorNode binary(Operator operator, ExpressionNode left, ExpressionNode right) {
            return new OperatorNode(operator.tag(), List.of(left, right));
        }

        public static OperatorNode call(String tag, List<ExpressionNode> arguments) {
            return new OperatorNode(tag, arguments);
        }

        public boolean is(Operator operator) {
            return operator.tag().equals(tag);
        }

        @Override
        public List<String> toPrefixNotation() {
            var result = ImmutableList.<String>builder().add(tag);
            for (var operand : operands) {
                result.addAll(operand.toPrefixNotation());
            }
            return result.build();
        }

        @Override
        public String toInfixString() {
            var operator = Operator.fromTag(tag);
            if (operator.isEmpty()) {
                return operands.stream()
                               .map(ExpressionNode::toInfixString)
                               .collect(Collectors.joining(", ", tag + "(", ")"));
            }
            return switch (operator.get()) {
                case ADD -> "(" + joined(Operator.ADD, " + ") + ")";
                case SUB -> "(" + operandText(Operator.SUB, 0) + " - " + operandText(Operator.SUB, 1) + ")";
                case MUL -> joined(Operator.MUL, " * ");
                case DIV -> "(" + operandText(Operator.DIV, 0) + " / " + operandText(Operator.DIV, 1) + ")";
                case POW -> "(" + operandText(Operator.POW, 0) + "^" + operandText(Operator.POW, 1) + ")";
            };
        }

        private String joined(Operator operator, String separator) {
            var parts = new String[operands.size()];
            for (int i = 0; i < parts.length; i++) {
                parts[i] = operandText(operator, i);
            }
            return String.join(separator, parts);
        }

        private String operandText(Operator parent, int position) {
            var operand = operands.get(position);
            var text = operand.toInfixString();
            return needsGrouping(parent, position, operand)
                   ? "(" + text + ")"
                   : text;
        }

        // mul renders without its own parentheses; these positions would re-associate without them
        private static boolean needsGrouping(Operator parent, int position, ExpressionNode operand) {
            if (!(operand instanceof OperatorNode node) || !node.is(Operator.MUL)) {
                return false;
            }
            return switch (parent) {
                case MUL, DIV -> position > 0;
                case POW -> true;
                case ADD, SUB -> false;
            };
        }

        @Override
        public String toString() {
            return toInfixString();
        }
    }

    // === Leaves ===

    /**
     * Twistor {@code Z_i}.
     */
    record TwistorNode(int index) implements ExpressionNode {
        public TwistorNode {
            checkArgument(index >= 0, "Twistor index must be non-negative, got %s", index);
        }

        @Override
        public List<String> toPrefixNotation() {
            return List.of("Z" + index);
        }

        @Override
        public String toInfixString() {
            return "Z_{" + index + "}";
        }

        @Override
        public String toString() {
            return toInfixString();
        }
    }

    /**
     * Dual twistor {@code W_i}.
     */
    record DualTwistorNode(int index) implements ExpressionNode {
        public DualTwistorNode {
            checkArgument(index >= 0, "Dual twistor index must be non-negative, got %s", index);
        }

        @Override
        public List<String> toPrefixNotation() {
            return List.of("W" + index);
        }

        @Override
        public String toInfixString() {
            return "W_{" + index + "}";
        }

        @Override
        public String toString() {
            return toInfixString();
        }
    }

    /**
     * Real constant.
     */
    record NumberNode(double value) implements ExpressionNode {
        public NumberNode {
            checkArgument(Double.isFinite(value), "Numeric constant must be finite, got %s", value);
        }

        @Override
        public List<String> toPrefixNotation() {
            return List.of(Double.toString(value));
        }

        @Override
        public String toInfixString() {
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return toInfixString();
        }
    }

    /**
     * Four-index invariant: {@code <i, j, k, l>} or {@code [i, j, k, l]}.
     */
    record BracketNode(BracketKind kind, List<Integer> indices) implements ExpressionNode {
        public static final int INDEX_COUNT = 4;

        public BracketNode {
            checkNotNull(kind, "kind");
            indices = ImmutableList.copyOf(indices);
            checkArgument(indices.size() == INDEX_COUNT,
                          "Bracket requires exactly %s indices, got %s",
                          INDEX_COUNT,
                          indices.size());
            checkArgument(indices.stream().allMatch(index -> index >= 0),
                          "Bracket indices must be non-negative: %s",
                          indices);
        }

        public static BracketNode angle(int i, int j, int k, int l) {
            return new BracketNode(BracketKind.ANGLE, List.of(i, j, k, l));
        }

        public static BracketNode square(int i, int j, int k, int l) {
            return new BracketNode(BracketKind.SQUARE, List.of(i, j, k, l));
        }

        @Override
        public List<String> toPrefixNotation() {
            var sb = new StringBuilder(kind.tag());
            indices.forEach(sb::append);
            return List.of(sb.toString());
        }

        @Override
        public String toInfixString() {
            return indices.stream()
                          .map(String::valueOf)
                          .collect(Collectors.joining(", ",
                                                      String.valueOf(kind.open()),
                                                      String.valueOf(kind.close())));
        }

        @Override
        public String toString() {
            return toInfixString();
        }
    }

    /**
     * The infinity twistor {@code I}.
     */
    enum InfinityTwistorNode implements ExpressionNode {
        INSTANCE;

        public static final String SYMBOL = "I";

        @Override
        public List<String> toPrefixNotation() {
            return List.of(SYMBOL);
        }

        @Override
        public String toInfixString() {
            return SYMBOL;
        }

        @Override
        public String toString() {
            return SYMBOL;
        }
    }
}
