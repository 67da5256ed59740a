package org.pragmatica.twistor.parser;

import org.pragmatica.twistor.error.ParseException;
import org.pragmatica.twistor.tree.BracketKind;
import org.pragmatica.twistor.tree.ExpressionNode;
import org.pragmatica.twistor.tree.ExpressionNode.BracketNode;
import org.pragmatica.twistor.tree.ExpressionNode.DualTwistorNode;
import org.pragmatica.twistor.tree.ExpressionNode.InfinityTwistorNode;
import org.pragmatica.twistor.tree.ExpressionNode.NumberNode;
import org.pragmatica.twistor.tree.ExpressionNode.OperatorNode;
import org.pragmatica.twistor.tree.ExpressionNode.TwistorNode;
import org.pragmatica.twistor.tree.Operator;
import org.pragmatica.twistor.tree.SourceLocation;
import org.pragmatica.twistor.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Rebuilds an expression tree from its prefix notation, reading every {@link Operator} with two operands.
 *
 * <p>Locations in errors count prefix tokens: column {@code n} is the n-th token of the sequence.
 */
public final class PrefixReader {
    private static final Pattern TWISTOR = Pattern.compile("([ZW])(\\d+)");
    private static final Pattern BRACKET = Pattern.compile("(angle|square)(\\d+)");
    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d+(\\.\\d+)?([eE][-+]?\\d+)?");

    private final List<String> tokens;
    private final int maxDepth;
    private int pos;

    private PrefixReader(List<String> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
        this.pos = 0;
    }

    public static ExpressionNode read(List<String> prefix) throws ParseException {
        return read(prefix, ParserConfig.DEFAULT);
    }

    public static ExpressionNode read(List<String> prefix, ParserConfig config) throws ParseException {
        checkNotNull(prefix, "prefix");
        if (prefix.isEmpty()) {
            throw ParseException.emptyInput();
        }
        var reader = new PrefixReader(new ArrayList<>(prefix), config.maxDepth());
        var root = reader.readNode(1);
        if (reader.pos < reader.tokens.size()) {
            throw ParseException.unexpected(reader.pos,
                                            spanAt(reader.pos),
                                            reader.tokens.get(reader.pos),
                                            "end of prefix sequence");
        }
        return root;
    }

    private ExpressionNode readNode(int depth) throws ParseException {
        if (pos >= tokens.size()) {
            throw ParseException.unexpectedEnd(pos, spanAt(pos), "operand");
        }
        if (depth > maxDepth) {
            throw new ParseException(pos, spanAt(pos), "Expression deeper than " + maxDepth + " levels");
        }
        var token = tokens.get(pos);
        var operator = Operator.fromTag(token);
        if (operator.isPresent()) {
            pos++;
            var left = readNode(depth + 1);
            var right = readNode(depth + 1);
            return OperatorNode.binary(operator.get(), left, right);
        }
        var leaf = readLeaf(token);
        pos++;
        return leaf;
    }

    private ExpressionNode readLeaf(String token) throws ParseException {
        if (InfinityTwistorNode.SYMBOL.equals(token)) {
            return InfinityTwistorNode.INSTANCE;
        }
        var twistor = TWISTOR.matcher(token);
        if (twistor.matches()) {
            int index = parseIndex(twistor.group(2));
            return "Z".equals(twistor.group(1))
                   ? new TwistorNode(index)
                   : new DualTwistorNode(index);
        }
        var bracket = BRACKET.matcher(token);
        if (bracket.matches()) {
            var kind = BracketKind.valueOf(bracket.group(1)
                                                  .toUpperCase(Locale.ROOT));
            return readBracket(token, kind, bracket.group(2));
        }
        if (NUMBER.matcher(token).matches()) {
            var value = Double.parseDouble(token);
            if (!Double.isFinite(value)) {
                throw new ParseException(pos, spanAt(pos), "Number '" + token + "' is out of range");
            }
            return new NumberNode(value);
        }
        throw ParseException.unexpected(pos, spanAt(pos), token, "operator tag or leaf");
    }

    // Concatenated indices are only unambiguous when each is a single digit
    private ExpressionNode readBracket(String token, BracketKind kind, String digits) throws ParseException {
        if (digits.length() != BracketNode.INDEX_COUNT) {
            throw new ParseException(pos,
                                     spanAt(pos),
                                     "Ambiguous bracket '" + token + "': expected " + BracketNode.INDEX_COUNT
                                     + " single-digit indices");
        }
        var indices = new ArrayList<Integer>(BracketNode.INDEX_COUNT);
        for (int i = 0; i < digits.length(); i++) {
            indices.add(digits.charAt(i) - '0');
        }
        return new BracketNode(kind, indices);
    }

    private int parseIndex(String digits) throws ParseException {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ParseException(pos, spanAt(pos), "Index out of range: " + digits, e);
        }
    }

    private static SourceSpan spanAt(int index) {
        return SourceSpan.of(SourceLocation.ofIndex(index), SourceLocation.ofIndex(index + 1));
    }
}
