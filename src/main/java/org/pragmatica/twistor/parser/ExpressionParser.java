package org.pragmatica.twistor.parser;

import org.pragmatica.twistor.error.ParseException;
import org.pragmatica.twistor.lexer.Token;
import org.pragmatica.twistor.tree.ExpressionNode;
import org.pragmatica.twistor.tree.ExpressionNode.BracketNode;
import org.pragmatica.twistor.tree.ExpressionNode.DualTwistorNode;
import org.pragmatica.twistor.tree.ExpressionNode.InfinityTwistorNode;
import org.pragmatica.twistor.tree.ExpressionNode.NumberNode;
import org.pragmatica.twistor.tree.ExpressionNode.OperatorNode;
import org.pragmatica.twistor.tree.ExpressionNode.TwistorNode;
import org.pragmatica.twistor.tree.Operator;
import org.pragmatica.twistor.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser building an expression tree from tokens.
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := factor (('*' | '/') factor)*
 * factor  := unary ('^' unary)*        right-associative
 * unary   := primary
 * primary := Number | Twistor | DualTwistor | InfinityTwistor | Bracket | '(' expr ')'
 * </pre>
 *
 * <p>Operator chains fold into nested two-operand nodes: {@code a + b + c} becomes {@code add(add(a, b), c)} and
 * {@code a ^ b ^ c} becomes {@code pow(a, pow(b, c))}. Parentheses produce no node of their own.
 */
public final class ExpressionParser {

    private final List<Token> tokens;
    private final int maxDepth;
    private int pos;
    private int nesting;

    private ExpressionParser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
        this.pos = 0;
        this.nesting = 0;
    }

    public static ExpressionNode parse(List<Token> tokens) throws ParseException {
        return parse(tokens, ParserConfig.DEFAULT);
    }

    public static ExpressionNode parse(List<Token> tokens, ParserConfig config) throws ParseException {
        if (tokens.isEmpty()) {
            throw ParseException.emptyInput();
        }
        return new ExpressionParser(tokens, config.maxDepth()).parseAll();
    }

    private ExpressionNode parseAll() throws ParseException {
        var root = parseExpression();
        if (!isAtEnd()) {
            var token = peek();
            if (token.isCloseParen()) {
                throw new ParseException(pos, token.span(), "Unbalanced ')' without matching '('");
            }
            throw unexpected(token, "operator or end of input");
        }
        return root.node();
    }

    /**
     * Node with the height of the subtree it roots.
     */
    private record Parsed(ExpressionNode node, int height) {
        static Parsed leaf(ExpressionNode node) {
            return new Parsed(node, 1);
        }
    }

    private Parsed parseExpression() throws ParseException {
        var left = parseTerm();
        while (peekOperator(Operator.ADD) || peekOperator(Operator.SUB)) {
            var operatorToken = advance();
            var right = parseTerm();
            left = combine(operatorToken, left, right);
        }
        return left;
    }

    private Parsed parseTerm() throws ParseException {
        var left = parseFactor();
        while (peekOperator(Operator.MUL) || peekOperator(Operator.DIV)) {
            var operatorToken = advance();
            var right = parseFactor();
            left = combine(operatorToken, left, right);
        }
        return left;
    }

    private Parsed parseFactor() throws ParseException {
        var operands = new ArrayList<Parsed>();
        var carets = new ArrayList<Token>();
        operands.add(parseUnary());
        while (peekOperator(Operator.POW)) {
            carets.add(advance());
            operands.add(parseUnary());
        }
        // fold from the right: a ^ b ^ c == a ^ (b ^ c)
        var result = operands.get(operands.size() - 1);
        for (int i = carets.size() - 1; i >= 0; i--) {
            result = combine(carets.get(i), operands.get(i), result);
        }
        return result;
    }

    private Parsed parseUnary() throws ParseException {
        return parsePrimary();
    }

    private Parsed parsePrimary() throws ParseException {
        if (isAtEnd()) {
            throw ParseException.unexpectedEnd(pos, endOfInput(), "operand");
        }
        var token = peek();
        return switch (token.type()) {
            case NUMBER -> {
                var value = parseNumber(token);
                advance();
                yield Parsed.leaf(new NumberNode(value));
            }
            case TWISTOR -> {
                advance();
                yield Parsed.leaf(new TwistorNode(token.index()));
            }
            case DUAL_TWISTOR -> {
                advance();
                yield Parsed.leaf(new DualTwistorNode(token.index()));
            }
            case INFINITY_TWISTOR -> {
                advance();
                yield Parsed.leaf(InfinityTwistorNode.INSTANCE);
            }
            case BRACKET_OPEN -> {
                var kind = token.bracketKind();
                if (kind.isPresent()) {
                    advance();
                    yield Parsed.leaf(new BracketNode(kind.get(), token.indices()));
                }
                yield parseGroup();
            }
            default -> throw unexpected(token, "operand");
        };
    }

    private Parsed parseGroup() throws ParseException {
        var open = advance();
        if (++nesting > maxDepth) {
            throw new ParseException(pos - 1, open.span(), "Parentheses nested deeper than " + maxDepth + " levels");
        }
        var inner = parseExpression();
        if (isAtEnd()) {
            throw new ParseException(pos, open.span(), "Unbalanced '(' without matching ')'");
        }
        if (!peek().isCloseParen()) {
            throw unexpected(peek(), "')'");
        }
        advance();
        nesting-- ;
        return inner;
    }

    private Parsed combine(Token operatorToken, Parsed left, Parsed right) throws ParseException {
        var operator = Operator.fromSymbol(operatorToken.value())
                               .orElseThrow(() -> new IllegalStateException("Not an operator: " + operatorToken));
        int height = 1 + Math.max(left.height(), right.height());
        if (height > maxDepth) {
            throw new ParseException(tokens.indexOf(operatorToken),
                                     operatorToken.span(),
                                     "Expression deeper than " + maxDepth + " levels");
        }
        return new Parsed(OperatorNode.binary(operator, left.node(), right.node()), height);
    }

    private double parseNumber(Token token) throws ParseException {
        double value;
        try {
            value = Double.parseDouble(token.value());
        } catch (NumberFormatException e) {
            throw new ParseException(pos, token.span(), "Malformed number '" + token.value() + "'", e);
        }
        if (!Double.isFinite(value)) {
            throw new ParseException(pos, token.span(), "Number '" + token.value() + "' is out of range");
        }
        return value;
    }

    private boolean peekOperator(Operator operator) {
        return !isAtEnd() && peek().isOperator(operator.symbol());
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        return tokens.get(pos++ );
    }

    private SourceSpan endOfInput() {
        return SourceSpan.at(tokens.get(tokens.size() - 1)
                                   .span()
                                   .end());
    }

    private ParseException unexpected(Token token, String expected) {
        return ParseException.unexpected(pos, token.span(), token.value(), expected);
    }
}
