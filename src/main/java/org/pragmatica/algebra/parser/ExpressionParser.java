package org.pragmatica.algebra.parser;

import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.ast.Operator;
import org.pragmatica.algebra.error.ParseError;
import org.pragmatica.algebra.lexer.Lexer;
import org.pragmatica.algebra.lexer.Token;

import java.util.List;

/**
 * Recursive descent parser for algebraic expressions.
 *
 * <p>Precedence, lowest to highest:
 * <ol>
 *   <li>{@code +}, {@code -} (left associative); a unary minus may open each operand</li>
 *   <li>{@code *}, implicit {@code *}, {@code /} (left associative)</li>
 *   <li>{@code ^} (right associative)</li>
 *   <li>function call</li>
 *   <li>number, variable, parenthesized expression</li>
 * </ol>
 *
 * <p>Unary minus takes a whole multiplicative term as its operand, so {@code -x*y} is {@code -(x*y)}
 * and {@code -x^2} is {@code -(x^2)}. A minus where a primary is required ({@code --x}, {@code x^-2},
 * {@code x*-y}) is rejected.
 */
public final class ExpressionParser {
    private final List<Token> tokens;
    private int pos;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Tokenize and parse expression text.
     */
    public static Expr parse(String text) {
        return parse(Lexer.tokenize(text));
    }

    /**
     * Parse a token stream ending with {@link Token.Eof}.
     *
     * @throws ParseError if the tokens do not form exactly one well-formed expression
     */
    public static Expr parse(List<Token> tokens) {
        if (tokens.isEmpty() || !(tokens.get(tokens.size() - 1) instanceof Token.Eof)) {
            throw new IllegalArgumentException("Token stream must end with Eof");
        }
        return new ExpressionParser(tokens).parseAll();
    }

    private Expr parseAll() {
        var expr = parseExpression();

        if (!isAtEnd()) {
            if (peek() instanceof Token.RParen) {
                throw ParseError.unsupported("Unmatched ')'", peek().position());
            }
            throw ParseError.unexpectedToken(tokenDescription(peek()), "operator or end of input", peek().position());
        }
        return expr;
    }

    private Expr parseExpression() {
        var left = parseUnary();

        while (peek() instanceof Token.Plus || peek() instanceof Token.Minus) {
            var operator = peek() instanceof Token.Plus
                           ? Operator.ADD
                           : Operator.SUBTRACT;
            advance();
            left = new Expr.BinaryOp(operator, left, parseUnary());
        }
        return left;
    }

    private Expr parseUnary() {
        if (peek() instanceof Token.Minus) {
            advance();
            return new Expr.UnaryOp(parseTerm());
        }
        return parseTerm();
    }

    private Expr parseTerm() {
        var left = parsePower();

        while (true) {
            var token = peek();
            if (token instanceof Token.Star || token instanceof Token.ImplicitStar) {
                advance();
                left = new Expr.BinaryOp(Operator.MULTIPLY, left, parsePower());
            }else if (token instanceof Token.Slash) {
                advance();
                left = new Expr.BinaryOp(Operator.DIVIDE, left, parsePower());
            }else {
                break;
            }
        }
        return left;
    }

    private Expr parsePower() {
        var base = parseFunction();

        if (peek() instanceof Token.Caret) {
            advance();
            // a^b^c = a^(b^c)
            return new Expr.BinaryOp(Operator.POWER, base, parsePower());
        }
        return base;
    }

    private Expr parseFunction() {
        if (peek() instanceof Token.FunctionName name) {
            advance();
            if (!(peek() instanceof Token.LParen)) {
                throw ParseError.unexpectedToken(tokenDescription(peek()),
                                                 "'(' after " + name.text(),
                                                 peek().position());
            }
            return new Expr.FunctionCall(name.function(), parseParenthesized());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        var token = peek();

        if (token instanceof Token.Number number) {
            advance();
            return new Expr.Number(number.value());
        }

        if (token instanceof Token.Identifier identifier) {
            advance();
            return new Expr.Variable(identifier.name());
        }

        if (token instanceof Token.LParen) {
            return parseParenthesized();
        }

        if (token instanceof Token.Minus) {
            throw misplacedMinus(token);
        }

        if (token instanceof Token.Eof) {
            throw ParseError.unexpectedEnd("operand", token.position());
        }

        if (token instanceof Token.RParen && previous() instanceof Token.LParen) {
            throw ParseError.unsupported("Empty parentheses", token.position());
        }

        throw ParseError.unexpectedToken(tokenDescription(token),
                                         "number, variable, function or '('",
                                         token.position());
    }

    private Expr parseParenthesized() {
        var open = peek();
        advance();
        var inner = parseExpression();

        if (peek() instanceof Token.Eof) {
            throw ParseError.unexpectedEnd("')' to close '(' at position " + open.position(), peek().position());
        }
        if (!(peek() instanceof Token.RParen)) {
            throw ParseError.unexpectedToken(tokenDescription(peek()), "')'", peek().position());
        }
        advance();
        return inner;
    }

    private ParseError misplacedMinus(Token minus) {
        var before = previous();
        if (before instanceof Token.Caret) {
            return ParseError.unsupported("Negative exponents are not supported", minus.position());
        }
        if (before instanceof Token.Minus) {
            return ParseError.unsupported("Consecutive unary minus is not supported", minus.position());
        }
        return ParseError.unsupported("Unary minus must start an operand of '+' or '-'", minus.position());
    }

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token previous() {
        return pos == 0
               ? null
               : tokens.get(pos - 1);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private static String tokenDescription(Token token) {
        if (token instanceof Token.Number number) {
            return "number " + number.value();
        }
        if (token instanceof Token.Identifier identifier) {
            return "variable '" + identifier.name() + "'";
        }
        if (token instanceof Token.FunctionName name) {
            return "function '" + name.text() + "'";
        }
        if (token instanceof Token.ImplicitStar) {
            return "implicit '*'";
        }
        if (token instanceof Token.Eof) {
            return "end of input";
        }
        return "'" + token.text() + "'";
    }
}
