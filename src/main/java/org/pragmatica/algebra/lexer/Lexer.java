package org.pragmatica.algebra.lexer;

import org.pragmatica.algebra.ast.Function;
import org.pragmatica.algebra.config.AnalyzerConfig;
import org.pragmatica.algebra.error.LexError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for algebraic expressions.
 *
 * <p>After scanning, an {@link Token.ImplicitStar} is inserted between juxtaposed operands
 * ({@code 2x}, {@code x(y+1)}, {@code (a)(b)}), so the parser needs no special case for implicit products.
 */
public final class Lexer {
    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private int pos;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
    }

    public static List<Token> tokenize(String input) {
        return tokenize(input, AnalyzerConfig.DEFAULT.maxInputLength());
    }

    /**
     * Tokenize {@code input}. The returned list always ends with {@link Token.Eof}.
     *
     * @throws LexError on an unrecognized character or input longer than {@code maxInputLength}
     */
    public static List<Token> tokenize(String input, int maxInputLength) {
        if (input.length() > maxInputLength) {
            throw LexError.inputTooLong(input.length(), maxInputLength);
        }
        var raw = new Lexer(input).scanAll();

        for (var token : raw) {
            if (token instanceof Token.Error error) {
                throw LexError.unexpectedCharacter(error.found(), error.position());
            }
        }

        var tokens = insertImplicitMultiplication(raw);
        LOG.trace("Tokenized '{}' into {}", input, tokens);
        return tokens;
    }

    private List<Token> scanAll() {
        var tokens = new ArrayList<Token>(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd()) {
            skipWhitespace();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(new Token.Eof(pos));
        return tokens;
    }

    private Token nextToken() {
        int start = pos;
        char c = peek();
        if (isDigit(c)) {
            return scanNumber(start);
        }
        if (isLetter(c)) {
            return scanLetters(start);
        }
        return scanOperator(start);
    }

    private Token scanNumber(int start) {
        while (!isAtEnd() && isDigit(peek())) {
            pos++;
        }
        var digits = input.substring(start, pos);
        return new Token.Number(start, new BigInteger(digits), digits);
    }

    /**
     * A function keyword is taken only when an opening parenthesis follows it; any other run of
     * letters is a sequence of single-letter identifiers.
     */
    private Token scanLetters(int start) {
        var function = Function.matchAt(input, start);
        if (function.isPresent() && isFollowedByParen(start + function.get().keyword().length())) {
            pos += function.get().keyword().length();
            return new Token.FunctionName(start, function.get());
        }
        pos++;
        return new Token.Identifier(start, String.valueOf(input.charAt(start)));
    }

    private boolean isFollowedByParen(int offset) {
        int lookahead = offset;
        while (lookahead < input.length() && Character.isWhitespace(input.charAt(lookahead))) {
            lookahead++;
        }
        return lookahead < input.length() && input.charAt(lookahead) == '(';
    }

    private Token scanOperator(int start) {
        char c = input.charAt(pos++);
        return switch (c) {
            case '+' -> new Token.Plus(start);
            case '-' -> new Token.Minus(start);
            case '*' -> new Token.Star(start);
            case '/' -> new Token.Slash(start);
            case '^' -> new Token.Caret(start);
            case '(' -> new Token.LParen(start);
            case ')' -> new Token.RParen(start);
            case ',' -> new Token.Comma(start);
            default -> new Token.Error(start, c);
        };
    }

    private static List<Token> insertImplicitMultiplication(List<Token> raw) {
        var result = new ArrayList<Token>(raw.size() * 2);
        for (int i = 0; i < raw.size(); i++) {
            var token = raw.get(i);
            result.add(token);

            if (i + 1 < raw.size() && isJuxtaposition(token, raw.get(i + 1))) {
                result.add(new Token.ImplicitStar(token.position() + token.text().length()));
            }
        }
        return List.copyOf(result);
    }

    // "2 3" gets no operator and is rejected by the parser
    private static boolean isJuxtaposition(Token left, Token right) {
        if (left instanceof Token.Number && right instanceof Token.Number) {
            return false;
        }
        return endsOperand(left) && startsOperand(right);
    }

    private static boolean endsOperand(Token token) {
        return token instanceof Token.Number
            || token instanceof Token.Identifier
            || token instanceof Token.RParen;
    }

    private static boolean startsOperand(Token token) {
        return token instanceof Token.Identifier
            || token instanceof Token.FunctionName
            || token instanceof Token.LParen
            || token instanceof Token.Number;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
