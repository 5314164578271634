package org.pragmatica.algebra.lexer;

import org.pragmatica.algebra.ast.Function;

import java.math.BigInteger;

/**
 * Token types produced by {@link Lexer}.
 */
public sealed interface Token {
    /**
     * Zero-based offset of the token in the input.
     */
    int position();

    /**
     * Source text of the token. Synthesized tokens report the text they stand for.
     */
    String text();

    // Operands
    /**
     * Integer literal; {@code text} keeps the digits as written, leading zeros included.
     */
    record Number(int position, BigInteger value, String text) implements Token {}

    record Identifier(int position, String name) implements Token {
        @Override
        public String text() {
            return name;
        }
    }

    record FunctionName(int position, Function function) implements Token {
        @Override
        public String text() {
            return function.keyword();
        }
    }

    // Operators
    record Plus(int position) implements Token {
        @Override
        public String text() {
            return "+";
        }
    }

    record Minus(int position) implements Token {
        @Override
        public String text() {
            return "-";
        }
    }

    record Star(int position) implements Token {
        @Override
        public String text() {
            return "*";
        }
    }

    // inserted between juxtaposed operands, e.g. 2x
    record ImplicitStar(int position) implements Token {
        @Override
        public String text() {
            return "*";
        }
    }

    record Slash(int position) implements Token {
        @Override
        public String text() {
            return "/";
        }
    }

    record Caret(int position) implements Token {
        @Override
        public String text() {
            return "^";
        }
    }

    // Delimiters
    record LParen(int position) implements Token {
        @Override
        public String text() {
            return "(";
        }
    }

    record RParen(int position) implements Token {
        @Override
        public String text() {
            return ")";
        }
    }

    // reserved for multi-argument functions, never accepted by the parser
    record Comma(int position) implements Token {
        @Override
        public String text() {
            return ",";
        }
    }

    // Special
    record Eof(int position) implements Token {
        @Override
        public String text() {
            return "";
        }
    }

    record Error(int position, char found) implements Token {
        @Override
        public String text() {
            return String.valueOf(found);
        }
    }
}
