package org.pragmatica.algebra.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Expression tree produced by the parser. The variant set is closed; record equality is structural equality.
 */
public sealed interface Expr {

    /**
     * Integer literal.
     */
    record Number(BigInteger value) implements Expr {
        public Number {
            Objects.requireNonNull(value, "value");
        }

        public static Number of(long value) {
            return new Number(BigInteger.valueOf(value));
        }
    }

    /**
     * Single-letter, case-sensitive variable.
     */
    record Variable(String name) implements Expr {
        public Variable {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Binary operation: left op right
     */
    record BinaryOp(Operator operator, Expr left, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /**
     * Unary minus: -operand
     */
    record UnaryOp(Expr operand) implements Expr {
        public UnaryOp {
            Objects.requireNonNull(operand, "operand");
        }

        public char operator() {
            return '-';
        }
    }

    /**
     * Function call with exactly one argument: name(argument)
     */
    record FunctionCall(Function function, Expr argument) implements Expr {
        public FunctionCall {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(argument, "argument");
        }
    }

    static Expr number(long value) {
        return Number.of(value);
    }

    static Expr variable(String name) {
        return new Variable(name);
    }

    static Expr binary(Operator operator, Expr left, Expr right) {
        return new BinaryOp(operator, left, right);
    }

    static Expr negate(Expr operand) {
        return new UnaryOp(operand);
    }

    static Expr call(Function function, Expr argument) {
        return new FunctionCall(function, argument);
    }
}
