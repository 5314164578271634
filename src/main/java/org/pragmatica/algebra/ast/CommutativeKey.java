package org.pragmatica.algebra.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical prefix key of an expression in which chains of {@code +} and of {@code *} are flattened and their
 * operands sorted. Two expressions are equal up to commutative reordering iff their keys are equal.
 */
public final class CommutativeKey {
    private CommutativeKey() {}

    public static String of(Expr expr) {
        if (expr instanceof Expr.Number number) {
            return number.value().toString();
        }
        if (expr instanceof Expr.Variable variable) {
            return variable.name();
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return "neg(" + of(unary.operand()) + ")";
        }
        if (expr instanceof Expr.FunctionCall call) {
            return call.function().keyword() + "(" + of(call.argument()) + ")";
        }
        var binary = (Expr.BinaryOp) expr;
        if (!binary.operator().isCommutative()) {
            return binary.operator().symbol() + "(" + of(binary.left()) + "," + of(binary.right()) + ")";
        }
        var operands = new ArrayList<String>();
        collectOperands(binary, binary.operator(), operands);
        operands.sort(null);
        return binary.operator().symbol() + "(" + String.join(",", operands) + ")";
    }

    public static boolean equivalent(Expr left, Expr right) {
        return of(left).equals(of(right));
    }

    private static void collectOperands(Expr expr, Operator operator, List<String> operands) {
        if (expr instanceof Expr.BinaryOp binary && binary.operator() == operator) {
            collectOperands(binary.left(), operator, operands);
            collectOperands(binary.right(), operator, operands);
        }else {
            operands.add(of(expr));
        }
    }
}
