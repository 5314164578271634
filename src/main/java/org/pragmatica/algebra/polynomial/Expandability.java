package org.pragmatica.algebra.polynomial;

import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.ast.Operator;

/**
 * Whether an expression is a plain polynomial: numbers, variables, unary minus, {@code +}, {@code -} and
 * {@code *} only. Such expressions normalize without creating any atom.
 */
public final class Expandability {
    private Expandability() {}

    public static boolean isExpandable(Expr expr) {
        if (expr instanceof Expr.Number || expr instanceof Expr.Variable) {
            return true;
        }
        if (expr instanceof Expr.UnaryOp unary) {
            return isExpandable(unary.operand());
        }
        if (expr instanceof Expr.BinaryOp binary) {
            return (binary.operator() == Operator.ADD
                    || binary.operator() == Operator.SUBTRACT
                    || binary.operator() == Operator.MULTIPLY)
                   && isExpandable(binary.left())
                   && isExpandable(binary.right());
        }
        return false;
    }
}
