package org.pragmatica.algebra.ast;

/**
 * Fully parenthesized infix text of an expression, e.g. {@code (x+1)^4} or {@code sin(x*y)}.
 * The outermost operation is left unparenthesized.
 */
public final class InfixFormatter {
    private InfixFormatter() {}

    public static String format(Expr expr) {
        return format(expr, false);
    }

    /**
     * Same as {@link #format(Expr)} but parenthesizes a top-level operation, so the result can be embedded
     * as a factor of a larger product.
     */
    public static String formatNested(Expr expr) {
        return format(expr, true);
    }

    private static String format(Expr expr, boolean nested) {
        if (expr instanceof Expr.Number number) {
            return number.value().toString();
        }
        if (expr instanceof Expr.Variable variable) {
            return variable.name();
        }
        if (expr instanceof Expr.FunctionCall call) {
            return call.function().keyword() + "(" + format(call.argument(), false) + ")";
        }
        String text;
        if (expr instanceof Expr.BinaryOp binary) {
            text = format(binary.left(), true) + binary.operator().symbol() + format(binary.right(), true);
        }else {
            text = "-" + format(((Expr.UnaryOp) expr).operand(), true);
        }
        return nested
               ? "(" + text + ")"
               : text;
    }
}
