package org.pragmatica.algebra.ast;

/**
 * Indented tree rendering of an expression, one node per line. Debugging aid only.
 *
 * <p>Example output for {@code 2x+1}:
 * <pre>
 * BinaryOp: +
 *   Left:
 *     BinaryOp: *
 *       Left:
 *         Number: 2
 *       Right:
 *         Variable: x
 *   Right:
 *     Number: 1
 * </pre>
 */
public final class AstPrinter {
    private static final String INDENT = "  ";

    private AstPrinter() {}

    public static String print(Expr expr) {
        var sb = new StringBuilder();
        print(expr, 0, sb);
        return sb.toString();
    }

    private static void print(Expr expr, int depth, StringBuilder sb) {
        var prefix = INDENT.repeat(depth);

        if (expr instanceof Expr.Number number) {
            line(sb, prefix, "Number: " + number.value());
        }else if (expr instanceof Expr.Variable variable) {
            line(sb, prefix, "Variable: " + variable.name());
        }else if (expr instanceof Expr.BinaryOp binary) {
            line(sb, prefix, "BinaryOp: " + binary.operator());
            child(sb, prefix, "Left:", binary.left(), depth);
            child(sb, prefix, "Right:", binary.right(), depth);
        }else if (expr instanceof Expr.UnaryOp unary) {
            line(sb, prefix, "UnaryOp: " + unary.operator());
            child(sb, prefix, "Operand:", unary.operand(), depth);
        }else if (expr instanceof Expr.FunctionCall call) {
            line(sb, prefix, "FunctionCall: " + call.function().keyword());
            child(sb, prefix, "Argument:", call.argument(), depth);
        }
    }

    private static void child(StringBuilder sb, String prefix, String label, Expr child, int depth) {
        line(sb, prefix + INDENT, label);
        print(child, depth + 2, sb);
    }

    private static void line(StringBuilder sb, String prefix, String text) {
        sb.append(prefix).append(text).append('\n');
    }
}
