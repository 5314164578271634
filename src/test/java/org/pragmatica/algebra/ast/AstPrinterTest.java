package org.pragmatica.algebra.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.algebra.parser.ExpressionParser;

import static org.junit.jupiter.api.Assertions.*;

class AstPrinterTest {

    @Test
    void print_leaf_singleLine() {
        assertEquals("Variable: x\n", AstPrinter.print(Expr.variable("x")));
        assertEquals("Number: 7\n", AstPrinter.print(Expr.number(7)));
    }

    @Test
    void print_binaryTree_indentsChildrenUnderLabels() {
        var expected = """
            BinaryOp: +
              Left:
                BinaryOp: *
                  Left:
                    Number: 2
                  Right:
                    Variable: x
              Right:
                Number: 1
            """;

        assertEquals(expected, AstPrinter.print(ExpressionParser.parse("2x+1")));
    }

    @Test
    void print_unaryAndFunction_labelOperandAndArgument() {
        var expected = """
            UnaryOp: -
              Operand:
                FunctionCall: sqrt
                  Argument:
                    Variable: y
            """;

        assertEquals(expected, AstPrinter.print(ExpressionParser.parse("-sqrt(y)")));
    }

    @Test
    void print_isDeterministic() {
        var expr = ExpressionParser.parse("(x+1)^3 - ln(x)/y");

        assertEquals(AstPrinter.print(expr), AstPrinter.print(ExpressionParser.parse("(x+1)^3 - ln(x)/y")));
    }
}
