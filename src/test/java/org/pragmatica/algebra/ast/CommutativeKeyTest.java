package org.pragmatica.algebra.ast;

import org.junit.jupiter.api.Test;
import org.pragmatica.algebra.parser.ExpressionParser;

import static org.junit.jupiter.api.Assertions.*;

class CommutativeKeyTest {

    private static boolean equivalent(String left, String right) {
        return CommutativeKey.equivalent(ExpressionParser.parse(left), ExpressionParser.parse(right));
    }

    @Test
    void equivalent_reorderedSum_matches() {
        assertTrue(equivalent("x+y", "y+x"));
        assertTrue(equivalent("x+y+z", "z+(y+x)"));
    }

    @Test
    void equivalent_reorderedProductInsideFunction_matches() {
        assertTrue(equivalent("sin(x*(y+z))", "sin((z+y)*x)"));
    }

    @Test
    void equivalent_nonCommutativeOperators_keepOrder() {
        assertFalse(equivalent("x-y", "y-x"));
        assertFalse(equivalent("x/y", "y/x"));
        assertFalse(equivalent("x^2", "2^x"));
    }

    @Test
    void equivalent_differentOperatorsOrFunctions_differ() {
        assertFalse(equivalent("x+y", "x*y"));
        assertFalse(equivalent("sin(x)", "cos(x)"));
        assertFalse(equivalent("-x", "x"));
    }

    @Test
    void of_mixedChain_flattensOnlySameOperator() {
        assertEquals("+(*(x,y),z)", CommutativeKey.of(ExpressionParser.parse("z + y*x")));
    }
}
