package org.pragmatica.algebra.polynomial;

import org.junit.jupiter.api.Test;
import org.pragmatica.algebra.parser.ExpressionParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AtomRegistryTest {

    @Test
    void register_commutativeVariant_returnsExistingAtom() {
        var registry = new AtomRegistry();
        var first = registry.register(ExpressionParser.parse("sin(x+y)"));
        var second = registry.register(ExpressionParser.parse("sin(y+x)"));

        assertSame(first, second);
        assertEquals(1, registry.size());
    }

    @Test
    void register_distinctExpressions_assignsSequentialIds() {
        var registry = new AtomRegistry();
        var sine = registry.register(ExpressionParser.parse("sin(x)"));
        var cosine = registry.register(ExpressionParser.parse("cos(x)"));

        assertEquals(0, sine.id());
        assertEquals(1, cosine.id());
        assertThat(registry.atoms()).containsExactly(sine, cosine);
    }

    @Test
    void register_labelsOperationsWithParentheses() {
        var registry = new AtomRegistry();

        assertEquals("((x+1)^4)", registry.register(ExpressionParser.parse("(x+1)^4")).label());
        assertEquals("tan(x)", registry.register(ExpressionParser.parse("tan(x)")).label());
    }

    @Test
    void newRegistry_isEmpty() {
        var registry = new AtomRegistry();

        assertTrue(registry.isEmpty());
        assertThat(registry.atoms()).isEmpty();
    }
}
