package org.pragmatica.algebra.polynomial;

import org.pragmatica.algebra.ast.Expr;

import java.util.Comparator;
import java.util.Objects;

/**
 * Base of a monomial factor: a variable or an atom standing in for a subexpression that cannot be expanded.
 */
public sealed interface Factor extends Comparable<Factor> {
    Comparator<Factor> ORDER = Comparator.comparing(Factor::name)
                                         .thenComparing(factor -> factor instanceof Atom atom ? atom.key() : "");

    /**
     * Display name; factors inside a rendered term appear in lexical order of this name.
     */
    String name();

    record Variable(String name) implements Factor {
        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Opaque factor. Two atoms are equal when they have the same label and the same commutative key, whichever
     * registry created them; the id only records registration order.
     *
     * @param id         position in the owning registry
     * @param key        commutative key of the expression
     * @param label      infix rendering of the atom's expression
     * @param expression the subexpression the atom stands for
     */
    record Atom(int id, String key, String label, Expr expression) implements Factor {
        @Override
        public String name() {
            return label;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Atom atom && key.equals(atom.key) && label.equals(atom.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, label);
        }

        @Override
        public String toString() {
            return label;
        }
    }

    @Override
    default int compareTo(Factor other) {
        return ORDER.compare(this, other);
    }
}
