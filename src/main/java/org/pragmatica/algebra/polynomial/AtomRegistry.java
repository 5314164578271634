package org.pragmatica.algebra.polynomial;

import org.pragmatica.algebra.ast.CommutativeKey;
import org.pragmatica.algebra.ast.Expr;
import org.pragmatica.algebra.ast.InfixFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, append-only registry of atoms for a single normalization or equivalence check.
 *
 * <p>Subexpressions equal up to commutative reordering of {@code +} and {@code *} operands share one atom,
 * which is what lets {@code sin(x+y)} on one side of a check match {@code sin(y+x)} on the other.
 * Not thread-safe; create one per call.
 */
public final class AtomRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(AtomRegistry.class);

    private final List<Factor.Atom> atoms = new ArrayList<>();
    private final Map<String, Factor.Atom> byKey = new HashMap<>();

    /**
     * Return the atom registered for an equivalent expression, or append a new one.
     */
    public Factor.Atom register(Expr expression) {
        var key = CommutativeKey.of(expression);
        var existing = byKey.get(key);
        if (existing != null) {
            return existing;
        }
        var atom = new Factor.Atom(atoms.size(), key, InfixFormatter.formatNested(expression), expression);
        atoms.add(atom);
        byKey.put(key, atom);
        LOG.debug("Registered atom #{} for {}", atom.id(), atom.label());
        return atom;
    }

    public List<Factor.Atom> atoms() {
        return List.copyOf(atoms);
    }

    public int size() {
        return atoms.size();
    }

    public boolean isEmpty() {
        return atoms.isEmpty();
    }
}
