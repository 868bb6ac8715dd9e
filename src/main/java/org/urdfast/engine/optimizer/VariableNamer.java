package org.urdfast.engine.optimizer;

import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.urdfast.engine.expression.OperationRecord;

import java.util.Collection;

/**
 * Hands out fresh variable names for extracted subexpressions.
 *
 * Names are {@code v_} followed by a prefix derived from the operator or
 * function ({@code v_sub}, {@code v_cos}, {@code v_q}). A name that collides
 * with a reserved name or an earlier one gets the first free suffix
 * {@code _0}, {@code _1}, ...
 *
 * One namer belongs to one optimization call; it is not thread-safe.
 */
public final class VariableNamer {

    private static final ImmutableMap<String, String> OPERATOR_PREFIXES = Maps.immutable.<String, String>empty()
            .newWithKeyValue("+", "sum")
            .newWithKeyValue("-", "sub")
            .newWithKeyValue("-u", "negative")
            .newWithKeyValue("+u", "positive")
            .newWithKeyValue("*", "prod")
            .newWithKeyValue("**", "exp")
            .newWithKeyValue("@", "matmul")
            .newWithKeyValue("/", "div")
            .newWithKeyValue("[]", "vect")
            .newWithKeyValue(":", "slice");

    private final MutableSet<String> taken = Sets.mutable.empty();

    public VariableNamer(Collection<String> reserved) {
        taken.addAll(reserved);
    }

    /**
     * Reserves and returns a fresh name for the operation.
     */
    public String nameFor(OperationRecord record) {
        return fresh("v_" + prefix(record.name()));
    }

    /**
     * Reserves and returns {@code base}, or the first free suffixed variant.
     */
    public String fresh(String base) {
        String name = base;
        int suffix = 0;
        while (taken.contains(name)) {
            name = base + "_" + suffix++;
        }
        taken.add(name);
        return name;
    }

    public boolean isTaken(String name) {
        return taken.contains(name);
    }

    static String prefix(String operation) {
        String prefix = OPERATOR_PREFIXES.get(operation);
        if (prefix != null) {
            return prefix;
        }
        StringBuilder sb = new StringBuilder(operation.length());
        for (char c : operation.toCharArray()) {
            sb.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
