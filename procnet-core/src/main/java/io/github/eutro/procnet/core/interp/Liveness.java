package io.github.eutro.procnet.core.interp;

import io.github.eutro.procnet.core.ssa.Region;
import io.github.eutro.procnet.core.ssa.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Where each var of a {@link Region} is last used.
 * <p>
 * Positions are effect indices, with the terminator at {@code effects.size()}.
 */
public final class Liveness {
    private final Map<Var, Integer> lastUse = new HashMap<>();
    private final List<List<Var>> deadAfter;

    public Liveness(int positions) {
        deadAfter = new ArrayList<>(positions);
        for (int i = 0; i < positions; i++) {
            deadAfter.add(new ArrayList<>());
        }
    }

    /**
     * Record a use of a var. Uses must be recorded in order.
     *
     * @param var      The var.
     * @param position The position of the use.
     */
    public void use(Var var, int position) {
        Integer previous = lastUse.put(var, position);
        if (previous != null) {
            deadAfter.get(previous).remove(var);
        }
        List<Var> dead = deadAfter.get(position);
        if (!dead.contains(var)) {
            dead.add(var);
        }
    }

    /**
     * Get the position of the last use of a var.
     *
     * @param var The var.
     * @return The position, or -1 if it is never used.
     */
    public int lastUseOf(Var var) {
        return lastUse.getOrDefault(var, -1);
    }

    /**
     * Get the vars which are not used after a position.
     *
     * @param position The position.
     * @return The vars last used there.
     */
    public List<Var> deadAfter(int position) {
        return Collections.unmodifiableList(deadAfter.get(position));
    }
}
