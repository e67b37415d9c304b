package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.ssa.ProcTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hands out {@link ProcId identities} to spawned instances, numbering the instances of each
 * template spawned from the same parent so that no two of them get the same identity.
 */
public final class ProcIdFactory {
    private final Map<CallSite, Integer> instanceCounts = new HashMap<>();

    private static final class CallSite {
        final ProcId parent;
        final String callee;

        CallSite(ProcId parent, String callee) {
            this.parent = parent;
            this.callee = callee;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CallSite)) return false;
            CallSite that = (CallSite) o;
            return parent.equals(that.parent) && callee.equals(that.callee);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parent, callee);
        }
    }

    /**
     * Create the identity of an instance of {@code callee} spawned from {@code parent}.
     *
     * @param parent             The identity of the spawning instance.
     * @param callee             The spawned template.
     * @param countAsNewInstance Whether this is a new instance, in which case the next
     *                           call for the same parent and callee gets the next index.
     *                           Otherwise, it gets the same identity as this one.
     * @return The identity.
     */
    public ProcId createProcId(ProcId parent, ProcTemplate callee, boolean countAsNewInstance) {
        CallSite site = new CallSite(parent, callee.getName());
        int instance = instanceCounts.getOrDefault(site, 0);
        if (countAsNewInstance) {
            instanceCounts.put(site, instance + 1);
        }
        return parent.child(callee, instance);
    }
}
