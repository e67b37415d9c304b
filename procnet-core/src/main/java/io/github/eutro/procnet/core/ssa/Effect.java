package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.DelegatingExtHolder;
import io.github.eutro.procnet.core.ext.ExtContainer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An {@link Insn instruction} whose results are assigned to some vars.
 */
public final class Effect extends DelegatingExtHolder {
    private final List<Var> assignsTo;
    private Insn insn;

    public Effect(List<Var> assignsTo, Insn insn) {
        this.assignsTo = new ArrayList<>(assignsTo);
        this.insn = insn;
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    public Insn insn() {
        return insn;
    }

    public void setInsn(Insn insn) {
        this.insn = insn;
    }

    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(assignsTo);
    }

    @Override
    public String toString() {
        if (assignsTo.isEmpty()) {
            return insn.toString();
        }
        return assignsTo.stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", ", "", " = ")) + insn;
    }
}
