package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.ssa.ProcTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Identifies one instance of a template within the spawn tree of an elaboration root,
 * by the path of spawns that leads to it.
 *
 * @see ProcIdFactory
 */
public final class ProcId {
    /**
     * The identity of the (empty) path to a root, from which root identities are created.
     */
    public static final ProcId EMPTY = new ProcId(Collections.emptyList());

    /**
     * One step of the path: a template, and which instance of it this is among
     * those spawned from the same parent.
     */
    public static final class Entry {
        public final ProcTemplate template;
        public final int instance;

        Entry(ProcTemplate template, int instance) {
            this.template = template;
            this.instance = instance;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry entry = (Entry) o;
            return instance == entry.instance && template == entry.template;
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(template), instance);
        }

        @Override
        public String toString() {
            return template.getName() + ":" + instance;
        }
    }

    private final List<Entry> instanceStack;

    private ProcId(List<Entry> instanceStack) {
        this.instanceStack = instanceStack;
    }

    ProcId child(ProcTemplate template, int instance) {
        List<Entry> stack = new ArrayList<>(instanceStack.size() + 1);
        stack.addAll(instanceStack);
        stack.add(new Entry(template, instance));
        return new ProcId(Collections.unmodifiableList(stack));
    }

    public List<Entry> getInstanceStack() {
        return instanceStack;
    }

    public int depth() {
        return instanceStack.size();
    }

    /**
     * Whether any step of this path is an instance of {@code template}.
     *
     * @param template The template.
     * @return Whether it occurs in this path.
     */
    public boolean contains(ProcTemplate template) {
        for (Entry entry : instanceStack) {
            if (entry.template == template) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof ProcId && instanceStack.equals(((ProcId) o).instanceStack);
    }

    @Override
    public int hashCode() {
        return instanceStack.hashCode();
    }

    @Override
    public String toString() {
        return instanceStack.stream().map(Entry::toString).collect(Collectors.joining("->"));
    }
}
