package io.github.eutro.procnet.core.types;

/**
 * The type of a value in the IR.
 * <p>
 * Types are immutable, and compared structurally.
 */
public abstract class Type {
    Type() {
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
