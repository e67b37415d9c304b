package io.github.eutro.procnet.core.ext;

import org.jetbrains.annotations.Nullable;

/**
 * An {@link ExtHolder} which falls back to another container for exts it doesn't hold itself.
 * <p>
 * Instructions use this to inherit exts from their operation, and operations from their key.
 */
public abstract class DelegatingExtHolder extends ExtHolder {
    /**
     * Get the container to fall back to.
     *
     * @return The delegate, or null.
     */
    protected abstract @Nullable ExtContainer getDelegate();

    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        T local = super.getNullable(ext);
        if (local != null) return local;
        ExtContainer delegate = getDelegate();
        return delegate == null ? null : delegate.getNullable(ext);
    }
}
