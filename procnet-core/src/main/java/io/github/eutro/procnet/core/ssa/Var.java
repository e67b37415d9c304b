package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ext.Ext;
import io.github.eutro.procnet.core.ext.ExtHolder;
import io.github.eutro.procnet.core.types.Type;
import org.jetbrains.annotations.Nullable;

/**
 * A value in a {@link Region}: either an argument of the region, or a result of one of its effects.
 * <p>
 * Each var is assigned exactly once, and only used in the region it belongs to.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * Distinguishes vars of the same name within a region,
     * if {@link Region#UNIQUE_VAR_NAMES counting is enabled}.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return '$' + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Type type = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.TYPE) {
            return (T) type;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.TYPE) {
            type = (Type) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.TYPE) {
            type = null;
            return;
        }
        super.removeExt(ext);
    }
}
