package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.diag.Diagnostic;
import io.github.eutro.procnet.core.diag.Diagnostics;
import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ext.Ext;
import io.github.eutro.procnet.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A named top-level definition in a {@link Module}.
 */
public abstract class ModuleSymbol extends ExtHolder {
    private final String name;

    protected ModuleSymbol(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Report an error about this symbol to the diagnostics of its module.
     *
     * @param message The message.
     */
    public void emitError(String message) {
        Diagnostics.of(getOwningModule()).emit(Diagnostic.Severity.ERROR, this, message);
    }

    /**
     * Report a warning about this symbol to the diagnostics of its module.
     *
     * @param message The message.
     */
    public void emitWarning(String message) {
        Diagnostics.of(getOwningModule()).emit(Diagnostic.Severity.WARNING, this, message);
    }

    private Module getOwningModule() {
        if (owner == null) {
            throw new IllegalStateException("@" + name + " is not in a module");
        }
        return owner;
    }

    // exts
    private Module owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_MODULE) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_MODULE) {
            owner = (Module) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_MODULE) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
