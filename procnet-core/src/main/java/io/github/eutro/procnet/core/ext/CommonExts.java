package io.github.eutro.procnet.core.ext;

import io.github.eutro.procnet.core.diag.Diagnostics;
import io.github.eutro.procnet.core.interp.Liveness;
import io.github.eutro.procnet.core.ops.Op;
import io.github.eutro.procnet.core.ops.OpKey;
import io.github.eutro.procnet.core.passes.meta.ComputeLiveness;
import io.github.eutro.procnet.core.ssa.Insn;
import io.github.eutro.procnet.core.ssa.Module;
import io.github.eutro.procnet.core.ssa.ModuleSymbol;
import io.github.eutro.procnet.core.ssa.Region;
import io.github.eutro.procnet.core.ssa.Var;
import io.github.eutro.procnet.core.types.Type;

/**
 * The {@link Ext}s used throughout the IR.
 */
public class CommonExts {
    /**
     * Attached to a {@link Var}. The type of the var, if it is known.
     */
    public static final Ext<Type> TYPE = Ext.create(Type.class, "TYPE");

    /**
     * Attached to a {@link ModuleSymbol}. The module it is in.
     */
    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");

    /**
     * Attached to a {@link Module}. The diagnostics reported while processing it.
     *
     * @see Diagnostics#of(Module)
     */
    public static final Ext<Diagnostics> DIAGNOSTICS = Ext.create(Diagnostics.class, "DIAGNOSTICS");

    /**
     * Attached to a {@link Region}, computed by {@link ComputeLiveness}.
     * Where each var of the region is last used.
     */
    public static final Ext<Liveness> LIVENESS = Ext.create(Liveness.class, "LIVENESS");

    /**
     * Attached to an {@link Insn}, {@link Op} or {@link OpKey}.
     * Whether the instruction operates on structured channels, and so
     * can only appear before elaboration.
     */
    public static final Ext<Boolean> IS_STRUCTURED = Ext.create(Boolean.class, "IS_STRUCTURED");
}
