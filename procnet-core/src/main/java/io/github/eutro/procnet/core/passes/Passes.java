package io.github.eutro.procnet.core.passes;

import io.github.eutro.procnet.core.passes.elab.ProcElaboration;
import io.github.eutro.procnet.core.passes.meta.VerifyElaborated;
import io.github.eutro.procnet.core.ssa.Module;

/**
 * Common pipelines of passes.
 */
public class Passes {
    /**
     * {@link ProcElaboration Elaborate} a module with the default options, then
     * {@link VerifyElaborated verify} the result.
     * <p>
     * The output of roots that failed to elaborate is still verified, since it must
     * be well-formed too.
     */
    public static final IRPass<Module, Module> ELABORATE_AND_VERIFY =
            ProcElaboration.INSTANCE.then(VerifyElaborated.INSTANCE);
}
