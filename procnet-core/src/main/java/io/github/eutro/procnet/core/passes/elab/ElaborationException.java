package io.github.eutro.procnet.core.passes.elab;

import io.github.eutro.procnet.core.interp.InterpretationException;

/**
 * Thrown when a root cannot be elaborated. Aborts the elaboration of that root only.
 */
public class ElaborationException extends InterpretationException {
    public enum Kind {
        /**
         * A spawn names a template that doesn't exist.
         */
        INVALID_REFERENCE,
        /**
         * The IR is inconsistent in a way earlier stages should have ruled out,
         * such as a spawn with the wrong number of channels.
         */
        INTERNAL,
        /**
         * A template spawns itself, directly or through others, so the spawn tree is infinite.
         */
        RECURSIVE_INSTANTIATION,
        /**
         * The spawn tree is deeper than {@link ElaborationOptions#getMaxSpawnDepth()}.
         */
        DEPTH_EXCEEDED,
    }

    public final Kind kind;

    public ElaborationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
