package io.github.eutro.procnet.core.passes;

import io.github.eutro.procnet.core.passes.misc.ChainedPass;
import io.github.eutro.procnet.core.ssa.Module;
import io.github.eutro.procnet.core.ssa.Region;

/**
 * A pass over some part of the IR (a {@link Module}, a {@link Region}),
 * which may modify it, analyse it, or convert it into something else.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Get whether this pass modifies its input and returns it, rather than producing something new.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run on the result of this one.
     * @param <C>  The result type of {@code next}.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
