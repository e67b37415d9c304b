package io.github.eutro.procnet.core.passes;

/**
 * An {@link IRPass} which modifies its input, and returns it.
 *
 * @param <T> The type of IR this pass runs on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass.
     *
     * @param t The IR to modify.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
