package io.github.eutro.procnet.core.ext;

import io.github.eutro.procnet.core.passes.IRPass;
import org.jetbrains.annotations.Nullable;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Something that can hold {@link Ext} values.
 */
public interface ExtContainer {
    /**
     * Set the value of {@code ext} in this container, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The type of the ext.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext} in this container, if there is one.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, or null if there is none.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value, if any.
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value of {@code ext} in this container.
     *
     * @param ext The ext.
     * @param <T> The type of the ext.
     * @return The value.
     * @throws NoSuchElementException If there is no value.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T value = getNullable(ext);
        if (value != null) return value;
        throw new NoSuchElementException("ext " + ext + " not present on " + this);
    }

    /**
     * Get the value of {@code ext} in this container, running {@code pass} on {@code o}
     * to compute it if it is absent.
     *
     * @param ext  The ext.
     * @param o    The IR to run the pass on.
     * @param pass The pass which computes the ext.
     * @param <T>  The type of the ext.
     * @param <O>  The type the pass runs on.
     * @return The value.
     */
    default <T, O> T getExtOrRun(Ext<T> ext, O o, IRPass<O, ?> pass) {
        T value = getNullable(ext);
        if (value != null) return value;
        pass.run(o);
        return getExtOrThrow(ext);
    }
}
