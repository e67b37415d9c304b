package io.github.eutro.procnet.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key under which an {@link ExtContainer} can hold a value of type {@code T}.
 * <p>
 * Exts are compared by identity, and ordered by creation, which is only
 * stable within one run of the program.
 *
 * @param <T> The type of the value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<T> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<T> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * {@code type} may be a raw supertype of {@code R}, so that exts of generic
     * types like {@code List<Var>} can be created from {@code List.class}.
     *
     * @param type The class of values, used for debugging only.
     * @param name The name of the ext, used for debugging only.
     * @param <T>  The class type.
     * @param <R>  The type of the ext.
     * @return The new ext.
     */
    @SuppressWarnings("unchecked")
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return (Ext<R>) new Ext<>(type, name);
    }

    /**
     * Get the class this ext was created with.
     *
     * @return The class.
     */
    public Class<T> getType() {
        return type;
    }

    /**
     * Get the name this ext was created with.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Look this ext up in a container.
     *
     * @param ec The container.
     * @return The value, if any.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getSimpleName();
    }
}
