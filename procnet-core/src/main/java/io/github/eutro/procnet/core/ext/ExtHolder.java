package io.github.eutro.procnet.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.TreeMap;

/**
 * An {@link ExtContainer} backed by a lazily allocated map.
 */
public class ExtHolder implements ExtContainer {
    @Nullable
    private Map<Ext<?>, Object> map = null; // most IR objects never get a slow-path ext

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (map == null) {
            map = new TreeMap<>();
        }
        map.put(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (map == null) return;
        map.remove(ext);
        if (map.isEmpty()) {
            map = null;
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (map == null) return null;
        return (T) map.get(ext);
    }
}
