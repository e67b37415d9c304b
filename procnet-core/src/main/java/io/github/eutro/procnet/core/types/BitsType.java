package io.github.eutro.procnet.core.types;

/**
 * A bit vector of a fixed width.
 */
public final class BitsType extends Type {
    /**
     * A single bit, the type of predicates and valid flags.
     */
    public static final BitsType BIT = new BitsType(1);

    /**
     * The width, in bits.
     */
    public final int width;

    private BitsType(int width) {
        this.width = width;
    }

    /**
     * Get the bits type of a given width.
     *
     * @param width The width.
     * @return The type.
     */
    public static BitsType of(int width) {
        if (width < 0) throw new IllegalArgumentException("negative width: " + width);
        return width == 1 ? BIT : new BitsType(width);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof BitsType && ((BitsType) o).width == width;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(width);
    }

    @Override
    public String toString() {
        return "bits[" + width + "]";
    }
}
