package io.github.eutro.procnet.core.types;

import java.util.Objects;

/**
 * The type of a structured channel endpoint: the payload it carries, and whether
 * it is an input or an output of the process holding it.
 */
public final class ChannelType extends Type {
    /**
     * The type of the values carried over the channel.
     */
    public final Type elementType;
    /**
     * True if values are received from this endpoint, false if they are sent to it.
     */
    public final boolean isInput;

    private ChannelType(Type elementType, boolean isInput) {
        this.elementType = Objects.requireNonNull(elementType);
        this.isInput = isInput;
    }

    /**
     * The type of a receiving endpoint.
     *
     * @param elementType The payload type.
     * @return The channel type.
     */
    public static ChannelType input(Type elementType) {
        return new ChannelType(elementType, true);
    }

    /**
     * The type of a sending endpoint.
     *
     * @param elementType The payload type.
     * @return The channel type.
     */
    public static ChannelType output(Type elementType) {
        return new ChannelType(elementType, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelType)) return false;
        ChannelType that = (ChannelType) o;
        return isInput == that.isInput && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elementType, isInput);
    }

    @Override
    public String toString() {
        return "schan<" + elementType + (isInput ? ", in>" : ", out>");
    }
}
