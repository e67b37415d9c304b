package io.github.eutro.procnet.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A key for operations with exactly one immediate, of type {@code T}.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    /**
     * An operation of this key, holding its immediate.
     */
    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    /**
     * Create an operation with the given immediate.
     *
     * @param arg The immediate, not null.
     * @return The operation.
     */
    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("immediate of " + mnemonic + " is null");
        }
        return new UnaryOp(arg);
    }

    /**
     * Get {@code op} as an operation of this key.
     *
     * @param op The operation.
     * @return The operation, or null if it has a different key.
     */
    @SuppressWarnings("unchecked")
    public @Nullable UnaryOp checkNullable(Op op) {
        return op.key == this ? (UnaryOp) op : null;
    }

    /**
     * Get {@code op} as an operation of this key.
     *
     * @param op The operation.
     * @return The operation, if it has this key.
     */
    public Optional<UnaryOp> check(Op op) {
        return Optional.ofNullable(checkNullable(op));
    }

    /**
     * Get {@code op} as an operation of this key.
     *
     * @param op The operation.
     * @return The operation.
     * @throws ClassCastException If it has a different key.
     */
    public UnaryOp cast(Op op) {
        UnaryOp unary = checkNullable(op);
        if (unary == null) throw new ClassCastException(op + " is not " + mnemonic);
        return unary;
    }
}
