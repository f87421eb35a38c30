package io.github.shadeir.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Function;

/**
 * A key for operations with exactly one immediate of type {@code T}.
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
     * An operation of this key.
     */
    public class UnaryOp extends Op {
        /**
         * The immediate.
         */
        public T arg;

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
     * Get {@code op} as an operation of this key, or null if it is of a different key.
     *
     * @param op The operation.
     * @return The operation, or null.
     */
    @SuppressWarnings("unchecked")
    public @Nullable UnaryOp checkNullable(Op op) {
        return op.key == this ? (UnaryOp) op : null;
    }

    /**
     * Get {@code op} as an operation of this key.
     *
     * @param op The operation.
     * @return The operation.
     * @throws ClassCastException If it is of a different key.
     */
    public UnaryOp cast(Op op) {
        UnaryOp cast = checkNullable(op);
        if (cast == null) {
            throw new ClassCastException(op + " is not " + mnemonic);
        }
        return cast;
    }

    /**
     * Create an operation of this key.
     *
     * @param arg The immediate.
     * @return The operation.
     */
    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Immediate of " + mnemonic + " is null");
        }
        return new UnaryOp(arg);
    }
}
