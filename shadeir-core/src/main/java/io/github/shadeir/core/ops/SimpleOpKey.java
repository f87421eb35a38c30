package io.github.shadeir.core.ops;

/**
 * A key for an operation with no immediates, which therefore only needs one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    /**
     * Get the single operation of this key.
     *
     * @return The operation.
     */
    public Op create() {
        return op;
    }
}
