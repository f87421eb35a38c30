package io.github.shadeir.core.ops;

import io.github.shadeir.core.ext.ExtHolder;

/**
 * The kind of an operation, without any immediates.
 * <p>
 * Instructions are told apart by comparing keys by identity,
 * so every key is a singleton, usually in {@link CommonOps}.
 */
public abstract class OpKey extends ExtHolder {
    /**
     * The name of the operation, as displayed.
     */
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
