package io.github.shadeir.core.passes;

import io.github.shadeir.core.passes.misc.ChainedPass;

/**
 * A pass over some IR, turning an {@code A} into a {@code B}.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The input.
     * @return The output.
     */
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it.
     *
     * @return Whether the pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another, which will be given the output of this one.
     *
     * @param next The next pass.
     * @param <C>  The output type of the next pass.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
