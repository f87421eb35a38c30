package io.github.shadeir.core.util;

/**
 * A unary function, named so as not to clash with {@link io.github.shadeir.core.ssa.Function}.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    /**
     * Apply the function.
     *
     * @param a The argument.
     * @return The result.
     */
    B apply(A a);
}
