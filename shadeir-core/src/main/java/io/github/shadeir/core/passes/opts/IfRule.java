package io.github.shadeir.core.passes.opts;

import io.github.shadeir.core.ssa.Function;
import io.github.shadeir.core.ssa.IfNode;

/**
 * A rewrite of a single if, tried by {@link SimplifyIfs}.
 * <p>
 * A rule must leave a valid function valid, and must not touch the function at all if it does not fire.
 * It need not invalidate metadata; {@link SimplifyIfs} does that once any rule fires.
 */
@FunctionalInterface
public interface IfRule {
    /**
     * Try to rewrite an if.
     *
     * @param func The function the if is in.
     * @param nif  The if.
     * @return Whether anything was rewritten.
     */
    boolean apply(Function func, IfNode nif);
}
