/**
 * Optimisation passes.
 * <p>
 * These report whether they made progress, and are meant to be run to a fixpoint with
 * {@link io.github.shadeir.core.passes.misc.FixpointPass}.
 */
package io.github.shadeir.core.passes.opts;
