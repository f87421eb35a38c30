/**
 * The structured SSA IR.
 * <p>
 * A {@link io.github.shadeir.core.ssa.Function} is a tree of
 * {@link io.github.shadeir.core.ssa.CfList control flow lists}, whose leaves are
 * {@link io.github.shadeir.core.ssa.BasicBlock basic blocks}. Edges between blocks are
 * not stored; they follow from where each block sits, and from its
 * {@link io.github.shadeir.core.ssa.Jump jump} if it has one.
 * See {@link io.github.shadeir.core.util.ControlFlow} for how they are derived.
 */
package io.github.shadeir.core.ssa;
