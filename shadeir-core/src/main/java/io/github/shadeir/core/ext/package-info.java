/**
 * The ext API associates arbitrary typed data with IR objects,
 * instances of {@link io.github.shadeir.core.ext.ExtContainer}.
 *
 * <pre>{@code
 * Ext<Integer> DEPTH = Ext.create(Integer.class, "DEPTH");
 *
 * block.attachExt(DEPTH, 2);
 * block.getExtOrThrow(DEPTH); // => 2
 * block.removeExt(DEPTH);
 * block.getExt(DEPTH);        // => Optional.empty()
 * }</pre>
 * <p>
 * Analyses use this to attach their results (predecessors, dominators,
 * block indices) to the blocks they describe, without the IR classes
 * having to know about every analysis. Whether such results are still
 * up to date is tracked separately, by {@link io.github.shadeir.core.ext.MetadataState}.
 * <p>
 * IR classes may store some exts directly in fields, for speed.
 */
package io.github.shadeir.core.ext;
