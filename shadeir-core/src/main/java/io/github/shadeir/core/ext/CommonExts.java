package io.github.shadeir.core.ext;

import io.github.shadeir.core.passes.meta.ComputeBlockIndices;
import io.github.shadeir.core.passes.meta.ComputeDoms;
import io.github.shadeir.core.passes.meta.ComputePreds;
import io.github.shadeir.core.ssa.*;

import java.util.List;

/**
 * The {@link Ext}s used throughout the IR.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Which derived metadata is valid.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The live predecessors of the block,
     * that is, the reachable blocks that have an edge to it.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");
    /**
     * Attached to a {@link BasicBlock}. The position of the block in program order.
     * <p>
     * Computed by {@link ComputeBlockIndices}.
     */
    public static final Ext<Integer> BLOCK_INDEX = Ext.create(Integer.class, "BLOCK_INDEX");
    /**
     * Attached to a reachable {@link BasicBlock} other than the entry.
     * The <a href="https://en.wikipedia.org/wiki/Dominator_(graph_theory)">immediate dominator</a> of the block.
     * <p>
     * Computed by {@link ComputeDoms}.
     */
    public static final Ext<BasicBlock> IDOM = Ext.create(BasicBlock.class, "IDOM");

    /**
     * Attached to a {@link Var}. The {@link Effect} that assigns it.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");

    /**
     * Attached to an {@link io.github.shadeir.core.ops.OpKey}. The kind of jump the op performs, if it is a jump.
     */
    public static final Ext<JumpKind> JUMP_KIND = Ext.create(JumpKind.class, "JUMP_KIND");

    /**
     * Attached to a {@link BasicBlock}. The function it was allocated in.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    /**
     * Attached to an {@link Effect} or {@link Jump}. The block it is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    /**
     * Attached to a {@link CfNode}. The control flow list it is in.
     */
    public static final Ext<CfList> OWNING_LIST = Ext.create(CfList.class, "OWNING_LIST");
}
