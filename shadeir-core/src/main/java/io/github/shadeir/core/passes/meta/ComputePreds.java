package io.github.shadeir.core.passes.meta;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.MetadataState;
import io.github.shadeir.core.passes.InPlaceIRPass;
import io.github.shadeir.core.ssa.BasicBlock;
import io.github.shadeir.core.ssa.Function;
import io.github.shadeir.core.util.ControlFlow;

import java.util.ArrayList;
import java.util.Set;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 * <p>
 * Only edges out of blocks reachable from the entry count, so unreachable
 * blocks never appear as predecessors.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        Set<BasicBlock> reachable = ControlFlow.reachable(func);
        for (BasicBlock block : func.blocks) {
            if (!reachable.contains(block)) continue;
            for (BasicBlock target : ControlFlow.successors(block)) {
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
