package io.github.shadeir.core.passes.meta;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.MetadataState;
import io.github.shadeir.core.passes.InPlaceIRPass;
import io.github.shadeir.core.ssa.BasicBlock;
import io.github.shadeir.core.ssa.Function;
import io.github.shadeir.core.util.ControlFlow;

import java.util.List;

/**
 * Computes {@link CommonExts#BLOCK_INDEX} for each block placed in the function body,
 * numbering them in program order from zero. The entry block is always 0.
 */
public class ComputeBlockIndices implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeBlockIndices INSTANCE = new ComputeBlockIndices();

    @Override
    public void runInPlace(Function func) {
        for (BasicBlock block : func.blocks) {
            block.removeExt(CommonExts.BLOCK_INDEX);
        }
        List<BasicBlock> order = ControlFlow.blocksInOrder(func.body);
        for (int i = 0; i < order.size(); i++) {
            order.get(i).attachExt(CommonExts.BLOCK_INDEX, i);
        }
        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.BLOCK_INDEX);
    }
}
