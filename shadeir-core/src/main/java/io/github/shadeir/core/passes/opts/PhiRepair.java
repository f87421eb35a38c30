package io.github.shadeir.core.passes.opts;

import io.github.shadeir.core.ops.CommonOps;
import io.github.shadeir.core.ops.UnaryOpKey;
import io.github.shadeir.core.ssa.BasicBlock;
import io.github.shadeir.core.ssa.Effect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps phis in step with edges that were moved from one block to another.
 */
public class PhiRepair {
    /**
     * Replace the predecessor keys of the phis in {@code blocks} according to {@code relabel}.
     * <p>
     * All keys of a phi are mapped at once, so a relabeling can swap two blocks.
     * Values are never changed, dropped or reordered.
     *
     * @param relabel The old predecessor of each moved edge, mapped to its new predecessor.
     * @param blocks  The blocks whose phis may refer to the old predecessors.
     * @return Whether any key was replaced.
     */
    public static boolean rekey(Map<BasicBlock, BasicBlock> relabel, Iterable<BasicBlock> blocks) {
        boolean changed = false;
        for (BasicBlock block : blocks) {
            for (Effect effect : block.getEffects()) {
                if (!CommonOps.isPhi(effect)) break;
                UnaryOpKey<List<BasicBlock>>.UnaryOp phi = CommonOps.PHI.cast(effect.insn().op);
                List<BasicBlock> keys = new ArrayList<>(phi.arg.size());
                for (BasicBlock key : phi.arg) {
                    BasicBlock newKey = relabel.getOrDefault(key, key);
                    changed |= newKey != key;
                    keys.add(newKey);
                }
                phi.arg = keys;
            }
        }
        return changed;
    }
}
