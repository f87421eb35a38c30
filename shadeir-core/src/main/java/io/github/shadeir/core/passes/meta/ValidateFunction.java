package io.github.shadeir.core.passes.meta;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ops.CommonOps;
import io.github.shadeir.core.passes.InPlaceIRPass;
import io.github.shadeir.core.ssa.*;
import io.github.shadeir.core.util.ControlFlow;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Checks that a function is well-formed, throwing {@link IllegalStateException} if it is not.
 * <p>
 * This recomputes {@link CommonExts#PREDS}, {@link CommonExts#BLOCK_INDEX} and {@link CommonExts#IDOM}
 * from scratch, rather than trusting whatever is cached.
 */
public class ValidateFunction implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ValidateFunction INSTANCE = new ValidateFunction();

    @Override
    public void runInPlace(Function func) {
        Set<BasicBlock> placed = new HashSet<>();
        checkList(func, func.body, null, false, placed);
        for (BasicBlock block : func.blocks) {
            if (!placed.contains(block)) {
                throw new IllegalStateException(String.format(
                        "block not placed in function body\n  block: %s",
                        block.toTargetString()));
            }
        }

        Set<Var> assigned = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            checkEffects(block, assigned);
        }

        ComputePreds.INSTANCE.runInPlace(func);
        ComputeBlockIndices.INSTANCE.runInPlace(func);
        ComputeDoms.INSTANCE.runInPlace(func);

        Set<BasicBlock> reachable = ControlFlow.reachable(func);
        for (BasicBlock block : func.blocks) {
            if (!reachable.contains(block)) continue;
            checkPhis(block);
            checkUses(func, block);
        }
    }

    private static void checkList(
            Function func,
            CfList list,
            @Nullable CfNode owner,
            boolean inLoop,
            Set<BasicBlock> placed
    ) {
        if (list.getFunction() != func || list.getOwner() != owner) {
            throw new IllegalStateException(String.format(
                    "control flow list has the wrong owner\n  expected: %s\n  found: %s",
                    owner,
                    list.getOwner()));
        }
        List<CfNode> nodes = list.getNodes();
        if (nodes.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "empty control flow list\n  in: %s",
                    owner == null ? "function body" : owner));
        }
        for (int i = 0; i < nodes.size(); i++) {
            CfNode node = nodes.get(i);
            boolean shouldBeBlock = i % 2 == 0;
            if ((node instanceof BasicBlock) != shouldBeBlock) {
                throw new IllegalStateException(String.format(
                        "control flow list does not alternate between blocks and other nodes\n  at: %d\n  found: %s",
                        i,
                        node));
            }
            if (node.getParentList() != list) {
                throw new IllegalStateException(String.format(
                        "node not owned by its list\n  node: %s",
                        node));
            }
            if (node instanceof BasicBlock) {
                checkBlock(func, (BasicBlock) node, inLoop, placed);
            } else if (node instanceof IfNode) {
                IfNode nif = (IfNode) node;
                if (nif.getCondition().bitSize != 1) {
                    throw new IllegalStateException(String.format(
                            "if condition is not a boolean\n  condition: %s\n  bit size: %d",
                            nif.getCondition(),
                            nif.getCondition().bitSize));
                }
                checkList(func, nif.thenList, nif, inLoop, placed);
                checkList(func, nif.elseList, nif, inLoop, placed);
            } else if (node instanceof LoopNode) {
                checkList(func, ((LoopNode) node).body, node, true, placed);
            } else {
                throw new IllegalStateException("unknown node: " + node);
            }
        }
        if (!(nodes.get(nodes.size() - 1) instanceof BasicBlock)) {
            throw new IllegalStateException(String.format(
                    "control flow list does not end with a block\n  found: %s",
                    nodes.get(nodes.size() - 1)));
        }
    }

    private static void checkBlock(Function func, BasicBlock block, boolean inLoop, Set<BasicBlock> placed) {
        if (block.getNullable(CommonExts.OWNING_FUNCTION) != func
                || block.id >= func.blocks.size()
                || func.blocks.get(block.id) != block) {
            throw new IllegalStateException(String.format(
                    "block not allocated in function\n  block: %s",
                    block.toTargetString()));
        }
        if (!placed.add(block)) {
            throw new IllegalStateException(String.format(
                    "block placed more than once\n  block: %s",
                    block.toTargetString()));
        }
        for (Effect effect : block.getEffects()) {
            if (effect.getNullable(CommonExts.OWNING_BLOCK) != block) {
                throw new IllegalStateException(String.format(
                        "effect not owned by block\n  effect: %s\n  block: %s",
                        effect,
                        block));
            }
        }
        Jump jump = block.getJump();
        if (jump != null) {
            if (jump.getNullable(CommonExts.OWNING_BLOCK) != block) {
                throw new IllegalStateException(String.format(
                        "jump not owned by block\n  jump: %s\n  block: %s",
                        jump,
                        block));
            }
            if (!inLoop && jump.getKind() != JumpKind.RETURN) {
                throw new IllegalStateException(String.format(
                        "%s outside of a loop\n  in block: %s",
                        jump,
                        block));
            }
        }
    }

    private static void checkEffects(BasicBlock block, Set<Var> assigned) {
        boolean pastPhis = false;
        for (Effect effect : block.getEffects()) {
            if (CommonOps.isPhi(effect)) {
                if (pastPhis) {
                    throw new IllegalStateException(String.format(
                            "phi not at block start\n  in block: %s",
                            block));
                }
            } else {
                pastPhis = true;
            }

            Var dest = effect.getDest();
            if (dest == null) continue;
            if (!assigned.add(dest) || dest.getNullable(CommonExts.ASSIGNED_AT) != effect) {
                throw new IllegalStateException(String.format(
                        "variable assigned more than once\n  variable: %s\n  in block: %s",
                        dest,
                        block));
            }
        }
    }

    private static void checkPhis(BasicBlock block) {
        List<BasicBlock> preds = block.getExtOrThrow(CommonExts.PREDS);
        for (Effect effect : block.getEffects()) {
            if (!CommonOps.isPhi(effect)) break;
            List<BasicBlock> keys = CommonOps.PHI.cast(effect.insn().op).arg;
            if (keys.size() != effect.insn().args().size()) {
                throw new IllegalStateException(String.format(
                        "phi has %d predecessors but %d values\n  phi: %s\n  in block: %s",
                        keys.size(),
                        effect.insn().args().size(),
                        effect,
                        block));
            }
            Set<BasicBlock> keySet = new HashSet<>(keys);
            if (keySet.size() != keys.size()) {
                throw new IllegalStateException(String.format(
                        "phi has duplicate predecessors\n  phi: %s\n  in block: %s",
                        effect,
                        block));
            }
            if (!keySet.equals(new HashSet<>(preds))) {
                throw new IllegalStateException(String.format(
                        "phi predecessors do not match block predecessors\n  phi: %s\n  expected: %s\n  in block: %s",
                        effect,
                        targets(preds),
                        block));
            }
        }
    }

    private static void checkUses(Function func, BasicBlock block) {
        List<Effect> effects = block.getEffects();
        for (int i = 0; i < effects.size(); i++) {
            Effect effect = effects.get(i);
            List<Var> args = effect.insn().args();
            if (CommonOps.isPhi(effect)) {
                List<BasicBlock> keys = CommonOps.PHI.cast(effect.insn().op).arg;
                for (int j = 0; j < args.size(); j++) {
                    // the value must be available at the end of the predecessor
                    checkAvailable(func, args.get(j), keys.get(j), Integer.MAX_VALUE, effect);
                }
            } else {
                for (Var arg : args) {
                    checkAvailable(func, arg, block, i, effect);
                }
            }
        }
        Jump jump = block.getJump();
        if (jump != null) {
            for (Var arg : jump.insn().args()) {
                checkAvailable(func, arg, block, Integer.MAX_VALUE, jump);
            }
        }
        CfNode next = block.next();
        if (next instanceof IfNode) {
            checkAvailable(func, ((IfNode) next).getCondition(), block, Integer.MAX_VALUE, next);
        }
    }

    /**
     * Check that {@code v} is defined before position {@code pos} of {@code block}.
     */
    private static void checkAvailable(Function func, Var v, BasicBlock block, int pos, Object user) {
        Effect def = v.getNullable(CommonExts.ASSIGNED_AT);
        BasicBlock defBlock = def == null ? null : def.getNullable(CommonExts.OWNING_BLOCK);
        if (defBlock == null || defBlock.getNullable(CommonExts.OWNING_FUNCTION) != func) {
            throw new IllegalStateException(String.format(
                    "use of undefined variable\n  variable: %s\n  used by: %s\n  in block: %s",
                    v,
                    user,
                    block.toTargetString()));
        }
        boolean available = defBlock == block
                ? defBlock.getEffects().indexOf(def) < pos
                : ControlFlow.dominates(defBlock, block);
        if (!available) {
            throw new IllegalStateException(String.format(
                    "definition does not dominate use\n  variable: %s\n  defined in: %s\n  used by: %s\n  in block: %s",
                    v,
                    defBlock.toTargetString(),
                    user,
                    block.toTargetString()));
        }
    }

    private static List<String> targets(List<BasicBlock> blocks) {
        List<String> ret = new ArrayList<>();
        for (BasicBlock block : blocks) {
            ret.add(block.toTargetString());
        }
        return ret;
    }
}
