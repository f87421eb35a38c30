package io.github.shadeir.core.util;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ssa.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Structural queries over the IR.
 * <p>
 * Edges between blocks are never stored, so everything here is derived from where
 * blocks sit in their {@link CfList}s and from their {@link Jump}s:
 * <ul>
 *     <li>{@link JumpKind#RETURN} has no successors;</li>
 *     <li>{@link JumpKind#BREAK} goes to the block after the innermost loop;</li>
 *     <li>{@link JumpKind#CONTINUE} goes to the first block of the innermost loop's body;</li>
 *     <li>a block without a jump goes to the entry of the next node in its list, or, if it is last,
 *     to the merge block of its if, the start of its loop, or out of the function.</li>
 * </ul>
 * The results always reflect the current structure.
 */
public class ControlFlow {
    /**
     * Check whether a block has no effects and no jump.
     *
     * @param block The block.
     * @return Whether it is empty.
     */
    public static boolean isEmpty(BasicBlock block) {
        return block.getEffects().isEmpty() && block.getJump() == null;
    }

    /**
     * Check whether a block ends in a jump.
     *
     * @param block The block.
     * @return Whether it has a jump.
     */
    public static boolean endsInJump(BasicBlock block) {
        return block.getJump() != null;
    }

    /**
     * Check whether a block falls through to its structural successor.
     *
     * @param block The block.
     * @return Whether it has no jump.
     */
    public static boolean fallsThrough(BasicBlock block) {
        return block.getJump() == null;
    }

    /**
     * Check whether a branch of an if does nothing: it is a single empty block.
     *
     * @param list The branch.
     * @return Whether it is empty.
     */
    public static boolean isEmptyBranch(CfList list) {
        List<CfNode> nodes = list.getNodes();
        return nodes.size() == 1
                && nodes.get(0) instanceof BasicBlock
                && isEmpty((BasicBlock) nodes.get(0));
    }

    /**
     * Get the blocks control may go to from the end of {@code block}.
     *
     * @param block The block.
     * @return The successors, in order; the then branch comes before the else branch.
     * @throws IllegalStateException If the block is a break or continue outside a loop, or is malformed.
     */
    public static List<BasicBlock> successors(BasicBlock block) {
        Jump jump = block.getJump();
        if (jump != null) {
            switch (jump.getKind()) {
                case RETURN:
                    return Collections.emptyList();
                case BREAK:
                    return Collections.singletonList(blockAfter(loopOf(block, jump)));
                case CONTINUE:
                    return Collections.singletonList(loopOf(block, jump).body.firstBlock());
                default:
                    throw new IllegalStateException("unknown jump kind: " + jump.getKind());
            }
        }
        CfNode next = block.next();
        if (next != null) {
            return entryBlocks(next);
        }
        CfNode owner = parentOf(block).getOwner();
        if (owner == null) {
            return Collections.emptyList();
        } else if (owner instanceof IfNode) {
            return Collections.singletonList(blockAfter(owner));
        } else if (owner instanceof LoopNode) {
            return Collections.singletonList(((LoopNode) owner).body.firstBlock());
        }
        throw new IllegalStateException("list owned by unknown node: " + owner);
    }

    private static LoopNode loopOf(BasicBlock block, Jump jump) {
        LoopNode loop = enclosingLoop(block);
        if (loop == null) {
            throw new IllegalStateException(String.format(
                    "%s outside of a loop\n  in block: %s",
                    jump,
                    block.toTargetString()));
        }
        return loop;
    }

    /**
     * Get the blocks control may go to when it enters {@code node}.
     *
     * @param node The node.
     * @return The node itself if it is a block, the first block of each branch of an if,
     * or the first block of the body of a loop.
     */
    public static List<BasicBlock> entryBlocks(CfNode node) {
        if (node instanceof BasicBlock) {
            return Collections.singletonList((BasicBlock) node);
        } else if (node instanceof IfNode) {
            IfNode nif = (IfNode) node;
            return Arrays.asList(nif.thenList.firstBlock(), nif.elseList.firstBlock());
        } else if (node instanceof LoopNode) {
            return Collections.singletonList(((LoopNode) node).body.firstBlock());
        }
        throw new IllegalStateException("unknown node: " + node);
    }

    /**
     * Get the live predecessors of {@code block}: every block reachable from the entry
     * that has {@code block} as a successor.
     * <p>
     * This walks the whole function on every call. To query many blocks, run
     * {@link io.github.shadeir.core.passes.meta.ComputePreds} once, or
     * {@code ensureValid(func, MetadataState.PREDS)}, and read {@link CommonExts#PREDS}.
     *
     * @param block The block.
     * @return The predecessors, in order of block id.
     */
    public static List<BasicBlock> predecessors(BasicBlock block) {
        Function func = block.getExtOrThrow(CommonExts.OWNING_FUNCTION);
        Set<BasicBlock> reachable = reachable(func);
        List<BasicBlock> preds = new ArrayList<>();
        for (BasicBlock pred : func.blocks) {
            if (reachable.contains(pred) && successors(pred).contains(block)) {
                preds.add(pred);
            }
        }
        return preds;
    }

    /**
     * Get every block reachable from the entry of a function.
     *
     * @param func The function.
     * @return The reachable blocks.
     */
    public static Set<BasicBlock> reachable(Function func) {
        Set<BasicBlock> set = new HashSet<>();
        for (BasicBlock block : GraphWalker.blockWalker(func).preOrder()) {
            set.add(block);
        }
        return set;
    }

    /**
     * Get every block of a list in program order, descending into ifs and loops.
     *
     * @param list The list.
     * @return The blocks.
     */
    public static List<BasicBlock> blocksInOrder(CfList list) {
        List<BasicBlock> blocks = new ArrayList<>();
        collectBlocks(list, blocks);
        return blocks;
    }

    private static void collectBlocks(CfList list, List<BasicBlock> blocks) {
        for (CfNode node : list.getNodes()) {
            if (node instanceof BasicBlock) {
                blocks.add((BasicBlock) node);
            } else if (node instanceof IfNode) {
                collectBlocks(((IfNode) node).thenList, blocks);
                collectBlocks(((IfNode) node).elseList, blocks);
            } else if (node instanceof LoopNode) {
                collectBlocks(((LoopNode) node).body, blocks);
            }
        }
    }

    /**
     * Get the block right after a node in its list. For an if, this is its merge block;
     * for a loop, this is where breaks go.
     *
     * @param node The node.
     * @return The block.
     * @throws IllegalStateException If the node is last in its list or is followed by something other than a block.
     */
    public static BasicBlock blockAfter(CfNode node) {
        CfNode next = node.next();
        if (!(next instanceof BasicBlock)) {
            throw new IllegalStateException(String.format(
                    "%s is not followed by a block\n  found: %s",
                    node,
                    next));
        }
        return (BasicBlock) next;
    }

    /**
     * Get the block right before a node in its list. For an if, this is the block whose end evaluates the condition.
     *
     * @param node The node.
     * @return The block.
     * @throws IllegalStateException If the node is first in its list or is preceded by something other than a block.
     */
    public static BasicBlock blockBefore(CfNode node) {
        CfNode prev = node.prev();
        if (!(prev instanceof BasicBlock)) {
            throw new IllegalStateException(String.format(
                    "%s is not preceded by a block\n  found: %s",
                    node,
                    prev));
        }
        return (BasicBlock) prev;
    }

    /**
     * Get the innermost loop containing a node.
     *
     * @param node The node.
     * @return The loop, or null if the node is not in a loop.
     */
    public static @Nullable LoopNode enclosingLoop(CfNode node) {
        CfList list = node.getParentList();
        while (list != null) {
            CfNode owner = list.getOwner();
            if (owner == null) return null;
            if (owner instanceof LoopNode) return (LoopNode) owner;
            list = owner.getParentList();
        }
        return null;
    }

    /**
     * Check whether {@code a} dominates {@code b}, using {@link CommonExts#IDOM}.
     * <p>
     * Dominance must be {@link io.github.shadeir.core.ext.MetadataState#DOMS valid}.
     * Every block dominates itself; an unreachable block is dominated by nothing else.
     *
     * @param a The dominator.
     * @param b The dominated block.
     * @return Whether a dominates b.
     */
    public static boolean dominates(BasicBlock a, BasicBlock b) {
        BasicBlock cur = b;
        while (cur != null) {
            if (cur == a) return true;
            cur = cur.getNullable(CommonExts.IDOM);
        }
        return false;
    }

    private static CfList parentOf(CfNode node) {
        CfList list = node.getParentList();
        if (list == null) {
            throw new IllegalStateException(node.toString() + " is not in any list");
        }
        return list;
    }
}
