package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ext.CommonExts;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * An ordered list of {@link CfNode}s.
 * <p>
 * A valid list is non-empty, starts and ends with a {@link BasicBlock},
 * and alternates between blocks and other nodes.
 */
public final class CfList {
    private final Function function;
    @Nullable
    private final CfNode owner;
    private final TrackedList<CfNode> nodes = new TrackedList<CfNode>() {
        @Override
        protected void onAdded(CfNode elt) {
            elt.attachExt(CommonExts.OWNING_LIST, CfList.this);
        }

        @Override
        protected void onRemoved(CfNode elt) {
            // a node being moved may already have been added elsewhere
            if (elt.getParentList() == CfList.this) {
                elt.removeExt(CommonExts.OWNING_LIST);
            }
        }
    };

    CfList(Function function, @Nullable CfNode owner) {
        this.function = function;
        this.owner = owner;
    }

    /**
     * Get the nodes of this list. The list is mutable, and keeps
     * {@link CommonExts#OWNING_LIST} up to date.
     *
     * @return The nodes.
     */
    public List<CfNode> getNodes() {
        return nodes;
    }

    /**
     * Get the node this list belongs to.
     *
     * @return The {@link IfNode} or {@link LoopNode} that owns this list, or null if this is a function body.
     */
    public @Nullable CfNode getOwner() {
        return owner;
    }

    /**
     * Get the function this list is in.
     *
     * @return The function.
     */
    public Function getFunction() {
        return function;
    }

    /**
     * Get the first block of this list.
     *
     * @return The block.
     * @throws IllegalStateException If the list is empty or does not start with a block.
     */
    public BasicBlock firstBlock() {
        if (nodes.isEmpty()) throw new IllegalStateException("empty control flow list");
        return asBlock(nodes.get(0));
    }

    /**
     * Get the last block of this list.
     *
     * @return The block.
     * @throws IllegalStateException If the list is empty or does not end with a block.
     */
    public BasicBlock lastBlock() {
        if (nodes.isEmpty()) throw new IllegalStateException("empty control flow list");
        return asBlock(nodes.get(nodes.size() - 1));
    }

    private static BasicBlock asBlock(CfNode node) {
        if (!(node instanceof BasicBlock)) {
            throw new IllegalStateException(String.format(
                    "control flow list does not start and end with a block\n  found: %s",
                    node));
        }
        return (BasicBlock) node;
    }
}
