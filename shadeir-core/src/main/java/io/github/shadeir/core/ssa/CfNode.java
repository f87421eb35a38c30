package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.Ext;
import io.github.shadeir.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A node of structured control flow: a {@link BasicBlock}, an {@link IfNode} or a {@link LoopNode}.
 * <p>
 * Nodes live in a {@link CfList}, which is the body of a function, a branch of an if,
 * or the body of a loop.
 */
public abstract class CfNode extends ExtHolder {
    CfNode() {
    }

    /**
     * Get the list this node is in.
     *
     * @return The list, or null if the node has not been placed yet.
     */
    public @Nullable CfList getParentList() {
        return parent;
    }

    /**
     * Get the node after this one in its list.
     *
     * @return The next node, or null if this is the last.
     */
    public @Nullable CfNode next() {
        return sibling(1);
    }

    /**
     * Get the node before this one in its list.
     *
     * @return The previous node, or null if this is the first.
     */
    public @Nullable CfNode prev() {
        return sibling(-1);
    }

    private @Nullable CfNode sibling(int offset) {
        if (parent == null) return null;
        List<CfNode> nodes = parent.getNodes();
        int i = nodes.indexOf(this) + offset;
        return i >= 0 && i < nodes.size() ? nodes.get(i) : null;
    }

    // exts
    private CfList parent = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_LIST) {
            return (T) parent;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_LIST) {
            parent = (CfList) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_LIST) {
            parent = null;
            return;
        }
        super.removeExt(ext);
    }
}
