package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.Ext;
import io.github.shadeir.core.ssa.display.TextDisplay;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A basic block: a list of {@link Effect}s, phis first, optionally followed by one {@link Jump}.
 * <p>
 * A block without a jump falls through to its structural successor.
 */
public final class BasicBlock extends CfNode {
    /**
     * The index of this block in {@link Function#blocks}. Never changes.
     */
    public final int id;
    private final TrackedList<Effect> effects = new TrackedList<Effect>() {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            if (elt.getNullable(CommonExts.OWNING_BLOCK) == BasicBlock.this) {
                elt.removeExt(CommonExts.OWNING_BLOCK);
            }
        }
    };
    @Nullable
    private Jump jump;

    BasicBlock(int id) {
        this.id = id;
    }

    /**
     * Format this block as a reference, for display.
     *
     * @return The reference string.
     */
    public String toTargetString() {
        return "block_" + id;
    }

    @Override
    public String toString() {
        return TextDisplay.displayBlock(this);
    }

    /**
     * Get the effects of this block. The list is mutable, and keeps
     * {@link CommonExts#OWNING_BLOCK} up to date.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    /**
     * Add an effect to the end of this block, before the jump if there is one.
     *
     * @param effect The effect.
     */
    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the jump that ends this block.
     *
     * @return The jump, or null if the block falls through.
     */
    public @Nullable Jump getJump() {
        return jump;
    }

    /**
     * Set the jump that ends this block.
     *
     * @param jump The jump, or null to make the block fall through.
     */
    public void setJump(@Nullable Jump jump) {
        if (this.jump != null && this.jump.getNullable(CommonExts.OWNING_BLOCK) == this) {
            this.jump.removeExt(CommonExts.OWNING_BLOCK);
        }
        this.jump = jump;
        if (jump != null) {
            jump.attachExt(CommonExts.OWNING_BLOCK, this);
        }
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
