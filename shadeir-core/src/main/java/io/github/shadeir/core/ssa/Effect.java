package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.Ext;
import io.github.shadeir.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * An effect: an {@link Insn instruction} in the body of a block,
 * and the variable its result is assigned to, if any.
 */
public final class Effect extends ExtHolder {
    @Nullable
    private final Var dest;
    private final Insn insn;

    Effect(@Nullable Var dest, Insn insn) {
        this.dest = dest;
        this.insn = insn;
        if (dest != null) {
            dest.attachExt(CommonExts.ASSIGNED_AT, this);
        }
    }

    /**
     * Get the variable this effect assigns.
     *
     * @return The variable, or null.
     */
    public @Nullable Var getDest() {
        return dest;
    }

    /**
     * Get the underlying instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    @Override
    public String toString() {
        return dest == null ? insn.toString() : dest + " = " + insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
