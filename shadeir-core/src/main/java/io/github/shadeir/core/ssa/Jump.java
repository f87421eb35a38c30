package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.Ext;
import io.github.shadeir.core.ext.ExtHolder;
import io.github.shadeir.core.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

/**
 * A jump: the instruction that ends a block and sends control somewhere
 * other than its structural successor.
 * <p>
 * Where it goes is determined by its {@link JumpKind} and the loop it is in,
 * so jumps have no explicit targets.
 */
public final class Jump extends ExtHolder {
    private final Insn insn;
    private final JumpKind kind;

    Jump(Insn insn) {
        JumpKind kind = CommonOps.jumpKind(insn.op);
        if (kind == null) {
            throw new IllegalArgumentException(insn.op + " is not a jump");
        }
        this.insn = insn;
        this.kind = kind;
    }

    /**
     * Get the underlying instruction. Only {@link JumpKind#RETURN} has arguments.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Get the kind of this jump.
     *
     * @return The kind.
     */
    public JumpKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return insn.toString();
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
