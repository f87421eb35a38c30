package io.github.shadeir.core.ops;

import io.github.shadeir.core.ssa.Insn;
import io.github.shadeir.core.ssa.Var;

import java.util.List;

/**
 * An operation: an {@link OpKey} together with its immediates, if any.
 */
public class Op {
    /**
     * The key of this operation.
     */
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Create an instruction applying this operation to the given arguments.
     *
     * @param args The arguments.
     * @return The instruction.
     */
    public Insn insn(Var... args) {
        return new Insn(this, args);
    }

    /**
     * Create an instruction applying this operation to the given arguments.
     *
     * @param args The arguments.
     * @return The instruction.
     */
    public Insn insn(List<Var> args) {
        return new Insn(this, args);
    }
}
