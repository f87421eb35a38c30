package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An instruction: an {@link Op} applied to a list of argument {@link Var}s.
 * <p>
 * An instruction is placed in the IR either as an {@link Effect} or as a {@link Jump}.
 */
public final class Insn {
    public Op op;
    private final List<Var> args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = new ArrayList<>(args);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    /**
     * Get the arguments of this instruction. The list is mutable.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return args;
    }

    /**
     * Wrap this instruction in an effect assigning to {@code dest}.
     *
     * @param dest The variable, or null if the result is unused.
     * @return The effect.
     */
    public Effect assignTo(@Nullable Var dest) {
        return new Effect(dest, this);
    }

    /**
     * Wrap this instruction in an effect that assigns nothing.
     *
     * @return The effect.
     */
    public Effect assignTo() {
        return new Effect(null, this);
    }

    /**
     * Wrap this instruction in a jump.
     *
     * @return The jump.
     * @throws IllegalArgumentException If {@link #op} is not a jump.
     */
    public Jump jump() {
        return new Jump(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }
}
