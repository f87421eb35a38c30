package io.github.shadeir.core.ops;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ssa.BasicBlock;
import io.github.shadeir.core.ssa.Effect;
import io.github.shadeir.core.ssa.Insn;
import io.github.shadeir.core.ssa.JumpKind;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The operations of the IR.
 * <p>
 * The set is closed: passes distinguish instructions by comparing
 * {@link Op#key} against the keys here.
 */
public class CommonOps {
    /**
     * Effect: returns the argument corresponding to the predecessor control arrived from.
     * <p>
     * The immediate is the list of predecessors, index-aligned with the arguments.
     * Must precede any non-phi effect in its block.
     */
    public static final UnaryOpKey<List<BasicBlock>> PHI = new UnaryOpKey<>("phi", bbs ->
            bbs.stream().map(BasicBlock::toTargetString).collect(Collectors.joining(" ")));

    /**
     * Effect: returns the constant.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");

    /**
     * Effect: reads the named shader input.
     */
    public static final UnaryOpKey<String> LOAD_INPUT = new UnaryOpKey<>("load_input");
    /**
     * Effect: writes its argument to the named shader output, returns nothing.
     */
    public static final UnaryOpKey<String> STORE_OUTPUT = new UnaryOpKey<>("store_output");

    /**
     * Effect: integer equality, returns a 1-bit boolean.
     */
    public static final Op IEQ = new SimpleOpKey("ieq").create();
    /**
     * Effect: integer inequality, returns a 1-bit boolean.
     */
    public static final Op INE = new SimpleOpKey("ine").create();
    /**
     * Effect: signed integer less-than, returns a 1-bit boolean.
     */
    public static final Op ILT = new SimpleOpKey("ilt").create();
    /**
     * Effect: integer addition.
     */
    public static final Op IADD = new SimpleOpKey("iadd").create();
    /**
     * Effect: bitwise not, which is logical negation on 1-bit booleans.
     */
    public static final Op INOT = new SimpleOpKey("inot").create();

    /**
     * Jump: leaves the innermost loop.
     */
    public static final Op BREAK = new SimpleOpKey("break").create();
    /**
     * Jump: goes back to the start of the innermost loop.
     */
    public static final Op CONTINUE = new SimpleOpKey("continue").create();
    /**
     * Jump: returns from the function, with its arguments as the results.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();

    static {
        BREAK.key.attachExt(CommonExts.JUMP_KIND, JumpKind.BREAK);
        CONTINUE.key.attachExt(CommonExts.JUMP_KIND, JumpKind.CONTINUE);
        RETURN.key.attachExt(CommonExts.JUMP_KIND, JumpKind.RETURN);
    }

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }

    /**
     * Get the kind of jump {@code op} performs.
     *
     * @param op The operation.
     * @return The jump kind, or null if it is not a jump.
     */
    public static @Nullable JumpKind jumpKind(Op op) {
        return op.key.getNullable(CommonExts.JUMP_KIND);
    }

    /**
     * Check whether the effect is a phi.
     *
     * @param effect The effect.
     * @return Whether it is a phi.
     */
    public static boolean isPhi(Effect effect) {
        return effect.insn().op.key == PHI;
    }
}
