package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ops.CommonOps;

import java.util.ArrayList;
import java.util.List;

/**
 * An IR, or instruction, builder, which encapsulates a position in a function
 * where instructions and control flow are being inserted.
 * <p>
 * The position is the end of a {@link CfList}: instructions go into its last block,
 * and new ifs and loops are appended to it, followed by a fresh block.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private CfList list;

    /**
     * Construct an instruction builder, inserting at the end of the function body.
     *
     * @param func The function.
     */
    public IRBuilder(Function func) {
        this(func, func.body);
    }

    /**
     * Construct an instruction builder, inserting at the end of a specific list.
     *
     * @param func The function.
     * @param list One of the function's control flow lists.
     */
    public IRBuilder(Function func, CfList list) {
        this.func = func;
        this.list = list;
    }

    /**
     * Get the list this builder is inserting at the end of.
     *
     * @return The list.
     */
    public CfList getList() {
        return list;
    }

    /**
     * Get the block this builder is inserting at the end of.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        return list.lastBlock();
    }

    /**
     * Insert an effect at the end of the current block.
     *
     * @param effect The effect.
     */
    public void insert(Effect effect) {
        getBlock().addEffect(effect);
    }

    /**
     * Assign the result of the instruction to a variable,
     * and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The variable.
     * @return The same variable.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of the instruction to a new variable,
     * and insert the effect.
     *
     * @param insn    The instruction.
     * @param name    The name of variable.
     * @param bitSize The width of the variable.
     * @return The assigned variable.
     */
    public Var insert(Insn insn, String name, int bitSize) {
        return insert(insn, func.newVar(name, bitSize));
    }

    /**
     * Insert a phi into the current block, after any phis already there.
     *
     * @param preds   The predecessor blocks.
     * @param srcs    The values, index-aligned with {@code preds}.
     * @param name    The name of the variable.
     * @param bitSize The width of the variable.
     * @return The assigned variable.
     */
    public Var insertPhi(List<BasicBlock> preds, List<Var> srcs, String name, int bitSize) {
        if (preds.size() != srcs.size()) {
            throw new IllegalArgumentException(String.format(
                    "phi has %d predecessors but %d values",
                    preds.size(),
                    srcs.size()));
        }
        Var v = func.newVar(name, bitSize);
        List<Effect> effects = getBlock().getEffects();
        int i = 0;
        while (i < effects.size() && CommonOps.isPhi(effects.get(i))) i++;
        effects.add(i, CommonOps.PHI.create(new ArrayList<>(preds)).insn(srcs).assignTo(v));
        return v;
    }

    /**
     * Insert a jump at the end of the current block.
     *
     * @param jump The jump to insert.
     * @throws IllegalStateException If the block already ends in a jump.
     */
    public void insertJump(Jump jump) {
        BasicBlock bb = getBlock();
        if (bb.getJump() != null) {
            throw new IllegalStateException(String.format(
                    "block already ends in a jump\n  block: %s",
                    bb));
        }
        bb.setJump(jump);
    }

    /**
     * Append an if to the current list, followed by its merge block,
     * and start inserting into its then branch.
     *
     * @param condition The condition.
     * @return The if.
     */
    public IfNode pushIf(Var condition) {
        IfNode nif = func.newIf(condition);
        list.getNodes().add(nif);
        list.getNodes().add(func.newBb());
        list = nif.thenList;
        return nif;
    }

    /**
     * Start inserting into the else branch of an if.
     *
     * @param nif The if.
     */
    public void pushElse(IfNode nif) {
        list = nif.elseList;
    }

    /**
     * Resume inserting after an if, in its merge block.
     *
     * @param nif The if.
     */
    public void popIf(IfNode nif) {
        list = parentOf(nif);
    }

    /**
     * Append a loop to the current list, followed by its exit block,
     * and start inserting into its body.
     *
     * @return The loop.
     */
    public LoopNode pushLoop() {
        LoopNode loop = func.newLoop();
        list.getNodes().add(loop);
        list.getNodes().add(func.newBb());
        list = loop.body;
        return loop;
    }

    /**
     * Resume inserting after a loop, in its exit block.
     *
     * @param loop The loop.
     */
    public void popLoop(LoopNode loop) {
        list = parentOf(loop);
    }

    private static CfList parentOf(CfNode node) {
        CfList parent = node.getParentList();
        if (parent == null) {
            throw new IllegalStateException(node + " is not in any list");
        }
        return parent;
    }
}
