package io.github.shadeir.core.test;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.MetadataState;
import io.github.shadeir.core.ops.CommonOps;
import io.github.shadeir.core.ops.Op;
import io.github.shadeir.core.passes.meta.ValidateFunction;
import io.github.shadeir.core.passes.opts.SimplifyIfs;
import io.github.shadeir.core.ssa.*;
import io.github.shadeir.core.ssa.Module;

import java.util.List;

/**
 * A shader with one function, which reads {@code in}, compares it against one,
 * and leaves the builder at the end of the entry block.
 */
final class TestShaders {
    final Module module = new Module("test");
    final Function func = module.newFunction("main");
    final IRBuilder ib = new IRBuilder(func);
    final Var in;
    final Var one;
    final Var cmp;

    TestShaders() {
        in = ib.insert(CommonOps.LOAD_INPUT.create("in").insn(), "in", 32);
        one = ib.insert(CommonOps.constant(1), "one", 32);
        cmp = ib.insert(CommonOps.IEQ.insn(in, one), "cmp", 1);
    }

    void store(Var v) {
        ib.insert(CommonOps.STORE_OUTPUT.create("out").insn(v).assignTo());
    }

    void jump(Op op) {
        ib.insertJump(op.insn().jump());
    }

    Var add(Var a, Var b) {
        return ib.insert(CommonOps.IADD.insn(a, b), "sum", 32);
    }

    Var phi(List<BasicBlock> preds, List<Var> srcs) {
        return ib.insertPhi(preds, srcs, "phi", 32);
    }

    boolean simplify() {
        return SimplifyIfs.INSTANCE.runWithProgress(func);
    }

    void validate() {
        ValidateFunction.INSTANCE.runInPlace(func);
    }

    MetadataState metadata() {
        return func.getExtOrThrow(CommonExts.METADATA_STATE);
    }

    static List<BasicBlock> phiKeys(Effect phi) {
        return CommonOps.PHI.cast(phi.insn().op).arg;
    }
}
