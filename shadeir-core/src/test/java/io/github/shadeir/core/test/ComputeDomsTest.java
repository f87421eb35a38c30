package io.github.shadeir.core.test;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.MetadataState;
import io.github.shadeir.core.ops.CommonOps;
import io.github.shadeir.core.passes.meta.ComputeDoms;
import io.github.shadeir.core.ssa.*;
import org.junit.jupiter.api.Test;

import static io.github.shadeir.core.util.ControlFlow.dominates;
import static org.junit.jupiter.api.Assertions.*;

public class ComputeDomsTest {
    @Test
    void testIfDiamond() {
        TestShaders s = new TestShaders();
        BasicBlock entry = s.ib.getBlock();
        IfNode nif = s.ib.pushIf(s.cmp);
        BasicBlock thenBlock = s.ib.getBlock();
        s.ib.pushElse(nif);
        BasicBlock elseBlock = s.ib.getBlock();
        s.ib.popIf(nif);
        BasicBlock merge = s.ib.getBlock();

        ComputeDoms.INSTANCE.runInPlace(s.func);

        assertTrue(s.metadata().isValid(MetadataState.DOMS));
        assertTrue(s.metadata().isValid(MetadataState.BLOCK_INDEX));
        assertNull(entry.getNullable(CommonExts.IDOM));
        assertSame(entry, thenBlock.getExtOrThrow(CommonExts.IDOM));
        assertSame(entry, elseBlock.getExtOrThrow(CommonExts.IDOM));
        assertSame(entry, merge.getExtOrThrow(CommonExts.IDOM));
        assertTrue(dominates(entry, merge));
        assertTrue(dominates(merge, merge));
        assertFalse(dominates(thenBlock, merge));
    }

    @Test
    void testJumpingBranchDominatesNothing() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.cmp);
        s.jump(CommonOps.RETURN);
        s.ib.pushElse(nif);
        BasicBlock elseBlock = s.ib.getBlock();
        s.ib.popIf(nif);
        BasicBlock merge = s.ib.getBlock();

        ComputeDoms.INSTANCE.runInPlace(s.func);

        assertSame(elseBlock, merge.getExtOrThrow(CommonExts.IDOM));
        assertTrue(dominates(elseBlock, merge));
    }

    @Test
    void testLoop() {
        TestShaders s = new TestShaders();
        BasicBlock entry = s.ib.getBlock();
        LoopNode loop = s.ib.pushLoop();
        BasicBlock header = s.ib.getBlock();
        IfNode nif = s.ib.pushIf(s.cmp);
        BasicBlock thenBlock = s.ib.getBlock();
        s.jump(CommonOps.BREAK);
        s.ib.popIf(nif);
        BasicBlock latch = s.ib.getBlock();
        s.ib.popLoop(loop);
        BasicBlock exit = s.ib.getBlock();

        ComputeDoms.INSTANCE.runInPlace(s.func);

        assertSame(entry, header.getExtOrThrow(CommonExts.IDOM));
        assertSame(nif.elseList.firstBlock(), latch.getExtOrThrow(CommonExts.IDOM));
        assertSame(header, nif.elseList.firstBlock().getExtOrThrow(CommonExts.IDOM));
        assertSame(thenBlock, exit.getExtOrThrow(CommonExts.IDOM));
        assertFalse(dominates(latch, header));
    }

    @Test
    void testUnreachableHasNoIdom() {
        TestShaders s = new TestShaders();
        s.jump(CommonOps.RETURN);
        IfNode nif = s.ib.pushIf(s.cmp);
        s.ib.popIf(nif);
        BasicBlock merge = s.ib.getBlock();

        ComputeDoms.INSTANCE.runInPlace(s.func);

        assertNull(merge.getNullable(CommonExts.IDOM));
        assertNull(nif.thenList.firstBlock().getNullable(CommonExts.IDOM));
        assertFalse(dominates(s.func.getEntry(), merge));
    }

    @Test
    void testRecomputedAfterChange() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.cmp);
        BasicBlock thenBlock = s.ib.getBlock();
        s.ib.popIf(nif);
        BasicBlock merge = s.ib.getBlock();

        MetadataState ms = s.metadata();
        ms.ensureValid(s.func, MetadataState.DOMS);
        assertSame(s.func.getEntry(), merge.getExtOrThrow(CommonExts.IDOM));

        nif.elseList.firstBlock().setJump(CommonOps.RETURN.insn().jump());
        ms.ensureValid(s.func, MetadataState.DOMS);
        assertSame(s.func.getEntry(), merge.getExtOrThrow(CommonExts.IDOM));

        ms.graphChanged();
        ms.ensureValid(s.func, MetadataState.DOMS);
        assertSame(thenBlock, merge.getExtOrThrow(CommonExts.IDOM));
    }
}
