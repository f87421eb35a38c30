package io.github.shadeir.core.test;

import io.github.shadeir.core.ops.CommonOps;
import io.github.shadeir.core.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ValidateFunctionTest {
    private static void assertInvalid(TestShaders s, String message) {
        IllegalStateException e = assertThrows(IllegalStateException.class, s::validate);
        assertTrue(e.getMessage().startsWith(message), e::getMessage);
    }

    @Test
    void testAcceptsStructuredFunction() {
        TestShaders s = new TestShaders();
        LoopNode loop = s.ib.pushLoop();
        IfNode nif = s.ib.pushIf(s.cmp);
        BasicBlock thenBlock = s.ib.getBlock();
        Var sum = s.add(s.in, s.one);
        s.jump(CommonOps.BREAK);
        s.ib.pushElse(nif);
        s.jump(CommonOps.CONTINUE);
        s.ib.popIf(nif);
        s.ib.popLoop(loop);
        Var p = s.phi(Collections.singletonList(thenBlock), Collections.singletonList(sum));
        s.store(p);
        s.ib.insertJump(CommonOps.RETURN.insn(p).jump());

        s.validate();
    }

    @Test
    void testPhiAfterEffect() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.cmp);
        BasicBlock thenBlock = s.ib.getBlock();
        s.ib.popIf(nif);
        s.store(s.in);
        Var v = s.func.newVar("late", 32);
        s.ib.insert(CommonOps.PHI.create(Arrays.asList(thenBlock, nif.elseList.firstBlock()))
                .insn(s.one, s.one)
                .assignTo(v));

        assertInvalid(s, "phi not at block start");
    }

    @Test
    void testAssignedTwice() {
        TestShaders s = new TestShaders();
        Var v = s.func.newVar("twice", 32);
        s.ib.insert(CommonOps.constant(1), v);
        s.ib.insert(CommonOps.constant(2), v);

        assertInvalid(s, "variable assigned more than once");
    }

    @Test
    void testBreakOutsideLoop() {
        TestShaders s = new TestShaders();
        s.jump(CommonOps.BREAK);

        assertInvalid(s, "break outside of a loop");
    }

    @Test
    void testNonBooleanCondition() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.in);
        s.ib.popIf(nif);

        assertInvalid(s, "if condition is not a boolean");
    }

    @Test
    void testPhiMissingPredecessor() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.cmp);
        BasicBlock thenBlock = s.ib.getBlock();
        s.ib.popIf(nif);
        s.phi(Collections.singletonList(thenBlock), Collections.singletonList(s.one));

        assertInvalid(s, "phi predecessors do not match block predecessors");
    }

    @Test
    void testPhiDuplicatePredecessor() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.cmp);
        BasicBlock thenBlock = s.ib.getBlock();
        s.ib.popIf(nif);
        s.phi(Arrays.asList(thenBlock, thenBlock), Arrays.asList(s.one, s.in));

        assertInvalid(s, "phi has duplicate predecessors");
    }

    @Test
    void testUseNotDominated() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.cmp);
        Var sum = s.add(s.in, s.one);
        s.ib.popIf(nif);
        s.store(sum);

        assertInvalid(s, "definition does not dominate use");
    }

    @Test
    void testUseBeforeDefinitionInBlock() {
        TestShaders s = new TestShaders();
        Var late = s.func.newVar("late", 32);
        s.store(late);
        s.ib.insert(CommonOps.constant(3), late);

        assertInvalid(s, "definition does not dominate use");
    }

    @Test
    void testUseOfUndefined() {
        TestShaders s = new TestShaders();
        s.store(s.func.newVar("nowhere", 32));

        assertInvalid(s, "use of undefined variable");
    }

    @Test
    void testUnplacedBlock() {
        TestShaders s = new TestShaders();
        s.func.newBb();

        assertInvalid(s, "block not placed in function body");
    }

    @Test
    void testEmptyBranch() {
        TestShaders s = new TestShaders();
        IfNode nif = s.ib.pushIf(s.cmp);
        s.ib.popIf(nif);
        nif.elseList.getNodes().clear();

        assertInvalid(s, "empty control flow list");
    }

    @Test
    void testUnreachablePhiIgnored() {
        TestShaders s = new TestShaders();
        s.jump(CommonOps.RETURN);
        IfNode nif = s.ib.pushIf(s.cmp);
        s.ib.popIf(nif);
        // nothing reaches this block, so it has no predecessors to match
        s.phi(Collections.singletonList(nif.thenList.firstBlock()), Collections.singletonList(s.one));

        s.validate();
    }
}
