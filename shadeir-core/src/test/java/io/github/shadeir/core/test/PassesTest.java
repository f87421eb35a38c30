package io.github.shadeir.core.test;

import io.github.shadeir.core.ops.CommonOps;
import io.github.shadeir.core.passes.IRPass;
import io.github.shadeir.core.passes.InPlaceIRPass;
import io.github.shadeir.core.passes.Passes;
import io.github.shadeir.core.passes.meta.ValidateFunction;
import io.github.shadeir.core.passes.misc.ChainedPass;
import io.github.shadeir.core.passes.misc.ForPass;
import io.github.shadeir.core.passes.opts.SimplifyIfs;
import io.github.shadeir.core.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.shadeir.core.util.ControlFlow.isEmptyBranch;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    private static IfNode emptyThenIf(TestShaders s) {
        IfNode nif = s.ib.pushIf(s.cmp);
        s.ib.pushElse(nif);
        s.store(s.in);
        s.ib.popIf(nif);
        return nif;
    }

    @Test
    void testIfOptsReachesCanonicalForm() {
        TestShaders s = new TestShaders();
        IfNode first = emptyThenIf(s);
        LoopNode loop = s.ib.pushLoop();
        IfNode second = emptyThenIf(s);
        s.jump(CommonOps.BREAK);
        s.ib.popLoop(loop);
        IfNode untouched = s.ib.pushIf(s.cmp);
        s.ib.popIf(untouched);

        assertTrue(Passes.ifOpts(true).runWithProgress(s.func));
        s.validate();

        for (IfNode nif : Arrays.asList(first, second)) {
            assertFalse(isEmptyBranch(nif.thenList));
            assertTrue(isEmptyBranch(nif.elseList));
        }
        assertTrue(isEmptyBranch(untouched.thenList));
        assertTrue(isEmptyBranch(untouched.elseList));
        assertFalse(Passes.IF_OPTS.runWithProgress(s.func));
    }

    @Test
    void testCheckedIfOpts() {
        TestShaders s = new TestShaders();
        IfNode nif = emptyThenIf(s);

        assertSame(s.func, Passes.CHECKED_IF_OPTS.run(s.func));
        assertTrue(isEmptyBranch(nif.elseList));
    }

    @Test
    void testCheckedIfOptsRejectsInvalidInput() {
        TestShaders s = new TestShaders();
        s.jump(CommonOps.BREAK);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> Passes.CHECKED_IF_OPTS.run(s.func));
        assertEquals("running pass 0 in chain", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testChainFlattened() {
        IRPass<Function, Function> chain = ValidateFunction.INSTANCE
                .then(SimplifyIfs.INSTANCE.ignoringProgress())
                .then(ValidateFunction.INSTANCE);
        assertTrue(chain instanceof ChainedPass);
        assertEquals(3, ((ChainedPass<?, ?, ?>) chain).getPasses().size());
        assertTrue(chain.isInPlace());
    }

    @Test
    void testModuleProgressVisitsEveryFunction() {
        TestShaders s = new TestShaders();
        emptyThenIf(s);
        Function other = s.module.newFunction("other");
        IRBuilder ib = new IRBuilder(other);
        Var c = ib.insert(CommonOps.constant(1), "c", 1);
        IfNode nif = ib.pushIf(c);
        ib.popIf(nif);

        List<Function> visited = new ArrayList<>();
        assertTrue(ForPass.liftFunctionsWithProgress(f -> {
            visited.add(f);
            return SimplifyIfs.INSTANCE.runWithProgress(f);
        }).runWithProgress(s.module));
        assertEquals(s.module.functions, visited);

        assertFalse(ForPass.liftFunctionsWithProgress(SimplifyIfs.INSTANCE).runWithProgress(s.module));
        ForPass.liftFunctions(ValidateFunction.INSTANCE).runInPlace(s.module);
    }

    @Test
    void testModuleReplacesFunctions() {
        TestShaders s = new TestShaders();
        Function replacement = new Function("replacement");
        ForPass.liftFunctions(f -> replacement).runInPlace(s.module);
        assertSame(replacement, s.module.functions.get(0));

        InPlaceIRPass<Function> failing = f -> {
            throw new IllegalStateException("bad " + f.name);
        };
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ForPass.liftFunctions(failing).runInPlace(s.module));
        assertEquals("in function 0", e.getSuppressed()[0].getMessage());
    }
}
