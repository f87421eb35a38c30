package io.github.shadeir.core.test;

import io.github.shadeir.core.passes.ProgressIRPass;
import io.github.shadeir.core.passes.misc.FixpointPass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FixpointPassTest {
    /**
     * Makes progress until the counter reaches zero.
     */
    private static final ProgressIRPass<AtomicInteger> COUNT_DOWN = n -> {
        if (n.get() == 0) return false;
        n.decrementAndGet();
        return true;
    };

    @Test
    void testRunsUntilNoProgress() {
        AtomicInteger n = new AtomicInteger(5);
        assertTrue(FixpointPass.of(COUNT_DOWN).runWithProgress(n));
        assertEquals(0, n.get());
        assertFalse(FixpointPass.of(COUNT_DOWN).runWithProgress(n));
    }

    @Test
    void testRoundBound() {
        AtomicInteger n = new AtomicInteger(100);
        FixpointPass<AtomicInteger> pass = FixpointPass.of(COUNT_DOWN).withMaxRounds(3);
        assertEquals(3, pass.getMaxRounds());
        assertTrue(pass.runWithProgress(n));
        assertEquals(97, n.get());
        assertEquals(FixpointPass.DEFAULT_MAX_ROUNDS, FixpointPass.of(COUNT_DOWN).getMaxRounds());
    }

    @Test
    void testValidatorRunsAfterProgress() {
        AtomicInteger n = new AtomicInteger(2);
        List<Integer> validated = new ArrayList<>();
        FixpointPass<AtomicInteger> pass = FixpointPass.of(COUNT_DOWN)
                .withValidator(t -> validated.add(t.get()));
        assertTrue(pass.runWithProgress(n));
        assertEquals(Arrays.asList(1, 0), validated);
    }

    @Test
    void testPassesRunInOrder() {
        List<String> log = new ArrayList<>();
        AtomicInteger n = new AtomicInteger(1);
        ProgressIRPass<AtomicInteger> first = t -> {
            log.add("first");
            return false;
        };
        ProgressIRPass<AtomicInteger> second = t -> {
            log.add("second");
            return COUNT_DOWN.runWithProgress(t);
        };
        assertTrue(new FixpointPass<>(Arrays.asList(first, second), null, 4).runWithProgress(n));
        assertEquals(Arrays.asList("first", "second", "first", "second"), log);
    }

    @Test
    void testFailureNamesPassAndRound() {
        AtomicInteger n = new AtomicInteger(3);
        ProgressIRPass<AtomicInteger> failing = t -> {
            if (t.get() == 1) throw new IllegalStateException("boom");
            return false;
        };
        FixpointPass<AtomicInteger> pass = new FixpointPass<>(Arrays.asList(COUNT_DOWN, failing), null, 8);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> pass.runWithProgress(n));
        assertEquals("boom", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("running pass 1 in round 1", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testRejectsNonPositiveBound() {
        assertThrows(IllegalArgumentException.class,
                () -> new FixpointPass<>(Collections.singletonList(COUNT_DOWN), null, 0));
    }
}
