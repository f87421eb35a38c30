package io.github.shadeir.core.passes.misc;

import io.github.shadeir.core.passes.IRPass;
import io.github.shadeir.core.passes.ProgressIRPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs a list of passes in rounds, until a whole round makes no progress.
 * <p>
 * The number of rounds is bounded; if the bound is hit the IR is left as it is,
 * which is still valid, just not fully simplified.
 *
 * @param <T> The type of the IR.
 */
public class FixpointPass<T> implements ProgressIRPass<T> {
    private static final Logger LOGGER = LogManager.getLogger(FixpointPass.class);

    /**
     * The number of rounds run before giving up, unless another is given.
     */
    public static final int DEFAULT_MAX_ROUNDS = 32;

    private final List<ProgressIRPass<T>> passes;
    @Nullable
    private final IRPass<T, ?> validator;
    private final int maxRounds;

    /**
     * Construct a fixpoint pass.
     *
     * @param passes    The passes to run each round, in order.
     * @param validator A pass to run after each pass that made progress, or null.
     * @param maxRounds The maximum number of rounds.
     */
    public FixpointPass(List<? extends ProgressIRPass<T>> passes, @Nullable IRPass<T, ?> validator, int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be positive, got " + maxRounds);
        }
        this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
        this.validator = validator;
        this.maxRounds = maxRounds;
    }

    /**
     * Construct a fixpoint pass with no validator and the {@link #DEFAULT_MAX_ROUNDS default bound}.
     *
     * @param passes The passes to run each round, in order.
     * @param <T>    The type of the IR.
     * @return The fixpoint pass.
     */
    @SafeVarargs
    public static <T> FixpointPass<T> of(ProgressIRPass<T>... passes) {
        return new FixpointPass<>(Arrays.asList(passes), null, DEFAULT_MAX_ROUNDS);
    }

    /**
     * Get a copy of this pass which runs {@code validator} after each pass that made progress.
     *
     * @param validator The validator.
     * @return The new pass.
     */
    public FixpointPass<T> withValidator(IRPass<T, ?> validator) {
        return new FixpointPass<>(passes, validator, maxRounds);
    }

    /**
     * Get a copy of this pass with a different bound on the number of rounds.
     *
     * @param maxRounds The bound.
     * @return The new pass.
     */
    public FixpointPass<T> withMaxRounds(int maxRounds) {
        return new FixpointPass<>(passes, validator, maxRounds);
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    @Override
    public boolean runWithProgress(T t) {
        boolean anyProgress = false;
        for (int round = 0; round < maxRounds; round++) {
            boolean progress = false;
            for (int i = 0; i < passes.size(); i++) {
                try {
                    if (passes.get(i).runWithProgress(t)) {
                        progress = true;
                        if (validator != null) validator.run(t);
                    }
                } catch (Throwable e) {
                    e.addSuppressed(new RuntimeException("running pass " + i + " in round " + round));
                    throw e;
                }
            }
            if (!progress) {
                LOGGER.debug("Reached fixpoint after {} round(s)", round + 1);
                return anyProgress;
            }
            anyProgress = true;
        }
        LOGGER.warn("No fixpoint after {} rounds, giving up", maxRounds);
        return anyProgress;
    }
}
