package io.github.shadeir.core.passes;

/**
 * An in-place pass which reports whether it changed anything,
 * so that it can be run to a fixpoint.
 * <p>
 * A pass that reports no progress must leave the IR, and all of its metadata, untouched.
 *
 * @param <T> The type of the IR this pass operates on.
 * @see io.github.shadeir.core.passes.misc.FixpointPass
 */
public interface ProgressIRPass<T> extends IRPass<T, Boolean> {
    /**
     * Run the pass.
     *
     * @param t The IR to run this pass on.
     * @return Whether the IR was changed.
     */
    boolean runWithProgress(T t);

    @Override
    default Boolean run(T t) {
        return runWithProgress(t);
    }

    /**
     * View this pass as an in-place pass, discarding the progress it reports.
     *
     * @return The in-place pass.
     */
    default InPlaceIRPass<T> ignoringProgress() {
        return this::runWithProgress;
    }
}
