package io.github.shadeir.core.ext;

import io.github.shadeir.core.passes.IRPass;
import io.github.shadeir.core.passes.meta.ComputeBlockIndices;
import io.github.shadeir.core.passes.meta.ComputeDoms;
import io.github.shadeir.core.passes.meta.ComputePreds;
import io.github.shadeir.core.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which derived metadata of a {@link Function} is currently valid.
 * <p>
 * Passes that change the control flow call {@link #graphChanged()}; passes that
 * need metadata call {@link #ensureValid(Object, ComputableMetaKind, ComputableMetaKind[])},
 * which recomputes it only if it was invalidated.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity is tracked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return id;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that also knows which passes compute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("not an in-place pass: " + pass);
                pass.run(t);
            }
        }
    }

    /**
     * {@link CommonExts#PREDS} on every block.
     */
    public static final ComputableMetaKind<Function> PREDS =
            new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE);
    /**
     * {@link CommonExts#BLOCK_INDEX} on every block.
     */
    public static final ComputableMetaKind<Function> BLOCK_INDEX =
            new ComputableMetaKind<>("BLOCK_INDEX", ComputeBlockIndices.INSTANCE);
    /**
     * {@link CommonExts#IDOM} on every reachable block.
     */
    public static final ComputableMetaKind<Function> DOMS =
            new ComputableMetaKind<>("DOMS", ComputeDoms.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute each of the given metadata kinds that is not currently valid.
     *
     * @param t     The IR to compute it on.
     * @param first The first kind.
     * @param kinds The other kinds.
     * @param <T>   The IR type.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    /**
     * Mark the given metadata as valid.
     *
     * @param kinds The kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    /**
     * Mark the given metadata as stale.
     *
     * @param kinds The kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Invalidate everything derived from the shape of the control flow.
     */
    public void graphChanged() {
        invalidate(PREDS, BLOCK_INDEX, DOMS);
    }
}
