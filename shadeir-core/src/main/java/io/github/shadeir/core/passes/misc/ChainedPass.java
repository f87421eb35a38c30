package io.github.shadeir.core.passes.misc;

import io.github.shadeir.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 * <p>
 * Nested chains are flattened, so a failure names the position of the failing pass in the whole chain.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<Object, Object>> passes;
    private final boolean isInPlace;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<Object, Object>> passes = new ArrayList<>();
        flatten(firstPass, passes);
        flatten(nextPass, passes);
        this.passes = Collections.unmodifiableList(passes);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    private static void flatten(IRPass<?, ?> pass, List<IRPass<Object, Object>> out) {
        if (pass instanceof ChainedPass) {
            out.addAll(((ChainedPass<?, ?, ?>) pass).passes);
        } else {
            out.add((IRPass<Object, Object>) pass);
        }
    }

    /**
     * Get the passes of this chain, in the order they run.
     *
     * @return The passes.
     */
    public List<IRPass<Object, Object>> getPasses() {
        return passes;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                acc = passes.get(i).run(acc);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw t;
            }
        }
        return (C) acc;
    }
}
