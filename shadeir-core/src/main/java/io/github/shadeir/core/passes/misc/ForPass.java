package io.github.shadeir.core.passes.misc;

import io.github.shadeir.core.passes.IRPass;
import io.github.shadeir.core.passes.InPlaceIRPass;
import io.github.shadeir.core.passes.ProgressIRPass;
import io.github.shadeir.core.ssa.Function;
import io.github.shadeir.core.ssa.Module;

import java.util.List;

/**
 * Lifts passes which operate on functions into ones that operate on whole modules.
 */
public class ForPass {
    /**
     * Lift a function pass to operate on every function of a module.
     * <p>
     * If the pass is not in-place, each function is replaced by its result.
     *
     * @param pass The function pass.
     * @return The module pass.
     */
    public static InPlaceIRPass<Module> liftFunctions(IRPass<Function, Function> pass) {
        return new Functions(pass);
    }

    /**
     * Lift a function pass that reports progress to operate on every function of a module.
     * <p>
     * Every function is visited, even after one has made progress.
     *
     * @param pass The function pass.
     * @return The module pass, which makes progress if the pass did on any function.
     */
    public static ProgressIRPass<Module> liftFunctionsWithProgress(ProgressIRPass<Function> pass) {
        return new ProgressFunctions(pass);
    }

    /**
     * A function pass lifted to operate on a module.
     */
    public static class Functions implements InPlaceIRPass<Module> {
        private final IRPass<Function, Function> pass;

        private Functions(IRPass<Function, Function> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Module module) {
            List<Function> functions = module.functions;
            int i = 0;
            try {
                for (; i < functions.size(); i++) {
                    Function result = pass.run(functions.get(i));
                    if (!pass.isInPlace()) {
                        functions.set(i, result);
                    }
                }
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("in function " + i));
                throw t;
            }
        }
    }

    /**
     * A progress-reporting function pass lifted to operate on a module.
     */
    public static class ProgressFunctions implements ProgressIRPass<Module> {
        private final ProgressIRPass<Function> pass;

        private ProgressFunctions(ProgressIRPass<Function> pass) {
            this.pass = pass;
        }

        @Override
        public boolean runWithProgress(Module module) {
            boolean progress = false;
            int i = 0;
            try {
                for (; i < module.functions.size(); i++) {
                    progress |= pass.runWithProgress(module.functions.get(i));
                }
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException("in function " + i));
                throw t;
            }
            return progress;
        }
    }
}
