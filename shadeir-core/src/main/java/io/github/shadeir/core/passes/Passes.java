package io.github.shadeir.core.passes;

import io.github.shadeir.core.passes.meta.ValidateFunction;
import io.github.shadeir.core.passes.misc.FixpointPass;
import io.github.shadeir.core.passes.opts.SimplifyIfs;
import io.github.shadeir.core.ssa.Function;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Whether {@link #IF_OPTS} should validate the function after every change.
     */
    public static boolean VALIDATE_PASSES = System.getenv("SHADEIR_VALIDATE_PASSES") != null;

    /**
     * Canonicalize every if in a function, until nothing changes.
     */
    public static final FixpointPass<Function> IF_OPTS = ifOpts(VALIDATE_PASSES);

    /**
     * Validate a function, canonicalize its ifs, and validate it again.
     */
    public static final IRPass<Function, Function> CHECKED_IF_OPTS =
            ValidateFunction.INSTANCE
                    .then(IF_OPTS.ignoringProgress())
                    .then(ValidateFunction.INSTANCE);

    /**
     * Create a pass that canonicalizes every if in a function, until nothing changes.
     *
     * @param validate Whether to validate the function after every change.
     * @return The pass.
     */
    public static FixpointPass<Function> ifOpts(boolean validate) {
        FixpointPass<Function> pass = FixpointPass.of(SimplifyIfs.INSTANCE);
        return validate ? pass.withValidator(ValidateFunction.INSTANCE) : pass;
    }
}
