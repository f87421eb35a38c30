package io.github.shadeir.core.ssa;

/**
 * The kinds of {@link Jump}.
 */
public enum JumpKind {
    /**
     * To the block after the innermost loop.
     */
    BREAK,
    /**
     * To the first block of the innermost loop.
     */
    CONTINUE,
    /**
     * Out of the function.
     */
    RETURN,
}
