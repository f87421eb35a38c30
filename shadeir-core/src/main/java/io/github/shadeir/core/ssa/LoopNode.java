package io.github.shadeir.core.ssa;

/**
 * An infinite loop, left only through {@link JumpKind#BREAK} or {@link JumpKind#RETURN}.
 * <p>
 * The last block of the body and every {@link JumpKind#CONTINUE} go back to the first block of the body.
 */
public final class LoopNode extends CfNode {
    /**
     * The body of the loop.
     */
    public final CfList body;

    LoopNode(Function function) {
        body = new CfList(function, this);
    }

    @Override
    public String toString() {
        return "loop";
    }
}
