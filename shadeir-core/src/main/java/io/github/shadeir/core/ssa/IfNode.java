package io.github.shadeir.core.ssa;

/**
 * An if construct.
 * <p>
 * The condition is evaluated at the end of the block before this node. Control enters
 * {@link #thenList} if it is true and {@link #elseList} otherwise; both branches
 * then fall through to the block after this node, the merge block, unless they jump.
 */
public final class IfNode extends CfNode {
    /**
     * The branch taken if the condition is true.
     */
    public final CfList thenList;
    /**
     * The branch taken if the condition is false.
     */
    public final CfList elseList;
    private Var condition;

    IfNode(Function function, Var condition) {
        this.condition = condition;
        thenList = new CfList(function, this);
        elseList = new CfList(function, this);
    }

    /**
     * Get the condition of this if, a 1-bit boolean.
     *
     * @return The condition.
     */
    public Var getCondition() {
        return condition;
    }

    /**
     * Set the condition of this if.
     *
     * @param condition The condition.
     */
    public void setCondition(Var condition) {
        this.condition = condition;
    }

    @Override
    public String toString() {
        return "if " + condition;
    }
}
