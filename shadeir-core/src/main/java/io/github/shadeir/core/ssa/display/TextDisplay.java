package io.github.shadeir.core.ssa.display;

import io.github.shadeir.core.ssa.*;

/**
 * Formats the IR as indented text, for debugging and error messages.
 */
public class TextDisplay {
    private static final String INDENT = "  ";

    /**
     * Format a single block.
     *
     * @param block The block.
     * @return The text.
     */
    public static String displayBlock(BasicBlock block) {
        StringBuilder sb = new StringBuilder();
        appendBlock(sb, block, "");
        return sb.toString();
    }

    /**
     * Format a whole function.
     *
     * @param func The function.
     * @return The text.
     */
    public static String displayFunction(Function func) {
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(func.name).append(" {\n");
        appendList(sb, func.body, INDENT);
        sb.append('}');
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, CfList list, String indent) {
        for (CfNode node : list.getNodes()) {
            if (node instanceof BasicBlock) {
                appendBlock(sb, (BasicBlock) node, indent);
            } else if (node instanceof IfNode) {
                IfNode nif = (IfNode) node;
                sb.append(indent).append(nif).append(" {\n");
                appendList(sb, nif.thenList, indent + INDENT);
                sb.append(indent).append("} else {\n");
                appendList(sb, nif.elseList, indent + INDENT);
                sb.append(indent).append("}\n");
            } else if (node instanceof LoopNode) {
                sb.append(indent).append(node).append(" {\n");
                appendList(sb, ((LoopNode) node).body, indent + INDENT);
                sb.append(indent).append("}\n");
            } else {
                sb.append(indent).append(node).append('\n');
            }
        }
    }

    private static void appendBlock(StringBuilder sb, BasicBlock block, String indent) {
        sb.append(indent).append(block.toTargetString()).append(":\n");
        for (Effect effect : block.getEffects()) {
            sb.append(indent).append(INDENT).append(effect).append('\n');
        }
        Jump jump = block.getJump();
        if (jump != null) {
            sb.append(indent).append(INDENT).append(jump).append('\n');
        }
    }
}
