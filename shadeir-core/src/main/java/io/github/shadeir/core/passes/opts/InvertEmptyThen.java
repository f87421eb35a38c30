package io.github.shadeir.core.passes.opts;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ops.CommonOps;
import io.github.shadeir.core.ssa.*;
import io.github.shadeir.core.util.ControlFlow;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites {@code if c {} else { E }} into {@code if !c { E } else {}}.
 * <p>
 * No blocks are allocated. The empty then block takes the contents of the first else block,
 * the rest of the else branch moves after it, and the first else block is left empty.
 * The two blocks have swapped places as far as edges go, so phis keyed on either are swapped too.
 * <p>
 * Does nothing if both branches are empty.
 */
public class InvertEmptyThen implements IfRule {
    /**
     * A singleton instance of this rule.
     */
    public static final InvertEmptyThen INSTANCE = new InvertEmptyThen();

    @Override
    public boolean apply(Function func, IfNode nif) {
        if (!ControlFlow.isEmptyBranch(nif.thenList) || ControlFlow.isEmptyBranch(nif.elseList)) {
            return false;
        }

        nif.setCondition(negate(func, nif));

        BasicBlock t0 = nif.thenList.firstBlock();
        BasicBlock e0 = nif.elseList.firstBlock();

        List<Effect> effects = e0.getEffects();
        while (!effects.isEmpty()) {
            t0.addEffect(effects.remove(0));
        }
        Jump jump = e0.getJump();
        e0.setJump(null);
        t0.setJump(jump);

        List<CfNode> elseNodes = nif.elseList.getNodes();
        List<CfNode> thenNodes = nif.thenList.getNodes();
        while (elseNodes.size() > 1) {
            thenNodes.add(elseNodes.remove(1));
        }

        Map<BasicBlock, BasicBlock> relabel = new HashMap<>();
        relabel.put(t0, e0);
        relabel.put(e0, t0);
        Set<BasicBlock> affected = new LinkedHashSet<>(ControlFlow.successors(t0));
        affected.addAll(ControlFlow.successors(e0));
        PhiRepair.rekey(relabel, affected);
        return true;
    }

    private static Var negate(Function func, IfNode nif) {
        Var cond = nif.getCondition();
        Effect def = cond.getNullable(CommonExts.ASSIGNED_AT);
        if (def != null && def.insn().op.key == CommonOps.INOT.key) {
            Var inner = def.insn().args().get(0);
            if (inner.bitSize == cond.bitSize) {
                return inner;
            }
        }
        Var negated = func.newVar("not_" + cond.name, cond.bitSize);
        ControlFlow.blockBefore(nif).addEffect(CommonOps.INOT.insn(cond).assignTo(negated));
        return negated;
    }

    @Override
    public String toString() {
        return "InvertEmptyThen";
    }
}
