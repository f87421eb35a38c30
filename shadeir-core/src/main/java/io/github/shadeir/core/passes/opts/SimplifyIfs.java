package io.github.shadeir.core.passes.opts;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.passes.ProgressIRPass;
import io.github.shadeir.core.ssa.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Puts every if of a function into canonical form by applying {@link IfRule}s.
 * <p>
 * Ifs are visited bottom-up, the contents of each branch before the if itself.
 * For each if the rules are tried in order, and the first that fires wins;
 * the next run may fire more.
 * <p>
 * If anything was rewritten, the control flow metadata of the function is invalidated.
 * Otherwise the function is left exactly as it was.
 */
public class SimplifyIfs implements ProgressIRPass<Function> {
    private static final Logger LOGGER = LogManager.getLogger(SimplifyIfs.class);

    /**
     * A singleton instance of this pass, with the default rules.
     */
    public static final SimplifyIfs INSTANCE = new SimplifyIfs(Collections.singletonList(InvertEmptyThen.INSTANCE));

    private final List<IfRule> rules;

    /**
     * Construct a pass with the given rules.
     *
     * @param rules The rules, in the order they should be tried.
     */
    public SimplifyIfs(List<? extends IfRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Get a copy of this pass with an additional rule, tried after the others.
     *
     * @param rule The rule.
     * @return The new pass.
     */
    public SimplifyIfs withRule(IfRule rule) {
        List<IfRule> newRules = new ArrayList<>(rules);
        newRules.add(rule);
        return new SimplifyIfs(newRules);
    }

    public List<IfRule> getRules() {
        return rules;
    }

    @Override
    public boolean runWithProgress(Function func) {
        boolean progress = simplifyList(func, func.body);
        if (progress) {
            func.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        }
        return progress;
    }

    private boolean simplifyList(Function func, CfList list) {
        boolean progress = false;
        for (CfNode node : new ArrayList<>(list.getNodes())) {
            if (node instanceof IfNode) {
                IfNode nif = (IfNode) node;
                progress |= simplifyList(func, nif.thenList);
                progress |= simplifyList(func, nif.elseList);
                progress |= applyRules(func, nif);
            } else if (node instanceof LoopNode) {
                progress |= simplifyList(func, ((LoopNode) node).body);
            }
        }
        return progress;
    }

    private boolean applyRules(Function func, IfNode nif) {
        for (IfRule rule : rules) {
            if (rule.apply(func, nif)) {
                LOGGER.debug("Applied {} to '{}' in {}", rule, nif, func.name);
                return true;
            }
        }
        return false;
    }
}
