package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.Ext;
import io.github.shadeir.core.ext.ExtHolder;
import io.github.shadeir.core.ext.MetadataState;
import io.github.shadeir.core.ssa.display.TextDisplay;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.SoftReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A function body: a structured {@link CfList} of nodes, and the arena of every block allocated in it.
 */
public final class Function extends ExtHolder {
    /**
     * Whether variables of the same name should be numbered apart. Only useful when reading dumps.
     */
    public static boolean UNIQUE_VAR_NAMES = System.getenv("SHADEIR_UNIQUE_VAR_NAMES") != null;

    /**
     * The name of the function.
     */
    public final String name;

    private final List<BasicBlock> arena = new ArrayList<>();
    /**
     * Every block allocated in this function, indexed by {@link BasicBlock#id}.
     */
    public final List<BasicBlock> blocks = Collections.unmodifiableList(arena);

    /**
     * The body of the function. Its first block is the entry block.
     */
    public final CfList body = new CfList(this, null);

    // names only matter for debugging, so let the JVM clear the counters if it has to
    private SoftReference<Map<String, Integer>> varsRef = null;

    /**
     * Create a function, with an empty entry block.
     *
     * @param name The name of the function.
     */
    public Function(String name) {
        this.name = name;
        body.getNodes().add(newBb());
    }

    /**
     * Get the entry block.
     *
     * @return The first block of {@link #body}.
     */
    public BasicBlock getEntry() {
        return body.firstBlock();
    }

    /**
     * Create a new variable.
     *
     * @param name    The name.
     * @param bitSize The width in bits.
     * @return The variable.
     */
    public Var newVar(String name, int bitSize) {
        if (!UNIQUE_VAR_NAMES) {
            return new Var(name, 0, bitSize);
        }
        Map<String, Integer> vars = varsRef == null ? null : varsRef.get();
        if (vars == null) {
            vars = new HashMap<>();
            varsRef = new SoftReference<>(vars);
        }
        int index = vars.getOrDefault(name, 0);
        vars.put(name, index + 1);
        return new Var(name, index, bitSize);
    }

    /**
     * Allocate a new block. It is not placed anywhere in {@link #body}.
     *
     * @return The block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock(arena.size());
        bb.attachExt(CommonExts.OWNING_FUNCTION, this);
        arena.add(bb);
        return bb;
    }

    /**
     * Allocate a new if construct, with a fresh empty block in each branch.
     * It is not placed anywhere in {@link #body}.
     *
     * @param condition The condition.
     * @return The if.
     */
    public IfNode newIf(Var condition) {
        IfNode nif = new IfNode(this, condition);
        nif.thenList.getNodes().add(newBb());
        nif.elseList.getNodes().add(newBb());
        return nif;
    }

    /**
     * Allocate a new loop, with a fresh empty block as its body.
     * It is not placed anywhere in {@link #body}.
     *
     * @return The loop.
     */
    public LoopNode newLoop() {
        LoopNode loop = new LoopNode(this);
        loop.body.getNodes().add(newBb());
        return loop;
    }

    @Override
    public String toString() {
        return TextDisplay.displayFunction(this);
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
