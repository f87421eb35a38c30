package io.github.shadeir.core.passes.meta;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.MetadataState;
import io.github.shadeir.core.passes.InPlaceIRPass;
import io.github.shadeir.core.ssa.BasicBlock;
import io.github.shadeir.core.ssa.Function;
import io.github.shadeir.core.util.ControlFlow;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*
 Thomas Lengauer and Robert Endre Tarjan. A fast algorithm for finding dominators in a flow-graph.
 ACM Transactions on Programming Languages and Systems, 1(1):121-141, July 1979.
*/
/**
 * Computes {@link CommonExts#IDOM} for every reachable block other than the entry,
 * and removes it from every other block.
 * <p>
 * Vertices are numbered by {@link CommonExts#BLOCK_INDEX} plus one, so the entry is vertex 1.
 */
public class ComputeDoms implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeDoms INSTANCE = new ComputeDoms();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.BLOCK_INDEX);

        List<BasicBlock> blocks = ControlFlow.blocksInOrder(func.body);

        class Runner {
            int n = blocks.size();
            final int total = n;
            final int[][] succ = new int[n + 1][];
            final int[] dom = new int[n + 1];
            final int[] parent = new int[n + 1];
            final int[] ancestor = new int[n + 1];
            final int[] child = new int[n + 1];
            final int[] vertex = new int[n + 1];
            final int[] label = new int[n + 1];
            final int[] semi = new int[n + 1];
            final int[] size = new int[n + 1];
            final boolean[] reached = new boolean[n + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] pred = new Set[n + 1];
            @SuppressWarnings("unchecked")
            final Set<Integer>[] bucket = new Set[n + 1];

            void dfs(int v) {
                reached[v] = true;
                semi[v] = ++n;
                vertex[n] = label[v] = v;
                ancestor[v] = child[v] = 0;
                size[v] = 1;
                for (int w : succ[v]) {
                    if (semi[w] == 0) {
                        parent[w] = v;
                        dfs(w);
                    }
                    pred[w].add(v);
                }
            }

            void compress(int v) {
                if (ancestor[ancestor[v]] != 0) {
                    compress(ancestor[v]);
                    if (semi[label[ancestor[v]]] < semi[label[v]]) {
                        label[v] = label[ancestor[v]];
                    }
                    ancestor[v] = ancestor[ancestor[v]];
                }
            }

            int eval(int v) {
                if (ancestor[v] == 0) {
                    return label[v];
                }
                compress(v);
                return semi[label[ancestor[v]]] >= semi[label[v]]
                        ? label[v]
                        : label[ancestor[v]];
            }

            void link(int v, int w) {
                int s = w;
                while (semi[label[w]] < semi[label[child[s]]]) {
                    if (size[s] + size[child[child[s]]] >= 2 * size[child[s]]) {
                        ancestor[child[s]] = s;
                        child[s] = child[child[s]];
                    } else {
                        size[child[s]] = size[s];
                        s = ancestor[s] = child[s];
                    }
                }
                label[s] = label[w];
                size[v] += size[w];
                if (size[v] < 2 * size[w]) {
                    int t = s;
                    s = child[v];
                    child[v] = t;
                }
                while (s != 0) {
                    ancestor[s] = v;
                    s = child[s];
                }
            }

            int vertexOf(BasicBlock block) {
                return block.getExtOrThrow(CommonExts.BLOCK_INDEX) + 1;
            }

            void run() {
                for (int v = 1; v <= total; v++) {
                    List<BasicBlock> targets = ControlFlow.successors(blocks.get(v - 1));
                    succ[v] = new int[targets.size()];
                    for (int j = 0; j < succ[v].length; j++) {
                        succ[v][j] = vertexOf(targets.get(j));
                    }
                    pred[v] = new HashSet<>();
                    bucket[v] = new HashSet<>();
                }

                int u, w;
                n = 0;
                dfs(1);
                size[0] = label[0] = semi[0] = 0;
                for (int i = n; i >= 2; i--) {
                    w = vertex[i];
                    for (int v : pred[w]) {
                        u = eval(v);
                        if (semi[u] < semi[w]) {
                            semi[w] = semi[u];
                        }
                    }
                    bucket[vertex[semi[w]]].add(w);
                    link(parent[w], w);
                    for (int v : bucket[parent[w]]) {
                        u = eval(v);
                        dom[v] = semi[u] < semi[v] ? u : parent[w];
                    }
                    bucket[parent[w]].clear();
                }
                for (int i = 2; i <= n; ++i) {
                    w = vertex[i];
                    if (dom[w] != vertex[semi[w]]) {
                        dom[w] = dom[dom[w]];
                    }
                }
                dom[1] = 0;

                for (int v = 1; v <= total; v++) {
                    BasicBlock block = blocks.get(v - 1);
                    if (v != 1 && reached[v]) {
                        block.attachExt(CommonExts.IDOM, blocks.get(dom[v] - 1));
                    } else {
                        block.removeExt(CommonExts.IDOM);
                    }
                }
            }
        }
        for (BasicBlock block : func.blocks) {
            block.removeExt(CommonExts.IDOM);
        }
        new Runner().run();

        ms.validate(MetadataState.DOMS);
    }
}
