package org.refactor.flowgraph.ddg;

import org.refactor.flowgraph.DdgBuildException;
import org.refactor.flowgraph.model.EdgeKind;
import org.refactor.flowgraph.model.FlowGraph;
import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 构建数据依赖图 (DDG)。
 * <p>
 * 不做迭代式的数据流不动点：对每个定义点 N 和它定义的每个变量 v，沿 CFG 控制边从 N 的后继开始做广度优先搜索，
 * 遇到重新定义 v 的节点就停止该路径。路径上每个使用 v 的节点得到一条 DATA_DEP 边；
 * 每条路径上第一个使用点额外得到一条 DEF_USE 边。
 * <p>
 * 搜索状态是 (节点, 该路径上是否已经遇到过使用)，visited 集合保证在 LOOP_BACK 回边上终止。
 */
public class DdgBuilder {

    private static final Logger log = LoggerFactory.getLogger(DdgBuilder.class);

    /**
     * @throws DdgBuildException CFG 的边指向不存在的节点时
     */
    public FlowGraph build(FlowGraph cfg) {
        List<GraphNode> nodes = new ArrayList<>(cfg.nodeCount());
        for (GraphNode n : cfg.nodes()) {
            nodes.add(n.copy());
        }

        Map<String, List<GraphEdge>> succ = cfg.adjacency(true);
        for (GraphEdge e : cfg.edges()) {
            if (!succ.containsKey(e.target())) {
                throw new DdgBuildException("Edge " + e.source() + " -> " + e.target() + " points to an unknown node");
            }
        }

        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode n : cfg.nodes()) {
            byId.put(n.id(), n);
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (GraphNode def : cfg.nodes()) {
            for (String variable : def.defs()) {
                collectDependencies(def, variable, succ, byId, edges);
            }
        }

        log.debug("DDG: {} data edges over {} nodes", edges.size(), nodes.size());
        return new FlowGraph(nodes, edges);
    }

    private void collectDependencies(GraphNode def, String variable, Map<String, List<GraphEdge>> succ,
                                     Map<String, GraphNode> byId, List<GraphEdge> out) {
        Set<SearchState> visited = new HashSet<>();
        Set<String> dataDeps = new HashSet<>();
        Set<String> defUses = new HashSet<>();
        Deque<SearchState> queue = new ArrayDeque<>();

        for (GraphEdge e : succ.get(def.id())) {
            enqueue(new SearchState(e.target(), false), visited, queue);
        }

        while (!queue.isEmpty()) {
            SearchState state = queue.poll();
            GraphNode node = byId.get(state.nodeId());

            boolean seenUse = state.seenUse();
            if (node.usesVariable(variable)) {
                if (dataDeps.add(node.id())) {
                    out.add(GraphEdge.data(def.id(), node.id(), EdgeKind.DATA_DEP, variable));
                }
                if (!seenUse && defUses.add(node.id())) {
                    out.add(GraphEdge.data(def.id(), node.id(), EdgeKind.DEF_USE, variable));
                }
                seenUse = true;
            }

            // 重新定义 v：这条路径上 def 的值被覆盖
            if (node.defines(variable)) {
                continue;
            }

            for (GraphEdge e : succ.get(node.id())) {
                enqueue(new SearchState(e.target(), seenUse), visited, queue);
            }
        }
    }

    private static void enqueue(SearchState state, Set<SearchState> visited, Deque<SearchState> queue) {
        if (visited.add(state)) {
            queue.add(state);
        }
    }

    private record SearchState(String nodeId, boolean seenUse) {
    }
}
