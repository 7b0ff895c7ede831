package org.refactor.flowgraph.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 一组节点 + 一组边（CFG 或 DDG）。
 * <p>
 * 节点按创建顺序、边按插入顺序保存，编码器依赖这两个顺序。
 */
public record FlowGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

    public FlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public static FlowGraph empty() {
        return new FlowGraph(List.of(), List.of());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Optional<GraphNode> node(String id) {
        for (GraphNode n : nodes) {
            if (n.id().equals(id)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    public List<GraphNode> nodesOfKind(NodeKind kind) {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode n : nodes) {
            if (n.kind() == kind) {
                result.add(n);
            }
        }
        return result;
    }

    public List<GraphEdge> edgesOfKind(EdgeKind kind) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.kind() == kind) {
                result.add(e);
            }
        }
        return result;
    }

    public List<GraphEdge> outgoing(String id) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.source().equals(id)) {
                result.add(e);
            }
        }
        return result;
    }

    public List<GraphEdge> incoming(String id) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge e : edges) {
            if (e.target().equals(id)) {
                result.add(e);
            }
        }
        return result;
    }

    /**
     * 节点 id -> 出边列表（按边插入顺序）
     *
     * @param controlOnly 为 true 时只保留控制流边
     */
    public Map<String, List<GraphEdge>> adjacency(boolean controlOnly) {
        Map<String, List<GraphEdge>> succ = new LinkedHashMap<>();
        for (GraphNode n : nodes) {
            succ.put(n.id(), new ArrayList<>());
        }
        for (GraphEdge e : edges) {
            if (controlOnly && !e.kind().isControl()) {
                continue;
            }
            succ.computeIfAbsent(e.source(), k -> new ArrayList<>()).add(e);
        }
        return succ;
    }

    /**
     * 节点 id -> 在 {@link #nodes()} 中的下标
     */
    public Map<String, Integer> indexById() {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i).id(), i);
        }
        return index;
    }
}
