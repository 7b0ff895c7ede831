package org.refactor.flowgraph.aggregate;

import org.refactor.flowgraph.GraphConfig;
import org.refactor.flowgraph.model.ClassGraph;
import org.refactor.flowgraph.model.FlowGraph;
import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;
import org.refactor.flowgraph.model.MethodGraph;
import org.refactor.flowgraph.model.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 把一个类的所有方法图合成一张类级图：节点 id 加上 {@code name#index/} 前缀后做不相交并集，
 * 方法之间不产生任何边。
 */
public class ClassGraphAggregator {

    public static final String META_METHOD_BOUNDARY = "methodBoundary";
    public static final String META_METHOD = "method";
    public static final String META_MEMBER_COUNT = "memberCount";

    private final boolean boundaryNodes;

    public ClassGraphAggregator(boolean boundaryNodes) {
        this.boundaryNodes = boundaryNodes;
    }

    public ClassGraphAggregator(GraphConfig config) {
        this(config.classGraphBoundaryNodes());
    }

    /**
     * 方法键：名字 + 在类中的位置，重载方法因此互不冲突
     */
    public static String methodKey(MethodGraph method, int index) {
        return method.name() + "#" + index;
    }

    public ClassGraph aggregate(String className, List<MethodGraph> methods) {
        List<String> keys = new ArrayList<>(methods.size());
        for (int i = 0; i < methods.size(); i++) {
            keys.add(methodKey(methods.get(i), i));
        }
        FlowGraph cfg = union(methods, keys, MethodGraph::cfg);
        FlowGraph ddg = union(methods, keys, MethodGraph::ddg);
        return new ClassGraph(className, keys, cfg, ddg);
    }

    private FlowGraph union(List<MethodGraph> methods, List<String> keys, Function<MethodGraph, FlowGraph> part) {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        for (int i = 0; i < methods.size(); i++) {
            MethodGraph method = methods.get(i);
            String key = keys.get(i);
            FlowGraph graph = part.apply(method);

            if (boundaryNodes) {
                nodes.add(boundaryNode(key, method, graph.nodeCount()));
            }
            for (GraphNode n : graph.nodes()) {
                nodes.add(n.withId(key + "/" + n.id()));
            }
            for (GraphEdge e : graph.edges()) {
                edges.add(e.withEndpoints(key + "/" + e.source(), key + "/" + e.target()));
            }
        }
        return new FlowGraph(nodes, edges);
    }

    private GraphNode boundaryNode(String key, MethodGraph method, int memberCount) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(META_METHOD_BOUNDARY, true);
        meta.put(META_METHOD, method.name());
        meta.put(META_MEMBER_COUNT, memberCount);
        return new GraphNode(key, NodeKind.ENTRY, "METHOD: " + method.signature(), null, Set.of(), Set.of(), meta);
    }
}
