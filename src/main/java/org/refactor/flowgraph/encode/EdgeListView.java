package org.refactor.flowgraph.encode;

import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;

import java.util.List;

/**
 * 边列表视图：节点和边原样输出，加上数量
 */
public record EdgeListView(List<GraphNode> nodes, List<GraphEdge> edges, int nodeCount, int edgeCount) {

    public EdgeListView {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
