package org.refactor.flowgraph.encode;

import java.util.List;

/**
 * 稠密邻接矩阵视图，行列按节点创建顺序排列。
 * <p>
 * 每个格子只记录 i -> j 的第一条边，平行边在这个视图里会丢失。
 *
 * @param matrix    有边为 1，否则为 0
 * @param edgeKinds 第一条边的种类名，没有边时为空串
 */
public record AdjacencyMatrixView(
        List<String> nodeIds,
        List<String> nodeKinds,
        List<List<Integer>> matrix,
        List<List<String>> edgeKinds) {

    public AdjacencyMatrixView {
        nodeIds = List.copyOf(nodeIds);
        nodeKinds = List.copyOf(nodeKinds);
        matrix = matrix.stream().map(List::copyOf).toList();
        edgeKinds = edgeKinds.stream().map(List::copyOf).toList();
    }

    public int size() {
        return nodeIds.size();
    }

    public String kindAt(int row, int column) {
        return edgeKinds.get(row).get(column);
    }
}
