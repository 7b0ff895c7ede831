package org.refactor.flowgraph.encode;

/**
 * 同一张图的三种视图，都由图推导而来
 */
public record GraphEncoding(EdgeListView edgeList, AdjacencyMatrixView adjacencyMatrix, SequenceView sequence) {
}
