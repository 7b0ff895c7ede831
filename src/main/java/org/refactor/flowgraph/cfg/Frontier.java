package org.refactor.flowgraph.cfg;

import org.refactor.flowgraph.model.EdgeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 前沿：等待连接到下一个节点的悬空边集合。
 * <p>
 * 不可变，按值在各语句处理步骤之间传递；顺序即插入顺序，保证边的生成顺序确定。
 */
final class Frontier {

    private static final Frontier EMPTY = new Frontier(List.of());

    private final List<PendingEdge> edges;

    private Frontier(List<PendingEdge> edges) {
        this.edges = edges;
    }

    static Frontier empty() {
        return EMPTY;
    }

    static Frontier of(String source) {
        return branch(source, EdgeKind.SEQUENTIAL, "");
    }

    static Frontier branch(String source, EdgeKind kind, String label) {
        return new Frontier(List.of(new PendingEdge(source, kind, label)));
    }

    Frontier union(Frontier other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<PendingEdge> merged = new ArrayList<>(edges);
        for (PendingEdge e : other.edges) {
            if (!merged.contains(e)) {
                merged.add(e);
            }
        }
        return new Frontier(List.copyOf(merged));
    }

    /**
     * 所有悬空边改成同一种类（回边、异常边）
     */
    Frontier withKind(EdgeKind kind) {
        List<PendingEdge> converted = new ArrayList<>(edges.size());
        for (PendingEdge e : edges) {
            PendingEdge c = e.withKind(kind);
            if (!converted.contains(c)) {
                converted.add(c);
            }
        }
        return new Frontier(List.copyOf(converted));
    }

    boolean isEmpty() {
        return edges.isEmpty();
    }

    List<PendingEdge> edges() {
        return edges;
    }

    @Override
    public String toString() {
        return edges.toString();
    }
}
