package org.refactor.flowgraph.cfg;

import org.refactor.flowgraph.model.EdgeKind;

/**
 * 一条还没有目标的控制流边（源节点 + 边种类 + 标签）
 */
record PendingEdge(String source, EdgeKind kind, String label) {

    PendingEdge withKind(EdgeKind newKind) {
        return new PendingEdge(source, newKind, newKind == kind ? label : "");
    }
}
