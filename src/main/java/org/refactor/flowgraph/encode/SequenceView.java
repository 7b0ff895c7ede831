package org.refactor.flowgraph.encode;

import java.util.List;

/**
 * 深度优先遍历得到的 token 序列
 *
 * @param tokens            完整 token 流
 * @param nodeSequence      节点的访问顺序，每个节点恰好出现一次
 * @param unreachableNodeIds 从入口出发访问不到、追加在末尾的节点
 */
public record SequenceView(
        String traversalType,
        List<String> tokens,
        List<String> nodeSequence,
        List<String> unreachableNodeIds) {

    public static final String DFS = "DFS";

    public SequenceView {
        tokens = List.copyOf(tokens);
        nodeSequence = List.copyOf(nodeSequence);
        unreachableNodeIds = List.copyOf(unreachableNodeIds);
    }

    public int length() {
        return nodeSequence.size();
    }
}
