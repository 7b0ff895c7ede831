package org.refactor.flowgraph.encode;

import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把编码视图转换成模型可以直接消费的数值特征（COO 边索引、token id、稀疏矩阵）。
 * 词表按首次出现的顺序分配 id。
 */
public final class TransformerFeatures {

    public static final String PAD = "[PAD]";
    public static final String UNK = "[UNK]";
    public static final String CLS = "[CLS]";
    public static final String SEP = "[SEP]";

    private TransformerFeatures() {
    }

    /**
     * 图神经网络输入：节点种类 id + COO 格式的边索引
     *
     * @param edgeIndex 两行：第一行是源节点下标，第二行是目标节点下标
     */
    public record GraphTensors(
            int numNodes,
            int numEdges,
            List<Integer> nodeTypeIds,
            List<List<Integer>> edgeIndex,
            List<Integer> edgeTypeIds,
            Map<String, Integer> nodeTypeVocab,
            Map<String, Integer> edgeTypeVocab) {
    }

    public record TokenIds(List<String> tokens, List<Integer> tokenIds, Map<String, Integer> vocab, int vocabSize) {
    }

    /**
     * @param nnz 非零元素个数（平行边各算一个）
     */
    public record SparseCoo(
            String format,
            List<Integer> shape,
            List<Integer> row,
            List<Integer> col,
            List<String> edgeTypes,
            int nnz) {
    }

    public static GraphTensors fromEdgeList(EdgeListView view) {
        Map<String, Integer> nodeVocab = new LinkedHashMap<>();
        Map<String, Integer> index = new LinkedHashMap<>();
        List<Integer> nodeTypeIds = new ArrayList<>();
        for (GraphNode node : view.nodes()) {
            index.put(node.id(), index.size());
            nodeTypeIds.add(idOf(nodeVocab, node.kind().name()));
        }

        Map<String, Integer> edgeVocab = new LinkedHashMap<>();
        List<Integer> sources = new ArrayList<>();
        List<Integer> targets = new ArrayList<>();
        List<Integer> edgeTypeIds = new ArrayList<>();
        for (GraphEdge edge : view.edges()) {
            Integer s = index.get(edge.source());
            Integer t = index.get(edge.target());
            if (s == null || t == null) {
                continue;
            }
            sources.add(s);
            targets.add(t);
            edgeTypeIds.add(idOf(edgeVocab, edge.kind().name()));
        }

        return new GraphTensors(view.nodeCount(), sources.size(), List.copyOf(nodeTypeIds),
                List.of(List.copyOf(sources), List.copyOf(targets)), List.copyOf(edgeTypeIds),
                Collections.unmodifiableMap(nodeVocab), Collections.unmodifiableMap(edgeVocab));
    }

    public static TokenIds fromSequence(SequenceView view) {
        Map<String, Integer> vocab = new LinkedHashMap<>();
        for (String special : List.of(PAD, UNK, CLS, SEP)) {
            idOf(vocab, special);
        }
        List<Integer> ids = new ArrayList<>(view.tokens().size());
        for (String token : view.tokens()) {
            ids.add(idOf(vocab, token));
        }
        return new TokenIds(view.tokens(), List.copyOf(ids), Collections.unmodifiableMap(vocab), vocab.size());
    }

    public static SparseCoo toSparse(EdgeListView view) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (GraphNode node : view.nodes()) {
            index.put(node.id(), index.size());
        }
        List<Integer> rows = new ArrayList<>();
        List<Integer> cols = new ArrayList<>();
        List<String> types = new ArrayList<>();
        for (GraphEdge edge : view.edges()) {
            Integer s = index.get(edge.source());
            Integer t = index.get(edge.target());
            if (s != null && t != null) {
                rows.add(s);
                cols.add(t);
                types.add(edge.kind().name());
            }
        }
        int n = view.nodes().size();
        return new SparseCoo("COO", List.of(n, n), List.copyOf(rows), List.copyOf(cols), List.copyOf(types),
                rows.size());
    }

    private static int idOf(Map<String, Integer> vocab, String key) {
        return vocab.computeIfAbsent(key, k -> vocab.size());
    }
}
