package org.refactor.flowgraph.encode;

import org.refactor.flowgraph.GraphConfig;
import org.refactor.flowgraph.model.FlowGraph;
import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把一张图编码成三种视图：边列表、邻接矩阵、DFS token 序列。
 * <p>
 * 三种视图都只依赖节点创建顺序和边插入顺序，同一张图编码两次结果完全一致。
 */
public class GraphEncoder {

    public static final String UNREACHABLE_TOKEN = "[UNREACHABLE]";
    public static final String TRUNCATED_TOKEN = "...";

    private final int maxCodeTokens;
    private final boolean edgeTokens;

    public GraphEncoder(int maxCodeTokens, boolean edgeTokens) {
        this.maxCodeTokens = maxCodeTokens;
        this.edgeTokens = edgeTokens;
    }

    public GraphEncoder(GraphConfig config) {
        this(config.sequenceMaxCodeTokens(), config.sequenceEdgeTokens());
    }

    public GraphEncoding encode(FlowGraph graph) {
        return new GraphEncoding(edgeList(graph), adjacencyMatrix(graph), sequence(graph));
    }

    public EdgeListView edgeList(FlowGraph graph) {
        return new EdgeListView(graph.nodes(), graph.edges(), graph.nodeCount(), graph.edgeCount());
    }

    public AdjacencyMatrixView adjacencyMatrix(FlowGraph graph) {
        int n = graph.nodeCount();
        Map<String, Integer> index = graph.indexById();

        List<String> ids = new ArrayList<>(n);
        List<String> kinds = new ArrayList<>(n);
        for (GraphNode node : graph.nodes()) {
            ids.add(node.id());
            kinds.add(node.kind().name());
        }

        List<List<Integer>> matrix = new ArrayList<>(n);
        List<List<String>> edgeKinds = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            matrix.add(new ArrayList<>(Collections.nCopies(n, 0)));
            edgeKinds.add(new ArrayList<>(Collections.nCopies(n, "")));
        }

        for (GraphEdge e : graph.edges()) {
            Integer row = index.get(e.source());
            Integer col = index.get(e.target());
            if (row == null || col == null || matrix.get(row).get(col) == 1) {
                continue;
            }
            matrix.get(row).set(col, 1);
            edgeKinds.get(row).set(col, e.kind().name());
        }
        return new AdjacencyMatrixView(ids, kinds, matrix, edgeKinds);
    }

    /**
     * 从每个 ENTRY / METHOD_ENTRY 节点出发做深度优先遍历，出边按插入顺序展开；
     * 遍历完仍未访问的节点按创建顺序追加，前面加 {@link #UNREACHABLE_TOKEN}。
     */
    public SequenceView sequence(FlowGraph graph) {
        Map<String, List<GraphEdge>> succ = graph.adjacency(false);
        Map<String, Integer> index = graph.indexById();

        List<String> tokens = new ArrayList<>();
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (GraphNode root : graph.nodes()) {
            if (root.kind().isRoot() && !visited.contains(root.id())) {
                traverse(graph, root, succ, index, visited, tokens, order);
            }
        }

        List<String> unreachable = new ArrayList<>();
        for (GraphNode node : graph.nodes()) {
            if (visited.add(node.id())) {
                unreachable.add(node.id());
                order.add(node.id());
                tokens.add(UNREACHABLE_TOKEN);
                appendNodeTokens(node, tokens);
            }
        }
        return new SequenceView(SequenceView.DFS, tokens, order, unreachable);
    }

    private void traverse(FlowGraph graph, GraphNode root, Map<String, List<GraphEdge>> succ,
                          Map<String, Integer> index, Set<String> visited,
                          List<String> tokens, List<String> order) {
        // 显式栈模拟递归：每一帧记录节点和下一条要展开的出边
        Deque<int[]> stack = new ArrayDeque<>();
        List<GraphNode> nodes = graph.nodes();

        visit(root, visited, tokens, order);
        stack.push(new int[]{index.get(root.id()), 0});

        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            List<GraphEdge> out = succ.getOrDefault(nodes.get(frame[0]).id(), List.of());
            if (frame[1] >= out.size()) {
                stack.pop();
                continue;
            }
            GraphEdge edge = out.get(frame[1]++);
            Integer target = index.get(edge.target());
            if (target == null || visited.contains(edge.target())) {
                continue;
            }
            if (edgeTokens) {
                tokens.add("[EDGE:" + edge.kind().name() + "]");
            }
            visit(nodes.get(target), visited, tokens, order);
            stack.push(new int[]{target, 0});
        }
    }

    private void visit(GraphNode node, Set<String> visited, List<String> tokens, List<String> order) {
        visited.add(node.id());
        order.add(node.id());
        appendNodeTokens(node, tokens);
    }

    private void appendNodeTokens(GraphNode node, List<String> tokens) {
        tokens.add("[" + node.kind().name() + "]");

        List<String> code = CodeTokenizer.tokenize(node.code());
        if (code.size() > maxCodeTokens) {
            tokens.addAll(code.subList(0, maxCodeTokens));
            tokens.add(TRUNCATED_TOKEN);
        } else {
            tokens.addAll(code);
        }

        for (String v : node.defs()) {
            tokens.add("[DEF:" + v + "]");
        }
        for (String v : node.uses()) {
            tokens.add("[USE:" + v + "]");
        }
    }
}
