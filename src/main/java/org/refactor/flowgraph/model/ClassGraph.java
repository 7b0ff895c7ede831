package org.refactor.flowgraph.model;

import java.util.List;

/**
 * 类级别的图：各方法图的不相交并集，节点 id 带方法前缀。构建后不再修改。
 *
 * @param methodKeys 参与聚合的方法键（{@code name#index}），按声明顺序
 */
public record ClassGraph(String className, List<String> methodKeys, FlowGraph cfg, FlowGraph ddg) {

    public ClassGraph {
        methodKeys = List.copyOf(methodKeys);
    }
}
