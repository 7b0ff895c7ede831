package org.refactor.flowgraph.cfg;

import org.refactor.flowgraph.model.FlowGraph;

import java.util.List;

/**
 * CFG 构建结果
 *
 * @param entryId  METHOD_ENTRY 节点 id
 * @param exitId   METHOD_EXIT 节点 id
 * @param warnings 分类器降级产生的告警
 */
public record CfgResult(FlowGraph graph, String entryId, String exitId, List<String> warnings) {

    public CfgResult {
        warnings = List.copyOf(warnings);
    }
}
