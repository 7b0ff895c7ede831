package org.refactor.flowgraph;

/**
 * DDG 构建失败（CFG 中出现了不存在的节点等）
 */
public class DdgBuildException extends GraphBuildException {

    public DdgBuildException(String message) {
        super(message);
    }
}
