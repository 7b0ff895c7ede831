package org.refactor.flowgraph;

/**
 * 方法体无法构建 CFG（例如 break/continue 找不到目标）
 */
public class CfgBuildException extends GraphBuildException {

    public CfgBuildException(String message) {
        super(message);
    }

    public CfgBuildException(String message, String details) {
        super(message, details);
    }
}
