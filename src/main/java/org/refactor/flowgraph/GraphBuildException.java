package org.refactor.flowgraph;

/**
 * 图构建过程中所有异常的基类。引擎边界会把它们转换成结果里的 error 条目，不会继续向外抛出。
 */
public class GraphBuildException extends RuntimeException {

    private final String details;

    public GraphBuildException(String message) {
        this(message, null, null);
    }

    public GraphBuildException(String message, String details) {
        this(message, details, null);
    }

    public GraphBuildException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public GraphBuildException(String message, String details, Throwable cause) {
        super(message, cause);
        this.details = details;
    }

    public String getDetails() {
        return details;
    }
}
