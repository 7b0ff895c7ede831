package org.refactor.flowgraph.model;

/**
 * 图节点的种类（封闭集合，构建器和编码器都对它做穷举 switch）
 */
public enum NodeKind {
    ENTRY,
    EXIT,
    METHOD_ENTRY,
    METHOD_EXIT,
    CONDITION,
    LOOP_HEADER,
    STATEMENT,
    RETURN,
    THROW,
    CATCH,
    TRY,
    FINALLY,
    SWITCH,
    CASE;

    /**
     * 遍历（DFS 序列化）可以从该种类的节点开始
     */
    public boolean isRoot() {
        return switch (this) {
            case ENTRY, METHOD_ENTRY -> true;
            case EXIT, METHOD_EXIT, CONDITION, LOOP_HEADER, STATEMENT, RETURN, THROW,
                    CATCH, TRY, FINALLY, SWITCH, CASE -> false;
        };
    }
}
