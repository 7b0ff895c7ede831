package org.refactor.flowgraph.classify;

/**
 * 语句的语义类别，写入节点 metadata 的 {@code statementType}
 */
public enum StatementCategory {
    DECLARATION,
    ASSIGNMENT,
    METHOD_CALL,
    EXPRESSION,
    CONDITION,
    LOOP,
    SWITCH,
    CASE,
    RETURN,
    THROW,
    TRY,
    CATCH,
    FINALLY,
    STATEMENT,
    UNKNOWN
}
