package org.refactor.flowgraph.model;

/**
 * 边的种类：控制流边 + 数据依赖边
 */
public enum EdgeKind {
    SEQUENTIAL,
    TRUE_BRANCH,
    FALSE_BRANCH,
    LOOP_BACK,
    EXCEPTION,
    CASE_BRANCH,
    DEFAULT_BRANCH,
    DATA_DEP,
    DEF_USE;

    public boolean isControl() {
        return switch (this) {
            case SEQUENTIAL, TRUE_BRANCH, FALSE_BRANCH, LOOP_BACK, EXCEPTION,
                    CASE_BRANCH, DEFAULT_BRANCH -> true;
            case DATA_DEP, DEF_USE -> false;
        };
    }

    public boolean isData() {
        return !isControl();
    }
}
