package org.refactor.flowgraph;

import java.util.List;

/**
 * 源码在进入引擎之前就被拒绝（语法错误、为空、过长）
 */
public class SourceParseException extends GraphBuildException {

    private final List<String> problems;

    public SourceParseException(String message) {
        this(message, List.of());
    }

    public SourceParseException(String message, List<String> problems) {
        super(message, problems.isEmpty() ? null : String.join("\n", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
