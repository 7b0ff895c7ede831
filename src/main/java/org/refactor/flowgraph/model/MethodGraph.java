package org.refactor.flowgraph.model;

import java.util.List;
import java.util.Objects;

/**
 * 一个方法的分析结果：方法身份 + CFG + DDG。
 * <p>
 * CFG 与 DDG 的节点 id 一一对应，但不共享节点对象，调用方可以按 id 把 DDG 边映射回 CFG。
 *
 * @param lineStart 方法声明起始行，未知时为 null
 * @param lineEnd   方法声明结束行，未知时为 null
 * @param warnings  构建过程中的告警（无法识别的语句等）
 */
public record MethodGraph(
        String name,
        String className,
        List<String> parameters,
        List<String> parameterTypes,
        String returnType,
        Integer lineStart,
        Integer lineEnd,
        boolean constructor,
        FlowGraph cfg,
        FlowGraph ddg,
        List<String> warnings) {

    public MethodGraph {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(ddg, "ddg");
        className = className == null ? "" : className;
        parameters = List.copyOf(parameters);
        parameterTypes = List.copyOf(parameterTypes);
        returnType = returnType == null ? "void" : returnType;
        warnings = List.copyOf(warnings);
    }

    public String signature() {
        return name + "(" + String.join(", ", parameterTypes) + ")";
    }
}
