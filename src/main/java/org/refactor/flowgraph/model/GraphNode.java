package org.refactor.flowgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 图中的一个节点（语句、条件、循环头、catch 子句或合成的入口/出口），构建后不可变。
 *
 * @param id       图内唯一的编号
 * @param kind     节点种类
 * @param code     语句源码片段
 * @param position 起始位置，合成节点为 null
 * @param defs     定义的变量（保持源码顺序）
 * @param uses     使用的变量（保持源码顺序）
 * @param metadata 与节点种类相关的附加信息
 */
public record GraphNode(
        String id,
        NodeKind kind,
        String code,
        SourcePosition position,
        Set<String> defs,
        Set<String> uses,
        Map<String, Object> metadata) {

    public static final String META_UNREACHABLE = "unreachable";
    public static final String META_STATEMENT_TYPE = "statementType";

    public GraphNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        code = Optional.ofNullable(code).orElse("");
        defs = defs == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(defs));
        uses = uses == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(uses));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<SourcePosition> sourcePosition() {
        return Optional.ofNullable(position);
    }

    public boolean defines(String variable) {
        return defs.contains(variable);
    }

    public boolean usesVariable(String variable) {
        return uses.contains(variable);
    }

    public boolean isUnreachable() {
        return Boolean.TRUE.equals(metadata.get(META_UNREACHABLE));
    }

    /**
     * 内容相同的新实例（DDG 与 CFG 不共享节点对象）
     */
    public GraphNode copy() {
        return new GraphNode(id, kind, code, position, defs, uses, metadata);
    }

    /**
     * 换一个 id，其余不变（类级聚合时加前缀用）
     */
    public GraphNode withId(String newId) {
        return new GraphNode(newId, kind, code, position, defs, uses, metadata);
    }
}
