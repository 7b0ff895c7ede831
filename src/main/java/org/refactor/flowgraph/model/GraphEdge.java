package org.refactor.flowgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 有向边。同一对节点之间可以存在多条不同种类的边，不做去重。
 *
 * @param variable 依赖所针对的变量，只有数据依赖边才有
 */
public record GraphEdge(
        String source,
        String target,
        EdgeKind kind,
        String label,
        String variable,
        Map<String, Object> metadata) {

    public GraphEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        label = Optional.ofNullable(label).orElse("");
        if (kind.isControl() && variable != null) {
            throw new IllegalArgumentException("control edge " + kind + " cannot carry a variable");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static GraphEdge control(String source, String target, EdgeKind kind, String label) {
        return new GraphEdge(source, target, kind, label, null, null);
    }

    public static GraphEdge data(String source, String target, EdgeKind kind, String variable) {
        Objects.requireNonNull(variable, "variable");
        return new GraphEdge(source, target, kind, "dep:" + variable, variable, null);
    }

    public Optional<String> dependencyVariable() {
        return Optional.ofNullable(variable);
    }

    public GraphEdge withEndpoints(String newSource, String newTarget) {
        return new GraphEdge(newSource, newTarget, kind, label, variable, metadata);
    }
}
