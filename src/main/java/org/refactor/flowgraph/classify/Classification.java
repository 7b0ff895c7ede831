package org.refactor.flowgraph.classify;

import org.refactor.flowgraph.model.NodeKind;
import org.refactor.flowgraph.model.SourcePosition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 对单个 AST 节点的分类结果，CFG 构建器据此创建图节点
 *
 * @param position 源码位置，未知时为 null
 * @param warning  无法识别的结构会带上一条告警，否则为 null
 */
public record Classification(
        NodeKind kind,
        StatementCategory category,
        String code,
        SourcePosition position,
        Set<String> defs,
        Set<String> uses,
        Map<String, Object> metadata,
        String warning) {

    public Classification {
        defs = Collections.unmodifiableSet(new LinkedHashSet<>(defs));
        uses = Collections.unmodifiableSet(new LinkedHashSet<>(uses));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<String> warningMessage() {
        return Optional.ofNullable(warning);
    }
}
