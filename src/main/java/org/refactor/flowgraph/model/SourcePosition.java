package org.refactor.flowgraph.model;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;

import java.util.Optional;

/**
 * 源码位置（行、列，从 1 开始）
 */
public record SourcePosition(int line, int column) {

    public static Optional<SourcePosition> of(Node node) {
        return node.getBegin().map(SourcePosition::of);
    }

    public static SourcePosition of(Position position) {
        return new SourcePosition(position.line, position.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
