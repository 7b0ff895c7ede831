package org.refactor.flowgraph;

import org.refactor.flowgraph.encode.GraphEncoder;
import org.refactor.flowgraph.encode.GraphEncoding;
import org.refactor.flowgraph.model.MethodGraph;

import java.util.List;

/**
 * 方法图的输出形式：方法身份 + CFG / DDG 的三种编码
 */
public record MethodGraphOutput(
        String name,
        String className,
        String signature,
        List<String> parameters,
        List<String> parameterTypes,
        String returnType,
        Integer lineStart,
        Integer lineEnd,
        boolean constructor,
        GraphEncoding cfg,
        GraphEncoding ddg,
        List<String> warnings) {

    public static MethodGraphOutput of(MethodGraph graph, GraphEncoder encoder) {
        return new MethodGraphOutput(
                graph.name(),
                graph.className(),
                graph.signature(),
                graph.parameters(),
                graph.parameterTypes(),
                graph.returnType(),
                graph.lineStart(),
                graph.lineEnd(),
                graph.constructor(),
                encoder.encode(graph.cfg()),
                encoder.encode(graph.ddg()),
                graph.warnings());
    }
}
