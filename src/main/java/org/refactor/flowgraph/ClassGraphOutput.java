package org.refactor.flowgraph;

import org.refactor.flowgraph.encode.GraphEncoder;
import org.refactor.flowgraph.encode.GraphEncoding;
import org.refactor.flowgraph.model.ClassGraph;

import java.util.List;

public record ClassGraphOutput(String className, List<String> methodKeys, GraphEncoding cfg, GraphEncoding ddg) {

    public static ClassGraphOutput of(ClassGraph graph, GraphEncoder encoder) {
        return new ClassGraphOutput(graph.className(), graph.methodKeys(),
                encoder.encode(graph.cfg()), encoder.encode(graph.ddg()));
    }
}
