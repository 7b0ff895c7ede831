package org.refactor.flowgraph;

import org.refactor.flowgraph.model.ClassGraph;
import org.refactor.flowgraph.model.MethodGraph;

import java.util.List;
import java.util.Optional;

/**
 * 一次 {@code build} 调用的结果。
 * <p>
 * 无论成功与否都是结构完整的对象；失败的方法只出现在 {@link #getErrors()} 里，不影响其它方法。
 * 原始的图对象通过 transient 字段保留，不参与 JSON 序列化。
 */
public class AnalysisResult {

    private final boolean success;
    private final String className;
    private final int methodCount;
    private final List<MethodGraphOutput> methodGraphs;
    private final ClassGraphOutput classGraph;
    private final List<String> errors;
    private final List<String> warnings;

    private final transient List<MethodGraph> rawMethodGraphs;
    private final transient ClassGraph rawClassGraph;

    AnalysisResult(boolean success, String className, int methodCount,
                   List<MethodGraphOutput> methodGraphs, ClassGraphOutput classGraph,
                   List<String> errors, List<String> warnings,
                   List<MethodGraph> rawMethodGraphs, ClassGraph rawClassGraph) {
        this.success = success;
        this.className = className;
        this.methodCount = methodCount;
        this.methodGraphs = List.copyOf(methodGraphs);
        this.classGraph = classGraph;
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
        this.rawMethodGraphs = List.copyOf(rawMethodGraphs);
        this.rawClassGraph = rawClassGraph;
    }

    /**
     * 请求级失败：没有任何图
     */
    public static AnalysisResult failure(String className, List<String> errors) {
        return new AnalysisResult(false, className, 0, List.of(), null, errors, List.of(), List.of(), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getClassName() {
        return className;
    }

    public int getMethodCount() {
        return methodCount;
    }

    public List<MethodGraphOutput> getMethodGraphs() {
        return methodGraphs;
    }

    public Optional<ClassGraphOutput> getClassGraph() {
        return Optional.ofNullable(classGraph);
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<MethodGraph> getRawMethodGraphs() {
        return rawMethodGraphs;
    }

    public Optional<ClassGraph> getRawClassGraph() {
        return Optional.ofNullable(rawClassGraph);
    }

    public Optional<MethodGraph> rawMethodGraph(String name) {
        return rawMethodGraphs.stream().filter(g -> g.name().equals(name)).findFirst();
    }

    @Override
    public String toString() {
        return "AnalysisResult{className=" + className + ", success=" + success + ", methodCount=" + methodCount
                + ", errors=" + errors.size() + ", warnings=" + warnings.size() + "}";
    }
}
