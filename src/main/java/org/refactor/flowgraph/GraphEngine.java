package org.refactor.flowgraph;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.refactor.flowgraph.aggregate.ClassGraphAggregator;
import org.refactor.flowgraph.encode.GraphEncoder;
import org.refactor.flowgraph.model.ClassGraph;
import org.refactor.flowgraph.model.MethodGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 引擎入口：{@code build(ast, options)}。
 * <p>
 * AST -> 分类器 -> CFG -> DDG -> 编码器 -> 聚合器，单向流动。
 * 任何异常都不会穿过这里：单个方法失败记为 error 并跳过，其余方法照常输出。
 */
public class GraphEngine {

    private static final Logger log = LoggerFactory.getLogger(GraphEngine.class);

    private final GraphConfig config;
    private final MethodAnalyzer analyzer;
    private final GraphEncoder encoder;
    private final ClassGraphAggregator aggregator;

    public GraphEngine() {
        this(GraphConfig.load());
    }

    public GraphEngine(GraphConfig config) {
        this(config, new MethodAnalyzer(config));
    }

    GraphEngine(GraphConfig config, MethodAnalyzer analyzer) {
        this.config = config;
        this.analyzer = analyzer;
        this.encoder = new GraphEncoder(config);
        this.aggregator = new ClassGraphAggregator(config);
    }

    public GraphConfig getConfig() {
        return config;
    }

    public AnalysisResult build(TypeDeclaration<?> type) {
        return build(type, config.defaultOptions());
    }

    /**
     * 分析一个类（或接口、枚举、record）中直接声明的所有方法和构造器：先方法后构造器，各自按声明顺序
     */
    public AnalysisResult build(TypeDeclaration<?> type, BuildOptions options) {
        String className = type.getNameAsString();
        List<CallableDeclaration<?>> callables = new ArrayList<>(type.getMethods());
        callables.addAll(type.getConstructors());
        if (callables.isEmpty()) {
            log.warn("No methods or constructors found in {}", className);
            return AnalysisResult.failure(className, List.of("No methods or constructors found in class " + className));
        }
        return buildAll(className, callables, options);
    }

    /**
     * 分析单个方法或构造器
     */
    public AnalysisResult build(CallableDeclaration<?> callable, BuildOptions options) {
        String className = callable.findAncestor(TypeDeclaration.class)
                .map(t -> t.getNameAsString())
                .orElse("");
        return buildAll(className, List.of(callable), options);
    }

    private AnalysisResult buildAll(String className, List<CallableDeclaration<?>> callables, BuildOptions options) {
        try {
            List<MethodGraph> graphs = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            List<String> warnings = new ArrayList<>();

            for (CallableDeclaration<?> callable : callables) {
                String name = callable.getNameAsString();
                try {
                    MethodGraph graph = analyzer.analyze(callable, className);
                    graphs.add(graph);
                    warnings.addAll(graph.warnings());
                    log.debug("Built graphs for {}.{}: cfg {} nodes, ddg {} edges",
                            className, graph.signature(), graph.cfg().nodeCount(), graph.ddg().edgeCount());
                } catch (GraphBuildException e) {
                    String message = "Error processing method " + name + ": " + e.getMessage();
                    errors.add(message);
                    log.warn(message);
                } catch (RuntimeException | StackOverflowError | LinkageError e) {
                    // 嵌套过深或缺少运行时类，同样只影响当前方法
                    String message = "Error processing method " + name + ": " + e;
                    errors.add(message);
                    log.warn(message, e);
                }
            }

            if (graphs.isEmpty()) {
                return new AnalysisResult(false, className, 0, List.of(), null, errors, warnings, List.of(), null);
            }

            List<MethodGraphOutput> methodOutputs = new ArrayList<>();
            if (options.includeMethodGraphs()) {
                for (MethodGraph graph : graphs) {
                    methodOutputs.add(MethodGraphOutput.of(graph, encoder));
                }
            }

            ClassGraph classGraph = null;
            ClassGraphOutput classOutput = null;
            if (options.includeClassGraph()) {
                classGraph = aggregator.aggregate(className, graphs);
                classOutput = ClassGraphOutput.of(classGraph, encoder);
            }

            return new AnalysisResult(true, className, graphs.size(), methodOutputs, classOutput,
                    errors, warnings, graphs, classGraph);
        } catch (RuntimeException | LinkageError e) {
            log.error("Failed to build graphs for {}", className, e);
            return AnalysisResult.failure(className, List.of("Failed to build graphs for " + className + ": " + e));
        }
    }
}
