package org.refactor.flowgraph;

/**
 * {@code build(ast, options)} 的选项
 *
 * @param includeMethodGraphs 每个方法输出一张图
 * @param includeClassGraph   额外输出聚合后的类级图
 */
public record BuildOptions(boolean includeMethodGraphs, boolean includeClassGraph) {

    public static BuildOptions all() {
        return new BuildOptions(true, true);
    }

    public static BuildOptions methodsOnly() {
        return new BuildOptions(true, false);
    }
}
