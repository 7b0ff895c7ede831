package org.refactor.flowgraph;

import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;

/**
 * 引擎配置。
 * <p>
 * 从 classpath 上的 {@code flowgraph.properties} 读取，{@code flowgraph.} 前缀的系统属性优先。
 *
 * @param snippetMaxLength        节点源码片段的最大长度，0 表示不截断
 * @param sequenceMaxCodeTokens   序列化时每个节点最多输出多少个代码 token
 * @param sequenceEdgeTokens      序列化时是否输出 {@code [EDGE:KIND]} 分隔 token
 * @param classGraphBoundaryNodes 类级聚合时是否为每个方法加一个边界节点
 * @param sourceMaxLength         源码文本的最大字符数
 * @param includeMethodGraphs     默认是否输出方法级图
 * @param includeClassGraph       默认是否输出类级图
 */
public record GraphConfig(
        int snippetMaxLength,
        int sequenceMaxCodeTokens,
        boolean sequenceEdgeTokens,
        boolean classGraphBoundaryNodes,
        int sourceMaxLength,
        boolean includeMethodGraphs,
        boolean includeClassGraph) {

    private static final Logger log = LoggerFactory.getLogger(GraphConfig.class);

    public static final String RESOURCE = "flowgraph.properties";
    public static final String SYSTEM_PREFIX = "flowgraph";

    public static GraphConfig defaults() {
        return from(new BaseConfiguration());
    }

    public static GraphConfig load() {
        return load(RESOURCE);
    }

    public static GraphConfig load(String resource) {
        CompositeConfiguration composite = new CompositeConfiguration();
        // 先加入的配置优先级更高
        composite.addConfiguration(new SystemConfiguration().subset(SYSTEM_PREFIX));

        URL url = GraphConfig.class.getClassLoader().getResource(resource);
        if (url != null) {
            // 直接用 FileHandler 读取，不经过 builder 层（builder 层依赖 commons-beanutils）
            PropertiesConfiguration properties = new PropertiesConfiguration();
            try {
                new FileHandler(properties).load(url);
                composite.addConfiguration(properties);
            } catch (ConfigurationException e) {
                throw new GraphBuildException("Failed to load configuration: " + resource, e);
            }
        } else {
            log.debug("Configuration resource {} not found, using defaults", resource);
        }
        return from(composite);
    }

    public static GraphConfig from(Configuration c) {
        GraphConfig config = new GraphConfig(
                c.getInt("snippet.max-length", 120),
                c.getInt("sequence.max-code-tokens", 50),
                c.getBoolean("sequence.edge-tokens", true),
                c.getBoolean("class-graph.boundary-nodes", true),
                c.getInt("source.max-length", 100_000),
                c.getBoolean("build.include-method-graphs", true),
                c.getBoolean("build.include-class-graph", true));
        if (config.snippetMaxLength < 0 || config.sequenceMaxCodeTokens < 0 || config.sourceMaxLength <= 0) {
            throw new GraphBuildException("Invalid configuration: " + config);
        }
        return config;
    }

    public BuildOptions defaultOptions() {
        return new BuildOptions(includeMethodGraphs, includeClassGraph);
    }
}
