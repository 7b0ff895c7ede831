package org.refactor.flowgraph;

import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.refactor.flowgraph.encode.TransformerFeatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取一个 Java 文件，对其中的每个类：
 * - 构建每个方法的 CFG + DDG
 * - 可选地聚合成类级图
 * - 输出 JSON
 * <p>
 * 用法：{@code Main <file.java> [--source-root <dir>] [--no-method-graphs] [--no-class-graph] [--features]}
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        File file = null;
        File sourceRoot = null;
        boolean methodGraphs = true;
        boolean classGraph = true;
        boolean features = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--source-root" -> {
                    if (i + 1 >= args.length) {
                        return usage("--source-root requires a directory");
                    }
                    sourceRoot = new File(args[++i]);
                }
                case "--no-method-graphs" -> methodGraphs = false;
                case "--no-class-graph" -> classGraph = false;
                case "--features" -> features = true;
                default -> {
                    if (args[i].startsWith("--") || file != null) {
                        return usage("Unexpected argument: " + args[i]);
                    }
                    file = new File(args[i]);
                }
            }
        }
        if (file == null) {
            return usage("Missing input file");
        }

        String code;
        try {
            code = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read {}", file, e);
            return 1;
        }

        // 配置 SymbolSolver（JDK + 源码根目录）
        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver());
        File root = sourceRoot != null ? sourceRoot : file.getAbsoluteFile().getParentFile();
        if (root != null && root.isDirectory()) {
            typeSolver.add(new JavaParserTypeSolver(root));
        }
        ParserConfiguration parserConfiguration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(typeSolver));

        GraphEngine engine = new GraphEngine(GraphConfig.load());
        SourceAnalyzer analyzer = new SourceAnalyzer(engine, parserConfiguration);
        List<AnalysisResult> results = analyzer.analyze(code, new BuildOptions(methodGraphs, classGraph));

        int status = 0;
        for (AnalysisResult result : results) {
            if (!result.isSuccess()) {
                log.error("Analysis failed for {}: {}", file, result.getErrors());
                status = 1;
            }
            System.out.println(GraphJson.toJson(features ? featuresOf(result) : result));
        }
        return status;
    }

    /**
     * 每个方法 CFG 的模型输入特征
     */
    private static Map<String, Object> featuresOf(AnalysisResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("className", result.getClassName());
        for (MethodGraphOutput method : result.getMethodGraphs()) {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("graph", TransformerFeatures.fromEdgeList(method.cfg().edgeList()));
            f.put("sequence", TransformerFeatures.fromSequence(method.cfg().sequence()));
            f.put("sparse", TransformerFeatures.toSparse(method.cfg().edgeList()));
            out.put(method.signature(), f);
        }
        return out;
    }

    private static int usage(String problem) {
        System.err.println(problem);
        System.err.println("Usage: Main <file.java> [--source-root <dir>] [--no-method-graphs] [--no-class-graph] [--features]");
        return 2;
    }
}
