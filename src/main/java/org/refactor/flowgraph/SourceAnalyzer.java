package org.refactor.flowgraph;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 源码文本 -> AST -> 引擎。
 * <p>
 * 语法错误、空源码、超长源码在进入引擎之前就被拒绝，转成请求级失败的结果。
 */
public class SourceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SourceAnalyzer.class);

    private final GraphEngine engine;
    private final JavaParser parser;

    public SourceAnalyzer(GraphEngine engine) {
        this(engine, new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    /**
     * @param parserConfiguration 可以带上 SymbolResolver，变量识别会优先使用符号解析
     */
    public SourceAnalyzer(GraphEngine engine, ParserConfiguration parserConfiguration) {
        this.engine = engine;
        this.parser = new JavaParser(parserConfiguration);
    }

    /**
     * 验证代码是否符合 Java 语法
     *
     * @return true = 语法正确; false = 空源码、过长或语法错误
     */
    public boolean validate(String code) {
        try {
            parse(code);
            return true;
        } catch (SourceParseException e) {
            log.info("Syntax validation failed: {}", e.getMessage());
            e.getProblems().forEach(p -> log.info("   -> {}", p));
            return false;
        }
    }

    /**
     * @throws SourceParseException 源码为空、超长或有语法错误
     */
    public CompilationUnit parse(String code) {
        if (code == null || code.trim().isEmpty()) {
            throw new SourceParseException("Source code is empty");
        }
        int max = engine.getConfig().sourceMaxLength();
        if (code.length() > max) {
            throw new SourceParseException("Source code exceeds maximum length of " + max + " characters");
        }

        ParseResult<CompilationUnit> result = parser.parse(code);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<String> problems = new ArrayList<>();
            for (Problem p : result.getProblems()) {
                int line = p.getLocation()
                        .flatMap(l -> l.getBegin().getRange())
                        .map(r -> r.begin.line)
                        .orElse(-1); // 获取不到行号时为 -1
                problems.add("Line " + line + ": " + p.getMessage());
            }
            throw new SourceParseException("Syntax error in source code", problems);
        }
        return result.getResult().get();
    }

    public List<AnalysisResult> analyze(String code) {
        return analyze(code, engine.getConfig().defaultOptions());
    }

    /**
     * 对源码中每个声明了方法或构造器的类型各产出一个结果（嵌套类型也算）
     */
    public List<AnalysisResult> analyze(String code, BuildOptions options) {
        CompilationUnit cu;
        try {
            cu = parse(code);
        } catch (SourceParseException e) {
            List<String> errors = new ArrayList<>();
            errors.add(e.getMessage());
            errors.addAll(e.getProblems());
            return List.of(AnalysisResult.failure(null, errors));
        }

        List<AnalysisResult> results = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            if (!(type.getMethods().isEmpty() && type.getConstructors().isEmpty())) {
                results.add(engine.build(type, options));
            }
        }
        if (results.isEmpty()) {
            return List.of(AnalysisResult.failure(null, List.of("No class with methods or constructors found")));
        }
        return results;
    }
}
