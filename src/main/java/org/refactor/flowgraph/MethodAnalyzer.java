package org.refactor.flowgraph;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import org.refactor.flowgraph.cfg.CfgBuilder;
import org.refactor.flowgraph.cfg.CfgResult;
import org.refactor.flowgraph.classify.StatementClassifier;
import org.refactor.flowgraph.ddg.DdgBuilder;
import org.refactor.flowgraph.model.FlowGraph;
import org.refactor.flowgraph.model.MethodGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * 方法分析器：对一个方法或构造器先构建 CFG，再在 CFG 上推导 DDG。
 * <p>
 * 实例不保存任何跨调用的状态，可以被多个线程同时使用。
 */
public class MethodAnalyzer {

    private final CfgBuilder cfgBuilder;
    private final DdgBuilder ddgBuilder;

    public MethodAnalyzer(GraphConfig config) {
        this.cfgBuilder = new CfgBuilder(new StatementClassifier(config.snippetMaxLength()));
        this.ddgBuilder = new DdgBuilder();
    }

    /**
     * 分析给定的方法声明并构建方法图
     *
     * @param callable  方法或构造器
     * @param className 所属类名，未知时为空串
     * @throws GraphBuildException CFG 或 DDG 构建失败时
     */
    public MethodGraph analyze(CallableDeclaration<?> callable, String className) {
        CfgResult cfg = cfgBuilder.build(callable);
        FlowGraph ddg = ddgBuilder.build(cfg.graph());

        List<String> names = new ArrayList<>();
        List<String> types = new ArrayList<>();
        for (Parameter p : callable.getParameters()) {
            names.add(p.getNameAsString());
            types.add(p.getType().asString() + (p.isVarArgs() ? "..." : ""));
        }

        boolean constructor = callable.isConstructorDeclaration();
        String returnType = callable instanceof MethodDeclaration md
                ? md.getType().asString()
                : className;

        return new MethodGraph(
                callable.getNameAsString(),
                className,
                names,
                types,
                returnType,
                callable.getBegin().map(p -> p.line).orElse(null),
                callable.getEnd().map(p -> p.line).orElse(null),
                constructor,
                cfg.graph(),
                ddg,
                cfg.warnings());
    }
}
