package org.refactor.flowgraph.classify;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.PrinterConfiguration;
import org.refactor.flowgraph.model.NodeKind;
import org.refactor.flowgraph.model.SourcePosition;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 语句分类器：把一个 AST 语句（或控制结构的边界部分）映射为节点种类、源码片段、位置和 def/use 集合。
 * <p>
 * 复合语句（块、if、循环、try）不在这里整体分类，CFG 构建器会拆开它们，
 * 分别对条件、循环头、catch 子句和内部的简单语句调用对应的方法。
 * 无法识别的结构统一走 {@link #fallback(Node)}，得到一个带告警的 STATEMENT。
 */
public class StatementClassifier {

    private static final PrinterConfiguration SNIPPET_PRINTER = new DefaultPrinterConfiguration()
            .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS))
            .removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_JAVADOC));

    public static final String META_LOOP_TYPE = "loopType";
    public static final String META_CONDITION = "condition";
    public static final String META_ITERATION_VARIABLE = "iterationVariable";
    public static final String META_ITERABLE = "iterable";

    private final int snippetMaxLength;

    public StatementClassifier(int snippetMaxLength) {
        this.snippetMaxLength = snippetMaxLength;
    }

    /**
     * 简单语句：表达式语句、return、throw、assert、构造器调用、局部类声明
     */
    public Classification classify(Statement stmt) {
        if (stmt instanceof ExpressionStmt exprStmt) {
            return simple(NodeKind.STATEMENT, categoryOf(exprStmt.getExpression()), stmt);
        }
        if (stmt instanceof ReturnStmt) {
            return simple(NodeKind.RETURN, StatementCategory.RETURN, stmt);
        }
        if (stmt instanceof ThrowStmt) {
            return simple(NodeKind.THROW, StatementCategory.THROW, stmt);
        }
        if (stmt instanceof ExplicitConstructorInvocationStmt) {
            return simple(NodeKind.STATEMENT, StatementCategory.METHOD_CALL, stmt);
        }
        if (stmt instanceof AssertStmt || stmt instanceof YieldStmt) {
            return simple(NodeKind.STATEMENT, StatementCategory.EXPRESSION, stmt);
        }
        if (stmt instanceof LocalClassDeclarationStmt || stmt instanceof LocalRecordDeclarationStmt) {
            // 类体里的变量与当前方法无关
            return build(NodeKind.STATEMENT, StatementCategory.DECLARATION, render(stmt), stmt,
                    Set.of(), Set.of(), Map.of());
        }
        return fallback(stmt);
    }

    public Classification methodEntry(CallableDeclaration<?> callable) {
        Set<String> params = new LinkedHashSet<>();
        for (Parameter p : callable.getParameters()) {
            params.add(p.getNameAsString());
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("method", callable.getNameAsString());
        meta.put("parameters", List.copyOf(params));
        return new Classification(NodeKind.METHOD_ENTRY, StatementCategory.STATEMENT,
                "ENTRY: " + callable.getNameAsString(), null, params, Set.of(), meta, null);
    }

    public Classification methodExit(CallableDeclaration<?> callable) {
        return new Classification(NodeKind.METHOD_EXIT, StatementCategory.STATEMENT,
                "EXIT: " + callable.getNameAsString(), null, Set.of(), Set.of(),
                Map.of("method", callable.getNameAsString()), null);
    }

    public Classification condition(IfStmt ifStmt) {
        Expression cond = ifStmt.getCondition();
        return build(NodeKind.CONDITION, StatementCategory.CONDITION, "if (" + render(cond) + ")", ifStmt,
                Set.of(), VarDefUseCollector.usesOf(cond),
                Map.of(META_CONDITION, sanitize(render(cond)), "hasElse", ifStmt.getElseStmt().isPresent()));
    }

    /**
     * 循环头：for 的 init/compare/update、foreach 的迭代变量与集合、while/do 的条件都归到这一个节点
     */
    public Classification loopHeader(Statement loop) {
        Set<String> defs = new LinkedHashSet<>();
        Set<String> uses = new LinkedHashSet<>();
        Map<String, Object> meta = new LinkedHashMap<>();
        String code;

        if (loop instanceof ForStmt forStmt) {
            forStmt.getInitialization().forEach(init -> VarDefUseCollector.collect(init, defs, uses));
            forStmt.getCompare().ifPresent(c -> VarDefUseCollector.collect(c, defs, uses));
            forStmt.getUpdate().forEach(u -> VarDefUseCollector.collect(u, defs, uses));
            String compare = forStmt.getCompare().map(this::render).orElse("");
            code = "for (" + join(forStmt.getInitialization()) + "; " + compare + "; "
                    + join(forStmt.getUpdate()) + ")";
            meta.put(META_LOOP_TYPE, "FOR");
            meta.put(META_CONDITION, sanitize(compare));
            if (!defs.isEmpty()) {
                meta.put(META_ITERATION_VARIABLE, String.join(", ", defs));
            }
        } else if (loop instanceof ForEachStmt forEach) {
            String variable = forEach.getVariableDeclarator().getNameAsString();
            defs.add(variable);
            uses.addAll(VarDefUseCollector.usesOf(forEach.getIterable()));
            code = "for (" + render(forEach.getVariable()) + " : " + render(forEach.getIterable()) + ")";
            meta.put(META_LOOP_TYPE, "FOR_EACH");
            meta.put(META_ITERATION_VARIABLE, variable);
            meta.put(META_ITERABLE, sanitize(render(forEach.getIterable())));
        } else if (loop instanceof WhileStmt whileStmt) {
            VarDefUseCollector.collect(whileStmt.getCondition(), defs, uses);
            code = "while (" + render(whileStmt.getCondition()) + ")";
            meta.put(META_LOOP_TYPE, "WHILE");
            meta.put(META_CONDITION, sanitize(render(whileStmt.getCondition())));
        } else if (loop instanceof DoStmt doStmt) {
            VarDefUseCollector.collect(doStmt.getCondition(), defs, uses);
            code = "while (" + render(doStmt.getCondition()) + ")";
            meta.put(META_LOOP_TYPE, "DO_WHILE");
            meta.put(META_CONDITION, sanitize(render(doStmt.getCondition())));
        } else {
            throw new IllegalArgumentException("Not a loop: " + loop.getClass().getSimpleName());
        }
        return build(NodeKind.LOOP_HEADER, StatementCategory.LOOP, code, loop, defs, uses, meta);
    }

    public Classification switchHeader(SwitchStmt switchStmt) {
        Expression selector = switchStmt.getSelector();
        return build(NodeKind.SWITCH, StatementCategory.SWITCH, "switch (" + render(selector) + ")", switchStmt,
                Set.of(), VarDefUseCollector.usesOf(selector), Map.of("selector", sanitize(render(selector))));
    }

    /**
     * case 标签通常是常量或枚举值，不计入 use
     */
    public Classification caseLabel(SwitchEntry entry) {
        String label = caseLabelText(entry);
        return build(NodeKind.CASE, StatementCategory.CASE, label, entry, Set.of(), Set.of(),
                Map.of("entryType", entry.getType().name()));
    }

    public static String caseLabelText(SwitchEntry entry) {
        if (entry.getLabels().isEmpty()) {
            return "default";
        }
        return "case " + entry.getLabels().stream().map(Node::toString).collect(Collectors.joining(", "));
    }

    public Classification tryHeader(TryStmt tryStmt) {
        Set<String> defs = new LinkedHashSet<>();
        Set<String> uses = new LinkedHashSet<>();
        tryStmt.getResources().forEach(r -> VarDefUseCollector.collect(r, defs, uses));
        String code = tryStmt.getResources().isEmpty()
                ? "try"
                : "try (" + tryStmt.getResources().stream().map(this::render).collect(Collectors.joining("; ")) + ")";
        return build(NodeKind.TRY, StatementCategory.TRY, code, tryStmt, defs, uses,
                Map.of("catchCount", tryStmt.getCatchClauses().size(),
                        "hasFinally", tryStmt.getFinallyBlock().isPresent()));
    }

    public Classification catchClause(CatchClause clause) {
        Parameter param = clause.getParameter();
        return build(NodeKind.CATCH, StatementCategory.CATCH, "catch (" + render(param) + ")", clause,
                Set.of(param.getNameAsString()), Set.of(),
                Map.of("exceptionType", param.getType().asString()));
    }

    public Classification finallyBlock(BlockStmt block) {
        return build(NodeKind.FINALLY, StatementCategory.FINALLY, "finally", block, Set.of(), Set.of(), Map.of());
    }

    public Classification synchronizedHeader(SynchronizedStmt stmt) {
        return build(NodeKind.STATEMENT, StatementCategory.STATEMENT,
                "synchronized (" + render(stmt.getExpression()) + ")", stmt,
                Set.of(), VarDefUseCollector.usesOf(stmt.getExpression()), Map.of());
    }

    /**
     * 统一的降级出口：STATEMENT + 空 def/use + 一条告警
     */
    public Classification fallback(Node node) {
        String where = node.getBegin().map(p -> " at line " + p.line).orElse("");
        String warning = "Unrecognized construct " + node.getClass().getSimpleName() + where
                + ", treated as STATEMENT";
        return new Classification(NodeKind.STATEMENT, StatementCategory.UNKNOWN, sanitize(render(node)),
                SourcePosition.of(node).orElse(null), Set.of(), Set.of(),
                Map.of("unrecognized", node.getClass().getSimpleName()), warning);
    }

    private Classification simple(NodeKind kind, StatementCategory category, Statement stmt) {
        Set<String> defs = new LinkedHashSet<>();
        Set<String> uses = new LinkedHashSet<>();
        VarDefUseCollector.collect(stmt, defs, uses);
        return build(kind, category, render(stmt), stmt, defs, uses, Map.of());
    }

    private Classification build(NodeKind kind, StatementCategory category, String code, Node node,
                                 Set<String> defs, Set<String> uses, Map<String, Object> meta) {
        return new Classification(kind, category, sanitize(code), SourcePosition.of(node).orElse(null),
                defs, uses, meta, null);
    }

    static StatementCategory categoryOf(Expression expr) {
        if (expr.isVariableDeclarationExpr()) {
            return StatementCategory.DECLARATION;
        }
        if (expr.isAssignExpr()) {
            return StatementCategory.ASSIGNMENT;
        }
        if (expr.isUnaryExpr() && VarDefUseCollector.isIncrementOrDecrement(expr.asUnaryExpr().getOperator())) {
            return StatementCategory.ASSIGNMENT;
        }
        if (expr.isMethodCallExpr() || expr.isObjectCreationExpr()) {
            return StatementCategory.METHOD_CALL;
        }
        return StatementCategory.EXPRESSION;
    }

    private String render(Node node) {
        return node.toString(SNIPPET_PRINTER);
    }

    private String join(NodeList<Expression> expressions) {
        return expressions.stream().map(this::render).collect(Collectors.joining(", "));
    }

    /**
     * 压缩空白并按配置截断
     */
    String sanitize(String code) {
        String collapsed = String.join(" ", code.trim().split("\\s+"));
        if (snippetMaxLength > 0 && collapsed.length() > snippetMaxLength) {
            return collapsed.substring(0, snippetMaxLength) + "...";
        }
        return collapsed;
    }
}
