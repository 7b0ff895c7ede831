package org.refactor.flowgraph.classify;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 收集一个语句或表达式中定义（def）和使用（use）的变量
 */
public class VarDefUseCollector {

    private static final Logger log = LoggerFactory.getLogger(VarDefUseCollector.class);

    private VarDefUseCollector() {
    }

    /**
     * 分析整棵子树，结果按源码顺序追加到 defs / uses
     */
    public static void collect(Node node, Set<String> defs, Set<String> uses) {
        node.accept(new DefUseVisitor(defs, uses), null);
    }

    /**
     * 只收集使用，例如条件表达式、循环边界
     */
    public static Set<String> usesOf(Node node) {
        Set<String> defs = new LinkedHashSet<>();
        Set<String> uses = new LinkedHashSet<>();
        collect(node, defs, uses);
        return uses;
    }

    private static class DefUseVisitor extends VoidVisitorAdapter<Void> {

        private final Set<String> defs;
        private final Set<String> uses;

        // lambda 参数及其内部声明的局部变量，不属于外层语句
        private final Deque<Set<String>> lambdaScopes = new ArrayDeque<>();

        DefUseVisitor(Set<String> defs, Set<String> uses) {
            this.defs = defs;
            this.uses = uses;
        }

        // 1) NameExpr：默认视为 use（赋值左值在 AssignExpr 里单独处理，不会走到这里）
        @Override
        public void visit(NameExpr n, Void arg) {
            String name = n.getNameAsString();
            if (isLambdaLocal(name) || !denotesVariable(n)) {
                return;
            }
            uses.add(name);
        }

        // 2) 变量声明：def
        @Override
        public void visit(VariableDeclarator n, Void arg) {
            n.getInitializer().ifPresent(init -> init.accept(this, arg));
            if (lambdaScopes.isEmpty()) {
                defs.add(n.getNameAsString());
            } else {
                lambdaScopes.peek().add(n.getNameAsString());
            }
        }

        // 3) 赋值：左值是 def；复合赋值（+= 等）同时也是 use
        @Override
        public void visit(AssignExpr n, Void arg) {
            Expression target = n.getTarget();
            if (n.getOperator() != AssignExpr.Operator.ASSIGN) {
                target.accept(this, arg);
            } else {
                visitTargetOperands(target, arg);
            }
            n.getValue().accept(this, arg);
            if (lambdaScopes.isEmpty()) {
                targetName(target).ifPresent(defs::add);
            }
        }

        // 4) ++ / --：既读又写
        @Override
        public void visit(UnaryExpr n, Void arg) {
            n.getExpression().accept(this, arg);
            if (isIncrementOrDecrement(n.getOperator()) && lambdaScopes.isEmpty()) {
                targetName(n.getExpression()).ifPresent(defs::add);
            }
        }

        // this.x 与直接写 x 视为同一个变量
        @Override
        public void visit(FieldAccessExpr n, Void arg) {
            if (n.getScope().isThisExpr()) {
                uses.add(n.getNameAsString());
                return;
            }
            super.visit(n, arg);
        }

        @Override
        public void visit(LambdaExpr n, Void arg) {
            Set<String> scope = new HashSet<>();
            for (Parameter p : n.getParameters()) {
                scope.add(p.getNameAsString());
            }
            lambdaScopes.push(scope);
            try {
                n.getBody().accept(this, arg);
            } finally {
                lambdaScopes.pop();
            }
        }

        // 先调用对象，再实参，保持源码顺序
        @Override
        public void visit(MethodCallExpr n, Void arg) {
            n.getScope().ifPresent(s -> s.accept(this, arg));
            n.getArguments().forEach(a -> a.accept(this, arg));
        }

        // 匿名类的类体不属于当前语句
        @Override
        public void visit(ObjectCreationExpr n, Void arg) {
            n.getScope().ifPresent(s -> s.accept(this, arg));
            n.getArguments().forEach(a -> a.accept(this, arg));
        }

        @Override
        public void visit(ClassOrInterfaceDeclaration n, Void arg) {
            // 局部类：不进入
        }

        @Override
        public void visit(RecordDeclaration n, Void arg) {
        }

        @Override
        public void visit(EnumDeclaration n, Void arg) {
        }

        /**
         * 左值里被读取的部分：数组下标、非 this 的字段访问对象
         */
        private void visitTargetOperands(Expression target, Void arg) {
            if (target.isNameExpr()) {
                return;
            }
            if (target.isArrayAccessExpr()) {
                ArrayAccessExpr access = target.asArrayAccessExpr();
                visitTargetOperands(access.getName(), arg);
                access.getIndex().accept(this, arg);
                return;
            }
            if (target.isFieldAccessExpr()) {
                FieldAccessExpr field = target.asFieldAccessExpr();
                if (!field.getScope().isThisExpr()) {
                    field.getScope().accept(this, arg);
                }
                return;
            }
            if (target.isEnclosedExpr()) {
                visitTargetOperands(target.asEnclosedExpr().getInner(), arg);
                return;
            }
            target.accept(this, arg);
        }

        private boolean isLambdaLocal(String name) {
            for (Set<String> scope : lambdaScopes) {
                if (scope.contains(name)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * 赋值目标对应的变量名：{@code x}、{@code a[i]} 中的 {@code a}、{@code this.f} 中的 {@code f}
     */
    static Optional<String> targetName(Expression target) {
        if (target.isNameExpr()) {
            return Optional.of(target.asNameExpr().getNameAsString());
        }
        if (target.isArrayAccessExpr()) {
            return targetName(target.asArrayAccessExpr().getName());
        }
        if (target.isFieldAccessExpr() && target.asFieldAccessExpr().getScope().isThisExpr()) {
            return Optional.of(target.asFieldAccessExpr().getNameAsString());
        }
        if (target.isEnclosedExpr()) {
            return targetName(target.asEnclosedExpr().getInner());
        }
        return Optional.empty();
    }

    static boolean isIncrementOrDecrement(UnaryExpr.Operator op) {
        return op == UnaryExpr.Operator.PREFIX_INCREMENT
                || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT
                || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    /**
     * 配置了 SymbolSolver 时先尝试解析；解析成功一定是变量。
     * 否则退化为语法判断：作为调用/字段访问对象的大写开头名字视为类型（如 Math.max、System.out）。
     */
    static boolean denotesVariable(NameExpr nameExpr) {
        if (symbolResolutionAvailable(nameExpr)) {
            try {
                nameExpr.resolve();
                return true;
            } catch (RuntimeException e) {
                log.trace("Cannot resolve {}: {}", nameExpr, e.getMessage());
            }
        }
        return !looksLikeTypeReference(nameExpr);
    }

    private static boolean symbolResolutionAvailable(Node node) {
        return node.findCompilationUnit()
                .map(cu -> cu.containsData(Node.SYMBOL_RESOLVER_KEY))
                .orElse(false);
    }

    private static boolean looksLikeTypeReference(NameExpr nameExpr) {
        String name = nameExpr.getNameAsString();
        if (name.isEmpty() || !Character.isUpperCase(name.charAt(0))) {
            return false;
        }
        Node parent = nameExpr.getParentNode().orElse(null);
        if (parent instanceof MethodCallExpr call) {
            return call.getScope().map(s -> s == nameExpr).orElse(false);
        }
        if (parent instanceof FieldAccessExpr field) {
            return field.getScope() == nameExpr;
        }
        if (parent instanceof MethodReferenceExpr ref) {
            return ref.getScope() == nameExpr;
        }
        return false;
    }
}
