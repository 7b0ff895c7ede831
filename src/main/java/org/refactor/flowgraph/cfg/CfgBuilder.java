package org.refactor.flowgraph.cfg;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.*;
import org.refactor.flowgraph.CfgBuildException;
import org.refactor.flowgraph.classify.Classification;
import org.refactor.flowgraph.classify.StatementClassifier;
import org.refactor.flowgraph.model.EdgeKind;
import org.refactor.flowgraph.model.FlowGraph;
import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 构建控制流图 (CFG)。
 * <p>
 * 对方法体做一次结构化遍历：每个处理步骤接收一组前驱悬空边（{@link Frontier}），返回执行完当前语句后的悬空边，
 * 下一个创建的节点把它们全部接上。break/continue 不建节点，只把前沿挂到目标循环上（跳出带 finally 的 try 时先进入 finally）；
 * return/throw 直接连到 METHOD_EXIT（或最近的 finally / catch）。
 * <p>
 * 节点和边严格按源码遍历顺序创建，同一棵 AST 构建两次得到完全相同的 id 和边顺序。
 */
public class CfgBuilder {

    private static final Logger log = LoggerFactory.getLogger(CfgBuilder.class);

    private final StatementClassifier classifier;

    public CfgBuilder(StatementClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @throws CfgBuildException break/continue 找不到目标时
     */
    public CfgResult build(CallableDeclaration<?> callable) {
        CfgContext ctx = new CfgContext(callable.getNameAsString());
        CfgVisitor visitor = new CfgVisitor(ctx);

        String entryId = ctx.addNode(classifier.methodEntry(callable));
        ctx.exitId = ctx.addNode(classifier.methodExit(callable));

        Frontier exits = bodyOf(callable)
                .map(body -> visitor.visit(body, Frontier.of(entryId)))
                .orElse(Frontier.of(entryId));

        // 剩余的悬空边统一汇入 METHOD_EXIT
        ctx.connect(exits, ctx.exitId);

        log.debug("CFG for {}: {} nodes, {} edges", ctx.methodName, ctx.nodes.size(), ctx.edges.size());
        return new CfgResult(new FlowGraph(ctx.nodes, ctx.edges), entryId, ctx.exitId, ctx.warnings);
    }

    static Optional<BlockStmt> bodyOf(CallableDeclaration<?> callable) {
        if (callable instanceof MethodDeclaration md) {
            return md.getBody();
        }
        if (callable instanceof ConstructorDeclaration cd) {
            return Optional.of(cd.getBody());
        }
        return Optional.empty();
    }

    /**
     * 一次构建的全部可变状态（节点、边、跳转目标栈、try 区域栈），不跨请求共享
     */
    private class CfgContext {
        final String methodName;
        final List<GraphNode> nodes = new ArrayList<>();
        final List<GraphEdge> edges = new ArrayList<>();
        final Set<GraphEdge> edgeSet = new HashSet<>();
        final List<String> warnings = new ArrayList<>();

        // 循环 / switch / 带标签块，栈顶是最内层
        final Deque<JumpTarget> jumpTargets = new ArrayDeque<>();
        final Deque<TryRegion> tryRegions = new ArrayDeque<>();

        String exitId;
        int counter = 0;
        // > 0 表示正在构建不可达的语句
        int unreachableDepth = 0;
        // 紧挨着的 LabeledStmt 留给下一个循环/switch 的标签
        String pendingLabel;

        CfgContext(String methodName) {
            this.methodName = methodName;
        }

        String addNode(Classification c) {
            String id = "n" + counter++;
            Map<String, Object> meta = new LinkedHashMap<>(c.metadata());
            meta.put(GraphNode.META_STATEMENT_TYPE, c.category().name());
            if (unreachableDepth > 0) {
                meta.put(GraphNode.META_UNREACHABLE, true);
            }
            nodes.add(new GraphNode(id, c.kind(), c.code(), c.position(), c.defs(), c.uses(), meta));

            c.warningMessage().ifPresent(w -> {
                String message = methodName + ": " + w;
                warnings.add(message);
                log.warn(message);
            });

            // try 块内的每个节点都可能抛出异常
            for (TryRegion region : tryRegions) {
                if (region.phase == TryPhase.BODY) {
                    region.throwingNodes.add(id);
                }
            }
            return id;
        }

        void connect(Frontier frontier, String target) {
            for (PendingEdge p : frontier.edges()) {
                addEdge(p.source(), target, p.kind(), p.label());
            }
        }

        /**
         * 完全相同的边（两端、种类、标签都一样）只保留一条，不同种类的平行边照常保留
         */
        void addEdge(String source, String target, EdgeKind kind, String label) {
            GraphEdge edge = GraphEdge.control(source, target, kind, label);
            if (edgeSet.add(edge)) {
                edges.add(edge);
            }
        }

        String takeLabel() {
            String label = pendingLabel;
            pendingLabel = null;
            return label;
        }
    }

    private enum JumpKind {LOOP, SWITCH, BLOCK}

    /**
     * break/continue 的目标。循环头在 do-while 中要到循环体之后才创建，此前的 continue 先挂起。
     */
    private static final class JumpTarget {
        final JumpKind kind;
        final String label;
        // 创建时外层 try 的层数，跳到这里要经过的是更内层的 try
        final int tryDepth;
        String continueTarget;
        Frontier breaks = Frontier.empty();
        Frontier pendingContinues = Frontier.empty();

        JumpTarget(JumpKind kind, String label, int tryDepth, String continueTarget) {
            this.kind = kind;
            this.label = label;
            this.tryDepth = tryDepth;
            this.continueTarget = continueTarget;
        }
    }

    /**
     * 先经过 finally 再继续的 break / continue
     */
    private record Jump(JumpTarget target, boolean isContinue) {
    }

    private enum TryPhase {BODY, CATCH, FINALLY}

    private static final class TryRegion {
        final boolean hasCatches;
        final boolean hasFinally;
        final List<String> throwingNodes = new ArrayList<>();
        TryPhase phase = TryPhase.BODY;
        // 经由 finally 离开的 return / throw / break / continue
        Frontier finallyPending = Frontier.empty();
        boolean returnsViaFinally;
        boolean throwsViaFinally;
        final List<Jump> jumpsViaFinally = new ArrayList<>();

        TryRegion(boolean hasCatches, boolean hasFinally) {
            this.hasCatches = hasCatches;
            this.hasFinally = hasFinally;
        }
    }

    /**
     * 核心 Visitor：接收一组前驱悬空边，返回当前语句执行完后的悬空边
     */
    private class CfgVisitor {

        private final CfgContext ctx;

        CfgVisitor(CfgContext ctx) {
            this.ctx = ctx;
        }

        Frontier visit(Statement stmt, Frontier in) {
            // 前沿为空说明控制流到不了这里，节点照建，但标记为不可达
            boolean dead = in.isEmpty();
            if (dead) {
                ctx.unreachableDepth++;
            }
            try {
                return dispatch(stmt, in);
            } finally {
                if (dead) {
                    ctx.unreachableDepth--;
                }
            }
        }

        private Frontier dispatch(Statement stmt, Frontier in) {
            if (stmt instanceof BlockStmt block) {
                return visitStatements(block.getStatements(), in);
            } else if (stmt instanceof IfStmt ifStmt) {
                return visitIf(ifStmt, in);
            } else if (stmt instanceof ForStmt forStmt) {
                return visitLoop(forStmt, forStmt.getBody(), in);
            } else if (stmt instanceof ForEachStmt forEachStmt) {
                return visitLoop(forEachStmt, forEachStmt.getBody(), in);
            } else if (stmt instanceof WhileStmt whileStmt) {
                return visitLoop(whileStmt, whileStmt.getBody(), in);
            } else if (stmt instanceof DoStmt doStmt) {
                return visitDo(doStmt, in);
            } else if (stmt instanceof SwitchStmt switchStmt) {
                return visitSwitch(switchStmt, in);
            } else if (stmt instanceof TryStmt tryStmt) {
                return visitTry(tryStmt, in);
            } else if (stmt instanceof LabeledStmt labeledStmt) {
                return visitLabeled(labeledStmt, in);
            } else if (stmt instanceof SynchronizedStmt syncStmt) {
                String id = ctx.addNode(classifier.synchronizedHeader(syncStmt));
                ctx.connect(in, id);
                return visit(syncStmt.getBody(), Frontier.of(id));
            } else if (stmt instanceof BreakStmt breakStmt) {
                handleBreak(breakStmt, in);
                return Frontier.empty();
            } else if (stmt instanceof ContinueStmt continueStmt) {
                handleContinue(continueStmt, in);
                return Frontier.empty();
            } else if (stmt instanceof ReturnStmt) {
                String id = ctx.addNode(classifier.classify(stmt));
                ctx.connect(in, id);
                routeReturn(Frontier.of(id));
                return Frontier.empty();
            } else if (stmt instanceof ThrowStmt) {
                String id = ctx.addNode(classifier.classify(stmt));
                ctx.connect(in, id);
                routeThrow(Frontier.branch(id, EdgeKind.EXCEPTION, ""));
                return Frontier.empty();
            } else if (stmt instanceof EmptyStmt) {
                return in;
            } else {
                // 普通语句（ExpressionStmt 等），无法识别的也走这里由分类器降级
                String id = ctx.addNode(classifier.classify(stmt));
                ctx.connect(in, id);
                return Frontier.of(id);
            }
        }

        private Frontier visitStatements(NodeList<Statement> statements, Frontier in) {
            Frontier current = in;
            for (Statement s : statements) {
                current = visit(s, current);
            }
            return current;
        }

        private Frontier visitIf(IfStmt stmt, Frontier in) {
            String condId = ctx.addNode(classifier.condition(stmt));
            ctx.connect(in, condId);

            Frontier thenExits = visit(stmt.getThenStmt(), Frontier.branch(condId, EdgeKind.TRUE_BRANCH, "T"));

            // 没有 else 时控制流直接穿过条件
            Frontier elseEntry = Frontier.branch(condId, EdgeKind.FALSE_BRANCH, "F");
            Frontier elseExits = stmt.getElseStmt()
                    .map(elseStmt -> visit(elseStmt, elseEntry))
                    .orElse(elseEntry);

            return thenExits.union(elseExits);
        }

        /**
         * for / foreach / while：循环头 -> (T) 循环体 -> (LOOP_BACK) 循环头 -> (F) 出口
         */
        private Frontier visitLoop(Statement loop, Statement body, Frontier in) {
            String headerId = ctx.addNode(classifier.loopHeader(loop));
            ctx.connect(in, headerId);

            JumpTarget target = new JumpTarget(JumpKind.LOOP, ctx.takeLabel(), ctx.tryRegions.size(), headerId);
            ctx.jumpTargets.push(target);
            Frontier bodyExits;
            try {
                bodyExits = visit(body, Frontier.branch(headerId, EdgeKind.TRUE_BRANCH, "T"));
            } finally {
                ctx.jumpTargets.pop();
            }

            ctx.connect(bodyExits.withKind(EdgeKind.LOOP_BACK), headerId);

            return Frontier.branch(headerId, EdgeKind.FALSE_BRANCH, "F").union(target.breaks);
        }

        /**
         * do-while：先执行循环体，再到循环头判断；循环头的回边重新进入循环体的第一个节点
         */
        private Frontier visitDo(DoStmt stmt, Frontier in) {
            JumpTarget target = new JumpTarget(JumpKind.LOOP, ctx.takeLabel(), ctx.tryRegions.size(), null);
            int bodyStart = ctx.counter;

            ctx.jumpTargets.push(target);
            Frontier bodyExits;
            try {
                bodyExits = visit(stmt.getBody(), in);
            } finally {
                ctx.jumpTargets.pop();
            }

            // 循环体从不正常结束、也没有 continue 时，条件永远不会被求值
            boolean headerReached = !bodyExits.isEmpty() || !target.pendingContinues.isEmpty();
            if (!headerReached) {
                ctx.unreachableDepth++;
            }
            String headerId;
            try {
                headerId = ctx.addNode(classifier.loopHeader(stmt));
            } finally {
                if (!headerReached) {
                    ctx.unreachableDepth--;
                }
            }
            ctx.connect(bodyExits, headerId);
            ctx.connect(target.pendingContinues, headerId);

            if (headerReached) {
                String reentry = bodyStart < ctx.counter - 1 ? "n" + bodyStart : headerId;
                ctx.addEdge(headerId, reentry, EdgeKind.LOOP_BACK, "T");
            }

            return Frontier.branch(headerId, EdgeKind.FALSE_BRANCH, "F").union(target.breaks);
        }

        /**
         * switch -> 每个 case 节点；传统 case 组会贯穿（fall through）到下一组，箭头形式不会
         */
        private Frontier visitSwitch(SwitchStmt stmt, Frontier in) {
            String switchId = ctx.addNode(classifier.switchHeader(stmt));
            ctx.connect(in, switchId);

            JumpTarget target = new JumpTarget(JumpKind.SWITCH, ctx.takeLabel(), ctx.tryRegions.size(), null);
            ctx.jumpTargets.push(target);
            Frontier fallthrough = Frontier.empty();
            boolean hasDefault = false;
            try {
                for (SwitchEntry entry : stmt.getEntries()) {
                    boolean isDefault = entry.getLabels().isEmpty();
                    hasDefault |= isDefault;

                    String caseId = ctx.addNode(classifier.caseLabel(entry));
                    ctx.addEdge(switchId, caseId, isDefault ? EdgeKind.DEFAULT_BRANCH : EdgeKind.CASE_BRANCH,
                            StatementClassifier.caseLabelText(entry));

                    Frontier caseExits = visitStatements(entry.getStatements(), Frontier.of(caseId).union(fallthrough));
                    if (entry.getType() == SwitchEntry.Type.STATEMENT_GROUP) {
                        fallthrough = caseExits;
                    } else {
                        target.breaks = target.breaks.union(caseExits);
                        fallthrough = Frontier.empty();
                    }
                }
            } finally {
                ctx.jumpTargets.pop();
            }

            Frontier exits = fallthrough.union(target.breaks);
            if (!hasDefault) {
                // 没有 default：所有 case 都不匹配时直接跳过 switch
                exits = exits.union(Frontier.branch(switchId, EdgeKind.DEFAULT_BRANCH, "default"));
            }
            return exits;
        }

        private Frontier visitTry(TryStmt stmt, Frontier in) {
            String tryId = ctx.addNode(classifier.tryHeader(stmt));
            ctx.connect(in, tryId);

            TryRegion region = new TryRegion(!stmt.getCatchClauses().isEmpty(), stmt.getFinallyBlock().isPresent());
            region.throwingNodes.add(tryId);
            ctx.tryRegions.push(region);
            try {
                Frontier normal = visit(stmt.getTryBlock(), Frontier.of(tryId));

                region.phase = TryPhase.CATCH;
                for (CatchClause clause : stmt.getCatchClauses()) {
                    String catchId = ctx.addNode(classifier.catchClause(clause));
                    String caught = clause.getParameter().getType().asString();
                    for (String source : region.throwingNodes) {
                        ctx.addEdge(source, catchId, EdgeKind.EXCEPTION, caught);
                    }
                    normal = normal.union(visit(clause.getBody(), Frontier.of(catchId)));
                }

                if (stmt.getFinallyBlock().isEmpty()) {
                    return normal;
                }

                region.phase = TryPhase.FINALLY;
                BlockStmt finallyBlock = stmt.getFinallyBlock().get();
                String finallyId = ctx.addNode(classifier.finallyBlock(finallyBlock));
                ctx.connect(normal, finallyId);
                if (!region.hasCatches) {
                    // 没有 catch：try 块里的异常先经过 finally 再向外传播
                    for (String source : region.throwingNodes) {
                        ctx.addEdge(source, finallyId, EdgeKind.EXCEPTION, "");
                    }
                    region.throwsViaFinally = true;
                }
                ctx.connect(region.finallyPending, finallyId);

                Frontier finallyExits = visit(finallyBlock, Frontier.of(finallyId));
                ctx.tryRegions.pop();
                if (region.returnsViaFinally) {
                    routeReturn(finallyExits);
                }
                if (region.throwsViaFinally) {
                    routeThrow(finallyExits.withKind(EdgeKind.EXCEPTION));
                }
                for (Jump jump : region.jumpsViaFinally) {
                    routeJump(finallyExits, jump.target(), jump.isContinue());
                }
                // try 和 catch 都不会正常结束时，finally 之后的语句不可达
                return normal.isEmpty() ? Frontier.empty() : finallyExits;
            } finally {
                ctx.tryRegions.remove(region);
            }
        }

        private Frontier visitLabeled(LabeledStmt stmt, Frontier in) {
            String label = stmt.getLabel().asString();
            Statement inner = stmt.getStatement();
            if (inner.isForStmt() || inner.isForEachStmt() || inner.isWhileStmt() || inner.isDoStmt()
                    || inner.isSwitchStmt()) {
                ctx.pendingLabel = label;
                return visit(inner, in);
            }

            // 带标签的普通块：只能被 break label 跳出
            JumpTarget target = new JumpTarget(JumpKind.BLOCK, label, ctx.tryRegions.size(), null);
            ctx.jumpTargets.push(target);
            try {
                return visit(inner, in).union(target.breaks);
            } finally {
                ctx.jumpTargets.pop();
            }
        }

        private void handleBreak(BreakStmt stmt, Frontier in) {
            Optional<String> label = stmt.getLabel().map(l -> l.asString());
            JumpTarget target = findTarget(label.orElse(null), false)
                    .orElseThrow(() -> new CfgBuildException(
                            "break" + label.map(l -> " " + l).orElse("") + " outside of loop or switch in method "
                                    + ctx.methodName,
                            stmt.getBegin().map(p -> "line " + p.line).orElse(null)));
            routeJump(in, target, false);
        }

        private void handleContinue(ContinueStmt stmt, Frontier in) {
            Optional<String> label = stmt.getLabel().map(l -> l.asString());
            JumpTarget target = findTarget(label.orElse(null), true)
                    .orElseThrow(() -> new CfgBuildException(
                            "continue" + label.map(l -> " " + l).orElse("") + " outside of loop in method "
                                    + ctx.methodName,
                            stmt.getBegin().map(p -> "line " + p.line).orElse(null)));
            routeJump(in, target, true);
        }

        /**
         * break / continue：跳出的 try 中最内层带 finally 的先接管，finally 结束后再跳到目标
         */
        private void routeJump(Frontier frontier, JumpTarget target, boolean isContinue) {
            int crossed = ctx.tryRegions.size() - target.tryDepth;
            for (TryRegion region : ctx.tryRegions) {
                if (crossed-- <= 0) {
                    break;
                }
                if (region.hasFinally && region.phase != TryPhase.FINALLY) {
                    region.finallyPending = region.finallyPending.union(frontier);
                    Jump jump = new Jump(target, isContinue);
                    if (!region.jumpsViaFinally.contains(jump)) {
                        region.jumpsViaFinally.add(jump);
                    }
                    return;
                }
            }
            if (!isContinue) {
                target.breaks = target.breaks.union(frontier);
            } else if (target.continueTarget != null) {
                ctx.connect(frontier.withKind(EdgeKind.LOOP_BACK), target.continueTarget);
            } else {
                target.pendingContinues = target.pendingContinues.union(frontier.withKind(EdgeKind.LOOP_BACK));
            }
        }

        /**
         * 无标签的 break 找最近的循环或 switch，continue 只找循环；带标签时按标签匹配
         */
        private Optional<JumpTarget> findTarget(String label, boolean loopOnly) {
            for (JumpTarget target : ctx.jumpTargets) {
                if (label != null) {
                    if (label.equals(target.label)) {
                        return loopOnly && target.kind != JumpKind.LOOP ? Optional.empty() : Optional.of(target);
                    }
                    continue;
                }
                if (target.kind == JumpKind.LOOP || (!loopOnly && target.kind == JumpKind.SWITCH)) {
                    return Optional.of(target);
                }
            }
            return Optional.empty();
        }

        /**
         * return：最近一个还没进入 finally 阶段、且带 finally 的 try 先接管，否则直连 METHOD_EXIT
         */
        private void routeReturn(Frontier frontier) {
            for (TryRegion region : ctx.tryRegions) {
                if (region.hasFinally && region.phase != TryPhase.FINALLY) {
                    region.finallyPending = region.finallyPending.union(frontier);
                    region.returnsViaFinally = true;
                    return;
                }
            }
            ctx.connect(frontier, ctx.exitId);
        }

        /**
         * throw：所在 try 块有 catch 时，异常边在创建 catch 节点时统一补上；
         * 只有 finally 时经由 finally 向外传播；catch 块里抛出的先交给同一 try 的 finally。
         * 没有任何接管者就连到 METHOD_EXIT。
         */
        private void routeThrow(Frontier frontier) {
            for (TryRegion region : ctx.tryRegions) {
                if (region.phase == TryPhase.BODY) {
                    // frontier 中的节点都是在这个 try 块内创建的，已登记为可抛出节点
                    if (region.hasCatches) {
                        return;
                    }
                    if (region.hasFinally) {
                        region.throwsViaFinally = true;
                        return;
                    }
                } else if (region.phase == TryPhase.CATCH && region.hasFinally) {
                    region.finallyPending = region.finallyPending.union(frontier);
                    region.throwsViaFinally = true;
                    return;
                }
            }
            ctx.connect(frontier, ctx.exitId);
        }
    }
}
