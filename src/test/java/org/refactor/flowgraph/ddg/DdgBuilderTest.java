package org.refactor.flowgraph.ddg;

import org.junit.jupiter.api.Test;
import org.refactor.flowgraph.DdgBuildException;
import org.refactor.flowgraph.JavaSnippets;
import org.refactor.flowgraph.cfg.CfgBuilder;
import org.refactor.flowgraph.classify.StatementClassifier;
import org.refactor.flowgraph.model.EdgeKind;
import org.refactor.flowgraph.model.FlowGraph;
import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;
import org.refactor.flowgraph.model.NodeKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DdgBuilderTest {

    private final CfgBuilder cfgBuilder = new CfgBuilder(new StatementClassifier(120));
    private final DdgBuilder ddgBuilder = new DdgBuilder();

    private FlowGraph cfg(String method) {
        return cfgBuilder.build(JavaSnippets.method(method)).graph();
    }

    private static List<String> deps(FlowGraph ddg, EdgeKind kind) {
        return ddg.edgesOfKind(kind).stream()
                .map(e -> e.source() + "->" + e.target() + ":" + e.variable())
                .collect(Collectors.toList());
    }

    @Test
    void testParametersFlowIntoReturn() {
        FlowGraph ddg = ddgBuilder.build(cfg("int add(int a, int b) { return a + b; }"));

        assertEquals(List.of("n0->n2:a", "n0->n2:b"), deps(ddg, EdgeKind.DATA_DEP));
        assertEquals("dep:a", ddg.edges().get(0).label());
    }

    @Test
    void testNodesAreCopiesWithSameIds() {
        FlowGraph cfg = cfg("int add(int a, int b) { return a + b; }");
        FlowGraph ddg = ddgBuilder.build(cfg);

        assertEquals(cfg.nodes(), ddg.nodes());
        for (int i = 0; i < cfg.nodeCount(); i++) {
            assertNotSame(cfg.nodes().get(i), ddg.nodes().get(i));
        }
    }

    @Test
    void testRedefinitionKillsEarlierDefinition() {
        FlowGraph ddg = ddgBuilder.build(cfg("int f() { int x = 1; x = 2; return x; }"));

        assertEquals(List.of("n3->n4:x"), deps(ddg, EdgeKind.DATA_DEP));
    }

    @Test
    void testDefUseOnlyForNearestUse() {
        FlowGraph ddg = ddgBuilder.build(cfg("void f() { int x = 1; foo(x); bar(x); }"));

        assertEquals(List.of("n2->n3:x", "n2->n4:x"), deps(ddg, EdgeKind.DATA_DEP));
        assertEquals(List.of("n2->n3:x"), deps(ddg, EdgeKind.DEF_USE));
    }

    @Test
    void testBothBranchesSeeDefinition() {
        FlowGraph ddg = ddgBuilder.build(cfg("int f(int x) { int y = 0; if (x > 0) { y = y + 1; } return y; }"));

        // n2: y = 0, n4: y = y + 1, n5: return y
        List<String> dataDeps = deps(ddg, EdgeKind.DATA_DEP);
        assertTrue(dataDeps.containsAll(List.of("n2->n4:y", "n2->n5:y", "n4->n5:y")));
        assertTrue(deps(ddg, EdgeKind.DEF_USE).containsAll(List.of("n2->n4:y", "n2->n5:y")));
    }

    @Test
    void testLoopCarriedDependencies() {
        FlowGraph ddg = ddgBuilder.build(
                cfg("int sum(int n) { int s = 0; for (int i = 0; i < n; i++) { s += i; } return s; }"));

        List<String> dataDeps = deps(ddg, EdgeKind.DATA_DEP);
        // 循环头 (n3) 定义并使用 i，经回边依赖自身；s += i (n4) 依赖上一轮的自己
        assertTrue(dataDeps.contains("n3->n3:i"));
        assertTrue(dataDeps.contains("n4->n4:s"));
        assertTrue(dataDeps.contains("n2->n5:s"));
        assertTrue(dataDeps.contains("n4->n5:s"));
        assertTrue(dataDeps.contains("n0->n3:n"));
        assertFalse(deps(ddg, EdgeKind.DEF_USE).contains("n3->n3:i"));
    }

    @Test
    void testTerminatesOnInfiniteLoop() {
        FlowGraph ddg = ddgBuilder.build(cfg("void f() { int x = 0; while (true) { x = x + 1; } }"));

        assertTrue(deps(ddg, EdgeKind.DATA_DEP).contains("n4->n4:x"));
    }

    @Test
    void testCatchVariableFlowsIntoHandler() {
        FlowGraph ddg = ddgBuilder.build(cfg("void f() { try { a(); } catch (RuntimeException e) { log(e); } }"));

        assertEquals(List.of("n4->n5:e"), deps(ddg, EdgeKind.DATA_DEP));
    }

    @Test
    void testEveryDataEdgeIsAReachableDefUse() {
        FlowGraph cfg = cfg("int f(int[] xs, int limit) { int total = 0; int i = 0;"
                + " while (i < xs.length) { if (xs[i] > limit) { total = total + xs[i]; } else if (xs[i] < 0) break;"
                + " i++; } try { check(total); } catch (IllegalStateException e) { total = -1; } return total; }");
        FlowGraph ddg = ddgBuilder.build(cfg);

        assertFalse(ddg.edges().isEmpty());
        for (GraphEdge e : ddg.edges()) {
            assertTrue(e.kind().isData());
            GraphNode def = ddg.node(e.source()).orElseThrow();
            GraphNode use = ddg.node(e.target()).orElseThrow();
            assertTrue(def.defines(e.variable()), e.toString());
            assertTrue(use.usesVariable(e.variable()), e.toString());
            assertTrue(reachableWithoutRedefinition(cfg, def.id(), use.id(), e.variable()), e.toString());
        }
    }

    @Test
    void testUnknownNodeInCfgFails() {
        GraphNode entry = new GraphNode("n0", NodeKind.METHOD_ENTRY, "ENTRY: f", null, Set.of("a"), Set.of(), null);
        FlowGraph broken = new FlowGraph(List.of(entry),
                List.of(GraphEdge.control("n0", "n9", EdgeKind.SEQUENTIAL, "")));

        assertThrows(DdgBuildException.class, () -> ddgBuilder.build(broken));
    }

    private static boolean reachableWithoutRedefinition(FlowGraph cfg, String from, String to, String variable) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        cfg.outgoing(from).forEach(e -> queue.add(e.target()));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            if (id.equals(to)) {
                return true;
            }
            if (cfg.node(id).orElseThrow().defines(variable)) {
                continue;
            }
            cfg.outgoing(id).forEach(e -> queue.add(e.target()));
        }
        return false;
    }
}
