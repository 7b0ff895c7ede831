package org.refactor.flowgraph.cfg;

import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.UnparsableStmt;
import org.junit.jupiter.api.Test;
import org.refactor.flowgraph.CfgBuildException;
import org.refactor.flowgraph.JavaSnippets;
import org.refactor.flowgraph.classify.StatementClassifier;
import org.refactor.flowgraph.model.EdgeKind;
import org.refactor.flowgraph.model.FlowGraph;
import org.refactor.flowgraph.model.GraphEdge;
import org.refactor.flowgraph.model.GraphNode;
import org.refactor.flowgraph.model.NodeKind;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.refactor.flowgraph.JavaSnippets.describe;
import static org.refactor.flowgraph.JavaSnippets.edgesOf;

public class CfgBuilderTest {

    private final CfgBuilder builder = new CfgBuilder(new StatementClassifier(120));

    private FlowGraph cfg(String method) {
        return builder.build(JavaSnippets.method(method)).graph();
    }

    private List<NodeKind> kinds(FlowGraph graph) {
        return graph.nodes().stream().map(GraphNode::kind).toList();
    }

    @Test
    void testStraightLineMethod() {
        FlowGraph g = cfg("int add(int a, int b) { return a + b; }");

        assertEquals(List.of(NodeKind.METHOD_ENTRY, NodeKind.METHOD_EXIT, NodeKind.RETURN), kinds(g));
        assertEquals(2, g.edgeCount());
        assertEquals(List.of("n0->n2", "n2->n1"), edgesOf(g, EdgeKind.SEQUENTIAL));
    }

    @Test
    void testIfWithEarlyReturn() {
        FlowGraph g = cfg("int max(int a, int b) { if (a > b) { return a; } return b; }");

        assertEquals(1, g.nodesOfKind(NodeKind.CONDITION).size());
        assertEquals(2, g.nodesOfKind(NodeKind.RETURN).size());
        assertEquals(List.of("n2->n3"), edgesOf(g, EdgeKind.TRUE_BRANCH));
        assertEquals(List.of("n2->n4"), edgesOf(g, EdgeKind.FALSE_BRANCH));
        assertEquals(List.of("n3-SEQUENTIAL->n1", "n4-SEQUENTIAL->n1"), describe(g.incoming("n1")));
        assertEquals("T", g.edgesOfKind(EdgeKind.TRUE_BRANCH).get(0).label());
    }

    @Test
    void testIfElseBranchesJoin() {
        FlowGraph g = cfg("int f(int x) { int y; if (x > 0) { y = 1; } else { y = 2; } return y; }");

        assertEquals(NodeKind.RETURN, g.node("n6").orElseThrow().kind());
        assertEquals(List.of("n4-SEQUENTIAL->n6", "n5-SEQUENTIAL->n6"), describe(g.incoming("n6")));
    }

    @Test
    void testIfWithoutElsePassesThrough() {
        FlowGraph g = cfg("void f(int x) { if (x > 0) { x = 0; } done(); }");

        assertEquals(List.of("n3-SEQUENTIAL->n4", "n2-FALSE_BRANCH->n4"), describe(g.incoming("n4")));
    }

    @Test
    void testForLoop() {
        FlowGraph g = cfg("int sum(int n) { int s = 0; for (int i = 0; i < n; i++) { s += i; } return s; }");

        assertEquals(1, g.nodesOfKind(NodeKind.LOOP_HEADER).size());
        assertEquals("n3", g.nodesOfKind(NodeKind.LOOP_HEADER).get(0).id());
        assertEquals(List.of("n3->n4"), edgesOf(g, EdgeKind.TRUE_BRANCH));
        assertEquals(List.of("n4->n3"), edgesOf(g, EdgeKind.LOOP_BACK));
        assertEquals(List.of("n3->n5"), edgesOf(g, EdgeKind.FALSE_BRANCH));
        assertEquals(NodeKind.RETURN, g.node("n5").orElseThrow().kind());
    }

    @Test
    void testWhileWithBreak() {
        FlowGraph g = cfg("void f(int n) { while (n > 0) { if (n == 3) break; n--; } done(); }");

        assertEquals(List.of("n4->n2"), edgesOf(g, EdgeKind.LOOP_BACK));
        assertEquals(List.of("n2-FALSE_BRANCH->n5", "n3-TRUE_BRANCH->n5"), describe(g.incoming("n5")));
    }

    @Test
    void testContinueJumpsBackToHeader() {
        FlowGraph g = cfg("void f(int n) { for (int i = 0; i < n; i++) { if (i % 2 == 0) continue; work(i); } }");

        assertEquals(List.of("n3->n2", "n4->n2"), edgesOf(g, EdgeKind.LOOP_BACK));
        assertEquals(List.of("n3->n4"), edgesOf(g, EdgeKind.FALSE_BRANCH).subList(0, 1));
    }

    @Test
    void testDoWhileRunsBodyFirst() {
        FlowGraph g = cfg("void f(int n) { do { n--; } while (n > 0); done(); }");

        GraphNode header = g.node("n3").orElseThrow();
        assertEquals(NodeKind.LOOP_HEADER, header.kind());
        assertEquals("while (n > 0)", header.code());
        assertEquals(List.of("n0-SEQUENTIAL->n2"), describe(g.incoming("n2").subList(0, 1)));
        assertEquals(List.of("n3->n2"), edgesOf(g, EdgeKind.LOOP_BACK));
        assertEquals(List.of("n3->n4"), edgesOf(g, EdgeKind.FALSE_BRANCH));
    }

    @Test
    void testDoWhileHeaderUnreachableWhenBodyAlwaysBreaks() {
        FlowGraph g = cfg("void f(boolean c) { do { break; } while (c); done(); }");

        GraphNode header = g.node("n2").orElseThrow();
        assertEquals(NodeKind.LOOP_HEADER, header.kind());
        assertTrue(header.isUnreachable());
        assertTrue(g.incoming("n2").isEmpty());
        assertTrue(edgesOf(g, EdgeKind.LOOP_BACK).isEmpty());
        assertEquals(List.of("n2-FALSE_BRANCH->n3", "n0-SEQUENTIAL->n3"), describe(g.incoming("n3")));
        assertFalse(g.node("n3").orElseThrow().isUnreachable());
    }

    @Test
    void testLabeledBreakLeavesOuterLoop() {
        FlowGraph g = cfg("void f(int[][] grid) { outer: for (int[] row : grid) { for (int v : row) {"
                + " if (v < 0) break outer; use(v); } } done(); }");

        assertEquals(List.of("n2-FALSE_BRANCH->n6", "n4-TRUE_BRANCH->n6"), describe(g.incoming("n6")));
        assertTrue(describe(g.outgoing("n3")).contains("n3-LOOP_BACK->n2"));
    }

    @Test
    void testSwitchFallThroughAndDefault() {
        FlowGraph g = cfg("int f(int k) { int r = 0; switch (k) { case 1: r = 10; case 2: r = 20; break;"
                + " default: r = 30; } return r; }");

        assertEquals(3, g.nodesOfKind(NodeKind.CASE).size());
        assertEquals(List.of("n3->n4", "n3->n6"), edgesOf(g, EdgeKind.CASE_BRANCH));
        assertEquals(List.of("n3->n8"), edgesOf(g, EdgeKind.DEFAULT_BRANCH));
        assertEquals("case 1", g.edgesOfKind(EdgeKind.CASE_BRANCH).get(0).label());
        // case 1 没有 break，落入 case 2 的语句
        assertTrue(describe(g.incoming("n7")).contains("n5-SEQUENTIAL->n7"));
        assertEquals(List.of("n9-SEQUENTIAL->n10", "n7-SEQUENTIAL->n10"), describe(g.incoming("n10")));
    }

    @Test
    void testArrowSwitchWithoutDefault() {
        FlowGraph g = cfg("void f(int k) { switch (k) { case 1 -> a(); case 2 -> b(); } done(); }");

        assertEquals(List.of("n4-SEQUENTIAL->n7", "n6-SEQUENTIAL->n7", "n2-DEFAULT_BRANCH->n7"),
                describe(g.incoming("n7")));
        assertTrue(g.outgoing("n4").stream().noneMatch(e -> e.target().equals("n5")));
    }

    @Test
    void testTryCatch() {
        FlowGraph g = cfg("void f() { try { a(); b(); } catch (RuntimeException e) { handle(e); } done(); }");

        assertEquals(List.of("n2->n5", "n3->n5", "n4->n5"), edgesOf(g, EdgeKind.EXCEPTION));
        assertEquals("RuntimeException", g.edgesOfKind(EdgeKind.EXCEPTION).get(0).label());
        assertEquals(List.of("n4-SEQUENTIAL->n7", "n6-SEQUENTIAL->n7"), describe(g.incoming("n7")));
    }

    @Test
    void testReturnPassesThroughFinally() {
        FlowGraph g = cfg("int f() { try { return compute(); } finally { cleanup(); } }");

        assertEquals(NodeKind.FINALLY, g.node("n4").orElseThrow().kind());
        assertTrue(describe(g.incoming("n4")).contains("n3-SEQUENTIAL->n4"));
        assertTrue(g.outgoing("n3").stream().noneMatch(e -> e.target().equals("n1")));
        assertEquals(List.of("n5-SEQUENTIAL->n1", "n5-EXCEPTION->n1"), describe(g.incoming("n1")));
    }

    @Test
    void testBreakPassesThroughFinally() {
        FlowGraph g = cfg("void f(int n) { while (n > 0) { try { if (n == 3) break; n--; }"
                + " finally { cleanup(); } } done(); }");

        assertEquals(NodeKind.FINALLY, g.node("n6").orElseThrow().kind());
        assertEquals(List.of("n2->n3", "n4->n6"), edgesOf(g, EdgeKind.TRUE_BRANCH));
        assertTrue(describe(g.incoming("n6")).contains("n5-SEQUENTIAL->n6"));
        assertEquals(List.of("n7->n2"), edgesOf(g, EdgeKind.LOOP_BACK));
        assertEquals(List.of("n2-FALSE_BRANCH->n8", "n7-SEQUENTIAL->n8"), describe(g.incoming("n8")));
    }

    @Test
    void testContinuePassesThroughFinally() {
        FlowGraph g = cfg("void f(int n) { while (n > 0) { try { if (n == 3) continue; n--; }"
                + " finally { cleanup(); } } done(); }");

        assertEquals(List.of("n2->n3", "n4->n6"), edgesOf(g, EdgeKind.TRUE_BRANCH));
        assertEquals(List.of("n7->n2"), edgesOf(g, EdgeKind.LOOP_BACK));
        assertEquals(List.of("n2-FALSE_BRANCH->n8"), describe(g.incoming("n8")));
    }

    @Test
    void testLabeledBreakRunsEveryEnclosingFinally() {
        FlowGraph g = cfg("void f() { outer: while (a()) { try { try { break outer; } finally { b(); } }"
                + " finally { c(); } } done(); }");

        // n3/n4: 外层/内层 TRY，n5: 内层 FINALLY，n6: b()，n7: 外层 FINALLY，n8: c()，n9: done()
        assertEquals(NodeKind.FINALLY, g.node("n5").orElseThrow().kind());
        assertEquals(NodeKind.FINALLY, g.node("n7").orElseThrow().kind());
        assertTrue(describe(g.incoming("n7")).contains("n6-SEQUENTIAL->n7"));
        assertEquals(List.of("n2-FALSE_BRANCH->n9", "n8-SEQUENTIAL->n9"), describe(g.incoming("n9")));
        assertTrue(edgesOf(g, EdgeKind.LOOP_BACK).isEmpty());
    }

    @Test
    void testThrowOutsideTryGoesToExit() {
        FlowGraph g = cfg("void f(int x) { if (x < 0) throw new IllegalArgumentException(); use(x); }");

        assertEquals(List.of("n3->n1"), edgesOf(g, EdgeKind.EXCEPTION));
        assertEquals(List.of("n2->n4"), edgesOf(g, EdgeKind.FALSE_BRANCH));
    }

    @Test
    void testThrowInsideTryIsCaught() {
        FlowGraph g = cfg("void f() { try { throw new RuntimeException(); } catch (RuntimeException e) { log(e); } }");

        assertEquals(List.of("n3-EXCEPTION->n4"), describe(g.outgoing("n3")));
    }

    @Test
    void testStatementsAfterReturnAreKeptButUnreachable() {
        FlowGraph g = cfg("int f() { return 1; dead(); }");

        GraphNode dead = g.node("n3").orElseThrow();
        assertTrue(dead.isUnreachable());
        assertTrue(g.incoming("n3").isEmpty());
        assertFalse(g.node("n2").orElseThrow().isUnreachable());
    }

    @Test
    void testBreakOutsideLoopFails() {
        CfgBuildException e = assertThrows(CfgBuildException.class, () -> cfg("void f() { break; }"));
        assertTrue(e.getMessage().contains("break"));
    }

    @Test
    void testContinueInsideSwitchWithoutLoopFails() {
        assertThrows(CfgBuildException.class, () -> cfg("void f(int k) { switch (k) { case 1: continue; } }"));
    }

    @Test
    void testUnknownStatementDegradesToWarning() {
        MethodDeclaration md = JavaSnippets.method("void f() { int x = 1; }");
        md.getBody().orElseThrow().addStatement(new UnparsableStmt());

        CfgResult result = builder.build(md);

        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("f: "));
        GraphNode unknown = result.graph().node("n3").orElseThrow();
        assertEquals(NodeKind.STATEMENT, unknown.kind());
        assertEquals("UNKNOWN", unknown.metadata().get(GraphNode.META_STATEMENT_TYPE));
        assertEquals(List.of("n3-SEQUENTIAL->n1"), describe(result.graph().incoming("n1")));
    }

    @Test
    void testSynchronizedAndEmptyStatements() {
        FlowGraph g = cfg("void f() { ; synchronized (lock) { a(); } }");

        assertEquals(4, g.nodeCount());
        assertEquals(Set.of("lock"), g.node("n2").orElseThrow().uses());
        assertEquals(List.of("n0->n2", "n2->n3", "n3->n1"), edgesOf(g, EdgeKind.SEQUENTIAL));
    }

    @Test
    void testConstructorEntryDefinesParameters() {
        ConstructorDeclaration ctor = JavaSnippets.type("class T { int v; T(int v) { this.v = v; } }")
                .getConstructors().get(0);

        CfgResult result = builder.build(ctor);

        assertEquals(3, result.graph().nodeCount());
        assertEquals(Set.of("v"), result.graph().node(result.entryId()).orElseThrow().defs());
    }

    @Test
    void testAbstractMethodConnectsEntryToExit() {
        FlowGraph g = builder.build(JavaSnippets.type("abstract class T { abstract int f(int a); }")
                .getMethods().get(0)).graph();

        assertEquals(List.of("n0->n1"), edgesOf(g, EdgeKind.SEQUENTIAL));
    }

    @Test
    void testBuildIsDeterministic() {
        String source = "int f(int[] xs) { int best = 0; for (int x : xs) { try { if (x > best) best = x; }"
                + " catch (RuntimeException e) { continue; } finally { tick(); } } return best; }";
        assertEquals(cfg(source), cfg(source));
    }

    @Test
    void testEntryIsUniqueAndEveryReachableNodeHasIncomingEdge() {
        List<String> sources = List.of(
                "int max(int a, int b) { if (a > b) { return a; } return b; }",
                "void f(int n) { while (n > 0) { if (n == 3) break; n--; } done(); }",
                "void f() { try { a(); } catch (RuntimeException e) { b(); } finally { c(); } d(); }",
                "int f(int k) { switch (k) { case 1: return 1; default: return 2; } }",
                "void f(boolean c) { do { break; } while (c); done(); }",
                "void f(int n) { while (n > 0) { try { if (n == 3) continue; n--; } finally { cleanup(); } } }");

        for (String source : sources) {
            FlowGraph g = cfg(source);
            assertEquals(1, g.nodesOfKind(NodeKind.METHOD_ENTRY).size(), source);
            assertTrue(g.incoming("n0").isEmpty(), source);
            assertFalse(g.incoming("n1").isEmpty(), source);
            for (GraphNode node : g.nodes()) {
                if (node.kind() != NodeKind.METHOD_ENTRY && !node.isUnreachable()) {
                    assertFalse(g.incoming(node.id()).isEmpty(), source + " " + node.id());
                }
            }
            for (GraphEdge e : g.edges()) {
                assertTrue(e.kind().isControl());
            }
        }
    }
}
