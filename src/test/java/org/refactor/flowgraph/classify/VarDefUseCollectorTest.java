package org.refactor.flowgraph.classify;

import org.junit.jupiter.api.Test;
import org.refactor.flowgraph.JavaSnippets;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class VarDefUseCollectorTest {

    private final Set<String> defs = new LinkedHashSet<>();
    private final Set<String> uses = new LinkedHashSet<>();

    private void collect(String statement) {
        VarDefUseCollector.collect(JavaSnippets.statement(statement), defs, uses);
    }

    @Test
    void testDeclarationDefinesAndInitializerUses() {
        collect("int sum = a + b;");
        assertEquals(Set.of("sum"), defs);
        assertEquals(List.of("a", "b"), List.copyOf(uses));
    }

    @Test
    void testPlainAssignmentDoesNotReadTarget() {
        collect("x = y * 2;");
        assertEquals(Set.of("x"), defs);
        assertEquals(Set.of("y"), uses);
    }

    @Test
    void testCompoundAssignmentReadsTarget() {
        collect("total += price;");
        assertEquals(Set.of("total"), defs);
        assertEquals(List.of("total", "price"), List.copyOf(uses));
    }

    @Test
    void testIncrementIsDefAndUse() {
        collect("count++;");
        assertEquals(Set.of("count"), defs);
        assertEquals(Set.of("count"), uses);
    }

    @Test
    void testArrayElementAssignment() {
        collect("values[i] = v;");
        assertEquals(Set.of("values"), defs);
        assertTrue(uses.containsAll(Set.of("i", "v")));
        assertFalse(uses.contains("values"));
    }

    @Test
    void testThisFieldSameAsBareName() {
        collect("this.size = this.size + n;");
        assertEquals(Set.of("size"), defs);
        assertEquals(List.of("size", "n"), List.copyOf(uses));
    }

    @Test
    void testTypeNamesAreNotVariables() {
        collect("System.out.println(Math.max(a, b));");
        assertTrue(defs.isEmpty());
        assertEquals(List.of("a", "b"), List.copyOf(uses));
    }

    @Test
    void testLambdaParametersStayInsideLambda() {
        collect("items.forEach(item -> { int doubled = item * factor; sink.accept(doubled); });");
        assertTrue(defs.isEmpty());
        assertEquals(List.of("items", "factor", "sink"), List.copyOf(uses));
    }

    @Test
    void testCallTargetComesBeforeArguments() {
        collect("buffer.append(prefix).append(names.get(index));");
        assertTrue(defs.isEmpty());
        assertEquals(List.of("buffer", "prefix", "names", "index"), List.copyOf(uses));
    }

    @Test
    void testAnonymousClassBodyIgnored() {
        collect("Runnable r = new Runnable() { public void run() { hidden = 1; } };");
        assertEquals(Set.of("r"), defs);
        assertFalse(uses.contains("hidden"));
    }

    @Test
    void testUsesOfCondition() {
        Set<String> found = VarDefUseCollector.usesOf(JavaSnippets.statement("if (a > b && flag) {}")
                .asIfStmt().getCondition());
        assertEquals(List.of("a", "b", "flag"), List.copyOf(found));
    }
}
