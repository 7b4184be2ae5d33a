package org.suiteflow.orchestrator.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.suiteflow.orchestrator.model.DependencyGraph;
import org.suiteflow.orchestrator.model.NodeStatus;
import org.suiteflow.orchestrator.model.TestDefinition;
import org.suiteflow.orchestrator.model.TestPriority;
import org.suiteflow.orchestrator.registry.TestRegistry;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphBuilderTest {

    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new DependencyGraphBuilder();
    }

    private static TestDefinition test(String name, TestPriority priority, String... dependsOn) {
        return TestDefinition.builder()
                .name(name)
                .priority(priority)
                .dependsOn(dependsOn)
                .body(fixtures -> { })
                .build();
    }

    private static TestDefinition test(String name, String... dependsOn) {
        return test(name, TestPriority.MEDIUM, dependsOn);
    }

    private static void assertTopological(DependencyGraph graph) {
        List<String> order = graph.getExecutionOrder();
        assertEquals(graph.size(), order.size());
        graph.nodeList().forEach(node -> node.getDependencies().forEach(dependency ->
                assertTrue(order.indexOf(dependency) < order.indexOf(node.getTestName()),
                        dependency + " must run before " + node.getTestName() + " in " + order)));
    }

    // --- structure ---

    @Test
    void build_CreatesOneNodePerDefinition_AllPending() {
        DependencyGraph graph = builder.build(TestRegistry.of(test("a"), test("b", "a"), test("c", "a")));

        assertEquals(3, graph.size());
        assertFalse(graph.hasCycles());
        assertTrue(graph.getCycles().isEmpty());
        graph.nodeList().forEach(node -> assertEquals(NodeStatus.PENDING, node.getStatus()));
    }

    @Test
    void build_FillsDependentsByInvertingEdges() {
        DependencyGraph graph = builder.build(TestRegistry.of(test("a"), test("b", "a"), test("c", "a", "b")));

        assertEquals(List.of("b", "c"), graph.getNode("a").getDependents());
        assertEquals(List.of("c"), graph.getNode("b").getDependents());
        assertTrue(graph.getNode("c").getDependents().isEmpty());
    }

    @Test
    void build_DuplicateDependencyNames_AreCollapsed() {
        DependencyGraph graph = builder.build(TestRegistry.of(test("a"), test("b", "a", "a")));

        assertEquals(List.of("a"), graph.getNode("b").getDependencies());
        assertEquals(List.of("b"), graph.getNode("a").getDependents());
        assertEquals(List.of("a", "b"), graph.getExecutionOrder());
    }

    // --- execution order ---

    @Test
    void executionOrder_IsTopological_ForDiamond() {
        DependencyGraph graph = builder.build(TestRegistry.of(
                test("d", "b", "c"), test("c", "a"), test("b", "a"), test("a")));

        assertTopological(graph);
        assertEquals("a", graph.getExecutionOrder().get(0));
        assertEquals("d", graph.getExecutionOrder().get(3));
    }

    @Test
    void executionOrder_TieBreak_HighestPriorityFirst() {
        DependencyGraph graph = builder.build(TestRegistry.of(
                test("low", TestPriority.LOW),
                test("medium", TestPriority.MEDIUM),
                test("high", TestPriority.HIGH),
                test("highest", TestPriority.HIGHEST)));

        assertEquals(List.of("highest", "high", "medium", "low"), graph.getExecutionOrder());
    }

    @Test
    void executionOrder_TieBreak_SamePriorityKeepsDeclarationOrder() {
        DependencyGraph graph = builder.build(TestRegistry.of(test("x"), test("y"), test("z")));

        assertEquals(List.of("x", "y", "z"), graph.getExecutionOrder());
    }

    @Test
    void executionOrder_DependencyOutranksPriority() {
        DependencyGraph graph = builder.build(TestRegistry.of(
                test("setup", TestPriority.LOW),
                test("critical", TestPriority.HIGHEST, "setup"),
                test("other", TestPriority.MEDIUM)));

        // "critical" becomes ready only after "setup", then jumps ahead of "other"
        assertEquals(List.of("other", "setup", "critical"), graph.getExecutionOrder());
        assertTopological(graph);
    }

    @Test
    void executionOrder_NewlyReadyHighPriorityRunsBeforeWaitingLowPriority() {
        DependencyGraph graph = builder.build(TestRegistry.of(
                test("login", TestPriority.HIGHEST),
                test("cleanup", TestPriority.LOW),
                test("chat", TestPriority.HIGH, "login")));

        assertEquals(List.of("login", "chat", "cleanup"), graph.getExecutionOrder());
    }

    @Test
    void build_Twice_GivesIdenticalOrder() {
        TestRegistry registry = TestRegistry.of(
                test("a", TestPriority.LOW), test("b", TestPriority.HIGH, "a"),
                test("c", TestPriority.HIGHEST), test("d", TestPriority.MEDIUM, "c"),
                test("e", TestPriority.HIGH, "b", "d"));

        assertEquals(builder.build(registry).getExecutionOrder(), builder.build(registry).getExecutionOrder());
    }

    @Test
    void build_EmptyRegistry_GivesEmptyGraph() {
        DependencyGraph graph = builder.build(new TestRegistry());

        assertEquals(0, graph.size());
        assertTrue(graph.getExecutionOrder().isEmpty());
        assertFalse(graph.hasCycles());
    }

    // --- cycles ---

    @Test
    void build_TwoNodeCycle_IsReported() {
        DependencyGraph graph = builder.build(TestRegistry.of(test("A", "B"), test("B", "A")));

        assertTrue(graph.hasCycles());
        assertEquals(List.of(List.of("A", "B")), graph.getCycles());
        assertTrue(graph.getExecutionOrder().isEmpty());
    }

    @Test
    void build_SelfDependency_IsACycle() {
        DependencyGraph graph = builder.build(TestRegistry.of(test("A", "A")));

        assertTrue(graph.hasCycles());
        assertEquals(List.of(List.of("A")), graph.getCycles());
    }

    @Test
    void build_DisjointCycles_AreAllReportedInOnePass() {
        DependencyGraph graph = builder.build(TestRegistry.of(
                test("a", "b"), test("b", "a"),
                test("ok"),
                test("x", "y"), test("y", "z"), test("z", "x")));

        assertTrue(graph.hasCycles());
        assertEquals(2, graph.getCycles().size());
        assertTrue(graph.getCycles().contains(List.of("a", "b")));
        assertTrue(graph.getCycles().contains(List.of("x", "y", "z")));
    }

    @Test
    void build_CycleBehindAcyclicPrefix_IsReported() {
        DependencyGraph graph = builder.build(TestRegistry.of(
                test("entry", "loop1"), test("loop1", "loop2"), test("loop2", "loop1")));

        assertEquals(List.of(List.of("loop1", "loop2")), graph.getCycles());
    }

    @Test
    void build_Twice_GivesIdenticalCycleReports() {
        TestRegistry registry = TestRegistry.of(test("c", "a"), test("a", "b"), test("b", "c"));

        assertEquals(builder.build(registry).getCycles(), builder.build(registry).getCycles());
        assertEquals(List.of(List.of("c", "a", "b")), builder.build(registry).getCycles());
    }

    @Test
    void buildAcyclic_ThrowsWithAllCycles() {
        TestRegistry registry = TestRegistry.of(test("A", "B"), test("B", "A"));

        DependencyCycleException e = assertThrows(DependencyCycleException.class,
                () -> builder.buildAcyclic(registry));

        assertEquals(List.of(List.of("A", "B")), e.getCycles());
        assertTrue(e.getMessage().contains("A -> B -> A"));
        assertTrue(e.getGraph().hasCycles());
    }

    // --- configuration errors ---

    @Test
    void build_UnknownDependency_FailsWithConfigurationError() {
        TestRegistry registry = TestRegistry.of(test("a", "missing"));

        OrchestratorConfigurationException e = assertThrows(OrchestratorConfigurationException.class,
                () -> builder.build(registry));

        assertEquals(1, e.getProblems().size());
        assertTrue(e.getProblems().get(0).contains("\"missing\""));
    }

    @Test
    void build_ReportsAllConfigurationProblemsTogether() {
        TestRegistry registry = new TestRegistry()
                .register(test("a", "ghost"))
                .register(test("a"))
                .register(test("b", "phantom"))
                .register(TestDefinition.builder().name("no body").build());

        OrchestratorConfigurationException e = assertThrows(OrchestratorConfigurationException.class,
                () -> builder.build(registry));

        assertEquals(4, e.getProblems().size());
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("Duplicate test name: \"a\"")));
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("\"ghost\"")));
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("\"phantom\"")));
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("has no test body")));
    }

    @Test
    void build_BlankName_IsAConfigurationError() {
        TestRegistry registry = new TestRegistry().register(test(" "));

        OrchestratorConfigurationException e = assertThrows(OrchestratorConfigurationException.class,
                () -> builder.build(registry));

        assertTrue(e.getProblems().get(0).contains("without a name"));
    }
}
