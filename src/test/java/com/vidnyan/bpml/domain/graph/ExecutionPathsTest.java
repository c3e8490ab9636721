package com.vidnyan.bpml.domain.graph;

import com.vidnyan.bpml.TestModels;
import com.vidnyan.bpml.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionPathsTest {

    private static ProcessDefinition diamond() {
        return TestModels.withElements("Approval",
                List.of(
                        new StartEvent("Start", null),
                        Gateway.exclusive("Decide", List.of(
                                new GatewayCondition("amount > 100", "Manual"),
                                new GatewayCondition("amount <= 100", "Auto"))),
                        UserTask.builder().name("Manual").assignee(Assignee.role("HR")).build(),
                        ServiceTask.builder().name("Auto").implementation("approve").build(),
                        new EndEvent("End", null)),
                SequenceFlow.of("Start", "Decide"),
                SequenceFlow.of("Decide", "Manual"),
                SequenceFlow.of("Decide", "Auto"),
                SequenceFlow.of("Manual", "End"),
                SequenceFlow.of("Auto", "End"));
    }

    @Test
    void paths_ShouldFollowOutgoingDeclarationOrder() {
        FlowGraph graph = FlowGraph.build(diamond());

        List<List<String>> paths = graph.executionPaths(ExecutionPaths.DEFAULT_MAX_DEPTH).toList();

        assertEquals(List.of(
                List.of("Start", "Decide", "Manual", "End"),
                List.of("Start", "Decide", "Auto", "End")
        ), paths);
    }

    @Test
    void paths_ShouldBeRestartable() {
        ExecutionPaths paths = FlowGraph.build(diamond()).executionPaths(ExecutionPaths.DEFAULT_MAX_DEPTH);

        List<List<String>> first = new ArrayList<>();
        paths.forEach(first::add);
        List<List<String>> second = paths.toList();

        assertEquals(2, first.size());
        assertEquals(first, second);
    }

    @Test
    void paths_ShouldSkipNodesAlreadyOnPath() {
        ProcessDefinition rework = TestModels.withElements("Rework",
                List.of(
                        new StartEvent("Start", null),
                        UserTask.builder().name("Draft").assignee(Assignee.role("HR")).build(),
                        Gateway.exclusive("Ok", List.of(new GatewayCondition("ok", "End"))),
                        new EndEvent("End", null)),
                SequenceFlow.of("Start", "Draft"),
                SequenceFlow.of("Draft", "Ok"),
                SequenceFlow.of("Ok", "Draft"),
                SequenceFlow.of("Ok", "End"));

        List<List<String>> paths = FlowGraph.build(rework).executionPaths(10).toList();

        assertEquals(List.of(List.of("Start", "Draft", "Ok", "End")), paths);
    }

    @Test
    void paths_ShouldAbandonBranchesDeeperThanMaxDepth() {
        ProcessDefinition chain = TestModels.linear("Chain",
                new ScriptTask("A", null, "a()", "groovy", null, null),
                new ScriptTask("B", null, "b()", "groovy", null, null));

        assertTrue(FlowGraph.build(chain).executionPaths(2).toList().isEmpty());
        assertEquals(1, FlowGraph.build(chain).executionPaths(3).toList().size());
    }

    @Test
    void paths_ShouldVisitPairsStartMajor() {
        ProcessDefinition twoByTwo = TestModels.withElements("Pairs",
                List.of(
                        new StartEvent("S1", null),
                        new StartEvent("S2", null),
                        Gateway.parallel("Fork"),
                        new EndEvent("E1", null),
                        new EndEvent("E2", null)),
                SequenceFlow.of("S1", "Fork"),
                SequenceFlow.of("S2", "Fork"),
                SequenceFlow.of("Fork", "E1"),
                SequenceFlow.of("Fork", "E2"));

        List<List<String>> paths = FlowGraph.build(twoByTwo).executionPaths(10).toList();

        assertEquals(List.of(
                List.of("S1", "Fork", "E1"),
                List.of("S1", "Fork", "E2"),
                List.of("S2", "Fork", "E1"),
                List.of("S2", "Fork", "E2")
        ), paths);
    }

    @Test
    void iterator_ShouldThrowWhenExhausted() {
        ProcessDefinition empty = ProcessDefinition.builder().name("Empty").build();

        Iterator<List<String>> iterator = FlowGraph.build(empty).executionPaths(10).iterator();

        assertFalse(iterator.hasNext());
        assertThrows(NoSuchElementException.class, iterator::next);
    }
}
