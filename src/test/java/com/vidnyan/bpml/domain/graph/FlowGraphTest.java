package com.vidnyan.bpml.domain.graph;

import com.vidnyan.bpml.TestModels;
import com.vidnyan.bpml.domain.model.ElementKind;
import com.vidnyan.bpml.domain.model.EndEvent;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.SequenceFlow;
import com.vidnyan.bpml.domain.model.StartEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowGraphTest {

    @Test
    void build_ShouldIndexFlowsBothWays() {
        FlowGraph graph = FlowGraph.build(TestModels.onboarding());

        assertEquals(List.of("Review"), graph.getOutgoing("Start"));
        assertEquals(List.of("Provision"), graph.getIncoming("End"));
        assertEquals(0, graph.fanIn("Start"));
        assertEquals(1, graph.fanOut("Review"));
        assertEquals(ElementKind.SERVICE_TASK, graph.kindOf("Provision").orElseThrow());
        assertEquals(List.of("Review"), graph.elementsOfKind(ElementKind.USER_TASK));
        assertEquals(new FlowGraph.Stats(4, 3), graph.stats());
    }

    @Test
    void toDirectedGraph_ShouldDropEdgesToUndeclaredElements() {
        ProcessDefinition process = TestModels.withElements("Broken",
                List.of(new StartEvent("Start", null), new EndEvent("End", null)),
                SequenceFlow.of("Start", "End"),
                SequenceFlow.of("Start", "Ghost"));

        DirectedGraph graph = FlowGraph.build(process).toDirectedGraph();

        assertEquals(List.of("Start", "End"), List.copyOf(graph.nodes()));
        assertEquals(List.of("End"), graph.getSuccessors("Start"));
    }
}
