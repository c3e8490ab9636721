package com.vidnyan.bpml.adapter.out.validator;

import com.vidnyan.bpml.domain.graph.FlowGraph;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.ProcessElement;
import com.vidnyan.bpml.domain.model.SequenceFlow;
import com.vidnyan.bpml.domain.validation.ErrorKind;
import com.vidnyan.bpml.domain.validation.ModelValidationException;
import com.vidnyan.bpml.domain.validation.ValidationContext;
import com.vidnyan.bpml.domain.validation.ValidationPass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Enforces flow topology: start events have no incoming flow, end events no outgoing
 * flow, and every other element, data objects included, has both.
 * Flows are taken as exhaustive. Processes ordered by an implicit step sequence
 * instead of explicit flows are left to the referential pass.
 */
@Slf4j
@Component
@Order(40)
public class ConnectivityValidationPass implements ValidationPass {

    @Override
    public void validate(ValidationContext context) {
        for (ProcessDefinition process : context.model().processes()) {
            if (process.elements().isEmpty()) {
                continue;
            }
            if (process.flows().isEmpty() && !process.sequence().isEmpty()) {
                log.debug("Process {} uses an implicit sequence, skipping topology checks", process.name());
                continue;
            }
            validateProcess(process, FlowGraph.build(process));
        }
    }

    private void validateProcess(ProcessDefinition process, FlowGraph graph) {
        String name = process.name();
        log.debug("Checking topology of process {} ({} elements, {} flows)",
                name, graph.stats().elementCount(), graph.stats().flowCount());

        for (SequenceFlow flow : process.flows()) {
            for (String endpoint : new String[]{flow.source(), flow.target()}) {
                if (graph.getElement(endpoint).isEmpty()) {
                    throw ModelValidationException.of(ErrorKind.UNRESOLVED_REFERENCE,
                            "Sequence flow from '" + flow.source() + "' to '" + flow.target()
                                    + "' connects undeclared element '" + endpoint + "' in process '" + name + "'",
                            name, endpoint);
                }
            }
        }

        for (ProcessElement element : graph.getElements()) {
            String elementName = element.name();
            boolean hasIncoming = !graph.getIncoming(elementName).isEmpty();
            boolean hasOutgoing = !graph.getOutgoing(elementName).isEmpty();

            switch (element.kind()) {
                case START_EVENT -> {
                    if (hasIncoming) {
                        throw topology("Start event '" + elementName + "' has incoming flow", name, elementName);
                    }
                }
                case END_EVENT -> {
                    if (hasOutgoing) {
                        throw topology("End event '" + elementName + "' has outgoing flow", name, elementName);
                    }
                }
                case USER_TASK, SERVICE_TASK, SCRIPT_TASK,
                        EXCLUSIVE_GATEWAY, INCLUSIVE_GATEWAY, PARALLEL_GATEWAY, DATA_OBJECT -> {
                    if (!hasIncoming || !hasOutgoing) {
                        String missing = !hasIncoming && !hasOutgoing ? "no incoming or outgoing flow"
                                : !hasIncoming ? "no incoming flow" : "no outgoing flow";
                        throw topology("Element '" + elementName + "' is disconnected (" + missing + ")",
                                name, elementName);
                    }
                }
            }
        }
    }

    private static ModelValidationException topology(String message, String process, String element) {
        return ModelValidationException.of(ErrorKind.INVALID_TOPOLOGY,
                message + " in process '" + process + "'", process, element);
    }
}
