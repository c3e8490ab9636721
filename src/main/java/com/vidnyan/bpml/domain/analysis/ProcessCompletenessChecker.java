package com.vidnyan.bpml.domain.analysis;

import com.vidnyan.bpml.domain.model.ElementKind;
import com.vidnyan.bpml.domain.model.Gateway;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.ProcessElement;
import com.vidnyan.bpml.domain.model.ServiceTask;
import com.vidnyan.bpml.domain.model.UserTask;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-fatal readiness lint for documentation and editor tooling.
 * Reports the same gaps the validator rejects, as a list of messages.
 */
public final class ProcessCompletenessChecker {

    private ProcessCompletenessChecker() {
    }

    public static List<String> check(ProcessDefinition process) {
        List<String> issues = new ArrayList<>();

        if (process.elementsOfKind(ElementKind.START_EVENT).isEmpty()) {
            issues.add("Process must have at least one start event");
        }
        if (process.elementsOfKind(ElementKind.END_EVENT).isEmpty()) {
            issues.add("Process must have at least one end event");
        }

        for (ProcessElement element : process.elements()) {
            switch (element.kind()) {
                case USER_TASK -> {
                    UserTask task = (UserTask) element;
                    if (task.assignee() == null && task.candidateGroups().isEmpty()) {
                        issues.add("User task '" + task.name() + "' has no assignee or candidate groups");
                    }
                }
                case SERVICE_TASK -> {
                    ServiceTask task = (ServiceTask) element;
                    if (task.implementation() == null || task.implementation().isBlank()) {
                        issues.add("Service task '" + task.name() + "' has no implementation defined");
                    }
                }
                case EXCLUSIVE_GATEWAY, INCLUSIVE_GATEWAY -> {
                    if (((Gateway) element).conditions().isEmpty()) {
                        issues.add("Gateway '" + element.name() + "' has no conditions defined");
                    }
                }
                default -> {
                }
            }
        }

        return issues;
    }
}
