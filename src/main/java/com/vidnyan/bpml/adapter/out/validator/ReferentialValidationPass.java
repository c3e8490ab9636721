package com.vidnyan.bpml.adapter.out.validator;

import com.vidnyan.bpml.domain.model.*;
import com.vidnyan.bpml.domain.registry.ModelRegistry;
import com.vidnyan.bpml.domain.registry.ProcessRegistry;
import com.vidnyan.bpml.domain.validation.ErrorKind;
import com.vidnyan.bpml.domain.validation.ModelValidationException;
import com.vidnyan.bpml.domain.validation.ValidationContext;
import com.vidnyan.bpml.domain.validation.ValidationPass;
import com.vidnyan.bpml.domain.vocabulary.AttributeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;

/**
 * Resolves every cross-reference against the registries.
 * Entity and role references resolve within the owning process or the model-wide
 * collections; states, tasks and elements resolve within the owning process only.
 */
@Slf4j
@Component
@Order(20)
public class ReferentialValidationPass implements ValidationPass {

    @Override
    public void validate(ValidationContext context) {
        Model model = context.model();
        ModelRegistry registry = context.registry();

        for (Role role : model.roles()) {
            validateRole(role, registry::hasRole, null);
        }
        for (Entity entity : model.entities()) {
            validateEntity(entity, registry::hasEntity, null);
        }

        for (ProcessDefinition process : model.processes()) {
            log.debug("Resolving references in process {}", process.name());
            validateProcess(process, registry.forProcess(process));
        }

        for (Dashboard dashboard : model.dashboards()) {
            for (Widget widget : dashboard.widgets()) {
                if (widget.process() != null && !registry.hasProcess(widget.process())) {
                    throw unresolved(widget.kind() + " widget in dashboard '" + dashboard.name()
                                    + "' references unknown process '" + widget.process() + "'",
                            null, widget.name());
                }
            }
        }
    }

    private void validateProcess(ProcessDefinition process, ProcessRegistry registry) {
        String name = process.name();

        for (Role role : process.roles()) {
            validateRole(role, registry::hasRole, name);
        }
        for (Entity entity : process.entities()) {
            validateEntity(entity, registry::hasEntity, name);
        }
        for (Task task : process.tasks()) {
            validateTask(task, registry, name);
        }
        for (Transition transition : process.transitions()) {
            validateTransition(transition, registry, name);
        }
        for (ProcessElement element : process.elements()) {
            validateElement(element, registry, name);
        }
        for (SequenceFlow flow : process.flows()) {
            if (!registry.hasElement(flow.source())) {
                throw unresolved(describe(flow) + " references unknown source element '"
                        + flow.source() + "'" + inProcess(name), name, flow.source());
            }
            if (!registry.hasElement(flow.target())) {
                throw unresolved(describe(flow) + " references unknown target element '"
                        + flow.target() + "'" + inProcess(name), name, flow.target());
            }
        }
        for (String step : process.sequence()) {
            if (!registry.hasStep(step)) {
                throw unresolved("Process flow references unknown step '" + step + "'" + inProcess(name),
                        name, step);
            }
        }
    }

    private void validateRole(Role role, Predicate<String> roleExists, String process) {
        if (role.parent() != null) {
            if (role.parent().equals(role.name())) {
                throw selfReference("Role '" + role.name() + "' cannot inherit from itself" + inProcess(process),
                        process, role.name());
            }
            if (!roleExists.test(role.parent())) {
                throw unresolved("Role '" + role.name() + "' inherits from unknown role '"
                        + role.parent() + "'" + inProcess(process), process, role.name());
            }
        }
        for (String supervised : role.supervises()) {
            if (supervised.equals(role.name())) {
                throw selfReference("Role '" + role.name() + "' cannot supervise itself" + inProcess(process),
                        process, role.name());
            }
            if (!roleExists.test(supervised)) {
                throw unresolved("Role '" + role.name() + "' supervises unknown role '"
                        + supervised + "'" + inProcess(process), process, role.name());
            }
        }
    }

    private void validateEntity(Entity entity, Predicate<String> entityExists, String process) {
        for (Attribute attribute : entity.attributes()) {
            String type = attribute.type();
            if (type == null || (AttributeType.fromToken(type).isEmpty() && !entityExists.test(type))) {
                throw unresolved("Attribute '" + attribute.name() + "' of entity '" + entity.name()
                        + "' references unknown type '" + type + "'" + inProcess(process), process, entity.name());
            }
        }
        for (Relationship relationship : entity.relationships()) {
            if (relationship.target() == null || !entityExists.test(relationship.target())) {
                throw unresolved("Relationship '" + relationship.name() + "' of entity '" + entity.name()
                        + "' references unknown entity '" + relationship.target() + "'" + inProcess(process),
                        process, entity.name());
            }
        }
    }

    private void validateTask(Task task, ProcessRegistry registry, String process) {
        String taskName = task.name();

        if (task.state() != null && !registry.hasState(task.state())) {
            throw unresolved("Task '" + taskName + "' references unknown state '" + task.state() + "'"
                    + inProcess(process), process, taskName);
        }
        if (task.hasRole() && !registry.hasRole(task.role())) {
            throw unresolved("Task '" + taskName + "' references unknown role '" + task.role() + "'"
                    + inProcess(process), process, taskName);
        }
        for (String entity : task.entities()) {
            if (!registry.hasEntity(entity)) {
                throw unresolved("Task '" + taskName + "' references unknown entity '" + entity + "'"
                        + inProcess(process), process, taskName);
            }
        }
        for (String dependency : task.dependencies()) {
            if (dependency.equals(taskName)) {
                throw selfReference("Task '" + taskName + "' cannot depend on itself" + inProcess(process),
                        process, taskName);
            }
            if (!registry.hasTask(dependency)) {
                throw unresolved("Task '" + taskName + "' depends on unknown task '" + dependency + "'"
                        + inProcess(process), process, taskName);
            }
        }
        requireRoles(task.candidateGroups(), "Task '" + taskName + "'", registry, process, taskName);
    }

    private void validateTransition(Transition transition, ProcessRegistry registry, String process) {
        String label = "Transition '" + transition.name() + "'";

        if (!registry.hasState(transition.fromState())) {
            throw unresolved(label + " references unknown from_state '" + transition.fromState() + "'"
                    + inProcess(process), process, transition.name());
        }
        if (!registry.hasState(transition.toState())) {
            throw unresolved(label + " references unknown to_state '" + transition.toState() + "'"
                    + inProcess(process), process, transition.name());
        }
        if (transition.fromState().equals(transition.toState())) {
            throw selfReference(label + " has same from and to state '" + transition.fromState() + "'"
                    + inProcess(process), process, transition.name());
        }
        if (transition.role() != null && !registry.hasRole(transition.role())) {
            throw unresolved(label + " references unknown role '" + transition.role() + "'"
                    + inProcess(process), process, transition.name());
        }
    }

    private void validateElement(ProcessElement element, ProcessRegistry registry, String process) {
        String label = element.kind() + " '" + element.name() + "'";
        switch (element.kind()) {
            case USER_TASK -> {
                UserTask task = (UserTask) element;
                if (task.assignee() != null && task.assignee().isRole()
                        && !registry.hasRole(task.assignee().value())) {
                    throw unresolved(label + " is assigned to unknown role '" + task.assignee().value() + "'"
                            + inProcess(process), process, task.name());
                }
                requireRoles(task.candidateGroups(), label, registry, process, task.name());
            }
            case SERVICE_TASK -> {
                ServiceTask task = (ServiceTask) element;
                requireLimits(task.retryCount(), task.timeout(), label, process, task.name());
            }
            case SCRIPT_TASK -> {
                ScriptTask task = (ScriptTask) element;
                requireLimits(task.retryCount(), task.timeout(), label, process, task.name());
            }
            case EXCLUSIVE_GATEWAY, INCLUSIVE_GATEWAY, PARALLEL_GATEWAY -> {
                Gateway gateway = (Gateway) element;
                for (GatewayCondition condition : gateway.conditions()) {
                    if (condition.expression() == null || condition.expression().isBlank()) {
                        throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                                label + " has an empty condition" + inProcess(process), process, gateway.name());
                    }
                    if (condition.target() != null && !registry.hasElement(condition.target())) {
                        throw unresolved(label + " condition targets unknown element '" + condition.target() + "'"
                                + inProcess(process), process, gateway.name());
                    }
                }
            }
            case DATA_OBJECT -> {
                DataObject dataObject = (DataObject) element;
                String type = dataObject.dataType();
                if (type != null && AttributeType.fromToken(type).isEmpty() && !registry.hasEntity(type)) {
                    throw unresolved(label + " references unknown data type '" + type + "'"
                            + inProcess(process), process, dataObject.name());
                }
            }
            case START_EVENT, END_EVENT -> {
                // no references
            }
        }
    }

    private void requireRoles(List<String> roles, String label, ProcessRegistry registry,
                              String process, String element) {
        for (String role : roles) {
            if (!registry.hasRole(role)) {
                throw unresolved(label + " references unknown candidate group '" + role + "'"
                        + inProcess(process), process, element);
            }
        }
    }

    private void requireLimits(Integer retryCount, Integer timeout, String label, String process, String element) {
        if (retryCount != null && retryCount < 0) {
            throw ModelValidationException.of(ErrorKind.INVALID_ATTRIBUTE_VALUE,
                    label + " has negative retry count " + retryCount + inProcess(process), process, element);
        }
        if (timeout != null && timeout <= 0) {
            throw ModelValidationException.of(ErrorKind.INVALID_ATTRIBUTE_VALUE,
                    label + " must have a positive timeout, got " + timeout + inProcess(process), process, element);
        }
    }

    private static String describe(SequenceFlow flow) {
        return flow.name() != null
                ? "Flow '" + flow.name() + "'"
                : "Flow '" + flow.source() + "' -> '" + flow.target() + "'";
    }

    private static ModelValidationException unresolved(String message, String process, String element) {
        return ModelValidationException.of(ErrorKind.UNRESOLVED_REFERENCE, message, process, element);
    }

    private static ModelValidationException selfReference(String message, String process, String element) {
        return ModelValidationException.of(ErrorKind.SELF_REFERENCE, message, process, element);
    }

    private static String inProcess(String process) {
        return process != null ? " in process '" + process + "'" : "";
    }
}
