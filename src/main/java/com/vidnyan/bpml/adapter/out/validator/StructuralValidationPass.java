package com.vidnyan.bpml.adapter.out.validator;

import com.vidnyan.bpml.domain.model.*;
import com.vidnyan.bpml.domain.validation.ErrorKind;
import com.vidnyan.bpml.domain.validation.ModelValidationException;
import com.vidnyan.bpml.domain.validation.ValidationContext;
import com.vidnyan.bpml.domain.validation.ValidationPass;
import com.vidnyan.bpml.domain.vocabulary.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Uniqueness, presence and closed-value-set checks.
 * Runs first: a model with duplicate names or malformed definitions is rejected
 * before any reference is resolved.
 */
@Slf4j
@Component
@Order(10)
public class StructuralValidationPass implements ValidationPass {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Override
    public void validate(ValidationContext context) {
        Model model = context.model();

        validateProjectInfo(model.projectInfo());

        requireNames(model.processes(), ProcessDefinition::name, "process", "", null);
        requireUnique(model.processes(), ProcessDefinition::name, "process", "", null);
        requireNames(model.entities(), Entity::name, "entity", "", null);
        requireUnique(model.entities(), Entity::name, "entity", "", null);
        for (Entity entity : model.entities()) {
            validateEntity(entity, null);
        }
        requireNames(model.roles(), Role::name, "role", "", null);
        requireUnique(model.roles(), Role::name, "role", "", null);
        requireNames(model.dashboards(), Dashboard::name, "dashboard", "", null);
        requireUnique(model.dashboards(), Dashboard::name, "dashboard", "", null);

        for (ProcessDefinition process : model.processes()) {
            validateProcess(process);
        }
        for (Dashboard dashboard : model.dashboards()) {
            validateDashboard(dashboard);
        }
    }

    private void validateProjectInfo(ProjectInfo projectInfo) {
        if (projectInfo == null || projectInfo.name() == null || projectInfo.name().isBlank()) {
            throw ModelValidationException.of(ErrorKind.PROJECT_INFO,
                    "Project name is required", null, null);
        }
        if (!IDENTIFIER.matcher(projectInfo.name()).matches()) {
            throw ModelValidationException.of(ErrorKind.PROJECT_INFO,
                    "Project name '" + projectInfo.name() + "' is not a valid identifier", null, null);
        }
    }

    private void validateProcess(ProcessDefinition process) {
        String name = process.name();
        String scope = inProcess(name);
        log.debug("Structural checks for process {}", name);

        requireNames(process.entities(), Entity::name, "entity", scope, name);
        requireUnique(process.entities(), Entity::name, "entity", scope, name);
        for (Entity entity : process.entities()) {
            validateEntity(entity, name);
        }
        requireNames(process.roles(), Role::name, "role", scope, name);
        requireUnique(process.roles(), Role::name, "role", scope, name);
        requireNames(process.states(), State::name, "state", scope, name);
        requireUnique(process.states(), State::name, "state", scope, name);
        requireNames(process.tasks(), Task::name, "task", scope, name);
        requireUnique(process.tasks(), Task::name, "task", scope, name);
        for (Task task : process.tasks()) {
            validateTask(task, name);
        }
        requireNames(process.transitions(), Transition::name, "transition", scope, name);
        requireUnique(process.transitions(), Transition::name, "transition", scope, name);
        requireNames(process.elements(), ProcessElement::name, "element", scope, name);
        requireUnique(process.elements(), ProcessElement::name, "element", scope, name);
        requireUnique(process.flows(), SequenceFlow::name, "flow", scope, name);

        if (!process.elements().isEmpty()) {
            requireEvent(process, ElementKind.START_EVENT, "start event");
            requireEvent(process, ElementKind.END_EVENT, "end event");
        }
        for (ProcessElement element : process.elements()) {
            validateElement(element, name);
        }
    }

    private void requireEvent(ProcessDefinition process, ElementKind kind, String label) {
        if (process.elementsOfKind(kind).isEmpty()) {
            throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                    "Process '" + process.name() + "' must have at least one " + label,
                    process.name(), null);
        }
    }

    private void validateEntity(Entity entity, String process) {
        requireNames(entity.properties(), EntityProperty::name, "property",
                " in entity '" + entity.name() + "'" + inProcess(process), process);
        requireUnique(entity.properties(), EntityProperty::name, "property",
                " in entity '" + entity.name() + "'" + inProcess(process), process);
        for (Relationship relationship : entity.relationships()) {
            requireToken(relationship.cardinality(), Cardinality::fromToken, Cardinality.values(),
                    "cardinality", "relationship '" + relationship.name() + "' of entity '" + entity.name() + "'",
                    process, entity.name());
        }
    }

    private void validateTask(Task task, String process) {
        if (task.auto() == task.hasRole()) {
            throw ModelValidationException.of(ErrorKind.TASK_ASSIGNMENT,
                    "Task '" + task.name() + "' must be either automated (use 'auto') "
                            + "or assigned to a role (use 'by RoleName') in process '" + process + "'",
                    process, task.name());
        }
        requireToken(task.priority(), Priority::fromToken, Priority.values(),
                "priority", "task '" + task.name() + "'", process, task.name());
        if (task.form() != null) {
            validateForm(task.form(), task.name(), process);
        }
    }

    private void validateElement(ProcessElement element, String process) {
        String owner = element.kind() + " '" + element.name() + "'";
        switch (element.kind()) {
            case USER_TASK -> {
                UserTask task = (UserTask) element;
                if (task.assignee() == null && task.candidateGroups().isEmpty()) {
                    throw ModelValidationException.of(ErrorKind.TASK_ASSIGNMENT,
                            "User task '" + task.name() + "' must have an assignee or candidate groups"
                                    + inProcess(process),
                            process, task.name());
                }
                requireToken(task.priority(), Priority::fromToken, Priority.values(),
                        "priority", owner, process, task.name());
                if (task.form() != null) {
                    validateForm(task.form(), task.name(), process);
                }
            }
            case SERVICE_TASK -> {
                ServiceTask task = (ServiceTask) element;
                requireText(task.implementation(), owner + " has no implementation defined", process, task.name());
            }
            case SCRIPT_TASK -> {
                ScriptTask task = (ScriptTask) element;
                requireText(task.script(), owner + " has no script defined", process, task.name());
                requireToken(task.language(), ScriptLanguage::fromToken, ScriptLanguage.values(),
                        "script language", owner, process, task.name());
            }
            case EXCLUSIVE_GATEWAY, INCLUSIVE_GATEWAY -> {
                Gateway gateway = (Gateway) element;
                if (gateway.conditions().isEmpty()) {
                    throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                            "Gateway '" + gateway.name() + "' has no conditions defined" + inProcess(process),
                            process, gateway.name());
                }
                requireToken(gateway.joinType(), JoinType::fromToken, JoinType.values(),
                        "join type", owner, process, gateway.name());
            }
            case PARALLEL_GATEWAY -> {
                Gateway gateway = (Gateway) element;
                requireToken(gateway.joinType(), JoinType::fromToken, JoinType.values(),
                        "join type", owner, process, gateway.name());
            }
            case START_EVENT, END_EVENT, DATA_OBJECT -> {
                // no variant-specific structure
            }
        }
    }

    private void validateForm(Form form, String ownerTask, String process) {
        String formName = form.name() != null ? form.name() : ownerTask;
        if (form.fields().isEmpty()) {
            throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                    "Form '" + formName + "' of task '" + ownerTask + "' has no fields" + inProcess(process),
                    process, ownerTask);
        }
        requireNames(form.fields(), FormField::name, "field",
                " in form '" + formName + "'" + inProcess(process), process);
        requireUnique(form.fields(), FormField::name, "field",
                " in form '" + formName + "'" + inProcess(process), process);
        for (FormField field : form.fields()) {
            String owner = "field '" + field.name() + "' of form '" + formName + "'";
            requireToken(field.fieldType(), FieldType::fromToken, FieldType.values(),
                    "field type", owner, process, ownerTask);
            for (FieldValidation rule : field.validations()) {
                if (rule.type() == null) {
                    throw invalidToken("validation type", null, owner, ValidationType.values(), process, ownerTask);
                }
                requireToken(rule.type(), ValidationType::fromToken, ValidationType.values(),
                        "validation type", owner, process, ownerTask);
            }
        }
    }

    private void validateDashboard(Dashboard dashboard) {
        String scope = " in dashboard '" + dashboard.name() + "'";
        requireUnique(dashboard.widgets(), Widget::name, "widget", scope, null);

        for (Widget widget : dashboard.widgets()) {
            String owner = widget.kind() + " widget"
                    + (widget.name() != null ? " '" + widget.name() + "'" : "") + scope;
            switch (widget.kind()) {
                case PROCESS_INSTANCE_LIST -> {
                    ProcessInstanceListWidget list = (ProcessInstanceListWidget) widget;
                    validateListWidget(list.columns(), list.actions(), owner);
                }
                case TASK_LIST -> {
                    TaskListWidget list = (TaskListWidget) widget;
                    validateListWidget(list.columns(), list.actions(), owner);
                }
                case PROCESS_METRICS -> {
                    ProcessMetricsWidget metrics = (ProcessMetricsWidget) widget;
                    if (metrics.charts().isEmpty()) {
                        throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                                owner + " has no charts", null, widget.name());
                    }
                    for (String chart : metrics.charts()) {
                        requireToken(chart, ChartType::fromToken, ChartType.values(),
                                "chart type", owner, null, widget.name());
                    }
                }
                case CUSTOM_CHART -> {
                    CustomChartWidget chart = (CustomChartWidget) widget;
                    requireText(chart.chartType(), owner + " has no chart type", null, widget.name());
                    requireToken(chart.chartType(), ChartType::fromToken, ChartType.values(),
                            "chart type", owner, null, widget.name());
                    requireText(chart.dataSource(), owner + " has no data source", null, widget.name());
                }
            }
        }
    }

    private void validateListWidget(List<String> columns, List<String> actions, String owner) {
        if (columns.isEmpty()) {
            throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                    owner + " has no columns", null, null);
        }
        for (String action : actions) {
            requireToken(action, ActionType::fromToken, ActionType.values(),
                    "action type", owner, null, null);
        }
    }

    private <T> void requireNames(List<T> items, Function<T, String> nameOf,
                                  String category, String scope, String process) {
        for (T item : items) {
            String name = nameOf.apply(item);
            if (name == null || name.isBlank()) {
                throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                        Character.toUpperCase(category.charAt(0)) + category.substring(1)
                                + " without a name" + scope,
                        process, null);
            }
        }
    }

    /**
     * First repeat of a non-null name raises; unnamed items are skipped.
     */
    private <T> void requireUnique(List<T> items, Function<T, String> nameOf,
                                   String category, String scope, String process) {
        Set<String> seen = new HashSet<>();
        for (T item : items) {
            String name = nameOf.apply(item);
            if (name != null && !seen.add(name)) {
                throw ModelValidationException.of(ErrorKind.DUPLICATE_NAME,
                        "Duplicate " + category + " name '" + name + "'" + scope,
                        process, name);
            }
        }
    }

    private void requireText(String value, String message, String process, String element) {
        if (value == null || value.isBlank()) {
            throw ModelValidationException.of(ErrorKind.EMPTY_DEFINITION,
                    message + inProcess(process), process, element);
        }
    }

    /**
     * Absent tokens are allowed; present ones must belong to the value set.
     */
    private <E extends Enum<E> & VocabularyToken> void requireToken(
            String token, Function<String, Optional<E>> lookup, E[] values,
            String field, String owner, String process, String element) {
        if (token != null && lookup.apply(token).isEmpty()) {
            throw invalidToken(field, token, owner, values, process, element);
        }
    }

    private <E extends Enum<E> & VocabularyToken> ModelValidationException invalidToken(
            String field, String token, String owner, E[] values, String process, String element) {
        return ModelValidationException.of(ErrorKind.INVALID_ENUM_VALUE,
                "Invalid " + field + " '" + token + "' on " + owner + inProcess(process)
                        + " (expected one of: " + String.join(", ", VocabularyToken.tokens(values)) + ")",
                process, element);
    }

    private static String inProcess(String process) {
        return process != null ? " in process '" + process + "'" : "";
    }
}
