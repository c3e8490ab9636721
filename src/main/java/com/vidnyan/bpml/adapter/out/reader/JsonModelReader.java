package com.vidnyan.bpml.adapter.out.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.bpml.application.port.out.ModelReadException;
import com.vidnyan.bpml.application.port.out.ModelSource;
import com.vidnyan.bpml.domain.model.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads the JSON form of a parsed BPML document into the domain model.
 * Elements and widgets carry a {@code type} discriminator holding the variant name
 * (e.g. {@code "UserTask"}, {@code "TaskList"}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonModelReader implements ModelSource {

    private final ObjectMapper objectMapper;

    @Override
    public Model read(Path path) {
        log.debug("Reading model from {}", path);
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException e) {
            throw new ModelReadException("Failed to read model file " + path + ": " + e.getMessage(), e);
        }
        return read(content);
    }

    @Override
    public Model read(String content) {
        ModelDto dto;
        try {
            dto = objectMapper.readValue(content, ModelDto.class);
        } catch (JsonProcessingException e) {
            throw new ModelReadException("Malformed model JSON: " + e.getOriginalMessage(), e);
        }
        if (dto == null) {
            throw new ModelReadException("Model JSON is empty");
        }
        return mapToModel(dto);
    }

    private Model mapToModel(ModelDto dto) {
        return Model.builder()
                .projectInfo(dto.project != null
                        ? new ProjectInfo(dto.project.name, dto.project.version, dto.project.description)
                        : null)
                .entities(map(dto.entities, "entities", this::mapEntity))
                .roles(map(dto.roles, "roles", this::mapRole))
                .processes(map(dto.processes, "processes", this::mapProcess))
                .dashboards(map(dto.dashboards, "dashboards", this::mapDashboard))
                .build();
    }

    private ProcessDefinition mapProcess(ProcessDto dto) {
        String owner = " of process '" + dto.name + "'";
        return ProcessDefinition.builder()
                .name(dto.name)
                .description(dto.description)
                .version(dto.version)
                .entities(map(dto.entities, "entities" + owner, this::mapEntity))
                .roles(map(dto.roles, "roles" + owner, this::mapRole))
                .states(map(dto.states, "states" + owner, s -> new State(s.name, s.description)))
                .tasks(map(dto.tasks, "tasks" + owner, this::mapTask))
                .transitions(map(dto.transitions, "transitions" + owner, t -> Transition.builder()
                        .name(t.name)
                        .fromState(t.from)
                        .toState(t.to)
                        .role(t.role)
                        .condition(t.condition)
                        .build()))
                .elements(map(dto.elements, "elements" + owner, this::mapElement))
                .flows(map(dto.flows, "flows" + owner, f -> new SequenceFlow(f.name, f.source, f.target, f.condition)))
                .sequence(entries(dto.sequence, "sequence" + owner))
                .build();
    }

    private Entity mapEntity(EntityDto dto) {
        String owner = " of entity '" + dto.name + "'";
        List<EntityProperty> properties = new ArrayList<>();
        properties.addAll(map(dto.attributes, "attributes" + owner, a -> new Attribute(a.name, a.type, a.optional, a.list)));
        properties.addAll(map(dto.relationships, "relationships" + owner,
                r -> new Relationship(r.name, r.target, r.cardinality, r.optional)));
        return new Entity(dto.name, properties);
    }

    private Role mapRole(RoleDto dto) {
        String owner = " of role '" + dto.name + "'";
        return new Role(dto.name, dto.description, dto.parent,
                entries(dto.supervises, "supervises" + owner),
                entries(dto.permissions, "permissions" + owner));
    }

    private Task mapTask(TaskDto dto) {
        String owner = " of task '" + dto.name + "'";
        return Task.builder()
                .name(dto.name)
                .description(dto.description)
                .state(dto.state)
                .auto(dto.auto)
                .role(dto.role)
                .entities(entries(dto.entities, "entities" + owner))
                .dependencies(entries(dto.dependencies, "dependencies" + owner))
                .form(mapForm(dto.form))
                .candidateGroups(entries(dto.candidateGroups, "candidateGroups" + owner))
                .priority(dto.priority)
                .build();
    }

    private ProcessElement mapElement(ElementDto dto) {
        if (dto.type == null) {
            throw new ModelReadException("Element '" + dto.name + "' has no type");
        }
        return switch (dto.type) {
            case "StartEvent" -> new StartEvent(dto.name, dto.description);
            case "EndEvent" -> new EndEvent(dto.name, dto.description);
            case "UserTask" -> UserTask.builder()
                    .name(dto.name)
                    .description(dto.description)
                    .assignee(mapAssignee(dto.assignee))
                    .candidateGroups(entries(dto.candidateGroups, "candidateGroups of element '" + dto.name + "'"))
                    .form(mapForm(dto.form))
                    .priority(dto.priority)
                    .build();
            case "ServiceTask" -> ServiceTask.builder()
                    .name(dto.name)
                    .description(dto.description)
                    .implementation(dto.implementation)
                    .retryCount(dto.retryCount)
                    .timeout(dto.timeout)
                    .onFailure(dto.onFailure)
                    .build();
            case "ScriptTask" -> ScriptTask.builder()
                    .name(dto.name)
                    .description(dto.description)
                    .script(dto.script)
                    .language(dto.language)
                    .retryCount(dto.retryCount)
                    .timeout(dto.timeout)
                    .build();
            case "ExclusiveGateway" -> mapGateway(dto, ElementKind.EXCLUSIVE_GATEWAY);
            case "InclusiveGateway" -> mapGateway(dto, ElementKind.INCLUSIVE_GATEWAY);
            case "ParallelGateway" -> mapGateway(dto, ElementKind.PARALLEL_GATEWAY);
            case "DataObject" -> new DataObject(dto.name, dto.description, dto.dataType, dto.list);
            default -> throw new ModelReadException(
                    "Unknown element type '" + dto.type + "' for element '" + dto.name + "'");
        };
    }

    private Gateway mapGateway(ElementDto dto, ElementKind kind) {
        return new Gateway(dto.name, dto.description, kind,
                map(dto.conditions, "conditions of element '" + dto.name + "'", c -> new GatewayCondition(c.expression, c.target)),
                dto.joinType);
    }

    private Assignee mapAssignee(AssigneeDto dto) {
        if (dto == null) return null;
        String type = dto.type != null ? dto.type.toLowerCase() : "role";
        return switch (type) {
            case "role" -> Assignee.role(dto.value);
            case "user" -> Assignee.user(dto.value);
            case "expression" -> Assignee.expression(dto.value);
            default -> throw new ModelReadException("Unknown assignee type '" + dto.type + "'");
        };
    }

    private Form mapForm(FormDto dto) {
        if (dto == null) return null;
        return new Form(dto.name, map(dto.fields, "fields of form '" + dto.name + "'", this::mapField));
    }

    private FormField mapField(FieldDto dto) {
        return new FormField(dto.name, dto.label, dto.type, dto.required,
                map(dto.validations, "validations of field '" + dto.name + "'",
                        v -> new FieldValidation(v.type, v.value, v.message)));
    }

    private Dashboard mapDashboard(DashboardDto dto) {
        return new Dashboard(dto.name, dto.title,
                map(dto.widgets, "widgets of dashboard '" + dto.name + "'", this::mapWidget));
    }

    private Widget mapWidget(WidgetDto dto) {
        if (dto.type == null) {
            throw new ModelReadException("Widget '" + dto.name + "' has no type");
        }
        String owner = " of widget '" + dto.name + "'";
        List<String> columns = entries(dto.columns, "columns" + owner);
        List<String> actions = entries(dto.actions, "actions" + owner);
        return switch (dto.type) {
            case "ProcessInstanceList" -> new ProcessInstanceListWidget(dto.name, dto.process, columns, actions);
            case "TaskList" -> new TaskListWidget(dto.name, dto.process, columns, actions);
            case "ProcessMetrics" -> new ProcessMetricsWidget(dto.name, dto.process, entries(dto.charts, "charts" + owner));
            case "CustomChart" -> new CustomChartWidget(dto.name, dto.chartType, dto.dataSource);
            default -> throw new ModelReadException(
                    "Unknown widget type '" + dto.type + "' for widget '" + dto.name + "'");
        };
    }

    /**
     * Maps a DTO list; a JSON null entry is a read error, not a missing item.
     */
    private static <D, T> List<T> map(List<D> items, String field, Function<D, T> mapper) {
        if (items == null) return List.of();
        return entries(items, field).stream().map(mapper).toList();
    }

    private static <T> List<T> entries(List<T> values, String field) {
        if (values == null) return null;
        if (values.contains(null)) {
            throw new ModelReadException("Null entry in " + field);
        }
        return values;
    }

    // DTO classes for JSON deserialization
    static class ModelDto {
        public ProjectDto project;
        public List<EntityDto> entities;
        public List<RoleDto> roles;
        public List<ProcessDto> processes;
        public List<DashboardDto> dashboards;
    }

    static class ProjectDto {
        public String name;
        public String version;
        public String description;
    }

    static class EntityDto {
        public String name;
        public List<AttributeDto> attributes;
        public List<RelationshipDto> relationships;
    }

    static class AttributeDto {
        public String name;
        public String type;
        public boolean optional;
        public boolean list;
    }

    static class RelationshipDto {
        public String name;
        public String target;
        public String cardinality;
        public boolean optional;
    }

    static class RoleDto {
        public String name;
        public String description;
        public String parent;
        public List<String> supervises;
        public List<String> permissions;
    }

    static class ProcessDto {
        public String name;
        public String description;
        public String version;
        public List<EntityDto> entities;
        public List<RoleDto> roles;
        public List<StateDto> states;
        public List<TaskDto> tasks;
        public List<TransitionDto> transitions;
        public List<ElementDto> elements;
        public List<FlowDto> flows;
        public List<String> sequence;
    }

    static class StateDto {
        public String name;
        public String description;
    }

    static class TaskDto {
        public String name;
        public String description;
        public String state;
        public boolean auto;
        public String role;
        public List<String> entities;
        public List<String> dependencies;
        public FormDto form;
        public List<String> candidateGroups;
        public String priority;
    }

    static class TransitionDto {
        public String name;
        public String from;
        public String to;
        public String role;
        public String condition;
    }

    static class ElementDto {
        public String type;
        public String name;
        public String description;
        public AssigneeDto assignee;
        public List<String> candidateGroups;
        public FormDto form;
        public String priority;
        public String implementation;
        public Integer retryCount;
        public Integer timeout;
        public String onFailure;
        public String script;
        public String language;
        public List<ConditionDto> conditions;
        public String joinType;
        public String dataType;
        public boolean list;
    }

    static class AssigneeDto {
        public String type;
        public String value;
    }

    static class ConditionDto {
        public String expression;
        public String target;
    }

    static class FlowDto {
        public String name;
        public String source;
        public String target;
        public String condition;
    }

    static class FormDto {
        public String name;
        public List<FieldDto> fields;
    }

    static class FieldDto {
        public String name;
        public String label;
        public String type;
        public boolean required;
        public List<ValidationDto> validations;
    }

    static class ValidationDto {
        public String type;
        public String value;
        public String message;
    }

    static class DashboardDto {
        public String name;
        public String title;
        public List<WidgetDto> widgets;
    }

    static class WidgetDto {
        public String type;
        public String name;
        public String process;
        public List<String> columns;
        public List<String> actions;
        public List<String> charts;
        public String chartType;
        public String dataSource;
    }
}
