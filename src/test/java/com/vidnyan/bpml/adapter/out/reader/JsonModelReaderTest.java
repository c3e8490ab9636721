package com.vidnyan.bpml.adapter.out.reader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.bpml.adapter.out.validator.ValidationPasses;
import com.vidnyan.bpml.application.port.out.ModelReadException;
import com.vidnyan.bpml.config.BpmlConfiguration;
import com.vidnyan.bpml.domain.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonModelReaderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new BpmlConfiguration().objectMapper();
    private final JsonModelReader reader = new JsonModelReader(objectMapper);

    private static String fixture(String name) throws IOException {
        try (InputStream in = JsonModelReaderTest.class.getResourceAsStream("/models/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void read_Fixture_ShouldMapEveryVariant() throws IOException {
        Model model = reader.read(fixture("onboarding.json"));

        assertEquals("Acme", model.projectInfo().name());
        assertEquals(List.of("HR", "IT"), model.roles().stream().map(Role::name).toList());
        assertEquals("HR", model.roles().get(1).parent());

        Entity employee = model.entities().get(0);
        assertEquals(3, employee.attributes().size());
        assertTrue(employee.attributes().get(2).isList());
        assertEquals("@0..1", employee.relationships().get(0).cardinality());

        ProcessDefinition process = model.getProcess("Onboarding").orElseThrow();
        assertEquals("2.1", process.version());
        assertEquals(List.of(
                ElementKind.START_EVENT, ElementKind.USER_TASK, ElementKind.EXCLUSIVE_GATEWAY,
                ElementKind.SERVICE_TASK, ElementKind.DATA_OBJECT, ElementKind.END_EVENT
        ), process.elements().stream().map(ProcessElement::kind).toList());

        UserTask review = (UserTask) process.findElement("Review").orElseThrow();
        assertTrue(review.assignee().isRole());
        assertEquals("checkbox", review.form().fields().get(0).fieldType());
        assertEquals("required", review.form().fields().get(0).validations().get(0).type());

        ServiceTask provision = (ServiceTask) process.findElement("Provision").orElseThrow();
        assertEquals(2, provision.retryCount());
        assertEquals(30, provision.timeout());

        assertEquals(6, process.flows().size());
        assertEquals("approved", process.flows().get(3).condition());

        List<Widget> widgets = model.dashboards().get(0).widgets();
        assertEquals(List.of(WidgetKind.TASK_LIST, WidgetKind.PROCESS_METRICS, WidgetKind.CUSTOM_CHART),
                widgets.stream().map(Widget::kind).toList());
    }

    @Test
    void read_Fixture_ShouldPassValidation() throws IOException {
        Model model = reader.read(fixture("onboarding.json"));

        assertTrue(ValidationPasses.standardValidator().check(model).isValid());
    }

    @Test
    void read_FromFile_ShouldMatchStringInput() throws IOException {
        Path file = tempDir.resolve("model.json");
        Files.writeString(file, fixture("onboarding.json"));

        assertEquals(reader.read(fixture("onboarding.json")), reader.read(file));
    }

    @Test
    void read_MissingFile_ShouldThrowModelReadException() {
        Path missing = tempDir.resolve("absent.json");

        ModelReadException e = assertThrows(ModelReadException.class, () -> reader.read(missing));

        assertNotNull(e.getCause());
    }

    @Test
    void read_MalformedJson_ShouldThrowModelReadException() {
        assertThrows(ModelReadException.class, () -> reader.read("{ \"project\": "));
    }

    @Test
    void read_UnknownElementType_ShouldThrowModelReadException() {
        String json = """
                {
                  "project": { "name": "Acme" },
                  "processes": [ { "name": "P", "elements": [ { "type": "TimerEvent", "name": "Tick" } ] } ]
                }
                """;

        ModelReadException e = assertThrows(ModelReadException.class, () -> reader.read(json));

        assertEquals("Unknown element type 'TimerEvent' for element 'Tick'", e.getMessage());
    }

    @Test
    void read_NullDependency_ShouldThrowModelReadException() {
        String json = """
                {
                  "project": { "name": "Acme" },
                  "processes": [ { "name": "P", "tasks": [ { "name": "A", "auto": true, "dependencies": [null] } ] } ]
                }
                """;

        ModelReadException e = assertThrows(ModelReadException.class, () -> reader.read(json));

        assertEquals("Null entry in dependencies of task 'A'", e.getMessage());
    }

    @Test
    void read_NullEntriesInLists_ShouldThrowModelReadException() {
        String nullElement = """
                { "project": { "name": "Acme" }, "processes": [ { "name": "P", "elements": [null] } ] }
                """;
        String nullSupervised = """
                { "project": { "name": "Acme" }, "roles": [ { "name": "Lead", "supervises": [null] } ] }
                """;
        String nullColumn = """
                {
                  "project": { "name": "Acme" },
                  "dashboards": [ { "name": "Ops", "widgets": [ { "type": "TaskList", "name": "Inbox", "columns": ["name", null] } ] } ]
                }
                """;

        assertEquals("Null entry in elements of process 'P'",
                assertThrows(ModelReadException.class, () -> reader.read(nullElement)).getMessage());
        assertEquals("Null entry in supervises of role 'Lead'",
                assertThrows(ModelReadException.class, () -> reader.read(nullSupervised)).getMessage());
        assertEquals("Null entry in columns of widget 'Inbox'",
                assertThrows(ModelReadException.class, () -> reader.read(nullColumn)).getMessage());
    }

    @Test
    void read_MinimalModel_ShouldDefaultCollections() {
        Model model = reader.read("{ \"project\": { \"name\": \"Acme\" } }");

        assertTrue(model.processes().isEmpty());
        assertTrue(model.dashboards().isEmpty());
    }
}
