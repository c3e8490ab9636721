package com.vidnyan.bpml;

import com.vidnyan.bpml.domain.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Model fixtures shared by the tests.
 */
public final class TestModels {

    private TestModels() {
    }

    /**
     * Project "Acme" with a model-wide HR role and the given processes.
     */
    public static Model model(ProcessDefinition... processes) {
        return Model.builder()
                .projectInfo(ProjectInfo.named("Acme"))
                .roles(List.of(Role.named("HR")))
                .processes(List.of(processes))
                .build();
    }

    /**
     * Start -> Review (user task, role HR) -> Provision (service task) -> End.
     */
    public static ProcessDefinition onboarding() {
        return linear("Onboarding",
                UserTask.builder().name("Review").assignee(Assignee.role("HR")).build(),
                ServiceTask.builder().name("Provision").implementation("accounts.Provisioner").build());
    }

    /**
     * Start -> each middle element in order -> End.
     */
    public static ProcessDefinition linear(String name, ProcessElement... middle) {
        List<ProcessElement> elements = new ArrayList<>();
        elements.add(new StartEvent("Start", null));
        elements.addAll(List.of(middle));
        elements.add(new EndEvent("End", null));

        List<SequenceFlow> flows = new ArrayList<>();
        for (int i = 0; i + 1 < elements.size(); i++) {
            flows.add(SequenceFlow.of(elements.get(i).name(), elements.get(i + 1).name()));
        }

        return ProcessDefinition.builder()
                .name(name)
                .elements(elements)
                .flows(flows)
                .build();
    }

    public static ProcessDefinition withElements(String name, List<ProcessElement> elements, SequenceFlow... flows) {
        return ProcessDefinition.builder()
                .name(name)
                .elements(elements)
                .flows(List.of(flows))
                .build();
    }

    public static Task autoTask(String name, String... dependencies) {
        return Task.builder()
                .name(name)
                .auto(true)
                .dependencies(List.of(dependencies))
                .build();
    }

    public static Role supervisor(String name, String... supervises) {
        return new Role(name, null, null, List.of(supervises), List.of());
    }
}
