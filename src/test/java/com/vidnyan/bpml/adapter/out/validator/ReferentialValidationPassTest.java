package com.vidnyan.bpml.adapter.out.validator;

import com.vidnyan.bpml.TestModels;
import com.vidnyan.bpml.domain.model.*;
import com.vidnyan.bpml.domain.validation.ErrorKind;
import com.vidnyan.bpml.domain.validation.ModelValidationException;
import com.vidnyan.bpml.domain.validation.ValidationContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferentialValidationPassTest {

    private final ReferentialValidationPass pass = new ReferentialValidationPass();

    private ModelValidationException reject(Model model) {
        return assertThrows(ModelValidationException.class, () -> pass.validate(ValidationContext.of(model)));
    }

    private void accept(Model model) {
        assertDoesNotThrow(() -> pass.validate(ValidationContext.of(model)));
    }

    private static Model withTasks(Task... tasks) {
        return TestModels.model(ProcessDefinition.builder().name("P").tasks(List.of(tasks)).build());
    }

    @Test
    void validate_SelfDependency_ShouldRejectSelfReference() {
        ModelValidationException e = reject(withTasks(TestModels.autoTask("A", "A")));

        assertEquals(ErrorKind.SELF_REFERENCE, e.getKind());
        assertEquals("Task 'A' cannot depend on itself in process 'P'", e.getMessage());
    }

    @Test
    void validate_UnknownDependency_ShouldRejectUnresolved() {
        ModelValidationException e = reject(withTasks(TestModels.autoTask("A", "Missing")));

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, e.getKind());
        assertEquals("A", e.getError().element());
    }

    @Test
    void validate_DependencyOnLaterTask_ShouldResolve() {
        accept(withTasks(TestModels.autoTask("A", "B"), TestModels.autoTask("B")));
    }

    @Test
    void validate_TaskWithUnknownStateRoleOrEntity_ShouldRejectUnresolved() {
        Task unknownState = Task.builder().name("T").auto(true).state("Closed").build();
        Task unknownRole = Task.builder().name("T").role("Auditor").build();
        Task unknownEntity = Task.builder().name("T").auto(true).entities(List.of("Invoice")).build();

        assertTrue(reject(withTasks(unknownState)).getMessage().contains("unknown state 'Closed'"));
        assertTrue(reject(withTasks(unknownRole)).getMessage().contains("unknown role 'Auditor'"));
        assertTrue(reject(withTasks(unknownEntity)).getMessage().contains("unknown entity 'Invoice'"));
    }

    @Test
    void validate_TaskRoleFromModelLevel_ShouldResolve() {
        accept(withTasks(Task.builder().name("T").role("HR").build()));
    }

    @Test
    void validate_RoleSupervisingItself_ShouldRejectSelfReference() {
        Model model = Model.builder()
                .projectInfo(ProjectInfo.named("Acme"))
                .roles(List.of(TestModels.supervisor("Boss", "Boss")))
                .build();

        ModelValidationException e = reject(model);

        assertEquals(ErrorKind.SELF_REFERENCE, e.getKind());
        assertEquals("Role 'Boss' cannot supervise itself", e.getMessage());
    }

    @Test
    void validate_RoleInheritingFromItself_ShouldRejectSelfReference() {
        Role role = new Role("Lead", null, "Lead", List.of(), List.of());
        Model model = TestModels.model(ProcessDefinition.builder().name("P").roles(List.of(role)).build());

        ModelValidationException e = reject(model);

        assertEquals(ErrorKind.SELF_REFERENCE, e.getKind());
        assertEquals("Role 'Lead' cannot inherit from itself in process 'P'", e.getMessage());
    }

    @Test
    void validate_RoleWithUnknownParent_ShouldRejectUnresolved() {
        Role role = new Role("Lead", null, "Director", List.of(), List.of());
        Model model = Model.builder().projectInfo(ProjectInfo.named("Acme")).roles(List.of(role)).build();

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, reject(model).getKind());
    }

    @Test
    void validate_AttributeTypes_ShouldAcceptBuiltinsAndEntities() {
        Entity customer = new Entity("Customer", List.of(new Attribute("email", "email", false, false)));
        Entity order = new Entity("Order", List.of(
                new Attribute("total", "float", false, false),
                new Attribute("buyer", "Customer", false, false)));
        Entity bad = new Entity("Invoice", List.of(new Attribute("amount", "Money", false, false)));

        accept(Model.builder().projectInfo(ProjectInfo.named("Acme")).entities(List.of(customer, order)).build());

        ModelValidationException e = reject(Model.builder()
                .projectInfo(ProjectInfo.named("Acme")).entities(List.of(bad)).build());
        assertEquals("Attribute 'amount' of entity 'Invoice' references unknown type 'Money'", e.getMessage());
    }

    @Test
    void validate_RelationshipToUnknownEntity_ShouldRejectUnresolved() {
        Entity order = new Entity("Order", List.of(new Relationship("customer", "Customer", "@1..1", false)));

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, reject(Model.builder()
                .projectInfo(ProjectInfo.named("Acme")).entities(List.of(order)).build()).getKind());
    }

    @Test
    void validate_TransitionChecks_ShouldRejectBadTransitions() {
        ProcessDefinition.ProcessDefinitionBuilder base = ProcessDefinition.builder()
                .name("Orders")
                .states(List.of(State.named("Open"), State.named("Closed")));

        Model loop = TestModels.model(base.transitions(List.of(
                new Transition("stay", "Open", "Open", null, null))).build());
        Model unknown = TestModels.model(base.transitions(List.of(
                new Transition("close", "Open", "Archived", null, null))).build());
        Model guarded = TestModels.model(base.transitions(List.of(
                new Transition("close", "Open", "Closed", "HR", null))).build());

        assertEquals(ErrorKind.SELF_REFERENCE, reject(loop).getKind());
        assertTrue(reject(unknown).getMessage().contains("unknown to_state 'Archived'"));
        accept(guarded);
    }

    @Test
    void validate_UserTaskAssignedToUnknownRole_ShouldRejectUnresolved() {
        ProcessDefinition process = TestModels.linear("Hiring",
                UserTask.builder().name("Review").assignee(Assignee.role("Recruiter")).build());

        ModelValidationException e = reject(TestModels.model(process));

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, e.getKind());
        assertEquals("UserTask 'Review' is assigned to unknown role 'Recruiter' in process 'Hiring'", e.getMessage());
    }

    @Test
    void validate_UserTaskAssignedToUser_ShouldNotResolveAgainstRoles() {
        ProcessDefinition process = TestModels.linear("Hiring",
                UserTask.builder().name("Review").assignee(Assignee.user("alice")).build());

        accept(TestModels.model(process));
    }

    @Test
    void validate_UnknownCandidateGroup_ShouldRejectUnresolved() {
        ProcessDefinition process = TestModels.linear("Hiring",
                UserTask.builder().name("Review").candidateGroups(List.of("HR", "Legal")).build());

        assertTrue(reject(TestModels.model(process)).getMessage().contains("unknown candidate group 'Legal'"));
    }

    @Test
    void validate_FlowToUnknownElement_ShouldRejectUnresolved() {
        ProcessDefinition process = TestModels.withElements("P",
                List.of(new StartEvent("Start", null), new EndEvent("End", null)),
                SequenceFlow.of("Start", "Ghost"));

        ModelValidationException e = reject(TestModels.model(process));

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, e.getKind());
        assertEquals("Ghost", e.getError().element());
    }

    @Test
    void validate_RetryAndTimeoutLimits_ShouldRejectInvalidValues() {
        ProcessDefinition negativeRetry = TestModels.linear("P",
                ServiceTask.builder().name("Call").implementation("c").retryCount(-1).build());
        ProcessDefinition zeroTimeout = TestModels.linear("P",
                new ScriptTask("Calc", null, "x", "groovy", 0, 0));

        assertEquals(ErrorKind.INVALID_ATTRIBUTE_VALUE, reject(TestModels.model(negativeRetry)).getKind());
        assertEquals(ErrorKind.INVALID_ATTRIBUTE_VALUE, reject(TestModels.model(zeroTimeout)).getKind());
    }

    @Test
    void validate_GatewayConditions_ShouldRejectBlankExpressionAndUnknownTarget() {
        ProcessDefinition blank = TestModels.linear("P",
                Gateway.exclusive("Route", List.of(new GatewayCondition("  ", "End"))));
        ProcessDefinition unknown = TestModels.linear("P",
                Gateway.exclusive("Route", List.of(new GatewayCondition("ok", "Nowhere"))));

        assertEquals(ErrorKind.EMPTY_DEFINITION, reject(TestModels.model(blank)).getKind());
        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, reject(TestModels.model(unknown)).getKind());
    }

    @Test
    void validate_DataObjectType_ShouldResolveToBuiltinOrEntity() {
        ProcessDefinition builtin = TestModels.linear("P", new DataObject("Notes", null, "text", false));
        ProcessDefinition unknown = TestModels.linear("P", new DataObject("Doc", null, "Contract", false));

        accept(TestModels.model(builtin));
        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, reject(TestModels.model(unknown)).getKind());
    }

    @Test
    void validate_SequenceStep_ShouldResolveToTaskStateOrElement() {
        ProcessDefinition known = ProcessDefinition.builder()
                .name("P")
                .states(List.of(State.named("Open")))
                .tasks(List.of(TestModels.autoTask("Ship")))
                .sequence(List.of("Open", "Ship"))
                .build();
        ProcessDefinition unknown = ProcessDefinition.builder()
                .name("P")
                .tasks(List.of(TestModels.autoTask("Ship")))
                .sequence(List.of("Ship", "Bill"))
                .build();

        accept(TestModels.model(known));
        assertEquals("Process flow references unknown step 'Bill' in process 'P'",
                reject(TestModels.model(unknown)).getMessage());
    }

    @Test
    void validate_WidgetForUnknownProcess_ShouldRejectUnresolved() {
        Model model = Model.builder()
                .projectInfo(ProjectInfo.named("Acme"))
                .dashboards(List.of(new Dashboard("Ops", null, List.of(
                        new TaskListWidget("Inbox", "Payroll", List.of("name"), List.of())))))
                .build();

        ModelValidationException e = reject(model);

        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, e.getKind());
        assertEquals("TaskList widget in dashboard 'Ops' references unknown process 'Payroll'", e.getMessage());
    }
}
