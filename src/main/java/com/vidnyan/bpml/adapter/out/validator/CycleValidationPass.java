package com.vidnyan.bpml.adapter.out.validator;

import com.vidnyan.bpml.domain.graph.DirectedGraph;
import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.model.Role;
import com.vidnyan.bpml.domain.model.Task;
import com.vidnyan.bpml.domain.validation.ModelValidationException;
import com.vidnyan.bpml.domain.validation.SemanticError;
import com.vidnyan.bpml.domain.validation.ValidationContext;
import com.vidnyan.bpml.domain.validation.ValidationPass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rejects cycles in the role hierarchy and in task dependencies.
 * Self-edges were already rejected by the referential pass.
 */
@Slf4j
@Component
@Order(30)
public class CycleValidationPass implements ValidationPass {

    @Override
    public void validate(ValidationContext context) {
        Model model = context.model();

        requireAcyclic(roleGraph(model.roles()), "Circular role hierarchy", null);

        for (ProcessDefinition process : model.processes()) {
            List<Role> visibleRoles = new ArrayList<>(process.roles());
            visibleRoles.addAll(model.roles());
            requireAcyclic(roleGraph(visibleRoles), "Circular role hierarchy", process.name());
            requireAcyclic(taskGraph(process.tasks()), "Circular task dependency", process.name());
        }
    }

    /**
     * Edges point from the role above to the role below: supervisor to supervised,
     * parent to child.
     */
    static DirectedGraph roleGraph(List<Role> roles) {
        DirectedGraph.Builder builder = DirectedGraph.builder();
        for (Role role : roles) {
            builder.node(role.name());
            role.supervises().forEach(supervised -> builder.edge(role.name(), supervised));
            if (role.parent() != null) {
                builder.edge(role.parent(), role.name());
            }
        }
        return builder.build();
    }

    /**
     * Edges point from a task to the tasks it depends on.
     */
    static DirectedGraph taskGraph(List<Task> tasks) {
        DirectedGraph.Builder builder = DirectedGraph.builder();
        for (Task task : tasks) {
            builder.node(task.name());
            task.dependencies().forEach(dependency -> builder.edge(task.name(), dependency));
        }
        return builder.build();
    }

    private void requireAcyclic(DirectedGraph graph, String label, String process) {
        Optional<List<String>> cycle = graph.findFirstCycle();
        if (cycle.isPresent()) {
            String path = String.join(" -> ", cycle.get());
            String where = process != null ? " in process '" + process + "'" : "";
            log.debug("{}{}: {}", label, where, path);
            throw new ModelValidationException(
                    SemanticError.cycle(label + where + ": " + path, process, cycle.get()));
        }
    }
}
