package com.vidnyan.bpml.domain.validation;

import com.vidnyan.bpml.domain.model.Model;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the validation passes over a model in their fixed order and stops at the first violation.
 * Holds no state between calls; the registries are rebuilt for every model.
 */
@Slf4j
public class ModelValidator {

    private final List<ValidationPass> passes;

    public ModelValidator(List<? extends ValidationPass> passes) {
        List<ValidationPass> ordered = new ArrayList<>(passes);
        AnnotationAwareOrderComparator.sort(ordered);
        this.passes = List.copyOf(ordered);
    }

    /**
     * Validate a model, throwing on the first violation.
     */
    public void validate(Model model) {
        ValidationContext context = ValidationContext.of(model);
        for (ValidationPass pass : passes) {
            log.debug("Running {}", pass.getName());
            pass.validate(context);
        }
    }

    /**
     * Validate a model and report the outcome as a value.
     */
    public ValidationResult check(Model model) {
        ValidationContext context = ValidationContext.of(model);
        int run = 0;
        for (ValidationPass pass : passes) {
            run++;
            try {
                pass.validate(context);
            } catch (ModelValidationException e) {
                log.warn("{} rejected model: {}", pass.getName(), e.getMessage());
                return ValidationResult.invalid(e.getError(), run);
            }
        }
        return ValidationResult.valid(run);
    }

    public List<ValidationPass> getPasses() {
        return passes;
    }
}
