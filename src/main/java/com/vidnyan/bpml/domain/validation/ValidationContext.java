package com.vidnyan.bpml.domain.validation;

import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.registry.ModelRegistry;

/**
 * Context provided to validation passes: the model and the registries derived from it.
 */
public record ValidationContext(
    Model model,
    ModelRegistry registry
) {

    public static ValidationContext of(Model model) {
        return new ValidationContext(model, ModelRegistry.build(model));
    }
}
