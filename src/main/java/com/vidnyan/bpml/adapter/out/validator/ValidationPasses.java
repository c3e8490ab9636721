package com.vidnyan.bpml.adapter.out.validator;

import com.vidnyan.bpml.domain.validation.ModelValidator;
import com.vidnyan.bpml.domain.validation.ValidationPass;

import java.util.List;

/**
 * The standard pass set, for use outside a Spring context.
 */
public final class ValidationPasses {

    private ValidationPasses() {
    }

    public static List<ValidationPass> standard() {
        return List.of(
                new StructuralValidationPass(),
                new ReferentialValidationPass(),
                new CycleValidationPass(),
                new ConnectivityValidationPass()
        );
    }

    public static ModelValidator standardValidator() {
        return new ModelValidator(standard());
    }
}
