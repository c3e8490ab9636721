package com.vidnyan.bpml.domain.validation;

import java.util.List;

/**
 * First violation found in a model.
 * Immutable value object; process and element are null when the error is model-wide.
 */
public record SemanticError(
    ErrorKind kind,
    String message,
    String process,
    String element,
    List<String> cyclePath
) {

    public SemanticError {
        cyclePath = cyclePath == null ? List.of() : List.copyOf(cyclePath);
    }

    public static SemanticError of(ErrorKind kind, String message, String process, String element) {
        return new SemanticError(kind, message, process, element, List.of());
    }

    public static SemanticError cycle(String message, String process, List<String> cyclePath) {
        return new SemanticError(ErrorKind.CIRCULAR_DEPENDENCY, message, process,
                cyclePath.isEmpty() ? null : cyclePath.get(0), cyclePath);
    }

    /**
     * Format the cycle for display.
     */
    public String formattedCycle() {
        return String.join(" -> ", cyclePath);
    }
}
