package com.vidnyan.bpml.domain.analysis;

import java.util.List;

public record OptimizationSuggestion(
    SuggestionType type,
    String description,
    List<String> elements,
    Severity priority
) {

    public enum SuggestionType {
        PARALLELIZATION,
        SIMPLIFICATION,
        ERROR_HANDLING
    }
}
