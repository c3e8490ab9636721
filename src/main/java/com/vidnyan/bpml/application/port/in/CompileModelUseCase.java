package com.vidnyan.bpml.application.port.in;

import com.vidnyan.bpml.domain.analysis.AnalysisReport;
import com.vidnyan.bpml.domain.analysis.ModelInsights;
import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.validation.SemanticError;
import com.vidnyan.bpml.domain.validation.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * Primary use case: validate a parsed model and analyze its processes.
 */
public interface CompileModelUseCase {

    /**
     * Validate the model fail-fast; on success, analyze every process.
     * @param model the AST handed off by the parser front end
     * @return validation outcome plus one report per process and the model-wide
     *         insights (both empty when invalid)
     */
    CompilationResult compile(Model model);

    record CompilationResult(
        String project,
        ValidationResult validation,
        List<AnalysisReport> reports,
        ModelInsights insights,
        CompilationStats stats
    ) {
        public CompilationResult {
            reports = reports == null ? List.of() : List.copyOf(reports);
            insights = insights == null ? ModelInsights.empty() : insights;
        }

        public boolean isValid() {
            return validation.isValid();
        }

        public Optional<SemanticError> error() {
            return validation.getError();
        }

        public Optional<AnalysisReport> reportFor(String process) {
            return reports.stream()
                    .filter(r -> r.process().equals(process))
                    .findFirst();
        }
    }

    record CompilationStats(
        int processCount,
        int passesRun,
        long totalDurationMs
    ) {}
}
