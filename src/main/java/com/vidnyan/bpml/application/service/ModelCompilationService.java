package com.vidnyan.bpml.application.service;

import com.vidnyan.bpml.application.port.in.CompileModelUseCase;
import com.vidnyan.bpml.domain.analysis.AnalysisReport;
import com.vidnyan.bpml.domain.analysis.AnalysisSettings;
import com.vidnyan.bpml.domain.analysis.ModelInsights;
import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.model.ProcessDefinition;
import com.vidnyan.bpml.domain.validation.ModelValidator;
import com.vidnyan.bpml.domain.validation.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates validation and analysis of a model.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelCompilationService implements CompileModelUseCase {

    private final ModelValidator modelValidator;
    private final AnalysisSettings analysisSettings;

    @Override
    public CompilationResult compile(Model model) {
        Instant startTime = Instant.now();
        String project = model.projectInfo() != null ? model.projectInfo().name() : null;
        log.info("Compiling model {} ({} processes)", project, model.processes().size());

        // Step 1: Validate
        log.info("Step 1: Validating model...");
        ValidationResult validation = modelValidator.check(model);
        if (!validation.isValid()) {
            log.warn("Model {} is invalid: {}", project, validation.error().message());
            return new CompilationResult(project, validation, List.of(), ModelInsights.empty(),
                    stats(0, validation, startTime));
        }

        // Step 2: Analyze each process
        log.info("Step 2: Analyzing processes...");
        List<AnalysisReport> reports = new ArrayList<>();
        for (ProcessDefinition process : model.processes()) {
            AnalysisReport report = AnalysisReport.of(process, analysisSettings);
            reports.add(report);
            log.info("  {}: {} elements, {} paths, {} suggestions",
                    process.name(),
                    report.metrics().totalElements(),
                    report.executionPaths().size(),
                    report.suggestions().size());
        }

        // Step 3: Model-wide roles and entities
        log.info("Step 3: Analyzing roles and entities...");
        ModelInsights insights = ModelInsights.of(model);
        if (!insights.roleConflicts().isEmpty()) {
            log.info("  {} role conflicts found", insights.roleConflicts().size());
        }

        CompilationStats stats = stats(reports.size(), validation, startTime);
        log.info("Compilation complete: {} processes analyzed in {}ms",
                reports.size(), stats.totalDurationMs());
        return new CompilationResult(project, validation, reports, insights, stats);
    }

    private CompilationStats stats(int processCount, ValidationResult validation, Instant startTime) {
        return new CompilationStats(processCount, validation.passesRun(),
                Duration.between(startTime, Instant.now()).toMillis());
    }
}
