package com.vidnyan.bpml.adapter.in.cli;

import com.vidnyan.bpml.application.port.in.CompileModelUseCase;
import com.vidnyan.bpml.application.port.in.CompileModelUseCase.CompilationResult;
import com.vidnyan.bpml.application.port.out.ModelReadException;
import com.vidnyan.bpml.application.port.out.ModelSource;
import com.vidnyan.bpml.domain.analysis.AnalysisReport;
import com.vidnyan.bpml.domain.analysis.Bottleneck;
import com.vidnyan.bpml.domain.analysis.OptimizationSuggestion;
import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.validation.SemanticError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * CLI runner for compiling a single model file.
 * Runs when bpml.compile.path is set; exits non-zero when the model is rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompileCliRunner implements CommandLineRunner {

    private final CompileModelUseCase compileModelUseCase;
    private final ModelSource modelSource;
    private final ConfigurableApplicationContext context;

    @Value("${bpml.compile.path:}")
    private String modelPath;

    @Override
    public void run(String... args) {
        if (modelPath == null || modelPath.isBlank()) {
            log.info("No model path specified. Set bpml.compile.path property.");
            return;
        }

        int exitCode = 1;
        try {
            log.info("Compiling: {}", modelPath);
            Model model = modelSource.read(Path.of(modelPath));
            CompilationResult result = compileModelUseCase.compile(model);
            printResult(result);
            exitCode = result.isValid() ? 0 : 1;
        } catch (ModelReadException e) {
            log.error("Could not read model: {}", e.getMessage());
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResult(CompilationResult result) {
        log.info("");
        log.info("Project:  {}", result.project());
        log.info("Passes:   {}", result.stats().passesRun());
        log.info("Duration: {}ms", result.stats().totalDurationMs());

        if (!result.isValid()) {
            SemanticError error = result.error().orElseThrow();
            log.info("");
            log.info("INVALID [{}]", error.kind());
            log.info(" Message: {}", error.message());
            if (error.process() != null) {
                log.info(" Process: {}", error.process());
            }
            if (!error.cyclePath().isEmpty()) {
                log.info(" Cycle:   {}", error.formattedCycle());
            }
            return;
        }

        log.info("VALID - {} processes analyzed", result.reports().size());
        for (AnalysisReport report : result.reports()) {
            log.info("");
            log.info("Process {}", report.process());
            log.info(" Elements:   {}", report.metrics().totalElements());
            log.info(" Paths:      {} (longest {})", report.executionPaths().size(), report.metrics().maxPathLength());
            log.info(" Complexity: {}", report.metrics().cyclomaticComplexity());
            log.info(" Est. time:  {} - {} min", report.timeEstimate().minTime(), report.timeEstimate().maxTime());
            for (Bottleneck b : report.bottlenecks()) {
                log.info(" [{}] {}: {}", b.severity(), b.element(), b.reason());
            }
            for (OptimizationSuggestion s : report.suggestions()) {
                log.info(" [{}] {}", s.priority(), s.description());
            }
            report.completenessIssues().forEach(issue -> log.info(" ! {}", issue));
        }

        if (!result.insights().roleConflicts().isEmpty()) {
            log.info("");
            result.insights().roleConflicts().forEach(c -> log.info("[{}] {}", c.type(), c.description()));
        }
    }
}
