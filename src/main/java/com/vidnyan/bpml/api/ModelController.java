package com.vidnyan.bpml.api;

import com.vidnyan.bpml.application.port.in.CompileModelUseCase;
import com.vidnyan.bpml.application.port.in.CompileModelUseCase.CompilationResult;
import com.vidnyan.bpml.application.port.out.ModelReadException;
import com.vidnyan.bpml.application.port.out.ModelSource;
import com.vidnyan.bpml.domain.analysis.AnalysisReport;
import com.vidnyan.bpml.domain.analysis.ModelInsights;
import com.vidnyan.bpml.domain.model.Model;
import com.vidnyan.bpml.domain.validation.SemanticError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for compiling models.
 */
@RestController
@RequestMapping("/api/models")
public class ModelController {

    private static final Logger log = LoggerFactory.getLogger(ModelController.class);

    private final CompileModelUseCase compileModelUseCase;
    private final ModelSource modelSource;

    public ModelController(CompileModelUseCase compileModelUseCase, ModelSource modelSource) {
        this.compileModelUseCase = compileModelUseCase;
        this.modelSource = modelSource;
    }

    /**
     * Compile a JSON model. Rejected models answer 422 with the semantic error.
     */
    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@RequestBody String body) {
        Model model = modelSource.read(body);
        log.info("Received compile request for {}",
                model.projectInfo() != null ? model.projectInfo().name() : "<unnamed>");

        CompilationResult result = compileModelUseCase.compile(model);
        CompileResponse response = new CompileResponse(
                result.project(),
                result.isValid(),
                result.error().orElse(null),
                result.reports(),
                result.insights(),
                result.stats().totalDurationMs()
        );
        return result.isValid()
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    @GetMapping("/health")
    public String health() {
        return "OK - BPML compiler";
    }

    @ExceptionHandler(ModelReadException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(ModelReadException e) {
        log.warn("Rejected unreadable model: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }

    public record CompileResponse(
        String project,
        boolean valid,
        SemanticError error,
        List<AnalysisReport> reports,
        ModelInsights insights,
        long durationMs
    ) {}

    public record ErrorResponse(String message) {}
}
