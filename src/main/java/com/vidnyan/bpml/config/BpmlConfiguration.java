package com.vidnyan.bpml.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.bpml.BpmlProperties;
import com.vidnyan.bpml.domain.analysis.AnalysisSettings;
import com.vidnyan.bpml.domain.validation.ModelValidator;
import com.vidnyan.bpml.domain.validation.ValidationPass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for the compiler components.
 */
@Slf4j
@Configuration
public class BpmlConfiguration {

    /**
     * ObjectMapper for reading models and writing reports.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public ModelValidator modelValidator(List<ValidationPass> passes) {
        ModelValidator validator = new ModelValidator(passes);
        log.info("Registered {} validation passes:", validator.getPasses().size());
        validator.getPasses().forEach(p -> log.info("  - {}", p.getName()));
        return validator;
    }

    @Bean
    public AnalysisSettings analysisSettings(BpmlProperties properties) {
        return properties.getAnalysis().toSettings();
    }
}
