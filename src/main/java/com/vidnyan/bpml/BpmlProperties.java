package com.vidnyan.bpml;

import com.vidnyan.bpml.domain.analysis.AnalysisSettings;
import com.vidnyan.bpml.domain.model.ElementKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for the compiler.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "bpml")
public class BpmlProperties {

    private Analysis analysis = new Analysis();

    private Compile compile = new Compile();

    @Data
    public static class Analysis {

        /**
         * Depth beyond which execution path enumeration abandons a branch.
         */
        private int maxPathDepth = 50;

        /**
         * Incoming flows above which an element is reported as a bottleneck.
         */
        private int fanInThreshold = 2;

        /**
         * Minutes per element kind used for time estimates.
         */
        private Map<ElementKind, Double> defaultEstimates = new EnumMap<>(Map.of(
                ElementKind.USER_TASK, 30.0,
                ElementKind.SERVICE_TASK, 2.0,
                ElementKind.SCRIPT_TASK, 1.0
        ));

        public AnalysisSettings toSettings() {
            return new AnalysisSettings(maxPathDepth, fanInThreshold, defaultEstimates);
        }
    }

    @Data
    public static class Compile {

        /**
         * JSON model to compile on startup. Empty disables the CLI run.
         */
        private String path = "";
    }
}
