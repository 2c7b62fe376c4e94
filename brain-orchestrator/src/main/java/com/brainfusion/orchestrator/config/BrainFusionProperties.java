package com.brainfusion.orchestrator.config;

import com.brainfusion.common.exception.ConfigurationException;
import com.brainfusion.common.quality.QualityGateSettings;
import com.brainfusion.common.quality.ValidationCriterion;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code brain-fusion.*} in {@code application.yml}.
 */
@Data
@NoArgsConstructor
@ConfigurationProperties(prefix = "brain-fusion")
public class BrainFusionProperties {

    private Brains brains = new Brains();
    private Orchestration orchestration = new Orchestration();
    private Quality quality = new Quality();
    private Learning learning = new Learning();

    /**
     * Remote endpoint of one reasoning brain. Brain ids are fixed by role
     * ({@code intent_brain}, {@code technical_brain}, {@code sme_<domain>}).
     */
    @Data
    @NoArgsConstructor
    public static class Endpoint {
        /** SME domain; ignored for the Intent and Technical brains. */
        private String domain;
        private String baseUrl;
        private String path = "/api/v1/analyze";
        private Duration timeout = Duration.ofSeconds(10);
        private List<String> capabilities = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class Brains {
        private Endpoint intent;
        private Endpoint technical;
        private List<Endpoint> sme = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class Orchestration {
        private Duration requestTimeout = Duration.ofSeconds(30);
        private boolean applyReliability = true;
        private int decisionRetention = 1000;
        private Duration connectTimeout = Duration.ofSeconds(5);
    }

    @Data
    @NoArgsConstructor
    public static class Quality {
        private double minimumConfidence = QualityGateSettings.DEFAULT_MINIMUM_CONFIDENCE;
        /** Criterion key (e.g. {@code source-reliability}) to weight; missing keys keep their default. */
        private Map<String, Double> weights = new LinkedHashMap<>();
        private List<String> trustedSources = new ArrayList<>();
        private List<String> blacklistedSources = new ArrayList<>();
        private int historyPerTarget = QualityGateSettings.DEFAULT_HISTORY_PER_TARGET;
        private int consistencyWindow = QualityGateSettings.DEFAULT_CONSISTENCY_WINDOW;
        private double contradictionTolerance = QualityGateSettings.DEFAULT_CONTRADICTION_TOLERANCE;
        private double highImpactThreshold = QualityGateSettings.DEFAULT_HIGH_IMPACT_THRESHOLD;

        /**
         * @throws ConfigurationException on an unknown criterion key or invalid settings
         */
        public QualityGateSettings toSettings() {
            Map<ValidationCriterion, Double> resolved = new EnumMap<>(ValidationCriterion.class);
            weights.forEach((key, weight) -> resolved.put(criterion(key), weight));
            return new QualityGateSettings(resolved, minimumConfidence, trustedSources, blacklistedSources,
                historyPerTarget, consistencyWindow, contradictionTolerance, highImpactThreshold);
        }

        private static ValidationCriterion criterion(String key) {
            String normalized = key.trim().replace('-', '_');
            for (ValidationCriterion criterion : ValidationCriterion.values()) {
                if (criterion.key().equalsIgnoreCase(normalized)) {
                    return criterion;
                }
            }
            throw new ConfigurationException("Unknown validation criterion in brain-fusion.quality.weights: " + key);
        }
    }

    @Data
    @NoArgsConstructor
    public static class Learning {
        private int patternMinObservations = 5;
        private Duration historyRetention = Duration.ofDays(180);
        private Duration knowledgeRetention = Duration.ofDays(90);
        private Duration maintenanceInterval = Duration.ofHours(1);
        private int recentUpdates = 20;
    }
}
