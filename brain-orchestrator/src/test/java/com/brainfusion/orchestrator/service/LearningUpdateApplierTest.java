package com.brainfusion.orchestrator.service;

import com.brainfusion.common.exception.ValidationRejectedException;
import com.brainfusion.common.knowledge.CrossBrainKnowledgeStore;
import com.brainfusion.common.knowledge.InMemoryKnowledgeRepository;
import com.brainfusion.common.learning.LearningUpdateGenerator;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.BrainDirectory;
import com.brainfusion.common.model.BrainKind;
import com.brainfusion.common.model.KnowledgeItem;
import com.brainfusion.common.model.KnowledgeType;
import com.brainfusion.common.model.LearningType;
import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.QualityLevel;
import com.brainfusion.common.model.ValidationResult;
import com.brainfusion.common.reliability.BrainReliabilityTracker;
import com.brainfusion.common.reliability.InMemoryBrainReliabilityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LearningUpdateApplierTest {

    private BrainReliabilityTracker tracker;
    private CrossBrainKnowledgeStore store;
    private LearningUpdateApplier applier;

    @BeforeEach
    void setUp() {
        BrainDirectory directory = BrainDirectory.of(List.of(
            BrainDescriptor.of(BrainDescriptor.INTENT_BRAIN_ID, BrainKind.INTENT),
            BrainDescriptor.of(BrainDescriptor.TECHNICAL_BRAIN_ID, BrainKind.TECHNICAL),
            BrainDescriptor.sme("cloud_services")));
        tracker = new BrainReliabilityTracker(new InMemoryBrainReliabilityRepository(), directory);
        store   = new CrossBrainKnowledgeStore(new InMemoryKnowledgeRepository());
        applier = new LearningUpdateApplier(tracker, store);
    }

    private static ValidationResult pass(LearningUpdate update) {
        return new ValidationResult(update.id(), true, QualityLevel.HIGH, 0.9, List.of(), List.of(), List.of(),
            List.of(), Map.of(), Map.of(), 0.1, false);
    }

    private LearningUpdateApplier.Target apply(LearningUpdate update) {
        return applier.apply(update, pass(update));
    }

    private KnowledgeItem onlyItem() {
        assertThat(store.items()).hasSize(1);
        return store.items().get(0);
    }

    // ── reliability ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("execution outcomes move the target brain's reliability")
    void outcome() {
        Map<String, Object> content = Map.of(
            LearningUpdateGenerator.KEY_EXECUTION_OUTCOME, "failure",
            LearningUpdateGenerator.KEY_OUTCOME_SUCCESSFUL, false,
            LearningUpdateGenerator.KEY_CONFIDENCE_ACCURACY, 0.5);
        LearningUpdate update = LearningUpdate.of(LearningType.EXECUTION_FEEDBACK,
            BrainDescriptor.FEEDBACK_ANALYZER_ID, "sme_cloud_services", content, 0.8);

        assertThat(apply(update)).isEqualTo(LearningUpdateApplier.Target.RELIABILITY);
        // SME default 1.1, halfway to 0.9
        assertThat(tracker.reliabilityOf("sme_cloud_services")).isCloseTo(1.0, within(1e-9));
        assertThat(store.items()).isEmpty();
    }

    @Test
    @DisplayName("SME effectiveness scores stay in history")
    void effectiveness() {
        LearningUpdate update = LearningUpdate.of(LearningType.EXECUTION_FEEDBACK,
            BrainDescriptor.FEEDBACK_ANALYZER_ID, "sme_cloud_services",
            Map.of(LearningUpdateGenerator.KEY_EFFECTIVENESS_SCORE, 0.8, "domain", "cloud_services"), 0.6);

        assertThat(apply(update)).isEqualTo(LearningUpdateApplier.Target.HISTORY_ONLY);
        assertThat(tracker.reliabilityOf("sme_cloud_services")).isEqualTo(BrainReliabilityTracker.SME_RELIABILITY);
        assertThat(store.items()).isEmpty();
    }

    // ── knowledge ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("knowledge items")
    class Knowledge {

        @Test
        @DisplayName("patterns carry the observed success rate")
        void pattern() {
            Map<String, Object> content = new LinkedHashMap<>();
            content.put(LearningUpdateGenerator.KEY_PATTERN, "deployment_medium_guided_execution");
            content.put(LearningUpdateGenerator.KEY_INTENT_TYPE, "deployment");
            content.put(LearningUpdateGenerator.KEY_COMPLEXITY, "medium");
            content.put(LearningUpdateGenerator.KEY_SUCCESS_RATE, 0.3);
            content.put(LearningUpdateGenerator.KEY_TOTAL_ATTEMPTS, 10);
            content.put(LearningUpdateGenerator.KEY_RECOMMENDATION, LearningUpdateGenerator.TAG_REVIEW_APPROACH);
            apply(LearningUpdate.of(LearningType.PATTERN_RECOGNITION, BrainDescriptor.FEEDBACK_ANALYZER_ID,
                BrainDescriptor.TECHNICAL_BRAIN_ID, content, 0.5));

            KnowledgeItem item = onlyItem();
            assertThat(item.id()).isEqualTo("pattern_deployment_medium_guided_execution");
            assertThat(item.sourceBrain()).isEqualTo(BrainDescriptor.FEEDBACK_ANALYZER_ID);
            assertThat(item.successRate()).isCloseTo(0.3, within(1e-9));
            assertThat(item.confidenceImpact()).isCloseTo(-0.2, within(1e-9));
            assertThat(item.description()).contains("review_approach");
        }

        @Test
        @DisplayName("timing corrections become optimisation techniques keyed by complexity")
        void timing() {
            Map<String, Object> content = Map.of(
                LearningUpdateGenerator.KEY_ADJUSTMENT_FACTOR, 2.0,
                LearningUpdateGenerator.KEY_COMPLEXITY, "high");
            LearningUpdate update = LearningUpdate.of(LearningType.EXECUTION_FEEDBACK,
                BrainDescriptor.FEEDBACK_ANALYZER_ID, BrainDescriptor.TECHNICAL_BRAIN_ID, content, 0.8);

            assertThat(apply(update)).isEqualTo(LearningUpdateApplier.Target.KNOWLEDGE);
            KnowledgeItem item = onlyItem();
            assertThat(item.id()).isEqualTo("timing_high");
            assertThat(item.knowledgeType()).isEqualTo(KnowledgeType.OPTIMIZATION_TECHNIQUE);
            assertThat(item.successRate()).isEqualTo(0.8);
            assertThat(item.applicableContexts()).containsExactly("high");
        }

        @Test
        @DisplayName("improvement suggestions become error-handling items")
        void improvement() {
            Map<String, Object> content = Map.of(
                "error_type", "Connection timeout to registry",
                LearningUpdateGenerator.KEY_IMPROVEMENT_SUGGESTIONS, List.of("Increase timeout values"),
                "failure_context", Map.of("intent", "deployment", "complexity", "unknown"));
            apply(LearningUpdate.of(LearningType.ERROR_CORRECTION, BrainDescriptor.FEEDBACK_ANALYZER_ID,
                BrainDescriptor.TECHNICAL_BRAIN_ID, content, 0.7));

            KnowledgeItem item = onlyItem();
            assertThat(item.id()).isEqualTo("improvement_connection_timeout_to_registry");
            assertThat(item.knowledgeType()).isEqualTo(KnowledgeType.ERROR_HANDLING);
            assertThat(item.description()).isEqualTo("Increase timeout values");
            assertThat(item.applicableContexts()).containsExactly("deployment");
        }

        @Test
        @DisplayName("security advisories keep their source kind and category as contexts")
        void advisory() {
            Map<String, Object> content = Map.of(
                "source_type", "security_advisories",
                "source", "cve-feed",
                "knowledge", Map.of("name", "Outdated TLS library", "category", "tls"));
            LearningUpdate update = LearningUpdate.of(LearningType.EXTERNAL_KNOWLEDGE,
                BrainDescriptor.EXTERNAL_INTEGRATOR_ID, "sme_security_and_compliance", content, 0.9);
            apply(update);

            KnowledgeItem item = onlyItem();
            assertThat(item.id()).isEqualTo("external_" + update.id());
            assertThat(item.title()).isEqualTo("Outdated TLS library");
            assertThat(item.knowledgeType()).isEqualTo(KnowledgeType.ERROR_HANDLING);
            assertThat(item.applicableContexts()).containsExactly("security_advisories", "tls");
        }

        @Test
        @DisplayName("cross-brain insights list the brains they concern")
        void insight() {
            Map<String, Object> content = Map.of(
                "pattern_type", "error_correction",
                "involved_brains", List.of("intent_brain", "technical_brain"));
            apply(LearningUpdate.of(LearningType.CROSS_BRAIN_INSIGHT, BrainDescriptor.CROSS_BRAIN_LEARNER_ID,
                BrainDescriptor.ALL_BRAINS, content, 0.7));

            KnowledgeItem item = onlyItem();
            assertThat(item.knowledgeType()).isEqualTo(KnowledgeType.DECISION_STRATEGY);
            assertThat(item.sourceBrain()).isEqualTo(BrainDescriptor.CROSS_BRAIN_LEARNER_ID);
            assertThat(item.applicableContexts())
                .containsExactly("error_correction", "intent_brain", "technical_brain");
        }
    }

    // ── refusal ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("an update without a passing verdict is never applied")
    void refusesInvalid() {
        LearningUpdate update = LearningUpdate.of(LearningType.CROSS_BRAIN_INSIGHT,
            BrainDescriptor.CROSS_BRAIN_LEARNER_ID, BrainDescriptor.ALL_BRAINS, Map.of("k", "v"), 0.7);

        assertThatThrownBy(() -> applier.apply(update, ValidationResult.failed(update.id(), "boom")))
            .isInstanceOf(ValidationRejectedException.class)
            .satisfies(e -> assertThat(((ValidationRejectedException) e).getUpdateId()).isEqualTo(update.id()));
        assertThatThrownBy(() -> applier.apply(update, null)).isInstanceOf(ValidationRejectedException.class);
        assertThat(store.items()).isEmpty();
    }
}
