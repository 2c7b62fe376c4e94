package com.brainfusion.common.learning;

import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.LearningType;
import com.brainfusion.common.model.LearningUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalKnowledgeIntegratorTest {

    private final ExternalKnowledgeIntegrator integrator = new ExternalKnowledgeIntegrator();

    @Test
    @DisplayName("best practices: one update per practice, routed by target_domain")
    void bestPractices() {
        ExternalKnowledgeSubmission submission = new ExternalKnowledgeSubmission(
            ExternalKnowledgeSource.BEST_PRACTICES, "vendor-handbook", 0.9,
            Map.of("practices", List.of(
                Map.of("title", "Drain nodes before patching", "target_domain", "infrastructure"),
                Map.of("title", "Tag every change ticket"))));

        List<LearningUpdate> updates = integrator.integrate(submission);

        assertThat(updates).extracting(LearningUpdate::targetBrain)
            .containsExactly("sme_infrastructure", BrainDescriptor.ALL_BRAINS);
        assertThat(updates).allSatisfy(u -> {
            assertThat(u.learningType()).isEqualTo(LearningType.EXTERNAL_KNOWLEDGE);
            assertThat(u.sourceBrain()).isEqualTo(BrainDescriptor.EXTERNAL_INTEGRATOR_ID);
            assertThat(u.confidence()).isEqualTo(0.9);
            assertThat(u.content()).containsEntry(ExternalKnowledgeIntegrator.KEY_SOURCE, "vendor-handbook");
        });
    }

    @Test
    @DisplayName("security advisories go to the security-and-compliance SME")
    void advisories() {
        List<LearningUpdate> updates = integrator.integrate(new ExternalKnowledgeSubmission(
            ExternalKnowledgeSource.SECURITY_ADVISORIES, "cert-feed", 0.7,
            Map.of("advisories", List.of("CVE-2026-0001 in openssl"))));

        assertThat(updates).singleElement()
            .satisfies(u -> assertThat(u.targetBrain()).isEqualTo("sme_security_and_compliance"));
    }

    @Test
    @DisplayName("missing item list → no updates")
    void noItems() {
        assertThat(integrator.integrate(new ExternalKnowledgeSubmission(
            ExternalKnowledgeSource.DOCUMENTATION, "wiki", 0.8, Map.of("other", "x")))).isEmpty();
    }

    @Test
    @DisplayName("reliability below 0.5 is rejected")
    void lowReliability() {
        assertThatThrownBy(() -> integrator.integrate(new ExternalKnowledgeSubmission(
            ExternalKnowledgeSource.DOCUMENTATION, "forum", 0.4, Map.of("documentation", List.of("x")))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("missing source or reliability is rejected")
    void missingFields() {
        assertThatThrownBy(() -> integrator.integrate(new ExternalKnowledgeSubmission(
            ExternalKnowledgeSource.DOCUMENTATION, null, 0.9, Map.of())))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> integrator.integrate(new ExternalKnowledgeSubmission(
            ExternalKnowledgeSource.DOCUMENTATION, "wiki", null, Map.of())))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("source type parses case-insensitively and rejects unknown kinds")
    void sourceType() {
        assertThat(ExternalKnowledgeSource.fromValue("Industry_Standards"))
            .isEqualTo(ExternalKnowledgeSource.INDUSTRY_STANDARDS);
        assertThatThrownBy(() -> ExternalKnowledgeSource.fromValue("rumours"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
