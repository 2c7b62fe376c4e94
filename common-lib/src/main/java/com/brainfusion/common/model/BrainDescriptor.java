package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Registration record for a brain: its identifier, role, SME domain (SME brains only)
 * and free-form capability tags.
 */
public record BrainDescriptor(
    @JsonProperty("brainId") String brainId,
    @JsonProperty("kind") BrainKind kind,
    @JsonProperty("domain") String domain,
    @JsonProperty("capabilities") List<String> capabilities
) {
    /** Pseudo-target addressing every registered brain. */
    public static final String ALL_BRAINS = "all_brains";

    public static final String INTENT_BRAIN_ID     = "intent_brain";
    public static final String TECHNICAL_BRAIN_ID  = "technical_brain";
    public static final String FEEDBACK_ANALYZER_ID = "execution_feedback_analyzer";
    public static final String CROSS_BRAIN_LEARNER_ID = "cross_brain_learner";
    public static final String EXTERNAL_INTEGRATOR_ID = "external_knowledge_integrator";

    public BrainDescriptor {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public static BrainDescriptor of(String brainId, BrainKind kind) {
        return new BrainDescriptor(brainId, kind, null, List.of());
    }

    public static BrainDescriptor sme(String domain) {
        return new BrainDescriptor(smeBrainId(domain), BrainKind.SME, domain, List.of());
    }

    /** Canonical identifier of the SME brain serving {@code domain}. */
    public static String smeBrainId(String domain) {
        return "sme_" + domain;
    }
}
