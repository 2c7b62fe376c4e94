package com.brainfusion.common.model;

/**
 * Declares what role a registered brain plays in the pipeline.
 * Resolved once at registration time so that no component has to
 * infer a brain's role from its identifier.
 */
public enum BrainKind {
    INTENT,
    TECHNICAL,
    SME,
    EXECUTION_FEEDBACK_ANALYZER,
    CROSS_BRAIN_LEARNER,
    EXTERNAL_KNOWLEDGE_INTEGRATOR,
    UNKNOWN
}
