package com.brainfusion.common.model;

import java.util.List;

/**
 * Everything the learning loop needs to remember about a decision once execution feedback arrives:
 * the decision itself and the brain outputs it was built from. {@code intent} and {@code technical}
 * are {@code null} when the corresponding brain failed.
 */
public record DecisionRecord(
    AggregatedDecision decision,
    BrainAnalysis intent,
    BrainAnalysis technical,
    List<SmeConsultation> smeConsultations,
    String traceId
) {
    public DecisionRecord {
        smeConsultations = smeConsultations == null ? List.of() : List.copyOf(smeConsultations);
    }

    public String requestId() {
        return decision.requestId();
    }

    /** Domains whose SME answered (structured or free text); failed consultations are excluded. */
    public List<String> consultedSmeDomains() {
        return smeConsultations.stream()
            .filter(c -> !c.isError())
            .map(SmeConsultation::domain)
            .toList();
    }
}
