package com.brainfusion.orchestrator.oracle;

import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.SmeConsultation;
import reactor.core.publisher.Mono;

/**
 * A reasoning collaborator the orchestrator consults: the Intent brain, the Technical
 * brain or a subject-matter expert.
 *
 * <p>Implementations signal failure with an error signal carrying
 * {@link com.brainfusion.common.exception.AnalysisUnavailableException}; they never emit
 * a partially filled analysis.
 */
public interface ReasoningOracle {

    BrainDescriptor descriptor();

    Mono<BrainAnalysis> analyze(BrainRequest request);

    /**
     * SME-side call. The default wraps a structured analysis; oracles that may reply with
     * prose override it to return {@link SmeConsultation.FreeText}.
     */
    default Mono<SmeConsultation> consult(BrainRequest request) {
        String domain = descriptor().domain();
        return analyze(request).map(analysis -> new SmeConsultation.Structured(domain, analysis));
    }

    default String brainId() {
        return descriptor().brainId();
    }
}
