package com.brainfusion.orchestrator.oracle;

import com.brainfusion.common.exception.AnalysisUnavailableException;
import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.BrainKind;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.model.SmeConsultation;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** In-process oracle for pipeline tests; records every request it receives. */
public class StubOracle implements ReasoningOracle {

    private final BrainDescriptor descriptor;
    private final Function<BrainRequest, Mono<BrainAnalysis>> behaviour;
    private final List<BrainRequest> requests = new CopyOnWriteArrayList<>();

    public StubOracle(BrainDescriptor descriptor, Function<BrainRequest, Mono<BrainAnalysis>> behaviour) {
        this.descriptor = descriptor;
        this.behaviour  = behaviour;
    }

    // ── factories ─────────────────────────────────────────────────────────────

    public static StubOracle intent(double confidence, RiskLevel risk, Map<String, Object> content) {
        return answering(BrainDescriptor.of(BrainDescriptor.INTENT_BRAIN_ID, BrainKind.INTENT),
                         confidence, risk, content, List.of());
    }

    public static StubOracle technical(double confidence, RiskLevel risk, Map<String, Object> content) {
        return answering(BrainDescriptor.of(BrainDescriptor.TECHNICAL_BRAIN_ID, BrainKind.TECHNICAL),
                         confidence, risk, content, List.of());
    }

    public static StubOracle sme(String domain, double confidence, RiskLevel risk, List<String> recommendations) {
        return answering(BrainDescriptor.sme(domain), confidence, risk, Map.of("domain", domain), recommendations);
    }

    public static StubOracle failing(BrainDescriptor descriptor, String reason) {
        return new StubOracle(descriptor,
            request -> Mono.error(new AnalysisUnavailableException(descriptor.brainId(), reason)));
    }

    public static StubOracle slow(StubOracle delegate, Duration delay) {
        return new StubOracle(delegate.descriptor(),
            request -> Mono.delay(delay).then(delegate.analyze(request)));
    }

    /** SME that replies in prose. */
    public static ReasoningOracle freeText(String domain, String text) {
        BrainDescriptor descriptor = BrainDescriptor.sme(domain);
        return new StubOracle(descriptor, request -> Mono.error(new IllegalStateException("prose only"))) {
            @Override
            public Mono<SmeConsultation> consult(BrainRequest request) {
                return Mono.just(new SmeConsultation.FreeText(domain, text));
            }
        };
    }

    private static StubOracle answering(BrainDescriptor descriptor, double confidence, RiskLevel risk,
                                        Map<String, Object> content, List<String> recommendations) {
        return new StubOracle(descriptor, request -> Mono.just(new BrainAnalysis(descriptor.brainId(), confidence,
            risk, content, recommendations, Instant.now())));
    }

    // ── ReasoningOracle ───────────────────────────────────────────────────────

    @Override
    public BrainDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<BrainAnalysis> analyze(BrainRequest request) {
        return Mono.defer(() -> {
            requests.add(request);
            return behaviour.apply(request);
        });
    }

    public List<BrainRequest> requests() {
        return requests;
    }
}
