package com.brainfusion.orchestrator.oracle;

import com.brainfusion.common.exception.AnalysisUnavailableException;
import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.SmeConsultation;
import com.brainfusion.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Reasoning brain reached over HTTP. Posts a {@link BrainRequest} to the configured path
 * and decodes the reply; transport failures, timeouts and undecodable replies surface as
 * {@link AnalysisUnavailableException}.
 */
public class RemoteReasoningOracle implements ReasoningOracle {

    private static final Logger log = LoggerFactory.getLogger(RemoteReasoningOracle.class);

    private final BrainDescriptor descriptor;
    private final WebClient webClient;
    private final String path;
    private final Duration timeout;
    private final OracleResponseDecoder decoder;

    public RemoteReasoningOracle(BrainDescriptor descriptor, WebClient webClient, String path,
                                 Duration timeout, OracleResponseDecoder decoder) {
        this.descriptor = descriptor;
        this.webClient  = webClient;
        this.path       = path;
        this.timeout    = timeout;
        this.decoder    = decoder;
    }

    @Override
    public BrainDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Mono<BrainAnalysis> analyze(BrainRequest request) {
        return call(request).map(raw -> decoder.decode(descriptor.brainId(), raw));
    }

    /** SMEs may answer in prose; anything that is not a JSON object becomes free text. */
    @Override
    public Mono<SmeConsultation> consult(BrainRequest request) {
        return call(request).map(raw -> decoder.parseObject(raw)
            .<SmeConsultation>map(node -> new SmeConsultation.Structured(
                descriptor.domain(), decoder.toAnalysis(descriptor.brainId(), node)))
            .orElseGet(() -> new SmeConsultation.FreeText(descriptor.domain(), raw == null ? "" : raw.trim())));
    }

    private Mono<String> call(BrainRequest request) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            return webClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(timeout)
                .doOnNext(raw -> TraceContextUtil.withMdc(traceId, () ->
                    log.debug("[Oracle] Reply received. brainId={} bytes={} traceId={}",
                              descriptor.brainId(), raw.length(), traceId)))
                .onErrorMap(e -> !(e instanceof AnalysisUnavailableException), e -> unavailable(e, traceId));
        });
    }

    private AnalysisUnavailableException unavailable(Throwable e, String traceId) {
        String reason = e instanceof TimeoutException
            ? "No reply within " + timeout.toMillis() + "ms"
            : "Call failed: " + e.getMessage();
        TraceContextUtil.withMdc(traceId, () ->
            log.warn("[Oracle] Brain unavailable. brainId={} reason={} traceId={}",
                     descriptor.brainId(), reason, traceId));
        return new AnalysisUnavailableException(descriptor.brainId(), reason, e);
    }
}
