package com.brainfusion.orchestrator.config;

import com.brainfusion.common.exception.AnalysisUnavailableException;
import com.brainfusion.common.exception.ConfigurationException;
import com.brainfusion.common.knowledge.CrossBrainKnowledgeStore;
import com.brainfusion.common.knowledge.InMemoryKnowledgeRepository;
import com.brainfusion.common.learning.CrossBrainInsightGenerator;
import com.brainfusion.common.learning.ExternalKnowledgeIntegrator;
import com.brainfusion.common.learning.LearningHistory;
import com.brainfusion.common.learning.LearningUpdateGenerator;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.BrainKind;
import com.brainfusion.common.quality.QualityAssuranceValidator;
import com.brainfusion.common.reliability.BrainReliabilityTracker;
import com.brainfusion.common.reliability.InMemoryBrainReliabilityRepository;
import com.brainfusion.orchestrator.oracle.BrainRegistry;
import com.brainfusion.orchestrator.oracle.OracleResponseDecoder;
import com.brainfusion.orchestrator.oracle.ReasoningOracle;
import com.brainfusion.orchestrator.oracle.RemoteReasoningOracle;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public OracleResponseDecoder oracleResponseDecoder(ObjectMapper objectMapper) {
        return new OracleResponseDecoder(objectMapper);
    }

    // ── reasoning brains ──────────────────────────────────────────────────────

    @Bean
    public BrainRegistry brainRegistry(BrainFusionProperties properties, WebClient.Builder builder,
                                       OracleResponseDecoder decoder) {
        BrainFusionProperties.Brains brains = properties.getBrains();
        int connectTimeoutMs = (int) properties.getOrchestration().getConnectTimeout().toMillis();

        ReasoningOracle intent = brains.getIntent() == null ? null
            : remote(BrainKind.INTENT, BrainDescriptor.INTENT_BRAIN_ID, brains.getIntent(),
                     builder, decoder, connectTimeoutMs);
        ReasoningOracle technical = brains.getTechnical() == null ? null
            : remote(BrainKind.TECHNICAL, BrainDescriptor.TECHNICAL_BRAIN_ID, brains.getTechnical(),
                     builder, decoder, connectTimeoutMs);
        List<ReasoningOracle> smes = brains.getSme().stream()
            .map(e -> remote(BrainKind.SME, null, e, builder, decoder, connectTimeoutMs))
            .toList();
        return new BrainRegistry(intent, technical, smes);
    }

    private ReasoningOracle remote(BrainKind kind, String defaultId, BrainFusionProperties.Endpoint endpoint,
                                   WebClient.Builder builder, OracleResponseDecoder decoder, int connectTimeoutMs) {
        if (endpoint.getBaseUrl() == null || endpoint.getBaseUrl().isBlank()) {
            throw new ConfigurationException("Brain " + kind + " has no base-url");
        }
        String domain = kind == BrainKind.SME ? endpoint.getDomain() : null;
        String id = kind == BrainKind.SME ? BrainDescriptor.smeBrainId(domain) : defaultId;
        BrainDescriptor descriptor = new BrainDescriptor(id, kind, domain, endpoint.getCapabilities());

        long readTimeoutMs = endpoint.getTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(endpoint.getTimeout())
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutMs, TimeUnit.MILLISECONDS))
            );
        WebClient client = builder.clone()
            .baseUrl(endpoint.getBaseUrl())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter(id))
            .filter(loggingFilter(id))
            .build();
        return new RemoteReasoningOracle(descriptor, client, endpoint.getPath(), endpoint.getTimeout(), decoder);
    }

    private ExchangeFilterFunction serverErrorFilter(String brainId) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new AnalysisUnavailableException(brainId,
                    "Brain server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter(String brainId) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[Oracle] Outbound request. brainId={} {} {}",
                      brainId, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    // ── adaptive state ────────────────────────────────────────────────────────

    @Bean
    public QualityAssuranceValidator qualityAssuranceValidator(BrainFusionProperties properties,
                                                               BrainRegistry brainRegistry) {
        return new QualityAssuranceValidator(properties.getQuality().toSettings(), brainRegistry);
    }

    @Bean
    public BrainReliabilityTracker brainReliabilityTracker(BrainRegistry brainRegistry) {
        return new BrainReliabilityTracker(new InMemoryBrainReliabilityRepository(), brainRegistry);
    }

    @Bean
    public CrossBrainKnowledgeStore crossBrainKnowledgeStore() {
        return new CrossBrainKnowledgeStore(new InMemoryKnowledgeRepository());
    }

    // ── learning ──────────────────────────────────────────────────────────────

    @Bean
    public LearningUpdateGenerator learningUpdateGenerator(BrainFusionProperties properties) {
        return new LearningUpdateGenerator(properties.getLearning().getPatternMinObservations());
    }

    @Bean
    public CrossBrainInsightGenerator crossBrainInsightGenerator() {
        return new CrossBrainInsightGenerator();
    }

    @Bean
    public ExternalKnowledgeIntegrator externalKnowledgeIntegrator() {
        return new ExternalKnowledgeIntegrator();
    }

    @Bean
    public LearningHistory learningHistory(BrainFusionProperties properties) {
        return new LearningHistory(properties.getLearning().getHistoryRetention(), Clock.systemUTC());
    }
}
