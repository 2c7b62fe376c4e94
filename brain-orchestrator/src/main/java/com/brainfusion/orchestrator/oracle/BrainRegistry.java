package com.brainfusion.orchestrator.oracle;

import com.brainfusion.common.exception.ConfigurationException;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.BrainDirectory;
import com.brainfusion.common.model.BrainKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The reasoning brains known to this process, keyed by role. Serves as the
 * {@link BrainDirectory} for the quality gate and the reliability tracker, so every
 * brain's kind is fixed here at registration.
 */
public class BrainRegistry implements BrainDirectory {

    private static final Logger log = LoggerFactory.getLogger(BrainRegistry.class);

    private final ReasoningOracle intent;
    private final ReasoningOracle technical;
    private final Map<String, ReasoningOracle> smeByDomain;
    private final Map<String, BrainDescriptor> descriptors;

    /**
     * @throws ConfigurationException when the Intent or Technical brain is missing, a brain is
     *         registered with the wrong kind, or an SME domain is declared twice
     */
    public BrainRegistry(ReasoningOracle intent, ReasoningOracle technical, List<ReasoningOracle> smes) {
        this.intent    = require(intent, BrainKind.INTENT);
        this.technical = require(technical, BrainKind.TECHNICAL);

        Map<String, ReasoningOracle> byDomain = new LinkedHashMap<>();
        for (ReasoningOracle sme : smes == null ? List.<ReasoningOracle>of() : smes) {
            BrainDescriptor d = require(sme, BrainKind.SME).descriptor();
            if (d.domain() == null || d.domain().isBlank()) {
                throw new ConfigurationException("SME brain " + d.brainId() + " has no domain");
            }
            if (byDomain.putIfAbsent(d.domain(), sme) != null) {
                throw new ConfigurationException("SME domain registered twice: " + d.domain());
            }
        }
        this.smeByDomain = Collections.unmodifiableMap(byDomain);

        Map<String, BrainDescriptor> all = new LinkedHashMap<>();
        all.put(intent.brainId(), intent.descriptor());
        all.put(technical.brainId(), technical.descriptor());
        byDomain.values().forEach(o -> all.put(o.brainId(), o.descriptor()));
        BrainDirectory.learningBrains().forEach(d -> all.put(d.brainId(), d));
        this.descriptors = Collections.unmodifiableMap(all);

        log.info("[Registry] Brains registered. intent={} technical={} smeDomains={}",
                 intent.brainId(), technical.brainId(), smeByDomain.keySet());
    }

    public ReasoningOracle intent() {
        return intent;
    }

    public ReasoningOracle technical() {
        return technical;
    }

    public Optional<ReasoningOracle> sme(String domain) {
        return Optional.ofNullable(smeByDomain.get(domain));
    }

    public List<String> smeDomains() {
        return new ArrayList<>(smeByDomain.keySet());
    }

    @Override
    public Optional<BrainDescriptor> find(String brainId) {
        return Optional.ofNullable(descriptors.get(brainId));
    }

    @Override
    public List<BrainDescriptor> all() {
        return List.copyOf(descriptors.values());
    }

    private static ReasoningOracle require(ReasoningOracle oracle, BrainKind kind) {
        if (oracle == null || oracle.descriptor() == null) {
            throw new ConfigurationException("Missing " + kind.name().toLowerCase(Locale.ROOT) + " brain configuration");
        }
        if (oracle.descriptor().kind() != kind) {
            throw new ConfigurationException("Brain " + oracle.brainId() + " registered as "
                + oracle.descriptor().kind() + " but expected " + kind);
        }
        return oracle;
    }
}
