package com.brainfusion.orchestrator.service;

import com.brainfusion.common.model.DecisionRecord;
import com.brainfusion.orchestrator.config.BrainFusionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recent decisions with the brain outputs behind them, kept so that execution feedback
 * can be matched to its request. Bounded; the least recently touched record is evicted.
 */
@Component
public class DecisionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DecisionRegistry.class);

    private final int capacity;
    private final Map<String, DecisionRecord> records;

    @Autowired
    public DecisionRegistry(BrainFusionProperties properties) {
        this(properties.getOrchestration().getDecisionRetention());
    }

    DecisionRegistry(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("decision retention must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.records  = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DecisionRecord> eldest) {
                boolean evict = size() > DecisionRegistry.this.capacity;
                if (evict) {
                    log.debug("[Registry] Decision evicted. requestId={}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    public synchronized void register(DecisionRecord record) {
        records.put(record.requestId(), record);
    }

    public synchronized Optional<DecisionRecord> find(String requestId) {
        return Optional.ofNullable(records.get(requestId));
    }

    public synchronized int size() {
        return records.size();
    }
}
