package com.brainfusion.orchestrator.service;

import com.brainfusion.common.knowledge.CrossBrainKnowledgeStore;
import com.brainfusion.common.learning.LearningHistory;
import com.brainfusion.orchestrator.config.BrainFusionProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Periodic housekeeping of the in-memory learning state: prunes learning history past its
 * retention and drops knowledge items unused for the knowledge retention period.
 *
 * <p>Each cycle is a fresh {@code Mono.delay} whose subscriber schedules the next one; a
 * failed cycle is logged and the loop carries on.
 */
@Component
public class LearningMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(LearningMaintenanceScheduler.class);

    private final LearningHistory history;
    private final CrossBrainKnowledgeStore knowledgeStore;
    private final Duration interval;
    private final Duration knowledgeRetention;

    private volatile Disposable nextCycle;
    private volatile boolean stopped;

    public LearningMaintenanceScheduler(LearningHistory history, CrossBrainKnowledgeStore knowledgeStore,
                                        BrainFusionProperties properties) {
        this.history            = history;
        this.knowledgeStore     = knowledgeStore;
        this.interval           = properties.getLearning().getMaintenanceInterval();
        this.knowledgeRetention = properties.getLearning().getKnowledgeRetention();
    }

    @PostConstruct
    public void start() {
        log.info("[Maintenance] Started. intervalSeconds={} knowledgeRetentionDays={}",
                 interval.toSeconds(), knowledgeRetention.toDays());
        scheduleNextCycle();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable current = nextCycle;
        if (current != null) {
            current.dispose();
        }
    }

    /** One housekeeping pass; returns the number of history entries and knowledge items removed. */
    public int runOnce() {
        int prunedHistory   = history.prune();
        int prunedKnowledge = knowledgeStore.cleanup(knowledgeRetention);
        log.info("[Maintenance] Cycle complete. historyPruned={} knowledgePruned={}", prunedHistory, prunedKnowledge);
        return prunedHistory + prunedKnowledge;
    }

    private void scheduleNextCycle() {
        if (stopped) {
            return;
        }
        nextCycle = Mono.delay(interval)
            .map(tick -> runOnce())
            .subscribe(
                removed -> scheduleNextCycle(),
                err -> {
                    log.error("[Maintenance] Cycle failed, rescheduling", err);
                    scheduleNextCycle();
                }
            );
    }
}
