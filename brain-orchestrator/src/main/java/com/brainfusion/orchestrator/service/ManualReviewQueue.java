package com.brainfusion.orchestrator.service;

import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Updates awaiting an operator's approve/dismiss. Oldest first.
 */
@Component
public class ManualReviewQueue {

    private static final Logger log = LoggerFactory.getLogger(ManualReviewQueue.class);

    private final Map<String, PendingReview> pending = new ConcurrentHashMap<>();

    public PendingReview hold(LearningUpdate update, ValidationResult validation) {
        PendingReview review = new PendingReview(update, validation, Instant.now());
        pending.put(update.id(), review);
        log.info("[Review] Update held for manual review. id={} type={} target={} failed={}",
                 update.id(), update.learningType(), update.targetBrain(), validation.criteriaFailed());
        return review;
    }

    /** Removes and returns the review, empty when no update with that id is waiting. */
    public Optional<PendingReview> take(String updateId) {
        return Optional.ofNullable(pending.remove(updateId));
    }

    public List<PendingReview> pending() {
        return pending.values().stream()
            .sorted(Comparator.comparing(PendingReview::queuedAt))
            .toList();
    }

    public int size() {
        return pending.size();
    }
}
