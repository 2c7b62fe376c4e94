package com.brainfusion.orchestrator.service;

import com.brainfusion.common.exception.ValidationRejectedException;
import com.brainfusion.common.knowledge.CrossBrainKnowledgeStore;
import com.brainfusion.common.learning.CrossBrainInsightGenerator;
import com.brainfusion.common.learning.ExternalKnowledgeIntegrator;
import com.brainfusion.common.learning.ExternalKnowledgeSource;
import com.brainfusion.common.learning.LearningUpdateGenerator;
import com.brainfusion.common.model.KnowledgeItem;
import com.brainfusion.common.model.KnowledgeType;
import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.ValidationResult;
import com.brainfusion.common.reliability.BrainReliabilityTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Applies validated learning updates to the adaptive state.
 *
 * <ul>
 *   <li>execution outcomes nudge the target brain's reliability;</li>
 *   <li>patterns, calibrations, improvement suggestions, timing corrections, external
 *       knowledge and cross-brain insights become knowledge items;</li>
 *   <li>SME effectiveness scores stay in the learning history only.</li>
 * </ul>
 *
 * Derived knowledge items take the update's confidence as their success rate, except
 * pattern items which carry the observed success rate.
 */
@Component
public class LearningUpdateApplier {

    private static final Logger log = LoggerFactory.getLogger(LearningUpdateApplier.class);

    /** Where an applied update ended up. */
    public enum Target { RELIABILITY, KNOWLEDGE, HISTORY_ONLY }

    private final BrainReliabilityTracker reliabilityTracker;
    private final CrossBrainKnowledgeStore knowledgeStore;

    public LearningUpdateApplier(BrainReliabilityTracker reliabilityTracker, CrossBrainKnowledgeStore knowledgeStore) {
        this.reliabilityTracker = reliabilityTracker;
        this.knowledgeStore     = knowledgeStore;
    }

    /**
     * @throws ValidationRejectedException if {@code result} is not a passing verdict
     */
    public Target apply(LearningUpdate update, ValidationResult result) {
        if (result == null || !result.valid()) {
            throw new ValidationRejectedException(update.id(), result == null
                ? ValidationResult.failed(update.id(), "no verdict") : result);
        }
        Map<String, Object> content = update.content();

        Target target = switch (update.learningType()) {
            case EXECUTION_FEEDBACK -> {
                if (content.get(LearningUpdateGenerator.KEY_OUTCOME_SUCCESSFUL) instanceof Boolean successful) {
                    reliabilityTracker.recordOutcome(update.targetBrain(), successful,
                        number(content.get(LearningUpdateGenerator.KEY_CONFIDENCE_ACCURACY), 0.5));
                    yield Target.RELIABILITY;
                }
                if (content.containsKey(LearningUpdateGenerator.KEY_ADJUSTMENT_FACTOR)) {
                    share(update, timingItem(update));
                    yield Target.KNOWLEDGE;
                }
                yield Target.HISTORY_ONLY;
            }
            case PATTERN_RECOGNITION -> {
                share(update, patternItem(update));
                yield Target.KNOWLEDGE;
            }
            case ERROR_CORRECTION -> {
                if (content.containsKey(LearningUpdateGenerator.KEY_CALIBRATION_ADJUSTMENT)) {
                    share(update, calibrationItem(update));
                    yield Target.KNOWLEDGE;
                }
                if (content.containsKey(LearningUpdateGenerator.KEY_IMPROVEMENT_SUGGESTIONS)) {
                    share(update, improvementItem(update));
                    yield Target.KNOWLEDGE;
                }
                yield Target.HISTORY_ONLY;
            }
            case EXTERNAL_KNOWLEDGE -> {
                share(update, externalItem(update));
                yield Target.KNOWLEDGE;
            }
            case CROSS_BRAIN_INSIGHT -> {
                share(update, insightItem(update));
                yield Target.KNOWLEDGE;
            }
        };
        log.debug("[Learning] Update applied. id={} type={} target={} appliedTo={}",
                  update.id(), update.learningType(), update.targetBrain(), target);
        return target;
    }

    private void share(LearningUpdate update, KnowledgeItem item) {
        knowledgeStore.share(update.sourceBrain(), item);
    }

    // ── item builders ────────────────────────────────────────────────────────

    private static KnowledgeItem patternItem(LearningUpdate update) {
        Map<String, Object> c = update.content();
        String pattern     = text(c.get(LearningUpdateGenerator.KEY_PATTERN));
        double successRate = number(c.get(LearningUpdateGenerator.KEY_SUCCESS_RATE), 0.0);
        Object attempts    = c.get(LearningUpdateGenerator.KEY_TOTAL_ATTEMPTS);
        return KnowledgeItem.of("pattern_" + pattern, update.sourceBrain(), KnowledgeType.PATTERN_RECOGNITION,
            "Execution pattern " + pattern,
            String.format(Locale.ROOT, "Success rate %.2f over %s attempts (%s)",
                successRate, attempts, text(c.get(LearningUpdateGenerator.KEY_RECOMMENDATION))),
            contexts(c.get(LearningUpdateGenerator.KEY_INTENT_TYPE), c.get(LearningUpdateGenerator.KEY_COMPLEXITY)),
            successRate - 0.5, successRate);
    }

    private static KnowledgeItem calibrationItem(LearningUpdate update) {
        Map<String, Object> c = update.content();
        Map<?, ?> context = c.get("context") instanceof Map<?, ?> m ? m : Map.of();
        Object intentType = context.get(LearningUpdateGenerator.KEY_INTENT_TYPE);
        Object complexity = context.get(LearningUpdateGenerator.KEY_COMPLEXITY);
        double adjustment = number(c.get(LearningUpdateGenerator.KEY_CALIBRATION_ADJUSTMENT), 0.0);
        return KnowledgeItem.of("calibration_" + text(intentType) + "_" + text(complexity), update.sourceBrain(),
            KnowledgeType.CONFIDENCE_CALIBRATION,
            "Confidence calibration for " + text(intentType) + "/" + text(complexity),
            String.format(Locale.ROOT, "Adjust predicted confidence by %+.2f", adjustment),
            contexts(intentType, complexity), adjustment, update.confidence());
    }

    private static KnowledgeItem improvementItem(LearningUpdate update) {
        Map<String, Object> c = update.content();
        Map<?, ?> failure = c.get("failure_context") instanceof Map<?, ?> m ? m : Map.of();
        Object suggestions = c.get(LearningUpdateGenerator.KEY_IMPROVEMENT_SUGGESTIONS);
        String errorType = text(c.get("error_type"));
        return KnowledgeItem.of("improvement_" + slug(errorType), update.sourceBrain(), KnowledgeType.ERROR_HANDLING,
            "Avoiding failure: " + errorType,
            suggestions instanceof Collection<?> list ? String.join("; ", list.stream().map(String::valueOf).toList())
                : text(suggestions),
            contexts(failure.get("intent"), failure.get(LearningUpdateGenerator.KEY_COMPLEXITY)),
            0.0, update.confidence());
    }

    private static KnowledgeItem timingItem(LearningUpdate update) {
        Map<String, Object> c = update.content();
        Object complexity = c.get(LearningUpdateGenerator.KEY_COMPLEXITY);
        double factor = number(c.get(LearningUpdateGenerator.KEY_ADJUSTMENT_FACTOR), 1.0);
        return KnowledgeItem.of("timing_" + text(complexity), update.sourceBrain(), KnowledgeType.OPTIMIZATION_TECHNIQUE,
            "Duration estimate correction for " + text(complexity) + " plans",
            String.format(Locale.ROOT, "Scale estimated duration by %.2f", factor),
            contexts(complexity), 0.0, update.confidence());
    }

    private static KnowledgeItem externalItem(LearningUpdate update) {
        Map<String, Object> c = update.content();
        ExternalKnowledgeSource source = ExternalKnowledgeSource.fromValue(
            text(c.get(ExternalKnowledgeIntegrator.KEY_SOURCE_TYPE)));
        Object knowledge = c.get(ExternalKnowledgeIntegrator.KEY_KNOWLEDGE);
        String title = text(c.get(ExternalKnowledgeIntegrator.KEY_SOURCE));
        List<Object> contexts = new ArrayList<>();
        contexts.add(source.value());
        if (knowledge instanceof Map<?, ?> item) {
            if (item.get("title") != null) title = text(item.get("title"));
            else if (item.get("name") != null) title = text(item.get("name"));
            contexts.add(item.get(ExternalKnowledgeIntegrator.KEY_TARGET_DOMAIN));
            contexts.add(item.get("category"));
        }
        return KnowledgeItem.of("external_" + update.id(), update.sourceBrain(), source.knowledgeType(),
            title, String.valueOf(knowledge), contexts(contexts.toArray()), 0.0, update.confidence());
    }

    private static KnowledgeItem insightItem(LearningUpdate update) {
        Map<String, Object> c = update.content();
        List<Object> contexts = new ArrayList<>();
        contexts.add(c.get(CrossBrainInsightGenerator.KEY_PATTERN_TYPE));
        for (String key : List.of(CrossBrainInsightGenerator.KEY_INVOLVED_BRAINS,
                                  CrossBrainInsightGenerator.KEY_COLLABORATION)) {
            if (c.get(key) instanceof Collection<?> brains) contexts.addAll(brains);
        }
        if (c.get(CrossBrainInsightGenerator.KEY_HIGH_ERROR_BRAINS) instanceof Map<?, ?> highError) {
            contexts.addAll(highError.keySet());
        }
        return KnowledgeItem.of("insight_" + update.id(), update.sourceBrain(), KnowledgeType.DECISION_STRATEGY,
            "Cross-brain insight", String.valueOf(c), contexts(contexts.toArray()), 0.0, update.confidence());
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static List<String> contexts(Object... values) {
        List<String> out = new ArrayList<>();
        for (Object value : values) {
            if (value != null && !String.valueOf(value).isBlank() && !"unknown".equals(value)) {
                out.add(String.valueOf(value));
            }
        }
        return out;
    }

    private static String text(Object value) {
        return value == null ? "unknown" : String.valueOf(value);
    }

    private static double number(Object value, double fallback) {
        return value instanceof Number n ? n.doubleValue() : fallback;
    }

    private static String slug(String value) {
        String slug = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return slug.length() > 40 ? slug.substring(0, 40) : slug;
    }
}
