package com.brainfusion.common.learning;

import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.DecisionRecord;
import com.brainfusion.common.model.ExecutionFeedback;
import com.brainfusion.common.model.LearningType;
import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.SmeConsultation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns execution feedback for a recorded decision into candidate {@link LearningUpdate}s.
 *
 * <p>Analyses, in emission order:
 * <ol>
 *   <li><b>Pattern recognition</b>: success/failure counters per
 *       {@code intent_type/complexity/strategy}; from {@value #DEFAULT_PATTERN_MIN_OBSERVATIONS}
 *       observations on, every feedback for the key emits its success rate and a tag
 *       ({@code high_confidence} at ≥ 0.8, {@code review_approach} below 0.4,
 *       {@code standard_approach} otherwise).</li>
 *   <li><b>Confidence calibration</b>: predicted = mean(intent, technical confidence);
 *       when |predicted − actual| &gt; 0.3 an error correction for all brains carries
 *       {@code calibration_adjustment} −0.1 (over-confident) or +0.1.</li>
 *   <li><b>Timing</b>: when |actual − estimated| / estimated &gt; 0.5 the technical brain gets
 *       {@code adjustment_factor = actual / estimated}.</li>
 *   <li><b>SME effectiveness</b>: 0.8 on success, 0.3 on failure, per consulted SME.</li>
 *   <li><b>Improvement suggestions</b>: failures whose error text mentions timeout, permission,
 *       resource or network get the matching fixed suggestion (first match wins).</li>
 * </ol>
 * {@link #reliabilityUpdates} additionally produces one execution-outcome update per
 * contributing brain, which the reliability tracker consumes once validated.
 *
 * <p>Pattern counters are the only state; they are updated atomically per key.
 */
public class LearningUpdateGenerator {

    private static final Logger log = LoggerFactory.getLogger(LearningUpdateGenerator.class);

    public static final String KEY_PATTERN                 = "pattern";
    public static final String KEY_INTENT_TYPE             = "intent_type";
    public static final String KEY_COMPLEXITY              = "complexity";
    public static final String KEY_EXECUTION_STRATEGY      = "execution_strategy";
    public static final String KEY_SUCCESS_RATE            = "success_rate";
    public static final String KEY_TOTAL_ATTEMPTS          = "total_attempts";
    public static final String KEY_RECOMMENDATION          = "recommendation";
    public static final String KEY_CALIBRATION_ADJUSTMENT  = "calibration_adjustment";
    public static final String KEY_ADJUSTMENT_FACTOR       = "adjustment_factor";
    public static final String KEY_EFFECTIVENESS_SCORE     = "effectiveness_score";
    public static final String KEY_IMPROVEMENT_SUGGESTIONS = "improvement_suggestions";
    public static final String KEY_EXECUTION_OUTCOME       = "execution_outcome";
    public static final String KEY_OUTCOME_SUCCESSFUL      = "outcome_successful";
    public static final String KEY_CONFIDENCE_ACCURACY     = "confidence_accuracy";

    public static final String TAG_HIGH_CONFIDENCE   = "high_confidence";
    public static final String TAG_REVIEW_APPROACH   = "review_approach";
    public static final String TAG_STANDARD_APPROACH = "standard_approach";

    public static final int DEFAULT_PATTERN_MIN_OBSERVATIONS = 5;

    static final double HIGH_CONFIDENCE_RATE     = 0.8;
    static final double REVIEW_RATE              = 0.4;
    static final double PATTERN_MAX_CONFIDENCE   = 0.9;
    static final double PATTERN_CONFIDENCE_SCALE = 20.0;
    static final double CALIBRATION_TOLERANCE    = 0.3;
    static final double CALIBRATION_STEP         = 0.1;
    static final double CALIBRATION_CONFIDENCE   = 0.7;
    static final double TIMING_TOLERANCE         = 0.5;
    static final double TIMING_CONFIDENCE        = 0.8;
    static final double SME_EFFECTIVE            = 0.8;
    static final double SME_INEFFECTIVE          = 0.3;
    static final double SME_CONFIDENCE           = 0.6;
    static final double SUGGESTION_CONFIDENCE    = 0.7;
    static final double OUTCOME_CONFIDENCE       = 0.8;
    static final double NEUTRAL_CONFIDENCE       = 0.5;

    /** Error-text marker → suggestion, checked in this order. */
    static final Map<String, String> IMPROVEMENTS = orderedImprovements();

    private final int patternMinObservations;
    private final ConcurrentHashMap<String, PatternCounts> patterns = new ConcurrentHashMap<>();

    public LearningUpdateGenerator() {
        this(DEFAULT_PATTERN_MIN_OBSERVATIONS);
    }

    public LearningUpdateGenerator(int patternMinObservations) {
        if (patternMinObservations < 1) {
            throw new IllegalArgumentException("patternMinObservations must be positive: " + patternMinObservations);
        }
        this.patternMinObservations = patternMinObservations;
    }

    /** Analytic updates followed by the per-brain execution-outcome updates. */
    public List<LearningUpdate> generate(DecisionRecord record, ExecutionFeedback feedback) {
        List<LearningUpdate> all = new ArrayList<>(analyze(record, feedback));
        all.addAll(reliabilityUpdates(record, feedback));
        return all;
    }

    /** Pattern, calibration, timing, SME-effectiveness and improvement updates. */
    public List<LearningUpdate> analyze(DecisionRecord record, ExecutionFeedback feedback) {
        List<LearningUpdate> updates = new ArrayList<>();
        patternUpdate(record, feedback).ifPresent(updates::add);
        calibrationUpdate(record, feedback).ifPresent(updates::add);
        timingUpdate(record, feedback).ifPresent(updates::add);
        updates.addAll(smeEffectivenessUpdates(record, feedback));
        improvementUpdate(record, feedback).ifPresent(updates::add);
        log.info("[Learning] Feedback analysed. requestId={} outcome={} updates={}",
                 record.requestId(), feedback.outcome(), updates.size());
        return updates;
    }

    /**
     * One execution-outcome update per brain that contributed to the decision.
     * Failed SME consultations did not contribute and get none.
     */
    public List<LearningUpdate> reliabilityUpdates(DecisionRecord record, ExecutionFeedback feedback) {
        Set<String> brains = new LinkedHashSet<>();
        if (record.intent() != null)    brains.add(record.intent().brainId());
        if (record.technical() != null) brains.add(record.technical().brainId());
        for (SmeConsultation consultation : record.smeConsultations()) {
            if (consultation instanceof SmeConsultation.Structured structured) {
                brains.add(structured.analysis().brainId());
            } else if (!consultation.isError()) {
                brains.add(BrainDescriptor.smeBrainId(consultation.domain()));
            }
        }
        List<LearningUpdate> updates = new ArrayList<>(brains.size());
        for (String brain : brains) {
            Map<String, Object> content = new LinkedHashMap<>();
            content.put(KEY_EXECUTION_OUTCOME, feedback.outcome().name().toLowerCase(Locale.ROOT));
            content.put(KEY_OUTCOME_SUCCESSFUL, feedback.isSuccessful());
            content.put(KEY_CONFIDENCE_ACCURACY, feedback.effectiveConfidenceAccuracy());
            updates.add(LearningUpdate.of(LearningType.EXECUTION_FEEDBACK,
                BrainDescriptor.FEEDBACK_ANALYZER_ID, brain, content, OUTCOME_CONFIDENCE));
        }
        return updates;
    }

    // ── pattern recognition ──────────────────────────────────────────────────

    Optional<LearningUpdate> patternUpdate(DecisionRecord record, ExecutionFeedback feedback) {
        String intentType = record.intent() != null ? record.intent().intentType() : "unknown";
        String complexity = record.technical() != null ? record.technical().complexity() : "unknown";
        String strategy   = record.decision().executionStrategy().name().toLowerCase(Locale.ROOT);
        String key        = intentType + "_" + complexity + "_" + strategy;

        PatternCounts counts = patterns.compute(key, (k, current) ->
            (current == null ? PatternCounts.EMPTY : current).record(feedback.isSuccessful()));

        int total = counts.total();
        if (total < patternMinObservations) {
            return Optional.empty();
        }
        double successRate = (double) counts.successes() / total;

        Map<String, Object> content = new LinkedHashMap<>();
        content.put(KEY_PATTERN, key);
        content.put(KEY_INTENT_TYPE, intentType);
        content.put(KEY_COMPLEXITY, complexity);
        content.put(KEY_EXECUTION_STRATEGY, strategy);
        content.put(KEY_SUCCESS_RATE, successRate);
        content.put(KEY_TOTAL_ATTEMPTS, total);
        content.put(KEY_RECOMMENDATION, recommendationTag(successRate));
        return Optional.of(LearningUpdate.of(LearningType.PATTERN_RECOGNITION,
            BrainDescriptor.FEEDBACK_ANALYZER_ID, BrainDescriptor.TECHNICAL_BRAIN_ID, content,
            Math.min(PATTERN_MAX_CONFIDENCE, total / PATTERN_CONFIDENCE_SCALE)));
    }

    static String recommendationTag(double successRate) {
        // inclusive: four successes out of five is already high confidence
        if (successRate >= HIGH_CONFIDENCE_RATE) return TAG_HIGH_CONFIDENCE;
        if (successRate < REVIEW_RATE)           return TAG_REVIEW_APPROACH;
        return TAG_STANDARD_APPROACH;
    }

    /** Observation counts for one pattern key; empty when the key was never seen. */
    public PatternCounts patternCounts(String key) {
        return patterns.getOrDefault(key, PatternCounts.EMPTY);
    }

    // ── confidence calibration ───────────────────────────────────────────────

    Optional<LearningUpdate> calibrationUpdate(DecisionRecord record, ExecutionFeedback feedback) {
        double intent    = record.intent() != null ? record.intent().confidence() : NEUTRAL_CONFIDENCE;
        double technical = record.technical() != null ? record.technical().confidence() : NEUTRAL_CONFIDENCE;
        double predicted = (intent + technical) / 2.0;
        double actual    = feedback.isSuccessful() ? 1.0 : 0.0;
        double error     = Math.abs(predicted - actual);
        if (error <= CALIBRATION_TOLERANCE) {
            return Optional.empty();
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put(KEY_INTENT_TYPE, record.intent() != null ? record.intent().intentType() : "unknown");
        context.put(KEY_COMPLEXITY, record.technical() != null ? record.technical().complexity() : "unknown");

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("confidence_error", error);
        content.put("predicted_success", predicted);
        content.put("actual_success", actual);
        content.put(KEY_CALIBRATION_ADJUSTMENT, predicted > actual ? -CALIBRATION_STEP : CALIBRATION_STEP);
        content.put("context", context);
        return Optional.of(LearningUpdate.of(LearningType.ERROR_CORRECTION,
            BrainDescriptor.FEEDBACK_ANALYZER_ID, BrainDescriptor.ALL_BRAINS, content, CALIBRATION_CONFIDENCE));
    }

    // ── timing ───────────────────────────────────────────────────────────────

    Optional<LearningUpdate> timingUpdate(DecisionRecord record, ExecutionFeedback feedback) {
        if (record.technical() == null || feedback.executionTimeSeconds() == null) {
            return Optional.empty();
        }
        double estimated = record.technical().estimatedDurationSeconds();
        double actual    = feedback.executionTimeSeconds();
        if (estimated <= 0.0) {
            return Optional.empty();
        }
        double timingError = Math.abs(actual - estimated) / estimated;
        if (timingError <= TIMING_TOLERANCE) {
            return Optional.empty();
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("timing_error", timingError);
        content.put("estimated_time", estimated);
        content.put("actual_time", actual);
        content.put(KEY_ADJUSTMENT_FACTOR, actual / estimated);
        content.put(KEY_COMPLEXITY, record.technical().complexity());
        return Optional.of(LearningUpdate.of(LearningType.EXECUTION_FEEDBACK,
            BrainDescriptor.FEEDBACK_ANALYZER_ID, BrainDescriptor.TECHNICAL_BRAIN_ID, content, TIMING_CONFIDENCE));
    }

    // ── SME effectiveness ────────────────────────────────────────────────────

    List<LearningUpdate> smeEffectivenessUpdates(DecisionRecord record, ExecutionFeedback feedback) {
        List<LearningUpdate> updates = new ArrayList<>();
        for (SmeConsultation consultation : record.smeConsultations()) {
            if (consultation.isError()) {
                continue;
            }
            int recommendationCount = consultation instanceof SmeConsultation.Structured structured
                ? structured.analysis().recommendations().size() : 0;
            Map<String, Object> content = new LinkedHashMap<>();
            content.put(KEY_EFFECTIVENESS_SCORE, feedback.isSuccessful() ? SME_EFFECTIVE : SME_INEFFECTIVE);
            content.put("sme_confidence", consultation.confidence());
            content.put("execution_success", feedback.isSuccessful());
            content.put("recommendation_count", recommendationCount);
            content.put("domain", consultation.domain());
            updates.add(LearningUpdate.of(LearningType.EXECUTION_FEEDBACK, BrainDescriptor.FEEDBACK_ANALYZER_ID,
                BrainDescriptor.smeBrainId(consultation.domain()), content, SME_CONFIDENCE));
        }
        return updates;
    }

    // ── improvement suggestions ──────────────────────────────────────────────

    Optional<LearningUpdate> improvementUpdate(DecisionRecord record, ExecutionFeedback feedback) {
        if (feedback.isSuccessful()) {
            return Optional.empty();
        }
        String errorText = feedback.errorDetails() == null || feedback.errorDetails().isBlank()
            ? "Unknown error" : feedback.errorDetails();
        String suggestion = suggestionFor(errorText);
        if (suggestion == null) {
            return Optional.empty();
        }
        Map<String, Object> failureContext = new LinkedHashMap<>();
        failureContext.put("intent", record.intent() != null ? record.intent().intentType() : "unknown");
        failureContext.put(KEY_COMPLEXITY, record.technical() != null ? record.technical().complexity() : "unknown");

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("error_type", errorText);
        content.put(KEY_IMPROVEMENT_SUGGESTIONS, List.of(suggestion));
        content.put("failure_context", failureContext);
        return Optional.of(LearningUpdate.of(LearningType.ERROR_CORRECTION,
            BrainDescriptor.FEEDBACK_ANALYZER_ID, BrainDescriptor.TECHNICAL_BRAIN_ID, content, SUGGESTION_CONFIDENCE));
    }

    static String suggestionFor(String errorText) {
        String lower = errorText.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : IMPROVEMENTS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Map<String, String> orderedImprovements() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("timeout",    "Increase timeout values for similar operations");
        map.put("permission", "Add permission validation to pre-execution checks");
        map.put("resource",   "Implement resource availability checks");
        map.put("network",    "Add network connectivity validation");
        return Collections.unmodifiableMap(map);
    }

    /** Immutable success/failure tally for one pattern key. */
    public record PatternCounts(int successes, int failures) {
        static final PatternCounts EMPTY = new PatternCounts(0, 0);

        PatternCounts record(boolean success) {
            return success ? new PatternCounts(successes + 1, failures)
                           : new PatternCounts(successes, failures + 1);
        }

        public int total() {
            return successes + failures;
        }
    }
}
