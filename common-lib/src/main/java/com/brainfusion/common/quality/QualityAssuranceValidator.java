package com.brainfusion.common.quality;

import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.BrainDirectory;
import com.brainfusion.common.model.BrainKind;
import com.brainfusion.common.model.LearningType;
import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.QualityLevel;
import com.brainfusion.common.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Multi-criteria gate deciding whether a {@link LearningUpdate} may change brain state.
 *
 * <h3>Scoring</h3>
 * <pre>
 *   overall = clamp( Σ (passed_i ? score_i : 0) × weight_i )
 *   level   = overall ≥ 0.8 HIGH | ≥ 0.6 MEDIUM | ≥ 0.4 LOW | REJECTED
 *   valid   = level ≠ REJECTED  and  |failed| &lt; |met|  and  source not blacklisted
 * </pre>
 * A failed criterion contributes nothing to {@code overall}; its raw score is kept in
 * {@link ValidationResult#rawScores()}.
 *
 * <h3>Criteria</h3>
 * <ul>
 *   <li>confidence threshold: pass at confidence ≥ minimum, score min(1, confidence / 0.8)</li>
 *   <li>source reliability: blacklisted fails at 0; base 0.7, trusted +0.2, SME +0.1,
 *       feedback analyzer +0.15, external integrator −0.1</li>
 *   <li>content completeness: required fields, serialized size ≥ 10, non-empty map</li>
 *   <li>consistency: contradiction rate against the target's last valid same-type updates</li>
 *   <li>impact: base 0.5 plus type, target and keyword bumps; above 0.8 fails for manual review</li>
 *   <li>safety: dangerous keywords soft-fail at 0.5; error corrections that switch off checks fail</li>
 * </ul>
 *
 * <p>The validator keeps a bounded per-target history for consistency checks and running
 * metrics. All mutable state is guarded by {@code this}; trusted and blacklisted sources are
 * concurrent sets that may change at runtime.
 */
public class QualityAssuranceValidator {

    private static final Logger log = LoggerFactory.getLogger(QualityAssuranceValidator.class);

    static final double PERFECT_CONFIDENCE   = 0.8;
    static final double BASE_SOURCE_SCORE    = 0.7;
    static final double TRUSTED_BONUS        = 0.2;
    static final double SME_BONUS            = 0.1;
    static final double FEEDBACK_BONUS       = 0.15;
    static final double EXTERNAL_PENALTY     = 0.1;
    static final int    MIN_CONTENT_SIZE     = 10;
    static final double MALFORMED_CONTENT    = 0.3;
    static final double NO_HISTORY_SCORE     = 0.8;
    static final double BASE_IMPACT          = 0.5;
    static final double HIGH_IMPACT_TYPE     = 0.2;
    static final double ALL_BRAINS_IMPACT    = 0.3;
    static final double SME_TARGET_IMPACT    = 0.1;
    static final double KEYWORD_IMPACT       = 0.1;
    static final double HIGH_IMPACT_SCORE    = 0.7;
    static final double SAFETY_KEYWORD_SCORE = 0.5;
    static final double SAFETY_BYPASS_SCORE  = 0.3;
    static final int    SUMMARY_CAPACITY     = 500;
    static final int    TREND_WINDOW         = 10;

    static final List<String> IMPACT_KEYWORDS = List.of("critical", "security", "safety", "error", "failure", "risk");
    static final List<String> SAFETY_KEYWORDS = List.of("delete", "remove", "destroy", "disable", "bypass");
    static final List<String> BYPASS_TERMS    = List.of("disable", "bypass", "skip", "ignore");

    private final QualityGateSettings settings;
    private final BrainDirectory directory;
    private final Set<String> trustedSources     = ConcurrentHashMap.newKeySet();
    private final Set<String> blacklistedSources = ConcurrentHashMap.newKeySet();

    // guarded by this
    private final Map<String, Deque<HistoryEntry>> historyByTarget = new HashMap<>();
    private final Deque<ValidationSummary> recent = new ArrayDeque<>();
    private final Map<QualityLevel, Long> distribution = new EnumMap<>(QualityLevel.class);
    private long totalValidations;
    private long successfulValidations;
    private double averageScore;
    private double averageTimeMs;
    private String trend = "stable";

    public QualityAssuranceValidator(QualityGateSettings settings, BrainDirectory directory) {
        this.settings  = settings;
        this.directory = directory;
        trustedSources.addAll(settings.trustedSources());
        blacklistedSources.addAll(settings.blacklistedSources());
    }

    /**
     * Scores {@code update} against every criterion, records the outcome and returns the verdict.
     * Never throws; an unexpected failure produces a rejected result.
     */
    public ValidationResult validate(LearningUpdate update) {
        long start = System.nanoTime();
        try {
            ValidationResult result = evaluate(update, start);
            record(update, result);
            log.info("[QA] updateId={} type={} target={} quality={} valid={} score={} manualReview={}",
                     update.id(), update.learningType(), update.targetBrain(), result.qualityLevel(),
                     result.valid(), String.format("%.3f", result.confidenceScore()),
                     result.requiresManualReview());
            return result;
        } catch (RuntimeException e) {
            log.error("[QA] Validation error updateId={} reason={}", update.id(), e.getMessage(), e);
            ValidationResult failed = ValidationResult.failed(update.id(), e.getMessage());
            record(update, failed);
            return failed;
        }
    }

    private ValidationResult evaluate(LearningUpdate update, long startNanos) {
        List<String> met             = new ArrayList<>();
        List<String> failed          = new ArrayList<>();
        List<String> notes           = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        Map<String, Double> raw      = new LinkedHashMap<>();
        Map<String, Double> weighted = new LinkedHashMap<>();
        double overall = 0.0;

        for (ValidationCriterion criterion : ValidationCriterion.values()) {
            CriterionOutcome outcome = check(criterion, update);
            double contribution = outcome.passed() ? outcome.score() * settings.weight(criterion) : 0.0;
            (outcome.passed() ? met : failed).add(criterion.key());
            raw.put(criterion.key(), outcome.score());
            weighted.put(criterion.key(), contribution);
            notes.add(outcome.note());
            if (outcome.recommendation() != null) {
                recommendations.add(outcome.recommendation());
            }
            overall += contribution;
        }

        overall = Math.max(0.0, Math.min(1.0, overall));
        QualityLevel level = QualityLevel.fromScore(overall);
        boolean blacklisted = update.sourceBrain() != null && blacklistedSources.contains(update.sourceBrain());
        boolean valid = level != QualityLevel.REJECTED && failed.size() < met.size() && !blacklisted;
        boolean manualReview = failed.contains(ValidationCriterion.IMPACT_ASSESSMENT.key())
                            || failed.contains(ValidationCriterion.SAFETY_VALIDATION.key());
        double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;

        return new ValidationResult(update.id(), valid, level, overall, met, failed, notes,
                                    recommendations, raw, weighted, elapsedMs, manualReview);
    }

    CriterionOutcome check(ValidationCriterion criterion, LearningUpdate update) {
        return switch (criterion) {
            case CONFIDENCE_THRESHOLD -> checkConfidence(update);
            case SOURCE_RELIABILITY   -> checkSource(update);
            case CONTENT_COMPLETENESS -> checkCompleteness(update);
            case CONSISTENCY_CHECK    -> checkConsistency(update);
            case IMPACT_ASSESSMENT    -> checkImpact(update);
            case SAFETY_VALIDATION    -> checkSafety(update);
        };
    }

    // ── criteria ─────────────────────────────────────────────────────────────

    private CriterionOutcome checkConfidence(LearningUpdate update) {
        double minimum = settings.minimumConfidence();
        double confidence = update.confidence();
        if (confidence >= minimum) {
            return CriterionOutcome.pass(Math.min(1.0, confidence / PERFECT_CONFIDENCE),
                String.format("Confidence %.2f meets threshold %.2f", confidence, minimum));
        }
        return CriterionOutcome.fail(Math.max(0.0, confidence / minimum),
            String.format("Confidence %.2f below threshold %.2f", confidence, minimum),
            "Increase confidence through additional validation");
    }

    private CriterionOutcome checkSource(LearningUpdate update) {
        String source = update.sourceBrain();
        if (source != null && blacklistedSources.contains(source)) {
            return CriterionOutcome.fail(0.0, "Source " + source + " is blacklisted",
                "Use trusted source for learning updates");
        }
        double score = BASE_SOURCE_SCORE;
        String note = "Source " + source + " reliability: standard";
        if (source != null && trustedSources.contains(source)) {
            score += TRUSTED_BONUS;
            note = "Source " + source + " is trusted";
        }
        BrainKind kind = directory.kindOf(source);
        if (kind == BrainKind.SME) {
            score += SME_BONUS;
        } else if (kind == BrainKind.EXECUTION_FEEDBACK_ANALYZER) {
            score += FEEDBACK_BONUS;
        } else if (kind == BrainKind.EXTERNAL_KNOWLEDGE_INTEGRATOR) {
            score -= EXTERNAL_PENALTY;
        }
        return CriterionOutcome.pass(Math.min(1.0, score), note);
    }

    private CriterionOutcome checkCompleteness(LearningUpdate update) {
        List<String> missing = new ArrayList<>();
        if (update.learningType() == null) missing.add("learningType");
        if (isBlank(update.sourceBrain())) missing.add("sourceBrain");
        if (isBlank(update.targetBrain())) missing.add("targetBrain");
        if (update.content() == null)      missing.add("content");
        if (!missing.isEmpty()) {
            return CriterionOutcome.fail(Math.max(0.0, 1.0 - missing.size() / 4.0),
                "Missing required fields: " + missing, "Ensure all required fields are provided");
        }
        int size = ContentText.serialize(update.content()).length();
        if (size < MIN_CONTENT_SIZE) {
            return CriterionOutcome.fail((double) size / MIN_CONTENT_SIZE,
                "Content too small: " + size + " < " + MIN_CONTENT_SIZE, "Provide more detailed content");
        }
        if (update.content().isEmpty()) {
            return CriterionOutcome.fail(MALFORMED_CONTENT, "Content is empty",
                "Provide structured content");
        }
        return CriterionOutcome.pass(1.0, "Content completeness validation passed");
    }

    private CriterionOutcome checkConsistency(LearningUpdate update) {
        List<Map<String, Object>> window = consistencyWindow(update.targetBrain(), update.learningType());
        if (window.isEmpty()) {
            return CriterionOutcome.pass(NO_HISTORY_SCORE, "No historical data for consistency check");
        }
        int checks = 0;
        int contradictions = 0;
        for (Map<String, Object> historical : window) {
            for (Map.Entry<String, Object> entry : update.content().entrySet()) {
                if (!historical.containsKey(entry.getKey())) {
                    continue;
                }
                checks++;
                if (isScalar(entry.getValue()) && !sameScalar(historical.get(entry.getKey()), entry.getValue())) {
                    contradictions++;
                }
            }
        }
        if (checks > 0) {
            double rate = (double) contradictions / checks;
            if (rate > settings.contradictionTolerance()) {
                return CriterionOutcome.fail(Math.max(0.0, 1.0 - rate),
                    String.format("High contradiction rate: %.2f > %.2f", rate, settings.contradictionTolerance()),
                    "Review for consistency with existing knowledge");
            }
        }
        return CriterionOutcome.pass(1.0, "Consistency validation passed");
    }

    private CriterionOutcome checkImpact(LearningUpdate update) {
        double impact = impactScore(update);
        if (impact > settings.highImpactThreshold()) {
            return CriterionOutcome.fail(HIGH_IMPACT_SCORE,
                String.format("High impact score: %.2f", impact),
                "High impact update requires additional review");
        }
        return CriterionOutcome.pass(1.0, String.format("Impact score: %.2f", impact));
    }

    /** Impact estimate in [0,1] from type, target and high-impact keywords. */
    double impactScore(LearningUpdate update) {
        double impact = BASE_IMPACT;
        if (update.learningType() != null && update.learningType().isHighImpact()) {
            impact += HIGH_IMPACT_TYPE;
        }
        if (BrainDescriptor.ALL_BRAINS.equals(update.targetBrain())) {
            impact += ALL_BRAINS_IMPACT;
        } else if (directory.kindOf(update.targetBrain()) == BrainKind.SME) {
            impact += SME_TARGET_IMPACT;
        }
        String text = ContentText.lowercase(update.content());
        for (String keyword : IMPACT_KEYWORDS) {
            if (text.contains(keyword)) {
                impact += KEYWORD_IMPACT;
            }
        }
        return Math.min(1.0, impact);
    }

    private CriterionOutcome checkSafety(LearningUpdate update) {
        String text = ContentText.lowercase(update.content());
        List<String> found = SAFETY_KEYWORDS.stream().filter(text::contains).toList();
        if (!found.isEmpty()) {
            return CriterionOutcome.fail(SAFETY_KEYWORD_SCORE, "Safety keywords found: " + found,
                "Manual safety review required");
        }
        if (update.learningType() == LearningType.ERROR_CORRECTION
                && BYPASS_TERMS.stream().anyMatch(text::contains)) {
            return CriterionOutcome.fail(SAFETY_BYPASS_SCORE, "Error correction might disable safety features",
                "Ensure safety features remain active");
        }
        return CriterionOutcome.pass(1.0, "Safety validation passed");
    }

    // ── history & metrics ────────────────────────────────────────────────────

    /** Contents of the newest valid {@code type} updates for {@code target}, newest first. */
    synchronized List<Map<String, Object>> consistencyWindow(String target, LearningType type) {
        Deque<HistoryEntry> history = historyByTarget.get(target);
        if (history == null) {
            return List.of();
        }
        List<Map<String, Object>> window = new ArrayList<>();
        Iterator<HistoryEntry> newestFirst = history.descendingIterator();
        while (newestFirst.hasNext() && window.size() < settings.consistencyWindow()) {
            HistoryEntry entry = newestFirst.next();
            if (entry.valid() && entry.type() == type) {
                window.add(entry.content());
            }
        }
        return window;
    }

    synchronized int historySize(String target) {
        Deque<HistoryEntry> history = historyByTarget.get(target);
        return history == null ? 0 : history.size();
    }

    private synchronized void record(LearningUpdate update, ValidationResult result) {
        if (update.targetBrain() != null) {
            Deque<HistoryEntry> history = historyByTarget.computeIfAbsent(update.targetBrain(), k -> new ArrayDeque<>());
            history.addLast(new HistoryEntry(update.learningType(), update.content(), result.valid()));
            while (history.size() > settings.historyPerTarget()) {
                history.removeFirst();
            }
        }

        recent.addLast(new ValidationSummary(update.id(), update.targetBrain(), update.learningType(),
            result.valid(), result.qualityLevel(), result.confidenceScore(),
            result.criteriaMet().size(), result.criteriaFailed().size(), Instant.now()));
        while (recent.size() > SUMMARY_CAPACITY) {
            recent.removeFirst();
        }

        totalValidations++;
        if (result.valid()) {
            successfulValidations++;
        }
        averageScore  += (result.confidenceScore() - averageScore) / totalValidations;
        averageTimeMs += (result.validationTimeMs() - averageTimeMs) / totalValidations;
        distribution.merge(result.qualityLevel(), 1L, Long::sum);

        if (recent.size() >= TREND_WINDOW) {
            long recentValid = 0;
            Iterator<ValidationSummary> it = recent.descendingIterator();
            for (int i = 0; i < TREND_WINDOW && it.hasNext(); i++) {
                if (it.next().valid()) recentValid++;
            }
            double rate = (double) recentValid / TREND_WINDOW;
            trend = rate > 0.8 ? "improving" : rate < 0.5 ? "declining" : "stable";
        }
    }

    public synchronized QualityMetrics metrics() {
        return new QualityMetrics(totalValidations, successfulValidations,
            totalValidations - successfulValidations,
            (double) successfulValidations / Math.max(1, totalValidations),
            averageScore, Map.copyOf(distribution), averageTimeMs, trend,
            trustedSources.size(), blacklistedSources.size());
    }

    /** Most recent validations, newest last. */
    public synchronized List<ValidationSummary> recentValidations(int limit) {
        List<ValidationSummary> all = new ArrayList<>(recent);
        return List.copyOf(all.subList(Math.max(0, all.size() - Math.max(0, limit)), all.size()));
    }

    // ── source management ────────────────────────────────────────────────────

    public void addTrustedSource(String source) {
        if (blacklistedSources.contains(source)) {
            throw new IllegalArgumentException("Source " + source + " is blacklisted");
        }
        if (trustedSources.add(source)) {
            log.info("[QA] Trusted source added. source={}", source);
        }
    }

    /** Blacklists {@code source}, dropping it from the trusted set. */
    public void addBlacklistedSource(String source) {
        blacklistedSources.add(source);
        trustedSources.remove(source);
        log.warn("[QA] Source blacklisted. source={}", source);
    }

    public void removeBlacklistedSource(String source) {
        if (blacklistedSources.remove(source)) {
            log.info("[QA] Source removed from blacklist. source={}", source);
        }
    }

    public Set<String> trustedSources() {
        return Set.copyOf(trustedSources);
    }

    public Set<String> blacklistedSources() {
        return Set.copyOf(blacklistedSources);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static boolean sameScalar(Object historical, Object current) {
        if (historical instanceof Number h && current instanceof Number c) {
            return Double.compare(h.doubleValue(), c.doubleValue()) == 0;
        }
        return current.equals(historical);
    }

    private record HistoryEntry(LearningType type, Map<String, Object> content, boolean valid) {}

    record CriterionOutcome(boolean passed, double score, String note, String recommendation) {
        static CriterionOutcome pass(double score, String note) {
            return new CriterionOutcome(true, score, note, null);
        }

        static CriterionOutcome fail(double score, String note, String recommendation) {
            return new CriterionOutcome(false, score, note, recommendation);
        }
    }
}
