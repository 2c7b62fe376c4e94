package com.brainfusion.common.learning;

import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.LearningType;
import com.brainfusion.common.model.LearningUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Looks across a batch of learning updates for patterns that concern more than one brain.
 *
 * <h3>Insights</h3>
 * <ul>
 *   <li><b>Shared pattern</b>: two targets received same-type updates whose contents are similar
 *       (similarity &gt; {@value #SIMILARITY_THRESHOLD}); confidence = similarity × 0.8.</li>
 *   <li><b>Collaboration</b>: more than one target received more than
 *       {@value #ACTIVE_BRAIN_UPDATES} updates; confidence 0.8.</li>
 *   <li><b>Coordination</b>: some target's share of error corrections exceeds
 *       {@value #ERROR_SHARE_THRESHOLD}; confidence 0.7.</li>
 * </ul>
 *
 * <pre>
 *   similarity = ( |keys₁ ∩ keys₂| / |keys₁ ∪ keys₂|  +  equalValues / |keys₁ ∩ keys₂| ) / 2
 * </pre>
 *
 * <p>All insights come from {@link BrainDescriptor#CROSS_BRAIN_LEARNER_ID} and address
 * {@link BrainDescriptor#ALL_BRAINS}. This class is stateless and thread-safe.
 */
public class CrossBrainInsightGenerator {

    private static final Logger log = LoggerFactory.getLogger(CrossBrainInsightGenerator.class);

    public static final String KEY_PATTERN_TYPE        = "pattern_type";
    public static final String KEY_INVOLVED_BRAINS     = "involved_brains";
    public static final String KEY_SIMILARITY_SCORE    = "similarity_score";
    public static final String KEY_COLLABORATION       = "collaboration_opportunities";
    public static final String KEY_HIGH_ERROR_BRAINS   = "high_error_brains";

    static final double SIMILARITY_THRESHOLD        = 0.7;
    static final double SIMILARITY_CONFIDENCE_SCALE = 0.8;
    static final int    ACTIVE_BRAIN_UPDATES        = 3;
    static final double COLLABORATION_CONFIDENCE    = 0.8;
    static final double ERROR_SHARE_THRESHOLD       = 0.3;
    static final double COORDINATION_CONFIDENCE     = 0.7;

    public List<LearningUpdate> generate(List<LearningUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            return List.of();
        }
        Map<String, List<LearningUpdate>> byTarget = new LinkedHashMap<>();
        for (LearningUpdate update : updates) {
            byTarget.computeIfAbsent(update.targetBrain(), k -> new ArrayList<>()).add(update);
        }

        List<LearningUpdate> insights = new ArrayList<>(sharedPatterns(byTarget));
        collaboration(byTarget).ifPresent(insights::add);
        coordination(byTarget).ifPresent(insights::add);
        if (!insights.isEmpty()) {
            log.info("[CrossBrain] Insights generated. input={} targets={} insights={}",
                     updates.size(), byTarget.size(), insights.size());
        }
        return insights;
    }

    // ── shared patterns ──────────────────────────────────────────────────────

    private List<LearningUpdate> sharedPatterns(Map<String, List<LearningUpdate>> byTarget) {
        List<String> targets = new ArrayList<>(byTarget.keySet());
        List<LearningUpdate> insights = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            for (int j = i + 1; j < targets.size(); j++) {
                for (LearningUpdate first : byTarget.get(targets.get(i))) {
                    for (LearningUpdate second : byTarget.get(targets.get(j))) {
                        if (first.learningType() != second.learningType()) {
                            continue;
                        }
                        double similarity = similarity(first.content(), second.content());
                        if (similarity > SIMILARITY_THRESHOLD) {
                            insights.add(sharedPattern(first.learningType(),
                                List.of(targets.get(i), targets.get(j)), similarity));
                        }
                    }
                }
            }
        }
        return insights;
    }

    private static LearningUpdate sharedPattern(LearningType type, List<String> brains, double similarity) {
        String typeName = type.name().toLowerCase(Locale.ROOT);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(KEY_PATTERN_TYPE, typeName);
        content.put(KEY_INVOLVED_BRAINS, brains);
        content.put(KEY_SIMILARITY_SCORE, similarity);
        content.put("coordination_suggestion", "Coordinate " + typeName + " learning between brains");
        return insight(content, similarity * SIMILARITY_CONFIDENCE_SCALE);
    }

    /** Content similarity in [0,1]; two empty contents are not similar. */
    static double similarity(Map<String, Object> first, Map<String, Object> second) {
        Set<String> union = new HashSet<>(first.keySet());
        union.addAll(second.keySet());
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> common = new HashSet<>(first.keySet());
        common.retainAll(second.keySet());
        double keySimilarity = (double) common.size() / union.size();
        if (common.isEmpty()) {
            return keySimilarity / 2.0;
        }
        long equalValues = common.stream()
            .filter(key -> Objects.equals(first.get(key), second.get(key)))
            .count();
        return (keySimilarity + (double) equalValues / common.size()) / 2.0;
    }

    // ── collaboration ────────────────────────────────────────────────────────

    private Optional<LearningUpdate> collaboration(Map<String, List<LearningUpdate>> byTarget) {
        List<String> active = byTarget.entrySet().stream()
            .filter(e -> e.getValue().size() > ACTIVE_BRAIN_UPDATES)
            .map(Map.Entry::getKey)
            .toList();
        if (active.size() <= 1) {
            return Optional.empty();
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(KEY_COLLABORATION, active);
        content.put("suggestion", "Increase communication frequency between active learning brains");
        content.put("coordination_strategy", "shared_learning_sessions");
        return Optional.of(insight(content, COLLABORATION_CONFIDENCE));
    }

    // ── coordination ─────────────────────────────────────────────────────────

    private Optional<LearningUpdate> coordination(Map<String, List<LearningUpdate>> byTarget) {
        Map<String, Double> highError = new LinkedHashMap<>();
        byTarget.forEach((target, list) -> {
            long corrections = list.stream()
                .filter(u -> u.learningType() == LearningType.ERROR_CORRECTION)
                .count();
            double share = (double) corrections / list.size();
            if (share > ERROR_SHARE_THRESHOLD) {
                highError.put(target, share);
            }
        });
        if (highError.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(KEY_HIGH_ERROR_BRAINS, highError);
        content.put("optimization_suggestion", "Increase validation and cross-checking for high-error brains");
        return Optional.of(insight(content, COORDINATION_CONFIDENCE));
    }

    private static LearningUpdate insight(Map<String, Object> content, double confidence) {
        return LearningUpdate.of(LearningType.CROSS_BRAIN_INSIGHT, BrainDescriptor.CROSS_BRAIN_LEARNER_ID,
            BrainDescriptor.ALL_BRAINS, content, confidence);
    }
}
