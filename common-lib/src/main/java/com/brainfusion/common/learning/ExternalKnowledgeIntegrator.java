package com.brainfusion.common.learning;

import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.LearningType;
import com.brainfusion.common.model.LearningUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts an {@link ExternalKnowledgeSubmission} into one {@code EXTERNAL_KNOWLEDGE} update
 * per item, with the submission's reliability as the update confidence.
 *
 * <p>Best practices go to the practice's {@code target_domain} SME when given, otherwise to
 * all brains; documentation goes to all brains; standards and advisories go to the
 * security-and-compliance SME.
 */
public class ExternalKnowledgeIntegrator {

    private static final Logger log = LoggerFactory.getLogger(ExternalKnowledgeIntegrator.class);

    public static final String KEY_SOURCE_TYPE   = "source_type";
    public static final String KEY_SOURCE        = "source";
    public static final String KEY_KNOWLEDGE     = "knowledge";
    public static final String KEY_TARGET_DOMAIN = "target_domain";

    public static final double MIN_RELIABILITY = 0.5;

    /**
     * @throws IllegalArgumentException if content, source or reliability is missing, or the
     *         reliability is below {@value #MIN_RELIABILITY}
     */
    public List<LearningUpdate> integrate(ExternalKnowledgeSubmission submission) {
        if (submission == null || submission.sourceType() == null) {
            throw new IllegalArgumentException("External knowledge source type is required");
        }
        if (submission.content() == null || submission.source() == null || submission.source().isBlank()
                || submission.reliability() == null) {
            throw new IllegalArgumentException("External knowledge requires content, source and reliability");
        }
        double reliability = submission.reliability();
        if (reliability < MIN_RELIABILITY || reliability > 1.0) {
            throw new IllegalArgumentException(
                String.format("External knowledge reliability %.2f outside [%.1f, 1.0]", reliability, MIN_RELIABILITY));
        }

        ExternalKnowledgeSource kind = submission.sourceType();
        List<LearningUpdate> updates = new ArrayList<>();
        for (Object item : items(submission.content().get(kind.itemsKey()))) {
            Map<String, Object> content = new LinkedHashMap<>();
            content.put(KEY_SOURCE_TYPE, kind.value());
            content.put(KEY_SOURCE, submission.source());
            content.put(KEY_KNOWLEDGE, item);
            updates.add(LearningUpdate.of(LearningType.EXTERNAL_KNOWLEDGE, BrainDescriptor.EXTERNAL_INTEGRATOR_ID,
                targetFor(kind, item), content, reliability));
        }
        log.info("[External] Integrated. type={} source={} reliability={} updates={}",
                 kind.value(), submission.source(), reliability, updates.size());
        return updates;
    }

    static String targetFor(ExternalKnowledgeSource kind, Object item) {
        if (kind.fixedTarget() != null) {
            return kind.fixedTarget();
        }
        if (kind == ExternalKnowledgeSource.BEST_PRACTICES && item instanceof Map<?, ?> practice
                && practice.get(KEY_TARGET_DOMAIN) instanceof String domain && !domain.isBlank()) {
            return BrainDescriptor.smeBrainId(domain);
        }
        return BrainDescriptor.ALL_BRAINS;
    }

    private static Collection<?> items(Object raw) {
        if (raw == null) {
            return List.of();
        }
        return raw instanceof Collection<?> list ? list : List.of(raw);
    }
}
