package com.brainfusion.common.reliability;

import com.brainfusion.common.model.BrainDirectory;
import com.brainfusion.common.model.BrainKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maintains the reliability multiplier each brain's confidence is scaled by during fusion.
 *
 * <h3>Update rule</h3>
 * <pre>
 *   target = 1.1 on a successful outcome, 0.9 otherwise
 *   next   = clamp(current + (target − current) × confidenceAccuracy, 0.5, 1.5)
 * </pre>
 * Brains start at 1.0, SME brains at 1.1.
 *
 * <p>Only validated execution-outcome updates should reach {@link #recordOutcome};
 * each call touches exactly one brain.
 */
public class BrainReliabilityTracker {

    private static final Logger log = LoggerFactory.getLogger(BrainReliabilityTracker.class);

    public static final double MIN_RELIABILITY     = 0.5;
    public static final double MAX_RELIABILITY     = 1.5;
    public static final double DEFAULT_RELIABILITY = 1.0;
    public static final double SME_RELIABILITY     = 1.1;

    static final double SUCCESS_TARGET = 1.1;
    static final double FAILURE_TARGET = 0.9;

    private final BrainReliabilityRepository repository;
    private final BrainDirectory directory;

    public BrainReliabilityTracker(BrainReliabilityRepository repository, BrainDirectory directory) {
        this.repository = repository;
        this.directory  = directory;
    }

    /** Current multiplier for {@code brainId}, or its kind's default when never updated. */
    public double reliabilityOf(String brainId) {
        return repository.find(brainId).orElseGet(() -> defaultFor(brainId));
    }

    /** Multipliers for the given brains, suitable for confidence fusion. */
    public Map<String, Double> reliabilityFor(Collection<String> brainIds) {
        Map<String, Double> out = new LinkedHashMap<>();
        for (String brainId : brainIds) {
            out.put(brainId, reliabilityOf(brainId));
        }
        return out;
    }

    /** Every brain with a stored multiplier plus the defaults of registered brains. */
    public Map<String, Double> all() {
        Map<String, Double> out = new LinkedHashMap<>();
        directory.all().forEach(d -> out.put(d.brainId(), defaultFor(d.brainId())));
        out.putAll(repository.findAll());
        return out;
    }

    /**
     * Nudges {@code brainId}'s multiplier toward the success or failure target.
     *
     * @param confidenceAccuracy weight of the nudge, clamped to [0,1]
     * @return the new multiplier
     */
    public double recordOutcome(String brainId, boolean successful, double confidenceAccuracy) {
        double weight = Math.max(0.0, Math.min(1.0, confidenceAccuracy));
        double target = successful ? SUCCESS_TARGET : FAILURE_TARGET;
        final double[] previous = {0.0};
        double next = repository.update(brainId, defaultFor(brainId), current -> {
            previous[0] = current;
            return clamp(current + (target - current) * weight);
        });
        log.info("[Reliability] brain={} successful={} accuracy={} previous={} next={}",
                 brainId, successful, weight,
                 String.format("%.4f", previous[0]), String.format("%.4f", next));
        return next;
    }

    double defaultFor(String brainId) {
        return directory.kindOf(brainId) == BrainKind.SME ? SME_RELIABILITY : DEFAULT_RELIABILITY;
    }

    static double clamp(double value) {
        return Math.max(MIN_RELIABILITY, Math.min(MAX_RELIABILITY, value));
    }
}
