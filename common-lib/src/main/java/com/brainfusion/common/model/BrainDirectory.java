package com.brainfusion.common.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of registered brains, used wherever behaviour depends on a brain's role.
 */
public interface BrainDirectory {

    Optional<BrainDescriptor> find(String brainId);

    List<BrainDescriptor> all();

    /** Role of {@code brainId}; {@link BrainKind#UNKNOWN} when it is not registered. */
    default BrainKind kindOf(String brainId) {
        return brainId == null ? BrainKind.UNKNOWN
            : find(brainId).map(BrainDescriptor::kind).orElse(BrainKind.UNKNOWN);
    }

    /** Fixed directory over {@code descriptors}; later duplicates replace earlier ones. */
    static BrainDirectory of(Collection<BrainDescriptor> descriptors) {
        Map<String, BrainDescriptor> byId = new LinkedHashMap<>();
        descriptors.forEach(d -> byId.put(d.brainId(), d));
        List<BrainDescriptor> snapshot = List.copyOf(byId.values());
        return new BrainDirectory() {
            @Override
            public Optional<BrainDescriptor> find(String brainId) {
                return Optional.ofNullable(byId.get(brainId));
            }

            @Override
            public List<BrainDescriptor> all() {
                return snapshot;
            }
        };
    }

    /** The learning-loop brains that exist regardless of configuration. */
    static List<BrainDescriptor> learningBrains() {
        return List.of(
            BrainDescriptor.of(BrainDescriptor.FEEDBACK_ANALYZER_ID, BrainKind.EXECUTION_FEEDBACK_ANALYZER),
            BrainDescriptor.of(BrainDescriptor.CROSS_BRAIN_LEARNER_ID, BrainKind.CROSS_BRAIN_LEARNER),
            BrainDescriptor.of(BrainDescriptor.EXTERNAL_INTEGRATOR_ID, BrainKind.EXTERNAL_KNOWLEDGE_INTEGRATOR));
    }
}
