package com.brainfusion.common.reliability;

import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Storage for per-brain reliability multipliers.
 *
 * <p>Implementations must apply {@link #update} as a single atomic read-modify-write per brain id.
 */
public interface BrainReliabilityRepository {

    Optional<Double> find(String brainId);

    /**
     * Atomically replaces the stored value for {@code brainId} with {@code fn(current)},
     * where {@code current} is {@code initial} if nothing is stored yet.
     *
     * @return the stored value after the update
     */
    double update(String brainId, double initial, DoubleUnaryOperator fn);

    Map<String, Double> findAll();
}
