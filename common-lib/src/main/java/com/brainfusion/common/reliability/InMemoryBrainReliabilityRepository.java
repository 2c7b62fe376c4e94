package com.brainfusion.common.reliability;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleUnaryOperator;

public class InMemoryBrainReliabilityRepository implements BrainReliabilityRepository {

    private final ConcurrentHashMap<String, Double> scores = new ConcurrentHashMap<>();

    @Override
    public Optional<Double> find(String brainId) {
        return Optional.ofNullable(scores.get(brainId));
    }

    @Override
    public double update(String brainId, double initial, DoubleUnaryOperator fn) {
        return scores.compute(brainId, (id, current) ->
            fn.applyAsDouble(current == null ? initial : current));
    }

    @Override
    public Map<String, Double> findAll() {
        return Map.copyOf(scores);
    }
}
