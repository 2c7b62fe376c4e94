package com.brainfusion.common.exception;

import java.time.Duration;

public class DecisionTimeoutException extends BrainFusionException {
    private final Duration budget;

    public DecisionTimeoutException(String scope, Duration budget) {
        super(scope + " exceeded budget of " + budget.toMillis() + "ms");
        this.budget = budget;
    }

    public Duration getBudget() {
        return budget;
    }
}
