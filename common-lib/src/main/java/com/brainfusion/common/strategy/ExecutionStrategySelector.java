package com.brainfusion.common.strategy;

import com.brainfusion.common.model.ActionType;
import com.brainfusion.common.model.ExecutionStrategy;
import com.brainfusion.common.model.RiskLevel;

/**
 * Decision table mapping (confidence, merged risk, intent action type) to an execution strategy.
 *
 * <p>Rules are evaluated top to bottom; the first match wins:
 * <pre>
 *   1. action type INFORMATION                 → INFORMATIONAL_RESPONSE
 *   2. confidence ≥ 0.8 and risk LOW           → AUTOMATED_EXECUTION
 *   3. confidence ≥ 0.6                        → GUIDED_EXECUTION
 *   4. confidence &lt; 0.4 or risk HIGH           → MANUAL_REVIEW
 *   5. otherwise                               → ASSISTED_EXECUTION
 * </pre>
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class ExecutionStrategySelector {

    static final double AUTOMATED_THRESHOLD = 0.8;
    static final double GUIDED_THRESHOLD    = 0.6;
    static final double MANUAL_THRESHOLD    = 0.4;

    private ExecutionStrategySelector() {}

    public static ExecutionStrategy select(double confidence, RiskLevel risk, ActionType actionType) {
        if (actionType == ActionType.INFORMATION) {
            return ExecutionStrategy.INFORMATIONAL_RESPONSE;
        }
        if (confidence >= AUTOMATED_THRESHOLD && risk == RiskLevel.LOW) {
            return ExecutionStrategy.AUTOMATED_EXECUTION;
        }
        if (confidence >= GUIDED_THRESHOLD) {
            return ExecutionStrategy.GUIDED_EXECUTION;
        }
        if (confidence < MANUAL_THRESHOLD || risk == RiskLevel.HIGH) {
            return ExecutionStrategy.MANUAL_REVIEW;
        }
        return ExecutionStrategy.ASSISTED_EXECUTION;
    }
}
