package com.brainfusion.common.exception;

import com.brainfusion.common.model.ValidationResult;

/**
 * Raised when a learning update is pushed towards application without a passing verdict.
 * Never fatal to the caller that produced the update.
 */
public class ValidationRejectedException extends BrainFusionException {
    private final String updateId;
    private final transient ValidationResult result;

    public ValidationRejectedException(String updateId, ValidationResult result) {
        super("Learning update " + updateId + " rejected: quality=" + result.qualityLevel()
              + " failed=" + result.criteriaFailed());
        this.updateId = updateId;
        this.result   = result;
    }

    public String getUpdateId() {
        return updateId;
    }

    public ValidationResult getResult() {
        return result;
    }
}
