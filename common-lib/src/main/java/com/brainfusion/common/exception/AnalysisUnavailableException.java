package com.brainfusion.common.exception;

public class AnalysisUnavailableException extends BrainFusionException {
    private final String brainId;

    public AnalysisUnavailableException(String brainId, String message) {
        super("[" + brainId + "] " + message);
        this.brainId = brainId;
    }

    public AnalysisUnavailableException(String brainId, String message, Throwable cause) {
        super("[" + brainId + "] " + message, cause);
        this.brainId = brainId;
    }

    public String getBrainId() {
        return brainId;
    }
}
