package com.brainfusion.common.exception;

public class RequestNotFoundException extends BrainFusionException {
    private final String requestId;

    public RequestNotFoundException(String requestId) {
        super("No decision recorded for requestId=" + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
