package com.brainfusion.common.exception;

/**
 * Root of the platform's unchecked exception hierarchy.
 */
public class BrainFusionException extends RuntimeException {

    public BrainFusionException(String message) {
        super(message);
    }

    public BrainFusionException(String message, Throwable cause) {
        super(message, cause);
    }
}
