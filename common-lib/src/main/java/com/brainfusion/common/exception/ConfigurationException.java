package com.brainfusion.common.exception;

/**
 * Invalid platform configuration. Thrown while wiring components so that startup aborts.
 */
public class ConfigurationException extends BrainFusionException {

    public ConfigurationException(String message) {
        super(message);
    }
}
