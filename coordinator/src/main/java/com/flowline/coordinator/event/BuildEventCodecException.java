package com.flowline.coordinator.event;

/**
 * Thrown when an event cannot be encoded for storage or a stored payload
 * cannot be decoded back into its record.
 */
public class BuildEventCodecException extends RuntimeException {

    public BuildEventCodecException(String message) {
        super(message);
    }

    public BuildEventCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
