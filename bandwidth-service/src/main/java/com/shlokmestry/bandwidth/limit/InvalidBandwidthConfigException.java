package com.shlokmestry.bandwidth.limit;

/**
 * Bandwidth configuration that must stop the service from starting.
 */
public class InvalidBandwidthConfigException extends RuntimeException {

    public InvalidBandwidthConfigException(String message) {
        super(message);
    }

    public InvalidBandwidthConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
