package com.shlokmestry.bandwidth.ratelimit;

import java.io.InterruptedIOException;

/**
 * Thrown when a paced write is abandoned because its request was cancelled or its thread
 * interrupted. {@link #bytesTransferred} holds the bytes written before that happened.
 */
public class WriteCancelledException extends InterruptedIOException {

    public WriteCancelledException(String reason) {
        super("write cancelled: " + reason);
    }
}
