package com.shlokmestry.bandwidth.ratelimit;

import java.io.IOException;

/**
 * The underlying sink failed part way through a paced write.
 */
public class PartialWriteException extends IOException {

    private final int bytesWritten;

    public PartialWriteException(int bytesWritten, IOException cause) {
        super("sink failed after " + bytesWritten + " bytes: " + cause.getMessage(), cause);
        this.bytesWritten = bytesWritten;
    }

    public int bytesWritten() {
        return bytesWritten;
    }
}
