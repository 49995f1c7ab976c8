package com.shlokmestry.bandwidth.web;

import java.io.IOException;
import java.util.Objects;

import com.shlokmestry.bandwidth.ratelimit.CancellationSignal;
import com.shlokmestry.bandwidth.ratelimit.PacedWriter;
import com.shlokmestry.bandwidth.ratelimit.PartialWriteException;
import com.shlokmestry.bandwidth.ratelimit.TokenBucket;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;

/**
 * Response body stream that hands every write to a {@link PacedWriter}.
 * A sink failure (usually the client going away) cancels the request's signal.
 */
class ThrottledServletOutputStream extends ServletOutputStream {

    private final ServletOutputStream delegate;
    private final PacedWriter writer;

    ThrottledServletOutputStream(ServletOutputStream delegate, TokenBucket bucket, CancellationSignal signal) {
        this.delegate = delegate;
        this.writer = new PacedWriter(delegate, bucket, signal);
    }

    @Override
    public void write(int b) throws IOException {
        write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        try {
            writer.write(b, off, len);
        } catch (PartialWriteException e) {
            writer.signal().cancel("sink error: " + e.getCause().getMessage());
            throw e;
        }
    }

    @Override
    public void flush() throws IOException {
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }

    @Override
    public boolean isReady() {
        return delegate.isReady();
    }

    @Override
    public void setWriteListener(WriteListener writeListener) {
        delegate.setWriteListener(writeListener);
    }

    PacedWriter writer() {
        return writer;
    }
}
