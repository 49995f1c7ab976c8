package com.shlokmestry.bandwidth.web;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;

import com.shlokmestry.bandwidth.ratelimit.CancellationSignal;
import com.shlokmestry.bandwidth.ratelimit.TokenBucket;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

/**
 * Response whose body, written through either {@link #getOutputStream()} or
 * {@link #getWriter()}, is paced by a token bucket. Status and headers pass straight through.
 */
public class ThrottledResponseWrapper extends HttpServletResponseWrapper {

    private final TokenBucket bucket;
    private final CancellationSignal signal;

    private ThrottledServletOutputStream body;
    private boolean streamUsed;
    private PrintWriter writer;

    public ThrottledResponseWrapper(HttpServletResponse response, TokenBucket bucket, CancellationSignal signal) {
        super(response);
        this.bucket = bucket;
        this.signal = signal;
    }

    @Override
    public ServletOutputStream getOutputStream() throws IOException {
        if (writer != null) {
            throw new IllegalStateException("getWriter() has already been called on this response");
        }
        streamUsed = true;
        return body();
    }

    @Override
    public PrintWriter getWriter() throws IOException {
        if (writer == null) {
            if (streamUsed) {
                throw new IllegalStateException("getOutputStream() has already been called on this response");
            }
            writer = new PrintWriter(new OutputStreamWriter(body(), getCharacterEncoding()));
        }
        return writer;
    }

    @Override
    public void flushBuffer() throws IOException {
        if (writer != null) {
            writer.flush();
        } else if (body != null) {
            body.flush();
        }
        super.flushBuffer();
    }

    /** Pushes anything still buffered in the writer through the paced stream. */
    void finish() {
        if (writer != null) {
            writer.flush();
        }
    }

    public TokenBucket bucket() {
        return bucket;
    }

    public long bytesWritten() {
        return body == null ? 0L : body.writer().bytesWritten();
    }

    public long waitedNanos() {
        return body == null ? 0L : body.writer().waitedNanos();
    }

    private ThrottledServletOutputStream body() throws IOException {
        if (body == null) {
            body = new ThrottledServletOutputStream(super.getOutputStream(), bucket, signal);
        }
        return body;
    }
}
