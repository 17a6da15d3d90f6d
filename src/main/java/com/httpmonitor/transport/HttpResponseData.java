package com.httpmonitor.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class HttpResponseData implements Closeable {
    private static final ExecutorService BODY_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "body-reader");
        thread.setDaemon(true);
        return thread;
    });

    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final Duration duration;
    private final InputStream body;
    private volatile boolean bodyRead;

    public HttpResponseData(int statusCode, Map<String, List<String>> headers, Duration duration, InputStream body) {
        this.statusCode = statusCode;
        this.headers = headers;
        this.duration = duration;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Reads the whole body as UTF-8, giving up with {@link HttpTimeoutException} once {@code limit}
     * has passed. The stream is closed on timeout.
     */
    public String readBody(Duration limit) throws IOException {
        bodyRead = true;
        if (body == null) {
            return "";
        }
        if (limit.isNegative() || limit.isZero()) {
            close();
            throw new HttpTimeoutException("No time left to read response body");
        }

        CompletableFuture<byte[]> read = CompletableFuture.supplyAsync(() -> {
            try {
                return body.readAllBytes();
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        }, BODY_READERS);

        try {
            return new String(read.get(limit.toMillis(), TimeUnit.MILLISECONDS), StandardCharsets.UTF_8);
        } catch (TimeoutException ex) {
            read.cancel(true);
            close();
            throw new HttpTimeoutException("Response body not received within " + limit.toMillis() + "ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            throw new IOException("Failed to read response body", cause);
        } catch (InterruptedException ex) {
            read.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading response body");
        }
    }

    public boolean isBodyRead() {
        return bodyRead;
    }

    @Override
    public void close() throws IOException {
        if (body != null) {
            body.close();
        }
    }
}
