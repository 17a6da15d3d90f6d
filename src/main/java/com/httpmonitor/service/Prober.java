package com.httpmonitor.service;

import com.httpmonitor.model.ErrorCategory;
import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.Target;
import com.httpmonitor.transport.HttpResponseData;
import com.httpmonitor.transport.HttpTransport;
import com.httpmonitor.transport.ProbeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

public class Prober {
    private static final Logger logger = LoggerFactory.getLogger(Prober.class);
    private static final String USER_AGENT = "User-Agent";

    private final HttpTransport transport;
    private final UserAgentProvider userAgents;
    private final CertificateExpiryInspector certificateInspector;
    private final Clock clock;

    public Prober(HttpTransport transport, UserAgentProvider userAgents,
                  CertificateExpiryInspector certificateInspector, Clock clock) {
        this.transport = transport;
        this.userAgents = userAgents;
        this.certificateInspector = certificateInspector;
        this.clock = clock;
    }

    public HealthCheck probe(Target target) {
        ProbeRequest request = new ProbeRequest(target.getUrl(), target.getMethod(), headersFor(target),
            target.getTimeout());
        long start = System.nanoTime();

        HttpResponseData response;
        try {
            response = transport.execute(request);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return failure(target, start, ErrorCategory.UNKNOWN, "Probe interrupted");
        } catch (Exception ex) {
            return failure(target, start, categorize(ex), describe(ex));
        }

        try {
            return evaluate(target, response);
        } finally {
            closeQuietly(target, response);
        }
    }

    private HealthCheck evaluate(Target target, HttpResponseData response) {
        int statusCode = response.getStatusCode();
        Duration responseTime = response.getDuration();
        boolean success = true;
        ErrorCategory category = ErrorCategory.NONE;
        String error = null;

        if (!target.acceptsStatus(statusCode)) {
            success = false;
            category = ErrorCategory.HTTP_ERROR;
            error = "Unexpected HTTP status " + statusCode;
        } else if (target.getExpectedContent() != null) {
            long readStart = System.nanoTime();
            try {
                String body = response.readBody(target.getTimeout().minus(response.getDuration()));
                if (!body.contains(target.getExpectedContent())) {
                    success = false;
                    category = ErrorCategory.CONTENT_MISMATCH;
                    error = "Expected content '" + target.getExpectedContent() + "' not found in response";
                }
            } catch (HttpTimeoutException ex) {
                success = false;
                category = ErrorCategory.TIMEOUT;
                error = "Request timed out";
            } catch (IOException ex) {
                success = false;
                category = ErrorCategory.BODY_READ_ERROR;
                error = "Failed to read response body: " + ex.getMessage();
            }
            responseTime = responseTime.plusNanos(System.nanoTime() - readStart);
        }

        Integer certExpiresDays = null;
        if (target.isHttps()) {
            OptionalInt days = certificateInspector.daysUntilExpiry(target.getUrl());
            if (days.isPresent()) {
                certExpiresDays = days.getAsInt();
            }
        }

        return new HealthCheck(target.getName(), clock.instant(), success, statusCode, responseTime,
            category, error, certExpiresDays);
    }

    private HealthCheck failure(Target target, long startNanos, ErrorCategory category, String error) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        return new HealthCheck(target.getName(), clock.instant(), false, null, elapsed, category, error, null);
    }

    private Map<String, String> headersFor(Target target) {
        Map<String, String> headers = new LinkedHashMap<>(target.getHeaders());
        boolean hasUserAgent = headers.keySet().stream().anyMatch(USER_AGENT::equalsIgnoreCase);
        if (!hasUserAgent) {
            headers.put(USER_AGENT, userAgents.next());
        }
        return headers;
    }

    static ErrorCategory categorize(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof HttpTimeoutException) {
                return ErrorCategory.TIMEOUT;
            }
            if (cause instanceof UnknownHostException || cause instanceof UnresolvedAddressException) {
                return ErrorCategory.DNS_FAILURE;
            }
            if (cause instanceof SSLException) {
                return ErrorCategory.TLS_ERROR;
            }
            if (cause instanceof ConnectException) {
                // the JDK client wraps resolution failures in ConnectException, keep looking
                if (cause.getCause() == null) {
                    return ErrorCategory.CONNECTION_FAILURE;
                }
                ErrorCategory nested = categorize(cause.getCause());
                return nested == ErrorCategory.UNKNOWN ? ErrorCategory.CONNECTION_FAILURE : nested;
            }
        }
        return ErrorCategory.UNKNOWN;
    }

    private static String describe(Exception ex) {
        switch (categorize(ex)) {
            case TIMEOUT:
                return "Request timed out";
            case DNS_FAILURE:
                return "DNS resolution failed";
            case TLS_ERROR:
                return "TLS handshake failed";
            case CONNECTION_FAILURE:
                return "Connection failed" + (ex.getMessage() != null ? ": " + ex.getMessage() : "");
            default:
                return ex.getClass().getSimpleName() + ": " + ex.getMessage();
        }
    }

    private static void closeQuietly(Target target, HttpResponseData response) {
        try {
            response.close();
        } catch (IOException ex) {
            logger.debug("Failed to release response for {}", target.getName(), ex);
        }
    }
}
