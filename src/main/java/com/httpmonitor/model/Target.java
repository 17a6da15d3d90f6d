package com.httpmonitor.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class Target {
    private final String name;
    private final String url;
    private final HttpMethod method;
    private final Map<String, String> headers;
    private final List<Integer> expectedStatus;
    private final String expectedContent;
    private final Duration timeout;
    private final Duration interval;

    public Target(String name, String url, HttpMethod method, Map<String, String> headers,
                  List<Integer> expectedStatus, String expectedContent, Duration timeout, Duration interval) {
        this.name = Objects.requireNonNull(name, "name");
        this.url = Objects.requireNonNull(url, "url");
        this.method = method == null ? HttpMethod.GET : method;
        this.headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.expectedStatus = expectedStatus == null ? List.of() : List.copyOf(expectedStatus);
        this.expectedContent = expectedContent;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public HttpMethod getMethod() {
        return method;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public List<Integer> getExpectedStatus() {
        return expectedStatus;
    }

    public String getExpectedContent() {
        return expectedContent;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Duration getInterval() {
        return interval;
    }

    public boolean isHttps() {
        return url.regionMatches(true, 0, "https://", 0, 8);
    }

    /**
     * An empty expected set accepts any 2xx code.
     */
    public boolean acceptsStatus(int statusCode) {
        if (expectedStatus.isEmpty()) {
            return statusCode >= 200 && statusCode <= 299;
        }
        return expectedStatus.contains(statusCode);
    }
}
