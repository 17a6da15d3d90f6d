package com.httpmonitor.transport;

import com.httpmonitor.model.HttpMethod;

import java.time.Duration;
import java.util.Map;

public class ProbeRequest {
    private final String url;
    private final HttpMethod method;
    private final Map<String, String> headers;
    private final Duration timeout;

    public ProbeRequest(String url, HttpMethod method, Map<String, String> headers, Duration timeout) {
        this.url = url;
        this.method = method;
        this.headers = headers;
        this.timeout = timeout;
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

    public Duration getTimeout() {
        return timeout;
    }
}
