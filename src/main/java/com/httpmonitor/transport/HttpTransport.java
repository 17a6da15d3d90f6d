package com.httpmonitor.transport;

public interface HttpTransport {
    /**
     * Sends the request and returns once response headers are available, bounded by the request
     * timeout. The body stays unread until {@link HttpResponseData#readBody(java.time.Duration)} is
     * called with whatever is left of that timeout; callers must close the response.
     */
    HttpResponseData execute(ProbeRequest request) throws Exception;
}
