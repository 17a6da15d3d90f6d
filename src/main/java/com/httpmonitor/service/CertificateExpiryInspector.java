package com.httpmonitor.service;

import java.util.OptionalInt;

public interface CertificateExpiryInspector {
    /**
     * Days until the server certificate behind {@code url} expires, or empty when unknown.
     */
    OptionalInt daysUntilExpiry(String url);
}
