package com.httpmonitor.service;

import java.util.OptionalInt;

public class UnknownCertificateExpiryInspector implements CertificateExpiryInspector {
    @Override
    public OptionalInt daysUntilExpiry(String url) {
        return OptionalInt.empty();
    }
}
