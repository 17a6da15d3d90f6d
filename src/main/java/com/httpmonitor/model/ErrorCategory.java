package com.httpmonitor.model;

public enum ErrorCategory {
    NONE,
    TIMEOUT,
    DNS_FAILURE,
    TLS_ERROR,
    CONNECTION_FAILURE,
    HTTP_ERROR,
    CONTENT_MISMATCH,
    BODY_READ_ERROR,
    UNKNOWN
}
