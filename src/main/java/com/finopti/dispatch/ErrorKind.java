package com.finopti.dispatch;

/**
 * Failure taxonomy carried by every unsuccessful dispatch, with the HTTP
 * status the inbound surface answers with.
 */
public enum ErrorKind {
    INVALID_INPUT(400),
    UNKNOWN_AGENT(404),
    AUTHORIZATION_DENIED(403),
    DELEGATION_FAILURE(502),
    REGISTRY_UNAVAILABLE(503),
    INTERNAL(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
