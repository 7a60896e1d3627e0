package com.finopti.models;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Allow/deny verdict for one (caller, target agent) pair. A denial always
 * carries a non-empty reason.
 */
public final class AuthorizationDecision {

    static final String DEFAULT_DENY_REASON = "Access denied";

    private final boolean allowed;
    private final String reason;

    private AuthorizationDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public static AuthorizationDecision allow(String reason) {
        return new AuthorizationDecision(true, reason != null ? reason : "");
    }

    public static AuthorizationDecision deny(String reason) {
        String r = reason == null || reason.isBlank() ? DEFAULT_DENY_REASON : reason;
        return new AuthorizationDecision(false, r);
    }

    @JsonProperty("allowed")
    public boolean isAllowed() {
        return allowed;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return (allowed ? "ALLOW" : "DENY") + (reason.isEmpty() ? "" : " (" + reason + ")");
    }
}
