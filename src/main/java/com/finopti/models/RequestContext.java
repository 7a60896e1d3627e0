package com.finopti.models;

import java.util.UUID;

/**
 * Per-request identity: session id, caller identity and the upstream bearer
 * credential. Passed explicitly to every delegated call and forwarded unchanged.
 * The credential never appears in {@link #toString()}.
 */
public final class RequestContext {

    private final String sessionId;
    private final String callerIdentity;
    private final String upstreamCredential;

    public RequestContext(String sessionId, String callerIdentity, String upstreamCredential) {
        this.sessionId = blankToNull(sessionId);
        this.callerIdentity = blankToNull(callerIdentity);
        this.upstreamCredential = blankToNull(upstreamCredential);
    }

    public static RequestContext of(String sessionId, String callerIdentity, String upstreamCredential) {
        return new RequestContext(sessionId, callerIdentity, upstreamCredential);
    }

    public static String generateSessionId() {
        return "gen-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getCallerIdentity() {
        return callerIdentity;
    }

    public String getUpstreamCredential() {
        return upstreamCredential;
    }

    public boolean hasCallerIdentity() {
        return callerIdentity != null;
    }

    public boolean hasCredential() {
        return upstreamCredential != null;
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public String toString() {
        return "RequestContext{session=" + sessionId
            + ", caller=" + callerIdentity
            + ", credential=" + (upstreamCredential != null ? "present" : "none") + "}";
    }
}
