package com.finopti.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.finopti.models.RequestContext;
import io.javalin.http.Context;

/**
 * Builds the {@link RequestContext} for an inbound request. Headers win over
 * body fields.
 */
final class RequestContexts {

    static final String SESSION_HEADER = "X-Session-ID";
    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_EMAIL_HEADER = "X-User-Email";
    static final String AUTHORIZATION_HEADER = "Authorization";

    private RequestContexts() {
    }

    static RequestContext from(Context ctx, JsonNode body) {
        String sessionId = firstNonBlank(
            ctx.header(SESSION_HEADER),
            bodyText(body, "session_id"),
            ctx.header(REQUEST_ID_HEADER));
        if (sessionId == null) {
            sessionId = RequestContext.generateSessionId();
        }
        String caller = firstNonBlank(ctx.header(USER_EMAIL_HEADER), bodyText(body, "user_email"));
        return RequestContext.of(sessionId, caller, ctx.header(AUTHORIZATION_HEADER));
    }

    private static String bodyText(JsonNode body, String field) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode node = body.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }
}
