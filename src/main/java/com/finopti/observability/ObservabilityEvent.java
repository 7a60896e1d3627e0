package com.finopti.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One structured event for the observability sink.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ObservabilityEvent {

    private final String component;
    private final String event;
    private final String outcome;
    private final Long latencyMs;
    private final String targetAgent;
    private final String sessionId;
    private final String message;
    private final long timestamp;

    private ObservabilityEvent(Builder b) {
        this.component = b.component;
        this.event = b.event;
        this.outcome = b.outcome;
        this.latencyMs = b.latencyMs;
        this.targetAgent = b.targetAgent;
        this.sessionId = b.sessionId;
        this.message = b.message;
        this.timestamp = b.timestamp > 0 ? b.timestamp : System.currentTimeMillis();
    }

    public static Builder builder(String component, String event) {
        return new Builder(component, event);
    }

    @JsonProperty("component")
    public String getComponent() {
        return component;
    }

    @JsonProperty("event")
    public String getEvent() {
        return event;
    }

    @JsonProperty("outcome")
    public String getOutcome() {
        return outcome;
    }

    @JsonProperty("latency_ms")
    public Long getLatencyMs() {
        return latencyMs;
    }

    @JsonProperty("target_agent")
    public String getTargetAgent() {
        return targetAgent;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(component).append('.').append(event);
        if (outcome != null) sb.append(" outcome=").append(outcome);
        if (targetAgent != null) sb.append(" agent=").append(targetAgent);
        if (latencyMs != null) sb.append(" latency=").append(latencyMs).append("ms");
        if (sessionId != null) sb.append(" session=").append(sessionId);
        if (message != null) sb.append(" msg=").append(message);
        return sb.toString();
    }

    public static class Builder {
        private final String component;
        private final String event;
        private String outcome;
        private Long latencyMs;
        private String targetAgent;
        private String sessionId;
        private String message;
        private long timestamp;

        private Builder(String component, String event) {
            this.component = component;
            this.event = event;
        }

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder latencyMs(long latencyMs) {
            this.latencyMs = latencyMs;
            return this;
        }

        public Builder targetAgent(String targetAgent) {
            this.targetAgent = targetAgent;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ObservabilityEvent build() {
            return new ObservabilityEvent(this);
        }
    }
}
