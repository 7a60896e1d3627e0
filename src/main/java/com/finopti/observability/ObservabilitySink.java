package com.finopti.observability;

/**
 * Fire-and-forget receiver of structured events. Callers must not depend on
 * delivery, and a failing sink must never change a routing outcome.
 */
public interface ObservabilitySink {

    void publish(ObservabilityEvent event);

    ObservabilitySink NOOP = event -> { };
}
