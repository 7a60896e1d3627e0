package com.finopti.observability;

import com.finopti.AppLogger;

/**
 * Writes events to the application log.
 */
public class LoggingObservabilitySink implements ObservabilitySink {

    private final AppLogger logger = AppLogger.get();

    @Override
    public void publish(ObservabilityEvent event) {
        if (event == null) {
            return;
        }
        if ("failure".equals(event.getOutcome()) || "rejected".equals(event.getOutcome())) {
            logger.warn("[obs] " + event);
        } else {
            logger.info("[obs] " + event);
        }
    }
}
