package com.purchasingpower.itemgraph.util;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One logged call to a store or the export files: request line, response line
 * with elapsed time, or error line, all tagged with the same short call id.
 *
 * @see ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary, Object... details) {
        logger.info("{} {} → {} [{}]", service.getEmoji(), service.getName(), operation, callId);
        logDetails("Request", summary, details);
    }

    public void logResponse(String summary, Object... details) {
        logger.info("{} {} ← {} [{}] ({}ms)", service.getEmoji(), service.getName(), operation, callId, getElapsedMs());
        logDetails("Response", summary, details);
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    private void logDetails(String direction, String summary, Object... details) {
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  {}: {}", direction, summary);
        }
        // details come in name/value pairs
        for (int i = 0; i + 1 < details.length; i += 2) {
            logger.debug("  {}: {}", details[i], details[i + 1]);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
