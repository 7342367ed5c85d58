package com.purchasingpower.itemgraph.util;

import org.slf4j.Logger;

/**
 * Unified logging for calls to the graph store and the export files.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
