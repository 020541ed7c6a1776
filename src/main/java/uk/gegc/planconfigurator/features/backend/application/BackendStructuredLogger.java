package uk.gegc.planconfigurator.features.backend.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging utility for backend calls.
 * Puts the operation, slot and attempt into the MDC for the duration of one log statement.
 */
public final class BackendStructuredLogger {

    private BackendStructuredLogger() {
    }

    public static void logAttempt(Logger logger, String level, String message,
            String operation, String slotKey, int attempt, Object... additionalArgs) {

        MDC.put("backend.operation", operation);
        MDC.put("backend.slot", slotKey);
        MDC.put("backend.attempt", String.valueOf(attempt));

        try {
            switch (level.toLowerCase()) {
                case "warn" -> logger.warn(message, additionalArgs);
                case "error" -> logger.error(message, additionalArgs);
                case "debug" -> logger.debug(message, additionalArgs);
                default -> logger.info(message, additionalArgs);
            }
        } finally {
            clearBackendMDC();
        }
    }

    public static void clearBackendMDC() {
        MDC.remove("backend.operation");
        MDC.remove("backend.slot");
        MDC.remove("backend.attempt");
    }
}
