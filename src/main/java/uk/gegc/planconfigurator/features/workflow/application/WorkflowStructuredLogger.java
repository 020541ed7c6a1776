package uk.gegc.planconfigurator.features.workflow.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging utility for workflow transitions.
 */
public final class WorkflowStructuredLogger {

    private WorkflowStructuredLogger() {
    }

    public static void logTransition(Logger logger, String level, String message,
            String sessionId, String stepId, long revision, Object... additionalArgs) {

        MDC.put("workflow.sessionId", sessionId);
        MDC.put("workflow.stepId", stepId);
        MDC.put("workflow.revision", String.valueOf(revision));

        try {
            switch (level.toLowerCase()) {
                case "warn" -> logger.warn(message, additionalArgs);
                case "error" -> logger.error(message, additionalArgs);
                case "debug" -> logger.debug(message, additionalArgs);
                default -> logger.info(message, additionalArgs);
            }
        } finally {
            clearWorkflowMDC();
        }
    }

    public static void clearWorkflowMDC() {
        MDC.remove("workflow.sessionId");
        MDC.remove("workflow.stepId");
        MDC.remove("workflow.revision");
    }
}
