package uk.gegc.planconfigurator.features.backend.application;

import uk.gegc.planconfigurator.features.backend.domain.model.RequestCompletedEvent;
import uk.gegc.planconfigurator.features.backend.domain.model.RequestStartedEvent;

/**
 * Observer hooks around backend calls. Listener failures are logged and never affect the call.
 */
public interface RequestLifecycleListener {

    default void onRequestStarted(RequestStartedEvent event) {
    }

    /**
     * Called once per attempt, including attempts that will be retried.
     */
    default void onRequestCompleted(RequestCompletedEvent event) {
    }

    default void onRequestSuperseded(String operation, String slotKey) {
    }
}
