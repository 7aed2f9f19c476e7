package simrun.coordinator.events;

/**
 * Observability hook for run lifecycle events.
 * Implementations must be thread-safe; they are called from the event bus thread.
 */
public interface RunEventListener {

    default void onTransition(RunTransitionEvent event) {
    }

    default void onRetryExhausted(RetryExhaustedEvent event) {
    }
}
