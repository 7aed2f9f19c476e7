package simrun.coordinator.events;

import simrun.coordinator.model.RunStatus;

import java.time.Instant;

/**
 * A run moved from one status to another and the change was persisted.
 *
 * @param source component that applied the change, e.g. {@code sync} or {@code publish}
 */
public record RunTransitionEvent(long jobId, long runId, RunStatus from, RunStatus to, String source,
        Instant at) {
}
