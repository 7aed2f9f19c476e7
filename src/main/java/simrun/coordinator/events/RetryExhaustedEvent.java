package simrun.coordinator.events;

import simrun.coordinator.model.RunStatus;

import java.time.Instant;

/**
 * Every status query attempt for a run failed; the run kept {@code status}.
 *
 * @param reason message of the last failure
 */
public record RetryExhaustedEvent(long jobId, long runId, RunStatus status, int attempts, String reason,
        Instant at) {
}
