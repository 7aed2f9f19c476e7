package simrun.coordinator.compute;

import simrun.coordinator.model.RunStatus;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps batch-compute job statuses onto {@link RunStatus}.
 * <pre>
 * SUBMITTED, PENDING, RUNNABLE  -&gt; QUEUED
 * STARTING, RUNNING             -&gt; RUNNING
 * SUCCEEDED                     -&gt; DONE
 * FAILED                        -&gt; FAILED
 * </pre>
 * Anything else maps to nothing, meaning "leave the run as it is".
 */
public final class BatchStatusMapper {

    private static final Map<String, RunStatus> STATUS_MAPPING = Map.of(
            "SUBMITTED", RunStatus.QUEUED,
            "PENDING", RunStatus.QUEUED,
            "RUNNABLE", RunStatus.QUEUED,
            "STARTING", RunStatus.RUNNING,
            "RUNNING", RunStatus.RUNNING,
            "SUCCEEDED", RunStatus.DONE,
            "FAILED", RunStatus.FAILED);

    private BatchStatusMapper() {
    }

    public static Optional<RunStatus> toRunStatus(String batchStatus) {
        if (batchStatus == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(STATUS_MAPPING.get(batchStatus.trim().toUpperCase(Locale.ROOT)));
    }
}
