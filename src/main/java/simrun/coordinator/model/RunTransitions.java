package simrun.coordinator.model;

import simrun.coordinator.error.InvalidTransitionException;

import java.time.Instant;
import java.util.Objects;

/**
 * The single gate for run status changes.
 * <p>
 * Every method returns a new {@link Run}; the input is never modified, so a
 * rejected transition leaves the caller's run exactly as it was.
 */
public final class RunTransitions {

    private RunTransitions() {
    }

    /**
     * Move a run to {@code target}.
     *
     * @throws InvalidTransitionException if the edge is not in the transition table
     */
    public static Run apply(Run run, RunStatus target, Instant at) {
        Objects.requireNonNull(run, "run");
        Objects.requireNonNull(target, "target");
        if (!run.status().canTransitionTo(target)) {
            throw new InvalidTransitionException(run.id(), run.status(), target);
        }
        return run.toBuilder()
                .status(target)
                .updatedAt(at)
                .build();
    }

    /** Same as {@link #apply(Run, RunStatus, Instant)} but also records the external reason text. */
    public static Run apply(Run run, RunStatus target, String statusDetail, Instant at) {
        return apply(run, target, at).toBuilder()
                .statusDetail(statusDetail)
                .build();
    }

    /**
     * Mark a run DONE with its stored results.
     * A run already DONE (status synced before its results arrived) only gets the location attached.
     *
     * @throws InvalidTransitionException if the run cannot reach DONE directly
     */
    public static Run publish(Run run, StorageLocation location, Instant publishedAt) {
        Objects.requireNonNull(location, "location");
        Run done = run.status() == RunStatus.DONE ? run : apply(run, RunStatus.DONE, publishedAt);
        return done.toBuilder()
                .resultsLocation(location)
                .resultsPublishedAt(publishedAt)
                .updatedAt(publishedAt)
                .build();
    }

    /** Whether {@link #publish} would accept this run. */
    public static boolean canPublish(Run run) {
        return run.status() == RunStatus.DONE || run.status().canTransitionTo(RunStatus.DONE);
    }
}
