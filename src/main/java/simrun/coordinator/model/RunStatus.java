package simrun.coordinator.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Run lifecycle status and the table of allowed transitions.
 */
public enum RunStatus {
    /** Run row exists, nothing prepared yet */
    CREATED,
    /** Run configuration registered */
    REGISTERED,
    /** Handed to the batch-compute service */
    SUBMITTED,
    /** Waiting for compute capacity */
    QUEUED,
    /** Simulation executing */
    RUNNING,
    /** Finished successfully */
    DONE,
    /** Finished with an error */
    FAILED,
    /** Cancelled by the owner */
    CANCELLED;

    private static final Map<RunStatus, Set<RunStatus>> TRANSITIONS = new EnumMap<>(RunStatus.class);

    static {
        TRANSITIONS.put(CREATED, EnumSet.of(REGISTERED, CANCELLED));
        TRANSITIONS.put(REGISTERED, EnumSet.of(SUBMITTED, CANCELLED));
        TRANSITIONS.put(SUBMITTED, EnumSet.of(QUEUED, FAILED, CANCELLED));
        TRANSITIONS.put(QUEUED, EnumSet.of(RUNNING, FAILED, CANCELLED));
        TRANSITIONS.put(RUNNING, EnumSet.of(DONE, FAILED, CANCELLED));
        TRANSITIONS.put(DONE, EnumSet.noneOf(RunStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(RunStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(RunStatus.class));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    public boolean canTransitionTo(RunStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<RunStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /**
     * Shortest chain of statuses leading from this status to {@code target}
     * through the transition table, excluding this status and including the
     * target. Empty when the target is this status or cannot be reached.
     * The table has no cycles, so every step of the chain moves forward.
     */
    public List<RunStatus> forwardPathTo(RunStatus target) {
        if (target == this) {
            return List.of();
        }
        Map<RunStatus, RunStatus> previous = new EnumMap<>(RunStatus.class);
        Deque<RunStatus> queue = new ArrayDeque<>();
        queue.add(this);
        while (!queue.isEmpty()) {
            RunStatus current = queue.poll();
            for (RunStatus next : TRANSITIONS.get(current)) {
                if (next == this || previous.containsKey(next)) {
                    continue;
                }
                previous.put(next, current);
                if (next == target) {
                    LinkedList<RunStatus> path = new LinkedList<>();
                    for (RunStatus s = target; s != this; s = previous.get(s)) {
                        path.addFirst(s);
                    }
                    return List.copyOf(path);
                }
                queue.add(next);
            }
        }
        return List.of();
    }
}
