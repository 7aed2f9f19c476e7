package simrun.coordinator.error;

import simrun.coordinator.model.RunStatus;

public class InvalidTransitionException extends CoordinatorException {

    private final RunStatus from;
    private final RunStatus to;

    public InvalidTransitionException(long runId, RunStatus from, RunStatus to) {
        super("Invalid transition for run " + runId + ": " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public RunStatus from() {
        return from;
    }

    public RunStatus to() {
        return to;
    }
}
