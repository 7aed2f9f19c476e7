package simrun.coordinator.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    private static final Map<RunStatus, Set<RunStatus>> ALLOWED = Map.of(
            RunStatus.CREATED, EnumSet.of(RunStatus.REGISTERED, RunStatus.CANCELLED),
            RunStatus.REGISTERED, EnumSet.of(RunStatus.SUBMITTED, RunStatus.CANCELLED),
            RunStatus.SUBMITTED, EnumSet.of(RunStatus.QUEUED, RunStatus.FAILED, RunStatus.CANCELLED),
            RunStatus.QUEUED, EnumSet.of(RunStatus.RUNNING, RunStatus.FAILED, RunStatus.CANCELLED),
            RunStatus.RUNNING, EnumSet.of(RunStatus.DONE, RunStatus.FAILED, RunStatus.CANCELLED),
            RunStatus.DONE, EnumSet.noneOf(RunStatus.class),
            RunStatus.FAILED, EnumSet.noneOf(RunStatus.class),
            RunStatus.CANCELLED, EnumSet.noneOf(RunStatus.class));

    @Test
    @DisplayName("Every (from, to) pair matches the transition table")
    void exhaustiveTransitionTable() {
        for (RunStatus from : RunStatus.values()) {
            for (RunStatus to : RunStatus.values()) {
                assertEquals(ALLOWED.get(from).contains(to), from.canTransitionTo(to), from + " -> " + to);
            }
            assertEquals(ALLOWED.get(from), from.allowedTargets());
        }
    }

    @Test
    void terminalStatuses() {
        assertTrue(RunStatus.DONE.isTerminal());
        assertTrue(RunStatus.FAILED.isTerminal());
        assertTrue(RunStatus.CANCELLED.isTerminal());
        assertFalse(RunStatus.CREATED.isTerminal());
        assertFalse(RunStatus.RUNNING.isTerminal());
    }

    @Test
    void allowedTargetsIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> RunStatus.CREATED.allowedTargets().add(RunStatus.DONE));
    }

    @Test
    void forwardPathSkipsIntermediateStatuses() {
        assertEquals(List.of(RunStatus.QUEUED, RunStatus.RUNNING, RunStatus.DONE),
                RunStatus.SUBMITTED.forwardPathTo(RunStatus.DONE));
        assertEquals(List.of(RunStatus.RUNNING), RunStatus.QUEUED.forwardPathTo(RunStatus.RUNNING));
        assertEquals(List.of(RunStatus.FAILED), RunStatus.SUBMITTED.forwardPathTo(RunStatus.FAILED));
    }

    @Test
    void forwardPathIsEmptyForRegressionsAndTerminalStatuses() {
        assertTrue(RunStatus.RUNNING.forwardPathTo(RunStatus.QUEUED).isEmpty());
        assertTrue(RunStatus.RUNNING.forwardPathTo(RunStatus.RUNNING).isEmpty());
        assertTrue(RunStatus.DONE.forwardPathTo(RunStatus.FAILED).isEmpty());
        assertTrue(RunStatus.CANCELLED.forwardPathTo(RunStatus.RUNNING).isEmpty());
    }
}
