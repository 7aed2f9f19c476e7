package simrun.coordinator.compute;

import simrun.coordinator.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BatchStatusMapperTest {

    @Test
    void mapsEveryKnownStatus() {
        Map<String, RunStatus> expected = Map.of(
                "SUBMITTED", RunStatus.QUEUED,
                "PENDING", RunStatus.QUEUED,
                "RUNNABLE", RunStatus.QUEUED,
                "STARTING", RunStatus.RUNNING,
                "RUNNING", RunStatus.RUNNING,
                "SUCCEEDED", RunStatus.DONE,
                "FAILED", RunStatus.FAILED);

        expected.forEach((batch, run) -> assertEquals(Optional.of(run), BatchStatusMapper.toRunStatus(batch)));
    }

    @Test
    void toleratesCaseAndWhitespace() {
        assertEquals(Optional.of(RunStatus.RUNNING), BatchStatusMapper.toRunStatus(" running "));
    }

    @Test
    void unknownStatusMapsToNothing() {
        assertTrue(BatchStatusMapper.toRunStatus("HIBERNATING").isEmpty());
        assertTrue(BatchStatusMapper.toRunStatus("").isEmpty());
        assertTrue(BatchStatusMapper.toRunStatus(null).isEmpty());
    }
}
