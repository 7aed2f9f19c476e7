package simrun.coordinator.storage;

import simrun.coordinator.model.Job;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResultsKeysTest {

    private final Job job = Job.builder()
            .id(123)
            .ownerId(9)
            .createdAt(Instant.parse("2025-10-23T21:15:00.450Z"))
            .build();

    @Test
    void prefixUsesJobCreationTimeInUtc() {
        assertEquals("jobs/123/2025/10/23/211500", ResultsKeys.jobPrefix(job));
    }

    @Test
    void runKeyIsStablePerRun() {
        assertEquals("jobs/123/2025/10/23/211500/run_4_results.zip", ResultsKeys.runResultsKey(job, 4));
        assertEquals(ResultsKeys.runResultsKey(job, 4), ResultsKeys.runResultsKey(job, 4));
        assertNotEquals(ResultsKeys.runResultsKey(job, 4), ResultsKeys.runResultsKey(job, 5));
    }
}
