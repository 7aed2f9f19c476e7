package simrun.coordinator.store;

import simrun.coordinator.error.RunNotFoundException;
import simrun.coordinator.error.StaleRunException;
import simrun.coordinator.model.Run;
import simrun.coordinator.model.RunStatus;
import simrun.coordinator.model.RunTransitions;
import simrun.coordinator.model.StorageLocation;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRunRepositoryTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcRunRepository repo;

    @BeforeAll
    static void setup() {
        db = StoreTestSupport.inMemoryDatabase("test-runs");
        jobs = new JdbcJobRepository(db);
        repo = new JdbcRunRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        StoreTestSupport.clear(db);
        jobs.save(StoreTestSupport.job(123));
        jobs.save(StoreTestSupport.job(124));
    }

    @Test
    void insertAndFind() {
        Instant created = StoreTestSupport.now();
        repo.insert(Run.builder().id(4).jobId(123).createdAt(created).build());

        Run found = repo.find(123, 4).orElseThrow();
        assertEquals(RunStatus.CREATED, found.status());
        assertEquals(0, found.version());
        assertEquals(created, found.createdAt());
        assertNull(found.resultsLocation());

        assertTrue(repo.find(124, 4).isEmpty());
        assertTrue(repo.findById(4).isPresent());
    }

    @Test
    void saveIncrementsVersion() {
        Run run = repo.insert(Run.builder().id(4).jobId(123).build());

        Run registered = repo.save(RunTransitions.apply(run, RunStatus.REGISTERED, StoreTestSupport.now()));

        assertEquals(1, registered.version());
        Run reloaded = repo.findById(4).orElseThrow();
        assertEquals(RunStatus.REGISTERED, reloaded.status());
        assertEquals(1, reloaded.version());
    }

    @Test
    @DisplayName("A write based on an outdated copy is rejected")
    void staleWriteIsRejected() {
        Run run = repo.insert(Run.builder().id(4).jobId(123).build());
        repo.save(RunTransitions.apply(run, RunStatus.REGISTERED, StoreTestSupport.now()));

        Run outdated = RunTransitions.apply(run, RunStatus.CANCELLED, StoreTestSupport.now());

        assertThrows(StaleRunException.class, () -> repo.save(outdated));
        assertEquals(RunStatus.REGISTERED, repo.findById(4).orElseThrow().status());
    }

    @Test
    void saveOfMissingRunFails() {
        Run ghost = Run.builder().id(99).jobId(123).build();

        assertThrows(RunNotFoundException.class, () -> repo.save(ghost));
    }

    @Test
    void storesPublishedLocation() {
        Instant now = StoreTestSupport.now();
        Run run = repo.insert(Run.restore(4, 123, RunStatus.RUNNING, null, null, "batch-1", null, now, now, 0));
        StorageLocation location = new StorageLocation("results", "jobs/123/run_4_results.zip");

        repo.save(RunTransitions.publish(run, location, now));

        Run reloaded = repo.findById(4).orElseThrow();
        assertEquals(RunStatus.DONE, reloaded.status());
        assertEquals(location, reloaded.resultsLocation());
        assertEquals(now, reloaded.resultsPublishedAt());
    }

    @Test
    void findActiveWithHandleSkipsTerminalAndUnsubmitted() {
        Instant now = StoreTestSupport.now();
        repo.insert(Run.restore(1, 123, RunStatus.QUEUED, null, null, "h-1", null, now, now.minusSeconds(30), 0));
        repo.insert(Run.restore(2, 123, RunStatus.RUNNING, null, null, "h-2", null, now, now.minusSeconds(60), 0));
        repo.insert(Run.restore(3, 123, RunStatus.FAILED, null, null, "h-3", null, now, now, 0));
        repo.insert(Run.restore(4, 124, RunStatus.REGISTERED, null, null, null, null, now, now, 0));

        List<Run> active = repo.findActiveWithHandle(10);

        assertEquals(List.of(2L, 1L), active.stream().map(Run::id).toList());
        assertEquals(1, repo.findActiveWithHandle(1).size());
    }

    @Test
    void polledRunsMoveBehindUnpolledOnes() {
        Instant now = StoreTestSupport.now();
        repo.insert(Run.restore(1, 123, RunStatus.RUNNING, null, null, "h-1", null, now, now.minusSeconds(60), 0));
        repo.insert(Run.restore(2, 123, RunStatus.RUNNING, null, null, "h-2", null, now, now.minusSeconds(30), 0));
        repo.insert(Run.restore(3, 123, RunStatus.QUEUED, null, null, "h-3", null, now, now, 0));

        repo.markPolled(List.of(1L, 2L), now);
        assertEquals(List.of(3L, 1L, 2L), repo.findActiveWithHandle(10).stream().map(Run::id).toList());

        repo.markPolled(List.of(3L), now.plusSeconds(5));
        repo.markPolled(List.of(1L), now.plusSeconds(10));
        assertEquals(List.of(2L, 3L), repo.findActiveWithHandle(2).stream().map(Run::id).toList());

        Run run = repo.findById(1).orElseThrow();
        assertEquals(0, run.version());
        assertEquals(now.minusSeconds(60), run.updatedAt());
    }

    @Test
    void findByJobIdOrdersById() {
        repo.insert(Run.builder().id(7).jobId(123).build());
        repo.insert(Run.builder().id(5).jobId(123).build());
        repo.insert(Run.builder().id(6).jobId(124).build());

        assertEquals(List.of(5L, 7L), repo.findByJobId(123).stream().map(Run::id).toList());
    }
}
