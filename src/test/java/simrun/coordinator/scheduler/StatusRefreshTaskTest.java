package simrun.coordinator.scheduler;

import simrun.coordinator.compute.FakeBatchComputeClient;
import simrun.coordinator.events.RunEventBus;
import simrun.coordinator.model.Run;
import simrun.coordinator.model.RunStatus;
import simrun.coordinator.service.RunStatusSynchronizer;
import simrun.coordinator.store.Database;
import simrun.coordinator.store.JdbcJobRepository;
import simrun.coordinator.store.JdbcRunRepository;
import simrun.coordinator.store.StoreTestSupport;
import simrun.coordinator.util.RetryPolicy;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static simrun.coordinator.compute.FakeBatchComputeClient.status;
import static org.junit.jupiter.api.Assertions.*;

class StatusRefreshTaskTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcRunRepository runs;

    private FakeBatchComputeClient compute;
    private RunEventBus events;
    private RunStatusSynchronizer synchronizer;

    @BeforeAll
    static void setup() {
        db = StoreTestSupport.inMemoryDatabase("test-refresh-task");
        jobs = new JdbcJobRepository(db);
        runs = new JdbcRunRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        StoreTestSupport.clear(db);
        jobs.save(StoreTestSupport.job(123));
        compute = new FakeBatchComputeClient();
        events = new RunEventBus();
        RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(10), 2.0, Duration.ofMillis(50));
        synchronizer = new RunStatusSynchronizer(compute, runs, policy, d -> { }, events, Clock.systemUTC(), 2);
    }

    @AfterEach
    void cleanup() {
        synchronizer.close();
        events.close();
    }

    private Run runIn(long id, RunStatus status, String handle, Instant updatedAt) {
        return runs.insert(Run.restore(id, 123, status, null, null, handle, null,
                StoreTestSupport.now(), updatedAt, 0));
    }

    @Test
    void refreshesOnlyActiveRunsWithHandle() {
        Instant t = StoreTestSupport.now();
        runIn(1, RunStatus.QUEUED, "h-1", t);
        runIn(2, RunStatus.RUNNING, "h-2", t);
        runIn(3, RunStatus.DONE, "h-3", t);
        runIn(4, RunStatus.CREATED, null, t);
        compute.respond("h-1", status("RUNNING"));
        compute.respond("h-2", status("RUNNING"));

        int changed = new StatusRefreshTask(runs, synchronizer, 100).refreshActiveRuns();

        assertEquals(1, changed);
        assertEquals(2, compute.describeCalls());
        assertEquals(RunStatus.RUNNING, runs.findById(1).orElseThrow().status());
        assertEquals(RunStatus.DONE, runs.findById(3).orElseThrow().status());
    }

    @Test
    void batchSizeLimitsOneTickLeastRecentlyUpdatedFirst() {
        Instant t = StoreTestSupport.now();
        runIn(1, RunStatus.RUNNING, "h-1", t);
        runIn(2, RunStatus.RUNNING, "h-2", t.minusSeconds(60));
        compute.respond("h-1", status("SUCCEEDED"));
        compute.respond("h-2", status("SUCCEEDED"));

        int changed = new StatusRefreshTask(runs, synchronizer, 1).refreshActiveRuns();

        assertEquals(1, changed);
        assertEquals(RunStatus.RUNNING, runs.findById(1).orElseThrow().status());
        assertEquals(RunStatus.DONE, runs.findById(2).orElseThrow().status());
    }

    @Test
    @DisplayName("Runs that keep their status do not block newer runs beyond the batch size")
    void unchangedRunsRotateOutOfTheBatch() {
        Instant t = StoreTestSupport.now();
        runIn(1, RunStatus.QUEUED, "h-1", t.minusSeconds(120));
        runIn(2, RunStatus.QUEUED, "h-2", t.minusSeconds(60));
        runIn(3, RunStatus.QUEUED, "h-3", t);
        compute.respond("h-1", status("RUNNABLE"));
        compute.respond("h-2", status("RUNNABLE"));
        compute.respond("h-3", status("SUCCEEDED"));
        StatusRefreshTask task = new StatusRefreshTask(runs, synchronizer, 2);

        assertEquals(0, task.refreshActiveRuns());
        assertEquals(RunStatus.QUEUED, runs.findById(3).orElseThrow().status());

        assertEquals(1, task.refreshActiveRuns());
        assertEquals(RunStatus.DONE, runs.findById(3).orElseThrow().status());
        assertEquals(4, compute.describeCalls());
    }

    @Test
    void nothingToRefresh() {
        assertEquals(0, new StatusRefreshTask(runs, synchronizer, 10).refreshActiveRuns());
        assertEquals(0, compute.describeCalls());
    }

    @Test
    void tickSurvivesRepositoryFailure() {
        Database closed = StoreTestSupport.inMemoryDatabase("test-refresh-task-closed");
        closed.close();
        StatusRefreshTask task = new StatusRefreshTask(new JdbcRunRepository(closed), synchronizer, 10);

        assertDoesNotThrow(task::run);
    }
}
