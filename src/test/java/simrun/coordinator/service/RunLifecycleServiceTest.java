package simrun.coordinator.service;

import simrun.coordinator.compute.FakeBatchComputeClient;
import simrun.coordinator.error.InvalidTransitionException;
import simrun.coordinator.error.PersistenceException;
import simrun.coordinator.error.RunOwnershipMismatchException;
import simrun.coordinator.error.TerminalExternalException;
import simrun.coordinator.error.TransientExternalException;
import simrun.coordinator.error.ValidationException;
import simrun.coordinator.events.RecordingRunEventListener;
import simrun.coordinator.events.RunEventBus;
import simrun.coordinator.events.RunTransitionEvent;
import simrun.coordinator.model.Job;
import simrun.coordinator.model.Run;
import simrun.coordinator.model.RunStatus;
import simrun.coordinator.model.RunSubmission;
import simrun.coordinator.store.CountingRunRepository;
import simrun.coordinator.store.Database;
import simrun.coordinator.store.JdbcJobRepository;
import simrun.coordinator.store.JdbcRunRepository;
import simrun.coordinator.store.StoreTestSupport;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RunLifecycleServiceTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static JdbcRunRepository jdbcRuns;

    private CountingRunRepository runs;
    private FakeBatchComputeClient compute;
    private RunEventBus events;
    private RecordingRunEventListener listener;
    private RunLifecycleService service;

    @BeforeAll
    static void setup() {
        db = StoreTestSupport.inMemoryDatabase("test-lifecycle");
        jobs = new JdbcJobRepository(db);
        jdbcRuns = new JdbcRunRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void init() throws Exception {
        StoreTestSupport.clear(db);
        runs = new CountingRunRepository(jdbcRuns);
        compute = new FakeBatchComputeClient();
        listener = new RecordingRunEventListener();
        events = new RunEventBus().subscribe(listener);
        service = new RunLifecycleService(jobs, runs, compute, events);
    }

    @AfterEach
    void cleanup() {
        events.close();
    }

    @Test
    void createJobAndRun() {
        Job job = service.createJob(9, Set.of("cfd"));
        Run run = service.createRun(job.id());

        assertEquals(Set.of("cfd"), jobs.findById(job.id()).orElseThrow().tags());
        assertEquals(RunStatus.CREATED, run.status());
        assertEquals(job.id(), run.jobId());
        assertEquals(List.of(run), service.runsForJob(job.id()));
    }

    @Test
    void createRunForUnknownJobFails() {
        assertThrows(ValidationException.class, () -> service.createRun(404));
    }

    @Test
    @DisplayName("Register then submit stores the compute handle")
    void registerAndSubmit() {
        Job job = service.createJob(9, Set.of());
        Run run = service.createRun(job.id());

        service.register(job.id(), run.id());
        Run submitted = service.submit(job.id(), run.id(), Map.of("SIM_CASE", "cavity"));

        assertEquals(RunStatus.SUBMITTED, submitted.status());
        assertEquals("batch-" + run.id(), submitted.externalJobHandle());
        assertEquals(submitted.externalJobHandle(),
                jdbcRuns.findById(run.id()).orElseThrow().externalJobHandle());

        RunSubmission sent = compute.submissions().get(0);
        assertEquals("job-" + job.id() + "-run-" + run.id(), sent.jobName());
        assertEquals("cavity", sent.environment().get("SIM_CASE"));

        events.close();
        assertEquals(List.of(RunStatus.REGISTERED, RunStatus.SUBMITTED),
                listener.transitions().stream().map(RunTransitionEvent::to).toList());
    }

    @Test
    void submitRequiresRegisteredRun() {
        Job job = service.createJob(9, Set.of());
        Run run = service.createRun(job.id());

        assertThrows(InvalidTransitionException.class, () -> service.submit(job.id(), run.id(), Map.of()));
        assertTrue(compute.submissions().isEmpty());
    }

    @Test
    void submitFailureLeavesRunRegistered() {
        Job job = service.createJob(9, Set.of());
        Run run = service.createRun(job.id());
        service.register(job.id(), run.id());
        compute.failSubmit(new TransientExternalException("503"));

        assertThrows(TransientExternalException.class, () -> service.submit(job.id(), run.id(), Map.of()));
        assertEquals(RunStatus.REGISTERED, jdbcRuns.findById(run.id()).orElseThrow().status());
    }

    @Test
    void unrecordedSubmissionIsCancelledRemotely() {
        Job job = service.createJob(9, Set.of());
        Run run = service.createRun(job.id());
        service.register(job.id(), run.id());
        runs.failNextSave(new PersistenceException("db down", null));

        assertThrows(PersistenceException.class, () -> service.submit(job.id(), run.id(), Map.of()));
        assertEquals(List.of("batch-" + run.id()), compute.cancelled());
    }

    @Test
    void cancelTerminatesRemoteJob() {
        Job job = service.createJob(9, Set.of());
        Run run = service.createRun(job.id());
        service.register(job.id(), run.id());
        service.submit(job.id(), run.id(), Map.of());

        Run cancelled = service.cancel(job.id(), run.id(), "owner request");

        assertEquals(RunStatus.CANCELLED, cancelled.status());
        assertEquals("owner request", cancelled.statusDetail());
        assertEquals(List.of("batch-" + run.id()), compute.cancelled());
    }

    @Test
    void cancelSucceedsWhenRemoteTerminateFails() {
        Job job = service.createJob(9, Set.of());
        Run run = service.createRun(job.id());
        service.register(job.id(), run.id());
        service.submit(job.id(), run.id(), Map.of());
        compute.failCancel(new TerminalExternalException("job already finished"));

        Run cancelled = service.cancel(job.id(), run.id(), null);

        assertEquals(RunStatus.CANCELLED, cancelled.status());
    }

    @Test
    void cancelOfFinishedRunIsRejected() {
        Job job = service.createJob(9, Set.of());
        Run run = service.createRun(job.id());
        service.cancel(job.id(), run.id(), "first");

        assertThrows(InvalidTransitionException.class, () -> service.cancel(job.id(), run.id(), "second"));
        assertTrue(compute.cancelled().isEmpty());
    }

    @Test
    void otherJobCannotTouchRun() {
        Job owner = service.createJob(9, Set.of());
        Job other = service.createJob(10, Set.of());
        Run run = service.createRun(owner.id());

        assertThrows(RunOwnershipMismatchException.class, () -> service.register(other.id(), run.id()));
    }
}
