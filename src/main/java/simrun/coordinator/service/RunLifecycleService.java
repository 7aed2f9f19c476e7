package simrun.coordinator.service;

import simrun.coordinator.compute.BatchComputeClient;
import simrun.coordinator.error.CoordinatorException;
import simrun.coordinator.error.InvalidTransitionException;
import simrun.coordinator.error.ValidationException;
import simrun.coordinator.events.RunEventBus;
import simrun.coordinator.events.RunTransitionEvent;
import simrun.coordinator.model.Job;
import simrun.coordinator.model.Run;
import simrun.coordinator.model.RunStatus;
import simrun.coordinator.model.RunSubmission;
import simrun.coordinator.model.RunTransitions;
import simrun.coordinator.repository.JobRepository;
import simrun.coordinator.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service layer for creating jobs and moving runs through the owner-driven
 * part of their lifecycle: register, submit, cancel.
 */
public class RunLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(RunLifecycleService.class);

    static final String EVENT_SOURCE = "lifecycle";

    private final JobRepository jobRepository;
    private final RunRepository runRepository;
    private final BatchComputeClient computeClient;
    private final RunEventBus events;
    private final Clock clock;

    public RunLifecycleService(JobRepository jobRepository, RunRepository runRepository,
            BatchComputeClient computeClient, RunEventBus events) {
        this(jobRepository, runRepository, computeClient, events, Clock.systemUTC());
    }

    public RunLifecycleService(JobRepository jobRepository, RunRepository runRepository,
            BatchComputeClient computeClient, RunEventBus events, Clock clock) {
        this.jobRepository = jobRepository;
        this.runRepository = runRepository;
        this.computeClient = computeClient;
        this.events = events;
        this.clock = clock;
    }

    public Job createJob(long ownerId, Set<String> tags) {
        RunLoader.requireId("ownerId", ownerId);
        Job job = Job.builder()
                .id(jobRepository.nextId())
                .ownerId(ownerId)
                .tags(tags == null ? Set.of() : tags)
                .createdAt(now())
                .build();
        jobRepository.save(job);
        log.info("Created job {} for owner {}", job.id(), ownerId);
        return job;
    }

    /**
     * Create a run in status CREATED.
     *
     * @throws ValidationException if the job does not exist
     */
    public Run createRun(long jobId) {
        RunLoader.requireId("jobId", jobId);
        if (jobRepository.findById(jobId).isEmpty()) {
            throw new ValidationException("Job not found: " + jobId);
        }
        Instant now = now();
        Run run = runRepository.insert(Run.builder()
                .id(runRepository.nextId())
                .jobId(jobId)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created run {} for job {}", run.id(), jobId);
        return run;
    }

    public Run register(long jobId, long runId) {
        Run run = RunLoader.load(runRepository, jobId, runId);
        return save(run, RunTransitions.apply(run, RunStatus.REGISTERED, now()));
    }

    /**
     * Hand a registered run to the compute service and record its handle.
     * If the handle cannot be stored, the compute job is cancelled again.
     *
     * @throws InvalidTransitionException if the run is not REGISTERED
     * @throws simrun.coordinator.error.TransientExternalException if the compute service is unavailable
     */
    public Run submit(long jobId, long runId, Map<String, String> environment) {
        Run run = RunLoader.load(runRepository, jobId, runId);
        if (!run.status().canTransitionTo(RunStatus.SUBMITTED)) {
            throw new InvalidTransitionException(runId, run.status(), RunStatus.SUBMITTED);
        }

        String handle = computeClient.submit(RunSubmission.of(jobId, runId,
                environment == null ? Map.of() : environment));

        Run submitted = RunTransitions.apply(run, RunStatus.SUBMITTED, now()).toBuilder()
                .externalJobHandle(handle)
                .build();
        try {
            return save(run, submitted);
        } catch (RuntimeException e) {
            log.warn("Run {}: could not record compute job {}, cancelling it", runId, handle);
            try {
                computeClient.cancel(handle, "Submission of run " + runId + " could not be recorded");
            } catch (CoordinatorException cancelFailure) {
                e.addSuppressed(cancelFailure);
            }
            throw e;
        }
    }

    /**
     * Cancel a run. A submitted run is also terminated on the compute service,
     * on a best-effort basis.
     *
     * @throws InvalidTransitionException if the run already finished
     */
    public Run cancel(long jobId, long runId, String reason) {
        Run run = RunLoader.load(runRepository, jobId, runId);
        Run cancelled = RunTransitions.apply(run, RunStatus.CANCELLED, reason, now());

        if (run.hasExternalHandle()) {
            try {
                computeClient.cancel(run.externalJobHandle(), reason == null ? "Cancelled by owner" : reason);
            } catch (CoordinatorException e) {
                log.warn("Run {}: compute job {} could not be terminated: {}", runId, run.externalJobHandle(),
                        e.getMessage());
            }
        }
        return save(run, cancelled);
    }

    public Run findRun(long jobId, long runId) {
        return RunLoader.load(runRepository, jobId, runId);
    }

    public List<Run> runsForJob(long jobId) {
        RunLoader.requireId("jobId", jobId);
        return runRepository.findByJobId(jobId);
    }

    private Run save(Run before, Run after) {
        Run saved = runRepository.save(after);
        events.publish(new RunTransitionEvent(saved.jobId(), saved.id(), before.status(), saved.status(),
                EVENT_SOURCE, saved.updatedAt()));
        log.info("Run {}: {} -> {}", saved.id(), before.status(), saved.status());
        return saved;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
