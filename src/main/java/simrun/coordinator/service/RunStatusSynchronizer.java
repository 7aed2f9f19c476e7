package simrun.coordinator.service;

import simrun.coordinator.compute.BatchComputeClient;
import simrun.coordinator.compute.BatchStatusMapper;
import simrun.coordinator.error.StaleRunException;
import simrun.coordinator.error.TerminalExternalException;
import simrun.coordinator.error.TransientExternalException;
import simrun.coordinator.events.RetryExhaustedEvent;
import simrun.coordinator.events.RunEventBus;
import simrun.coordinator.events.RunTransitionEvent;
import simrun.coordinator.model.ExternalStatus;
import simrun.coordinator.model.Run;
import simrun.coordinator.model.RunStatus;
import simrun.coordinator.model.RunTransitions;
import simrun.coordinator.repository.RunRepository;
import simrun.coordinator.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reconciles runs with the batch-compute service.
 * <p>
 * For each non-terminal run with an external handle:
 * <ol>
 * <li>query the compute service, retrying transient failures with backoff</li>
 * <li>map the reported status; unknown statuses mean "no change"</li>
 * <li>walk the transition table forward to the mapped status; regressions and
 * unreachable statuses are skipped</li>
 * <li>persist the result in a single guarded write</li>
 * </ol>
 * A run whose queries all fail keeps its stored status and the rest of the batch
 * carries on. A job the compute service reports as gone fails the run.
 */
public class RunStatusSynchronizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunStatusSynchronizer.class);

    static final String EVENT_SOURCE = "sync";

    private final BatchComputeClient computeClient;
    private final RunRepository runRepository;
    private final RetryPolicy retryPolicy;
    private final RetryPolicy.Sleeper sleeper;
    private final RunEventBus events;
    private final Clock clock;
    private final ExecutorService workers;

    public RunStatusSynchronizer(BatchComputeClient computeClient, RunRepository runRepository,
            RetryPolicy retryPolicy, RunEventBus events, int poolSize) {
        this(computeClient, runRepository, retryPolicy, RetryPolicy.Sleeper.THREAD, events, Clock.systemUTC(),
                poolSize);
    }

    public RunStatusSynchronizer(BatchComputeClient computeClient, RunRepository runRepository,
            RetryPolicy retryPolicy, RetryPolicy.Sleeper sleeper, RunEventBus events, Clock clock, int poolSize) {
        this.computeClient = computeClient;
        this.runRepository = runRepository;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.events = events;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "simrun-sync-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Refresh the given runs against the compute service.
     *
     * @return the runs in input order, each either updated or exactly as passed in
     */
    public List<Run> refresh(Collection<Run> runs) {
        List<Run> input = List.copyOf(runs);
        List<Future<Run>> futures = new ArrayList<>(input.size());
        for (Run run : input) {
            futures.add(workers.submit(() -> refreshOne(run)));
        }

        List<Run> result = new ArrayList<>(input.size());
        int changed = 0;
        for (int i = 0; i < input.size(); i++) {
            Run original = input.get(i);
            Run refreshed = await(futures.get(i), original);
            if (refreshed.status() != original.status()) {
                changed++;
            }
            result.add(refreshed);
        }
        log.info("Status refresh: {} runs checked, {} changed", input.size(), changed);
        return result;
    }

    /**
     * Refresh a single run on the calling thread.
     */
    public Run refreshOne(Run run) {
        if (run.isTerminal() || !run.hasExternalHandle()) {
            log.debug("Skipping run {} ({}, handle={})", run.id(), run.status(), run.externalJobHandle());
            return run;
        }

        RunStatus target;
        String detail;
        try {
            Optional<ExternalStatus> status = describeWithRetry(run);
            if (status.isEmpty()) {
                return run;
            }
            Optional<RunStatus> mapped = BatchStatusMapper.toRunStatus(status.get().phase());
            if (mapped.isEmpty()) {
                log.debug("Run {}: unmapped compute status '{}', no change", run.id(), status.get().phase());
                return run;
            }
            target = mapped.get();
            detail = status.get().detail();
        } catch (TerminalExternalException e) {
            log.warn("Run {}: compute job {} is gone: {}", run.id(), run.externalJobHandle(), e.getMessage());
            target = RunStatus.FAILED;
            detail = e.getMessage();
        }

        return applyAndSave(run, target, detail);
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    // --- Helpers ---

    private Optional<ExternalStatus> describeWithRetry(Run run) {
        TransientExternalException last = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                return Optional.of(computeClient.describe(run.externalJobHandle()));
            } catch (TransientExternalException e) {
                last = e;
                log.debug("Run {}: status query attempt {}/{} failed: {}", run.id(), attempt,
                        retryPolicy.maxAttempts(), e.getMessage());
                if (attempt < retryPolicy.maxAttempts() && !pause(retryPolicy.backoffAfter(attempt))) {
                    return exhausted(run, attempt, "interrupted during backoff");
                }
            }
        }
        return exhausted(run, retryPolicy.maxAttempts(), last == null ? "unknown" : last.getMessage());
    }

    private Optional<ExternalStatus> exhausted(Run run, int attempts, String reason) {
        log.warn("Run {}: status query failed after {} attempts, keeping {}", run.id(), attempts, run.status());
        events.publish(new RetryExhaustedEvent(run.jobId(), run.id(), run.status(), attempts, reason,
                clock.instant()));
        return Optional.empty();
    }

    private boolean pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Run applyAndSave(Run run, RunStatus target, String detail) {
        Run advanced = advance(run, target, detail);
        if (advanced == null) {
            return run;
        }
        try {
            Run saved = runRepository.save(advanced);
            announce(run, saved);
            return saved;
        } catch (StaleRunException e) {
            log.debug("Run {} changed while syncing, reapplying on fresh copy", run.id());
        }

        Run current = runRepository.find(run.jobId(), run.id()).orElse(run);
        Run reapplied = advance(current, target, detail);
        if (reapplied == null) {
            return current;
        }
        try {
            Run saved = runRepository.save(reapplied);
            announce(current, saved);
            return saved;
        } catch (StaleRunException e) {
            log.warn("Run {} still changing concurrently, leaving sync to the next refresh", run.id());
            return current;
        }
    }

    /**
     * Run moved along the shortest forward path to {@code target}, or null when
     * there is nothing to apply.
     */
    private Run advance(Run run, RunStatus target, String detail) {
        List<RunStatus> path = run.status().forwardPathTo(target);
        if (path.isEmpty()) {
            if (run.status() != target) {
                log.debug("Run {}: ignoring compute status {} while {}", run.id(), target, run.status());
            }
            return null;
        }
        Instant now = clock.instant();
        Run current = run;
        for (RunStatus step : path) {
            current = step == target
                    ? RunTransitions.apply(current, step, detail, now)
                    : RunTransitions.apply(current, step, now);
        }
        return current;
    }

    private void announce(Run before, Run after) {
        Instant at = after.updatedAt();
        RunStatus from = before.status();
        for (RunStatus step : before.status().forwardPathTo(after.status())) {
            events.publish(new RunTransitionEvent(after.jobId(), after.id(), from, step, EVENT_SOURCE, at));
            from = step;
        }
        log.info("Run {}: {} -> {}", after.id(), before.status(), after.status());
    }

    private Run await(Future<Run> future, Run original) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return original;
        } catch (ExecutionException e) {
            log.error("Status refresh failed for run {}", original.id(), e.getCause());
            return original;
        }
    }
}
