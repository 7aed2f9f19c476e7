package simrun.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives {@link StatusRefreshTask} on one daemon thread.
 * <p>
 * Ticks use a fixed delay, so a slow refresh pushes the next one back rather than
 * piling up. Manual refreshes run on the same thread and never overlap a tick.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StatusRefreshTask refreshTask;
    private final Duration interval;

    private ScheduledFuture<?> ticks;

    public Scheduler(StatusRefreshTask refreshTask, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Refresh interval must be positive: " + interval);
        }
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "simrun-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.refreshTask = refreshTask;
        this.interval = interval;
    }

    public synchronized void start() {
        if (ticks != null) {
            log.warn("Status refresh already scheduled");
            return;
        }
        ticks = executor.scheduleWithFixedDelay(refreshTask, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
        log.info("Status refresh scheduled every {}ms", interval.toMillis());
    }

    /**
     * Queue one refresh right away, behind any tick in progress.
     *
     * @return number of runs whose status changed
     */
    public Future<Integer> refreshNow() {
        return executor.submit(refreshTask::refreshActiveRuns);
    }

    public synchronized boolean isRunning() {
        return ticks != null;
    }

    /**
     * Cancel future ticks and wait up to five seconds for a running one.
     */
    public synchronized void stop() {
        if (executor.isShutdown()) {
            return;
        }
        if (ticks != null) {
            ticks.cancel(false);
            ticks = null;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Status refresh still busy after 5s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
