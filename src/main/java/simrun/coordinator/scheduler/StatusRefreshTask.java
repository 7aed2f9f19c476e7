package simrun.coordinator.scheduler;

import simrun.coordinator.model.Run;
import simrun.coordinator.repository.RunRepository;
import simrun.coordinator.service.RunStatusSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Background task that pulls compute status for every active run.
 * <p>
 * Each tick loads up to {@code batchSize} non-terminal runs that have a compute
 * handle, least recently polled first, stamps them as polled and hands them to the
 * synchronizer. The stamp moves whether or not the status changes.
 */
public class StatusRefreshTask implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StatusRefreshTask.class);

    private final RunRepository runRepository;
    private final RunStatusSynchronizer synchronizer;
    private final int batchSize;

    public StatusRefreshTask(RunRepository runRepository, RunStatusSynchronizer synchronizer, int batchSize) {
        this.runRepository = runRepository;
        this.synchronizer = synchronizer;
        this.batchSize = batchSize;
    }

    @Override
    public void run() {
        try {
            refreshActiveRuns();
        } catch (Exception e) {
            log.error("Status refresh error", e);
        }
    }

    /**
     * @return number of runs whose status changed
     */
    public int refreshActiveRuns() {
        List<Run> active = runRepository.findActiveWithHandle(batchSize);
        if (active.isEmpty()) {
            log.debug("No active runs to refresh");
            return 0;
        }

        runRepository.markPolled(active.stream().map(Run::id).toList(), Instant.now());
        List<Run> refreshed = synchronizer.refresh(active);
        int changed = 0;
        for (int i = 0; i < active.size(); i++) {
            if (refreshed.get(i).status() != active.get(i).status()) {
                changed++;
            }
        }
        if (active.size() == batchSize) {
            log.info("Refresh batch full ({} runs), remaining runs are polled on later ticks", batchSize);
        }
        return changed;
    }
}
