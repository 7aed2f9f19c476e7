package simrun.coordinator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes run events to the {@code simrun.events} logger.
 */
public class LoggingRunEventListener implements RunEventListener {

    private static final Logger log = LoggerFactory.getLogger("simrun.events");

    @Override
    public void onTransition(RunTransitionEvent event) {
        log.info("run={} job={} {} -> {} ({})", event.runId(), event.jobId(), event.from(), event.to(),
                event.source());
    }

    @Override
    public void onRetryExhausted(RetryExhaustedEvent event) {
        log.warn("run={} job={} status query failed {} times, keeping {}: {}", event.runId(), event.jobId(),
                event.attempts(), event.status(), event.reason());
    }
}
