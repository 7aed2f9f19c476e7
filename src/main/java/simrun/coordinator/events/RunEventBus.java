package simrun.coordinator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Fire-and-forget delivery of run events to registered listeners.
 * <p>
 * Publishing hands the event to a single background thread and returns at once.
 * A listener that throws is logged and does not affect other listeners or the publisher.
 * Pending events are held in a bounded queue; when it is full, new events are dropped.
 */
public final class RunEventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunEventBus.class);

    static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private final CopyOnWriteArrayList<RunEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ThreadPoolExecutor executor;

    public RunEventBus() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * @param queueCapacity events waiting for delivery; further events are dropped
     */
    public RunEventBus(int queueCapacity) {
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "simrun-events");
                    t.setDaemon(true);
                    return t;
                },
                (task, pool) -> log.debug(pool.isShutdown()
                        ? "Event bus closed, dropping event"
                        : "Event queue full, dropping event"));
    }

    public RunEventBus subscribe(RunEventListener listener) {
        listeners.add(listener);
        return this;
    }

    public void unsubscribe(RunEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(RunTransitionEvent event) {
        dispatch(listener -> listener.onTransition(event));
    }

    public void publish(RetryExhaustedEvent event) {
        dispatch(listener -> listener.onRetryExhausted(event));
    }

    private void dispatch(Consumer<RunEventListener> delivery) {
        if (listeners.isEmpty()) {
            return;
        }
        executor.execute(() -> {
            for (RunEventListener listener : listeners) {
                try {
                    delivery.accept(listener);
                } catch (RuntimeException e) {
                    log.warn("Event listener {} failed", listener.getClass().getSimpleName(), e);
                }
            }
        });
    }

    /**
     * Deliver pending events, waiting at most a few seconds, then stop.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Event bus forcefully stopped");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
