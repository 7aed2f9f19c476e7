package simrun.coordinator.events;

import simrun.coordinator.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RunEventBusTest {

    private static RunTransitionEvent transition(long runId) {
        return new RunTransitionEvent(123, runId, RunStatus.QUEUED, RunStatus.RUNNING, "sync", Instant.now());
    }

    @Test
    void deliversToAllListenersInOrder() {
        RecordingRunEventListener listener = new RecordingRunEventListener();
        RunEventBus bus = new RunEventBus().subscribe(listener);

        bus.publish(transition(1));
        bus.publish(transition(2));
        bus.publish(new RetryExhaustedEvent(123, 3, RunStatus.RUNNING, 3, "throttled", Instant.now()));
        bus.close();

        assertEquals(2, listener.transitions().size());
        assertEquals(1, listener.transitions().get(0).runId());
        assertEquals(2, listener.transitions().get(1).runId());
        assertEquals(1, listener.exhausted().size());
        assertEquals(3, listener.exhausted().get(0).attempts());
    }

    @Test
    void failingListenerDoesNotAffectOthers() {
        RecordingRunEventListener listener = new RecordingRunEventListener();
        RunEventBus bus = new RunEventBus()
                .subscribe(new RunEventListener() {
                    @Override
                    public void onTransition(RunTransitionEvent event) {
                        throw new IllegalStateException("listener broken");
                    }
                })
                .subscribe(listener);

        assertDoesNotThrow(() -> bus.publish(transition(1)));
        bus.close();

        assertEquals(1, listener.transitions().size());
    }

    @Test
    void unsubscribedListenerReceivesNothing() {
        RecordingRunEventListener listener = new RecordingRunEventListener();
        RunEventBus bus = new RunEventBus().subscribe(listener);

        bus.unsubscribe(listener);
        bus.publish(transition(1));
        bus.close();

        assertTrue(listener.transitions().isEmpty());
    }

    @Test
    void publishAfterCloseIsDropped() {
        RecordingRunEventListener listener = new RecordingRunEventListener();
        RunEventBus bus = new RunEventBus().subscribe(listener);
        bus.close();

        assertDoesNotThrow(() -> bus.publish(transition(1)));
        assertTrue(listener.transitions().isEmpty());
    }

    @Test
    void slowListenerCausesDropsInsteadOfGrowth() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger delivered = new AtomicInteger();
        RunEventBus bus = new RunEventBus(2).subscribe(new RunEventListener() {
            @Override
            public void onTransition(RunTransitionEvent event) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                delivered.incrementAndGet();
            }
        });

        assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            for (int i = 1; i <= 10; i++) {
                bus.publish(transition(i));
            }
        });
        release.countDown();
        bus.close();

        // one in delivery, two queued, the rest dropped
        assertEquals(3, delivered.get());
    }
}
