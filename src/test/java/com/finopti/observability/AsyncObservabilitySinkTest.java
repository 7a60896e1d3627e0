package com.finopti.observability;

import com.finopti.support.RecordingSink;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncObservabilitySinkTest {

    private static ObservabilityEvent event(String name) {
        return ObservabilityEvent.builder("test", name).outcome("success").build();
    }

    @Test
    void deliversEventsToDelegate() {
        RecordingSink delegate = new RecordingSink();
        AsyncObservabilitySink sink = new AsyncObservabilitySink(delegate);

        sink.publish(event("one"));
        sink.publish(event("two"));
        sink.close();

        assertEquals(2, delegate.getEvents().size());
        assertEquals("one", delegate.getEvents().get(0).getEvent());
    }

    @Test
    void dropsWhenQueueIsFullInsteadOfBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch busy = new CountDownLatch(1);
        AsyncObservabilitySink sink = new AsyncObservabilitySink(e -> {
            busy.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, 1);

        sink.publish(event("first"));
        assertTrue(busy.await(5, TimeUnit.SECONDS));
        sink.publish(event("queued"));
        sink.publish(event("dropped"));

        assertEquals(1, sink.getDroppedCount());
        release.countDown();
        sink.close();
    }

    @Test
    void failingDelegateIsContained() {
        AsyncObservabilitySink sink = new AsyncObservabilitySink(e -> {
            throw new IllegalStateException("collector offline");
        });

        assertDoesNotThrow(() -> sink.publish(event("x")));
        sink.close();
    }

    @Test
    void publishAfterCloseIsDropped() {
        AsyncObservabilitySink sink = new AsyncObservabilitySink(new RecordingSink());
        sink.close();

        assertDoesNotThrow(() -> sink.publish(event("late")));
        assertEquals(1, sink.getDroppedCount());
    }
}
