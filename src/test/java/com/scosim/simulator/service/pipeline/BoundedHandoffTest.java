package com.scosim.simulator.service.pipeline;

import com.scosim.simulator.service.pipeline.BoundedHandoff.OfferOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BoundedHandoffTest {

    @Test
    void testOffer_FullQueueDropsWithinTimeout() {
        BoundedHandoff<String> queue = new BoundedHandoff<>("test", 2, Duration.ofMillis(50));
        assertEquals(OfferOutcome.ACCEPTED, queue.offer("a"));
        assertEquals(OfferOutcome.ACCEPTED, queue.offer("b"));

        long start = System.nanoTime();
        OfferOutcome outcome = queue.offer("c");
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(OfferOutcome.DROPPED, outcome);
        assertTrue(elapsedMillis >= 40, "waited " + elapsedMillis + "ms");
        assertTrue(elapsedMillis < 2000, "waited " + elapsedMillis + "ms");
        assertEquals(2, queue.size());
    }

    @Test
    void testCapacityNeverGrows() {
        BoundedHandoff<Integer> queue = new BoundedHandoff<>("test", 3, Duration.ZERO);
        int dropped = 0;
        for (int i = 0; i < 10; i++) {
            if (queue.offer(i) == OfferOutcome.DROPPED) {
                dropped++;
            }
        }
        assertEquals(3, queue.size());
        assertEquals(3, queue.capacity());
        assertEquals(7, dropped);
    }

    @Test
    void testFifoOrder() throws InterruptedException {
        BoundedHandoff<Integer> queue = new BoundedHandoff<>("test", 5, Duration.ZERO);
        for (int i = 0; i < 5; i++) {
            queue.offer(i);
        }
        for (int i = 0; i < 5; i++) {
            assertEquals(i, queue.poll(Duration.ofMillis(10)));
        }
        assertNull(queue.poll(Duration.ofMillis(10)));
    }

    @Test
    void testOffer_SucceedsWhenConsumerFreesSpace() throws Exception {
        BoundedHandoff<String> queue = new BoundedHandoff<>("test", 1, Duration.ofSeconds(5));
        queue.offer("first");

        CompletableFuture<OfferOutcome> pending = CompletableFuture.supplyAsync(() -> queue.offer("second"));
        assertEquals("first", queue.poll(Duration.ofSeconds(1)));

        assertEquals(OfferOutcome.ACCEPTED, pending.get(5, TimeUnit.SECONDS));
        assertEquals("second", queue.poll(Duration.ofSeconds(1)));
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedHandoff<>("test", 0, Duration.ZERO));
    }
}
