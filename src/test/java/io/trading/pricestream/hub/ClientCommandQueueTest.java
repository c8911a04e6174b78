package io.trading.pricestream.hub;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ClientCommandQueueTest {

    private final ExecutorService workers = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    void testCommandsRunInSubmissionOrder() throws Exception {
        ClientCommandQueue queue = new ClientCommandQueue(workers);
        List<Integer> ran = new CopyOnWriteArrayList<>();

        for (int i = 0; i < 100; i++) {
            int n = i;
            queue.submit("hub-1", () -> ran.add(n));
        }

        queue.drained().get(2, TimeUnit.SECONDS);
        for (int i = 0; i < 100; i++) {
            assertEquals(i, ran.get(i));
        }
    }

    @Test
    void testFailedCommandDoesNotStopLaterOnes() throws Exception {
        ClientCommandQueue queue = new ClientCommandQueue(workers);
        List<String> ran = new CopyOnWriteArrayList<>();

        queue.submit("hub-1", () -> {
            throw new IllegalStateException("registry unavailable");
        });
        queue.submit("hub-1", () -> ran.add("unsubscribeAll"));

        queue.drained().get(2, TimeUnit.SECONDS);
        assertEquals(List.of("unsubscribeAll"), ran);
    }

    @Test
    void testCleanupRunsAfterWorkerPoolShutdown() throws Exception {
        ClientCommandQueue queue = new ClientCommandQueue(workers);
        List<String> ran = new CopyOnWriteArrayList<>();
        workers.shutdown();
        assertTrue(workers.awaitTermination(1, TimeUnit.SECONDS));

        queue.submit("hub-1", () -> ran.add("unsubscribeAll"));

        assertEquals(List.of("unsubscribeAll"), ran);
        assertFalse(queue.drained().isCompletedExceptionally());
    }
}
