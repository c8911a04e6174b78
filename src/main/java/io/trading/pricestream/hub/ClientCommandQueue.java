package io.trading.pricestream.hub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one hub client's commands in arrival order on a shared worker pool.
 *
 * A failed task is logged and does not stop later ones. Once the pool rejects work
 * (gateway shutdown) tasks run on the submitting thread, so the disconnect cleanup of a
 * client is never lost.
 */
final class ClientCommandQueue {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientCommandQueue.class);

    private final Executor workers;
    // only touched on the client's event loop
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    ClientCommandQueue(Executor workers) {
        this.workers = workers;
    }

    /**
     * Queues a task behind every task submitted before it.
     *
     * @param clientId Client the task belongs to, for logging
     */
    void submit(String clientId, Runnable task) {
        tail = tail.thenRunAsync(task, command -> execute(clientId, command))
            .exceptionally(error -> {
                LOGGER.error("[Hub] Command for {} failed", clientId, error);
                return null;
            });
    }

    /**
     * Completes when every task submitted so far has run.
     */
    CompletableFuture<Void> drained() {
        return tail;
    }

    private void execute(String clientId, Runnable command) {
        try {
            workers.execute(command);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("[Hub] Worker pool is shut down, running inline for {}", clientId);
            command.run();
        }
    }
}
