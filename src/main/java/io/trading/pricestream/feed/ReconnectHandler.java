package io.trading.pricestream.feed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Control thread of one connector: runs transport event handling off the I/O
 * thread and schedules reconnection attempts according to a {@link ReconnectPolicy}.
 */
public class ReconnectHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectHandler.class);

    private static final long TERMINATION_TIMEOUT_MS = 5000;

    private final String name;
    private final ReconnectPolicy policy;
    private final Runnable connectAction;
    private final Runnable exhaustedAction;

    private ScheduledExecutorService scheduler;
    private int retryCount = 0;
    private Duration currentDelay;
    private volatile boolean running = false;

    /**
     * Creates a new reconnect handler.
     *
     * @param name            Friendly name for logging and the thread name
     * @param policy          Delay and retry cap
     * @param connectAction   Reconnection attempt; throws on failure
     * @param exhaustedAction Called once when the retry cap is reached
     */
    public ReconnectHandler(String name, ReconnectPolicy policy, Runnable connectAction, Runnable exhaustedAction) {
        this.name = name;
        this.policy = policy;
        this.connectAction = connectAction;
        this.exhaustedAction = exhaustedAction;
        this.currentDelay = policy.initialDelay();
    }

    /**
     * Starts the handler. No-op if already running.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-feed-control");
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.debug("{}: Reconnect handler started", name);
    }

    /**
     * Stops the handler, cancels pending attempts and waits for a running one to finish.
     */
    public void stop() {
        ExecutorService toStop;
        synchronized (this) {
            running = false;
            toStop = scheduler;
            scheduler = null;
            retryCount = 0;
            currentDelay = policy.initialDelay();
        }
        if (toStop == null) {
            return;
        }
        toStop.shutdownNow();
        try {
            if (!toStop.awaitTermination(TERMINATION_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{}: Control thread did not terminate within {} ms", name, TERMINATION_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.debug("{}: Reconnect handler stopped", name);
    }

    /**
     * Runs a task on the control thread.
     *
     * @return false if the handler is not running
     */
    public synchronized boolean execute(Runnable task) {
        if (!running) {
            return false;
        }
        try {
            scheduler.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            LOGGER.debug("{}: Control task rejected, handler stopping", name);
            return false;
        }
    }

    /**
     * Schedules a reconnection attempt after the current delay.
     *
     * @return false if the retry cap is reached or the handler is not running
     */
    public boolean scheduleReconnect() {
        synchronized (this) {
            if (!running) {
                LOGGER.warn("{}: Reconnect handler not running", name);
                return false;
            }
            if (policy.allowsAttempt(retryCount)) {
                retryCount++;
                long delayMs = currentDelay.toMillis();
                LOGGER.info("{}: Scheduling reconnect attempt {} in {} ms", name, retryCount, delayMs);
                scheduler.schedule(this::attemptReconnect, delayMs, TimeUnit.MILLISECONDS);
                return true;
            }
        }

        // outside the monitor: the action takes the connector's lock
        LOGGER.error("{}: Max reconnect retries ({}) reached, giving up", name, policy.maxRetries());
        exhaustedAction.run();
        return false;
    }

    private void attemptReconnect() {
        if (!running) {
            return;
        }
        try {
            LOGGER.info("{}: Attempting reconnection #{}", name, getRetryCount());
            connectAction.run();
        } catch (RuntimeException e) {
            LOGGER.error("{}: Reconnect attempt failed: {}", name, e.getMessage());
            synchronized (this) {
                currentDelay = policy.nextDelay(currentDelay);
            }
            scheduleReconnect();
        }
    }

    /**
     * Resets the retry state (called on successful connection).
     */
    public synchronized void reset() {
        retryCount = 0;
        currentDelay = policy.initialDelay();
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }
}
