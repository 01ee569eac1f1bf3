package org.gpsagents.frontier;

import org.gpsagents.frontier.config.FrontierConfig;
import org.gpsagents.frontier.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically releases items whose workers appear to have died.
 *
 * <p>The frontier never recovers stalled items on its own. Run one sweeper per frontier, in the process that
 * supervises the workers.</p>
 */
public class StallSweeper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StallSweeper.class);
    private final FrontierQueue frontier;
    private final Duration stallTimeout;
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("stall-sweeper"));
    private ScheduledFuture<?> sweepTask;

    public StallSweeper(FrontierQueue frontier, Duration stallTimeout) {
        if (stallTimeout.isNegative()) throw new IllegalArgumentException("stallTimeout must not be negative");
        this.frontier = frontier;
        this.stallTimeout = stallTimeout;
    }

    /**
     * Creates a sweeper with the configured timeout and starts it at the configured interval.
     */
    public static StallSweeper start(FrontierQueue frontier, FrontierConfig config) {
        var sweeper = new StallSweeper(frontier, config.stallTimeout());
        sweeper.start(config.sweepInterval());
        return sweeper;
    }

    public synchronized void start(Duration interval) {
        if (sweepTask != null) throw new IllegalStateException("Already started");
        long millis = interval.toMillis();
        if (millis <= 0) throw new IllegalArgumentException("interval must be positive");
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Sweeping for items stalled longer than {} every {}", stallTimeout, interval);
    }

    public synchronized void stop() {
        if (sweepTask == null) return;
        sweepTask.cancel(false);
        sweepTask = null;
    }

    public synchronized boolean isRunning() {
        return sweepTask != null;
    }

    /**
     * Runs one recovery pass.
     *
     * @return the number of items requeued, or -1 if the pass failed
     */
    int sweep() {
        try {
            return frontier.recoverStalled(stallTimeout);
        } catch (RuntimeException e) {
            // keep the schedule alive, the next pass retries
            log.error("Stall sweep failed", e);
            return -1;
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }
}
