package io.surfworks.warden.license;

import io.surfworks.warden.license.engine.EngineWatcher;
import io.surfworks.warden.license.engine.LicenseEvent;
import io.surfworks.warden.license.metrics.MetricsSink;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background monitor for the engine's license events.
 *
 * <p>Obtained from {@link LicenseWatcher#start()}. Two threads are owned:
 * <ul>
 *   <li>{@code license-monitor} handles engine events one at a time, in order</li>
 *   <li>{@code license-metrics} publishes the expiration gauge every second</li>
 * </ul>
 *
 * <p>Engine errors (expiration, termination) are only logged. A license
 * that stops validating never stops the server; it only empties
 * {@link LicenseWatcher#features()}.
 *
 * <p>{@link #cancel()} is the only way the loop ends. Events still queued
 * when cancellation is observed are not handled. On exit the engine watcher
 * is stopped exactly once.
 */
public final class LicenseMonitor implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LicenseMonitor.class.getName());

    /**
     * Gauge key for the license expiration time, in Unix seconds.
     */
    public static final List<String> EXPIRATION_GAUGE = List.of("license", "expiration_time_epoch");

    static final Duration METRICS_INTERVAL = Duration.ofSeconds(1);

    private final LicenseWatcher watcher;
    private final EngineWatcher engineWatcher;
    private final MetricsSink metricsSink;
    private final Clock clock;

    private final AtomicBoolean engineStopped = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean cancelled;
    private volatile Thread loopThread;
    private volatile ScheduledExecutorService metricsTicker;

    LicenseMonitor(LicenseWatcher watcher, EngineWatcher engineWatcher, MetricsSink metricsSink, Clock clock) {
        this.watcher = watcher;
        this.engineWatcher = engineWatcher;
        this.metricsSink = metricsSink;
        this.clock = clock;
    }

    void start() {
        ScheduledExecutorService ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "license-metrics");
            t.setDaemon(true);
            return t;
        });
        long millis = METRICS_INTERVAL.toMillis();
        ticker.scheduleAtFixedRate(this::emitMetrics, millis, millis, TimeUnit.MILLISECONDS);
        metricsTicker = ticker;

        Thread thread = new Thread(this::run, "license-monitor");
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();
        LOG.fine("License monitor started");
    }

    /**
     * Request shutdown. Safe to call more than once and from any thread.
     */
    public void cancel() {
        cancelled = true;
        Thread thread = loopThread;
        if (thread != null) {
            thread.interrupt();
        }
    }

    @Override
    public void close() {
        cancel();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * True while the monitor thread has been started and not yet exited.
     */
    public boolean isRunning() {
        return loopThread != null && terminated.getCount() > 0;
    }

    /**
     * Wait for the loop to exit after {@link #cancel()}.
     *
     * @return true if the loop exited within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * The event loop. Runs on the monitor thread; exits only on cancellation.
     */
    void run() {
        BlockingQueue<LicenseEvent> events = engineWatcher.events();
        try {
            while (!cancelled) {
                LicenseEvent event;
                try {
                    event = events.take();
                } catch (InterruptedException e) {
                    cancelled = true;
                    Thread.currentThread().interrupt();
                    break;
                }
                // Cancellation wins over an event dequeued at the same time
                if (cancelled) {
                    break;
                }
                handle(event);
            }
        } finally {
            stopEngineWatcher();
            ScheduledExecutorService ticker = metricsTicker;
            if (ticker != null) {
                ticker.shutdownNow();
            }
            terminated.countDown();
            LOG.fine("License monitor stopped");
        }
    }

    void handle(LicenseEvent event) {
        try {
            if (event instanceof LicenseEvent.Updated) {
                if (cancelled) {
                    return;
                }
                LOG.fine("received update from license manager");
            } else if (event instanceof LicenseEvent.Failed failed) {
                // Logged only: a terminated license must not take the server down
                LOG.log(Level.SEVERE, "license expired, please update license", failed.error());
            } else if (event instanceof LicenseEvent.ExpiringSoon warning) {
                Duration timeLeft = Duration.between(clock.instant(), warning.expirationTime())
                    .truncatedTo(ChronoUnit.SECONDS);
                LOG.warning("license expiring, time left: " + timeLeft);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to handle license event " + event, e);
        }
    }

    void emitMetrics() {
        if (cancelled) {
            return;
        }
        try {
            long expiration = watcher.currentLicense().expirationTime().getEpochSecond();
            metricsSink.setGauge(EXPIRATION_GAUGE, expiration);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to emit license metrics", e);
        }
    }

    private void stopEngineWatcher() {
        if (engineStopped.compareAndSet(false, true)) {
            try {
                engineWatcher.stop();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Failed to stop license engine watcher", e);
            }
        }
    }
}
