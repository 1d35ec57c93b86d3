package promptbatch.engine.scheduler;

import promptbatch.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - DailyTrigger: checked periodically, fires once per run window
 * - Reconciler: resumes or finalizes stale jobs
 *
 * Uses a single-threaded executor; drivers run on their own pool.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final DailyTrigger trigger;
    private final Reconciler reconciler;
    private final EngineConfig config;

    private volatile boolean running = false;

    public Scheduler(DailyTrigger trigger, Reconciler reconciler, EngineConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "promptbatch-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.trigger = trigger;
        this.reconciler = reconciler;
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long triggerIntervalMs = config.triggerCheckInterval().toMillis();
        executor.scheduleAtFixedRate(
                wrapRunnable("daily-trigger", () -> trigger.trigger(false, "scheduler")),
                0,
                triggerIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Daily trigger checked every {}ms (window {})", triggerIntervalMs, trigger.window());

        long reconcileIntervalMs = config.reconcileInterval().toMillis();
        executor.scheduleAtFixedRate(
                reconciler,
                reconcileIntervalMs,
                reconcileIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Reconciler scheduled every {}ms", reconcileIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
