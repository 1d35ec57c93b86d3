package promptbatch.engine.service;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.repository.JobRepository;
import promptbatch.engine.repository.PromptCatalog;
import promptbatch.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts drivers on a bounded pool, at most one per job within this process.
 * Jobs of different organizations run independently.
 */
public class DriverLauncher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DriverLauncher.class);

    private final JobRepository jobRepository;
    private final TaskRepository taskRepository;
    private final PromptCatalog catalog;
    private final TaskExecutor executor;
    private final TaskMatrixBuilder matrixBuilder;
    private final EngineConfig config;
    private final ExecutorService pool;
    private final Map<String, Future<BatchDriver.Result>> running = new ConcurrentHashMap<>();

    public DriverLauncher(JobRepository jobRepository, TaskRepository taskRepository, PromptCatalog catalog,
            TaskExecutor executor, TaskMatrixBuilder matrixBuilder, EngineConfig config) {
        this.jobRepository = jobRepository;
        this.taskRepository = taskRepository;
        this.catalog = catalog;
        this.executor = executor;
        this.matrixBuilder = matrixBuilder;
        this.config = config;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(config.driverThreads(), r -> {
            Thread t = new Thread(r, "promptbatch-driver-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start a driver for the job in the background.
     *
     * @return false if a driver for this job is already running in this process
     */
    public boolean launch(String jobId) {
        running.values().removeIf(Future::isDone);
        boolean[] started = { false };
        running.compute(jobId, (id, existing) -> {
            if (existing != null && !existing.isDone()) {
                return existing;
            }
            started[0] = true;
            return pool.submit(() -> runDriver(id));
        });
        if (!started[0]) {
            log.debug("Driver for job {} already running locally", jobId);
        }
        return started[0];
    }

    /**
     * Run a driver on the calling thread.
     */
    public BatchDriver.Result runNow(String jobId) {
        return newDriver(jobId).run();
    }

    public boolean isRunning(String jobId) {
        Future<BatchDriver.Result> f = running.get(jobId);
        return f != null && !f.isDone();
    }

    public int activeCount() {
        int n = 0;
        for (Future<BatchDriver.Result> f : running.values()) {
            if (!f.isDone()) {
                n++;
            }
        }
        return n;
    }

    /**
     * Wait until every launched driver has returned.
     *
     * @return results of the drivers that finished, in no particular order
     */
    public List<BatchDriver.Result> awaitIdle(Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<BatchDriver.Result> results = new ArrayList<>();
        for (Map.Entry<String, Future<BatchDriver.Result>> e : running.entrySet()) {
            long left = deadline - System.nanoTime();
            try {
                results.add(e.getValue().get(Math.max(0, left), TimeUnit.NANOSECONDS));
            } catch (ExecutionException ex) {
                log.warn("Driver for job {} ended with an error: {}", e.getKey(), ex.getCause().toString());
            }
            running.remove(e.getKey(), e.getValue());
        }
        return results;
    }

    private BatchDriver newDriver(String jobId) {
        return new BatchDriver(jobId, jobRepository, taskRepository, catalog, executor, matrixBuilder, config);
    }

    private BatchDriver.Result runDriver(String jobId) {
        BatchDriver driver = newDriver(jobId);
        try {
            BatchDriver.Result result = driver.run();
            log.info("Driver {} on job {} ended: {} ({} slices, {} tasks dispatched)",
                    driver.driverId(), jobId, result.outcome(), result.slices(), result.dispatched());
            return result;
        } catch (RuntimeException e) {
            log.error("Driver {} on job {} crashed; the reconciler will resume it", driver.driverId(), jobId, e);
            throw e;
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Drivers still running at shutdown; their jobs will be resumed by the reconciler");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
