package promptbatch.engine.config;

import promptbatch.engine.api.internal.v1.DriveController;
import promptbatch.engine.api.internal.v1.TriggerController;
import promptbatch.engine.api.v1.HealthController;
import promptbatch.engine.api.v1.JobController;
import promptbatch.engine.api.v1.SchedulerController;
import promptbatch.engine.provider.ProviderRegistry;
import promptbatch.engine.repository.JobRepository;
import promptbatch.engine.repository.PromptCatalog;
import promptbatch.engine.repository.SchedulerRunRepository;
import promptbatch.engine.repository.TaskRepository;
import promptbatch.engine.scheduler.DailyTrigger;
import promptbatch.engine.scheduler.Reconciler;
import promptbatch.engine.scheduler.Scheduler;
import promptbatch.engine.server.BatchHttpServer;
import promptbatch.engine.server.RouterHandler;
import promptbatch.engine.service.DriverLauncher;
import promptbatch.engine.service.JobService;
import promptbatch.engine.service.ResponseHandoff;
import promptbatch.engine.service.RunRecorder;
import promptbatch.engine.service.TaskExecutor;
import promptbatch.engine.service.TaskMatrixBuilder;
import promptbatch.engine.store.Database;
import promptbatch.engine.store.JdbcJobRepository;
import promptbatch.engine.store.JdbcPromptCatalog;
import promptbatch.engine.store.JdbcSchedulerRunRepository;
import promptbatch.engine.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all engine components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(EngineConfig.fromEnv());
 * deps.startScheduler(); // daily trigger + reconciler
 * deps.httpServer().start();
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final TaskRepository taskRepository;
    private final PromptCatalog promptCatalog;
    private final SchedulerRunRepository schedulerRunRepository;
    private final ProviderRegistry providers;
    private final TaskExecutor taskExecutor;
    private final DriverLauncher driverLauncher;
    private final TaskMatrixBuilder matrixBuilder;
    private final RunRecorder runRecorder;
    private final DailyTrigger dailyTrigger;
    private final Reconciler reconciler;
    private final JobService jobService;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private Scheduler scheduler;
    private BatchHttpServer httpServer;

    private Dependencies(EngineConfig config, ProviderRegistry providers, ResponseHandoff handoff) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.taskRepository = new JdbcTaskRepository(database);
        this.promptCatalog = new JdbcPromptCatalog(database);
        this.schedulerRunRepository = new JdbcSchedulerRunRepository(database);

        // Execution
        this.providers = providers != null ? providers : ProviderRegistry.fromConfig(config);
        this.taskExecutor = new TaskExecutor(taskRepository, this.providers, handoff, config);
        this.matrixBuilder = new TaskMatrixBuilder(jobRepository, taskRepository, promptCatalog, config);
        this.driverLauncher = new DriverLauncher(jobRepository, taskRepository, promptCatalog, taskExecutor,
                matrixBuilder, config);

        // Scheduling
        this.runRecorder = new RunRecorder(schedulerRunRepository, config.clock());
        this.dailyTrigger = new DailyTrigger(jobRepository, promptCatalog, schedulerRunRepository, matrixBuilder,
                driverLauncher, runRecorder, config);
        this.reconciler = new Reconciler(jobRepository, taskRepository, promptCatalog, matrixBuilder,
                driverLauncher, runRecorder, config);

        this.jobService = new JobService(jobRepository, taskRepository, schedulerRunRepository, driverLauncher,
                config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and HTTP provider adapters.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, null, ResponseHandoff.none());
    }

    /**
     * Create dependencies with custom provider adapters and response handoff.
     */
    public static Dependencies create(EngineConfig config, ProviderRegistry providers, ResponseHandoff handoff) {
        return new Dependencies(config, providers, handoff);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public PromptCatalog promptCatalog() {
        return promptCatalog;
    }

    public SchedulerRunRepository schedulerRunRepository() {
        return schedulerRunRepository;
    }

    public ProviderRegistry providers() {
        return providers;
    }

    public DriverLauncher driverLauncher() {
        return driverLauncher;
    }

    public TaskMatrixBuilder matrixBuilder() {
        return matrixBuilder;
    }

    public DailyTrigger dailyTrigger() {
        return dailyTrigger;
    }

    public Reconciler reconciler() {
        return reconciler;
    }

    public JobService jobService() {
        return jobService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, jobService))
                    .registerController(new JobController(jobService))
                    .registerController(new SchedulerController(jobService))
                    .registerController(new TriggerController(dailyTrigger, reconciler))
                    .registerController(new DriveController(jobService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public synchronized BatchHttpServer httpServer() {
        if (httpServer == null) {
            httpServer = new BatchHttpServer(routerHandler(), config.serverHost(), config.serverPort());
        }
        return httpServer;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(dailyTrigger, reconciler, config);
        }
        return scheduler;
    }

    /**
     * Start the daily trigger checks and the reconciler sweeps.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public synchronized void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Shutting down dependencies...");
        synchronized (this) {
            if (httpServer != null) {
                httpServer.stop();
            }
        }
        stopScheduler();
        driverLauncher.close();
        taskExecutor.close();
        database.close();
        log.info("Dependencies shut down");
    }
}
