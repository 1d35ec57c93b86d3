package promptbatch.engine.service;

import promptbatch.engine.config.EngineConfig;
import promptbatch.engine.model.BatchTask;
import promptbatch.engine.model.TaskCompleteResult;
import promptbatch.engine.model.TaskFailResult;
import promptbatch.engine.provider.ProviderAdapter;
import promptbatch.engine.provider.ProviderErrorKind;
import promptbatch.engine.provider.ProviderException;
import promptbatch.engine.provider.ProviderRegistry;
import promptbatch.engine.provider.ProviderResponse;
import promptbatch.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task: one provider call for one prompt, with a bounded timeout, and records
 * the outcome. Never retries by itself and never completes exceptionally, so one task
 * cannot disturb the others of its slice.
 */
public class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final String PROMPT_MISSING = "PROMPT_MISSING";

    private final TaskRepository taskRepository;
    private final ProviderRegistry providers;
    private final ResponseHandoff handoff;
    private final EngineConfig config;
    private final ExecutorService callPool;
    private final ExecutorService handoffPool;

    public TaskExecutor(TaskRepository taskRepository, ProviderRegistry providers, ResponseHandoff handoff,
            EngineConfig config) {
        this.taskRepository = taskRepository;
        this.providers = providers;
        this.handoff = handoff;
        this.config = config;
        this.callPool = Executors.newFixedThreadPool(config.providerCallThreads(), named("promptbatch-call-"));
        this.handoffPool = Executors.newSingleThreadExecutor(named("promptbatch-handoff-"));
    }

    /**
     * Start a task. The future completes once the outcome is recorded, or once the
     * call timeout expires (the late answer is then ignored).
     *
     * @param task       a dispatched task
     * @param promptText prompt text, null if the prompt no longer exists
     * @return outcome, never completes exceptionally
     */
    public CompletableFuture<TaskOutcome> submit(BatchTask task, String promptText) {
        if (promptText == null) {
            return CompletableFuture.completedFuture(
                    recordFailure(task, null, PROMPT_MISSING, "Prompt " + task.promptId() + " not found", false));
        }

        Optional<ProviderAdapter> adapter = providers.find(task.provider());
        if (adapter.isEmpty()) {
            return CompletableFuture.completedFuture(recordFailure(task, ProviderErrorKind.NOT_CONFIGURED,
                    ProviderErrorKind.NOT_CONFIGURED.name(), "Unknown provider: " + task.provider(), false));
        }

        Duration timeout = config.providerTimeout();
        long startNanos = System.nanoTime();

        return CompletableFuture
                .supplyAsync(() -> call(adapter.get(), promptText, timeout), callPool)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    long runtimeMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
                    try {
                        if (error == null) {
                            return recordSuccess(task, response, runtimeMs);
                        }
                        return recordError(task, unwrap(error), timeout);
                    } catch (RuntimeException e) {
                        log.error("Failed to record outcome of task {}", task.key(), e);
                        return TaskOutcome.discarded(task, "store error: " + e.getMessage());
                    }
                });
    }

    /**
     * Run a task and wait for its outcome.
     */
    public TaskOutcome execute(BatchTask task, String promptText) {
        return submit(task, promptText).join();
    }

    private static ProviderResponse call(ProviderAdapter adapter, String promptText, Duration timeout) {
        try {
            return adapter.complete(promptText, timeout);
        } catch (ProviderException e) {
            throw new CompletionException(e);
        }
    }

    private TaskOutcome recordSuccess(BatchTask task, ProviderResponse response, long runtimeMs) {
        String model = response.model() != null ? response.model() : task.provider();
        TaskCompleteResult result = taskRepository.completeIdempotent(task.id(), model, response.text(),
                response.tokensIn(), response.tokensOut(), runtimeMs, config.clock().instant());

        switch (result) {
            case COMPLETED -> {
                log.debug("Task {} completed in {} ms", task.key(), runtimeMs);
                handOff(task, response);
                return TaskOutcome.completed(task);
            }
            case ALREADY_TERMINAL -> {
                return TaskOutcome.discarded(task, "task already terminal");
            }
            case JOB_TERMINAL -> {
                return TaskOutcome.discarded(task, "job already terminal");
            }
            default -> {
                log.warn("Task {} vanished before completion was recorded", task.key());
                return TaskOutcome.discarded(task, "task not found");
            }
        }
    }

    private TaskOutcome recordError(BatchTask task, Throwable error, Duration timeout) {
        if (error instanceof ProviderException pe) {
            return recordFailure(task, pe.kind(), pe.kind().name(), pe.getMessage(), pe.retriable());
        }
        if (error instanceof TimeoutException) {
            return recordFailure(task, ProviderErrorKind.TIMEOUT, ProviderErrorKind.TIMEOUT.name(),
                    task.provider() + " did not answer within " + timeout.toMillis() + " ms", true);
        }
        log.warn("Unexpected error calling {} for task {}", task.provider(), task.key(), error);
        return recordFailure(task, ProviderErrorKind.NETWORK, ProviderErrorKind.NETWORK.name(),
                String.valueOf(error), true);
    }

    private TaskOutcome recordFailure(BatchTask task, ProviderErrorKind kind, String errorKind, String message,
            boolean retriable) {
        TaskFailResult result = taskRepository.failIdempotent(task.id(), errorKind, message, retriable,
                config.clock().instant());

        return switch (result) {
            case RETRIED -> {
                log.debug("Task {} failed ({}), back to pending: {}", task.key(), errorKind, message);
                yield new TaskOutcome(task, TaskOutcome.Status.RETRY_SCHEDULED, kind, message);
            }
            case FAILED -> {
                log.info("Task {} failed permanently ({}): {}", task.key(), errorKind, message);
                yield new TaskOutcome(task, TaskOutcome.Status.FAILED, kind, message);
            }
            case ALREADY_TERMINAL, JOB_TERMINAL, NOT_FOUND ->
                new TaskOutcome(task, TaskOutcome.Status.DISCARDED, kind, result.name());
        };
    }

    private void handOff(BatchTask task, ProviderResponse response) {
        handoffPool.execute(() -> {
            try {
                handoff.accept(task.key(), response);
            } catch (Exception e) {
                log.warn("Response hand-off failed for task {}: {}", task.key(), e.getMessage(), e);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static java.util.concurrent.ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        callPool.shutdownNow();
        handoffPool.shutdown();
        try {
            if (!handoffPool.awaitTermination(5, TimeUnit.SECONDS)) {
                handoffPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            handoffPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
