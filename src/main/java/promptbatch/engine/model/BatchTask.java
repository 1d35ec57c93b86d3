package promptbatch.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one (prompt, provider) execution unit of a job.
 */
public final class BatchTask {
    private final String id;
    private final String jobId;
    private final String orgId;
    private final String promptId;
    private final String provider;
    private final TaskStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final String lastError;
    private final String errorKind;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String model;
    private final String rawResponse;
    private final Integer tokensIn;
    private final Integer tokensOut;
    private final Long runtimeMs;

    private BatchTask(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.promptId = Objects.requireNonNull(builder.promptId, "promptId is required");
        this.provider = Objects.requireNonNull(builder.provider, "provider is required");
        this.id = builder.id != null ? builder.id : key().taskId();
        this.orgId = builder.orgId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.lastError = builder.lastError;
        this.errorKind = builder.errorKind;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.model = builder.model;
        this.rawResponse = builder.rawResponse;
        this.tokensIn = builder.tokensIn;
        this.tokensOut = builder.tokensOut;
        this.runtimeMs = builder.runtimeMs;
    }

    public String id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public String orgId() {
        return orgId;
    }

    public String promptId() {
        return promptId;
    }

    public String provider() {
        return provider;
    }

    public TaskStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String lastError() {
        return lastError;
    }

    public String errorKind() {
        return errorKind;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String model() {
        return model;
    }

    public String rawResponse() {
        return rawResponse;
    }

    public Integer tokensIn() {
        return tokensIn;
    }

    public Integer tokensOut() {
        return tokensOut;
    }

    public Long runtimeMs() {
        return runtimeMs;
    }

    public TaskKey key() {
        return new TaskKey(jobId, promptId, provider);
    }

    /** Check if task can be retried after the current attempt */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .orgId(orgId)
                .promptId(promptId)
                .provider(provider)
                .status(status)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .lastError(lastError)
                .errorKind(errorKind)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .model(model)
                .rawResponse(rawResponse)
                .tokensIn(tokensIn)
                .tokensOut(tokensOut)
                .runtimeMs(runtimeMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobId;
        private String orgId;
        private String promptId;
        private String provider;
        private TaskStatus status = TaskStatus.PENDING;
        private int attempts = 0;
        private int maxAttempts = 3;
        private String lastError;
        private String errorKind;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private String model;
        private String rawResponse;
        private Integer tokensIn;
        private Integer tokensOut;
        private Long runtimeMs;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder promptId(String promptId) {
            this.promptId = promptId;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder errorKind(String errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder rawResponse(String rawResponse) {
            this.rawResponse = rawResponse;
            return this;
        }

        public Builder tokensIn(Integer tokensIn) {
            this.tokensIn = tokensIn;
            return this;
        }

        public Builder tokensOut(Integer tokensOut) {
            this.tokensOut = tokensOut;
            return this;
        }

        public Builder runtimeMs(Long runtimeMs) {
            this.runtimeMs = runtimeMs;
            return this;
        }

        public BatchTask build() {
            return new BatchTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BatchTask task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "BatchTask{" + key() + ", status=" + status + ", attempts=" + attempts + "}";
    }
}
