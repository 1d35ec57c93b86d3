package promptbatch.engine.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one batch run for one organization in one
 * run window. Counters are only ever moved forward by the store.
 */
public final class BatchJob {
    private final String id;
    private final String orgId;
    private final String runKey; // yyyy-MM-dd in the run-window zone
    private final JobStatus status;
    private final int totalTasks;
    private final int completedTasks;
    private final int failedTasks;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final Instant matrixBuiltAt;
    private final boolean driverActive;
    private final String driverId;
    private final Instant driverLastPing;
    private final int runCount;
    private final String triggerSource;
    private final String errorMessage;

    private BatchJob(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.orgId = Objects.requireNonNull(builder.orgId, "orgId is required");
        this.runKey = Objects.requireNonNull(builder.runKey, "runKey is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.totalTasks = builder.totalTasks;
        this.completedTasks = builder.completedTasks;
        this.failedTasks = builder.failedTasks;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.matrixBuiltAt = builder.matrixBuiltAt;
        this.driverActive = builder.driverActive;
        this.driverId = builder.driverId;
        this.driverLastPing = builder.driverLastPing;
        this.runCount = builder.runCount;
        this.triggerSource = builder.triggerSource;
        this.errorMessage = builder.errorMessage;
    }

    public String id() {
        return id;
    }

    public String orgId() {
        return orgId;
    }

    public String runKey() {
        return runKey;
    }

    public JobStatus status() {
        return status;
    }

    public int totalTasks() {
        return totalTasks;
    }

    public int completedTasks() {
        return completedTasks;
    }

    public int failedTasks() {
        return failedTasks;
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

    public Instant matrixBuiltAt() {
        return matrixBuiltAt;
    }

    public boolean driverActive() {
        return driverActive;
    }

    public String driverId() {
        return driverId;
    }

    public Instant driverLastPing() {
        return driverLastPing;
    }

    public int runCount() {
        return runCount;
    }

    public String triggerSource() {
        return triggerSource;
    }

    public String errorMessage() {
        return errorMessage;
    }

    /** Tasks that reached COMPLETED or FAILED */
    public int processedTasks() {
        return completedTasks + failedTasks;
    }

    /** Calculate progress percentage */
    public int progressPercent() {
        if (totalTasks == 0)
            return isMatrixBuilt() ? 100 : 0;
        return processedTasks() * 100 / totalTasks;
    }

    public boolean isMatrixBuilt() {
        return matrixBuiltAt != null;
    }

    /** Matrix built and every task accounted for by the counters */
    public boolean isDrained() {
        return isMatrixBuilt() && processedTasks() >= totalTasks;
    }

    /** Check if job is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .orgId(orgId)
                .runKey(runKey)
                .status(status)
                .totalTasks(totalTasks)
                .completedTasks(completedTasks)
                .failedTasks(failedTasks)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .matrixBuiltAt(matrixBuiltAt)
                .driverActive(driverActive)
                .driverId(driverId)
                .driverLastPing(driverLastPing)
                .runCount(runCount)
                .triggerSource(triggerSource)
                .errorMessage(errorMessage);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String orgId;
        private String runKey;
        private JobStatus status = JobStatus.PENDING;
        private int totalTasks;
        private int completedTasks;
        private int failedTasks;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private Instant matrixBuiltAt;
        private boolean driverActive;
        private String driverId;
        private Instant driverLastPing;
        private int runCount;
        private String triggerSource;
        private String errorMessage;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder runKey(String runKey) {
            this.runKey = runKey;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder totalTasks(int totalTasks) {
            this.totalTasks = totalTasks;
            return this;
        }

        public Builder completedTasks(int completedTasks) {
            this.completedTasks = completedTasks;
            return this;
        }

        public Builder failedTasks(int failedTasks) {
            this.failedTasks = failedTasks;
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

        public Builder matrixBuiltAt(Instant matrixBuiltAt) {
            this.matrixBuiltAt = matrixBuiltAt;
            return this;
        }

        public Builder driverActive(boolean driverActive) {
            this.driverActive = driverActive;
            return this;
        }

        public Builder driverId(String driverId) {
            this.driverId = driverId;
            return this;
        }

        public Builder driverLastPing(Instant driverLastPing) {
            this.driverLastPing = driverLastPing;
            return this;
        }

        public Builder runCount(int runCount) {
            this.runCount = runCount;
            return this;
        }

        public Builder triggerSource(String triggerSource) {
            this.triggerSource = triggerSource;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public BatchJob build() {
            return new BatchJob(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BatchJob job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "BatchJob{id='" + id + "', org='" + orgId + "', status=" + status
                + ", progress=" + processedTasks() + "/" + totalTasks + "}";
    }
}
