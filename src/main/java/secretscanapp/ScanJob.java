package secretscanapp;

/**
 * Immutable snapshot of a scan job. Every state change produces a new snapshot, so a reader
 * always sees progress, message and result that belong together.
 *
 * Once completed or failed, a job no longer changes.
 */
public final class ScanJob {
    private String id;
    private ScanStatus status;
    private int progress;
    private String message;
    private ScanResult result;
    private String error;
    private String repoUrl;
    private ScanMode mode;
    private String createdAt; // ISO-8601 instant

    // Used by the Temporal data converter
    private ScanJob() {
    }

    private ScanJob(ScanJob other) {
        this.id = other.id;
        this.status = other.status;
        this.progress = other.progress;
        this.message = other.message;
        this.result = other.result;
        this.error = other.error;
        this.repoUrl = other.repoUrl;
        this.mode = other.mode;
        this.createdAt = other.createdAt;
    }

    /**
     * A freshly created job that has not started yet
     */
    public static ScanJob pending(String id, String repoUrl, ScanMode mode, String createdAt) {
        ScanJob job = new ScanJob();
        job.id = id;
        job.status = ScanStatus.PENDING;
        job.progress = 0;
        job.message = "Scan queued";
        job.repoUrl = repoUrl;
        job.mode = mode;
        job.createdAt = createdAt;
        return job;
    }

    public ScanJob start(String message) {
        if (status.isTerminal()) {
            return this;
        }
        ScanJob next = new ScanJob(this);
        next.status = ScanStatus.RUNNING;
        next.message = message;
        return next;
    }

    /**
     * Progress update. A lower percentage than the current one keeps the current value.
     */
    public ScanJob withProgress(int percent, String message) {
        if (status.isTerminal()) {
            return this;
        }
        ScanJob next = new ScanJob(this);
        next.status = ScanStatus.RUNNING;
        next.progress = Math.max(progress, Math.min(100, Math.max(0, percent)));
        next.message = message;
        return next;
    }

    public ScanJob complete(ScanResult result, String message) {
        if (status.isTerminal()) {
            return this;
        }
        ScanJob next = new ScanJob(this);
        next.status = ScanStatus.COMPLETED;
        next.progress = 100;
        next.message = message;
        next.result = result;
        return next;
    }

    public ScanJob fail(String error) {
        if (status.isTerminal()) {
            return this;
        }
        ScanJob next = new ScanJob(this);
        next.status = ScanStatus.FAILED;
        next.message = error;
        next.error = error;
        return next;
    }

    public String getId() {
        return id;
    }

    public ScanStatus getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public String getMessage() {
        return message;
    }

    public ScanResult getResult() {
        return result;
    }

    public String getError() {
        return error;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public ScanMode getMode() {
        return mode;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "ScanJob{" + id + ", " + status.getId() + ", " + progress + "%, " + message + "}";
    }
}
