package secretscanapp;

/**
 * Writes progress into a job's snapshot in the store
 */
class JobProgressReporter implements ProgressReporter {
    private final ScanJobStore store;
    private final String jobId;

    JobProgressReporter(ScanJobStore store, String jobId) {
        this.store = store;
        this.jobId = jobId;
    }

    @Override
    public void report(int percent, String message) {
        store.update(jobId, job -> job.withProgress(percent, message));
    }
}
