package secretscanapp;

import io.temporal.activity.ActivityExecutionContext;

/**
 * Publishes scan progress as activity heartbeat details
 */
class HeartbeatProgressReporter implements ProgressReporter {
    private final ActivityExecutionContext context;
    private volatile ScanProgress last = new ScanProgress(0, "Starting scan...");

    HeartbeatProgressReporter(ActivityExecutionContext context) {
        this.context = context;
    }

    @Override
    public void report(int percent, String message) {
        last = new ScanProgress(percent, message);
        context.heartbeat(last);
    }

    /**
     * Repeat the latest progress, keeping the activity alive during long git commands
     */
    void beat() {
        context.heartbeat(last);
    }
}
