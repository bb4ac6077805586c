package secretscanapp;

import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.CanceledFailure;
import io.temporal.failure.TimeoutFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;

/**
 * Implementation of the secret scanning workflow
 * Clones a mirror (local mode), scans it, and always cleans the workspace up afterwards
 *
 * A failed scan does not fail the workflow: the returned job carries status FAILED and the message.
 */
public class SecretScanWorkflowImpl implements SecretScanWorkflow {
    private static final Logger logger = Workflow.getLogger(SecretScanWorkflowImpl.class);

    // Failures that would repeat on every attempt
    private static final String[] NON_RETRYABLE = {
        ProviderUnavailableException.class.getName(),
        RateLimitedException.class.getName(),
        ScanCancelledException.class.getName(),
        InvalidRepositoryUrlException.class.getName()
    };

    private final RetryOptions retryOptions = RetryOptions.newBuilder()
        .setInitialInterval(Duration.ofSeconds(5))
        .setMaximumInterval(Duration.ofSeconds(60))
        .setBackoffCoefficient(2.0)
        .setMaximumAttempts(3)
        .setDoNotRetry(NON_RETRYABLE)
        .build();

    private final ActivityOptions repositoryActivityOptions = ActivityOptions.newBuilder()
        .setRetryOptions(retryOptions)
        .setStartToCloseTimeout(Duration.ofSeconds(Shared.CLONE_TIMEOUT_SECONDS + 60))
        .setHeartbeatTimeout(Duration.ofSeconds(30))
        .build();

    private final RepositoryActivity repositoryActivity =
        Workflow.newActivityStub(RepositoryActivity.class, repositoryActivityOptions);

    private ScanJob job;

    private ActivityOptions createScanActivityOptions(int timeoutSeconds) {
        return ActivityOptions.newBuilder()
            .setRetryOptions(retryOptions)
            .setStartToCloseTimeout(Duration.ofSeconds(timeoutSeconds))
            .setHeartbeatTimeout(Duration.ofSeconds(60))
            .build();
    }

    @Override
    public ScanJob scan(ScanRequest request) {
        String createdAt = Instant.ofEpochMilli(Workflow.currentTimeMillis()).toString();
        job = ScanJob.pending(request.getScanId(), request.getRepositoryUrl(), request.getMode(), createdAt)
            .start("Starting scan...");

        ScanConfig config = request.effectiveConfig();
        int timeoutSeconds = config.getScanTimeoutSeconds() != null
            ? config.getScanTimeoutSeconds()
            : Shared.SCAN_TIMEOUT_SECONDS;
        SecretScanActivity scanActivity =
            Workflow.newActivityStub(SecretScanActivity.class, createScanActivityOptions(timeoutSeconds));

        boolean local = request.getMode() == ScanMode.LOCAL;
        try {
            String mirrorPath = null;
            if (local) {
                job = job.withProgress(0, "Cloning repository...");
                mirrorPath = repositoryActivity.cloneMirror(request);
                job = job.withProgress(ScanMode.LOCAL.getSetupEndPercent() / 2, "Repository cloned, scanning...");
            } else {
                job = job.withProgress(0, "Scanning repository through the GitHub API...");
            }

            ScanResult result = scanActivity.scanRepository(request, mirrorPath);
            job = job.complete(result, "Scan completed! Found " + result.getSummary().getTotal()
                + " secrets in " + result.getSummary().getCommitsScanned() + " commits");
            logger.info("Scan {} completed with {} findings", request.getScanId(), result.getSummary().getTotal());

        } catch (ActivityFailure e) {
            String message = failureMessage(e);
            logger.warn("Scan {} failed: {}", request.getScanId(), message);
            job = job.fail(message);

        } finally {
            // Temporary clones never outlive the scan
            if (local && request.getWorkspacePath() != null) {
                try {
                    repositoryActivity.cleanupWorkspace(request.getWorkspacePath());
                } catch (ActivityFailure e) {
                    logger.warn("Cleanup of {} failed: {}", request.getWorkspacePath(), failureMessage(e));
                }
            }
        }
        return job;
    }

    @Override
    public ScanJob getStatus() {
        return job;
    }

    private static String failureMessage(ActivityFailure failure) {
        Throwable cause = failure.getCause();
        if (cause instanceof ApplicationFailure) {
            return ((ApplicationFailure) cause).getOriginalMessage();
        }
        if (cause instanceof TimeoutFailure) {
            return "Scan timed out";
        }
        if (cause instanceof CanceledFailure) {
            return "Scan cancelled";
        }
        return cause != null ? cause.getMessage() : failure.getMessage();
    }
}
