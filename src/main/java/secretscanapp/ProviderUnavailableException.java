package secretscanapp;

/**
 * Exception thrown when the repository cannot be reached through its source provider
 * This includes clone failures, repositories that do not exist, authentication failures
 * and setup-time timeouts. Fatal for the scan job.
 */
public class ProviderUnavailableException extends RuntimeException {
    private final String repositoryUrl;
    private final String failureReason;

    public ProviderUnavailableException(String message, String repositoryUrl, String failureReason) {
        super(message);
        this.repositoryUrl = repositoryUrl;
        this.failureReason = failureReason;
    }

    public ProviderUnavailableException(String message, String repositoryUrl, String failureReason, Throwable cause) {
        super(message, cause);
        this.repositoryUrl = repositoryUrl;
        this.failureReason = failureReason;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
