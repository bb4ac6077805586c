package secretscanapp;

/**
 * Exception thrown when a repository URL is malformed or not supported by the requested mode
 * Raised synchronously, before a scan job is created.
 */
public class InvalidRepositoryUrlException extends IllegalArgumentException {
    private final String repositoryUrl;

    public InvalidRepositoryUrlException(String message, String repositoryUrl) {
        super(message);
        this.repositoryUrl = repositoryUrl;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }
}
