package secretscanapp;

/**
 * Exception thrown when the hosting API reports an exhausted request quota
 * Fatal for the scan job: the remaining calls would fail the same way.
 */
public class RateLimitedException extends RuntimeException {
    private final String requestUrl;
    private final long resetEpochSeconds; // -1 when the API did not say

    public RateLimitedException(String message, String requestUrl, long resetEpochSeconds) {
        super(message);
        this.requestUrl = requestUrl;
        this.resetEpochSeconds = resetEpochSeconds;
    }

    public String getRequestUrl() {
        return requestUrl;
    }

    public long getResetEpochSeconds() {
        return resetEpochSeconds;
    }
}
