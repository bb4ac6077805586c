package secretscanapp;

/**
 * Exception thrown at a file or commit boundary once a scan has been cancelled
 */
public class ScanCancelledException extends RuntimeException {

    public ScanCancelledException(String message) {
        super(message);
    }
}
