package secretscanapp;

import java.nio.file.Paths;

/**
 * Shared constants and configuration for the secret scanning application
 */
public interface Shared {
    // Task queue for secret scanning workflows and activities
    static final String SECRET_SCAN_TASK_QUEUE = "SECRET_SCAN_TASK_QUEUE";

    // Base directory for mirror clones (each job gets its own subdirectory), SCAN_WORKSPACE_DIR overrides
    static final String WORKSPACE_BASE_DIR = System.getenv("SCAN_WORKSPACE_DIR") != null
        ? System.getenv("SCAN_WORKSPACE_DIR")
        : Paths.get(System.getProperty("java.io.tmpdir"), "secret-scans").toString();

    // Files above this size are never read (1 MiB)
    static final long MAX_FILE_SIZE_BYTES = 1024L * 1024;

    // Git command deadlines
    static final int CLONE_TIMEOUT_SECONDS = 600; // 10 minutes for large repos
    static final int GIT_COMMAND_TIMEOUT_SECONDS = 300;

    // Activity timeouts
    static final int SCAN_TIMEOUT_SECONDS = 1800; // 30 minutes for a full-history scan

    // Remote API defaults
    static final String GITHUB_API_URL = "https://api.github.com";
    static final int REQUEST_TIMEOUT_SECONDS = 30;
    static final long REQUEST_INTERVAL_MILLIS = 100;

    // Finding rendering
    static final int MASK_VISIBLE_CHARS = 4;
    static final int COMMIT_ID_LENGTH = 8;
    static final int COMMIT_MESSAGE_MAX_LENGTH = 100;

    /**
     * Workflow ID for a scan
     */
    static String workflowIdForScan(String scanId) {
        return "secret-scan-" + scanId;
    }
}
