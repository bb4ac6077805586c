package secretscanapp;

import java.nio.file.Paths;
import java.util.UUID;

/**
 * Request object containing all information needed to perform a secret scan
 *
 * Workflow ID format: secret-scan-{scanId}
 */
public class ScanRequest {
    private String scanId; // 12 hex characters, unique per request
    private String repositoryUrl;
    private ScanMode mode;
    private String branch; // Remote mode only: branch to scan (null = default branch)
    private String workspacePath; // Mirror clone location for local mode
    private ScanConfig scanConfig;

    public ScanRequest() {
    }

    public ScanRequest(String repositoryUrl, ScanMode mode, String branch) {
        this.repositoryUrl = repositoryUrl;
        this.mode = mode;
        this.branch = branch;
        this.scanId = generateScanId();
        this.scanConfig = new ScanConfig();
        this.workspacePath = Paths.get(scanConfig.getWorkspaceBaseDir(), scanId).toString();
    }

    private static String generateScanId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * Generate workflow ID from the scan ID
     */
    public String generateWorkflowId() {
        if (scanId == null) {
            throw new IllegalStateException("Cannot generate workflow ID: scanId must be set");
        }
        return Shared.workflowIdForScan(scanId);
    }

    /**
     * Configuration of this request, falling back to defaults
     */
    public ScanConfig effectiveConfig() {
        return scanConfig != null ? scanConfig : new ScanConfig();
    }

    // Getters and Setters
    public String getScanId() {
        return scanId;
    }

    public void setScanId(String scanId) {
        this.scanId = scanId;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public void setRepositoryUrl(String repositoryUrl) {
        this.repositoryUrl = repositoryUrl;
    }

    public ScanMode getMode() {
        return mode;
    }

    public void setMode(ScanMode mode) {
        this.mode = mode;
    }

    public String getBranch() {
        return branch;
    }

    public void setBranch(String branch) {
        this.branch = branch;
    }

    public String getWorkspacePath() {
        return workspacePath;
    }

    public void setWorkspacePath(String workspacePath) {
        this.workspacePath = workspacePath;
    }

    public ScanConfig getScanConfig() {
        return scanConfig;
    }

    /**
     * Replaces the configuration; the workspace path follows the configured base directory
     */
    public void setScanConfig(ScanConfig scanConfig) {
        this.scanConfig = scanConfig;
        if (scanConfig != null && scanId != null && scanConfig.getWorkspaceBaseDir() != null) {
            this.workspacePath = Paths.get(scanConfig.getWorkspaceBaseDir(), scanId).toString();
        }
    }
}
