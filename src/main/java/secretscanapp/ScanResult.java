package secretscanapp;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a completed secret scan: summary, findings ordered by severity, and the repository's web URL
 */
public class ScanResult {
    private ScanSummary summary;
    private List<Finding> findings;
    private String repoUrl;

    public ScanResult() {
        this.findings = new ArrayList<>();
    }

    public ScanResult(ScanSummary summary, List<Finding> findings, String repoUrl) {
        this.summary = summary;
        this.findings = new ArrayList<>(findings);
        this.repoUrl = repoUrl;
    }

    // Getters and Setters
    public ScanSummary getSummary() {
        return summary;
    }

    public void setSummary(ScanSummary summary) {
        this.summary = summary;
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public void setFindings(List<Finding> findings) {
        this.findings = findings;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public void setRepoUrl(String repoUrl) {
        this.repoUrl = repoUrl;
    }
}
