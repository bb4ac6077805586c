package secretscanapp;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Counts over the findings of one scan
 *
 * Invariant: total equals the number of findings and the severity counts add up to it.
 */
public class ScanSummary {
    private int total;
    private int critical;
    private int high;
    private int medium;
    private int low;
    private int commitsScanned;
    private int branchesScanned;
    private int filesScanned;
    private List<String> secretTypes; // Sorted distinct rule names

    public ScanSummary() {
        this.secretTypes = new ArrayList<>();
    }

    /**
     * Summarize a list of findings together with the traversal counters
     */
    public static ScanSummary from(List<Finding> findings, int commitsScanned, int branchesScanned,
                                   int filesScanned) {
        ScanSummary summary = new ScanSummary();
        TreeSet<String> types = new TreeSet<>();
        for (Finding finding : findings) {
            types.add(finding.getSecretType());
            switch (finding.getSeverity()) {
                case CRITICAL:
                    summary.critical++;
                    break;
                case HIGH:
                    summary.high++;
                    break;
                case MEDIUM:
                    summary.medium++;
                    break;
                case LOW:
                    summary.low++;
                    break;
            }
        }
        summary.total = findings.size();
        summary.commitsScanned = commitsScanned;
        summary.branchesScanned = branchesScanned;
        summary.filesScanned = filesScanned;
        summary.secretTypes = new ArrayList<>(types);
        return summary;
    }

    // Getters and Setters
    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }

    public int getCritical() {
        return critical;
    }

    public void setCritical(int critical) {
        this.critical = critical;
    }

    public int getHigh() {
        return high;
    }

    public void setHigh(int high) {
        this.high = high;
    }

    public int getMedium() {
        return medium;
    }

    public void setMedium(int medium) {
        this.medium = medium;
    }

    public int getLow() {
        return low;
    }

    public void setLow(int low) {
        this.low = low;
    }

    public int getCommitsScanned() {
        return commitsScanned;
    }

    public void setCommitsScanned(int commitsScanned) {
        this.commitsScanned = commitsScanned;
    }

    public int getBranchesScanned() {
        return branchesScanned;
    }

    public void setBranchesScanned(int branchesScanned) {
        this.branchesScanned = branchesScanned;
    }

    public int getFilesScanned() {
        return filesScanned;
    }

    public void setFilesScanned(int filesScanned) {
        this.filesScanned = filesScanned;
    }

    public List<String> getSecretTypes() {
        return secretTypes;
    }

    public void setSecretTypes(List<String> secretTypes) {
        this.secretTypes = secretTypes;
    }
}
