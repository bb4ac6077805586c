package secretscanapp;

import java.util.Objects;

/**
 * A single exposed secret. Immutable once created.
 *
 * Two findings are duplicates when they share file path, line number, secret type
 * and masked preview; see {@link #dedupKey()}.
 */
public final class Finding {
    private String filePath;
    private int lineNumber;
    private String secretType;
    private String maskedPreview;
    private String rawValue;
    private String commitId;
    private String author;
    private String timestamp;
    private String commitMessage;
    private String branch;
    private Severity severity;
    private double entropy;

    // Used by the Temporal data converter
    private Finding() {
    }

    /**
     * Build a finding for a pattern match. Severity is copied from the originating rule.
     */
    public static Finding of(FindingSource source, int lineNumber, SecretPattern pattern, String value) {
        Finding finding = new Finding();
        finding.filePath = source.getFilePath();
        finding.lineNumber = lineNumber;
        finding.secretType = pattern.getName();
        finding.maskedPreview = SecretMasker.mask(value);
        finding.rawValue = value;
        finding.commitId = source.getCommitId();
        finding.author = source.getAuthor();
        finding.timestamp = source.getTimestamp();
        finding.commitMessage = source.getCommitMessage();
        finding.branch = source.getBranch();
        finding.severity = pattern.getSeverity();
        finding.entropy = Math.round(EntropyScorer.entropy(value) * 100.0) / 100.0;
        return finding;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getSecretType() {
        return secretType;
    }

    public String getMaskedPreview() {
        return maskedPreview;
    }

    public String getRawValue() {
        return rawValue;
    }

    public String getCommitId() {
        return commitId;
    }

    public String getAuthor() {
        return author;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getCommitMessage() {
        return commitMessage;
    }

    public String getBranch() {
        return branch;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getEntropy() {
        return entropy;
    }

    /**
     * Uniqueness key used by the {@link Deduplicator}
     */
    DedupKey dedupKey() {
        return new DedupKey(filePath, lineNumber, secretType, maskedPreview);
    }

    @Override
    public String toString() {
        return severity.getId() + " " + secretType + " at " + filePath + ":" + lineNumber
            + " (" + commitId + ", " + maskedPreview + ")";
    }

    static final class DedupKey {
        private final String filePath;
        private final int lineNumber;
        private final String secretType;
        private final String maskedPreview;

        DedupKey(String filePath, int lineNumber, String secretType, String maskedPreview) {
            this.filePath = filePath;
            this.lineNumber = lineNumber;
            this.secretType = secretType;
            this.maskedPreview = maskedPreview;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DedupKey)) {
                return false;
            }
            DedupKey other = (DedupKey) o;
            return lineNumber == other.lineNumber
                && Objects.equals(filePath, other.filePath)
                && Objects.equals(secretType, other.secretType)
                && Objects.equals(maskedPreview, other.maskedPreview);
        }

        @Override
        public int hashCode() {
            return Objects.hash(filePath, lineNumber, secretType, maskedPreview);
        }
    }
}
