package secretscanapp;

/**
 * Traversal modes supported by the scanner.
 * Each mode fixes the progress budget of its setup and finalize phases.
 */
public enum ScanMode {
    /**
     * Mirror clone of the repository: every branch, deep history
     */
    LOCAL("local", "Full-history scan of a local mirror clone", 10, 90),

    /**
     * Hosting provider REST API: default or selected branch, recent history only
     */
    REMOTE("remote", "Bounded scan through the GitHub REST API", 15, 95);

    private final String id;
    private final String description;
    private final int setupEndPercent;
    private final int finalizeStartPercent;

    ScanMode(String id, String description, int setupEndPercent, int finalizeStartPercent) {
        this.id = id;
        this.description = description;
        this.setupEndPercent = setupEndPercent;
        this.finalizeStartPercent = finalizeStartPercent;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public int getSetupEndPercent() {
        return setupEndPercent;
    }

    public int getFinalizeStartPercent() {
        return finalizeStartPercent;
    }
}
