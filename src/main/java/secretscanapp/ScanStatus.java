package secretscanapp;

import com.google.gson.annotations.SerializedName;

/**
 * Lifecycle of a scan job: pending, running, then completed or failed
 */
public enum ScanStatus {
    @SerializedName("pending")
    PENDING("pending"),

    @SerializedName("running")
    RUNNING("running"),

    @SerializedName("completed")
    COMPLETED("completed"),

    @SerializedName("failed")
    FAILED("failed");

    private final String id;

    ScanStatus(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
