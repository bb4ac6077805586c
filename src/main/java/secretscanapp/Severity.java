package secretscanapp;

import com.google.gson.annotations.SerializedName;

/**
 * Severity tiers of detection rules, ordered from most to least urgent
 */
public enum Severity {
    @SerializedName("critical")
    CRITICAL("critical", 0),

    @SerializedName("high")
    HIGH("high", 1),

    @SerializedName("medium")
    MEDIUM("medium", 2),

    @SerializedName("low")
    LOW("low", 3);

    private final String id;
    private final int rank;

    Severity(String id, int rank) {
        this.id = id;
        this.rank = rank;
    }

    public String getId() {
        return id;
    }

    public int getRank() {
        return rank;
    }
}
