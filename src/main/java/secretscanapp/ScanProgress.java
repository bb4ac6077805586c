package secretscanapp;

/**
 * Progress snapshot sent as activity heartbeat details
 */
public class ScanProgress {
    private int percent;
    private String message;

    public ScanProgress() {
    }

    public ScanProgress(int percent, String message) {
        this.percent = percent;
        this.message = message;
    }

    public int getPercent() {
        return percent;
    }

    public void setPercent(int percent) {
        this.percent = percent;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    @Override
    public String toString() {
        return percent + "% " + message;
    }
}
