package secretscanapp;

/**
 * Sink for scan progress. Percentages handed to a reporter never decrease within one scan.
 */
@FunctionalInterface
public interface ProgressReporter {

    void report(int percent, String message);

    /**
     * Reporter that drops every update
     */
    static ProgressReporter noop() {
        return (percent, message) -> { };
    }
}
