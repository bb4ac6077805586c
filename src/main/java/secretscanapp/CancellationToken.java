package secretscanapp;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through the orchestrator and every provider call
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * A token nobody will cancel
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws ScanCancelledException if {@link #cancel()} has been called
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new ScanCancelledException("Scan cancelled");
        }
    }
}
