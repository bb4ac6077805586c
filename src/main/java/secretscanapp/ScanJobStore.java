package secretscanapp;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-wide map of scan jobs. Entries are immutable snapshots replaced atomically per key.
 */
public class ScanJobStore {
    private final Map<String, ScanJob> jobs = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if a job with the same id already exists
     */
    public ScanJob create(ScanJob job) {
        ScanJob existing = jobs.putIfAbsent(job.getId(), job);
        if (existing != null) {
            throw new IllegalStateException("Scan job already exists: " + job.getId());
        }
        return job;
    }

    public Optional<ScanJob> get(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Apply a transition to a job; unknown ids are ignored
     *
     * @return the new snapshot, or empty if no such job exists
     */
    public Optional<ScanJob> update(String id, UnaryOperator<ScanJob> transition) {
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, job) -> transition.apply(job)));
    }

    /**
     * Remove finished jobs created before the cutoff
     *
     * @return number of jobs removed
     */
    public int purgeFinishedBefore(Instant cutoff) {
        int removed = 0;
        for (Map.Entry<String, ScanJob> entry : jobs.entrySet()) {
            ScanJob job = entry.getValue();
            if (job.getStatus().isTerminal() && Instant.parse(job.getCreatedAt()).isBefore(cutoff)
                    && jobs.remove(entry.getKey(), job)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return jobs.size();
    }
}
