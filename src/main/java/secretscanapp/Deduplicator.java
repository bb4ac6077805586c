package secretscanapp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-scan set of findings. The first finding seen for a key is retained, later ones are dropped.
 * Not thread-safe; one instance belongs to one scan.
 */
public class Deduplicator {
    private final Set<Finding.DedupKey> seen = new HashSet<>();
    private final List<Finding> retained = new ArrayList<>();

    /**
     * @return true if the finding was new and is retained, false if it duplicated an earlier one
     */
    public boolean add(Finding finding) {
        if (!seen.add(finding.dedupKey())) {
            return false;
        }
        retained.add(finding);
        return true;
    }

    /**
     * Retained findings in discovery order
     */
    public List<Finding> findings() {
        return Collections.unmodifiableList(retained);
    }

    public int size() {
        return retained.size();
    }
}
