package secretscanapp;

import java.util.HashMap;
import java.util.Map;

/**
 * Shannon entropy of matched values, used as a triage signal only
 */
public final class EntropyScorer {

    private EntropyScorer() {
    }

    /**
     * H = -sum(p * log2(p)) over the distinct characters of the string.
     * Returns 0 for an empty string.
     */
    public static double entropy(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }

        Map<Integer, Integer> counts = new HashMap<>();
        value.codePoints().forEach(cp -> counts.merge(cp, 1, Integer::sum));

        double length = value.codePointCount(0, value.length());
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }
}
