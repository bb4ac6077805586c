package secretscanapp;

import java.util.regex.Pattern;

/**
 * Compiled detection rule. Instances only exist for regexes that compiled successfully.
 */
public final class SecretPattern {
    private final String name;
    private final Pattern pattern;
    private final Severity severity;

    SecretPattern(String name, Pattern pattern, Severity severity) {
        this.name = name;
        this.pattern = pattern;
        this.severity = severity;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return name + " [" + severity.getId() + "]";
    }
}
