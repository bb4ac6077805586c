package secretscanapp;

/**
 * Uncompiled detection rule as it appears in the pattern catalog
 */
public class PatternDefinition {
    private final String name;
    private final String regex;
    private final Severity severity;

    public PatternDefinition(String name, String regex, Severity severity) {
        this.name = name;
        this.regex = regex;
        this.severity = severity;
    }

    public String getName() {
        return name;
    }

    public String getRegex() {
        return regex;
    }

    public Severity getSeverity() {
        return severity;
    }
}
