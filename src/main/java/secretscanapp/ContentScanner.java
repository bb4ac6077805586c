package secretscanapp;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Runs every detection rule over every line of a text and emits one raw finding per match
 */
public class ContentScanner {
    private final PatternRegistry registry;

    public ContentScanner(PatternRegistry registry) {
        this.registry = registry;
    }

    /**
     * Scan a whole file; line numbers start at 1
     */
    public List<Finding> scanContent(String content, FindingSource source) {
        List<Finding> findings = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return findings;
        }
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            scanLine(lines[i], i + 1, source, findings);
        }
        return findings;
    }

    /**
     * Scan the added lines of one file in a commit, keeping their new-file line numbers
     */
    public List<Finding> scanAddedLines(List<AddedLine> lines, FindingSource source) {
        List<Finding> findings = new ArrayList<>();
        for (AddedLine line : lines) {
            scanLine(line.getContent(), line.getLineNumber(), source, findings);
        }
        return findings;
    }

    private void scanLine(String line, int lineNumber, FindingSource source, List<Finding> findings) {
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        if (line.isEmpty()) {
            return;
        }
        for (SecretPattern pattern : registry) {
            Matcher matcher = pattern.getPattern().matcher(line);
            while (matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                findings.add(Finding.of(source, lineNumber, pattern, matcher.group()));
            }
        }
    }
}
