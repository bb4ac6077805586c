package secretscanapp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts added lines from unified diff text.
 *
 * Hunk headers are tracked so that every added line keeps its line number in the new file
 * and so that a content line starting with "+++" inside a hunk is not mistaken for a file header.
 * Removed lines never produce output.
 */
public final class PatchParser {
    private static final Pattern HUNK_HEADER =
        Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@");
    private static final String DEV_NULL = "/dev/null";

    private PatchParser() {
    }

    /**
     * Parse the patch of a single file, as returned by hosting APIs (hunks only, no file headers)
     */
    public static List<AddedLine> parseFilePatch(String patch) {
        if (patch == null || patch.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, List<AddedLine>> byFile = parse(patch, "");
        List<AddedLine> lines = byFile.get("");
        return lines == null ? Collections.emptyList() : lines;
    }

    /**
     * Parse multi-file output of {@code git diff}. Files without added lines are omitted.
     */
    public static List<FileDiff> parseUnifiedDiff(String diff) {
        List<FileDiff> result = new ArrayList<>();
        if (diff == null || diff.isEmpty()) {
            return result;
        }
        for (Map.Entry<String, List<AddedLine>> entry : parse(diff, null).entrySet()) {
            result.add(new FileDiff(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private static Map<String, List<AddedLine>> parse(String text, String defaultPath) {
        Map<String, List<AddedLine>> byFile = new LinkedHashMap<>();
        String currentPath = defaultPath;
        int oldRemaining = 0;
        int newRemaining = 0;
        int newLine = 0;

        for (String line : text.split("\n", -1)) {
            if (oldRemaining > 0 || newRemaining > 0) {
                if (line.isEmpty()) {
                    // Context line whose leading space was stripped
                    oldRemaining = Math.max(0, oldRemaining - 1);
                    newRemaining = Math.max(0, newRemaining - 1);
                    newLine++;
                    continue;
                }
                char marker = line.charAt(0);
                if (marker == '+') {
                    if (currentPath != null) {
                        byFile.computeIfAbsent(currentPath, k -> new ArrayList<>())
                            .add(new AddedLine(newLine, line.substring(1)));
                    }
                    newLine++;
                    newRemaining = Math.max(0, newRemaining - 1);
                    continue;
                }
                if (marker == '-') {
                    oldRemaining = Math.max(0, oldRemaining - 1);
                    continue;
                }
                if (marker == ' ') {
                    oldRemaining = Math.max(0, oldRemaining - 1);
                    newRemaining = Math.max(0, newRemaining - 1);
                    newLine++;
                    continue;
                }
                if (marker == '\\') {
                    continue;
                }
                // Truncated hunk; treat the line as a header
                oldRemaining = 0;
                newRemaining = 0;
            }

            if (line.startsWith("diff --git ")) {
                int idx = line.lastIndexOf(" b/");
                currentPath = idx >= 0 ? line.substring(idx + 3) : null;
            } else if (line.startsWith("+++ ")) {
                currentPath = headerPath(line.substring(4));
            } else if (line.startsWith("@@")) {
                Matcher matcher = HUNK_HEADER.matcher(line);
                if (matcher.find()) {
                    oldRemaining = count(matcher.group(2));
                    newLine = Integer.parseInt(matcher.group(3));
                    newRemaining = count(matcher.group(4));
                }
            }
        }
        return byFile;
    }

    private static String headerPath(String value) {
        int tab = value.indexOf('\t');
        if (tab >= 0) {
            value = value.substring(0, tab);
        }
        if (DEV_NULL.equals(value)) {
            return null;
        }
        if (value.startsWith("b/")) {
            return value.substring(2);
        }
        return value;
    }

    private static int count(String group) {
        return group == null ? 1 : Integer.parseInt(group);
    }
}
