package secretscanapp;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a repository path is passed to pattern matching.
 * Deny rules win over allow rules.
 */
public class FileFilter {
    // Git treats content with a NUL byte in the first 8000 bytes as binary
    private static final int BINARY_PROBE_LENGTH = 8000;

    private final Set<String> allowedExtensions;
    private final Set<String> allowedFileNames;
    private final Set<String> deniedExtensions;
    private final Set<String> deniedDirectories;
    private final long maxFileSizeBytes;

    public FileFilter(FileFilterConfig config) {
        this.allowedExtensions = lowerCase(config.getAllowedExtensions());
        this.allowedFileNames = lowerCase(config.getAllowedFileNames());
        this.deniedExtensions = lowerCase(config.getDeniedExtensions());
        this.deniedDirectories = lowerCase(config.getDeniedDirectories());
        this.maxFileSizeBytes = config.getMaxFileSizeBytes();
    }

    /**
     * Full check for a file of a tree or a commit: path rules plus the size ceiling
     */
    public boolean accepts(String path, long sizeBytes) {
        if (sizeBytes > maxFileSizeBytes) {
            return false;
        }
        return acceptsPath(path);
    }

    /**
     * Path rules only: deny-listed directories and extensions, then the allow-lists
     */
    public boolean acceptsPath(String path) {
        if (isDenied(path)) {
            return false;
        }
        String name = fileName(path).toLowerCase(Locale.ROOT);
        return allowedFileNames.contains(name) || allowedExtensions.contains(extension(name));
    }

    /**
     * Deny-list check: dependency directories and binary extensions
     */
    public boolean isDenied(String path) {
        String[] segments = path.split("/");
        for (int i = 0; i < segments.length - 1; i++) {
            if (deniedDirectories.contains(segments[i].toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        String name = fileName(path).toLowerCase(Locale.ROOT);
        return deniedExtensions.contains(extension(name));
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    /**
     * True when the content looks binary (NUL byte near the start)
     */
    public static boolean isBinary(byte[] content) {
        int limit = Math.min(content.length, BINARY_PROBE_LENGTH);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1);
    }

    private static Set<String> lowerCase(Iterable<String> values) {
        Set<String> result = new HashSet<>();
        if (values != null) {
            for (String value : values) {
                result.add(value.toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
