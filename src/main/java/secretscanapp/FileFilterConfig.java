package secretscanapp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Allow/deny lists and size ceiling deciding which files are scanned.
 * Applied identically by both source providers.
 */
public class FileFilterConfig {
    private List<String> allowedExtensions; // Without the leading dot, lower case
    private List<String> allowedFileNames; // Extension-less or dot files worth scanning
    private List<String> deniedExtensions; // Binary formats, always skipped
    private List<String> deniedDirectories; // Dependency and build output directories
    private long maxFileSizeBytes;

    public FileFilterConfig() {
        this.allowedExtensions = new ArrayList<>(Arrays.asList(
            "py", "js", "ts", "jsx", "tsx", "java", "go", "rb", "php",
            "env", "yaml", "yml", "json", "xml", "conf", "config", "ini",
            "sh", "bash", "zsh", "properties", "toml", "tf", "tfvars",
            "dockerfile", "sql", "md", "txt", "cfg", "settings"
        ));
        this.allowedFileNames = new ArrayList<>(Arrays.asList(
            "dockerfile", "makefile", ".env", ".env.local", ".env.development",
            ".env.production", ".env.staging", "secrets", "credentials", "config"
        ));
        this.deniedExtensions = new ArrayList<>(Arrays.asList(
            "png", "jpg", "jpeg", "gif", "bmp", "ico", "webp", "svgz", "pdf",
            "zip", "gz", "tgz", "bz2", "xz", "7z", "rar", "jar", "war", "ear", "class",
            "exe", "dll", "so", "dylib", "bin", "o", "a", "pyc", "woff", "woff2", "ttf",
            "otf", "eot", "mp3", "mp4", "mov", "avi", "wav", "iso", "dmg"
        ));
        this.deniedDirectories = new ArrayList<>(Arrays.asList(
            ".git", "node_modules", "vendor", "bower_components", "dist", "build",
            "target", "__pycache__", ".venv", "venv"
        ));
        this.maxFileSizeBytes = Shared.MAX_FILE_SIZE_BYTES;
    }

    // Getters and Setters
    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions;
    }

    public List<String> getAllowedFileNames() {
        return allowedFileNames;
    }

    public void setAllowedFileNames(List<String> allowedFileNames) {
        this.allowedFileNames = allowedFileNames;
    }

    public List<String> getDeniedExtensions() {
        return deniedExtensions;
    }

    public void setDeniedExtensions(List<String> deniedExtensions) {
        this.deniedExtensions = deniedExtensions;
    }

    public List<String> getDeniedDirectories() {
        return deniedDirectories;
    }

    public void setDeniedDirectories(List<String> deniedDirectories) {
        this.deniedDirectories = deniedDirectories;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}
