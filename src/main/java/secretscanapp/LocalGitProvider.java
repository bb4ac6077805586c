package secretscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Source provider over a bare mirror clone: every branch, history up to
 * {@link #MAX_COMMITS_PER_BRANCH} commits per branch.
 */
public class LocalGitProvider implements SourceProvider {
    private static final Logger logger = LoggerFactory.getLogger(LocalGitProvider.class);

    public static final int MAX_COMMITS_PER_BRANCH = 500;

    // Object id of the empty tree, the diff base of root commits
    static final String EMPTY_TREE_ID = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";

    private static final char FIELD_SEPARATOR = '\u001f';
    private static final char RECORD_SEPARATOR = '\u001e';

    private final String repositoryUrl;
    private final ScanConfig config;
    private final FileFilter fileFilter;
    private final GitCommandRunner runner;
    private final boolean ownsClone;
    private Path mirrorPath;
    private String defaultBranch;

    /**
     * Provider that clones the repository itself on {@link #open} and deletes the clone on {@link #close}
     */
    public LocalGitProvider(String repositoryUrl, ScanConfig config) {
        this(repositoryUrl, config, new GitCommandRunner(), null, true);
    }

    private LocalGitProvider(String repositoryUrl, ScanConfig config, GitCommandRunner runner,
                             Path mirrorPath, boolean ownsClone) {
        this.repositoryUrl = repositoryUrl;
        this.config = config != null ? config : new ScanConfig();
        this.fileFilter = new FileFilter(this.config.getFileFilter() != null
            ? this.config.getFileFilter() : new FileFilterConfig());
        this.runner = runner;
        this.mirrorPath = mirrorPath;
        this.ownsClone = ownsClone;
    }

    /**
     * Provider over a mirror cloned by someone else (the clone activity); it is left in place on close
     */
    public static LocalGitProvider forExistingMirror(Path mirrorPath, String repositoryUrl,
                                                     ScanConfig config, GitCommandRunner runner) {
        return new LocalGitProvider(repositoryUrl, config, runner, mirrorPath, false);
    }

    @Override
    public ScanMode getMode() {
        return ScanMode.LOCAL;
    }

    @Override
    public void open(CancellationToken token) throws IOException {
        if (ownsClone) {
            Path base = Paths.get(config.getWorkspaceBaseDir());
            Files.createDirectories(base);
            mirrorPath = Files.createTempDirectory(base, "mirror-");
            cloneMirror(repositoryUrl, mirrorPath, config, runner, token);
        } else if (mirrorPath == null || !Files.isDirectory(mirrorPath)) {
            throw new ProviderUnavailableException(
                "Mirror clone not found: " + mirrorPath, repositoryUrl, "Missing mirror clone");
        }
        defaultBranch = resolveDefaultBranch(token);
        logger.info("Opened mirror of {} at {} (default branch: {})",
            RepositoryUrls.toWebUrl(repositoryUrl), mirrorPath, defaultBranch);
    }

    @Override
    public String getDefaultBranch() {
        return defaultBranch;
    }

    @Override
    public List<String> listBranches(CancellationToken token) throws IOException {
        GitCommandRunner.Result result = git(token,
            "for-each-ref", "--format=%(refname:short)", "refs/heads/");
        List<String> branches = new ArrayList<>();
        for (String line : result.getStdoutText().split("\n")) {
            String branch = line.trim();
            if (!branch.isEmpty()) {
                branches.add(branch);
            }
        }
        return branches;
    }

    @Override
    public List<FileRef> listFiles(String branch, CancellationToken token) throws IOException {
        List<FileRef> files = new ArrayList<>();
        for (FileRef blob : listBlobs(token, "refs/heads/" + branch)) {
            if (fileFilter.accepts(blob.getPath(), blob.getSize())) {
                files.add(blob);
            }
        }
        return files;
    }

    /**
     * Blobs of a tree-ish, optionally restricted to some paths
     */
    private List<FileRef> listBlobs(CancellationToken token, String treeish, String... paths) throws IOException {
        List<String> args = new ArrayList<>(Arrays.asList("ls-tree", "-r", "-l", "-z", treeish));
        if (paths.length > 0) {
            args.add("--");
            args.addAll(Arrays.asList(paths));
        }
        token.throwIfCancelled();
        GitCommandRunner.Result result = runner.runChecked(mirrorPath.toFile(), args, commandTimeout(), token);
        List<FileRef> blobs = new ArrayList<>();
        // Entry format: "<mode> SP <type> SP <object> SP+ <size> TAB <path>", NUL terminated
        for (String entry : result.getStdoutText().split("\u0000")) {
            int tab = entry.indexOf('\t');
            if (tab < 0) {
                continue;
            }
            String[] meta = entry.substring(0, tab).trim().split("\\s+");
            if (meta.length < 4 || !"blob".equals(meta[1]) || "-".equals(meta[3])) {
                continue;
            }
            blobs.add(new FileRef(entry.substring(tab + 1), meta[2], Long.parseLong(meta[3])));
        }
        return blobs;
    }

    @Override
    public String readFile(FileRef ref, CancellationToken token) throws IOException {
        byte[] content = git(token, "cat-file", "blob", ref.getId()).getStdout();
        if (FileFilter.isBinary(content)) {
            throw new IOException("Binary content in " + ref.getPath());
        }
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public List<CommitInfo> listCommits(String branch, int limit, CancellationToken token) throws IOException {
        GitCommandRunner.Result result = git(token, "log",
            "--format=%H%x1f%P%x1f%an%x1f%aI%x1f%s%x1e",
            "-n", String.valueOf(limit),
            "refs/heads/" + branch);
        List<CommitInfo> commits = new ArrayList<>();
        for (String record : result.getStdoutText().split(String.valueOf(RECORD_SEPARATOR))) {
            // Unit separators count as whitespace, so only line breaks are trimmed
            String trimmed = record.replaceAll("^\\n+|\\n+$", "");
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = trimmed.split(String.valueOf(FIELD_SEPARATOR), -1);
            if (fields.length < 5) {
                logger.warn("Skipping malformed log record on {}: {}", branch, trimmed);
                continue;
            }
            List<String> parents = fields[1].isBlank()
                ? Collections.emptyList()
                : Arrays.asList(fields[1].trim().split(" "));
            commits.add(new CommitInfo(fields[0], parents, fields[2], fields[3], fields[4]));
        }
        return commits;
    }

    @Override
    public int getCommitLimit() {
        return config.getMaxCommitsPerBranch() > 0 ? config.getMaxCommitsPerBranch() : MAX_COMMITS_PER_BRANCH;
    }

    @Override
    public List<FileDiff> getCommitDiff(CommitInfo commit, CancellationToken token) throws IOException {
        String base = commit.getParentIds().isEmpty() ? EMPTY_TREE_ID : commit.getParentIds().get(0);
        GitCommandRunner.Result result = git(token, "diff", "--no-color", "--no-ext-diff", "-U0",
            "--diff-filter=AMR", base, commit.getId());
        List<FileDiff> candidates = new ArrayList<>();
        for (FileDiff diff : PatchParser.parseUnifiedDiff(result.getStdoutText())) {
            if (fileFilter.acceptsPath(diff.getFilePath())) {
                candidates.add(diff);
            }
        }
        if (candidates.isEmpty()) {
            return candidates;
        }

        // Size ceiling applies to the file as of this commit
        String[] paths = candidates.stream().map(FileDiff::getFilePath).toArray(String[]::new);
        Map<String, Long> sizes = new HashMap<>();
        for (FileRef blob : listBlobs(token, commit.getId(), paths)) {
            sizes.put(blob.getPath(), blob.getSize());
        }
        List<FileDiff> diffs = new ArrayList<>();
        for (FileDiff diff : candidates) {
            Long size = sizes.get(diff.getFilePath());
            if (size != null && fileFilter.accepts(diff.getFilePath(), size)) {
                diffs.add(diff);
            } else {
                logger.debug("Skipping {} in {}: size {} over the ceiling or unknown",
                    diff.getFilePath(), commit.getId(), size);
            }
        }
        return diffs;
    }

    @Override
    public void close() {
        if (ownsClone && mirrorPath != null) {
            try {
                deleteDirectory(mirrorPath);
            } catch (IOException e) {
                logger.warn("Failed to delete mirror clone {}: {}", mirrorPath, e.getMessage());
            }
        }
    }

    Path getMirrorPath() {
        return mirrorPath;
    }

    /**
     * Create a bare mirror clone of a repository.
     *
     * @throws ProviderUnavailableException if git cannot clone the repository or the clone times out
     */
    public static void cloneMirror(String repositoryUrl, Path target, ScanConfig config,
                                   GitCommandRunner runner, CancellationToken token) throws IOException {
        String cloneUrl = withCredentials(repositoryUrl, config);
        Duration timeout = Duration.ofSeconds(config.getCloneTimeoutSeconds());
        GitCommandRunner.Result result;
        try {
            result = runner.run(target.getParent().toFile(),
                List.of("clone", "--mirror", "--quiet", "--", cloneUrl, target.toString()), timeout, token);
        } catch (InterruptedIOException e) {
            throw new ProviderUnavailableException(
                "Clone of " + RepositoryUrls.toWebUrl(repositoryUrl) + " timed out",
                repositoryUrl, "Clone timed out", e);
        }
        if (!result.isSuccess()) {
            String stderr = redact(result.getStderr(), config);
            String reason = classifyCloneFailure(stderr);
            throw new ProviderUnavailableException(
                reason + ": " + RepositoryUrls.toWebUrl(repositoryUrl) + " (" + stderr + ")",
                repositoryUrl, reason);
        }
    }

    /**
     * Remote URL recorded in a mirror clone, or null if the directory is not a usable clone
     */
    static String originUrl(Path mirror, GitCommandRunner runner) {
        try {
            GitCommandRunner.Result result = runner.run(mirror.toFile(),
                List.of("config", "--get", "remote.origin.url"),
                Duration.ofSeconds(Shared.GIT_COMMAND_TIMEOUT_SECONDS), CancellationToken.none());
            return result.isSuccess() ? result.getStdoutText().trim() : null;
        } catch (IOException e) {
            logger.debug("Cannot read origin of {}: {}", mirror, e.getMessage());
            return null;
        }
    }

    /**
     * Delete a directory tree, children before parents
     */
    static void deleteDirectory(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(path)) {
            paths.sorted((a, b) -> b.compareTo(a))
                .forEach(p -> {
                    File file = p.toFile();
                    if (!file.delete() && file.exists()) {
                        logger.warn("Failed to delete {}", p);
                    }
                });
        }
    }

    private static String withCredentials(String repositoryUrl, ScanConfig config) {
        if (config.getGitUsername() != null && config.getGitPassword() != null
                && repositoryUrl.startsWith("https://")) {
            return repositoryUrl.replace("https://",
                "https://" + config.getGitUsername() + ":" + config.getGitPassword() + "@");
        }
        return repositoryUrl;
    }

    private static String redact(String text, ScanConfig config) {
        if (config.getGitPassword() != null && !config.getGitPassword().isEmpty()) {
            text = text.replace(config.getGitPassword(), "****");
        }
        return text;
    }

    private static String classifyCloneFailure(String stderr) {
        String lower = stderr.toLowerCase(Locale.ROOT);
        if (lower.contains("not found") || lower.contains("does not exist")
                || lower.contains("does not appear to be a git repository")) {
            return "Repository not found";
        }
        if (lower.contains("authentication failed") || lower.contains("could not read username")
                || lower.contains("permission denied")) {
            return "Authentication failed";
        }
        if (lower.contains("could not resolve host") || lower.contains("unable to access")
                || lower.contains("connection")) {
            return "Network failure";
        }
        return "Clone failed";
    }

    private String resolveDefaultBranch(CancellationToken token) throws IOException {
        GitCommandRunner.Result result = runner.run(mirrorPath.toFile(),
            List.of("symbolic-ref", "--short", "HEAD"), commandTimeout(), token);
        if (result.isSuccess()) {
            return result.getStdoutText().trim();
        }
        // Detached or missing HEAD; fall back to the first branch
        List<String> branches = listBranches(token);
        return branches.isEmpty() ? null : branches.get(0);
    }

    private GitCommandRunner.Result git(CancellationToken token, String... args) throws IOException {
        token.throwIfCancelled();
        return runner.runChecked(mirrorPath.toFile(), Arrays.asList(args), commandTimeout(), token);
    }

    private Duration commandTimeout() {
        int seconds = config.getGitCommandTimeoutSeconds() > 0
            ? config.getGitCommandTimeoutSeconds() : Shared.GIT_COMMAND_TIMEOUT_SECONDS;
        return Duration.ofSeconds(seconds);
    }
}
