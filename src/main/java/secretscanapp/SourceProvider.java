package secretscanapp;

import java.io.IOException;
import java.util.List;

/**
 * Capability set the orchestrator needs to walk a repository: branches, current files, commits
 * and the lines each commit added.
 *
 * Failures of setup and enumeration calls are fatal for the scan; failures of
 * {@link #readFile} and {@link #getCommitDiff} only skip the file or commit.
 * {@link RateLimitedException} is fatal wherever it is thrown.
 */
public interface SourceProvider extends AutoCloseable {

    ScanMode getMode();

    /**
     * Prepare the provider (clone the mirror, look the repository up).
     *
     * @throws ProviderUnavailableException if the repository cannot be reached
     */
    void open(CancellationToken token) throws IOException;

    /**
     * Default branch of the repository; only valid after {@link #open}
     */
    String getDefaultBranch();

    List<String> listBranches(CancellationToken token) throws IOException;

    /**
     * Files of a branch's current tree that pass the configured {@link FileFilter}
     */
    List<FileRef> listFiles(String branch, CancellationToken token) throws IOException;

    /**
     * @throws IOException if the file cannot be read or is binary
     */
    String readFile(FileRef ref, CancellationToken token) throws IOException;

    /**
     * Commits reachable from a branch, newest first, at most {@code limit}
     */
    List<CommitInfo> listCommits(String branch, int limit, CancellationToken token) throws IOException;

    /**
     * Maximum number of commits per branch this provider walks
     */
    int getCommitLimit();

    /**
     * Lines added by a commit, per file. Removed lines are never returned.
     */
    List<FileDiff> getCommitDiff(CommitInfo commit, CancellationToken token) throws IOException;

    /**
     * Release resources; a clone created by the provider is deleted
     */
    @Override
    void close();
}
