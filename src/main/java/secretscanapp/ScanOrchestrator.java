package secretscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drives one scan over a source provider.
 *
 * Setup (open, list branches), then per branch the current files followed by the branch history,
 * then sorting and summarizing. Each branch gets an equal share of the progress range between the
 * mode's setup and finalize marks; files take the first half of a share, commits the second.
 *
 * Enumeration failures end the scan. A file or commit that cannot be read is logged and skipped.
 */
public class ScanOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

    private final SourceProvider provider;
    private final ContentScanner scanner;
    private final ScanRequest request;

    public ScanOrchestrator(SourceProvider provider, PatternRegistry registry, ScanRequest request) {
        this.provider = provider;
        this.scanner = new ContentScanner(registry);
        this.request = request;
    }

    /**
     * Run the scan to completion.
     *
     * @throws ProviderUnavailableException if the repository cannot be opened or enumerated
     * @throws RateLimitedException if the hosting API quota runs out
     * @throws ScanCancelledException if the token is cancelled
     */
    public ScanResult run(ProgressReporter reporter, CancellationToken token) {
        Progress progress = new Progress(reporter);
        ScanMode mode = provider.getMode();
        String repositoryUrl = request.getRepositoryUrl();
        logger.info("Starting {} scan {} of {}", mode.getId(), request.getScanId(),
            RepositoryUrls.toWebUrl(repositoryUrl));

        // Setup
        progress.report(0, "Preparing repository...");
        token.throwIfCancelled();
        call("Opening repository", () -> {
            provider.open(token);
            return null;
        });
        progress.report(mode.getSetupEndPercent() / 2, "Fetching repository branches...");
        List<String> available = call("Listing branches", () -> provider.listBranches(token));
        List<String> branches = selectBranches(mode, available);
        progress.report(mode.getSetupEndPercent(), "Found " + branches.size() + " branch(es) to scan");
        logger.info("Scan {}: {} branch(es) selected of {} listed", request.getScanId(),
            branches.size(), available.size());

        Deduplicator deduplicator = new Deduplicator();
        Set<String> visitedCommits = new HashSet<>();
        int commitsScanned = 0;
        String scanTimestamp = Instant.now().toString();
        int filesScanned = 0;
        int limit = provider.getCommitLimit();

        double range = mode.getFinalizeStartPercent() - mode.getSetupEndPercent();
        for (int b = 0; b < branches.size(); b++) {
            String branch = branches.get(b);
            double sliceStart = mode.getSetupEndPercent() + range * b / branches.size();
            double sliceEnd = mode.getSetupEndPercent() + range * (b + 1) / branches.size();
            double sliceMid = (sliceStart + sliceEnd) / 2;

            // Current tree
            token.throwIfCancelled();
            List<FileRef> files = call("Listing files of " + branch, () -> provider.listFiles(branch, token));
            progress.report(sliceStart, "Found " + files.size() + " files to scan on " + branch + "...");
            for (int i = 0; i < files.size(); i++) {
                token.throwIfCancelled();
                FileRef file = files.get(i);
                progress.report(interpolate(sliceStart, sliceMid, i, files.size()),
                    "Scanning file: " + file.getPath());
                try {
                    String content = provider.readFile(file, token);
                    FindingSource source = FindingSource.currentFile(file.getPath(), branch, scanTimestamp);
                    addAll(deduplicator, scanner.scanContent(content, source));
                    filesScanned++;
                } catch (RateLimitedException | ProviderUnavailableException | ScanCancelledException e) {
                    throw e;
                } catch (IOException | RuntimeException e) {
                    logger.warn("Skipping file {} on {}: {}", file.getPath(), branch, e.getMessage());
                }
            }

            // History
            token.throwIfCancelled();
            progress.report(sliceMid, "Scanning commit history of " + branch + "...");
            List<CommitInfo> commits = call("Listing commits of " + branch,
                () -> provider.listCommits(branch, limit, token));
            for (int i = 0; i < commits.size(); i++) {
                token.throwIfCancelled();
                CommitInfo commit = commits.get(i);
                if (!visitedCommits.add(commit.getId())) {
                    continue;
                }
                progress.report(interpolate(sliceMid, sliceEnd, i, commits.size()),
                    "Scanning commit " + (i + 1) + "/" + commits.size() + ": " + abbreviate(commit.getId()));
                try {
                    for (FileDiff diff : provider.getCommitDiff(commit, token)) {
                        FindingSource source = FindingSource.commitFile(diff.getFilePath(), commit, branch);
                        addAll(deduplicator, scanner.scanAddedLines(diff.getAddedLines(), source));
                    }
                    commitsScanned++;
                } catch (RateLimitedException | ProviderUnavailableException | ScanCancelledException e) {
                    throw e;
                } catch (IOException | RuntimeException e) {
                    logger.warn("Skipping commit {} on {}: {}", abbreviate(commit.getId()), branch, e.getMessage());
                }
            }
        }

        // Finalize
        progress.report(mode.getFinalizeStartPercent(), "Processing results...");
        List<Finding> findings = new ArrayList<>(deduplicator.findings());
        // List.sort is stable, so findings of equal severity keep discovery order
        findings.sort(Comparator.comparingInt(finding -> finding.getSeverity().getRank()));
        ScanSummary summary = ScanSummary.from(findings, commitsScanned, branches.size(), filesScanned);
        ScanResult result = new ScanResult(summary, findings, RepositoryUrls.toWebUrl(repositoryUrl));

        progress.report(100, "Scan completed! Found " + findings.size() + " secrets in "
            + commitsScanned + " commits");
        logger.info("Scan {} completed: {} findings ({} critical, {} high) in {} commits, {} files",
            request.getScanId(), summary.getTotal(), summary.getCritical(), summary.getHigh(),
            summary.getCommitsScanned(), summary.getFilesScanned());
        return result;
    }

    private List<String> selectBranches(ScanMode mode, List<String> available) {
        if (mode == ScanMode.LOCAL) {
            if (available.isEmpty() && provider.getDefaultBranch() != null) {
                return Collections.singletonList(provider.getDefaultBranch());
            }
            return available;
        }
        String requested = request.getBranch();
        if (requested != null && !requested.isBlank()) {
            return Collections.singletonList(requested.trim());
        }
        if (provider.getDefaultBranch() != null) {
            return Collections.singletonList(provider.getDefaultBranch());
        }
        if (available.contains("main")) {
            return Collections.singletonList("main");
        }
        return available.isEmpty() ? Collections.emptyList() : Collections.singletonList(available.get(0));
    }

    private static void addAll(Deduplicator deduplicator, List<Finding> findings) {
        for (Finding finding : findings) {
            deduplicator.add(finding);
        }
    }

    private static double interpolate(double from, double to, int index, int count) {
        return count == 0 ? from : from + (to - from) * index / count;
    }

    private static String abbreviate(String commitId) {
        return commitId.length() > Shared.COMMIT_ID_LENGTH ? commitId.substring(0, Shared.COMMIT_ID_LENGTH) : commitId;
    }

    /**
     * Setup and enumeration calls: any I/O failure ends the scan
     */
    private <T> T call(String step, ProviderCall<T> call) {
        try {
            return call.call();
        } catch (InterruptedIOException e) {
            throw new ProviderUnavailableException(step + " timed out: " + e.getMessage(),
                request.getRepositoryUrl(), "Timeout", e);
        } catch (IOException e) {
            throw new ProviderUnavailableException(step + " failed: " + e.getMessage(),
                request.getRepositoryUrl(), "Provider error", e);
        }
    }

    @FunctionalInterface
    private interface ProviderCall<T> {
        T call() throws IOException;
    }

    /**
     * Keeps reported percentages non-decreasing
     */
    private static final class Progress {
        private final ProgressReporter reporter;
        private int current;

        Progress(ProgressReporter reporter) {
            this.reporter = reporter;
        }

        void report(double percent, String message) {
            current = Math.max(current, Math.min(100, (int) Math.floor(percent)));
            reporter.report(current, message);
        }
    }
}
