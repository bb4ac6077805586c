package secretscanapp;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * In-memory source provider for orchestrator tests
 */
class FakeSourceProvider implements SourceProvider {
    private final ScanMode mode;
    private final String defaultBranch;
    private final List<String> branches = new ArrayList<>();
    private final Map<String, List<FileRef>> files = new HashMap<>();
    private final Map<String, String> contents = new HashMap<>();
    private final Map<String, List<CommitInfo>> commits = new LinkedHashMap<>();
    private final Map<String, List<FileDiff>> diffs = new HashMap<>();
    private final Map<String, RuntimeException> fileFailures = new HashMap<>();
    private final Set<String> unreadableFiles = new HashSet<>();
    private final Set<String> brokenCommits = new HashSet<>();

    final List<String> listedFileBranches = new ArrayList<>();
    final List<String> diffRequests = new ArrayList<>();
    Consumer<FileRef> onRead = ref -> { };
    RuntimeException openFailure;
    IOException listFilesFailure;
    volatile boolean opened;
    volatile boolean closed;
    int commitLimit = 500;

    FakeSourceProvider(ScanMode mode, String defaultBranch) {
        this.mode = mode;
        this.defaultBranch = defaultBranch;
    }

    FakeSourceProvider branch(String name) {
        branches.add(name);
        return this;
    }

    FakeSourceProvider file(String branch, String path, String content) {
        String id = branch + ":" + path;
        files.computeIfAbsent(branch, k -> new ArrayList<>()).add(new FileRef(path, id, content.length()));
        contents.put(id, content);
        return this;
    }

    FakeSourceProvider unreadableFile(String branch, String path) {
        String id = branch + ":" + path;
        files.computeIfAbsent(branch, k -> new ArrayList<>()).add(new FileRef(path, id, 1));
        unreadableFiles.add(id);
        return this;
    }

    FakeSourceProvider failingFile(String branch, String path, RuntimeException failure) {
        String id = branch + ":" + path;
        files.computeIfAbsent(branch, k -> new ArrayList<>()).add(new FileRef(path, id, 1));
        fileFailures.put(id, failure);
        return this;
    }

    FakeSourceProvider commit(String branch, String id, String message, FileDiff... changes) {
        commits.computeIfAbsent(branch, k -> new ArrayList<>())
            .add(new CommitInfo(id, List.of(), "Dev", "2024-01-01T00:00:00+00:00", message));
        diffs.put(id, List.of(changes));
        return this;
    }

    FakeSourceProvider brokenCommit(String branch, String id) {
        commits.computeIfAbsent(branch, k -> new ArrayList<>())
            .add(new CommitInfo(id, List.of(), "Dev", "2024-01-01T00:00:00+00:00", "broken"));
        brokenCommits.add(id);
        return this;
    }

    static FileDiff added(String path, int lineNumber, String content) {
        return new FileDiff(path, List.of(new AddedLine(lineNumber, content)));
    }

    @Override
    public ScanMode getMode() {
        return mode;
    }

    @Override
    public void open(CancellationToken token) {
        if (openFailure != null) {
            throw openFailure;
        }
        opened = true;
    }

    @Override
    public String getDefaultBranch() {
        return defaultBranch;
    }

    @Override
    public List<String> listBranches(CancellationToken token) {
        return new ArrayList<>(branches);
    }

    @Override
    public List<FileRef> listFiles(String branch, CancellationToken token) throws IOException {
        if (listFilesFailure != null) {
            throw listFilesFailure;
        }
        listedFileBranches.add(branch);
        return files.getOrDefault(branch, Collections.emptyList());
    }

    @Override
    public String readFile(FileRef ref, CancellationToken token) throws IOException {
        onRead.accept(ref);
        if (fileFailures.containsKey(ref.getId())) {
            throw fileFailures.get(ref.getId());
        }
        if (unreadableFiles.contains(ref.getId())) {
            throw new IOException("Binary content in " + ref.getPath());
        }
        return contents.get(ref.getId());
    }

    @Override
    public List<CommitInfo> listCommits(String branch, int limit, CancellationToken token) {
        List<CommitInfo> list = commits.getOrDefault(branch, Collections.emptyList());
        return list.subList(0, Math.min(limit, list.size()));
    }

    @Override
    public int getCommitLimit() {
        return commitLimit;
    }

    @Override
    public List<FileDiff> getCommitDiff(CommitInfo commit, CancellationToken token) {
        diffRequests.add(commit.getId());
        if (brokenCommits.contains(commit.getId())) {
            throw new IllegalStateException("bad object " + commit.getId());
        }
        return diffs.getOrDefault(commit.getId(), Collections.emptyList());
    }

    @Override
    public void close() {
        closed = true;
    }
}
