package secretscanapp;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Source provider over the GitHub REST API. Bounded: one branch, {@link #MAX_FILES} files and
 * {@link #MAX_COMMITS} recent commits by default. Calls are issued one at a time, spaced by the
 * configured request interval.
 */
public class RemoteApiProvider implements SourceProvider {
    private static final Logger logger = LoggerFactory.getLogger(RemoteApiProvider.class);

    public static final int MAX_BRANCHES = 10;
    public static final int BRANCHES_PER_PAGE = 10;
    public static final int MAX_FILES = 100;
    public static final int MAX_COMMITS = 20;
    public static final int MAX_COMMITS_PER_PAGE = 100;

    private static final String ACCEPT = "application/vnd.github+json";

    private final String repositoryUrl;
    private final GitHubRepository repository;
    private final ScanConfig config;
    private final FileFilter fileFilter;
    private final HttpUrl apiBaseUrl;
    private final OkHttpClient http;
    private long lastRequestNanos;
    private String defaultBranch;

    /**
     * @throws InvalidRepositoryUrlException if the URL is not a GitHub repository URL
     */
    public RemoteApiProvider(String repositoryUrl, ScanConfig config) {
        this.repositoryUrl = repositoryUrl;
        this.repository = RepositoryUrls.parseGitHub(repositoryUrl);
        this.config = config != null ? config : new ScanConfig();
        this.fileFilter = new FileFilter(this.config.getFileFilter() != null
            ? this.config.getFileFilter() : new FileFilterConfig());
        String base = this.config.getApiBaseUrl() != null ? this.config.getApiBaseUrl() : Shared.GITHUB_API_URL;
        this.apiBaseUrl = HttpUrl.parse(base);
        if (apiBaseUrl == null) {
            throw new IllegalArgumentException("Invalid API base URL: " + base);
        }
        this.http = new OkHttpClient.Builder()
            .callTimeout(Duration.ofSeconds(this.config.getRequestTimeoutSeconds()))
            .readTimeout(Duration.ofSeconds(this.config.getRequestTimeoutSeconds()))
            .build();
    }

    @Override
    public ScanMode getMode() {
        return ScanMode.REMOTE;
    }

    @Override
    public void open(CancellationToken token) throws IOException {
        HttpUrl url = repoUrl().build();
        ApiResponse response;
        try {
            response = get(url, token);
        } catch (IOException e) {
            throw new ProviderUnavailableException(
                "Cannot reach GitHub API for " + repository + ": " + e.getMessage(),
                repositoryUrl, "Network failure", e);
        }
        if (response.code == 404) {
            throw new ProviderUnavailableException(
                "Repository not found: " + repository.getWebUrl(), repositoryUrl, "Repository not found");
        }
        if (response.code == 401 || response.code == 403) {
            throw new ProviderUnavailableException(
                "Authentication failed for " + repository.getWebUrl() + " (HTTP " + response.code + ")",
                repositoryUrl, "Authentication failed");
        }
        if (!response.isSuccessful()) {
            throw new ProviderUnavailableException(
                "GitHub API returned HTTP " + response.code + " for " + repository,
                repositoryUrl, "GitHub API error");
        }
        JsonObject repo = parseObject(response, url);
        defaultBranch = optString(repo, "default_branch");
        logger.info("Opened {} through {} (default branch: {})", repository, apiBaseUrl, defaultBranch);
    }

    @Override
    public String getDefaultBranch() {
        return defaultBranch;
    }

    @Override
    public List<String> listBranches(CancellationToken token) throws IOException {
        int max = config.getMaxBranches() > 0 ? config.getMaxBranches() : MAX_BRANCHES;
        List<String> branches = new ArrayList<>();
        for (int page = 1; branches.size() < max; page++) {
            HttpUrl url = repoUrl()
                .addPathSegment("branches")
                .addQueryParameter("per_page", String.valueOf(BRANCHES_PER_PAGE))
                .addQueryParameter("page", String.valueOf(page))
                .build();
            JsonArray items = parseArray(expectSuccess(get(url, token), url), url);
            for (JsonElement item : items) {
                if (branches.size() >= max) {
                    break;
                }
                branches.add(item.getAsJsonObject().get("name").getAsString());
            }
            if (items.size() < BRANCHES_PER_PAGE) {
                break;
            }
        }
        return branches;
    }

    @Override
    public List<FileRef> listFiles(String branch, CancellationToken token) throws IOException {
        int max = config.getMaxFiles() > 0 ? config.getMaxFiles() : MAX_FILES;
        List<FileRef> files = new ArrayList<>();
        for (FileRef blob : listBlobs(branch, token)) {
            if (!fileFilter.accepts(blob.getPath(), blob.getSize())) {
                continue;
            }
            files.add(blob);
            if (files.size() >= max) {
                break;
            }
        }
        return files;
    }

    /**
     * Blobs of a recursive tree listing; {@code treeish} is a branch name or a tree sha
     */
    private List<FileRef> listBlobs(String treeish, CancellationToken token) throws IOException {
        HttpUrl url = repoUrl()
            .addPathSegments("git/trees")
            .addPathSegment(treeish)
            .addQueryParameter("recursive", "1")
            .build();
        JsonObject tree = parseObject(expectSuccess(get(url, token), url), url);
        if (tree.has("truncated") && tree.get("truncated").getAsBoolean()) {
            logger.warn("Tree {} of {} was truncated by the API", treeish, repository);
        }
        List<FileRef> blobs = new ArrayList<>();
        JsonArray entries = tree.has("tree") ? tree.getAsJsonArray("tree") : new JsonArray();
        for (JsonElement element : entries) {
            JsonObject entry = element.getAsJsonObject();
            if (!"blob".equals(optString(entry, "type"))) {
                continue;
            }
            long size = entry.has("size") ? entry.get("size").getAsLong() : 0;
            blobs.add(new FileRef(entry.get("path").getAsString(), entry.get("sha").getAsString(), size));
        }
        return blobs;
    }

    @Override
    public String readFile(FileRef ref, CancellationToken token) throws IOException {
        HttpUrl url = repoUrl()
            .addPathSegments("git/blobs")
            .addPathSegment(ref.getId())
            .build();
        JsonObject blob = parseObject(expectSuccess(get(url, token), url), url);
        String content = optString(blob, "content");
        if (content == null) {
            throw new IOException("Blob " + ref.getId() + " has no content");
        }
        byte[] bytes;
        if ("base64".equals(optString(blob, "encoding"))) {
            try {
                bytes = Base64.getMimeDecoder().decode(content);
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid base64 content for " + ref.getPath(), e);
            }
        } else {
            bytes = content.getBytes(StandardCharsets.UTF_8);
        }
        if (FileFilter.isBinary(bytes)) {
            throw new IOException("Binary content in " + ref.getPath());
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public List<CommitInfo> listCommits(String branch, int limit, CancellationToken token) throws IOException {
        int perPage = Math.max(1, Math.min(limit, MAX_COMMITS_PER_PAGE));
        List<CommitInfo> commits = new ArrayList<>();
        for (int page = 1; commits.size() < limit; page++) {
            HttpUrl url = repoUrl()
                .addPathSegment("commits")
                .addQueryParameter("sha", branch)
                .addQueryParameter("per_page", String.valueOf(perPage))
                .addQueryParameter("page", String.valueOf(page))
                .build();
            JsonArray items = parseArray(expectSuccess(get(url, token), url), url);
            for (JsonElement element : items) {
                if (commits.size() >= limit) {
                    break;
                }
                commits.add(toCommitInfo(element.getAsJsonObject()));
            }
            if (items.size() < perPage) {
                break;
            }
        }
        return commits;
    }

    private static CommitInfo toCommitInfo(JsonObject item) {
        JsonObject commit = item.getAsJsonObject("commit");
        JsonObject author = commit != null && commit.has("author") && commit.get("author").isJsonObject()
            ? commit.getAsJsonObject("author") : new JsonObject();
        List<String> parents = new ArrayList<>();
        if (item.has("parents")) {
            for (JsonElement parent : item.getAsJsonArray("parents")) {
                parents.add(parent.getAsJsonObject().get("sha").getAsString());
            }
        }
        return new CommitInfo(
            item.get("sha").getAsString(),
            parents,
            optString(author, "name"),
            optString(author, "date"),
            commit != null ? optString(commit, "message") : "");
    }

    @Override
    public int getCommitLimit() {
        return config.getMaxCommits() > 0 ? config.getMaxCommits() : MAX_COMMITS;
    }

    @Override
    public List<FileDiff> getCommitDiff(CommitInfo commit, CancellationToken token) throws IOException {
        HttpUrl url = repoUrl()
            .addPathSegment("commits")
            .addPathSegment(commit.getId())
            .build();
        JsonObject detail = parseObject(expectSuccess(get(url, token), url), url);
        List<JsonObject> candidates = new ArrayList<>();
        if (detail.has("files")) {
            for (JsonElement element : detail.getAsJsonArray("files")) {
                JsonObject file = element.getAsJsonObject();
                String path = optString(file, "filename");
                // Binary files and very large diffs come without a patch
                if (path != null && optString(file, "patch") != null
                        && !"removed".equals(optString(file, "status")) && fileFilter.acceptsPath(path)) {
                    candidates.add(file);
                }
            }
        }
        List<FileDiff> diffs = new ArrayList<>();
        if (candidates.isEmpty()) {
            return diffs;
        }

        // Size ceiling applies to the file as of this commit
        Map<String, Long> sizes = fileSizes(detail, token);
        for (JsonObject file : candidates) {
            String path = optString(file, "filename");
            String patch = optString(file, "patch");
            Long size = sizes.get(path);
            long effectiveSize = size != null ? size : patch.getBytes(StandardCharsets.UTF_8).length;
            if (!fileFilter.accepts(path, effectiveSize)) {
                logger.debug("Skipping {} in {}: {} bytes", path, commit.getId(), effectiveSize);
                continue;
            }
            List<AddedLine> added = PatchParser.parseFilePatch(patch);
            if (!added.isEmpty()) {
                diffs.add(new FileDiff(path, added));
            }
        }
        return diffs;
    }

    /**
     * Blob sizes by path in the tree of a commit detail; empty when the detail names no tree
     */
    private Map<String, Long> fileSizes(JsonObject detail, CancellationToken token) throws IOException {
        Map<String, Long> sizes = new HashMap<>();
        JsonObject commit = detail.has("commit") && detail.get("commit").isJsonObject()
            ? detail.getAsJsonObject("commit") : null;
        JsonObject tree = commit != null && commit.has("tree") && commit.get("tree").isJsonObject()
            ? commit.getAsJsonObject("tree") : null;
        String treeSha = tree != null ? optString(tree, "sha") : null;
        if (treeSha == null) {
            return sizes;
        }
        for (FileRef blob : listBlobs(treeSha, token)) {
            sizes.put(blob.getPath(), blob.getSize());
        }
        return sizes;
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }

    private HttpUrl.Builder repoUrl() {
        return apiBaseUrl.newBuilder()
            .addPathSegment("repos")
            .addPathSegment(repository.getOwner())
            .addPathSegment(repository.getName());
    }

    private ApiResponse get(HttpUrl url, CancellationToken token) throws IOException {
        token.throwIfCancelled();
        throttle();

        Request.Builder builder = new Request.Builder()
            .url(url)
            .header("Accept", ACCEPT)
            .header("X-GitHub-Api-Version", "2022-11-28");
        if (config.getApiToken() != null && !config.getApiToken().isBlank()) {
            builder.header("Authorization", "Bearer " + config.getApiToken());
        }

        logger.debug("GET {}", url);
        try (Response response = http.newCall(builder.build()).execute()) {
            checkRateLimit(response, url);
            ResponseBody body = response.body();
            return new ApiResponse(response.code(), body != null ? body.string() : "");
        }
    }

    /**
     * @throws RateLimitedException on any 429, or a 403 that reports zero remaining quota
     */
    private void checkRateLimit(Response response, HttpUrl url) {
        String remaining = response.header("X-RateLimit-Remaining");
        boolean exhausted = response.code() == 429
            || (response.code() == 403 && "0".equals(remaining != null ? remaining.trim() : null));
        if (!exhausted) {
            return;
        }
        long reset = parseLong(response.header("X-RateLimit-Reset"));
        StringBuilder message = new StringBuilder(
            "GitHub API rate limit exceeded. Please add a GitHub token or wait");
        if (reset > 0) {
            message.append(" until ").append(Instant.ofEpochSecond(reset));
        }
        message.append('.');
        logger.warn("Rate limited on {} (reset: {})", url.encodedPath(), reset);
        throw new RateLimitedException(message.toString(), url.toString(), reset);
    }

    private synchronized void throttle() throws InterruptedIOException {
        long interval = config.getRequestIntervalMillis();
        if (interval > 0 && lastRequestNanos != 0) {
            long waitMillis = interval - (System.nanoTime() - lastRequestNanos) / 1_000_000;
            if (waitMillis > 0) {
                try {
                    Thread.sleep(waitMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while waiting between API calls");
                }
            }
        }
        lastRequestNanos = System.nanoTime();
    }

    private static ApiResponse expectSuccess(ApiResponse response, HttpUrl url) throws IOException {
        if (!response.isSuccessful()) {
            throw new IOException("GitHub API returned HTTP " + response.code + " for " + url.encodedPath());
        }
        return response;
    }

    private static JsonObject parseObject(ApiResponse response, HttpUrl url) throws IOException {
        try {
            return JsonParser.parseString(response.body).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Unexpected response from " + url.encodedPath(), e);
        }
    }

    private static JsonArray parseArray(ApiResponse response, HttpUrl url) throws IOException {
        try {
            return JsonParser.parseString(response.body).getAsJsonArray();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Unexpected response from " + url.encodedPath(), e);
        }
    }

    private static String optString(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element != null && !element.isJsonNull() ? element.getAsString() : null;
    }

    private static long parseLong(String value) {
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static final class ApiResponse {
        private final int code;
        private final String body;

        ApiResponse(int code, String body) {
            this.code = code;
            this.body = body;
        }

        boolean isSuccessful() {
            return code >= 200 && code < 300;
        }
    }
}
