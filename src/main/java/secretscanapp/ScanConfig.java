package secretscanapp;

/**
 * Configuration for secret scans
 */
public class ScanConfig {
    private String gitUsername;
    private String gitPassword; // Should use secure credential management in production
    private String workspaceBaseDir; // Parent directory of per-job mirror clones
    private FileFilterConfig fileFilter;

    // Local mode
    private int maxCommitsPerBranch;
    private int cloneTimeoutSeconds;
    private int gitCommandTimeoutSeconds;

    // Remote mode
    private String apiBaseUrl;
    private String apiToken; // Raises the API quota; never logged
    private int maxBranches;
    private int maxFiles;
    private int maxCommits;
    private int requestTimeoutSeconds;
    private long requestIntervalMillis; // Minimum spacing between API calls

    private Integer scanTimeoutSeconds; // Scan activity timeout in seconds (null = use default)
    private String taskQueue; // Task queue name (null = SECRET_SCAN_TASK_QUEUE)

    public ScanConfig() {
        this.workspaceBaseDir = Shared.WORKSPACE_BASE_DIR;
        this.fileFilter = new FileFilterConfig();
        this.maxCommitsPerBranch = LocalGitProvider.MAX_COMMITS_PER_BRANCH;
        this.cloneTimeoutSeconds = Shared.CLONE_TIMEOUT_SECONDS;
        this.gitCommandTimeoutSeconds = Shared.GIT_COMMAND_TIMEOUT_SECONDS;
        this.apiBaseUrl = Shared.GITHUB_API_URL;
        this.maxBranches = RemoteApiProvider.MAX_BRANCHES;
        this.maxFiles = RemoteApiProvider.MAX_FILES;
        this.maxCommits = RemoteApiProvider.MAX_COMMITS;
        this.requestTimeoutSeconds = Shared.REQUEST_TIMEOUT_SECONDS;
        this.requestIntervalMillis = Shared.REQUEST_INTERVAL_MILLIS;
    }

    // Getters and Setters
    public String getGitUsername() {
        return gitUsername;
    }

    public void setGitUsername(String gitUsername) {
        this.gitUsername = gitUsername;
    }

    public String getGitPassword() {
        return gitPassword;
    }

    public void setGitPassword(String gitPassword) {
        this.gitPassword = gitPassword;
    }

    public String getWorkspaceBaseDir() {
        return workspaceBaseDir;
    }

    public void setWorkspaceBaseDir(String workspaceBaseDir) {
        this.workspaceBaseDir = workspaceBaseDir;
    }

    public FileFilterConfig getFileFilter() {
        return fileFilter;
    }

    public void setFileFilter(FileFilterConfig fileFilter) {
        this.fileFilter = fileFilter;
    }

    public int getMaxCommitsPerBranch() {
        return maxCommitsPerBranch;
    }

    public void setMaxCommitsPerBranch(int maxCommitsPerBranch) {
        this.maxCommitsPerBranch = maxCommitsPerBranch;
    }

    public int getCloneTimeoutSeconds() {
        return cloneTimeoutSeconds;
    }

    public void setCloneTimeoutSeconds(int cloneTimeoutSeconds) {
        this.cloneTimeoutSeconds = cloneTimeoutSeconds;
    }

    public int getGitCommandTimeoutSeconds() {
        return gitCommandTimeoutSeconds;
    }

    public void setGitCommandTimeoutSeconds(int gitCommandTimeoutSeconds) {
        this.gitCommandTimeoutSeconds = gitCommandTimeoutSeconds;
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = apiBaseUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public int getMaxBranches() {
        return maxBranches;
    }

    public void setMaxBranches(int maxBranches) {
        this.maxBranches = maxBranches;
    }

    public int getMaxFiles() {
        return maxFiles;
    }

    public void setMaxFiles(int maxFiles) {
        this.maxFiles = maxFiles;
    }

    public int getMaxCommits() {
        return maxCommits;
    }

    public void setMaxCommits(int maxCommits) {
        this.maxCommits = maxCommits;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public long getRequestIntervalMillis() {
        return requestIntervalMillis;
    }

    public void setRequestIntervalMillis(long requestIntervalMillis) {
        this.requestIntervalMillis = requestIntervalMillis;
    }

    public Integer getScanTimeoutSeconds() {
        return scanTimeoutSeconds;
    }

    public void setScanTimeoutSeconds(Integer scanTimeoutSeconds) {
        this.scanTimeoutSeconds = scanTimeoutSeconds;
    }

    public String getTaskQueue() {
        return taskQueue;
    }

    public void setTaskQueue(String taskQueue) {
        this.taskQueue = taskQueue;
    }
}
