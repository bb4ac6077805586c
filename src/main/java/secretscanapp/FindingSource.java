package secretscanapp;

/**
 * Where scanned text came from: a file on a branch, either in the current tree or in a commit
 */
public final class FindingSource {
    static final String HEAD_COMMIT_ID = "HEAD";
    static final String HEAD_AUTHOR = "Current";
    static final String HEAD_MESSAGE = "Current HEAD";

    private final String filePath;
    private final String commitId;
    private final String author;
    private final String timestamp;
    private final String commitMessage;
    private final String branch;

    private FindingSource(String filePath, String commitId, String author, String timestamp,
                          String commitMessage, String branch) {
        this.filePath = filePath;
        this.commitId = commitId;
        this.author = author;
        this.timestamp = timestamp;
        this.commitMessage = commitMessage;
        this.branch = branch;
    }

    /**
     * A file of the current tree of a branch
     */
    public static FindingSource currentFile(String filePath, String branch, String scanTimestamp) {
        return new FindingSource(filePath, HEAD_COMMIT_ID, HEAD_AUTHOR, scanTimestamp, HEAD_MESSAGE, branch);
    }

    /**
     * A file changed by a commit
     */
    public static FindingSource commitFile(String filePath, CommitInfo commit, String branch) {
        String id = commit.getId();
        if (id.length() > Shared.COMMIT_ID_LENGTH) {
            id = id.substring(0, Shared.COMMIT_ID_LENGTH);
        }
        String message = commit.getMessage() == null ? "" : commit.getMessage();
        if (message.length() > Shared.COMMIT_MESSAGE_MAX_LENGTH) {
            message = message.substring(0, Shared.COMMIT_MESSAGE_MAX_LENGTH);
        }
        return new FindingSource(filePath, id, commit.getAuthor(), commit.getDate(), message, branch);
    }

    public String getFilePath() {
        return filePath;
    }

    public String getCommitId() {
        return commitId;
    }

    public String getAuthor() {
        return author;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getCommitMessage() {
        return commitMessage;
    }

    public String getBranch() {
        return branch;
    }
}
