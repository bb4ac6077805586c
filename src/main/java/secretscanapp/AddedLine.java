package secretscanapp;

/**
 * A line introduced by a commit, with its line number in the new version of the file
 */
public final class AddedLine {
    private final int lineNumber;
    private final String content;

    public AddedLine(int lineNumber, String content) {
        this.lineNumber = lineNumber;
        this.content = content;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String toString() {
        return lineNumber + ": " + content;
    }
}
