package secretscanapp;

import java.util.Collections;
import java.util.List;

/**
 * Added lines of one file in one commit
 */
public final class FileDiff {
    private final String filePath;
    private final List<AddedLine> addedLines;

    public FileDiff(String filePath, List<AddedLine> addedLines) {
        this.filePath = filePath;
        this.addedLines = Collections.unmodifiableList(addedLines);
    }

    public String getFilePath() {
        return filePath;
    }

    public List<AddedLine> getAddedLines() {
        return addedLines;
    }
}
