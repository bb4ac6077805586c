package secretscanapp;

import java.util.Collections;
import java.util.List;

/**
 * A commit as listed by a source provider. Parent ids are only known to the local provider.
 */
public final class CommitInfo {
    private final String id;
    private final List<String> parentIds;
    private final String author;
    private final String date;
    private final String message;

    public CommitInfo(String id, List<String> parentIds, String author, String date, String message) {
        this.id = id;
        this.parentIds = parentIds == null ? Collections.emptyList() : List.copyOf(parentIds);
        this.author = author;
        this.date = date;
        this.message = message;
    }

    public String getId() {
        return id;
    }

    public List<String> getParentIds() {
        return parentIds;
    }

    public String getAuthor() {
        return author;
    }

    public String getDate() {
        return date;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return id + " " + message;
    }
}
