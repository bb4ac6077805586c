package secretscanapp;

/**
 * A file in a branch's current tree. The id is the blob SHA.
 */
public final class FileRef {
    private final String path;
    private final String id;
    private final long size;

    public FileRef(String path, String id, long size) {
        this.path = path;
        this.id = id;
        this.size = size;
    }

    public String getPath() {
        return path;
    }

    public String getId() {
        return id;
    }

    public long getSize() {
        return size;
    }

    @Override
    public String toString() {
        return path + "@" + id;
    }
}
