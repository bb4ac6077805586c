package secretscanapp;

/**
 * Owner/name coordinates of a GitHub repository
 */
public final class GitHubRepository {
    private final String owner;
    private final String name;

    public GitHubRepository(String owner, String name) {
        this.owner = owner;
        this.name = name;
    }

    public String getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    public String getWebUrl() {
        return "https://github.com/" + owner + "/" + name;
    }

    @Override
    public String toString() {
        return owner + "/" + name;
    }
}
