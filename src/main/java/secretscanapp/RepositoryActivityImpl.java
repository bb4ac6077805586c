package secretscanapp;

import io.temporal.activity.Activity;
import io.temporal.activity.ActivityExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Implementation of repository management activities
 * Handles mirror cloning and workspace cleanup
 */
public class RepositoryActivityImpl implements RepositoryActivity {
    private static final Logger logger = LoggerFactory.getLogger(RepositoryActivityImpl.class);

    static final String MIRROR_DIR_NAME = "mirror.git";

    @Override
    public String cloneMirror(ScanRequest request) {
        ActivityExecutionContext context = Activity.getExecutionContext();
        String repositoryUrl = request.getRepositoryUrl();
        ScanConfig config = request.effectiveConfig();

        try {
            Path workspaceDir = Paths.get(request.getWorkspacePath());
            Files.createDirectories(workspaceDir);
            context.heartbeat("Created workspace directory: " + workspaceDir);

            GitCommandRunner runner = new GitCommandRunner(
                () -> context.heartbeat("Cloning repository: " + RepositoryUrls.toWebUrl(repositoryUrl)));

            // Check if the mirror already exists (idempotency for retries)
            Path mirrorPath = workspaceDir.resolve(MIRROR_DIR_NAME);
            if (Files.isDirectory(mirrorPath)) {
                String origin = LocalGitProvider.originUrl(mirrorPath, runner);
                if (origin != null && RepositoryUrls.normalize(origin).equals(RepositoryUrls.normalize(repositoryUrl))) {
                    logger.info("Reusing mirror clone of {} at {} from a previous attempt",
                        RepositoryUrls.toWebUrl(repositoryUrl), mirrorPath);
                    context.heartbeat("Existing mirror verified, skipping clone");
                    return mirrorPath.toString();
                }
                logger.info("Directory {} does not hold a mirror of {}, re-cloning", mirrorPath,
                    RepositoryUrls.toWebUrl(repositoryUrl));
                LocalGitProvider.deleteDirectory(mirrorPath);
            }

            context.heartbeat("Cloning repository: " + RepositoryUrls.toWebUrl(repositoryUrl));
            LocalGitProvider.cloneMirror(repositoryUrl, mirrorPath, config, runner, CancellationToken.none());
            logger.info("Mirror of {} cloned to {}", RepositoryUrls.toWebUrl(repositoryUrl), mirrorPath);
            context.heartbeat("Repository cloned successfully to: " + mirrorPath);
            return mirrorPath.toString();

        } catch (IOException e) {
            throw new ProviderUnavailableException(
                "Failed to clone repository: " + e.getMessage(), repositoryUrl, "Clone failed", e);
        }
    }

    @Override
    public boolean cleanupWorkspace(String workspacePath) {
        ActivityExecutionContext context = Activity.getExecutionContext();

        try {
            context.heartbeat("Starting workspace cleanup: " + workspacePath);

            Path path = Paths.get(workspacePath);
            if (!Files.exists(path)) {
                context.heartbeat("Workspace does not exist, nothing to clean");
                return true;
            }

            LocalGitProvider.deleteDirectory(path);
            logger.info("Workspace {} cleaned", workspacePath);
            return !Files.exists(path);

        } catch (IOException e) {
            throw Activity.wrap(new IOException("Failed to cleanup workspace: " + e.getMessage(), e));
        }
    }
}
