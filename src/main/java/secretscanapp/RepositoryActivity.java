package secretscanapp;

import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * Activity interface for mirror clone management
 */
@ActivityInterface
public interface RepositoryActivity {

    /**
     * Mirror-clone the repository into the request's workspace
     * @param request Scan request containing repository information
     * @return Path to the mirror clone
     */
    @ActivityMethod
    String cloneMirror(ScanRequest request);

    /**
     * Delete a scan workspace and everything in it
     * @param workspacePath Path to workspace directory to clean
     * @return True if cleanup was successful
     */
    @ActivityMethod
    boolean cleanupWorkspace(String workspacePath);
}
