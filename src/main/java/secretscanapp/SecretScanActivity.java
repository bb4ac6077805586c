package secretscanapp;

import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/**
 * Activity interface for the secret scan itself
 */
@ActivityInterface
public interface SecretScanActivity {

    /**
     * Scan a repository for exposed secrets. Progress is reported through heartbeat details
     * ({@link ScanProgress}).
     * @param request Scan request
     * @param mirrorPath Mirror clone made by {@link RepositoryActivity#cloneMirror}, null in remote mode
     * @return Findings and summary
     */
    @ActivityMethod
    ScanResult scanRepository(ScanRequest request, String mirrorPath);
}
