package secretscanapp;

import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Workflow interface for secret scanning
 */
@WorkflowInterface
public interface SecretScanWorkflow {

    /**
     * Scan a repository for exposed secrets
     * @param request Scan request containing repository and scan configuration
     * @return Final job snapshot, completed with a result or failed with a message
     */
    @WorkflowMethod
    ScanJob scan(ScanRequest request);

    /**
     * Current job snapshot, queryable while the scan runs and after it finished
     */
    @QueryMethod
    ScanJob getStatus();
}
