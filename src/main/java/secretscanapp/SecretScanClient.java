package secretscanapp;

import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for starting secret scan workflows and polling their status
 */
public class SecretScanClient {
    private static final Logger logger = LoggerFactory.getLogger(SecretScanClient.class);

    private final WorkflowServiceStubs serviceStub; // Null when the client was handed in
    private final WorkflowClient client;

    /**
     * @param temporalAddress Temporal service address, e.g. localhost:7233
     */
    public SecretScanClient(String temporalAddress) {
        this.serviceStub = WorkflowServiceStubs.newServiceStubs(
            WorkflowServiceStubsOptions.newBuilder()
                .setTarget(temporalAddress)
                .build()
        );
        this.client = WorkflowClient.newInstance(serviceStub);
    }

    public SecretScanClient(WorkflowClient client) {
        this.serviceStub = null;
        this.client = client;
    }

    /**
     * Validate a scan request and start its workflow
     *
     * @return Workflow ID ({@code secret-scan-{scanId}})
     * @throws InvalidRepositoryUrlException if the repository URL is not acceptable for the mode
     */
    public String submitScan(ScanRequest request) {
        RepositoryUrls.validate(request.getRepositoryUrl(), request.getMode());

        String workflowId = request.generateWorkflowId();
        String taskQueue = request.getScanConfig() != null && request.getScanConfig().getTaskQueue() != null
            ? request.getScanConfig().getTaskQueue()
            : Shared.SECRET_SCAN_TASK_QUEUE;

        WorkflowOptions options = WorkflowOptions.newBuilder()
            .setTaskQueue(taskQueue)
            .setWorkflowId(workflowId)
            .build();
        SecretScanWorkflow workflow = client.newWorkflowStub(SecretScanWorkflow.class, options);

        WorkflowExecution execution = WorkflowClient.start(workflow::scan, request);
        logger.info("Started {} scan of {} (workflow {}, run {})", request.getMode().getId(),
            RepositoryUrls.toWebUrl(request.getRepositoryUrl()), workflowId, execution.getRunId());
        return workflowId;
    }

    /**
     * Current status of a scan, read through the workflow query
     */
    public ScanJob getStatus(String scanId) {
        SecretScanWorkflow workflow =
            client.newWorkflowStub(SecretScanWorkflow.class, Shared.workflowIdForScan(scanId));
        return workflow.getStatus();
    }

    /**
     * Block until the scan finished and return the final job snapshot
     */
    public ScanJob awaitResult(String scanId) {
        WorkflowStub stub = client.newUntypedWorkflowStub(Shared.workflowIdForScan(scanId));
        return stub.getResult(ScanJob.class);
    }

    public ScanJob submitScanAndWait(ScanRequest request) {
        submitScan(request);
        return awaitResult(request.getScanId());
    }

    public void shutdown() {
        if (serviceStub != null) {
            serviceStub.shutdown();
        }
    }
}
