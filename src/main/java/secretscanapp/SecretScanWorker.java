package secretscanapp;

import io.temporal.client.WorkflowClient;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker that processes secret scanning workflows and activities
 *
 * Environment: TEMPORAL_ADDRESS, TASK_QUEUE, SCAN_WORKSPACE_DIR, GITHUB_TOKEN, GITHUB_API_URL
 */
public class SecretScanWorker {
    private static final Logger logger = LoggerFactory.getLogger(SecretScanWorker.class);

    public static void main(String[] args) {
        String temporalAddress = env("TEMPORAL_ADDRESS", "localhost:7233");
        String taskQueue = env("TASK_QUEUE", Shared.SECRET_SCAN_TASK_QUEUE);
        String githubToken = env("GITHUB_TOKEN", null);
        String githubApiUrl = env("GITHUB_API_URL", null);

        logger.info("Connecting to Temporal service at: {}", temporalAddress);

        WorkflowServiceStubs serviceStub = WorkflowServiceStubs.newServiceStubs(
            WorkflowServiceStubsOptions.newBuilder()
                .setTarget(temporalAddress)
                .build()
        );
        WorkflowClient client = WorkflowClient.newInstance(serviceStub);
        WorkerFactory factory = WorkerFactory.newInstance(client);

        Worker worker = factory.newWorker(taskQueue);
        registerWorkerComponents(worker, githubToken, githubApiUrl);

        logger.info("Secret Scan Worker started on task queue {}", taskQueue);
        logger.info("Workspace base directory: {}", Shared.WORKSPACE_BASE_DIR);
        logger.info("Detection rules loaded: {} (catalog {})",
            PatternRegistry.defaultRegistry().size(), SecretPatternCatalog.VERSION);
        if (githubToken == null) {
            logger.info("GITHUB_TOKEN not set; remote scans use the unauthenticated API quota");
        }

        factory.start();
    }

    /**
     * Register workflow and activity implementations with a worker
     */
    static void registerWorkerComponents(Worker worker, String githubToken, String githubApiUrl) {
        worker.registerWorkflowImplementationTypes(SecretScanWorkflowImpl.class);
        worker.registerActivitiesImplementations(
            new RepositoryActivityImpl(),
            new SecretScanActivityImpl(PatternRegistry.defaultRegistry(), githubToken, githubApiUrl)
        );
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }
}
