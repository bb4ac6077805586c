package secretscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process scan execution: every submitted job runs on its own worker thread and publishes its
 * progress to the {@link ScanJobStore}, where callers poll it.
 */
public class ScanJobService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ScanJobService.class);

    private final ScanJobStore store;
    private final SourceProviderFactory providers;
    private final PatternRegistry registry;
    private final ExecutorService workers;
    private final Map<String, CancellationToken> running = new ConcurrentHashMap<>();

    public ScanJobService() {
        this(new ScanJobStore(), new SourceProviders(), PatternRegistry.defaultRegistry());
    }

    public ScanJobService(ScanJobStore store, SourceProviderFactory providers, PatternRegistry registry) {
        this.store = store;
        this.providers = providers;
        this.registry = registry;
        AtomicInteger threadNumber = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "scan-worker-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Validate the request and start the scan in the background.
     *
     * @return snapshot of the new job, already running
     * @throws InvalidRepositoryUrlException if the repository URL is not acceptable for the mode
     */
    public ScanJob submit(ScanRequest request) {
        RepositoryUrls.validate(request.getRepositoryUrl(), request.getMode());
        if (request.getScanId() == null) {
            throw new IllegalArgumentException("Scan request has no scan id");
        }

        String jobId = request.getScanId();
        ScanJob job = store.create(
            ScanJob.pending(jobId, request.getRepositoryUrl(), request.getMode(), Instant.now().toString())
                .start("Starting scan..."));
        CancellationToken token = new CancellationToken();
        running.put(jobId, token);
        logger.info("Submitted {} scan {} for {}", request.getMode().getId(), jobId,
            RepositoryUrls.toWebUrl(request.getRepositoryUrl()));

        workers.submit(() -> runJob(request, token));
        return job;
    }

    public Optional<ScanJob> getJob(String jobId) {
        return store.get(jobId);
    }

    /**
     * Request cancellation of a running job
     *
     * @return false if the job is unknown or already finished
     */
    public boolean cancel(String jobId) {
        CancellationToken token = running.get(jobId);
        if (token == null) {
            return false;
        }
        token.cancel();
        logger.info("Cancellation requested for scan {}", jobId);
        return true;
    }

    public ScanJobStore getStore() {
        return store;
    }

    private void runJob(ScanRequest request, CancellationToken token) {
        String jobId = request.getScanId();
        try (SourceProvider provider = providers.create(request)) {
            ScanOrchestrator orchestrator = new ScanOrchestrator(provider, registry, request);
            ScanResult result = orchestrator.run(new JobProgressReporter(store, jobId), token);
            store.update(jobId, job -> job.complete(result, "Scan completed! Found "
                + result.getSummary().getTotal() + " secrets in "
                + result.getSummary().getCommitsScanned() + " commits"));
        } catch (ScanCancelledException e) {
            logger.info("Scan {} cancelled", jobId);
            store.update(jobId, job -> job.fail(e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Scan {} failed: {}", jobId, e.getMessage(), e);
            store.update(jobId, job -> job.fail(describe(e)));
        } finally {
            running.remove(jobId);
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Cancel running jobs and stop the workers
     */
    @Override
    public void close() {
        running.values().forEach(CancellationToken::cancel);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
