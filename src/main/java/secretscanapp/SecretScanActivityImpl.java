package secretscanapp;

import io.temporal.activity.Activity;
import io.temporal.activity.ActivityExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Implementation of the secret scan activity
 */
public class SecretScanActivityImpl implements SecretScanActivity {
    private static final Logger logger = LoggerFactory.getLogger(SecretScanActivityImpl.class);

    private final PatternRegistry registry;
    private final String defaultApiToken;
    private final String defaultApiBaseUrl;

    public SecretScanActivityImpl() {
        this(PatternRegistry.defaultRegistry(), null, null);
    }

    /**
     * @param defaultApiToken token for remote scans whose request carries none (may be null)
     * @param defaultApiBaseUrl API base URL for remote scans whose request carries none (may be null)
     */
    public SecretScanActivityImpl(PatternRegistry registry, String defaultApiToken, String defaultApiBaseUrl) {
        this.registry = registry;
        this.defaultApiToken = defaultApiToken;
        this.defaultApiBaseUrl = defaultApiBaseUrl;
    }

    @Override
    public ScanResult scanRepository(ScanRequest request, String mirrorPath) {
        ActivityExecutionContext context = Activity.getExecutionContext();
        HeartbeatProgressReporter reporter = new HeartbeatProgressReporter(context);
        ScanConfig config = withWorkerDefaults(request.effectiveConfig());

        try (SourceProvider provider = createProvider(request, mirrorPath, config, reporter)) {
            ScanResult result = new ScanOrchestrator(provider, registry, request)
                .run(reporter, CancellationToken.none());
            logger.info("Scan {} found {} secrets", request.getScanId(), result.getSummary().getTotal());
            return result;
        }
    }

    private SourceProvider createProvider(ScanRequest request, String mirrorPath, ScanConfig config,
                                          HeartbeatProgressReporter reporter) {
        switch (request.getMode()) {
            case LOCAL:
                if (mirrorPath == null) {
                    throw new ProviderUnavailableException("No mirror clone for local scan " + request.getScanId(),
                        request.getRepositoryUrl(), "Missing mirror clone");
                }
                return LocalGitProvider.forExistingMirror(Paths.get(mirrorPath), request.getRepositoryUrl(),
                    config, new GitCommandRunner(reporter::beat));
            case REMOTE:
                return new RemoteApiProvider(request.getRepositoryUrl(), config);
            default:
                throw new IllegalArgumentException("Unsupported scan mode: " + request.getMode());
        }
    }

    private ScanConfig withWorkerDefaults(ScanConfig config) {
        if (config.getApiToken() == null && defaultApiToken != null) {
            config.setApiToken(defaultApiToken);
        }
        if (defaultApiBaseUrl != null
                && (config.getApiBaseUrl() == null || Shared.GITHUB_API_URL.equals(config.getApiBaseUrl()))) {
            config.setApiBaseUrl(defaultApiBaseUrl);
        }
        return config;
    }
}
