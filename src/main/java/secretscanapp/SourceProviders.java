package secretscanapp;

/**
 * Default provider selection: the request's mode picks the implementation
 */
public final class SourceProviders implements SourceProviderFactory {

    @Override
    public SourceProvider create(ScanRequest request) {
        ScanConfig config = request.effectiveConfig();
        switch (request.getMode()) {
            case LOCAL:
                return new LocalGitProvider(request.getRepositoryUrl(), config);
            case REMOTE:
                return new RemoteApiProvider(request.getRepositoryUrl(), config);
            default:
                throw new IllegalArgumentException("Unsupported scan mode: " + request.getMode());
        }
    }
}
