package secretscanapp;

/**
 * Creates the source provider for a scan request
 */
@FunctionalInterface
public interface SourceProviderFactory {

    SourceProvider create(ScanRequest request);
}
