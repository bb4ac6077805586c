package secretscanapp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable, compiled-once corpus of detection rules.
 * Rules whose regex does not compile are dropped at load time and never reach a scan.
 */
public final class PatternRegistry implements Iterable<SecretPattern> {
    private static final Logger logger = LoggerFactory.getLogger(PatternRegistry.class);

    private static final PatternRegistry DEFAULT = compile(SecretPatternCatalog.DEFINITIONS);

    private final List<SecretPattern> patterns;

    private PatternRegistry(List<SecretPattern> patterns) {
        this.patterns = Collections.unmodifiableList(patterns);
    }

    /**
     * Registry built from {@link SecretPatternCatalog}, compiled once per process
     */
    public static PatternRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Compile a list of rule definitions, preserving their order
     */
    public static PatternRegistry compile(List<PatternDefinition> definitions) {
        List<SecretPattern> compiled = new ArrayList<>(definitions.size());
        for (PatternDefinition definition : definitions) {
            try {
                Pattern pattern = Pattern.compile(definition.getRegex());
                compiled.add(new SecretPattern(definition.getName(), pattern, definition.getSeverity()));
            } catch (PatternSyntaxException e) {
                logger.warn("Dropping detection rule '{}': regex does not compile ({})",
                    definition.getName(), e.getDescription());
            }
        }
        logger.debug("Compiled {} of {} detection rules", compiled.size(), definitions.size());
        return new PatternRegistry(compiled);
    }

    public int size() {
        return patterns.size();
    }

    @Override
    public Iterator<SecretPattern> iterator() {
        return patterns.iterator();
    }
}
