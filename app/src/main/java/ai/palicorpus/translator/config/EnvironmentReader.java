package ai.palicorpus.translator.config;

import java.util.Map;
import java.util.Optional;

/**
 * Source of environment settings for {@link ConfigLoader}.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    /**
     * Fixed settings, e.g. read from a file or supplied by a test.
     */
    static EnvironmentReader of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return key -> Optional.ofNullable(copy.get(key));
    }
}
