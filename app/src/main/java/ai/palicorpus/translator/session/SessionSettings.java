package ai.palicorpus.translator.session;

import ai.palicorpus.translator.corpus.Language;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Per-run options of the session driver.
 *
 * @param maxUnitsPerRun units to process before pausing; 0 means no limit
 * @param resumeFrom operator-supplied node or slot key overriding the stored checkpoint position
 * @param force overwrite conflicting existing translations
 * @param owner lock owner identity of this run
 */
public record SessionSettings(Set<Language> languages,
                              int batchSize,
                              int maxUnitsPerRun,
                              Optional<String> resumeFrom,
                              boolean force,
                              String owner) {

    public static final int DEFAULT_BATCH_SIZE = 200;

    public SessionSettings {
        if (languages == null || languages.isEmpty()) {
            throw new IllegalArgumentException("At least one target language is required");
        }
        languages = Collections.unmodifiableSet(EnumSet.copyOf(languages));
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (maxUnitsPerRun < 0) {
            throw new IllegalArgumentException("maxUnitsPerRun must be zero or greater");
        }
        resumeFrom = resumeFrom == null ? Optional.empty() : resumeFrom.filter(value -> !value.isBlank());
        owner = owner == null || owner.isBlank() ? defaultOwner() : owner;
    }

    public static SessionSettings defaults(Set<Language> languages) {
        return new SessionSettings(languages, DEFAULT_BATCH_SIZE, 0, Optional.empty(), false, null);
    }

    public static String defaultOwner() {
        return "pid-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
