package ai.palicorpus.translator.config;

import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.sanitize.SanitizerSettings;
import ai.palicorpus.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 *
 * @param scope node key restricting the run to a subtree; empty means the whole corpus
 * @param maxUnitsPerRun units to translate before pausing; 0 means no limit
 * @param lockStaleAfter age after which another owner's session lock may be taken over
 */
public record Config(
        Mode mode,
        Path corpusRoot,
        Optional<String> scope,
        Set<Language> languages,
        int batchSize,
        int maxUnitsPerRun,
        Optional<String> resumeFrom,
        boolean force,
        Path batchDirectory,
        Path databasePath,
        Path checkpointDirectory,
        Duration lockStaleAfter,
        boolean dryRun,
        TranslationMode translationMode,
        LogFormat logFormat,
        TranslatorConfig translatorConfig,
        SanitizerSettings sanitizerSettings,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(corpusRoot, "corpusRoot");
        scope = scope == null ? Optional.empty() : scope.filter(value -> !value.isBlank());
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
        Objects.requireNonNull(batchDirectory, "batchDirectory");
        Objects.requireNonNull(databasePath, "databasePath");
        Objects.requireNonNull(checkpointDirectory, "checkpointDirectory");
        Objects.requireNonNull(lockStaleAfter, "lockStaleAfter");
        if (lockStaleAfter.isNegative() || lockStaleAfter.isZero()) {
            throw new IllegalArgumentException("lockStaleAfter must be positive");
        }
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        sanitizerSettings = sanitizerSettings == null ? SanitizerSettings.defaults() : sanitizerSettings;
        secrets = secrets == null ? Secrets.none() : secrets;
        if (resumeFrom.isPresent() && mode != Mode.TRANSLATE) {
            throw new IllegalArgumentException("--resume-from can only be used in translate mode");
        }
    }
}
