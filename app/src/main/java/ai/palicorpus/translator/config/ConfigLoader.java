package ai.palicorpus.translator.config;

import ai.palicorpus.translator.cli.CliArguments;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.sanitize.SanitizerSettings;
import ai.palicorpus.translator.session.SessionSettings;
import ai.palicorpus.translator.translate.RetryPolicy;
import ai.palicorpus.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_CORPUS_ROOT = "CORPUS_ROOT";
    static final String ENV_MODE = "MODE";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_DRY_RUN = "DRY_RUN";
    static final String ENV_TRANSLATION_LANGUAGES = "TRANSLATION_LANGUAGES";
    static final String ENV_BATCH_SIZE = "BATCH_SIZE";
    static final String ENV_MAX_UNITS_PER_RUN = "MAX_UNITS_PER_RUN";
    static final String ENV_CHECKPOINT_DIR = "CHECKPOINT_DIR";
    static final String ENV_LOCK_STALE_MINUTES = "LOCK_STALE_MINUTES";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_LLM_REQUESTS_PER_MINUTE = "LLM_REQUESTS_PER_MINUTE";
    static final String ENV_LLM_MIN_REQUEST_INTERVAL_MILLIS = "LLM_MIN_REQUEST_INTERVAL_MILLIS";
    static final String ENV_SANITIZER_MAX_LENGTH_RATIO = "SANITIZER_MAX_LENGTH_RATIO";
    static final String ENV_SANITIZER_MIN_SCRIPT_RATIO = "SANITIZER_MIN_SCRIPT_RATIO";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_CHECKPOINT_DIRECTORY = ".checkpoints";
    static final String DEFAULT_BATCH_DIRECTORY = "batches";
    static final String DEFAULT_DATABASE_FILE = "corpus.db";

    private static final Set<Language> DEFAULT_LANGUAGES = EnumSet.allOf(Language.class);
    private static final int DEFAULT_LOCK_STALE_MINUTES = 30;
    private static final int DEFAULT_LLM_MAX_RETRY_ATTEMPTS = 6;
    private static final int DEFAULT_LLM_INITIAL_BACKOFF_SECONDS = 2;
    private static final int DEFAULT_LLM_MAX_BACKOFF_SECONDS = 60;
    private static final double DEFAULT_LLM_RETRY_JITTER_FACTOR = 0.3;
    private static final int DEFAULT_LLM_REQUESTS_PER_MINUTE = 10;
    private static final int DEFAULT_LLM_MIN_REQUEST_INTERVAL_MILLIS = 2000;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        boolean dryRun = resolveDryRun(arguments);
        TranslationMode translationMode = resolveTranslationMode(arguments, dryRun);
        LogFormat logFormat = resolveLogFormat(arguments);

        Path corpusRoot = Optional.ofNullable(arguments.corpusRoot())
                .or(() -> env(ENV_CORPUS_ROOT).map(Path::of))
                .orElseThrow(() -> new IllegalArgumentException("corpus root must be provided"))
                .toAbsolutePath()
                .normalize();

        Set<Language> languages = Optional.ofNullable(arguments.languages())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> env(ENV_TRANSLATION_LANGUAGES))
                .map(ConfigLoader::parseLanguages)
                .orElse(DEFAULT_LANGUAGES);

        int batchSize = resolveNonNegative(arguments.batchSize(), "--batch-size", ENV_BATCH_SIZE,
                SessionSettings.DEFAULT_BATCH_SIZE);
        int maxUnitsPerRun = resolveNonNegative(arguments.translationLimit(), "--limit", ENV_MAX_UNITS_PER_RUN, 0);

        Path checkpointDirectory = env(ENV_CHECKPOINT_DIR)
                .map(Path::of)
                .orElse(corpusRoot.resolve(DEFAULT_CHECKPOINT_DIRECTORY));
        Path batchDirectory = Optional.ofNullable(arguments.batchDirectory())
                .orElse(corpusRoot.resolve(DEFAULT_BATCH_DIRECTORY));
        Path databasePath = Optional.ofNullable(arguments.databasePath())
                .orElse(corpusRoot.resolve(DEFAULT_DATABASE_FILE));
        Duration lockStaleAfter = Duration.ofMinutes(intEnv(ENV_LOCK_STALE_MINUTES, DEFAULT_LOCK_STALE_MINUTES));

        Optional<String> geminiApiKey = env(ENV_GEMINI_API_KEY);

        LlmProvider provider = env(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.GEMINI);

        String modelName = env(ENV_LLM_MODEL).orElse(provider.defaultModel());

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(env(ENV_OLLAMA_BASE_URL).orElse("http://localhost:11434"));
        }

        RetryPolicy retryPolicy = new RetryPolicy(
                intEnv(ENV_LLM_MAX_RETRY_ATTEMPTS, DEFAULT_LLM_MAX_RETRY_ATTEMPTS),
                Duration.ofSeconds(intEnv(ENV_LLM_INITIAL_BACKOFF_SECONDS, DEFAULT_LLM_INITIAL_BACKOFF_SECONDS)),
                Duration.ofSeconds(intEnv(ENV_LLM_MAX_BACKOFF_SECONDS, DEFAULT_LLM_MAX_BACKOFF_SECONDS)),
                doubleEnv(ENV_LLM_RETRY_JITTER_FACTOR, DEFAULT_LLM_RETRY_JITTER_FACTOR));
        int requestsPerMinute = intEnv(ENV_LLM_REQUESTS_PER_MINUTE, DEFAULT_LLM_REQUESTS_PER_MINUTE);
        Duration minRequestInterval = Duration.ofMillis(
                intEnv(ENV_LLM_MIN_REQUEST_INTERVAL_MILLIS, DEFAULT_LLM_MIN_REQUEST_INTERVAL_MILLIS));

        SanitizerSettings sanitizerSettings = new SanitizerSettings(
                doubleEnv(ENV_SANITIZER_MAX_LENGTH_RATIO, SanitizerSettings.DEFAULT_MAX_LENGTH_RATIO),
                SanitizerSettings.DEFAULT_MINIMUM_LENGTH_ALLOWANCE,
                doubleEnv(ENV_SANITIZER_MIN_SCRIPT_RATIO, SanitizerSettings.DEFAULT_MIN_SCRIPT_RATIO));

        if (mode == Mode.TRANSLATE && translationMode == TranslationMode.PRODUCTION
                && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided for production translation with Gemini");
        }

        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl, retryPolicy,
                requestsPerMinute, minRequestInterval);

        return new Config(mode, corpusRoot, Optional.ofNullable(arguments.scope()), languages, batchSize,
                maxUnitsPerRun, Optional.ofNullable(arguments.resumeFrom()), arguments.force(), batchDirectory,
                databasePath, checkpointDirectory, lockStaleAfter, dryRun, translationMode, logFormat,
                translatorConfig, sanitizerSettings, new Secrets(geminiApiKey));
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_MODE)
                .map(Mode::from)
                .orElse(Mode.TRANSLATE);
    }

    private boolean resolveDryRun(CliArguments arguments) {
        if (arguments.dryRun()) {
            return true;
        }
        return env(ENV_DRY_RUN)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments, boolean dryRun) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return env(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(dryRun ? TranslationMode.DRY_RUN : TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return env(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveNonNegative(Integer cliValue, String optionName, String envKey, int defaultValue) {
        if (cliValue != null) {
            if (cliValue < 0) {
                throw new IllegalArgumentException(optionName + " must be zero or greater");
            }
            return cliValue;
        }
        return intEnv(envKey, defaultValue);
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private int intEnv(String key, int defaultValue) {
        return env(key)
                .map(raw -> parseNonNegativeInteger(key, raw))
                .orElse(defaultValue);
    }

    private double doubleEnv(String key, double defaultValue) {
        return env(key)
                .map(raw -> parseDouble(key, raw))
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static Set<Language> parseLanguages(String raw) {
        Set<Language> languages = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(Language::from)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Language.class)));
        if (languages.isEmpty()) {
            throw new IllegalArgumentException("At least one target language is required");
        }
        return languages;
    }

    private static int parseNonNegativeInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid double value for " + key + ": " + raw, ex);
        }
    }
}
