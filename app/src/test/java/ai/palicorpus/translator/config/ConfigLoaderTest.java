package ai.palicorpus.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.palicorpus.translator.cli.CliArguments;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ConfigLoaderTest {

    @TempDir
    Path corpusRoot;

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "translate",
                "--corpus-root", corpusRoot.toString(),
                "--scope", "silakkhandha/chapterA",
                "--languages", "sinhala",
                "--batch-size", "50",
                "--limit", "5",
                "--resume-from", "chapterA/section3",
                "--force",
                "--dry-run");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.TRANSLATE);
        assertThat(config.corpusRoot()).isEqualTo(corpusRoot.toAbsolutePath().normalize());
        assertThat(config.scope()).contains("silakkhandha/chapterA");
        assertThat(config.languages()).containsExactly(Language.SINHALA);
        assertThat(config.batchSize()).isEqualTo(50);
        assertThat(config.maxUnitsPerRun()).isEqualTo(5);
        assertThat(config.resumeFrom()).contains("chapterA/section3");
        assertThat(config.force()).isTrue();
        assertThat(config.dryRun()).isTrue();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(config.translatorConfig().modelName()).isEqualTo("gemini-2.5-flash");
        assertThat(config.translatorConfig().baseUrl()).isEmpty();
        assertThat(config.secrets().geminiApiKey()).isEmpty();
    }

    @Test
    void appliesDefaultsRelativeToCorpusRoot() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--corpus-root", corpusRoot.toString(),
                "--translation-mode", "mock");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);
        Path root = corpusRoot.toAbsolutePath().normalize();

        assertThat(config.mode()).isEqualTo(Mode.TRANSLATE);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.languages()).containsExactlyInAnyOrder(Language.ENGLISH, Language.SINHALA);
        assertThat(config.batchSize()).isEqualTo(200);
        assertThat(config.maxUnitsPerRun()).isZero();
        assertThat(config.checkpointDirectory()).isEqualTo(root.resolve(".checkpoints"));
        assertThat(config.batchDirectory()).isEqualTo(root.resolve("batches"));
        assertThat(config.databasePath()).isEqualTo(root.resolve("corpus.db"));
        assertThat(config.lockStaleAfter()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.translatorConfig().retryPolicy().maxAttempts()).isEqualTo(6);
        assertThat(config.translatorConfig().retryPolicy().initialBackoff()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.translatorConfig().retryPolicy().maxBackoff()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.translatorConfig().requestsPerMinute()).isEqualTo(10);
        assertThat(config.translatorConfig().minRequestInterval()).isEqualTo(Duration.ofMillis(2000));
        assertThat(config.sanitizerSettings().maxLengthRatio()).isEqualTo(5.0);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_CORPUS_ROOT, corpusRoot.toString());
        envValues.put(ConfigLoader.ENV_MODE, "status");
        envValues.put(ConfigLoader.ENV_TRANSLATION_LANGUAGES, "english, sinhala");
        envValues.put(ConfigLoader.ENV_BATCH_SIZE, "25");
        envValues.put(ConfigLoader.ENV_MAX_UNITS_PER_RUN, "7");
        envValues.put(ConfigLoader.ENV_CHECKPOINT_DIR, "/var/lib/checkpoints");
        envValues.put(ConfigLoader.ENV_LOCK_STALE_MINUTES, "5");
        envValues.put(ConfigLoader.ENV_LLM_PROVIDER, "ollama");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_LLM_MODEL, "custom-gguf");
        envValues.put(ConfigLoader.ENV_LLM_MAX_RETRY_ATTEMPTS, "2");
        envValues.put(ConfigLoader.ENV_LLM_REQUESTS_PER_MINUTE, "0");
        envValues.put(ConfigLoader.ENV_SANITIZER_MAX_LENGTH_RATIO, "3.5");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_GEMINI_API_KEY, "gemini-key");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.STATUS);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(config.languages()).containsExactlyInAnyOrder(Language.ENGLISH, Language.SINHALA);
        assertThat(config.batchSize()).isEqualTo(25);
        assertThat(config.maxUnitsPerRun()).isEqualTo(7);
        assertThat(config.checkpointDirectory()).isEqualTo(Path.of("/var/lib/checkpoints"));
        assertThat(config.lockStaleAfter()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.translatorConfig().baseUrl()).contains("http://ollama:11434");
        assertThat(config.translatorConfig().modelName()).isEqualTo("custom-gguf");
        assertThat(config.translatorConfig().retryPolicy().maxAttempts()).isEqualTo(2);
        assertThat(config.translatorConfig().requestsPerMinute()).isZero();
        assertThat(config.sanitizerSettings().maxLengthRatio()).isEqualTo(3.5);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.secrets().geminiApiKey()).contains("gemini-key");
        assertThat(config.secrets().toString()).doesNotContain("gemini-key");
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_DRY_RUN);
    }

    @Test
    void cliOverridesEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_CORPUS_ROOT, "/ignored",
                ConfigLoader.ENV_BATCH_SIZE, "25",
                ConfigLoader.ENV_MODE, "load"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--corpus-root", corpusRoot.toString(),
                "--batch-size", "10",
                "--mode", "extract");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.EXTRACT);
        assertThat(config.corpusRoot()).isEqualTo(corpusRoot.toAbsolutePath().normalize());
        assertThat(config.batchSize()).isEqualTo(10);
    }

    @Test
    void missingGeminiKeyForProductionTranslationThrows() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_CORPUS_ROOT, corpusRoot.toString()));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void missingGeminiKeyIsFineOutsideTranslation() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--corpus-root", corpusRoot.toString(),
                "--mode", "load");

        Config config = new ConfigLoader(EnvironmentReader.of(Map.of())).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.LOAD);
        assertThat(config.secrets().geminiApiKey()).isEmpty();
    }

    @Test
    void missingCorpusRootIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--dry-run");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("corpus root");
    }

    @Test
    void resumeOutsideTranslateModeCausesValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--corpus-root", corpusRoot.toString(),
                "--mode", "apply",
                "--resume-from", "chapterA");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("translate mode");
    }

    @Test
    void rejectsInvalidNumbersAndLanguages() {
        CliArguments negativeLimit = CommandLine.populateCommand(new CliArguments(),
                "--corpus-root", corpusRoot.toString(), "--dry-run", "--limit=-1");
        CliArguments unknownLanguage = CommandLine.populateCommand(new CliArguments(),
                "--corpus-root", corpusRoot.toString(), "--dry-run", "--languages", "english,tamil");
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());
        ConfigLoader badEnv = new ConfigLoader(new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_BATCH_SIZE, "many")));

        assertThat(catchThrowable(() -> loader.load(negativeLimit)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--limit");
        assertThat(catchThrowable(() -> loader.load(unknownLanguage)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(() -> badEnv.load(CommandLine.populateCommand(new CliArguments(),
                "--corpus-root", corpusRoot.toString(), "--dry-run"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_BATCH_SIZE);
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
