package ai.palicorpus.translator.cli;

import ai.palicorpus.translator.batch.BatchChunker;
import ai.palicorpus.translator.batch.BatchExchange;
import ai.palicorpus.translator.batch.BatchImportReport;
import ai.palicorpus.translator.batch.TranslationBatch;
import ai.palicorpus.translator.config.Config;
import ai.palicorpus.translator.config.ConfigLoader;
import ai.palicorpus.translator.config.EnvironmentReader;
import ai.palicorpus.translator.config.Secrets;
import ai.palicorpus.translator.config.TranslatorConfig;
import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.NodePath;
import ai.palicorpus.translator.corpus.io.CorpusReader;
import ai.palicorpus.translator.corpus.io.CorpusWriter;
import ai.palicorpus.translator.corpus.io.LoadedCorpus;
import ai.palicorpus.translator.extract.ExtractionResult;
import ai.palicorpus.translator.extract.MissingUnitExtractor;
import ai.palicorpus.translator.extract.ReviewItem;
import ai.palicorpus.translator.logging.LoggingConfigurator;
import ai.palicorpus.translator.merge.MergeConflict;
import ai.palicorpus.translator.merge.MergeEngine;
import ai.palicorpus.translator.sanitize.TextSanitizer;
import ai.palicorpus.translator.session.CheckpointStore;
import ai.palicorpus.translator.session.CorpusSaver;
import ai.palicorpus.translator.session.FileCheckpointStore;
import ai.palicorpus.translator.session.InMemoryCheckpointStore;
import ai.palicorpus.translator.session.SessionCheckpoint;
import ai.palicorpus.translator.session.SessionReport;
import ai.palicorpus.translator.session.SessionSettings;
import ai.palicorpus.translator.session.TranslationSessionDriver;
import ai.palicorpus.translator.sink.SinkLoadReport;
import ai.palicorpus.translator.sink.SqliteSinkAdapter;
import ai.palicorpus.translator.translate.ChatModelTranslator;
import ai.palicorpus.translator.translate.MockTranslator;
import ai.palicorpus.translator.translate.PassThroughTranslator;
import ai.palicorpus.translator.translate.RequestPacer;
import ai.palicorpus.translator.translate.TranslationService;
import ai.palicorpus.translator.translate.Translator;
import ai.palicorpus.translator.translate.TranslatorFactory;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the corpus pipeline.
 *
 * <p>Exit codes: 0 when the run completed or was paused by the operator, 2 when it paused on provider quota,
 * 1 when it paused on an error or failed.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_QUOTA = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Function<Config, ChatModel> chatModelFactory;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), CliApplication::createChatModel);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, ChatModel> chatModelFactory) {
        this.configLoader = configLoader;
        this.chatModelFactory = chatModelFactory;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_ERROR;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running in {} mode (dryRun={}, translationMode={}): corpus={} languages={}",
                config.mode(), config.dryRun(), config.translationMode(), config.corpusRoot(), config.languages());

        try {
            return execute(config, commandLine.getOut());
        } catch (RuntimeException ex) {
            LOGGER.error("{} failed: {}", config.mode(), ex.getMessage(), ex);
            return EXIT_ERROR;
        }
    }

    private int execute(Config config, PrintWriter out) {
        LoadedCorpus corpus = new CorpusReader().read(config.corpusRoot());
        CorpusTree tree = corpus.tree();
        NodePath scope = config.scope().map(tree::resolveNode).orElse(tree.root().path());
        return switch (config.mode()) {
            case TRANSLATE -> translate(config, corpus, scope);
            case EXTRACT -> extract(config, tree, scope);
            case APPLY -> apply(config, corpus);
            case LOAD -> load(config, tree);
            case STATUS -> status(config, tree, scope, out);
        };
    }

    private int translate(Config config, LoadedCorpus corpus, NodePath scope) {
        CorpusWriter writer = new CorpusWriter();
        CheckpointStore checkpointStore = config.dryRun()
                ? new InMemoryCheckpointStore()
                : new FileCheckpointStore(config.checkpointDirectory(), config.lockStaleAfter(), Clock.systemUTC());
        CorpusSaver saver = config.dryRun() ? CorpusSaver.discarding() : tree -> writer.write(corpus);
        TranslationSessionDriver driver = new TranslationSessionDriver(createTranslationService(config),
                new TextSanitizer(config.sanitizerSettings()), new MergeEngine(), checkpointStore, saver);
        SessionSettings settings = new SessionSettings(config.languages(), config.batchSize(),
                config.maxUnitsPerRun(), config.resumeFrom(), config.force(), null);

        SessionStopHook stopHook = new SessionStopHook(driver, SessionStopHook.DEFAULT_GRACE);
        Thread hookThread = new Thread(stopHook, "session-stop");
        Runtime.getRuntime().addShutdownHook(hookThread);
        SessionReport report;
        try {
            report = stopHook.guard(() -> driver.run(corpus.tree(), scope, settings));
        } finally {
            removeShutdownHook(hookThread);
        }

        logReviewItems(report.reviewItems());
        logConflicts(report.conflicts());
        LOGGER.info("Session {} ended {}: {} translated, {} reused, {} skipped by checkpoint, {} unit(s) processed",
                report.scope(), report.finalState(), report.translated(), report.reused(),
                report.skippedByCheckpoint(), report.unitsProcessed());
        report.failure().ifPresent(failure -> LOGGER.error("Session stopped: {}", failure));
        return switch (report.finalState()) {
            case PAUSED_QUOTA -> EXIT_QUOTA;
            case PAUSED_ERROR -> EXIT_ERROR;
            default -> EXIT_OK;
        };
    }

    private int extract(Config config, CorpusTree tree, NodePath scope) {
        ExtractionResult extraction = new MissingUnitExtractor().extract(tree, scope, config.languages());
        List<TranslationBatch> batches = new BatchChunker().chunk(extraction.units(), config.batchSize());
        if (config.dryRun()) {
            LOGGER.info("Dry run: would export {} unit(s) in {} batch file(s) to {}",
                    extraction.units().size(), batches.size(), config.batchDirectory());
            return EXIT_OK;
        }
        List<Path> files = newBatchExchange(config).export(batches, config.batchDirectory());
        LOGGER.info("Exported {} unit(s) in {} batch file(s) to {}", extraction.units().size(), files.size(),
                config.batchDirectory());
        return EXIT_OK;
    }

    private int apply(Config config, LoadedCorpus corpus) {
        BatchImportReport report = newBatchExchange(config)
                .importCompleted(config.batchDirectory(), corpus.tree(), config.languages(), config.force());
        logReviewItems(report.reviewItems());
        logConflicts(report.conflicts());
        LOGGER.info("Imported {} completed batch file(s): {} applied, {} unchanged, {} skipped",
                report.files(), report.applied(), report.unchanged(), report.skipped());
        if (config.dryRun()) {
            LOGGER.info("Dry run: corpus documents left untouched");
            return EXIT_OK;
        }
        List<Path> written = new CorpusWriter().write(corpus);
        LOGGER.info("Rewrote {} corpus document(s)", written.size());
        return EXIT_OK;
    }

    private int load(Config config, CorpusTree tree) {
        if (config.dryRun()) {
            LOGGER.info("Dry run: would load {} node(s) into {}", tree.nodeCount(), config.databasePath());
            return EXIT_OK;
        }
        SinkLoadReport report = new SqliteSinkAdapter(config.databasePath()).load(tree);
        LOGGER.info("Loaded {} book(s), {} chapter(s), {} section(s)", report.books(), report.chapters(),
                report.sections());
        return EXIT_OK;
    }

    private int status(Config config, CorpusTree tree, NodePath scope, PrintWriter out) {
        ExtractionResult extraction = new MissingUnitExtractor().extract(tree, scope, config.languages());
        out.printf("Scope: %s%n", scope);
        out.printf("Slots scanned: %d (complete: %d)%n", extraction.scannedSlots(), extraction.completeSlots());
        out.printf("Units missing translations: %d (%d pending translation(s))%n",
                extraction.units().size(), extraction.pendingTranslations());
        Optional<SessionCheckpoint> checkpoint =
                new FileCheckpointStore(config.checkpointDirectory(), config.lockStaleAfter(), Clock.systemUTC())
                        .load(scope.toString());
        if (checkpoint.isPresent()) {
            SessionCheckpoint value = checkpoint.get();
            out.printf("Checkpoint: %s, last completed %s at %s%s%n", value.state(),
                    value.lastCompleted().orElse("<none>"), value.timestamp(),
                    value.lockOwner() == null ? "" : " (locked by " + value.lockOwner() + ")");
            if (value.completedUnits() > 0) {
                out.printf("Progress: %d unit(s) done, last in batch %d of size %d%n", value.completedUnits(),
                        value.lastCompletedBatchIndex() + 1, value.batchSize());
            }
        } else {
            out.println("Checkpoint: <none>");
        }
        out.flush();
        return EXIT_OK;
    }

    private BatchExchange newBatchExchange(Config config) {
        return new BatchExchange(new MissingUnitExtractor(), new TextSanitizer(config.sanitizerSettings()),
                new MergeEngine());
    }

    private Translator createTranslationService(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        TranslatorFactory factory = new TranslatorFactory(
                () -> new ChatModelTranslator(chatModelFactory.apply(config), translatorConfig.provider().name(),
                        translatorConfig.modelName()),
                new PassThroughTranslator(),
                new MockTranslator());
        Translator selected = factory.select(config.translationMode());
        RequestPacer pacer = config.translationMode().callsProvider()
                ? new RequestPacer(translatorConfig.requestsPerMinute(), translatorConfig.minRequestInterval())
                : RequestPacer.unpaced();
        return new TranslationService(selected, translatorConfig.retryPolicy(), pacer);
    }

    private static void logReviewItems(List<ReviewItem> reviewItems) {
        for (ReviewItem item : reviewItems) {
            LOGGER.warn("Needs review: {} ({}) {}: {}", item.location(), item.language().key(), item.reason(),
                    item.detail());
        }
    }

    private static void logConflicts(List<MergeConflict> conflicts) {
        for (MergeConflict conflict : conflicts) {
            LOGGER.warn("Conflict at {} ({}): existing '{}' differs from proposed '{}'", conflict.location(),
                    conflict.language().key(), conflict.existing(), conflict.proposed());
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM shutdown in progress; stop hook stays registered");
        }
    }

    static ChatModel createChatModel(Config config) {
        TranslatorConfig translatorConfig = config.translatorConfig();
        return switch (translatorConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, config.secrets());
        };
    }

    private static ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.3)
                    .timeout(Duration.ofMinutes(2))
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private static ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.geminiApiKey()
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(0.3)
                    .timeout(Duration.ofMinutes(2))
                    .maxRetries(0)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
