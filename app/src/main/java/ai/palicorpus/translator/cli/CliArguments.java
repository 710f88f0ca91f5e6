package ai.palicorpus.translator.cli;

import ai.palicorpus.translator.config.LogFormat;
import ai.palicorpus.translator.config.Mode;
import ai.palicorpus.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "pali-corpus-translator", mixinStandardHelpOptions = true,
        description = "Fills missing English and Sinhala translations in a Pali corpus")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class,
            description = "Execution mode: translate, extract, apply, load or status")
    private Mode mode;

    @CommandLine.Option(names = "--corpus-root", description = "Directory holding collection.json or book.json", paramLabel = "DIR")
    private Path corpusRoot;

    @CommandLine.Option(names = "--scope", description = "Node key limiting the run to a subtree, e.g. silakkhandha/chapterA", paramLabel = "KEY")
    private String scope;

    @CommandLine.Option(names = "--languages", description = "Comma separated target languages (english,sinhala)", paramLabel = "LANGS")
    private String languages;

    @CommandLine.Option(names = "--batch-size", description = "Units per batch", paramLabel = "N")
    private Integer batchSize;

    @CommandLine.Option(names = "--limit", description = "Maximum number of units to translate in this run", paramLabel = "COUNT")
    private Integer translationLimit;

    @CommandLine.Option(names = "--resume-from", description = "Resume after this node or slot key instead of the stored checkpoint", paramLabel = "KEY")
    private String resumeFrom;

    @CommandLine.Option(names = "--force", description = "Overwrite conflicting existing translations")
    private boolean force;

    @CommandLine.Option(names = "--batch-dir", description = "Directory for exported and completed batch files", paramLabel = "DIR")
    private Path batchDirectory;

    @CommandLine.Option(names = "--database", description = "SQLite database file for load mode", paramLabel = "FILE")
    private Path databasePath;

    @CommandLine.Option(names = "--dry-run", description = "Run without writing the corpus or checkpoints")
    private boolean dryRun;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Mode mode() {
        return mode;
    }

    public Path corpusRoot() {
        return corpusRoot;
    }

    public String scope() {
        return scope;
    }

    public String languages() {
        return languages;
    }

    public Integer batchSize() {
        return batchSize;
    }

    public Integer translationLimit() {
        return translationLimit;
    }

    public String resumeFrom() {
        return resumeFrom;
    }

    public boolean force() {
        return force;
    }

    public Path batchDirectory() {
        return batchDirectory;
    }

    public Path databasePath() {
        return databasePath;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
