package ai.palicorpus.translator.batch;

import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.TextSlot;
import ai.palicorpus.translator.corpus.io.CorpusJson;
import ai.palicorpus.translator.extract.ExtractionResult;
import ai.palicorpus.translator.extract.MissingUnitExtractor;
import ai.palicorpus.translator.extract.ReviewItem;
import ai.palicorpus.translator.extract.TranslatableUnit;
import ai.palicorpus.translator.merge.MergeConflict;
import ai.palicorpus.translator.merge.MergeEngine;
import ai.palicorpus.translator.merge.MergeResult;
import ai.palicorpus.translator.sanitize.SanitizationResult;
import ai.palicorpus.translator.sanitize.TextSanitizer;
import ai.palicorpus.translator.sanitize.ValidationError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-based hand-off of batches to an offline translator.
 *
 * <p>Export writes {@code chunk_01.json}, {@code chunk_02.json}, ... with blank target fields. Import reads
 * the filled-in {@code chunk_NN_completed.json} files and merges every value that passes the sanitizer.
 */
public class BatchExchange {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchExchange.class);
    private static final Pattern COMPLETED_FILE = Pattern.compile("chunk_\\d+_completed\\.json");
    private static final TypeReference<List<BatchEntry>> ENTRIES = new TypeReference<>() { };

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final MissingUnitExtractor extractor;
    private final TextSanitizer sanitizer;
    private final MergeEngine mergeEngine;

    public BatchExchange(MissingUnitExtractor extractor, TextSanitizer sanitizer, MergeEngine mergeEngine) {
        this(CorpusJson.newMapper(), extractor, sanitizer, mergeEngine);
    }

    public BatchExchange(ObjectMapper mapper, MissingUnitExtractor extractor, TextSanitizer sanitizer,
                         MergeEngine mergeEngine) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.writer = CorpusJson.prettyWriter(mapper);
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine");
    }

    public static String fileNameFor(TranslationBatch batch) {
        return "chunk_%02d.json".formatted(batch.index() + 1);
    }

    public List<Path> export(List<TranslationBatch> batches, Path directory) {
        Objects.requireNonNull(directory, "directory");
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            for (TranslationBatch batch : batches) {
                List<BatchEntry> entries = batch.units().stream().map(BatchExchange::toEntry).toList();
                Path file = directory.resolve(fileNameFor(batch));
                Files.writeString(file, writer.writeValueAsString(entries) + "\n");
                written.add(file);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to export batches to " + directory, ex);
        }
        LOGGER.info("Exported {} batch file(s) to {}", written.size(), directory);
        return written;
    }

    private static BatchEntry toEntry(TranslatableUnit unit) {
        Map<String, String> targets = new LinkedHashMap<>();
        for (Language language : unit.missingLanguages()) {
            targets.put(language.key(), "");
        }
        return new BatchEntry(unit.sourceText(), targets, unit.usageCount(), unit.canonicalLocation().toString());
    }

    public BatchImportReport importCompleted(Path directory, CorpusTree tree, Set<Language> languages, boolean force) {
        Objects.requireNonNull(tree, "tree");
        List<Path> files = completedFiles(directory);
        ExtractionResult extraction = extractor.extract(tree, languages);
        Map<String, TranslatableUnit> unitsBySource = new HashMap<>();
        for (TranslatableUnit unit : extraction.units()) {
            unitsBySource.put(unit.sourceText().strip(), unit);
        }

        int applied = 0;
        int unchanged = 0;
        int skipped = 0;
        List<ReviewItem> review = new ArrayList<>();
        List<MergeConflict> conflicts = new ArrayList<>();
        for (Path file : files) {
            for (BatchEntry entry : readEntries(file)) {
                if (entry.sourceText() == null) {
                    LOGGER.warn("Skipping entry without sourceText in {}", file.getFileName());
                    continue;
                }
                TranslatableUnit unit = unitsBySource.get(entry.sourceText().strip());
                for (Map.Entry<String, String> field : entry.targetFields().entrySet()) {
                    if (TextSlot.isMissingValue(field.getValue())) {
                        continue;
                    }
                    Language language = Language.from(field.getKey());
                    if (unit == null || !languages.contains(language) || !unit.isMissing(language)) {
                        skipped++;
                        continue;
                    }
                    SanitizationResult result = sanitizer.sanitize(field.getValue(), unit.sourceText(), language);
                    if (!result.isAccepted()) {
                        ValidationError error = result.error().orElseThrow();
                        review.add(new ReviewItem(unit.canonicalLocation(), language, unit.sourceText(),
                                error.kind().name(), error.message()));
                        continue;
                    }
                    MergeResult merge = mergeEngine.merge(tree, unit, language, result.text().orElseThrow(), force);
                    if (merge.isConflict()) {
                        conflicts.addAll(merge.conflicts());
                    } else if (merge.isNoOp()) {
                        unchanged++;
                    } else {
                        applied++;
                    }
                }
            }
        }
        LOGGER.info("Imported {} file(s): {} applied, {} unchanged, {} skipped, {} for review, {} conflicts",
                files.size(), applied, unchanged, skipped, review.size(), conflicts.size());
        return new BatchImportReport(files.size(), applied, unchanged, skipped, review, conflicts);
    }

    private List<Path> completedFiles(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Batch directory does not exist: " + directory);
        }
        try (Stream<Path> listing = Files.list(directory)) {
            return listing
                    .filter(path -> COMPLETED_FILE.matcher(path.getFileName().toString()).matches())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + directory, ex);
        }
    }

    private List<BatchEntry> readEntries(Path file) {
        try {
            return mapper.readValue(file.toFile(), ENTRIES);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Malformed batch file " + file + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read batch file " + file, ex);
        }
    }
}
