package ai.palicorpus.translator.corpus.io;

import ai.palicorpus.translator.corpus.BookNode;
import ai.palicorpus.translator.corpus.ChapterNode;
import ai.palicorpus.translator.corpus.CollectionNode;
import ai.palicorpus.translator.corpus.CorpusNode;
import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.FieldKind;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.SectionNode;
import ai.palicorpus.translator.corpus.SlotPath;
import ai.palicorpus.translator.corpus.TextSlot;
import ai.palicorpus.translator.corpus.TreeIntegrityException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a persisted corpus into a {@link CorpusTree}.
 *
 * <p>A root holding {@code collection.json} is read as a collection of books; a root holding only
 * {@code book.json} is read as a single book. Chapter documents are resolved through the book manifest.
 */
public class CorpusReader {

    static final String COLLECTION_MANIFEST = "collection.json";
    static final String BOOK_MANIFEST = "book.json";
    static final String CHAPTER_DIRECTORY = "chapters";

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusReader.class);

    private final ObjectMapper mapper;

    public CorpusReader() {
        this(CorpusJson.newMapper());
    }

    public CorpusReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public LoadedCorpus read(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new IllegalArgumentException("Corpus root is not a directory: " + root);
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        ReadContext context = new ReadContext();
        CorpusNode treeRoot;
        if (Files.isRegularFile(normalizedRoot.resolve(COLLECTION_MANIFEST))) {
            treeRoot = readCollection(normalizedRoot, context);
        } else if (Files.isRegularFile(normalizedRoot.resolve(BOOK_MANIFEST))) {
            treeRoot = readBook(normalizedRoot, null, 0, context);
        } else {
            throw new TreeIntegrityException("No " + COLLECTION_MANIFEST + " or " + BOOK_MANIFEST
                    + " under " + normalizedRoot);
        }
        CorpusTree tree = new CorpusTree(treeRoot);
        Map<SlotPath, SlotBinding> bindings = new LinkedHashMap<>();
        for (PendingBinding pending : context.bindings) {
            bindings.put(new SlotPath(pending.node().path(), pending.field()), pending.binding());
        }
        LOGGER.info("Loaded corpus {} with {} nodes and {} text slots from {} documents",
                treeRoot.path(), tree.nodeCount(), tree.slots().size(), context.documents.size());
        return new LoadedCorpus(normalizedRoot, tree, context.documents, bindings);
    }

    private CollectionNode readCollection(Path root, ReadContext context) {
        Path manifest = root.resolve(COLLECTION_MANIFEST);
        ObjectNode document = readDocument(manifest, context);
        CollectionNode collection = new CollectionNode(requiredText(document, "id", manifest));
        readNestedSlot(document, collection, FieldKind.NAME, manifest, context);

        JsonNode books = document.path("books");
        if (!books.isArray()) {
            throw new TreeIntegrityException(manifest + " does not list any books");
        }
        int order = 0;
        for (JsonNode entry : books) {
            String bookId = requiredText(entry, "id", manifest);
            String relative = entry.hasNonNull("path") ? entry.get("path").asText() : bookId;
            Path bookDirectory = root.resolve(relative).normalize();
            if (!Files.isRegularFile(bookDirectory.resolve(BOOK_MANIFEST))) {
                throw new TreeIntegrityException("Book '" + bookId + "' has no " + BOOK_MANIFEST + " in " + bookDirectory);
            }
            collection.addBook(readBook(bookDirectory, bookId, order++, context));
        }
        return collection;
    }

    private BookNode readBook(Path bookDirectory, String expectedId, int order, ReadContext context) {
        Path manifest = bookDirectory.resolve(BOOK_MANIFEST);
        ObjectNode document = readDocument(manifest, context);
        String id = document.hasNonNull("id") ? document.get("id").asText() : expectedId;
        if (id == null) {
            throw new TreeIntegrityException(manifest + " has no id");
        }
        if (expectedId != null && !expectedId.equals(id)) {
            throw new TreeIntegrityException("Collection lists book '" + expectedId + "' but " + manifest
                    + " declares '" + id + "'");
        }
        BookNode book = new BookNode(id, order);
        readNestedSlot(document, book, FieldKind.TITLE, manifest, context);
        readNestedSlot(document, book, FieldKind.FOOTER, manifest, context);

        JsonNode chapters = document.path("chapters");
        if (!chapters.isArray()) {
            throw new TreeIntegrityException(manifest + " does not list any chapters");
        }
        int index = 0;
        for (JsonNode entry : chapters) {
            index++;
            String chapterId = requiredText(entry, "id", manifest);
            int number = integer(entry, "number", index, manifest);
            String file = entry.hasNonNull("file")
                    ? entry.get("file").asText()
                    : CHAPTER_DIRECTORY + "/" + chapterId + ".json";
            book.addChapter(readChapter(bookDirectory.resolve(file).normalize(), chapterId, number, context));
        }
        return book;
    }

    private ChapterNode readChapter(Path file, String expectedId, int number, ReadContext context) {
        if (!Files.isRegularFile(file)) {
            throw new TreeIntegrityException("Chapter document missing: " + file);
        }
        ObjectNode document = readDocument(file, context);
        if (document.hasNonNull("id") && !document.get("id").asText().equals(expectedId)) {
            throw new TreeIntegrityException("Manifest lists chapter '" + expectedId + "' but " + file
                    + " declares '" + document.get("id").asText() + "'");
        }
        ChapterNode chapter = new ChapterNode(expectedId, number);
        readNestedSlot(document, chapter, FieldKind.TITLE, file, context);
        readNestedSlot(document, chapter, FieldKind.FOOTER, file, context);

        JsonNode sections = document.path("sections");
        if (sections.isMissingNode() || sections.isNull()) {
            return chapter;
        }
        if (!sections.isArray()) {
            throw new TreeIntegrityException("'sections' is not an array in " + file);
        }
        int index = 0;
        for (JsonNode entry : sections) {
            index++;
            if (!entry.isObject()) {
                throw new TreeIntegrityException("Section " + index + " of " + file + " is not an object");
            }
            SectionNode section = new SectionNode(integer(entry, "number", index, file));
            for (FieldKind field : List.of(FieldKind.TITLE, FieldKind.VAGGA, FieldKind.BODY)) {
                readSectionSlot((ObjectNode) entry, section, field, file, context);
            }
            chapter.addSection(section);
        }
        return chapter;
    }

    private void readNestedSlot(ObjectNode owner, CorpusNode node, FieldKind field, Path document,
                                ReadContext context) {
        JsonNode value = owner.get(JsonFieldLayout.nestedObjectKey(field));
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isObject()) {
            throw new TreeIntegrityException("'" + JsonFieldLayout.nestedObjectKey(field) + "' of " + node.id()
                    + " in " + document + " is not an object");
        }
        Map<Language, String> keys = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            keys.put(language, language.key());
        }
        bind((ObjectNode) value, Language.SOURCE_KEY, keys, node, field, document, context);
    }

    private void readSectionSlot(ObjectNode section, CorpusNode node, FieldKind field, Path document,
                                 ReadContext context) {
        Map<Language, String> keys = new EnumMap<>(Language.class);
        for (Language language : Language.values()) {
            keys.put(language, JsonFieldLayout.sectionTranslationKey(field, language));
        }
        bind(section, JsonFieldLayout.sectionSourceKey(field), keys, node, field, document, context);
    }

    private void bind(ObjectNode container, String sourceKey, Map<Language, String> keys, CorpusNode node,
                      FieldKind field, Path document, ReadContext context) {
        JsonNode source = container.get(sourceKey);
        if (source == null || !source.isTextual() || TextSlot.isMissingValue(source.asText())) {
            return;
        }
        SlotBinding binding = new SlotBinding(document, container, keys);
        node.putSlot(field, new TextSlot(source.asText(), binding.readTranslations()));
        context.bindings.add(new PendingBinding(node, field, binding));
    }

    private ObjectNode readDocument(Path file, ReadContext context) {
        JsonNode document;
        try {
            document = mapper.readTree(file.toFile());
        } catch (JsonProcessingException ex) {
            throw new TreeIntegrityException("Malformed corpus document " + file + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read corpus document: " + file, ex);
        }
        if (document == null || !document.isObject()) {
            throw new TreeIntegrityException("Corpus document " + file + " is not a JSON object");
        }
        context.documents.put(file, (ObjectNode) document);
        return (ObjectNode) document;
    }

    private static String requiredText(JsonNode node, String field, Path document) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.asText().isBlank()) {
            throw new TreeIntegrityException("Missing '" + field + "' in " + document);
        }
        return value.asText();
    }

    private static int integer(JsonNode node, String field, int fallback, Path document) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (value.canConvertToInt() && value.isIntegralNumber()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().strip());
            } catch (NumberFormatException ex) {
                throw new TreeIntegrityException("'" + field + "' is not a number in " + document + ": " + value, ex);
            }
        }
        throw new TreeIntegrityException("'" + field + "' is not a number in " + document + ": " + value);
    }

    private record PendingBinding(CorpusNode node, FieldKind field, SlotBinding binding) {
    }

    private static final class ReadContext {
        private final Map<Path, ObjectNode> documents = new LinkedHashMap<>();
        private final List<PendingBinding> bindings = new ArrayList<>();
    }
}
