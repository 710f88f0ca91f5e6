package ai.palicorpus.translator.sink;

import ai.palicorpus.translator.corpus.BookNode;
import ai.palicorpus.translator.corpus.ChapterNode;
import ai.palicorpus.translator.corpus.CollectionNode;
import ai.palicorpus.translator.corpus.CorpusNode;
import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.FieldKind;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.SectionNode;
import ai.palicorpus.translator.corpus.TextSlot;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk-loads a corpus tree into a SQLite (libSQL compatible) database with an FTS5 index over sections.
 *
 * <p>The schema is created when absent. Collection, book and chapter rows are upserted; each chapter's
 * sections are replaced inside one transaction so the triggers keep {@code sections_fts} in step.
 */
public class SqliteSinkAdapter {

    static final String SCHEMA_RESOURCE = "/sink/schema.sql";

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteSinkAdapter.class);

    private static final String UPSERT_COLLECTION = """
            INSERT INTO collections (id, name_pali, name_english, name_sinhala) VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET name_pali = excluded.name_pali, name_english = excluded.name_english,
                name_sinhala = excluded.name_sinhala, updated_at = CURRENT_TIMESTAMP""";
    private static final String UPSERT_BOOK = """
            INSERT INTO books (id, collection_id, position, title_pali, title_english, title_sinhala,
                footer_pali, footer_english, footer_sinhala, total_chapters) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET collection_id = excluded.collection_id, position = excluded.position,
                title_pali = excluded.title_pali, title_english = excluded.title_english,
                title_sinhala = excluded.title_sinhala, footer_pali = excluded.footer_pali,
                footer_english = excluded.footer_english, footer_sinhala = excluded.footer_sinhala,
                total_chapters = excluded.total_chapters, updated_at = CURRENT_TIMESTAMP""";
    private static final String UPSERT_CHAPTER = """
            INSERT INTO chapters (id, book_id, chapter_number, title_pali, title_english, title_sinhala,
                footer_pali, footer_english, footer_sinhala) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET book_id = excluded.book_id, chapter_number = excluded.chapter_number,
                title_pali = excluded.title_pali, title_english = excluded.title_english,
                title_sinhala = excluded.title_sinhala, footer_pali = excluded.footer_pali,
                footer_english = excluded.footer_english, footer_sinhala = excluded.footer_sinhala,
                updated_at = CURRENT_TIMESTAMP""";
    private static final String DELETE_SECTIONS = "DELETE FROM sections WHERE chapter_id = ?";
    private static final String INSERT_SECTION = """
            INSERT INTO sections (chapter_id, section_number, pali, english, sinhala, pali_title, english_title,
                sinhala_title, vagga, vagga_english, vagga_sinhala) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";
    private static final String SEARCH = """
            SELECT s.chapter_id, s.section_number, s.pali, s.english, s.sinhala
            FROM sections_fts f JOIN sections s ON s.id = f.rowid
            WHERE sections_fts MATCH ? ORDER BY rank LIMIT ?""";

    private final String jdbcUrl;

    public SqliteSinkAdapter(Path database) {
        this("jdbc:sqlite:" + Objects.requireNonNull(database, "database").toAbsolutePath());
    }

    public SqliteSinkAdapter(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl must not be blank");
        }
        this.jdbcUrl = jdbcUrl;
    }

    public SinkLoadReport load(CorpusTree tree) {
        Objects.requireNonNull(tree, "tree");
        try (Connection connection = DriverManager.getConnection(jdbcUrl)) {
            ensureSchema(connection);
            Counter counter = new Counter();
            CorpusNode root = tree.root();
            if (root instanceof CollectionNode collection) {
                inTransaction(connection, () -> upsertCollection(connection, collection));
                counter.collections++;
                for (CorpusNode child : collection.children()) {
                    loadBook(connection, (BookNode) child, collection.path().toString(), counter);
                }
            } else if (root instanceof BookNode book) {
                loadBook(connection, book, null, counter);
            } else {
                throw new IllegalArgumentException("Cannot load a tree rooted at " + root.kind());
            }
            LOGGER.info("Loaded {} book(s), {} chapter(s) and {} section(s) into {}",
                    counter.books, counter.chapters, counter.sections, jdbcUrl);
            return new SinkLoadReport(counter.collections, counter.books, counter.chapters, counter.sections);
        } catch (SQLException ex) {
            throw new SinkException("Failed to load corpus into " + jdbcUrl, ex);
        }
    }

    public List<SectionHit> search(String query, int limit) {
        try (Connection connection = DriverManager.getConnection(jdbcUrl);
             PreparedStatement statement = connection.prepareStatement(SEARCH)) {
            statement.setString(1, query);
            statement.setInt(2, limit);
            List<SectionHit> hits = new ArrayList<>();
            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    hits.add(new SectionHit(rows.getString(1), rows.getInt(2), rows.getString(3),
                            rows.getString(4), rows.getString(5)));
                }
            }
            return hits;
        } catch (SQLException ex) {
            throw new SinkException("Search failed for '" + query + "'", ex);
        }
    }

    private void loadBook(Connection connection, BookNode book, String collectionId, Counter counter) throws SQLException {
        String bookId = book.path().toString();
        inTransaction(connection, () -> upsertBook(connection, book, collectionId));
        counter.books++;
        for (CorpusNode child : book.children()) {
            ChapterNode chapter = (ChapterNode) child;
            int loaded = inTransaction(connection, () -> replaceChapter(connection, chapter, bookId));
            counter.chapters++;
            counter.sections += loaded;
        }
    }

    private int upsertCollection(Connection connection, CollectionNode collection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(UPSERT_COLLECTION)) {
            statement.setString(1, collection.path().toString());
            bindTexts(statement, 2, collection.slot(FieldKind.NAME), true);
            return statement.executeUpdate();
        }
    }

    private int upsertBook(Connection connection, BookNode book, String collectionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(UPSERT_BOOK)) {
            statement.setString(1, book.path().toString());
            statement.setString(2, collectionId);
            statement.setInt(3, book.order());
            bindTexts(statement, 4, book.slot(FieldKind.TITLE), false);
            bindTexts(statement, 7, book.slot(FieldKind.FOOTER), false);
            statement.setInt(10, book.children().size());
            return statement.executeUpdate();
        }
    }

    private int replaceChapter(Connection connection, ChapterNode chapter, String bookId) throws SQLException {
        String chapterId = chapter.path().toString();
        try (PreparedStatement statement = connection.prepareStatement(UPSERT_CHAPTER)) {
            statement.setString(1, chapterId);
            statement.setString(2, bookId);
            statement.setInt(3, chapter.number());
            bindTexts(statement, 4, chapter.slot(FieldKind.TITLE), false);
            bindTexts(statement, 7, chapter.slot(FieldKind.FOOTER), false);
            statement.executeUpdate();
        }
        try (PreparedStatement statement = connection.prepareStatement(DELETE_SECTIONS)) {
            statement.setString(1, chapterId);
            statement.executeUpdate();
        }
        int inserted = 0;
        try (PreparedStatement statement = connection.prepareStatement(INSERT_SECTION)) {
            for (CorpusNode child : chapter.children()) {
                SectionNode section = (SectionNode) child;
                statement.setString(1, chapterId);
                statement.setInt(2, section.number());
                bindTexts(statement, 3, section.slot(FieldKind.BODY), true);
                bindTexts(statement, 6, section.slot(FieldKind.TITLE), false);
                bindTexts(statement, 9, section.slot(FieldKind.VAGGA), false);
                statement.addBatch();
                inserted++;
            }
            statement.executeBatch();
        }
        return inserted;
    }

    /**
     * Binds source, English and Sinhala text of a slot to three consecutive parameters. Missing values become NULL,
     * except a required source which becomes an empty string.
     */
    private static void bindTexts(PreparedStatement statement, int firstIndex, Optional<TextSlot> slot,
                                  boolean sourceRequired) throws SQLException {
        String source = slot.map(TextSlot::sourceText).orElse(sourceRequired ? "" : null);
        statement.setString(firstIndex, source);
        statement.setString(firstIndex + 1, slot.flatMap(value -> value.translation(Language.ENGLISH)).orElse(null));
        statement.setString(firstIndex + 2, slot.flatMap(value -> value.translation(Language.SINHALA)).orElse(null));
    }

    private static int inTransaction(Connection connection, SqlWork work) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            int result = work.run();
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException ex) {
            connection.rollback();
            throw ex;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    void ensureSchema(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String sql : schemaStatements()) {
                statement.execute(sql);
            }
        }
    }

    static List<String> schemaStatements() {
        String script;
        try (InputStream input = SqliteSinkAdapter.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Missing schema resource " + SCHEMA_RESOURCE);
            }
            script = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, ex);
        }
        return splitStatements(script);
    }

    /**
     * Splits a SQL script on statement-ending semicolons. Trigger bodies run until their closing {@code END;}.
     */
    static List<String> splitStatements(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inTrigger = false;
        for (String line : script.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("--")) {
                continue;
            }
            if (current.length() == 0 && trimmed.toUpperCase(Locale.ROOT).startsWith("CREATE TRIGGER")) {
                inTrigger = true;
            }
            current.append(line).append('\n');
            boolean ends = inTrigger ? trimmed.equalsIgnoreCase("END;") : trimmed.endsWith(";");
            if (ends) {
                statements.add(current.toString().strip());
                current.setLength(0);
                inTrigger = false;
            }
        }
        if (current.length() > 0) {
            statements.add(current.toString().strip());
        }
        return statements;
    }

    @FunctionalInterface
    private interface SqlWork {
        int run() throws SQLException;
    }

    private static final class Counter {
        private int collections;
        private int books;
        private int chapters;
        private int sections;
    }
}
