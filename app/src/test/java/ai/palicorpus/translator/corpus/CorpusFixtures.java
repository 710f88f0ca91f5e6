package ai.palicorpus.translator.corpus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Shared corpus fixtures for tests.
 */
public final class CorpusFixtures {

    private CorpusFixtures() {
    }

    /**
     * Copies the on-disk sample corpus ({@code dn/silakkhandha} with chapters A and B) into {@code target}.
     */
    public static Path copySample(Path target) {
        URL resource = CorpusFixtures.class.getResource("/corpus/sample");
        if (resource == null) {
            throw new IllegalStateException("Sample corpus missing from test resources");
        }
        try {
            Path source = Path.of(resource.toURI());
            try (Stream<Path> files = Files.walk(source)) {
                for (Path file : (Iterable<Path>) files::iterator) {
                    Path destination = target.resolve(source.relativize(file).toString());
                    if (Files.isDirectory(file)) {
                        Files.createDirectories(destination);
                    } else {
                        Files.copy(file, destination);
                    }
                }
            }
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        } catch (URISyntaxException ex) {
            throw new IllegalStateException(ex);
        }
    }

    /**
     * In-memory book with two chapters of seven and two sections. Section 5 and section 7 of chapterA and
     * section 1 of chapterB share the vagga title "Dutiyavaggo".
     */
    public static CorpusTree twoChapterBook() {
        BookNode book = new BookNode("book", 0);
        book.putSlot(FieldKind.TITLE, slot("Sīlakkhandhavaggo"));

        ChapterNode chapterA = new ChapterNode("chapterA", 1);
        chapterA.putSlot(FieldKind.TITLE, slot("Brahmajālasuttaṃ"));
        for (int number = 1; number <= 7; number++) {
            SectionNode section = new SectionNode(number);
            section.putSlot(FieldKind.BODY, slot("Pāḷi paragraph A" + number));
            if (number == 5 || number == 7) {
                section.putSlot(FieldKind.VAGGA, slot("Dutiyavaggo"));
            }
            chapterA.addSection(section);
        }
        ChapterNode chapterB = new ChapterNode("chapterB", 2);
        chapterB.putSlot(FieldKind.TITLE, slot("Sāmaññaphalasuttaṃ"));
        for (int number = 1; number <= 2; number++) {
            SectionNode section = new SectionNode(number);
            section.putSlot(FieldKind.BODY, slot("Pāḷi paragraph B" + number));
            if (number == 1) {
                section.putSlot(FieldKind.VAGGA, slot("Dutiyavaggo"));
            }
            chapterB.addSection(section);
        }
        book.addChapter(chapterB);
        book.addChapter(chapterA);
        return new CorpusTree(book);
    }

    public static TextSlot slot(String source) {
        return new TextSlot(source);
    }

    public static TextSlot slot(String source, String english, String sinhala) {
        Map<Language, String> translations = new EnumMap<>(Language.class);
        translations.put(Language.ENGLISH, english);
        translations.put(Language.SINHALA, sinhala);
        return new TextSlot(source, translations);
    }
}
