package ai.palicorpus.translator.corpus.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.palicorpus.translator.corpus.CorpusFixtures;
import ai.palicorpus.translator.corpus.CorpusNode;
import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.NodeKind;
import ai.palicorpus.translator.corpus.SlotPath;
import ai.palicorpus.translator.corpus.TextSlot;
import ai.palicorpus.translator.corpus.TreeIntegrityException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusReaderTest {

    @TempDir
    Path tempDir;

    private final CorpusReader reader = new CorpusReader();

    @Test
    void loadsCollectionWithChaptersAndSectionsInDeclaredOrder() {
        CorpusFixtures.copySample(tempDir);

        CorpusTree tree = reader.read(tempDir).tree();

        assertThat(tree.root().kind()).isEqualTo(NodeKind.COLLECTION);
        CorpusNode book = tree.root().children().get(0);
        assertThat(book.children()).extracting(CorpusNode::id).containsExactly("chapterA", "chapterB");
        assertThat(tree.slots()).extracting(entry -> entry.path().toString()).containsExactly(
                "dn#name",
                "dn/silakkhandha#title",
                "dn/silakkhandha/chapterA#title",
                "dn/silakkhandha/chapterA/section1#title",
                "dn/silakkhandha/chapterA/section1#body",
                "dn/silakkhandha/chapterA/section2#vagga",
                "dn/silakkhandha/chapterA/section2#body",
                "dn/silakkhandha/chapterA#footer",
                "dn/silakkhandha/chapterB#title",
                "dn/silakkhandha/chapterB/section1#vagga",
                "dn/silakkhandha/chapterB/section1#body",
                "dn/silakkhandha#footer");
    }

    @Test
    void readsExistingTranslationsAndPlaceholders() {
        CorpusFixtures.copySample(tempDir);

        CorpusTree tree = reader.read(tempDir).tree();

        TextSlot chapterTitle = tree.slot(SlotPath.parse("dn/silakkhandha/chapterA#title")).orElseThrow();
        assertThat(chapterTitle.translation(Language.ENGLISH)).contains("The All-embracing Net of Views");
        assertThat(chapterTitle.isMissing(Language.SINHALA)).isTrue();
        TextSlot body = tree.slot(SlotPath.parse("dn/silakkhandha/chapterA/section1#body")).orElseThrow();
        assertThat(body.sourceText()).isEqualTo("Evaṃ me sutaṃ.");
        assertThat(body.translation(Language.ENGLISH)).contains("Thus have I heard.");
    }

    @Test
    void loadsSingleBookRoot() throws Exception {
        Files.createDirectories(tempDir.resolve("chapters"));
        Files.writeString(tempDir.resolve("book.json"), """
                {"id": "mn", "title": {"pali": "Majjhimanikāyo"}, "chapters": [{"id": "mn1"}]}
                """, StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("chapters/mn1.json"), """
                {"id": "mn1", "sections": [{"number": 1, "pali": "Evaṃ me sutaṃ."}]}
                """, StandardCharsets.UTF_8);

        CorpusTree tree = reader.read(tempDir).tree();

        assertThat(tree.root().kind()).isEqualTo(NodeKind.BOOK);
        assertThat(tree.slots()).extracting(entry -> entry.path().toString())
                .containsExactly("mn#title", "mn/mn1/section1#body");
    }

    @Test
    void failsWhenChapterDocumentIsMissing() throws Exception {
        CorpusFixtures.copySample(tempDir);
        Files.delete(tempDir.resolve("silakkhandha/chapters/chapterB.json"));

        assertThatThrownBy(() -> reader.read(tempDir))
                .isInstanceOf(TreeIntegrityException.class)
                .hasMessageContaining("chapterB.json");
    }

    @Test
    void failsOnDuplicateSectionNumbers() throws Exception {
        Files.writeString(tempDir.resolve("book.json"), """
                {"id": "mn", "chapters": [{"id": "mn1", "file": "mn1.json"}]}
                """, StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("mn1.json"), """
                {"sections": [{"number": 1, "pali": "a"}, {"number": 1, "pali": "b"}]}
                """, StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(tempDir)).isInstanceOf(TreeIntegrityException.class);
    }

    @Test
    void failsOnMalformedDocument() throws Exception {
        Files.writeString(tempDir.resolve("book.json"), "{\"id\": \"mn\", \"chapters\": [", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.read(tempDir))
                .isInstanceOf(TreeIntegrityException.class)
                .hasMessageContaining("Malformed");
    }
}
