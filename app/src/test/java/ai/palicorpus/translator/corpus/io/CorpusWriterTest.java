package ai.palicorpus.translator.corpus.io;

import static org.assertj.core.api.Assertions.assertThat;

import ai.palicorpus.translator.corpus.CorpusFixtures;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.SlotPath;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusWriterTest {

    @TempDir
    Path tempDir;

    private final CorpusReader reader = new CorpusReader();
    private final CorpusWriter writer = new CorpusWriter();

    @Test
    void rewritesOnlyChangedDocumentsAndKeepsUnknownFields() throws Exception {
        CorpusFixtures.copySample(tempDir);
        LoadedCorpus corpus = reader.read(tempDir);
        corpus.tree().slot(SlotPath.parse("dn/silakkhandha/chapterA/section2#vagga")).orElseThrow()
                .write(Language.SINHALA, "දෙවන වර්ගය");

        List<Path> written = writer.write(corpus);

        Path chapterA = tempDir.resolve("silakkhandha/chapters/chapterA.json").toAbsolutePath().normalize();
        assertThat(written).containsExactly(chapterA);
        String content = Files.readString(chapterA, StandardCharsets.UTF_8);
        assertThat(content).contains("දෙවන වර්ගය").doesNotContain("\\u");
        JsonNode section = new ObjectMapper().readTree(content).get("sections").get(0);
        assertThat(section.get("vaggaSinhala").asText()).isEqualTo("දෙවන වර්ගය");
        assertThat(section.get("pageNumber").asInt()).isEqualTo(4);
        assertThat(Files.exists(chapterA.resolveSibling("chapterA.json.partial"))).isFalse();
    }

    @Test
    void writeWithoutChangesTouchesNothing() {
        CorpusFixtures.copySample(tempDir);

        assertThat(writer.write(reader.read(tempDir))).isEmpty();
    }

    @Test
    void reloadedCorpusCarriesWrittenTranslation() {
        CorpusFixtures.copySample(tempDir);
        LoadedCorpus corpus = reader.read(tempDir);
        corpus.tree().slot(SlotPath.parse("dn#name")).orElseThrow().write(Language.SINHALA, "දීඝ නිකාය");
        writer.write(corpus);

        LoadedCorpus reloaded = reader.read(tempDir);

        assertThat(reloaded.tree().slot(SlotPath.parse("dn#name")).orElseThrow().translation(Language.SINHALA))
                .contains("දීඝ නිකාය");
    }

    @Test
    void stagesRewrittenDocumentsWhenRootIsRepository() throws Exception {
        CorpusFixtures.copySample(tempDir);
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            LoadedCorpus corpus = reader.read(tempDir);
            corpus.tree().slot(SlotPath.parse("dn/silakkhandha#title")).orElseThrow()
                    .write(Language.ENGLISH, "The Division on Morality");

            writer.write(corpus);

            assertThat(git.status().call().getAdded()).containsExactly("silakkhandha/book.json");
        }
    }
}
