package ai.palicorpus.translator.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CorpusTreeTest {

    @Test
    void traversesChildrenInDeclaredOrderRegardlessOfInsertion() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();

        List<String> paths = tree.slots().stream().map(entry -> entry.path().toString()).toList();

        assertThat(paths).startsWith("book#title", "book/chapterA#title", "book/chapterA/section1#body");
        assertThat(paths.indexOf("book/chapterA/section7#body"))
                .isLessThan(paths.indexOf("book/chapterB#title"));
        assertThat(tree.slots()).extracting(SlotEntry::ordinal)
                .containsExactlyElementsOf(java.util.stream.IntStream.range(0, paths.size()).boxed().toList());
    }

    @Test
    void visitsFooterAfterChildren() {
        BookNode book = new BookNode("book", 0);
        book.putSlot(FieldKind.FOOTER, CorpusFixtures.slot("Niṭṭhito"));
        book.putSlot(FieldKind.TITLE, CorpusFixtures.slot("Vaggo"));
        ChapterNode chapter = new ChapterNode("c1", 1);
        chapter.putSlot(FieldKind.TITLE, CorpusFixtures.slot("Suttaṃ"));
        book.addChapter(chapter);

        CorpusTree tree = new CorpusTree(book);

        assertThat(tree.slots()).extracting(entry -> entry.path().toString())
                .containsExactly("book#title", "book/c1#title", "book#footer");
    }

    @Test
    void resolvesShortKeysBySuffix() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();

        assertThat(tree.resolveNode("chapterA/section5")).hasToString("book/chapterA/section5");
        assertThat(tree.resolveNode("book/chapterB")).hasToString("book/chapterB");
        assertThatThrownBy(() -> tree.resolveNode("section1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ambiguous");
        assertThatThrownBy(() -> tree.resolveNode("chapterZ"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nodeResumeKeyCoversWholeSubtree() {
        CorpusTree tree = CorpusFixtures.twoChapterBook();

        int afterSection5 = tree.resumeOrdinal("chapterA/section5");
        int vaggaOfSection5 = tree.resumeOrdinal("chapterA/section5#vagga");

        SlotEntry next = tree.slots().get(afterSection5 + 1);
        assertThat(next.path()).hasToString("book/chapterA/section6#body");
        assertThat(vaggaOfSection5).isLessThan(afterSection5);
    }

    @Test
    void rejectsDuplicateSiblings() {
        ChapterNode chapter = new ChapterNode("c1", 1);
        chapter.addSection(new SectionNode(3));

        assertThatThrownBy(() -> chapter.addSection(new SectionNode(3)))
                .isInstanceOf(TreeIntegrityException.class);
    }

    @Test
    void rejectsFieldsTheVariantDoesNotCarry() {
        SectionNode section = new SectionNode(1);

        assertThatThrownBy(() -> section.putSlot(FieldKind.FOOTER, CorpusFixtures.slot("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void treatsPlaceholderMarkersAsMissing() {
        TextSlot slot = CorpusFixtures.slot("Evaṃ me sutaṃ.", "N/A", " - ");

        assertThat(slot.isMissing(Language.ENGLISH)).isTrue();
        assertThat(slot.isMissing(Language.SINHALA)).isTrue();
        assertThat(slot.rawValue(Language.ENGLISH)).contains("N/A");
        assertThatThrownBy(() -> slot.write(Language.ENGLISH, "  "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
