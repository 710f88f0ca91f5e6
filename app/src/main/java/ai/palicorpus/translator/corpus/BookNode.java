package ai.palicorpus.translator.corpus;

import java.util.EnumSet;
import java.util.Set;

/**
 * A book (vagga) holding chapters in manifest order.
 */
public final class BookNode extends CorpusNode {

    private static final Set<FieldKind> FIELDS = EnumSet.of(FieldKind.TITLE, FieldKind.FOOTER);

    public BookNode(String id, int order) {
        super(id, order);
    }

    public BookNode addChapter(ChapterNode chapter) {
        attach(chapter);
        return this;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOOK;
    }

    @Override
    protected Set<FieldKind> allowedFields() {
        return FIELDS;
    }
}
