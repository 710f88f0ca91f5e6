package ai.palicorpus.translator.corpus;

import java.util.EnumSet;
import java.util.Set;

/**
 * A chapter document holding numbered sections.
 */
public final class ChapterNode extends CorpusNode {

    private static final Set<FieldKind> FIELDS = EnumSet.of(FieldKind.TITLE, FieldKind.FOOTER);

    public ChapterNode(String id, int number) {
        super(id, number);
    }

    public int number() {
        return order();
    }

    public ChapterNode addSection(SectionNode section) {
        attach(section);
        return this;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CHAPTER;
    }

    @Override
    protected Set<FieldKind> allowedFields() {
        return FIELDS;
    }
}
