package ai.palicorpus.translator.corpus;

import java.util.EnumSet;
import java.util.Set;

/**
 * Top-level collection (nikaya) grouping books.
 */
public final class CollectionNode extends CorpusNode {

    private static final Set<FieldKind> FIELDS = EnumSet.of(FieldKind.NAME);

    public CollectionNode(String id) {
        super(id, 0);
    }

    public CollectionNode addBook(BookNode book) {
        attach(book);
        return this;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COLLECTION;
    }

    @Override
    protected Set<FieldKind> allowedFields() {
        return FIELDS;
    }
}
