package ai.palicorpus.translator.corpus;

import java.util.EnumSet;
import java.util.Set;

/**
 * Leaf section (sutta) identified by its number within the chapter.
 */
public final class SectionNode extends CorpusNode {

    private static final String SEGMENT_PREFIX = "section";
    private static final Set<FieldKind> FIELDS = EnumSet.of(FieldKind.TITLE, FieldKind.VAGGA, FieldKind.BODY);

    public SectionNode(int number) {
        super(segmentFor(number), number);
    }

    public static String segmentFor(int number) {
        if (number < 0) {
            throw new TreeIntegrityException("Section number must not be negative: " + number);
        }
        return SEGMENT_PREFIX + number;
    }

    public int number() {
        return order();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SECTION;
    }

    @Override
    protected Set<FieldKind> allowedFields() {
        return FIELDS;
    }

    @Override
    protected boolean acceptsChildren() {
        return false;
    }
}
