package ai.palicorpus.translator.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base of the typed corpus hierarchy. A node owns its children and its text slots exclusively.
 */
public abstract class CorpusNode {

    private static final Comparator<CorpusNode> DECLARED_ORDER = Comparator.comparingInt(CorpusNode::order);

    private final String id;
    private final int order;
    private final Map<FieldKind, TextSlot> slots = new EnumMap<>(FieldKind.class);
    private final List<CorpusNode> children = new ArrayList<>();
    private CorpusNode parent;

    protected CorpusNode(String id, int order) {
        if (id == null || id.isBlank()) {
            throw new TreeIntegrityException(getClass().getSimpleName() + " without id");
        }
        this.id = id.strip();
        this.order = order;
    }

    public String id() {
        return id;
    }

    /**
     * Declared index or number used to order siblings.
     */
    public int order() {
        return order;
    }

    public abstract NodeKind kind();

    /**
     * Field kinds this variant may carry.
     */
    protected abstract Set<FieldKind> allowedFields();

    protected boolean acceptsChildren() {
        return true;
    }

    public NodePath path() {
        return parent == null ? NodePath.root(id) : parent.path().child(id);
    }

    public Optional<CorpusNode> parent() {
        return Optional.ofNullable(parent);
    }

    public List<CorpusNode> children() {
        return Collections.unmodifiableList(children);
    }

    public Optional<TextSlot> slot(FieldKind field) {
        return Optional.ofNullable(slots.get(field));
    }

    /**
     * Slots in field declaration order.
     */
    public Map<FieldKind, TextSlot> slots() {
        return Collections.unmodifiableMap(slots);
    }

    public void putSlot(FieldKind field, TextSlot slot) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(slot, "slot");
        if (!allowedFields().contains(field)) {
            throw new IllegalArgumentException(kind() + " nodes do not carry a " + field.key() + " field");
        }
        slots.put(field, slot);
    }

    protected void attach(CorpusNode child) {
        Objects.requireNonNull(child, "child");
        if (!acceptsChildren()) {
            throw new IllegalArgumentException(kind() + " nodes cannot have children");
        }
        if (child.parent != null) {
            throw new IllegalArgumentException("Node " + child.id + " already belongs to " + child.parent.path());
        }
        for (CorpusNode sibling : children) {
            if (sibling.id.equals(child.id)) {
                throw new TreeIntegrityException("Duplicate id '" + child.id + "' under " + path());
            }
            if (sibling.order == child.order) {
                throw new TreeIntegrityException("Nodes '" + sibling.id + "' and '" + child.id
                        + "' share position " + child.order + " under " + path());
            }
        }
        child.parent = this;
        children.add(child);
        children.sort(DECLARED_ORDER);
    }

    @Override
    public String toString() {
        return kind() + "[" + path() + "]";
    }
}
