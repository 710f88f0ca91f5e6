package ai.palicorpus.translator.corpus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the corpus hierarchy and provides the stable depth-first traversal used for extraction and resume.
 *
 * <p>Traversal visits a node's own leading fields, then its children in declared order, then its footer.
 * The structure is fixed once the tree is built; only slot contents change afterwards.
 */
public final class CorpusTree {

    private final CorpusNode root;
    private final Map<NodePath, CorpusNode> nodes = new LinkedHashMap<>();
    private final List<SlotEntry> slots = new ArrayList<>();
    private final Map<SlotPath, SlotEntry> slotIndex = new HashMap<>();
    private final Map<NodePath, Integer> lastOrdinalByNode = new HashMap<>();

    public CorpusTree(CorpusNode root) {
        this.root = Objects.requireNonNull(root, "root");
        if (root.parent().isPresent()) {
            throw new TreeIntegrityException("Tree root " + root.path() + " is attached to a parent");
        }
        index(root);
    }

    private void index(CorpusNode node) {
        NodePath path = node.path();
        if (nodes.putIfAbsent(path, node) != null) {
            throw new TreeIntegrityException("Duplicate node path " + path);
        }
        node.slots().forEach((field, slot) -> {
            if (field != FieldKind.FOOTER) {
                addSlot(new SlotPath(path, field), slot);
            }
        });
        for (CorpusNode child : node.children()) {
            index(child);
        }
        node.slot(FieldKind.FOOTER).ifPresent(footer -> addSlot(new SlotPath(path, FieldKind.FOOTER), footer));
        lastOrdinalByNode.put(path, slots.size() - 1);
    }

    private void addSlot(SlotPath path, TextSlot slot) {
        SlotEntry entry = new SlotEntry(slots.size(), path, slot);
        slots.add(entry);
        slotIndex.put(path, entry);
    }

    public CorpusNode root() {
        return root;
    }

    public Optional<CorpusNode> node(NodePath path) {
        return Optional.ofNullable(nodes.get(path));
    }

    public Optional<TextSlot> slot(SlotPath path) {
        SlotEntry entry = slotIndex.get(path);
        return entry == null ? Optional.empty() : Optional.of(entry.slot());
    }

    /**
     * Every slot of the tree in traversal order.
     */
    public List<SlotEntry> slots() {
        return Collections.unmodifiableList(slots);
    }

    /**
     * Slots of the subtree rooted at {@code scope}, in traversal order.
     */
    public List<SlotEntry> slotsUnder(NodePath scope) {
        if (!nodes.containsKey(scope)) {
            throw new IllegalArgumentException("Unknown node: " + scope);
        }
        return slots.stream()
                .filter(entry -> entry.path().node().startsWith(scope))
                .collect(Collectors.toUnmodifiableList());
    }

    public Optional<Integer> ordinalOf(SlotPath path) {
        SlotEntry entry = slotIndex.get(path);
        return entry == null ? Optional.empty() : Optional.of(entry.ordinal());
    }

    /**
     * Resolves an operator-supplied node key. Exact paths win; otherwise the key must match
     * the tail of exactly one node path, so {@code dn1/section5} finds {@code dn/silakkhandha/dn1/section5}.
     */
    public NodePath resolveNode(String key) {
        NodePath requested = NodePath.parse(key);
        if (nodes.containsKey(requested)) {
            return requested;
        }
        List<NodePath> matches = nodes.keySet().stream()
                .filter(path -> path.endsWith(requested))
                .collect(Collectors.toList());
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("No corpus node matches '" + key + "'");
        }
        if (matches.size() > 1) {
            throw new IllegalArgumentException("Key '" + key + "' is ambiguous: " + matches);
        }
        return matches.get(0);
    }

    /**
     * Ordinal of the last slot covered by a resume key. Slot keys ({@code node#field}) cover up to that slot;
     * node keys cover the whole subtree. Returns -1 when nothing precedes the key.
     */
    public int resumeOrdinal(String key) {
        if (SlotPath.isSlotKey(key)) {
            SlotPath requested = SlotPath.parse(key);
            SlotPath resolved = new SlotPath(resolveNode(requested.node().toString()), requested.field());
            return ordinalOf(resolved)
                    .orElseThrow(() -> new IllegalArgumentException("No slot " + resolved + " in corpus"));
        }
        return lastOrdinalByNode.get(resolveNode(key));
    }

    public int nodeCount() {
        return nodes.size();
    }
}
