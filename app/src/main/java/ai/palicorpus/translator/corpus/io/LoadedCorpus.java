package ai.palicorpus.translator.corpus.io;

import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.SlotPath;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A corpus tree together with the JSON documents backing it.
 */
public final class LoadedCorpus {

    private final Path root;
    private final CorpusTree tree;
    private final Map<Path, ObjectNode> documents;
    private final Map<SlotPath, SlotBinding> bindings;

    LoadedCorpus(Path root, CorpusTree tree, Map<Path, ObjectNode> documents, Map<SlotPath, SlotBinding> bindings) {
        this.root = Objects.requireNonNull(root, "root");
        this.tree = Objects.requireNonNull(tree, "tree");
        this.documents = Collections.unmodifiableMap(new LinkedHashMap<>(documents));
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Path root() {
        return root;
    }

    public CorpusTree tree() {
        return tree;
    }

    /**
     * Documents in load order (manifest first, then books and their chapters).
     */
    public Map<Path, ObjectNode> documents() {
        return documents;
    }

    Map<SlotPath, SlotBinding> bindings() {
        return bindings;
    }
}
