package ai.palicorpus.translator.corpus.io;

import ai.palicorpus.translator.corpus.SlotPath;
import ai.palicorpus.translator.corpus.TextSlot;
import ai.palicorpus.translator.corpus.TreeIntegrityException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes translations held by the tree back into the corpus documents they were read from.
 *
 * <p>Only documents whose content changed are rewritten. Each file is replaced through a temporary
 * sibling so a crash never leaves a half-written chapter. When the corpus root is a git working tree
 * the rewritten files are staged.
 */
public class CorpusWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusWriter.class);
    private static final String PARTIAL_SUFFIX = ".partial";

    private final ObjectWriter writer;

    public CorpusWriter() {
        this(CorpusJson.newMapper());
    }

    public CorpusWriter(ObjectMapper mapper) {
        this.writer = CorpusJson.prettyWriter(mapper);
    }

    /**
     * @return the documents that were rewritten, in load order
     */
    public List<Path> write(LoadedCorpus corpus) {
        if (corpus == null) {
            throw new IllegalArgumentException("corpus must be provided");
        }
        Set<Path> changed = new LinkedHashSet<>();
        for (Map.Entry<SlotPath, SlotBinding> entry : corpus.bindings().entrySet()) {
            TextSlot slot = corpus.tree().slot(entry.getKey())
                    .orElseThrow(() -> new TreeIntegrityException("Slot " + entry.getKey() + " vanished from the tree"));
            if (entry.getValue().apply(slot)) {
                changed.add(entry.getValue().document());
            }
        }
        List<Path> written = new ArrayList<>();
        for (Path document : corpus.documents().keySet()) {
            if (changed.contains(document)) {
                writeDocument(corpus, document);
                written.add(document);
            }
        }
        if (!written.isEmpty()) {
            stageIfRepository(corpus.root(), written);
            LOGGER.debug("Wrote {} corpus document(s)", written.size());
        }
        return written;
    }

    private void writeDocument(LoadedCorpus corpus, Path document) {
        Path partial = document.resolveSibling(document.getFileName() + PARTIAL_SUFFIX);
        try {
            String json = writer.writeValueAsString(corpus.documents().get(document)) + "\n";
            Files.writeString(partial, json, StandardCharsets.UTF_8);
            try {
                Files.move(partial, document, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(partial, document, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write corpus document: " + document, ex);
        }
    }

    private void stageIfRepository(Path root, List<Path> documents) {
        if (!Files.isDirectory(root.resolve(".git"))) {
            return;
        }
        try (Git git = Git.open(root.toFile())) {
            for (Path document : documents) {
                String relative = root.relativize(document).toString().replace('\\', '/');
                git.add().addFilepattern(relative).call();
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to open repository at " + root, ex);
        } catch (GitAPIException ex) {
            throw new IllegalStateException("Failed to stage corpus documents under " + root, ex);
        }
    }
}
