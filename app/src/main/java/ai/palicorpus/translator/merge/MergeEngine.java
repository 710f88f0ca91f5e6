package ai.palicorpus.translator.merge;

import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.SlotPath;
import ai.palicorpus.translator.corpus.TextSlot;
import ai.palicorpus.translator.corpus.TreeIntegrityException;
import ai.palicorpus.translator.extract.TranslatableUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an accepted translation into every location of a unit.
 *
 * <p>All locations are checked before anything is written: a conflicting value anywhere aborts the merge
 * for the whole unit. Re-merging identical text is a no-op.
 */
public class MergeEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(MergeEngine.class);

    public MergeResult merge(CorpusTree tree, TranslatableUnit unit, Language language, String text) {
        return merge(tree, unit, language, text, false);
    }

    /**
     * @param force overwrite existing different translations instead of reporting conflicts
     */
    public MergeResult merge(CorpusTree tree, TranslatableUnit unit, Language language, String text, boolean force) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(language, "language");
        if (TextSlot.isMissingValue(text)) {
            throw new IllegalArgumentException("Refusing to merge an empty translation for " + unit.canonicalLocation());
        }
        String expectedSource = unit.sourceText().strip();
        List<TextSlot> targets = new ArrayList<>();
        List<SlotPath> targetPaths = new ArrayList<>();
        List<SlotPath> unchanged = new ArrayList<>();
        List<MergeConflict> conflicts = new ArrayList<>();
        for (SlotPath location : unit.locations()) {
            TextSlot slot = tree.slot(location)
                    .orElseThrow(() -> new TreeIntegrityException("Merge target " + location + " is not in the tree"));
            if (!slot.sourceText().strip().equals(expectedSource)) {
                throw new TreeIntegrityException("Source text at " + location + " changed since extraction");
            }
            Optional<String> existing = slot.translation(language);
            if (existing.isEmpty()) {
                targets.add(slot);
                targetPaths.add(location);
            } else if (existing.get().equals(text)) {
                unchanged.add(location);
            } else if (force) {
                LOGGER.warn("Overwriting {} translation at {}", language.key(), location);
                targets.add(slot);
                targetPaths.add(location);
            } else {
                conflicts.add(new MergeConflict(location, language, existing.get(), text));
            }
        }
        if (!conflicts.isEmpty()) {
            LOGGER.warn("Merge of {} {} blocked by {} conflicting location(s)",
                    unit.canonicalLocation(), language.key(), conflicts.size());
            return MergeResult.conflict(conflicts);
        }
        for (TextSlot slot : targets) {
            slot.write(language, text);
        }
        return new MergeResult(targetPaths, unchanged, List.of());
    }
}
