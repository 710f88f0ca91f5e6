package ai.palicorpus.translator.extract;

import ai.palicorpus.translator.corpus.CorpusTree;
import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.NodePath;
import ai.palicorpus.translator.corpus.SlotEntry;
import ai.palicorpus.translator.corpus.TextSlot;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the text units that still lack a translation, deduplicated by source text.
 *
 * <p>Output order follows the tree's traversal order of each unit's first occurrence, so an unchanged tree
 * always yields the same sequence.
 */
public class MissingUnitExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MissingUnitExtractor.class);

    public ExtractionResult extract(CorpusTree tree, Set<Language> requiredLanguages) {
        if (tree == null) {
            throw new IllegalArgumentException("tree must be provided");
        }
        return extract(tree.slots(), requiredLanguages);
    }

    /**
     * Extraction restricted to the subtree rooted at {@code scope}.
     */
    public ExtractionResult extract(CorpusTree tree, NodePath scope, Set<Language> requiredLanguages) {
        if (tree == null) {
            throw new IllegalArgumentException("tree must be provided");
        }
        return extract(scope == null ? tree.slots() : tree.slotsUnder(scope), requiredLanguages);
    }

    private ExtractionResult extract(List<SlotEntry> slots, Set<Language> requiredLanguages) {
        if (requiredLanguages == null || requiredLanguages.isEmpty()) {
            throw new IllegalArgumentException("At least one target language is required");
        }
        Set<Language> required = EnumSet.copyOf(requiredLanguages);
        Map<String, List<SlotEntry>> occurrences = new LinkedHashMap<>();
        int complete = 0;
        for (SlotEntry entry : slots) {
            occurrences.computeIfAbsent(normalize(entry.slot().sourceText()), key -> new ArrayList<>()).add(entry);
            if (entry.slot().isComplete(required)) {
                complete++;
            }
        }

        List<TranslatableUnit> units = new ArrayList<>();
        for (List<SlotEntry> group : occurrences.values()) {
            toUnit(group, required).ifPresent(units::add);
        }
        LOGGER.debug("Scanned {} slots: {} complete, {} distinct source texts missing a translation",
                slots.size(), complete, units.size());
        return new ExtractionResult(units, slots.size(), complete);
    }

    private Optional<TranslatableUnit> toUnit(List<SlotEntry> group, Set<Language> required) {
        Map<Language, Optional<String>> targetFields = new EnumMap<>(Language.class);
        Set<Language> missing = EnumSet.noneOf(Language.class);
        Map<Language, String> reusable = new EnumMap<>(Language.class);
        for (Language language : required) {
            Set<String> present = new LinkedHashSet<>();
            boolean anyMissing = false;
            for (SlotEntry entry : group) {
                TextSlot slot = entry.slot();
                Optional<String> value = slot.translation(language);
                if (value.isPresent()) {
                    present.add(value.get());
                } else {
                    anyMissing = true;
                }
            }
            if (!anyMissing) {
                targetFields.put(language, group.get(0).slot().translation(language));
                continue;
            }
            targetFields.put(language, Optional.empty());
            missing.add(language);
            if (present.size() == 1) {
                reusable.put(language, present.iterator().next());
            }
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TranslatableUnit(
                group.get(0).slot().sourceText(),
                targetFields,
                missing,
                reusable,
                group.stream().map(SlotEntry::path).toList()));
    }

    static String normalize(String sourceText) {
        return sourceText.strip();
    }
}
