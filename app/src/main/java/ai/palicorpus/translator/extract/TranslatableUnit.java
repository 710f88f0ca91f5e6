package ai.palicorpus.translator.extract;

import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.SlotPath;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One distinct source text that still lacks a translation in at least one required language,
 * with every tree location where it occurs.
 *
 * @param sourceText canonical source text (the first occurrence)
 * @param targetFields per required language, the value every location already agrees on
 * @param missingLanguages required languages at least one location lacks
 * @param reusableTranslations for missing languages, the single value already present at other locations
 * @param locations slot paths in traversal order; the first is canonical
 */
public record TranslatableUnit(String sourceText,
                               Map<Language, Optional<String>> targetFields,
                               Set<Language> missingLanguages,
                               Map<Language, String> reusableTranslations,
                               List<SlotPath> locations) {

    public TranslatableUnit {
        if (sourceText == null || sourceText.isBlank()) {
            throw new IllegalArgumentException("sourceText must not be blank");
        }
        Objects.requireNonNull(targetFields, "targetFields");
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("A unit needs at least one location");
        }
        targetFields = Collections.unmodifiableMap(new EnumMap<>(targetFields));
        missingLanguages = missingLanguages.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Language.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(missingLanguages));
        reusableTranslations = reusableTranslations.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(reusableTranslations));
        locations = List.copyOf(locations);
    }

    public SlotPath canonicalLocation() {
        return locations.get(0);
    }

    public int usageCount() {
        return locations.size();
    }

    public boolean isMissing(Language language) {
        return missingLanguages.contains(language);
    }

    public Optional<String> reusableTranslation(Language language) {
        return Optional.ofNullable(reusableTranslations.get(language));
    }
}
