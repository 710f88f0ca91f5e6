package ai.palicorpus.translator.corpus;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A single translatable field: Pali source text plus its translations.
 */
public final class TextSlot {

    private static final Set<String> EMPTY_MARKERS = Set.of("N/A", "-");

    private final String sourceText;
    private final Map<Language, String> translations = new EnumMap<>(Language.class);

    public TextSlot(String sourceText) {
        if (sourceText == null || sourceText.isBlank()) {
            throw new IllegalArgumentException("sourceText must not be blank");
        }
        this.sourceText = sourceText;
    }

    public TextSlot(String sourceText, Map<Language, String> translations) {
        this(sourceText);
        if (translations != null) {
            translations.forEach((language, value) -> {
                if (value != null) {
                    this.translations.put(language, value);
                }
            });
        }
    }

    public String sourceText() {
        return sourceText;
    }

    /**
     * The stored translation when it is not missing.
     */
    public Optional<String> translation(Language language) {
        String value = translations.get(language);
        return isMissingValue(value) ? Optional.empty() : Optional.of(value);
    }

    /**
     * The stored value as-is, including placeholder markers such as {@code N/A}.
     */
    public Optional<String> rawValue(Language language) {
        return Optional.ofNullable(translations.get(language));
    }

    public boolean isMissing(Language language) {
        return isMissingValue(translations.get(language));
    }

    public boolean isComplete(Set<Language> languages) {
        for (Language language : languages) {
            if (isMissing(language)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Writes a translation. Corpus mutations go through the merge engine and the corpus reader only.
     */
    public void write(Language language, String value) {
        Objects.requireNonNull(language, "language");
        if (isMissingValue(value)) {
            throw new IllegalArgumentException("Refusing to write an empty translation for " + language.key());
        }
        translations.put(language, value);
    }

    public static boolean isMissingValue(String value) {
        if (value == null) {
            return true;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() || EMPTY_MARKERS.contains(trimmed);
    }
}
