package ai.palicorpus.translator.corpus;

import java.lang.Character.UnicodeScript;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Target languages of the corpus. The source language is always Pali.
 */
public enum Language {
    ENGLISH("english", "English", UnicodeScript.LATIN, false, EnumSet.of(
            UnicodeScript.SINHALA, UnicodeScript.TAMIL, UnicodeScript.DEVANAGARI, UnicodeScript.THAI,
            UnicodeScript.MYANMAR, UnicodeScript.KHMER, UnicodeScript.HAN, UnicodeScript.CYRILLIC)),
    SINHALA("sinhala", "Sinhala", UnicodeScript.SINHALA, true, EnumSet.of(
            UnicodeScript.TAMIL, UnicodeScript.BENGALI, UnicodeScript.DEVANAGARI, UnicodeScript.TELUGU,
            UnicodeScript.KANNADA, UnicodeScript.MALAYALAM, UnicodeScript.THAI, UnicodeScript.MYANMAR,
            UnicodeScript.KHMER));

    public static final String SOURCE_KEY = "pali";

    private final String key;
    private final String displayName;
    private final UnicodeScript script;
    private final boolean usesJoiner;
    private final Set<UnicodeScript> forbiddenScripts;

    Language(String key, String displayName, UnicodeScript script, boolean usesJoiner, Set<UnicodeScript> forbiddenScripts) {
        this.key = key;
        this.displayName = displayName;
        this.script = script;
        this.usesJoiner = usesJoiner;
        this.forbiddenScripts = forbiddenScripts;
    }

    /**
     * JSON key used for this language in the persisted corpus, e.g. {@code english}.
     */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public UnicodeScript script() {
        return script;
    }

    /**
     * Whether well-formed text in this language relies on U+200D for conjuncts.
     */
    public boolean usesJoiner() {
        return usesJoiner;
    }

    public Set<UnicodeScript> forbiddenScripts() {
        return forbiddenScripts;
    }

    public static Language from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Language must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.key.equals(normalized) || language.name().equalsIgnoreCase(normalized)) {
                return language;
            }
        }
        return switch (normalized) {
            case "en" -> ENGLISH;
            case "si" -> SINHALA;
            default -> throw new IllegalArgumentException("Unsupported language: " + raw);
        };
    }
}
