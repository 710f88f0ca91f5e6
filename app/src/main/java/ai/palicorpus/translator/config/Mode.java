package ai.palicorpus.translator.config;

/**
 * What the CLI does with the corpus.
 */
public enum Mode {
    /** Run a translation session against the configured provider. */
    TRANSLATE,
    /** Write pending units as batch files for offline completion. */
    EXTRACT,
    /** Merge completed batch files back into the corpus. */
    APPLY,
    /** Bulk-load the corpus into the SQLite sink. */
    LOAD,
    /** Report missing translations and the stored checkpoint. */
    STATUS;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TRANSLATE;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean writesCorpus() {
        return this == TRANSLATE || this == APPLY;
    }
}
