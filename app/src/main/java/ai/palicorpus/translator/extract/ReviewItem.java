package ai.palicorpus.translator.extract;

import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.SlotPath;
import java.util.Objects;

/**
 * A unit/language pair left untranslated that an operator has to look at.
 *
 * @param reason short machine-readable cause such as {@code OVER_EXPANSION} or {@code PROVIDER_REJECTED}
 */
public record ReviewItem(SlotPath location, Language language, String sourceText, String reason, String detail) {

    public static final String PROVIDER_REJECTED = "PROVIDER_REJECTED";

    public ReviewItem {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(reason, "reason");
        detail = detail == null ? "" : detail;
    }
}
