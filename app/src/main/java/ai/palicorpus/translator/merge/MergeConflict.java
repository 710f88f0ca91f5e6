package ai.palicorpus.translator.merge;

import ai.palicorpus.translator.corpus.Language;
import ai.palicorpus.translator.corpus.SlotPath;

/**
 * A location that already holds a different translation than the one being merged.
 */
public record MergeConflict(SlotPath location, Language language, String existing, String proposed) {
}
