package ai.palicorpus.translator.corpus;

/**
 * Variants of the corpus hierarchy.
 */
public enum NodeKind {
    COLLECTION,
    BOOK,
    CHAPTER,
    SECTION
}
