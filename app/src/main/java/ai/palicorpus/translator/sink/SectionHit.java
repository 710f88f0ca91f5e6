package ai.palicorpus.translator.sink;

/**
 * A full-text search match.
 */
public record SectionHit(String chapterId, int sectionNumber, String pali, String english, String sinhala) {
}
