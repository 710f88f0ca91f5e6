package ai.palicorpus.translator.sanitize;

/**
 * Why a provider response was not accepted.
 */
public enum ValidationErrorKind {
    EMPTY_TRANSLATION,
    ARTIFACT_ENCODING,
    FOREIGN_CHARACTER,
    OVER_EXPANSION
}
