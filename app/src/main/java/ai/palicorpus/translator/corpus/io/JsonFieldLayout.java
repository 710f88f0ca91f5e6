package ai.palicorpus.translator.corpus.io;

import ai.palicorpus.translator.corpus.FieldKind;
import ai.palicorpus.translator.corpus.Language;

/**
 * JSON key naming of translatable fields in the persisted corpus.
 *
 * <p>Collection, book and chapter fields are nested objects ({@code "title": {"pali": .., "english": ..}}).
 * Section fields are flat keys on the section object ({@code paliTitle}, {@code englishTitle}, {@code vaggaSinhala}).
 */
final class JsonFieldLayout {

    private JsonFieldLayout() {
    }

    static String nestedObjectKey(FieldKind field) {
        return switch (field) {
            case NAME -> "name";
            case TITLE -> "title";
            case FOOTER -> "footer";
            default -> throw new IllegalArgumentException(field + " is not stored as a nested object");
        };
    }

    static String sectionSourceKey(FieldKind field) {
        return switch (field) {
            case BODY -> Language.SOURCE_KEY;
            case TITLE -> "paliTitle";
            case VAGGA -> "vagga";
            default -> throw new IllegalArgumentException(field + " is not a section field");
        };
    }

    static String sectionTranslationKey(FieldKind field, Language language) {
        String capitalized = Character.toUpperCase(language.key().charAt(0)) + language.key().substring(1);
        return switch (field) {
            case BODY -> language.key();
            case TITLE -> language.key() + "Title";
            case VAGGA -> "vagga" + capitalized;
            default -> throw new IllegalArgumentException(field + " is not a section field");
        };
    }
}
