package ai.palicorpus.translator.translate;

import ai.palicorpus.translator.corpus.Language;

/**
 * Translation provider capability: Pali text in, raw target-language text out.
 *
 * <p>Implementations signal failures with {@link TranslationException} subclasses so callers can tell
 * a quota stop from a transient fault or a rejected request.
 */
@FunctionalInterface
public interface Translator {

    String translate(String sourceText, Language target);
}
