package ai.palicorpus.translator.translate;

import ai.palicorpus.translator.corpus.Language;

/**
 * Translator used for dry-run scenarios that echoes the source text without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public String translate(String sourceText, Language target) {
        return sourceText == null ? "" : sourceText;
    }
}
