package ai.palicorpus.translator.translate;

import ai.palicorpus.translator.corpus.Language;
import java.lang.Character.UnicodeScript;

/**
 * Mock translator producing text that passes validation for the target language.
 */
public class MockTranslator implements Translator {

    static final String SINHALA_SAMPLE = "පරීක්ෂණ පරිවර්තනය";

    @Override
    public String translate(String sourceText, Language target) {
        if (target.script() == UnicodeScript.LATIN) {
            return "[MOCK] " + sourceText;
        }
        return "[MOCK] " + SINHALA_SAMPLE;
    }
}
