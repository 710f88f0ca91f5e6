package ai.palicorpus.translator.cli;

import ai.palicorpus.translator.translate.TranslationMode;
import picocli.CommandLine;

public class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {

    @Override
    public TranslationMode convert(String value) {
        try {
            return TranslationMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(
                    "'" + value + "' is not a translation mode; use production, dry-run or mock");
        }
    }
}
