package ai.palicorpus.translator.cli;

import ai.palicorpus.translator.config.Mode;
import picocli.CommandLine;

/**
 * Parses {@code --mode}; unknown values become picocli usage errors.
 */
public class ModeConverter implements CommandLine.ITypeConverter<Mode> {

    @Override
    public Mode convert(String value) {
        try {
            return Mode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(
                    "'" + value + "' is not a mode; use translate, extract, apply, load or status");
        }
    }
}
