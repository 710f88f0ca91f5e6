package ai.palicorpus.translator.cli;

import ai.palicorpus.translator.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses log format CLI options.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
