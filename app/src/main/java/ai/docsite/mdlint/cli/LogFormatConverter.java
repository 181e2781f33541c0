package ai.docsite.mdlint.cli;

import ai.docsite.mdlint.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses {@code --log-format}; picocli reports the rejected value with the accepted ones.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("'" + value + "' is not a log format (text, json)");
        }
    }
}
