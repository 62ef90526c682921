package io.netconf.confdiff.cli;

import io.netconf.confdiff.config.LogFormat;
import io.netconf.confdiff.config.Mode;
import java.util.function.Function;
import picocli.CommandLine;

/**
 * Enum option converters reporting unknown values as picocli conversion errors.
 */
final class OptionConverters {

    private OptionConverters() {
    }

    private static <T> T convert(String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }

    static final class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return OptionConverters.convert(value, Mode::from);
        }
    }

    static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return OptionConverters.convert(value, LogFormat::from);
        }
    }
}
