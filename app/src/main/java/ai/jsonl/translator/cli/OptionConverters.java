package ai.jsonl.translator.cli;

import ai.jsonl.translator.config.LogFormat;
import ai.jsonl.translator.translate.TranslationMode;
import picocli.CommandLine;

/**
 * Lenient parsing for enum-valued options: case-insensitive, with {@code -} accepted for {@code _}.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static final class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {
        @Override
        public TranslationMode convert(String value) {
            return TranslationMode.from(value);
        }
    }

    public static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return LogFormat.from(value);
        }
    }
}
