package ai.jsonl.translator.cli;

import ai.jsonl.translator.config.LogFormat;
import ai.jsonl.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "jsonl-translator", mixinStandardHelpOptions = true, version = "jsonl-translator 1.0.0",
        description = "Translates every string value of a JSON Lines file with a language model, keeping the structure of each record")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT_FILE", description = "JSON Lines file to translate")
    private Path inputFile;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "CONCURRENCY", defaultValue = "8",
            description = "Maximum number of translation requests in flight (default: ${DEFAULT-VALUE})")
    private int concurrencyLimit = 8;

    @CommandLine.Parameters(index = "2", arity = "0..1", paramLabel = "RECORD_LIMIT", defaultValue = "-1",
            description = "Number of leading records to translate; -1 translates all of them (default: ${DEFAULT-VALUE})")
    private int recordLimit = -1;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file (default: translated/<input file name>)", paramLabel = "FILE")
    private Path outputFile;

    @CommandLine.Option(names = "--translation-mode", description = "Translation execution mode: production, dry-run, or mock", converter = OptionConverters.TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--target-language", description = "Language to translate into (default: French)", paramLabel = "LANGUAGE")
    private String targetLanguage;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every string as it is translated")
    private boolean verbose;

    public Path inputFile() {
        return inputFile;
    }

    public int concurrencyLimit() {
        return concurrencyLimit;
    }

    public int recordLimit() {
        return recordLimit;
    }

    public Path outputFile() {
        return outputFile;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public String targetLanguage() {
        return targetLanguage;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
