package ai.jsonl.translator.config;

import ai.jsonl.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputFile,
        Path outputFile,
        int concurrencyLimit,
        int recordLimit,
        TranslationMode translationMode,
        LogFormat logFormat,
        boolean verbose,
        String targetLanguage,
        TranslatorConfig translatorConfig,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(inputFile, "inputFile");
        Objects.requireNonNull(outputFile, "outputFile");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrency limit must be at least 1");
        }
        if (inputFile.toAbsolutePath().normalize().equals(outputFile.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("output file must differ from the input file");
        }
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (targetLanguage == null || targetLanguage.isBlank()) {
            throw new IllegalArgumentException("targetLanguage must not be blank");
        }
        translatorConfig = Objects.requireNonNull(translatorConfig, "translatorConfig");
        secrets = Objects.requireNonNull(secrets, "secrets");
    }

    public boolean hasRecordLimit() {
        return recordLimit >= 0;
    }
}
