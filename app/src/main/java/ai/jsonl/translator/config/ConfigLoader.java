package ai.jsonl.translator.config;

import ai.jsonl.translator.cli.CliArguments;
import ai.jsonl.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_MODEL = "MODEL";
    static final String ENV_BASE_URL = "BASE_URL";
    static final String ENV_API_KEY = "API_KEY";
    static final String ENV_TEMPERATURE = "TEMPERATURE";
    static final String ENV_TIMEOUT = "TIMEOUT";
    static final String ENV_MAX_RETRIES = "MAX_RETRIES";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("translated");
    private static final double DEFAULT_TEMPERATURE = 0.2;
    private static final int DEFAULT_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final String DEFAULT_TARGET_LANGUAGE = "French";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path inputFile = Objects.requireNonNull(arguments.inputFile(), "input file must be provided");
        Path outputFile = arguments.outputFile() != null
                ? arguments.outputFile()
                : DEFAULT_OUTPUT_DIRECTORY.resolve(inputFile.getFileName());

        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        String targetLanguage = firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANGUAGE, DEFAULT_TARGET_LANGUAGE);

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OPENAI);
        String modelName = environmentReader.get(ENV_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(provider.defaultModel());
        Optional<String> baseUrl = environmentReader.get(ENV_BASE_URL)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .or(provider::defaultBaseUrl);

        double temperature = environmentReader.get(ENV_TEMPERATURE)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parseDouble(ENV_TEMPERATURE, raw))
                .orElse(DEFAULT_TEMPERATURE);
        int timeoutSeconds = environmentReader.get(ENV_TIMEOUT)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parseInteger(ENV_TIMEOUT, raw))
                .orElse(DEFAULT_TIMEOUT_SECONDS);
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException(ENV_TIMEOUT + " must be at least 1 second");
        }
        int maxRetries = environmentReader.get(ENV_MAX_RETRIES)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> parseInteger(ENV_MAX_RETRIES, raw))
                .orElse(DEFAULT_MAX_RETRIES);
        if (maxRetries < 0) {
            throw new IllegalArgumentException(ENV_MAX_RETRIES + " must be zero or greater");
        }

        Secrets secrets = new Secrets(environmentReader.get(ENV_API_KEY).map(String::trim));
        if (translationMode.callsModel() && provider.requiresApiKey() && secrets.apiKey().isEmpty()) {
            throw new IllegalStateException("%s must be provided when %s=%s unless running in dry-run or mock mode"
                    .formatted(ENV_API_KEY, ENV_LLM_PROVIDER, provider.name().toLowerCase(Locale.ROOT)));
        }

        TranslatorConfig translatorConfig = new TranslatorConfig(provider, modelName, baseUrl, temperature,
                Duration.ofSeconds(timeoutSeconds), maxRetries);

        return new Config(inputFile, outputFile, arguments.concurrencyLimit(), arguments.recordLimit(),
                translationMode, logFormat, arguments.verbose(), targetLanguage, translatorConfig, secrets);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue.trim();
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(defaultValue);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInteger(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }
}
