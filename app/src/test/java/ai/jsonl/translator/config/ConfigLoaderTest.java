package ai.jsonl.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.jsonl.translator.cli.CliArguments;
import ai.jsonl.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsWhenOnlyInputFileIsGiven() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "data/train.jsonl");

        Config config = new ConfigLoader(environment(Map.of(ConfigLoader.ENV_API_KEY, "sk-test"))).load(cliArguments);

        assertThat(config.inputFile()).isEqualTo(Path.of("data/train.jsonl"));
        assertThat(config.outputFile()).isEqualTo(Path.of("translated", "train.jsonl"));
        assertThat(config.concurrencyLimit()).isEqualTo(8);
        assertThat(config.recordLimit()).isEqualTo(-1);
        assertThat(config.hasRecordLimit()).isFalse();
        assertThat(config.translationMode()).isEqualTo(TranslationMode.PRODUCTION);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.verbose()).isFalse();
        assertThat(config.targetLanguage()).isEqualTo("French");
        assertThat(config.translatorConfig().provider()).isEqualTo(LlmProvider.OPENAI);
        assertThat(config.translatorConfig().modelName()).isEqualTo("gpt-4o-mini");
        assertThat(config.translatorConfig().baseUrl()).isEmpty();
        assertThat(config.translatorConfig().temperature()).isEqualTo(0.2);
        assertThat(config.translatorConfig().timeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.translatorConfig().maxRetries()).isEqualTo(3);
        assertThat(config.secrets().apiKey()).contains("sk-test");
    }

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "in.jsonl", "4", "10",
                "--output", "out/result.jsonl",
                "--translation-mode", "dry-run",
                "--target-language", "Spanish",
                "--log-format", "json",
                "--verbose");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.concurrencyLimit()).isEqualTo(4);
        assertThat(config.recordLimit()).isEqualTo(10);
        assertThat(config.hasRecordLimit()).isTrue();
        assertThat(config.outputFile()).isEqualTo(Path.of("out/result.jsonl"));
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.targetLanguage()).isEqualTo("Spanish");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
        assertThat(config.secrets().apiKey()).isEmpty();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_LLM_PROVIDER, "ollama");
        envValues.put(ConfigLoader.ENV_MODEL, "qwen2.5:7b");
        envValues.put(ConfigLoader.ENV_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_TEMPERATURE, "0.7");
        envValues.put(ConfigLoader.ENV_TIMEOUT, "30");
        envValues.put(ConfigLoader.ENV_MAX_RETRIES, "0");
        envValues.put(ConfigLoader.ENV_TARGET_LANGUAGE, "German");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "mock");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "in.jsonl");

        Config config = new ConfigLoader(environment(envValues)).load(cliArguments);

        TranslatorConfig translatorConfig = config.translatorConfig();
        assertThat(translatorConfig.provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(translatorConfig.modelName()).isEqualTo("qwen2.5:7b");
        assertThat(translatorConfig.baseUrl()).contains("http://ollama:11434");
        assertThat(translatorConfig.temperature()).isEqualTo(0.7);
        assertThat(translatorConfig.timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(translatorConfig.maxRetries()).isZero();
        assertThat(config.targetLanguage()).isEqualTo("German");
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void cliOptionsOverrideEnvironment() {
        Map<String, String> envValues = Map.of(
                ConfigLoader.ENV_TARGET_LANGUAGE, "German",
                ConfigLoader.ENV_TRANSLATION_MODE, "production",
                ConfigLoader.ENV_LOG_FORMAT, "json");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "in.jsonl", "--target-language", "Italian", "--translation-mode", "mock", "--log-format", "text");

        Config config = new ConfigLoader(environment(envValues)).load(cliArguments);

        assertThat(config.targetLanguage()).isEqualTo("Italian");
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void ollamaUsesLocalEndpointWithoutApiKey() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "in.jsonl");

        Config config = new ConfigLoader(environment(Map.of(ConfigLoader.ENV_LLM_PROVIDER, "ollama")))
                .load(cliArguments);

        assertThat(config.translatorConfig().modelName()).isEqualTo("llama3.1");
        assertThat(config.translatorConfig().baseUrl()).contains("http://localhost:11434");
    }

    @Test
    void requiresApiKeyForHostedProviderInProductionMode() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "in.jsonl");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("API_KEY");
    }

    @Test
    void blankApiKeyCountsAsMissing() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "in.jsonl");
        Map<String, String> envValues = Map.of(ConfigLoader.ENV_API_KEY, "   ", ConfigLoader.ENV_LLM_PROVIDER, "gemini");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environment(envValues)).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessageContaining("gemini");
    }

    @Test
    void rejectsMalformedNumbers() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "in.jsonl");

        Throwable temperature = catchThrowable(() -> new ConfigLoader(environment(Map.of(
                ConfigLoader.ENV_TEMPERATURE, "warm", ConfigLoader.ENV_API_KEY, "k"))).load(cliArguments));
        Throwable timeout = catchThrowable(() -> new ConfigLoader(environment(Map.of(
                ConfigLoader.ENV_TIMEOUT, "0", ConfigLoader.ENV_API_KEY, "k"))).load(cliArguments));
        Throwable retries = catchThrowable(() -> new ConfigLoader(environment(Map.of(
                ConfigLoader.ENV_MAX_RETRIES, "-2", ConfigLoader.ENV_API_KEY, "k"))).load(cliArguments));

        assertThat(temperature).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("TEMPERATURE");
        assertThat(timeout).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("TIMEOUT");
        assertThat(retries).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("MAX_RETRIES");
    }

    @Test
    void rejectsTemperatureOutsideSupportedRange() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "in.jsonl");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environment(Map.of(
                ConfigLoader.ENV_TEMPERATURE, "2.5", ConfigLoader.ENV_API_KEY, "k"))).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("temperature");
    }

    @Test
    void rejectsUnknownProvider() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "in.jsonl");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environment(Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "bard"))).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("bard");
    }

    @Test
    void rejectsConcurrencyBelowOne() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "in.jsonl", "0", "--translation-mode", "mock");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("concurrency");
    }

    @Test
    void rejectsOutputFileEqualToInput() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "in.jsonl", "--output", "./in.jsonl", "--translation-mode", "mock");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("output file");
    }

    @Test
    void secretsNeverPrintTheKey() {
        assertThat(new Secrets(Optional.of("sk-very-secret")).toString())
                .doesNotContain("sk-very-secret")
                .contains("****");
        assertThat(Secrets.none().toString()).contains("<unset>");
    }

    private static EnvironmentReader environment(Map<String, String> values) {
        return key -> Optional.ofNullable(values.get(key));
    }
}
