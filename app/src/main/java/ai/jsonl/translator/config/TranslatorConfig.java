package ai.jsonl.translator.config;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the translation model provider.
 */
public record TranslatorConfig(LlmProvider provider,
                               String modelName,
                               Optional<String> baseUrl,
                               double temperature,
                               Duration timeout,
                               int maxRetries) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be zero or greater");
        }
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
