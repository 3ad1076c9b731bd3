package ai.jsonl.translator.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported large language model providers.
 */
public enum LlmProvider {
    OPENAI("gpt-4o-mini", null, true),
    OLLAMA("llama3.1", "http://localhost:11434", false),
    GEMINI("gemini-1.5-flash", null, true);

    private final String defaultModel;
    private final String defaultBaseUrl;
    private final boolean requiresApiKey;

    LlmProvider(String defaultModel, String defaultBaseUrl, boolean requiresApiKey) {
        this.defaultModel = defaultModel;
        this.defaultBaseUrl = defaultBaseUrl;
        this.requiresApiKey = requiresApiKey;
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return OPENAI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "openai", "" -> OPENAI;
            case "ollama" -> OLLAMA;
            case "gemini" -> GEMINI;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }

    public String defaultModel() {
        return defaultModel;
    }

    public Optional<String> defaultBaseUrl() {
        return Optional.ofNullable(defaultBaseUrl);
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }
}
