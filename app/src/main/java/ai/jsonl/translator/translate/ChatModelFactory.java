package ai.jsonl.translator.translate;

import ai.jsonl.translator.config.Secrets;
import ai.jsonl.translator.config.TranslatorConfig;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the LangChain4j chat model for the configured provider. Temperature, timeout and retry count
 * are handed to the client, which owns the retry policy.
 */
public class ChatModelFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelFactory.class);

    public ChatModel create(TranslatorConfig translatorConfig, Secrets secrets) {
        return switch (translatorConfig.provider()) {
            case OPENAI -> createOpenAiChatModel(translatorConfig, secrets);
            case OLLAMA -> createOllamaChatModel(translatorConfig);
            case GEMINI -> createGeminiChatModel(translatorConfig, secrets);
        };
    }

    private ChatModel createOpenAiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.apiKey()
                .orElseThrow(() -> new IllegalStateException("API_KEY must be provided when LLM_PROVIDER=openai"));
        try {
            LOGGER.info("Using OpenAI-compatible model '{}' via {}", translatorConfig.modelName(),
                    translatorConfig.baseUrl().orElse("the default endpoint"));
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(translatorConfig.temperature())
                    .timeout(translatorConfig.timeout())
                    .maxRetries(translatorConfig.maxRetries());
            translatorConfig.baseUrl().ifPresent(builder::baseUrl);
            return builder.build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize OpenAI chat model", ex);
        }
    }

    private ChatModel createOllamaChatModel(TranslatorConfig translatorConfig) {
        try {
            String baseUrl = translatorConfig.baseUrl()
                    .orElseThrow(() -> new IllegalStateException("BASE_URL must be configured when LLM_PROVIDER=ollama"));
            LOGGER.info("Using Ollama model '{}' via {}", translatorConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(translatorConfig.modelName())
                    .temperature(translatorConfig.temperature())
                    .timeout(translatorConfig.timeout())
                    .maxRetries(translatorConfig.maxRetries())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(TranslatorConfig translatorConfig, Secrets secrets) {
        String apiKey = secrets.apiKey()
                .orElseThrow(() -> new IllegalStateException("API_KEY must be provided when LLM_PROVIDER=gemini"));
        try {
            LOGGER.info("Using Gemini model '{}'", translatorConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(translatorConfig.modelName())
                    .temperature(translatorConfig.temperature())
                    .timeout(translatorConfig.timeout())
                    .maxRetries(translatorConfig.maxRetries())
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
