package ai.jsonl.translator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Translator backed by a LangChain4j {@link ChatModel} implementation.
 * The model client blocks, so each call runs on the supplied executor.
 */
public class ChatModelTranslator implements Translator {

    private final ChatModel model;
    private final Executor executor;
    private final String targetLanguage;
    private final String providerName;
    private final String modelName;

    public ChatModelTranslator(ChatModel model, Executor executor, String targetLanguage,
                               String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public CompletableFuture<String> translate(String text) {
        Objects.requireNonNull(text, "text");
        return CompletableFuture.supplyAsync(() -> chat(text), executor);
    }

    String buildPrompt(String text) {
        return """
I will give you a text that you will have to translate to %s.
Just give me the translation, without any additional context or formatting.
Keep the syntax as it was, for example if there is no punctuation, don't add any.
Here is the text you have to translate :\s""".formatted(targetLanguage) + text;
    }

    private String chat(String text) {
        String response;
        try {
            response = model.chat(buildPrompt(text));
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new TranslationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new TranslationException("LangChain translation failed", ex);
        }
        if (response == null) {
            throw new TranslationException("%s model '%s' returned no content".formatted(providerName, modelName));
        }
        return response;
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
