package ai.jsonl.translator.translate;

import java.util.concurrent.CompletableFuture;

/**
 * Translator used for dry-run scenarios that preserves the original text without invoking remote APIs.
 */
public class PassThroughTranslator implements Translator {

    @Override
    public CompletableFuture<String> translate(String text) {
        return CompletableFuture.completedFuture(text);
    }
}
