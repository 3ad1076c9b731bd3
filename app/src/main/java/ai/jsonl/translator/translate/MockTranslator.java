package ai.jsonl.translator.translate;

import java.util.concurrent.CompletableFuture;

/**
 * Translator that tags each text instead of calling a model, so a run can be inspected end to end.
 */
public class MockTranslator implements Translator {

    static final String PREFIX = "[MOCK] ";

    @Override
    public CompletableFuture<String> translate(String text) {
        return CompletableFuture.completedFuture(PREFIX + text);
    }
}
