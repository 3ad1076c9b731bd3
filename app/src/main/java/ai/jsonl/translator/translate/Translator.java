package ai.jsonl.translator.translate;

import java.util.concurrent.CompletableFuture;

/**
 * Single-shot text translation capability backed by a language model or a local stand-in.
 * Implementations may complete the returned future on any thread.
 */
@FunctionalInterface
public interface Translator {

    CompletableFuture<String> translate(String text);
}
