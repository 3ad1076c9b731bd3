package ai.jsonl.translator.batch;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * One string leaf handed to the gate: its text, the position label used in log lines and errors, and
 * the future of the translator call admitted for it.
 */
record TranslationJob(String position, String text, CompletableFuture<String> call) {

    TranslationJob {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(call, "call");
    }

    static TranslationJob submit(String position, String text, ConcurrencyGate gate,
                                 Supplier<? extends CompletableFuture<String>> operation) {
        return new TranslationJob(position, text, gate.submit(operation));
    }
}
