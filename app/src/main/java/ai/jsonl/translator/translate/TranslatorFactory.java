package ai.jsonl.translator.translate;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Picks the translator for a {@link TranslationMode}. The production translator is built on first
 * selection only, so dry and mock runs never create a model client.
 */
public class TranslatorFactory {

    private final Supplier<Translator> productionSupplier;
    private final Translator dryRunTranslator;
    private final Translator mockTranslator;
    private Translator productionTranslator;

    public TranslatorFactory(Supplier<Translator> productionSupplier,
                             Translator dryRunTranslator,
                             Translator mockTranslator) {
        this.productionSupplier = Objects.requireNonNull(productionSupplier, "productionSupplier");
        this.dryRunTranslator = Objects.requireNonNull(dryRunTranslator, "dryRunTranslator");
        this.mockTranslator = Objects.requireNonNull(mockTranslator, "mockTranslator");
    }

    public synchronized Translator select(TranslationMode mode) {
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case PRODUCTION -> production();
            case DRY_RUN -> dryRunTranslator;
            case MOCK -> mockTranslator;
        };
    }

    private Translator production() {
        if (productionTranslator == null) {
            productionTranslator = Objects.requireNonNull(productionSupplier.get(), "production translator");
        }
        return productionTranslator;
    }
}
