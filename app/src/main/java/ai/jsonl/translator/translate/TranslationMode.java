package ai.jsonl.translator.translate;

import java.util.Locale;

/**
 * Mode controlling how translations are executed.
 */
public enum TranslationMode {
    PRODUCTION,
    DRY_RUN,
    MOCK;

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TranslationMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported translation mode: " + raw);
    }

    public boolean callsModel() {
        return this == PRODUCTION;
    }
}
