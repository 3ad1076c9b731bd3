package ai.jsonl.translator.config;

import java.util.Optional;

/**
 * Holds the credential for the model endpoint. {@link #toString()} never reveals it.
 */
public record Secrets(Optional<String> apiKey) {

    public Secrets {
        apiKey = apiKey == null ? Optional.empty() : apiKey.filter(value -> !value.isBlank());
    }

    public static Secrets none() {
        return new Secrets(Optional.empty());
    }

    @Override
    public String toString() {
        return "Secrets[apiKey=" + (apiKey.isPresent() ? "****" : "<unset>") + "]";
    }
}
