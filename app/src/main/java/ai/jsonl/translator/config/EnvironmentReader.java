package ai.jsonl.translator.config;

import java.util.Objects;
import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    /**
     * Returns a reader that consults this reader first and {@code fallback} for keys this one lacks.
     */
    default EnvironmentReader orElse(EnvironmentReader fallback) {
        Objects.requireNonNull(fallback, "fallback");
        return key -> get(key).or(() -> fallback.get(key));
    }
}
