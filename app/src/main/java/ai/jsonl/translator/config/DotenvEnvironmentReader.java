package ai.jsonl.translator.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code KEY=VALUE} pairs from a {@code .env} file. A missing file yields no values.
 * Blank lines, {@code #} comments and an optional leading {@code export} are ignored; values may be
 * wrapped in single or double quotes.
 */
public class DotenvEnvironmentReader implements EnvironmentReader {

    public static final String DEFAULT_FILE_NAME = ".env";

    private final Map<String, String> values;

    public DotenvEnvironmentReader(Path file) {
        this.values = Files.isRegularFile(file) ? parse(file) : Map.of();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    private static Map<String, String> parse(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read environment file " + file, ex);
        }
        Map<String, String> parsed = new HashMap<>();
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).strip();
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = line.substring(0, separator).strip();
            String value = unquote(line.substring(separator + 1).strip());
            parsed.put(key, value);
        }
        return Map.copyOf(parsed);
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        int comment = value.indexOf(" #");
        return comment >= 0 ? value.substring(0, comment).stripTrailing() : value;
    }
}
