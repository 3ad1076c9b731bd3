package ai.jsonl.translator.jsonl;

import ai.jsonl.translator.tree.TreeValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads a JSON Lines file into one {@link TreeValue} per non-blank line.
 */
public class JsonlReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectMapper mapper;
    private final TreeValueCodec codec;

    public JsonlReader() {
        this(JsonlMapper.create(), new TreeValueCodec());
    }

    JsonlReader(ObjectMapper mapper, TreeValueCodec codec) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public List<TreeValue> read(Path file) {
        Objects.requireNonNull(file, "file");
        List<TreeValue> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                    line = line.substring(1);
                }
                if (line.isBlank()) {
                    continue;
                }
                records.add(parse(file, lineNumber, line));
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read records from " + file, ex);
        }
        return records;
    }

    private TreeValue parse(Path file, int lineNumber, String line) {
        try {
            return codec.fromPlain(mapper.readValue(line, Object.class));
        } catch (JsonProcessingException ex) {
            throw new JsonlFormatException(file, lineNumber, ex);
        }
    }
}
