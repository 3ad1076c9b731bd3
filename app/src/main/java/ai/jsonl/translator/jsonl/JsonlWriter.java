package ai.jsonl.translator.jsonl;

import ai.jsonl.translator.tree.TreeValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes records as JSON Lines. The file is assembled next to its target and moved into place once
 * complete, so readers never observe a partially written batch.
 */
public class JsonlWriter {

    private final ObjectMapper mapper;
    private final TreeValueCodec codec;

    public JsonlWriter() {
        this(JsonlMapper.create(), new TreeValueCodec());
    }

    JsonlWriter(ObjectMapper mapper, TreeValueCodec codec) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public void write(Path target, List<TreeValue> records) {
        if (target == null || records == null) {
            throw new IllegalArgumentException("target and records must be provided");
        }
        Path absolute = target.toAbsolutePath();
        Path temporary = null;
        try {
            Files.createDirectories(absolute.getParent());
            temporary = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString() + ".", ".tmp");
            try (BufferedWriter writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
                for (TreeValue record : records) {
                    writer.write(mapper.writeValueAsString(codec.toPlain(record)));
                    writer.write('\n');
                }
            }
            moveIntoPlace(temporary, absolute);
        } catch (IOException ex) {
            deleteQuietly(temporary, ex);
            throw new UncheckedIOException("Failed to write records to " + target, ex);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temporary, IOException failure) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
        }
    }
}
