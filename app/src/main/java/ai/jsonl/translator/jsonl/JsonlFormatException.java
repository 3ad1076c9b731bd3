package ai.jsonl.translator.jsonl;

import java.nio.file.Path;

/**
 * A line of a JSON Lines file does not hold exactly one JSON value.
 */
public class JsonlFormatException extends RuntimeException {

    private final int lineNumber;

    public JsonlFormatException(Path file, int lineNumber, Throwable cause) {
        super("Invalid JSON on line " + lineNumber + " of " + file + ": " + cause.getMessage(), cause);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
