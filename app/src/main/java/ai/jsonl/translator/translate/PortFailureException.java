package ai.jsonl.translator.translate;

/**
 * Raised when the translator fails for one string leaf.
 */
public class PortFailureException extends TranslationException {

    private final String position;

    public PortFailureException(String position, Throwable cause) {
        super("Translation failed for " + position + describe(cause), cause);
        this.position = position;
    }

    public String position() {
        return position;
    }

    private static String describe(Throwable cause) {
        if (cause == null || cause.getMessage() == null) {
            return "";
        }
        return ": " + cause.getMessage();
    }
}
