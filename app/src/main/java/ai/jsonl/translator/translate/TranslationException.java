package ai.jsonl.translator.translate;

/**
 * Unchecked failure of a translation, raised by translators and wrapped by the batch layer.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
