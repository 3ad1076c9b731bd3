package ai.jsonl.translator.batch;

import ai.jsonl.translator.translate.TranslationException;

/**
 * Aborts a whole batch; no record of the batch is returned.
 */
public class BatchTranslationException extends TranslationException {

    public BatchTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
