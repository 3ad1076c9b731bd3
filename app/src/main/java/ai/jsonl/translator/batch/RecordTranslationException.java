package ai.jsonl.translator.batch;

import ai.jsonl.translator.translate.TranslationException;

/**
 * A string leaf somewhere inside one record could not be translated.
 */
public class RecordTranslationException extends TranslationException {

    private final int recordIndex;

    public RecordTranslationException(int recordIndex, Throwable cause) {
        super("Record #" + (recordIndex + 1) + " could not be translated", cause);
        this.recordIndex = recordIndex;
    }

    /**
     * Zero-based position of the record in the input batch.
     */
    public int recordIndex() {
        return recordIndex;
    }
}
