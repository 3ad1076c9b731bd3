package ai.jsonl.translator.batch;

import ai.jsonl.translator.tree.TreeValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates a batch of records concurrently behind one shared {@link ConcurrencyGate}.
 *
 * <p>All selected records are launched up front; the gate is the only throttle, so leaves of different
 * records compete for permits first come, first served. Results keep the input order. One failing record
 * fails the batch and nothing is returned for the others.
 */
public class BatchTranslator {

    public static final int NO_LIMIT = -1;

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchTranslator.class);

    private final TreeTranslator treeTranslator;

    public BatchTranslator(TreeTranslator treeTranslator) {
        this.treeTranslator = Objects.requireNonNull(treeTranslator, "treeTranslator");
    }

    /**
     * Blocks until the batch is translated.
     *
     * @param recordLimit number of leading records to translate, or a negative value for all of them
     * @throws BatchTranslationException if any selected record fails
     */
    public List<TreeValue> translate(List<TreeValue> records, int concurrencyLimit, int recordLimit) {
        try {
            return translateAsync(records, concurrencyLimit, recordLimit).join();
        } catch (CompletionException ex) {
            Throwable cause = Futures.unwrap(ex);
            if (cause instanceof BatchTranslationException batchFailure) {
                throw batchFailure;
            }
            throw new BatchTranslationException("Batch translation failed", cause);
        } catch (CancellationException ex) {
            throw new BatchTranslationException("Batch translation was cancelled", ex);
        }
    }

    public CompletableFuture<List<TreeValue>> translateAsync(List<TreeValue> records, int concurrencyLimit, int recordLimit) {
        Objects.requireNonNull(records, "records");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1");
        }
        int selected = effectiveCount(records.size(), recordLimit);
        LOGGER.info("Translating {} of {} records with up to {} concurrent requests",
                selected, records.size(), concurrencyLimit);

        ConcurrencyGate gate = new ConcurrencyGate(concurrencyLimit);
        List<CompletableFuture<TreeValue>> translations = new ArrayList<>(selected);
        for (int index = 0; index < selected; index++) {
            translations.add(translateRecord(Objects.requireNonNull(records.get(index), "record"), gate, index));
        }
        CompletableFuture<List<TreeValue>> joined = Futures.gather(translations, List::copyOf);
        return Futures.transform(joined, results -> results,
                error -> new BatchTranslationException("Batch translation aborted: " + error.getMessage(), error));
    }

    static int effectiveCount(int available, int recordLimit) {
        if (recordLimit < 0) {
            return available;
        }
        return Math.min(recordLimit, available);
    }

    private CompletableFuture<TreeValue> translateRecord(TreeValue record, ConcurrencyGate gate, int index) {
        String position = "Record #" + (index + 1);
        return Futures.transform(treeTranslator.translate(record, gate, position), translated -> {
            LOGGER.info("{} translated.", position);
            return translated;
        }, error -> new RecordTranslationException(index, error));
    }
}
