package ai.jsonl.translator.batch;

import ai.jsonl.translator.translate.PortFailureException;
import ai.jsonl.translator.translate.Translator;
import ai.jsonl.translator.tree.TreeValue;
import ai.jsonl.translator.tree.TreeValue.ObjectValue;
import ai.jsonl.translator.tree.TreeValue.OpaqueScalar;
import ai.jsonl.translator.tree.TreeValue.SequenceValue;
import ai.jsonl.translator.tree.TreeValue.StringLeaf;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a {@link TreeValue} with every string leaf replaced by its translation.
 *
 * <p>Each container launches one future per child and joins them before rebuilding itself, so the whole
 * tree is offered to the gate at once and the gate alone decides how many translator calls run. Children
 * are paired with their key or index while they are launched; the container is walked exactly once.
 * A failing leaf fails its ancestors immediately and cancels the siblings still pending.
 */
public class TreeTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeTranslator.class);

    private final Translator translator;

    public TreeTranslator(Translator translator) {
        this.translator = Objects.requireNonNull(translator, "translator");
    }

    public CompletableFuture<TreeValue> translate(TreeValue value, ConcurrencyGate gate) {
        return translate(value, gate, "Value");
    }

    /**
     * @param position label of {@code value} used in log lines and in {@link PortFailureException}
     */
    public CompletableFuture<TreeValue> translate(TreeValue value, ConcurrencyGate gate, String position) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(gate, "gate");
        Objects.requireNonNull(position, "position");
        if (value instanceof StringLeaf leaf) {
            return translateLeaf(leaf.text(), gate, position);
        }
        if (value instanceof ObjectValue object) {
            return translateObject(object, gate, position);
        }
        if (value instanceof SequenceValue sequence) {
            return translateSequence(sequence, gate, position);
        }
        if (value instanceof OpaqueScalar) {
            return CompletableFuture.completedFuture(value);
        }
        throw new IllegalStateException("Unknown tree value: " + value.getClass().getName());
    }

    private CompletableFuture<TreeValue> translateObject(ObjectValue object, ConcurrencyGate gate, String position) {
        List<String> keys = new ArrayList<>(object.size());
        List<CompletableFuture<TreeValue>> children = new ArrayList<>(object.size());
        for (Map.Entry<String, TreeValue> entry : object.entries().entrySet()) {
            keys.add(entry.getKey());
            children.add(translate(entry.getValue(), gate, position + " (" + entry.getKey() + ")"));
        }
        return Futures.gather(children, values -> {
            Map<String, TreeValue> rebuilt = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                rebuilt.put(keys.get(i), values.get(i));
            }
            return TreeValue.object(rebuilt);
        });
    }

    private CompletableFuture<TreeValue> translateSequence(SequenceValue sequence, ConcurrencyGate gate, String position) {
        List<TreeValue> elements = sequence.elements();
        List<CompletableFuture<TreeValue>> children = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            children.add(translate(elements.get(i), gate, position + " (" + i + ")"));
        }
        return Futures.gather(children, TreeValue::sequence);
    }

    private CompletableFuture<TreeValue> translateLeaf(String text, ConcurrencyGate gate, String position) {
        TranslationJob job = TranslationJob.submit(position, text, gate, () -> invoke(position, text));
        return Futures.transform(job.call(), translated -> {
            if (translated == null) {
                throw new IllegalStateException("translator returned no text");
            }
            LOGGER.debug("{} translated.", job.position());
            return TreeValue.string(translated);
        }, error -> new PortFailureException(job.position(), error));
    }

    private CompletableFuture<String> invoke(String position, String text) {
        LOGGER.debug("Translating {}...", position);
        return translator.translate(text);
    }
}
