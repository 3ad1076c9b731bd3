package ai.jsonl.translator.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-like value making up one record: an ordered object, a sequence, a string leaf or an opaque scalar.
 * Instances are immutable, so a tree can be read concurrently while it is being translated.
 */
public sealed interface TreeValue
        permits TreeValue.ObjectValue, TreeValue.SequenceValue, TreeValue.StringLeaf, TreeValue.OpaqueScalar {

    static ObjectValue object(Map<String, ? extends TreeValue> entries) {
        return new ObjectValue(new LinkedHashMap<String, TreeValue>(entries));
    }

    static SequenceValue sequence(List<? extends TreeValue> elements) {
        return new SequenceValue(List.copyOf(elements));
    }

    static StringLeaf string(String text) {
        return new StringLeaf(text);
    }

    static OpaqueScalar scalar(Object value) {
        return new OpaqueScalar(value);
    }

    /**
     * Mapping from key to value; iteration follows insertion order.
     */
    record ObjectValue(Map<String, TreeValue> entries) implements TreeValue {

        public ObjectValue {
            Objects.requireNonNull(entries, "entries");
            LinkedHashMap<String, TreeValue> copy = new LinkedHashMap<>(entries.size());
            entries.forEach((key, value) -> copy.put(
                    Objects.requireNonNull(key, "key"),
                    Objects.requireNonNull(value, () -> "value for key " + key)));
            entries = Collections.unmodifiableMap(copy);
        }

        public int size() {
            return entries.size();
        }
    }

    record SequenceValue(List<TreeValue> elements) implements TreeValue {

        public SequenceValue {
            elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        }

        public int size() {
            return elements.size();
        }
    }

    record StringLeaf(String text) implements TreeValue {

        public StringLeaf {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Number, boolean or null. Never inspected during translation.
     */
    record OpaqueScalar(Object value) implements TreeValue {

        public static final OpaqueScalar NULL = new OpaqueScalar(null);

        public OpaqueScalar {
            if (value != null && !(value instanceof Number) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
            }
        }

        public boolean isNull() {
            return value == null;
        }
    }
}
