package ai.jsonl.translator.jsonl;

import ai.jsonl.translator.tree.TreeValue;
import ai.jsonl.translator.tree.TreeValue.ObjectValue;
import ai.jsonl.translator.tree.TreeValue.OpaqueScalar;
import ai.jsonl.translator.tree.TreeValue.SequenceValue;
import ai.jsonl.translator.tree.TreeValue.StringLeaf;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between Jackson's untyped object model (maps, lists, strings, numbers, booleans and null)
 * and {@link TreeValue}.
 */
public class TreeValueCodec {

    public TreeValue fromPlain(Object value) {
        if (value == null) {
            return OpaqueScalar.NULL;
        }
        if (value instanceof String text) {
            return TreeValue.string(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, TreeValue> entries = new LinkedHashMap<>();
            map.forEach((key, entry) -> entries.put(String.valueOf(key), fromPlain(entry)));
            return TreeValue.object(entries);
        }
        if (value instanceof List<?> list) {
            List<TreeValue> elements = new ArrayList<>(list.size());
            for (Object element : list) {
                elements.add(fromPlain(element));
            }
            return TreeValue.sequence(elements);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return TreeValue.scalar(value);
        }
        throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }

    public Object toPlain(TreeValue value) {
        if (value instanceof StringLeaf leaf) {
            return leaf.text();
        }
        if (value instanceof ObjectValue object) {
            Map<String, Object> map = new LinkedHashMap<>();
            object.entries().forEach((key, entry) -> map.put(key, toPlain(entry)));
            return map;
        }
        if (value instanceof SequenceValue sequence) {
            List<Object> list = new ArrayList<>(sequence.size());
            for (TreeValue element : sequence.elements()) {
                list.add(toPlain(element));
            }
            return list;
        }
        if (value instanceof OpaqueScalar scalar) {
            return scalar.value();
        }
        throw new IllegalStateException("Unknown tree value: " + value);
    }
}
