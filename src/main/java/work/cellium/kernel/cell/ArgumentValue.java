package work.cellium.kernel.cell;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decoded command argument: plain text, a list, or a string-keyed map. Non-string JSON leaves
 * nested inside a list or map are kept as {@link Scalar}.
 */
public sealed interface ArgumentValue
    permits ArgumentValue.Text, ArgumentValue.ListValue, ArgumentValue.MapValue, ArgumentValue.Scalar {

    /**
     * Converts the value back into plain Java objects (String, Number, Boolean, null, List, Map).
     */
    Object toPlain();

    default String asText() {
        if (this instanceof Text text) {
            return text.value();
        }
        if (this instanceof Scalar scalar) {
            return String.valueOf(scalar.value());
        }
        throw new IllegalArgumentException("Expected a text argument but got " + kindName());
    }

    default List<ArgumentValue> asList() {
        if (this instanceof ListValue list) {
            return list.items();
        }
        throw new IllegalArgumentException("Expected a list argument but got " + kindName());
    }

    default Map<String, ArgumentValue> asMap() {
        if (this instanceof MapValue map) {
            return map.entries();
        }
        throw new IllegalArgumentException("Expected an object argument but got " + kindName());
    }

    default String kindName() {
        if (this instanceof Text) {
            return "text";
        }
        if (this instanceof ListValue) {
            return "list";
        }
        if (this instanceof MapValue) {
            return "object";
        }
        return "scalar";
    }

    static Text text(String value) {
        return new Text(value);
    }

    /**
     * Wraps a value produced by a JSON decoder. Strings become {@link Text}, lists and maps are
     * converted recursively, anything else becomes a {@link Scalar}.
     */
    static ArgumentValue fromPlain(Object value) {
        if (value instanceof ArgumentValue argument) {
            return argument;
        }
        if (value instanceof String str) {
            return new Text(str);
        }
        if (value instanceof List<?> list) {
            var items = new ArrayList<ArgumentValue>(list.size());
            for (Object item : list) {
                items.add(fromPlain(item));
            }
            return new ListValue(items);
        }
        if (value instanceof Map<?, ?> map) {
            var entries = new LinkedHashMap<String, ArgumentValue>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), fromPlain(entry.getValue()));
            }
            return new MapValue(entries);
        }
        return new Scalar(value);
    }

    record Text(String value) implements ArgumentValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        public boolean isEmpty() {
            return value.isEmpty();
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record ListValue(List<ArgumentValue> items) implements ArgumentValue {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public Object toPlain() {
            var plain = new ArrayList<Object>(items.size());
            for (ArgumentValue item : items) {
                plain.add(item.toPlain());
            }
            return plain;
        }
    }

    record MapValue(Map<String, ArgumentValue> entries) implements ArgumentValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public String getText(String key, String fallback) {
            var value = entries.get(key);
            if (value == null || (value instanceof Scalar scalar && scalar.value() == null)) {
                return fallback;
            }
            return value.asText();
        }

        @Override
        public Object toPlain() {
            var plain = new LinkedHashMap<String, Object>();
            for (Map.Entry<String, ArgumentValue> entry : entries.entrySet()) {
                plain.put(entry.getKey(), entry.getValue().toPlain());
            }
            return plain;
        }
    }

    record Scalar(Object value) implements ArgumentValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }
}
