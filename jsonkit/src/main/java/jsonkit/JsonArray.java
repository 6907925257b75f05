package jsonkit;

import java.util.List;
import java.util.Objects;

/**
 * JSON array. Elements are copied on construction and cannot be modified.
 *
 * @author Freeman
 * @since 2025/10/9
 */
public record JsonArray(List<JsonValue> value) implements JsonValue {

    public JsonArray {
        value = List.copyOf(Objects.requireNonNull(value, "value"));
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append('[');
        for (int i = 0; i < value.size(); i++) {
            if (i > 0) out.append(',');
            value.get(i).appendTo(out);
        }
        out.append(']');
    }
}
