package jsonkit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON object. Key order is not significant. The members are copied on construction and cannot be
 * modified.
 *
 * @author Freeman
 * @since 2025/10/9
 */
public record JsonObject(Map<String, JsonValue> value) implements JsonValue {

    public JsonObject {
        Objects.requireNonNull(value, "value");
        // copied into a LinkedHashMap to keep the source order for the writer
        value = Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    @Override
    public void appendTo(StringBuilder out) {
        out.append('{');
        boolean first = true;
        for (var en : value.entrySet()) {
            if (!first) out.append(',');
            first = false;
            JsonString.quote(out, en.getKey());
            out.append(':');
            en.getValue().appendTo(out);
        }
        out.append('}');
    }
}
