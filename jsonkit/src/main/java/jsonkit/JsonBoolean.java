package jsonkit;

/**
 * @author Freeman
 * @since 2025/10/9
 */
public record JsonBoolean(boolean value) implements JsonValue {
    @Override
    public void appendTo(StringBuilder out) {
        out.append(value ? "true" : "false");
    }
}
