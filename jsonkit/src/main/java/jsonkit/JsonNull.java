package jsonkit;

/**
 * @author Freeman
 * @since 2025/10/9
 */
public record JsonNull() implements JsonValue {
    @Override
    public void appendTo(StringBuilder out) {
        out.append("null");
    }
}
