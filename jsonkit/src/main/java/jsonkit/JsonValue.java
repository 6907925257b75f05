package jsonkit;

/**
 * Untyped JSON value tree.
 *
 * <p> Values are records, so equality is structural. A tree is built bottom-up by
 * {@link Parsers#value()} and owned by the caller; nodes are never shared.
 *
 * @author Freeman
 * @since 2025/10/9
 */
public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {

    /**
     * Append the compact JSON rendering of this value.
     *
     * @throws Json.WriteException if the value cannot be represented as JSON text
     */
    void appendTo(StringBuilder out);

    /**
     * @return compact JSON text, which parses back to an equal value
     * @throws Json.WriteException if the value cannot be represented as JSON text
     */
    default String stringify() {
        var sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }
}
