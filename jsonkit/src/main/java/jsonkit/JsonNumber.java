package jsonkit;

/**
 * JSON number, held as a 64-bit float.
 *
 * @author Freeman
 * @since 2025/10/9
 */
public record JsonNumber(double value) implements JsonValue {

    private static final double MAX_PLAIN_INTEGRAL = 1e15;

    @Override
    public void appendTo(StringBuilder out) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new Json.WriteException("Cannot write NaN or Infinity as JSON number: " + value);
        if (value == Math.rint(value) && Math.abs(value) < MAX_PLAIN_INTEGRAL) {
            // keep the sign of negative zero, it would not survive the long conversion
            if (value == 0 && Double.compare(value, 0.0) < 0) out.append('-');
            out.append((long) value);
        } else {
            out.append(value);
        }
    }
}
