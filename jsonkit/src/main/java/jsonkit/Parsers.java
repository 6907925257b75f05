package jsonkit;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;

/**
 * Built-in {@link JsonParse} implementations.
 *
 * <p> The parse logic is selected by the requested result type, never by the token found in the
 * input: asking for {@link #int32()} when the input holds a string is an
 * {@link ErrorKind.UnexpectedToken}, not a conversion.
 *
 * <h3>Numbers</h3>
 * All numeric parses consume exactly one number token and convert its source text. Any conversion
 * failure (out of range, fraction or exponent for an integer type, sign for an unsigned type,
 * overflow to infinity for a floating point type) is an {@link ErrorKind.InvalidNumber} anchored at
 * that token. Unsigned widths are widened to the next signed Java type, except {@link #uint64()}
 * which keeps the unsigned bit pattern in a {@code long} (see {@link Long#toUnsignedString(long)}).
 *
 * @author Freeman
 */
public final class Parsers {

    private static final JsonParse<JsonValue> VALUE = Parsers::readValue;
    private static final JsonParse<JsonObject> OBJECT = map(VALUE).map(JsonObject::new);
    private static final JsonParse<JsonArray> ARRAY = list(VALUE).map(JsonArray::new);

    private static final JsonParse<String> STRING = Parsers::readString;
    private static final JsonParse<Boolean> BOOL = Parsers::readBool;

    private static final JsonParse<Byte> INT8 = number(Byte::parseByte);
    private static final JsonParse<Short> INT16 = number(Short::parseShort);
    private static final JsonParse<Integer> INT32 = number(Integer::parseInt);
    private static final JsonParse<Long> INT64 = number(Long::parseLong);
    private static final JsonParse<Short> UINT8 = number(s -> (short) parseUnsigned(s, 0xFFL));
    private static final JsonParse<Integer> UINT16 = number(s -> (int) parseUnsigned(s, 0xFFFFL));
    private static final JsonParse<Long> UINT32 = number(s -> parseUnsigned(s, 0xFFFF_FFFFL));
    private static final JsonParse<Long> UINT64 = number(Long::parseUnsignedLong);
    private static final JsonParse<Float> FLOAT32 = number(Parsers::parseFloat);
    private static final JsonParse<Double> FLOAT64 = number(Parsers::parseDouble);
    private static final JsonParse<BigInteger> BIG_INTEGER = number(BigInteger::new);
    private static final JsonParse<BigDecimal> BIG_DECIMAL = number(BigDecimal::new);

    private Parsers() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Untyped
    // ============================================================

    /**
     * Any JSON value, dispatched on the kind of the current token.
     */
    public static JsonParse<JsonValue> value() {
        return VALUE;
    }

    public static JsonParse<JsonObject> object() {
        return OBJECT;
    }

    public static JsonParse<JsonArray> array() {
        return ARRAY;
    }

    // ============================================================
    // Scalars
    // ============================================================

    /**
     * A string token, yielding its decoded (unescaped) value.
     */
    public static JsonParse<String> string() {
        return STRING;
    }

    public static JsonParse<Boolean> bool() {
        return BOOL;
    }

    public static JsonParse<Byte> int8() {
        return INT8;
    }

    public static JsonParse<Short> int16() {
        return INT16;
    }

    public static JsonParse<Integer> int32() {
        return INT32;
    }

    public static JsonParse<Long> int64() {
        return INT64;
    }

    public static JsonParse<Short> uint8() {
        return UINT8;
    }

    public static JsonParse<Integer> uint16() {
        return UINT16;
    }

    public static JsonParse<Long> uint32() {
        return UINT32;
    }

    /**
     * Unsigned 64-bit integer; values above {@link Long#MAX_VALUE} come back negative, as with
     * {@link Long#parseUnsignedLong(String)}.
     */
    public static JsonParse<Long> uint64() {
        return UINT64;
    }

    public static JsonParse<Float> float32() {
        return FLOAT32;
    }

    public static JsonParse<Double> float64() {
        return FLOAT64;
    }

    public static JsonParse<BigInteger> bigInteger() {
        return BIG_INTEGER;
    }

    public static JsonParse<BigDecimal> bigDecimal() {
        return BIG_DECIMAL;
    }

    // ============================================================
    // Containers
    // ============================================================

    /**
     * {@code null} yields {@link Optional#empty()}; anything else is parsed with {@code item}.
     *
     * <p> For nested optionals {@code null} always yields the outermost empty value.
     */
    public static <T> JsonParse<Optional<T>> optional(JsonParse<T> item) {
        Objects.requireNonNull(item, "item");
        return cursor -> {
            if (cursor.check(TokenKind.NULL)) {
                cursor.advance();
                return Optional.empty();
            }
            return Optional.of(item.parse(cursor));
        };
    }

    /**
     * A JSON array whose elements are all parsed with {@code item}. Trailing commas are rejected.
     */
    public static <T> JsonParse<List<T>> list(JsonParse<T> item) {
        Objects.requireNonNull(item, "item");
        return cursor -> {
            var list = new ArrayList<T>();
            elements(cursor, c -> list.add(item.parse(c)));
            return list;
        };
    }

    public static <T> JsonParse<Set<T>> set(JsonParse<T> item) {
        return list(item).map(LinkedHashSet::new);
    }

    /**
     * A JSON object with arbitrary keys whose values are all parsed with {@code item}.
     * A repeated key keeps the value that comes last.
     */
    public static <T> JsonParse<Map<String, T>> map(JsonParse<T> item) {
        Objects.requireNonNull(item, "item");
        return cursor -> {
            var map = new LinkedHashMap<String, T>();
            members(cursor, (key, c) -> map.put(key.value(), item.parse(c)));
            return map;
        };
    }

    /**
     * Defer creating a parse until it is first used, which allows recursive types.
     */
    public static <T> JsonParse<T> lazy(Supplier<? extends JsonParse<T>> supplier) {
        return new Lazy<>(supplier);
    }

    // ============================================================
    // Grammar
    // ============================================================

    @FunctionalInterface
    interface MemberHandler {
        /**
         * Called with the cursor positioned on the member value, the key and colon already consumed.
         */
        void member(Token key, Cursor cursor);
    }

    @FunctionalInterface
    interface ElementHandler {
        void element(Cursor cursor);
    }

    /**
     * Walk {@code [ element (, element)* ]}.
     */
    static void elements(Cursor cursor, ElementHandler handler) {
        cursor.consume(TokenKind.LBRACKET);
        boolean hadComma = false;
        while (!cursor.check(TokenKind.RBRACKET)) {
            handler.element(cursor);
            hadComma = cursor.check(TokenKind.COMMA);
            if (hadComma) cursor.advance();
            else break;
        }
        if (hadComma) throw cursor.errorAtPrevious(ErrorKind.UNEXPECTED_TOKEN);
        cursor.consume(TokenKind.RBRACKET);
    }

    /**
     * Walk {@code { "key" : value (, "key" : value)* }}.
     *
     * @return the opening brace token
     */
    static Token members(Cursor cursor, MemberHandler handler) {
        var open = cursor.consume(TokenKind.LBRACE);
        boolean hadComma = false;
        while (!cursor.check(TokenKind.RBRACE)) {
            var key = cursor.advance();
            if (key.kind() != TokenKind.STRING) throw cursor.errorAtPrevious(ErrorKind.UNEXPECTED_TOKEN);
            cursor.consume(TokenKind.COLON);
            handler.member(key, cursor);
            hadComma = cursor.check(TokenKind.COMMA);
            if (hadComma) cursor.advance();
            else break;
        }
        if (hadComma) throw cursor.errorAtPrevious(ErrorKind.UNEXPECTED_TOKEN);
        cursor.consume(TokenKind.RBRACE);
        return open;
    }

    private static JsonValue readValue(Cursor cursor) {
        return switch (cursor.peek().kind()) {
            case LBRACE -> OBJECT.parse(cursor);
            case LBRACKET -> ARRAY.parse(cursor);
            case STRING -> new JsonString(readString(cursor));
            case NUMBER -> new JsonNumber(FLOAT64.parse(cursor));
            case BOOL -> new JsonBoolean(readBool(cursor));
            case NULL -> {
                cursor.advance();
                yield new JsonNull();
            }
            case RBRACE, RBRACKET, COLON, COMMA -> throw cursor.error(ErrorKind.UNEXPECTED_TOKEN);
        };
    }

    private static String readString(Cursor cursor) {
        var token = cursor.advance();
        if (token.kind() != TokenKind.STRING) throw cursor.errorAtPrevious(ErrorKind.UNEXPECTED_TOKEN);
        return Objects.requireNonNull(token.value());
    }

    private static Boolean readBool(Cursor cursor) {
        var token = cursor.advance();
        if (token.kind() != TokenKind.BOOL) throw cursor.errorAtPrevious(ErrorKind.UNEXPECTED_TOKEN);
        return "true".equals(token.lexeme());
    }

    private static <T> JsonParse<T> number(Function<String, T> conversion) {
        return cursor -> {
            var token = cursor.advance();
            if (token.kind() != TokenKind.NUMBER) throw cursor.errorAtPrevious(ErrorKind.UNEXPECTED_TOKEN);
            try {
                return conversion.apply(token.lexeme());
            } catch (NumberFormatException e) {
                throw cursor.errorAtPrevious(ErrorKind.INVALID_NUMBER).withCause(e);
            }
        };
    }

    private static long parseUnsigned(String s, long max) {
        if (s.startsWith("-")) throw new NumberFormatException("Negative value for unsigned type: " + s);
        long v = Long.parseLong(s);
        if (v > max) throw new NumberFormatException("Value out of range: " + s);
        return v;
    }

    private static double parseDouble(String s) {
        double d = Double.parseDouble(s);
        if (Double.isInfinite(d)) throw new NumberFormatException("Value out of range: " + s);
        return d;
    }

    private static float parseFloat(String s) {
        float f = Float.parseFloat(s);
        if (Float.isInfinite(f)) throw new NumberFormatException("Value out of range: " + s);
        return f;
    }

    private static final class Lazy<T> implements JsonParse<T> {
        private final Supplier<? extends JsonParse<T>> supplier;
        private volatile @Nullable JsonParse<T> delegate;

        Lazy(Supplier<? extends JsonParse<T>> supplier) {
            this.supplier = Objects.requireNonNull(supplier, "supplier");
        }

        @Override
        public T parse(Cursor cursor) {
            var d = delegate;
            if (d == null) {
                d = Objects.requireNonNull(supplier.get(), "lazy parse supplier returned null");
                delegate = d;
            }
            return d.parse(cursor);
        }
    }
}
