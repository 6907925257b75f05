package jsonkit;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Builder;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent JSON parser with typed deserialization.
 *
 * <p> Every parse runs the same pipeline: a {@link Scanner} turns the text into tokens, a
 * {@link Cursor} keeps one token of lookahead, and the {@link JsonParse} selected by the requested
 * type consumes the tokens of exactly one value. Whatever follows that value is an error.
 *
 * <p> Malformed input is reported with a {@link ParseException} carrying a {@link ParserError}
 * (kind, line and offending source text). The first error aborts the parse.
 *
 * @author <a href="mailto:llw599502537@gmail.com">Freeman</a>
 */
public final class Json {

    private static final Parser defaultParser = Parser.builder().build();

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse JSON text into a target type described by a {@link Type} token.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * record Point(int x, int y) {}
     *
     * List<Point> points = Json.parse("[{\"x\":42,\"y\":21}]", new Json.Type<List<Point>>() {});
     * // -> [Point[x=42, y=21]]
     * }</pre>
     *
     * @param json JSON text, not {@code null}
     * @param type target type token, not {@code null}
     * @param <T>  result type
     * @return parsed value, never {@code null}
     * @throws ParseException      if the text is not a single well-formed value of the target type
     * @throws DefinitionException if the target type is not supported
     */
    public static <T> T parse(String json, Type<T> type) {
        return defaultParser.parse(json, type);
    }

    /**
     * Parse JSON text into a target class.
     *
     * <p> This is a convenience overload of {@link #parse(String, Type)}
     *
     * @param json  JSON text, not {@code null}
     * @param clazz target class, not {@code null}
     * @param <T>   result type
     * @return parsed value, never {@code null}
     */
    public static <T> T parse(String json, Class<T> clazz) {
        return defaultParser.parse(json, clazz);
    }

    /**
     * Parse JSON text with explicit parse logic, e.g. from {@link Parsers} or a {@link RecordSchema}.
     *
     * @param json  JSON text, not {@code null}
     * @param parse parse logic for the top-level value, not {@code null}
     * @param <T>   result type
     * @return parsed value
     */
    public static <T> T parse(String json, JsonParse<T> parse) {
        return defaultParser.parse(json, parse);
    }

    /**
     * Render a value tree as compact JSON text.
     *
     * @throws WriteException if the tree holds a number JSON cannot represent (NaN, Infinity)
     */
    public static String stringify(JsonValue value) {
        Objects.requireNonNull(value, "value");
        return value.stringify();
    }

    public static Parser defaultParser() {
        return defaultParser;
    }

    // ============================================================
    // Extension point
    // ============================================================

    /**
     * Supplies parse logic for target types the built-in resolution does not know.
     *
     * <p> Implementations are registered on a {@link Parser.ParserBuilder#deserializer(Deserializer)},
     * or discovered through {@link ServiceLoader}. Registered ones are asked first.
     */
    public interface Deserializer {
        boolean canDeserialize(java.lang.reflect.Type targetType);

        JsonParse<?> deserializer(Json.Parser parser, java.lang.reflect.Type targetType);
    }

    // ============================================================
    // Type token
    // ============================================================

    public abstract static class Type<T> {
        private final java.lang.reflect.Type type;

        protected Type() {
            Class<?> c = findTypeSubclass(getClass());
            var p = (ParameterizedType) c.getGenericSuperclass();
            this.type = p.getActualTypeArguments()[0];
        }

        private Type(java.lang.reflect.Type t) {
            this.type = t;
        }

        public static <T> Type<T> of(Class<T> clazz) {
            return new Type<>(clazz) {};
        }

        public java.lang.reflect.Type getType() {
            return type;
        }

        private static Class<?> findTypeSubclass(Class<?> child) {
            Class<?> parent = child.getSuperclass();
            if (parent == Type.class) return child;
            if (parent == Object.class) throw new IllegalStateException("Expected Json.Type superclass");
            return findTypeSubclass(parent);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Type<?> t && Objects.equals(type, t.type);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(type);
        }

        @Override
        public String toString() {
            return "Type{" + type + '}';
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * Parser configuration plus the cache of resolved parse logic per target type.
     *
     * <p> Immutable once built and safe to share between threads; every parse call gets its own
     * scanner and cursor.
     */
    public static final class Parser {

        private final List<Deserializer> deserializers;

        private final Map<java.lang.reflect.Type, JsonParse<?>> resolved = new ConcurrentHashMap<>();

        @Builder(toBuilder = true)
        private Parser(@Singular("deserializer") List<Deserializer> deserializers) {
            this.deserializers = List.copyOf(deserializers);
        }

        public <T> T parse(String json, Class<T> clazz) {
            Objects.requireNonNull(clazz, "clazz");
            return parse(json, Type.of(clazz));
        }

        public <T> T parse(String json, Type<T> type) {
            Objects.requireNonNull(type, "type");
            return parse(json, this.<T>resolveAs(type.getType()));
        }

        public <T> T parse(String json, JsonParse<T> parse) {
            Objects.requireNonNull(json, "json");
            Objects.requireNonNull(parse, "parse");
            if (LOGGER.isTraceEnabled()) LOGGER.trace("Parsing {} characters with {}", json.length(), parse);

            var cursor = new Cursor(new Scanner(json));
            T result = parse.parse(cursor);
            if (!cursor.isAtEnd()) throw cursor.error(ErrorKind.EXPECTED_END_OF_SOURCE);
            return result;
        }

        /**
         * Find the parse logic for a target type. Results are cached per type.
         *
         * @throws DefinitionException if the type is not supported
         */
        public JsonParse<?> resolve(java.lang.reflect.Type targetType) {
            var type = canonicalize(Objects.requireNonNull(targetType, "targetType"));
            var cached = resolved.get(type);
            if (cached != null) return cached;
            var created = create(type);
            var existing = resolved.putIfAbsent(type, created);
            return existing != null ? existing : created;
        }

        /**
         * Schema of a Java record, derived from its components unless a {@link Deserializer} claims
         * the type.
         */
        @SuppressWarnings("unchecked")
        public <R extends Record> RecordSchema<R> recordSchema(Class<R> type) {
            var parse = resolve(type);
            if (parse instanceof RecordSchema<?> schema) return (RecordSchema<R>) schema;
            return RecordSchema.derive(type, this);
        }

        @SuppressWarnings("unchecked")
        <T> JsonParse<T> resolveAs(java.lang.reflect.Type targetType) {
            return (JsonParse<T>) resolve(targetType);
        }

        private JsonParse<?> create(java.lang.reflect.Type type) {
            var parse = createParse(type);
            LOGGER.debug("Resolved parse for {}", type.getTypeName());
            return parse;
        }

        private JsonParse<?> createParse(java.lang.reflect.Type type) {
            Class<?> raw = raw(type);

            // 0) Untyped targets
            if (raw == JsonValue.class || raw == Object.class) return Parsers.value();
            if (raw == JsonObject.class) return Parsers.object();
            if (raw == JsonArray.class) return Parsers.array();

            // 1) Custom deserializers
            for (var d : deserializers) {
                if (d.canDeserialize(type)) return d.deserializer(this, type);
            }
            for (var d : LoadedDeserializersHolder.INSTANCE) {
                if (d.canDeserialize(type)) return d.deserializer(this, type);
            }

            // 2) Scalars
            if (raw == String.class || raw == CharSequence.class) return Parsers.string();
            if (raw == boolean.class || raw == Boolean.class) return Parsers.bool();
            if (raw == byte.class || raw == Byte.class) return Parsers.int8();
            if (raw == short.class || raw == Short.class) return Parsers.int16();
            if (raw == int.class || raw == Integer.class) return Parsers.int32();
            if (raw == long.class || raw == Long.class) return Parsers.int64();
            if (raw == float.class || raw == Float.class) return Parsers.float32();
            if (raw == double.class || raw == Double.class) return Parsers.float64();
            if (raw == BigInteger.class) return Parsers.bigInteger();
            if (raw == BigDecimal.class) return Parsers.bigDecimal();

            // 3) Containers
            if (raw == Optional.class) return Parsers.optional(resolve(typeArgument(type, 0)));
            if (raw == List.class || raw == ArrayList.class || raw == Collection.class || raw == Iterable.class) {
                return Parsers.list(resolve(typeArgument(type, 0)));
            }
            if (raw == Set.class || raw == LinkedHashSet.class) return Parsers.set(resolve(typeArgument(type, 0)));
            if (raw == Map.class || raw == LinkedHashMap.class) {
                var keyType = typeArgument(type, 0);
                if (keyType != String.class && keyType != Object.class)
                    throw new DefinitionException("Map keys must be String, got " + keyType.getTypeName());
                return Parsers.map(resolve(typeArgument(type, 1)));
            }

            // 4) Records
            if (raw.isRecord()) return deriveRecord(type, raw.asSubclass(Record.class));

            throw new DefinitionException("Unsupported target type: " + type.getTypeName());
        }

        private JsonParse<?> deriveRecord(java.lang.reflect.Type type, Class<? extends Record> raw) {
            var schema = RecordSchema.derive(raw, this);
            // cached before the components resolve, so a recursive record finds itself
            var existing = resolved.putIfAbsent(type, schema);
            if (existing != null) return existing;
            try {
                for (var c : raw.getRecordComponents()) resolve(c.getGenericType());
            } catch (DefinitionException e) {
                resolved.remove(type, schema);
                throw e;
            }
            return schema;
        }
    }

    // ============================================================
    // Type utils
    // ============================================================

    private static final class LoadedDeserializersHolder {
        private static final List<Deserializer> INSTANCE = loadDeserializers();
    }

    static List<Deserializer> loadDeserializers() {
        var loaded = new ArrayList<Deserializer>();
        for (var d : ServiceLoader.load(Deserializer.class)) {
            LOGGER.debug("Loaded deserializer {}", d.getClass().getName());
            loaded.add(d);
        }
        return List.copyOf(loaded);
    }

    /**
     * @throws DefinitionException for a type that has no class, such as a custom {@code Type} implementation
     */
    static Class<?> raw(java.lang.reflect.Type t) {
        if (t instanceof Class<?> c) return c;
        if (t instanceof ParameterizedType p) return (Class<?>) p.getRawType();
        if (t instanceof GenericArrayType ga) return Array.newInstance(raw(ga.getGenericComponentType()), 0).getClass();
        if (t instanceof TypeVariable<?> || t instanceof WildcardType) return raw(canonicalize(t));
        throw new DefinitionException("Unsupported type: " + t);
    }

    /**
     * Type argument at {@code index}, canonicalized; {@code Object} for a raw container.
     */
    static java.lang.reflect.Type typeArgument(java.lang.reflect.Type t, int index) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[index]);
        return Object.class;
    }

    /**
     * Replace a wildcard or type variable by its first upper bound, repeatedly. Unbounded ones become
     * {@code Object}, which resolves to the untyped {@link JsonValue}.
     */
    static java.lang.reflect.Type canonicalize(java.lang.reflect.Type t) {
        java.lang.reflect.Type[] bounds;
        if (t instanceof WildcardType w) bounds = w.getUpperBounds();
        else if (t instanceof TypeVariable<?> tv) bounds = tv.getBounds();
        else return t;
        return bounds.length == 0 ? Object.class : canonicalize(bounds[0]);
    }

    static boolean isClassPresent(String name) {
        try {
            Class.forName(name, false, Json.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    // ============================================================
    // Exceptions
    // ============================================================

    /**
     * Base exception for everything the engine reports.
     *
     * @since 0.3.0
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Input is not a single well-formed value of the requested type.
     *
     * <p> {@link #error()} is the inspectable, comparable description of the failure.
     *
     * @since 0.3.0
     */
    public static class ParseException extends Exception {
        private final ParserError error;

        public ParseException(ParserError error) {
            super(Objects.requireNonNull(error, "error").describe());
            this.error = error;
        }

        public ParserError error() {
            return error;
        }

        ParseException withCause(Throwable cause) {
            initCause(cause);
            return this;
        }
    }

    /**
     * A target type or schema cannot be used for parsing: unsupported type, non-{@code String} map
     * key, duplicate schema field, or a record constructor that fails.
     *
     * @since 0.3.0
     */
    public static class DefinitionException extends Exception {
        public DefinitionException(String message) {
            super(message);
        }

        public DefinitionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A value tree cannot be rendered as JSON text.
     *
     * @since 0.3.0
     */
    public static class WriteException extends Exception {
        public WriteException(String message) {
            super(message);
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(Json.class);
}
