package jsonkit;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds a JSON object literal to a record type through a fixed field schema.
 *
 * <p> Every declared field is required: parsing fails with {@link ErrorKind.MissingProperty} (anchored
 * at the opening brace) when one is absent, and with {@link ErrorKind.UnknownProperty} (anchored at
 * the key) when the object holds a key the schema does not declare. A field of type
 * {@link java.util.Optional} must still be present, but may be {@code null}. A repeated key keeps the
 * value that comes last.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * record Person(String name, long age) {}
 *
 * RecordSchema<Person> schema = RecordSchema.builder()
 *         .field("name", Parsers.string())
 *         .field("age", Parsers.uint32())
 *         .build(slots -> new Person(slots.get("name"), slots.get("age")));
 *
 * Person jane = Json.parse("{\"name\": \"Jane\", \"age\": 32}", schema);
 * }</pre>
 *
 * <p> Schemas for Java records can also be derived from their components, see {@link #of(Class)}.
 *
 * @param <R> record type
 * @author Freeman
 */
public final class RecordSchema<R> implements JsonParse<R> {

    private final List<Field<?>> fields;
    private final Map<String, Integer> index;
    private final Function<? super Slots, ? extends R> factory;

    private RecordSchema(List<Field<?>> fields, Function<? super Slots, ? extends R> factory) {
        this.fields = List.copyOf(fields);
        this.factory = factory;
        var idx = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < this.fields.size(); i++) idx.put(this.fields.get(i).name(), i);
        this.index = Collections.unmodifiableMap(idx);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Derive the schema of a Java record from its components, resolving component types with the
     * default {@link Json.Parser}.
     */
    public static <R extends Record> RecordSchema<R> of(Class<R> type) {
        return Json.defaultParser().recordSchema(type);
    }

    /**
     * Declared fields, in declaration order.
     */
    public List<Field<?>> fields() {
        return fields;
    }

    @Override
    public R parse(Cursor cursor) {
        var values = new Object[fields.size()];
        var present = new BitSet(fields.size());

        var open = Parsers.members(cursor, (key, c) -> {
            Integer i = index.get(key.value());
            if (i == null) throw c.errorAt(ErrorKind.UNKNOWN_PROPERTY, key);
            values[i] = fields.get(i).parse().parse(c);
            present.set(i);
        });

        int missing = present.nextClearBit(0);
        if (missing < fields.size())
            throw cursor.errorAt(new ErrorKind.MissingProperty(fields.get(missing).name()), open);

        return factory.apply(new Slots(index, values));
    }

    static <R extends Record> RecordSchema<R> derive(Class<R> type, Json.Parser parser) {
        var components = type.getRecordComponents();
        var builder = builder();
        for (var c : components) {
            builder.field(c.getName(), Parsers.<Object>lazy(() -> parser.resolveAs(c.getGenericType())));
        }
        var ctor = canonicalConstructor(type, components);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(
                    "Derived record schema for {}: {}",
                    type.getName(),
                    Arrays.stream(components).map(RecordComponent::getName).toList());
        }
        return builder.build(slots -> newInstance(ctor, slots.values));
    }

    private static <R> Constructor<R> canonicalConstructor(Class<R> type, RecordComponent[] components) {
        var types = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
        try {
            var ctor = type.getDeclaredConstructor(types);
            if (!ctor.canAccess(null)) ctor.setAccessible(true);
            return ctor;
        } catch (NoSuchMethodException | RuntimeException e) {
            throw new Json.DefinitionException("Cannot access canonical constructor of record " + type.getName(), e);
        }
    }

    private static <R> R newInstance(Constructor<R> ctor, Object[] args) {
        try {
            return ctor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new Json.DefinitionException(
                    "Constructor of record " + ctor.getDeclaringClass().getName() + " rejected its arguments: "
                            + e.getCause().getMessage(),
                    e.getCause());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new Json.DefinitionException(
                    "Failed to construct record instance of type " + ctor.getDeclaringClass().getName(), e);
        }
    }

    /**
     * A declared field.
     *
     * @param name  JSON key
     * @param parse parse logic for the value
     */
    public record Field<T>(String name, JsonParse<T> parse) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(parse, "parse");
        }
    }

    /**
     * Parsed field values handed to the record factory. Every declared field is filled.
     */
    public static final class Slots {
        private final Map<String, Integer> index;
        private final Object[] values;

        Slots(Map<String, Integer> index, Object[] values) {
            this.index = index;
            this.values = values;
        }

        /**
         * @param field declared field name
         * @return the parsed value, typed by the caller
         * @throws Json.DefinitionException if the schema declares no such field
         */
        @SuppressWarnings("unchecked")
        public <V> V get(String field) {
            Integer i = index.get(field);
            if (i == null) throw new Json.DefinitionException("Schema declares no field '" + field + "'");
            return (V) values[i];
        }
    }

    public static final class Builder {
        private final List<Field<?>> fields = new ArrayList<>();

        private Builder() {}

        /**
         * Declare the next field.
         *
         * @throws Json.DefinitionException if a field with this name is already declared
         */
        public <T> Builder field(String name, JsonParse<T> parse) {
            for (var f : fields) {
                if (f.name().equals(name)) throw new Json.DefinitionException("Duplicate field '" + name + "'");
            }
            fields.add(new Field<>(name, parse));
            return this;
        }

        public <R> RecordSchema<R> build(Function<? super Slots, ? extends R> factory) {
            Objects.requireNonNull(factory, "factory");
            return new RecordSchema<>(fields, factory);
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordSchema.class);
}
