package jsonkit;

import static jsonkit.Json.isClassPresent;
import static jsonkit.Json.raw;

import com.google.protobuf.BoolValue;
import com.google.protobuf.DoubleValue;
import com.google.protobuf.FloatValue;
import com.google.protobuf.Int32Value;
import com.google.protobuf.Int64Value;
import com.google.protobuf.ListValue;
import com.google.protobuf.NullValue;
import com.google.protobuf.StringValue;
import com.google.protobuf.Struct;
import com.google.protobuf.UInt32Value;
import com.google.protobuf.UInt64Value;
import com.google.protobuf.Value;
import java.lang.reflect.Type;
import java.util.Set;

/**
 * Parses JSON into the protobuf well-known types that have a plain JSON mapping: {@link Value},
 * {@link Struct}, {@link ListValue} and the scalar wrappers.
 *
 * <p> Only active when protobuf-java is on the classpath. Messages with generated descriptors are not
 * supported.
 *
 * @author Freeman
 * @since 0.2.0
 */
public final class ProtobufDeserializer implements Json.Deserializer {

    private static final boolean PROTOBUF_PRESENT = isClassPresent("com.google.protobuf.Message");

    private static final Set<String> SUPPORTED = Set.of(
            "com.google.protobuf.Value",
            "com.google.protobuf.Struct",
            "com.google.protobuf.ListValue",
            "com.google.protobuf.StringValue",
            "com.google.protobuf.BoolValue",
            "com.google.protobuf.Int32Value",
            "com.google.protobuf.Int64Value",
            "com.google.protobuf.UInt32Value",
            "com.google.protobuf.UInt64Value",
            "com.google.protobuf.FloatValue",
            "com.google.protobuf.DoubleValue");

    public ProtobufDeserializer() {}

    @Override
    public boolean canDeserialize(Type targetType) {
        return PROTOBUF_PRESENT && SUPPORTED.contains(raw(targetType).getName());
    }

    @Override
    public JsonParse<?> deserializer(Json.Parser parser, Type targetType) {
        var raw = raw(targetType);
        if (raw == Value.class) return Parsers.value().map(ProtobufDeserializer::toValue);
        if (raw == Struct.class) return Parsers.object().map(ProtobufDeserializer::toStruct);
        if (raw == ListValue.class) return Parsers.array().map(ProtobufDeserializer::toListValue);
        if (raw == StringValue.class) return Parsers.string().map(StringValue::of);
        if (raw == BoolValue.class) return Parsers.bool().map(BoolValue::of);
        if (raw == Int32Value.class) return Parsers.int32().map(Int32Value::of);
        if (raw == Int64Value.class) return Parsers.int64().map(Int64Value::of);
        // uint32 is carried in a Java int
        if (raw == UInt32Value.class) return Parsers.uint32().map(v -> UInt32Value.of(v.intValue()));
        if (raw == UInt64Value.class) return Parsers.uint64().map(UInt64Value::of);
        if (raw == FloatValue.class) return Parsers.float32().map(FloatValue::of);
        if (raw == DoubleValue.class) return Parsers.float64().map(DoubleValue::of);
        throw new Json.DefinitionException("Unsupported protobuf type: " + targetType.getTypeName());
    }

    static Value toValue(JsonValue value) {
        var builder = Value.newBuilder();
        if (value instanceof JsonNull) builder.setNullValue(NullValue.NULL_VALUE);
        else if (value instanceof JsonBoolean b) builder.setBoolValue(b.value());
        else if (value instanceof JsonNumber n) builder.setNumberValue(n.value());
        else if (value instanceof JsonString s) builder.setStringValue(s.value());
        else if (value instanceof JsonObject o) builder.setStructValue(toStruct(o));
        else if (value instanceof JsonArray a) builder.setListValue(toListValue(a));
        return builder.build();
    }

    static Struct toStruct(JsonObject object) {
        var builder = Struct.newBuilder();
        object.value().forEach((k, v) -> builder.putFields(k, toValue(v)));
        return builder.build();
    }

    static ListValue toListValue(JsonArray array) {
        var builder = ListValue.newBuilder();
        for (var v : array.value()) builder.addValues(toValue(v));
        return builder.build();
    }
}
