package jsonkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/**
 * Cross-checks parsing and writing against Jackson.
 *
 * @author Freeman
 * @since 2025/10/10
 */
class JacksonTest {

    private static final JsonMapper jsonMapper = JsonMapper.builder().build();

    // @spotless:off
    private static final String[] VALID = {
            "[]",
            "{}",
            "null",
            "1234.567e5",
            "\"str a_b\"",
            "{\"name\": \"Jane Doe\", \"age\": 32}",
            "[\"first\", \"second\", 3, true]",
            "{\"a\": {\"b\": {\"c\": [1, [2, [3]]]}}, \"d\": false}",
            "\"\\u00A9 \\uD83D\\uDE00 \\\\ \\/ \\b\\f\\n\\r\\t\"",
            "[-0.5, 0.1, 1E+2, 1e-2, -12.5e3, 9007199254740993]",
            " \t\r\n[ 1 , 2 ]\n",
    };

    private static final String[] INVALID = {
            "[,]",
            "{",
            "[1, 2 3]",
            "[1, 2,]",
            "{\"key\" \"value\"}",
            "{ true: 5 }",
            "\"bad\\escape\"",
            "[+1]",
            "tru",
    };
    // @spotless:on

    static JsonValue fromJava(Object o) {
        if (o == null) return new JsonNull();
        if (o instanceof Boolean b) return new JsonBoolean(b);
        if (o instanceof Number n) return new JsonNumber(n.doubleValue());
        if (o instanceof String s) return new JsonString(s);
        if (o instanceof List<?> list) {
            var elements = new ArrayList<JsonValue>();
            for (var e : list) elements.add(fromJava(e));
            return new JsonArray(elements);
        }
        if (o instanceof Map<?, ?> map) {
            var members = new LinkedHashMap<String, JsonValue>();
            map.forEach((k, v) -> members.put((String) k, fromJava(v)));
            return new JsonObject(members);
        }
        throw new IllegalArgumentException("Unexpected Jackson value: " + o.getClass());
    }

    @Test
    void parsesLikeJackson() {
        assertAll(IntStream.range(0, VALID.length).mapToObj(i -> () -> {
            var input = VALID[i];
            var expected = fromJava(jsonMapper.readValue(input, Object.class));
            var actual = Json.parse(input, JsonValue.class);
            assertThat(actual).as("Case %d: input=%s", i, input).isEqualTo(expected);
        }));
    }

    @Test
    void jacksonReadsWhatWeWrite() {
        assertAll(IntStream.range(0, VALID.length).mapToObj(i -> () -> {
            var input = VALID[i];
            var value = Json.parse(input, JsonValue.class);
            var reread = fromJava(jsonMapper.readValue(Json.stringify(value), Object.class));
            assertThat(reread).as("Case %d: input=%s", i, input).isEqualTo(value);
        }));
    }

    @Test
    void rejectsWhatJacksonRejects() {
        assertAll(IntStream.range(0, INVALID.length).mapToObj(i -> () -> {
            var input = INVALID[i];
            assertThatCode(() -> jsonMapper.readValue(input, Object.class))
                    .as("Jackson, case %d: input=%s", i, input)
                    .isInstanceOf(JacksonException.class);
            assertThatCode(() -> Json.parse(input, JsonValue.class))
                    .as("Case %d: input=%s", i, input)
                    .isInstanceOf(Json.ParseException.class);
        }));
    }
}
