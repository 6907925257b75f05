package jsonkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RecordSchemaTest {

    record Person(String name, long age) {}

    static final RecordSchema<Person> PERSON = RecordSchema.builder()
            .field("name", Parsers.string())
            .field("age", Parsers.uint32())
            .build(slots -> new Person(slots.get("name"), slots.<Long>get("age")));

    static ParserError parseError(String json, JsonParse<?> parse) {
        var e = catchThrowable(() -> Json.parse(json, parse));
        assertThat(e).as("Expected a parse error for %s", json).isInstanceOf(Json.ParseException.class);
        return ((Json.ParseException) e).error();
    }

    @Nested
    class ExplicitSchema {

        @Test
        void bindsFieldsInAnyOrder() {
            // @spotless:off
            var table = new Object[][] {
                    {"{\"name\": \"Jane Doe\", \"age\": 32}", new Person("Jane Doe", 32)},
                    {"{\"age\": 32, \"name\": \"Jane Doe\"}", new Person("Jane Doe", 32)},
                    {"{\n  \"name\": \"\",\n  \"age\": 0\n}", new Person("", 0)},
                    {"{\"name\": \"a\", \"age\": 1, \"age\": 2}", new Person("a", 2)},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var input = (String) row[0];
                var expected = (Person) row[1];
                assertThat(Json.parse(input, PERSON)).as("Case %d: input=%s", i, input).isEqualTo(expected);
            }));
        }

        @Test
        void schemaErrors() {
            // @spotless:off
            var table = new Object[][] {
                    {"{\"name\": \"Jane\"}", new ParserError(new ErrorKind.MissingProperty("age"), 1, "{")},
                    {"{}", new ParserError(new ErrorKind.MissingProperty("name"), 1, "{")},
                    {"\n\n{\n\"age\": 3\n}", new ParserError(new ErrorKind.MissingProperty("name"), 3, "{")},
                    {"{\"name\": \"Jane\", \"age\": 32, \"extra\": 1}", new ParserError(ErrorKind.UNKNOWN_PROPERTY, 1, "\"extra\"")},
                    {"{\"nickname\": \"J\"}", new ParserError(ErrorKind.UNKNOWN_PROPERTY, 1, "\"nickname\"")},
                    {"{\"name\": \"Jane\", \"age\": -1}", new ParserError(ErrorKind.INVALID_NUMBER, 1, "-1")},
                    {"{\"name\": 1, \"age\": 1}", new ParserError(ErrorKind.UNEXPECTED_TOKEN, 1, "1")},
                    {"{\"name\": \"Jane\", \"age\": 32,}", new ParserError(ErrorKind.UNEXPECTED_TOKEN, 1, ",")},
                    {"[]", new ParserError(new ErrorKind.ExpectedToken(TokenKind.LBRACE), 1, "[")},
                    {"{\"name\" \"Jane\"}", new ParserError(new ErrorKind.ExpectedToken(TokenKind.COLON), 1, "\"Jane\"")},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var input = (String) row[0];
                var expected = (ParserError) row[1];
                assertThat(parseError(input, PERSON)).as("Case %d: input=%s", i, input).isEqualTo(expected);
            }));
        }

        @Test
        void missingPropertyDescribesField() {
            assertThatCode(() -> Json.parse("{\"name\": \"Jane\"}", PERSON))
                    .isInstanceOf(Json.ParseException.class)
                    .hasMessage("Missing property 'age' at line 1 near '{'");
        }

        @Test
        void duplicateFieldIsRejected() {
            var builder = RecordSchema.builder().field("name", Parsers.string());

            assertThatCode(() -> builder.field("name", Parsers.int32()))
                    .isInstanceOf(Json.DefinitionException.class)
                    .hasMessageContaining("Duplicate field 'name'");
        }

        @Test
        void undeclaredSlotIsRejected() {
            var schema = RecordSchema.builder()
                    .field("name", Parsers.string())
                    .build(slots -> slots.<String>get("nmae"));

            assertThatCode(() -> Json.parse("{\"name\": \"x\"}", schema))
                    .isInstanceOf(Json.DefinitionException.class)
                    .hasMessageContaining("'nmae'");
        }

        @Test
        void fieldsKeepDeclarationOrder() {
            assertThat(PERSON.fields()).extracting(RecordSchema.Field::name).containsExactly("name", "age");
        }
    }

    @Nested
    class Derived {

        record Address(String street, String city) {}

        record Contact(String email, Address address, Optional<String> phone) {}

        record Node(String name, List<Node> children) {}

        record Positive(int value) {
            Positive {
                if (value <= 0) throw new IllegalArgumentException("value must be positive");
            }
        }

        record Unsupported(Thread thread) {}

        record Bad(String name, Thread t) {}

        record HoldsBad(Bad bad) {}

        @Test
        void derivesFieldsFromComponents() {
            var schema = RecordSchema.of(Contact.class);

            assertThat(schema.fields())
                    .extracting(RecordSchema.Field::name)
                    .containsExactly("email", "address", "phone");
            assertThat(RecordSchema.of(Contact.class)).isSameAs(schema);
        }

        @Test
        void parsesNestedRecords() {
            var json = """
                    {
                      "email": "jane@example.com",
                      "address": {"street": "1 Main St", "city": "Springfield"},
                      "phone": null
                    }
                    """;

            var actual = Json.parse(json, Contact.class);

            assertThat(actual)
                    .isEqualTo(new Contact(
                            "jane@example.com", new Address("1 Main St", "Springfield"), Optional.empty()));
        }

        @Test
        void optionalComponentMustStillBePresent() {
            var json = "{\"email\": \"a@b.c\", \"address\": {\"street\": \"s\", \"city\": \"c\"}}";

            assertThat(parseError(json, RecordSchema.of(Contact.class)))
                    .isEqualTo(new ParserError(new ErrorKind.MissingProperty("phone"), 1, "{"));
        }

        @Test
        void nestedErrorIsAnchoredInsideNestedObject() {
            var json = """
                    {
                      "email": "jane@example.com",
                      "address": {
                        "street": "1 Main St"
                      },
                      "phone": "555"
                    }
                    """;

            assertThat(parseError(json, RecordSchema.of(Contact.class)))
                    .isEqualTo(new ParserError(new ErrorKind.MissingProperty("city"), 3, "{"));
        }

        @Test
        void recursiveRecord() {
            var json = "{\"name\": \"root\", \"children\": [{\"name\": \"leaf\", \"children\": []}]}";

            assertThat(Json.parse(json, Node.class))
                    .isEqualTo(new Node("root", List.of(new Node("leaf", List.of()))));
        }

        @Test
        void constructorFailureIsDefinitionError() {
            assertThatCode(() -> Json.parse("{\"value\": 0}", Positive.class))
                    .isInstanceOf(Json.DefinitionException.class)
                    .hasMessageContaining("value must be positive")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void unsupportedComponentType() {
            assertThatCode(() -> Json.parse("{\"thread\": 1}", Unsupported.class))
                    .isInstanceOf(Json.DefinitionException.class)
                    .hasMessageContaining("Unsupported target type: java.lang.Thread");
        }

        @Test
        void unsupportedComponentIsReportedBeforeInputIsRead() {
            // @spotless:off
            var table = new Object[][] {
                    {"{}", Bad.class},
                    {"{\"name\": \"x\"}", Bad.class},
                    {"{\"other\": 1}", Bad.class},
                    {"{}", HoldsBad.class},
            };
            // @spotless:on

            assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
                var row = table[i];
                var input = (String) row[0];
                var type = (Class<?>) row[1];
                assertThatCode(() -> Json.parse(input, type))
                        .as("Case %d: input=%s, type=%s", i, input, type.getSimpleName())
                        .isInstanceOf(Json.DefinitionException.class)
                        .hasMessageContaining("Unsupported target type: java.lang.Thread");
            }));
        }

        @Test
        void unsupportedComponentFailsSchemaDerivation() {
            assertThatCode(() -> RecordSchema.of(Bad.class))
                    .isInstanceOf(Json.DefinitionException.class)
                    .hasMessageContaining("Unsupported target type: java.lang.Thread");

            // nothing half-built is left behind
            assertThatCode(() -> RecordSchema.of(Bad.class)).isInstanceOf(Json.DefinitionException.class);
        }

        @Test
        void mapOfRecords() {
            var actual = Json.parse(
                    "{\"home\": {\"street\": \"a\", \"city\": \"b\"}}", new Json.Type<Map<String, Address>>() {});

            assertThat(actual).isEqualTo(Map.of("home", new Address("a", "b")));
        }
    }
}
