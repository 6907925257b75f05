package jsonkit;

import java.util.Objects;
import java.util.function.Function;

/**
 * Parse one value of type {@code T} from a {@link Cursor}.
 *
 * <p> This is the single capability the whole engine is built from: an implementation consumes
 * exactly the tokens of one value and leaves the cursor on the first token after it, recursing into
 * other {@code JsonParse} instances for nested values. Implementations report malformed input by
 * throwing {@link Json.ParseException}; they never return partial results.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonParse<List<Long>> ids = Parsers.list(Parsers.uint32());
 * List<Long> result = Json.parse("[1, 2, 3]", ids);
 * }</pre>
 *
 * @param <T> result type
 * @author Freeman
 * @see Parsers
 * @see RecordSchema
 */
@FunctionalInterface
public interface JsonParse<T> {

    T parse(Cursor cursor);

    /**
     * Post-process the parsed value.
     */
    default <R> JsonParse<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return cursor -> mapper.apply(parse(cursor));
    }
}
