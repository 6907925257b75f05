package jsonkit;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Token cursor shared by every {@link JsonParse} taking part in one parse call.
 *
 * <p> Holds exactly one token of lookahead ({@code current}) plus the last consumed token
 * ({@code previous}), which is what diagnostics are anchored to. The grammar is LL(1), so nothing
 * else is buffered.
 *
 * <p> Not thread-safe; a cursor belongs to a single parse call.
 *
 * @author Freeman
 */
public final class Cursor {

    static final String BUG_PREVIOUS_BEFORE_ADVANCE = "[BUG] Previous token requested before any token was consumed";

    private final Scanner scanner;
    private @Nullable Token previous;
    private @Nullable Token current;

    /**
     * Create a cursor and prime it with the first token of the scanner.
     *
     * @throws Json.ParseException if the first token is malformed
     */
    public Cursor(Scanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.current = scanner.next();
    }

    /**
     * @return the current (not yet consumed) token
     * @throws Json.ParseException {@link ErrorKind.UnexpectedEndOfSource} if the source is exhausted
     */
    public Token peek() {
        if (current == null) throw error(ErrorKind.UNEXPECTED_END_OF_SOURCE);
        return current;
    }

    /**
     * @return whether the current token has the given kind, regardless of the value it carries
     * @throws Json.ParseException {@link ErrorKind.UnexpectedEndOfSource} if the source is exhausted
     */
    public boolean check(TokenKind kind) {
        return peek().kind() == kind;
    }

    /**
     * Consume the current token and pull the next one from the scanner.
     *
     * @return the token just consumed, which is now {@link #previous()}
     * @throws Json.ParseException if the source is exhausted or the next token is malformed
     */
    public Token advance() {
        var consumed = peek();
        previous = consumed;
        current = scanner.next();
        return consumed;
    }

    /**
     * Consume the current token, which must be of the given kind.
     *
     * @throws Json.ParseException {@link ErrorKind.ExpectedToken} anchored at the current token otherwise
     */
    public Token consume(TokenKind kind) {
        if (check(kind)) return advance();
        throw error(new ErrorKind.ExpectedToken(kind));
    }

    /**
     * @return the most recently consumed token
     * @throws IllegalStateException if nothing has been consumed yet, which is an engine defect
     */
    public Token previous() {
        if (previous == null) throw new IllegalStateException(BUG_PREVIOUS_BEFORE_ADVANCE);
        return previous;
    }

    public boolean isAtEnd() {
        return current == null;
    }

    /**
     * Build an error anchored at the current token, or at the previous one once the source is
     * exhausted.
     */
    public Json.ParseException error(ErrorKind kind) {
        if (current != null) return errorAt(kind, current);
        if (previous != null) return errorAt(kind, previous);
        // empty input, there is no token at all
        return new Json.ParseException(new ParserError(kind, scanner.line(), ""));
    }

    /**
     * Build an error anchored at the token consumed last, e.g. a trailing comma.
     */
    public Json.ParseException errorAtPrevious(ErrorKind kind) {
        return errorAt(kind, previous());
    }

    public Json.ParseException errorAt(ErrorKind kind, Token token) {
        return new Json.ParseException(ParserError.at(kind, token));
    }
}
