package jsonkit;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A classified, position-tagged lexical unit.
 *
 * @param kind   token kind
 * @param line   1-based line the token was read on
 * @param lexeme exact source text of the token, quotes and escapes included
 * @param value  decoded value of a {@link TokenKind#STRING} token, {@code null} for every other kind
 * @author Freeman
 */
public record Token(TokenKind kind, int line, String lexeme, @Nullable String value) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
        if ((kind == TokenKind.STRING) != (value != null)) {
            throw new IllegalArgumentException("Only STRING tokens carry a decoded value: " + kind);
        }
    }

    static Token of(TokenKind kind, int line, String lexeme) {
        return new Token(kind, line, lexeme, null);
    }

    static Token string(int line, String lexeme, String value) {
        return new Token(TokenKind.STRING, line, lexeme, value);
    }
}
