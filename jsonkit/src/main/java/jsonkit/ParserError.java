package jsonkit;

import java.util.Objects;

/**
 * A position-annotated parse failure.
 *
 * @param kind   what went wrong
 * @param line   1-based line of the offending token
 * @param lexeme exact source text of the offending token (possibly partial for lexical errors)
 * @author Freeman
 */
public record ParserError(ErrorKind kind, int line, String lexeme) {

    public ParserError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
    }

    static ParserError at(ErrorKind kind, Token token) {
        return new ParserError(kind, token.line(), token.lexeme());
    }

    /**
     * One-line diagnostic, e.g. {@code Unexpected token at line 1 near ','}.
     */
    public String describe() {
        return kind.describe() + " at line " + line + " near '" + lexeme + "'";
    }
}
