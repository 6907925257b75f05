package jsonkit;

import java.util.Objects;

/**
 * What went wrong while parsing.
 *
 * <p> Kinds are records, so two {@link ParserError}s compare equal when they report the same kind,
 * parameters included ({@code new ExpectedToken(TokenKind.COLON)} equals another instance built the
 * same way).
 *
 * @author Freeman
 */
public sealed interface ErrorKind {

    UnterminatedString UNTERMINATED_STRING = new UnterminatedString();
    UnrecognisedSymbol UNRECOGNISED_SYMBOL = new UnrecognisedSymbol();
    UnrecognisedLiteral UNRECOGNISED_LITERAL = new UnrecognisedLiteral();
    InvalidNumber INVALID_NUMBER = new InvalidNumber();
    InvalidEscapeSequence INVALID_ESCAPE_SEQUENCE = new InvalidEscapeSequence();
    ExpectedEndOfSource EXPECTED_END_OF_SOURCE = new ExpectedEndOfSource();
    UnexpectedToken UNEXPECTED_TOKEN = new UnexpectedToken();
    UnknownProperty UNKNOWN_PROPERTY = new UnknownProperty();
    UnexpectedEndOfSource UNEXPECTED_END_OF_SOURCE = new UnexpectedEndOfSource();

    Category category();

    /**
     * Human-readable description, used in exception messages.
     */
    String describe();

    enum Category {
        /**
         * Malformed token shape.
         */
        LEXICAL,
        /**
         * Well-formed token in the wrong grammar position.
         */
        STRUCTURAL,
        /**
         * Object does not match the record schema it is bound to.
         */
        SCHEMA,
        /**
         * Input ended too early, reported by both the scanner and the parser.
         */
        BOUNDARY
    }

    // lexical

    record UnterminatedString() implements ErrorKind {
        @Override
        public Category category() {
            return Category.LEXICAL;
        }

        @Override
        public String describe() {
            return "Unterminated string";
        }
    }

    record UnrecognisedSymbol() implements ErrorKind {
        @Override
        public Category category() {
            return Category.LEXICAL;
        }

        @Override
        public String describe() {
            return "Unrecognised symbol";
        }
    }

    record UnrecognisedLiteral() implements ErrorKind {
        @Override
        public Category category() {
            return Category.LEXICAL;
        }

        @Override
        public String describe() {
            return "Unrecognised literal";
        }
    }

    record InvalidNumber() implements ErrorKind {
        @Override
        public Category category() {
            return Category.LEXICAL;
        }

        @Override
        public String describe() {
            return "Invalid number";
        }
    }

    record InvalidEscapeSequence() implements ErrorKind {
        @Override
        public Category category() {
            return Category.LEXICAL;
        }

        @Override
        public String describe() {
            return "Invalid escape sequence";
        }
    }

    // structural

    record ExpectedEndOfSource() implements ErrorKind {
        @Override
        public Category category() {
            return Category.STRUCTURAL;
        }

        @Override
        public String describe() {
            return "Expected end of source";
        }
    }

    record ExpectedToken(TokenKind expected) implements ErrorKind {
        public ExpectedToken {
            Objects.requireNonNull(expected, "expected");
        }

        @Override
        public Category category() {
            return Category.STRUCTURAL;
        }

        @Override
        public String describe() {
            return "Expected " + expected.display();
        }
    }

    record UnexpectedToken() implements ErrorKind {
        @Override
        public Category category() {
            return Category.STRUCTURAL;
        }

        @Override
        public String describe() {
            return "Unexpected token";
        }
    }

    // schema

    record UnknownProperty() implements ErrorKind {
        @Override
        public Category category() {
            return Category.SCHEMA;
        }

        @Override
        public String describe() {
            return "Unknown property";
        }
    }

    record MissingProperty(String field) implements ErrorKind {
        public MissingProperty {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public Category category() {
            return Category.SCHEMA;
        }

        @Override
        public String describe() {
            return "Missing property '" + field + "'";
        }
    }

    // boundary

    record UnexpectedEndOfSource() implements ErrorKind {
        @Override
        public Category category() {
            return Category.BOUNDARY;
        }

        @Override
        public String describe() {
            return "Unexpected end of source";
        }
    }
}
