package jsonkit;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Pull-based tokenizer.
 *
 * <p> Each call to {@link #next()} skips whitespace and scans exactly one token. The scanner only
 * validates the <em>shape</em> of numbers and literals; what they mean is decided by the
 * {@link JsonParse} that consumes them.
 *
 * <p> Positions are tracked in code points, so supplementary characters are never split.
 *
 * @author Freeman
 */
public final class Scanner {

    private static final int EOF = -1;

    private final String s;
    private int start = 0, i = 0, line = 1;

    public Scanner(String source) {
        this.s = Objects.requireNonNull(source, "source");
    }

    /**
     * Scan the next token.
     *
     * @return the next token, or {@code null} once the source is exhausted
     * @throws Json.ParseException on a lexical error
     */
    public @Nullable Token next() {
        skipWs();
        if (eof()) return null;

        start = i;
        int c = consume();
        if (c == '-' || isDigit(c)) return readNumber();
        if (Character.isAlphabetic(c)) return readLiteral();
        if (c == '"') return readString();
        return readSymbol(c);
    }

    /**
     * Current 1-based line.
     */
    public int line() {
        return line;
    }

    private void skipWs() {
        while (!eof()) {
            int c = peek();
            if (c == ' ' || c == '\t' || c == '\r') consume();
            else if (c == '\n') {
                consume();
                line++;
            } else break;
        }
    }

    private Token readNumber() {
        while (isDigit(peek())) consume();
        if (peek() == '.') {
            consume();
            while (isDigit(peek())) consume();
        }
        if (peek() == 'e' || peek() == 'E') {
            consume();
            if (peek() == '+' || peek() == '-') consume();
            if (!isDigit(peek())) throw error(ErrorKind.INVALID_NUMBER);
            while (isDigit(peek())) consume();
        }
        if (peek() != EOF && Character.isAlphabetic(peek())) throw error(ErrorKind.INVALID_NUMBER);
        // a sign alone is not a number; "-.5" and "-e5" are left to the numeric conversion
        if (lexeme().equals("-")) throw error(ErrorKind.INVALID_NUMBER);
        return Token.of(TokenKind.NUMBER, line, lexeme());
    }

    private Token readLiteral() {
        while (peek() != EOF && Character.isAlphabetic(peek())) consume();
        var text = lexeme();
        var kind = switch (text) {
            case "null" -> TokenKind.NULL;
            case "true", "false" -> TokenKind.BOOL;
            default -> throw error(ErrorKind.UNRECOGNISED_LITERAL);
        };
        return Token.of(kind, line, text);
    }

    private Token readString() {
        var sb = new StringBuilder();
        while (true) {
            if (eof()) throw error(ErrorKind.UNEXPECTED_END_OF_SOURCE);
            int c = consume();
            if (c == '"') return Token.string(line, lexeme(), sb.toString());
            if (c == '\n') throw error(ErrorKind.UNTERMINATED_STRING);
            if (c != '\\') {
                sb.appendCodePoint(c);
                continue;
            }
            int e = consumeOrFail();
            switch (e) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case '/' -> sb.append('/');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'u' -> readUnicodeEscape(sb);
                default -> throw error(ErrorKind.INVALID_ESCAPE_SEQUENCE);
            }
        }
    }

    private void readUnicodeEscape(StringBuilder sb) {
        char unit = (char) readHex4();
        if (Character.isLowSurrogate(unit)) throw error(ErrorKind.INVALID_ESCAPE_SEQUENCE);
        if (!Character.isHighSurrogate(unit)) {
            sb.append(unit);
            return;
        }
        // a high surrogate is only valid as the first half of an escaped pair
        if (peek() != '\\' || peekNext() != 'u') throw error(ErrorKind.INVALID_ESCAPE_SEQUENCE);
        consume();
        consume();
        char low = (char) readHex4();
        if (!Character.isLowSurrogate(low)) throw error(ErrorKind.INVALID_ESCAPE_SEQUENCE);
        sb.appendCodePoint(Character.toCodePoint(unit, low));
    }

    private int readHex4() {
        int[] digits = new int[4];
        for (int k = 0; k < 4; k++) digits[k] = consumeOrFail();
        int cp = 0;
        for (int d : digits) {
            int v = hexVal(d);
            if (v < 0) throw error(ErrorKind.INVALID_ESCAPE_SEQUENCE);
            cp = (cp << 4) | v;
        }
        return cp;
    }

    private Token readSymbol(int c) {
        var kind = switch (c) {
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case '[' -> TokenKind.LBRACKET;
            case ']' -> TokenKind.RBRACKET;
            case ':' -> TokenKind.COLON;
            case ',' -> TokenKind.COMMA;
            default -> throw error(ErrorKind.UNRECOGNISED_SYMBOL);
        };
        return Token.of(kind, line, lexeme());
    }

    private static int hexVal(int c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return 10 + (c - 'a');
        if (c >= 'A' && c <= 'F') return 10 + (c - 'A');
        return -1;
    }

    private boolean eof() {
        return i >= s.length();
    }

    private int peek() {
        return eof() ? EOF : s.codePointAt(i);
    }

    private int peekNext() {
        if (eof()) return EOF;
        int next = i + Character.charCount(s.codePointAt(i));
        return next < s.length() ? s.codePointAt(next) : EOF;
    }

    private int consume() {
        int c = s.codePointAt(i);
        i += Character.charCount(c);
        return c;
    }

    private int consumeOrFail() {
        if (eof()) throw error(ErrorKind.UNEXPECTED_END_OF_SOURCE);
        return consume();
    }

    private String lexeme() {
        return s.substring(start, i);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private Json.ParseException error(ErrorKind kind) {
        return new Json.ParseException(new ParserError(kind, line, lexeme()));
    }
}
