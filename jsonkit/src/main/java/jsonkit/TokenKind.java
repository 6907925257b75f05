package jsonkit;

/**
 * The closed alphabet of lexical units.
 *
 * <p> Only {@link #STRING} tokens carry a decoded value; {@link #NUMBER} and {@link #BOOL} keep their
 * source text and are interpreted by whichever {@link JsonParse} consumes them.
 *
 * @author Freeman
 */
public enum TokenKind {
    LBRACE("'{'"),
    RBRACE("'}'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    COLON("':'"),
    COMMA("','"),
    STRING("string"),
    NUMBER("number"),
    BOOL("boolean"),
    NULL("null");

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
