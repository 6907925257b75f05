package jsonkit.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import jsonkit.Json;
import jsonkit.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validate a JSON file and print its compact form.
 *
 * <pre>
 * usage: jsonkit &lt;file&gt;
 * </pre>
 *
 * Exit codes: {@code 0} valid, {@code 1} parse error, {@code 2} usage or I/O error.
 *
 * @author Freeman
 */
public final class JsonKitCli {

    static final int OK = 0;
    static final int PARSE_ERROR = 1;
    static final int USAGE_ERROR = 2;

    private JsonKitCli() {
        throw new UnsupportedOperationException();
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("usage: jsonkit <file>");
            return USAGE_ERROR;
        }
        var file = args[0];

        String text;
        try {
            text = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            LOGGER.debug("Cannot read {}", file, e);
            err.println(file + ": cannot read file: " + e.getMessage());
            return USAGE_ERROR;
        }

        try {
            var value = Json.parse(text, JsonValue.class);
            out.println(Json.stringify(value));
            return OK;
        } catch (Json.ParseException e) {
            var error = e.error();
            err.println(file + ":" + error.line() + ": " + error.kind().describe() + " near '" + error.lexeme() + "'");
            return PARSE_ERROR;
        }
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonKitCli.class);
}
