package software.amazon.dfa;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds automata whose elements are JSON values. A pattern, or a sequence to search, is written as a JSON array:
 * <pre>
 *     [ "login", { "status": 403 }, { "status": 403 }, "logout" ]
 * </pre>
 * Elements are compared with JsonNode equality, so objects match regardless of field order but numbers only match
 * when written the same way: 1 and 1.0 are different elements.
 */
public class JsonPatternCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper(JSON_FACTORY);

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a pattern
     * @param source pattern, as a String
     * @return null if the pattern is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doParse(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doParse(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern from its JSON array form.
     *
     * @param source pattern, as a String
     * @return an automaton recognizing the array's elements in order
     * @throws IOException if the pattern isn't a syntactically valid JSON array
     */
    public static Dfa<JsonNode> compile(final String source) throws IOException {
        return new Dfa<>(doParse(JSON_FACTORY.createParser(source)));
    }

    public static Dfa<JsonNode> compile(final Reader source) throws IOException {
        return new Dfa<>(doParse(JSON_FACTORY.createParser(source)));
    }

    public static Dfa<JsonNode> compile(final InputStream source) throws IOException {
        return new Dfa<>(doParse(JSON_FACTORY.createParser(source)));
    }

    /**
     * Parse a sequence to be searched. Same format as a pattern.
     *
     * @param source the sequence, as a JSON array
     * @return the array's elements, in order
     * @throws IOException if the source isn't a syntactically valid JSON array
     */
    public static List<JsonNode> parseSequence(final String source) throws IOException {
        return doParse(JSON_FACTORY.createParser(source));
    }

    public static List<JsonNode> parseSequence(final Reader source) throws IOException {
        return doParse(JSON_FACTORY.createParser(source));
    }

    public static List<JsonNode> parseSequence(final InputStream source) throws IOException {
        return doParse(JSON_FACTORY.createParser(source));
    }

    private static List<JsonNode> doParse(final JsonParser parser) throws IOException {
        try {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                barf(parser, "Pattern is not an array");
            }
            final List<JsonNode> elements = new ArrayList<>();
            JsonToken token;
            while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
                if (token == null) {
                    barf(parser, "Pattern array is not closed");
                }
                final JsonNode element = OBJECT_MAPPER.readTree(parser);
                elements.add(element == null ? NullNode.getInstance() : element);
            }
            if (parser.nextToken() != null) {
                barf(parser, "Unexpected content after the pattern array");
            }
            return elements;
        } finally {
            parser.close();
        }
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
