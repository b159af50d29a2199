package software.amazon.keyword.fsa;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.HashSet;
import java.util.Set;

/**
 * Compiles keyword libraries, expressed in JSON, into a {@link StaticKeywordLibrary}.
 * The document is an object whose field names are decimal type selectors and whose values are arrays of keywords:
 * <pre>
 * {@code
 *   {
 *     "1": [ "he", "she", { "id": 7, "text": "his" }, { "hex": "68657273" } ],
 *     "2": [ "error", "warning" ]
 *   }
 * }
 * </pre>
 * A string entry is a UTF-8 keyword whose id is its position in the array. An object entry carries exactly one of
 * "text" or "hex" and may override the id with "id".
 *
 * Is public so clients can call the check() method to syntax-check libraries before deploying them.
 */
public final class KeywordLibraryCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private static final String ID = "id";
    private static final String TEXT = "text";
    private static final String HEX = "hex";

    private KeywordLibraryCompiler() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Verify the syntax of a keyword library
     * @param source library, as a String
     * @return null if the library is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a keyword library
     * @param source library, as a byte array
     * @return null if the library is valid, otherwise an error message
     */
    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a keyword library
     * @param source library, as a Reader
     * @return null if the library is valid, otherwise an error message
     */
    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a keyword library
     * @param source library, as an InputStream
     * @return null if the library is valid, otherwise an error message
     */
    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a keyword library from its JSON form.
     *
     * @param source library, as a String
     * @return the compiled library
     * @throws IOException if the library isn't syntactically valid
     */
    public static StaticKeywordLibrary compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static StaticKeywordLibrary compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static StaticKeywordLibrary compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static StaticKeywordLibrary compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static StaticKeywordLibrary doCompile(final JsonParser parser) throws IOException {
        final StaticKeywordLibrary.Builder library = StaticKeywordLibrary.builder();
        final Set<Integer> seenTypes = new HashSet<>();
        try {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                barf(parser, "Keyword library is not an object");
            }
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                final String typeName = parser.getCurrentName();
                final int type = parseType(parser, typeName);
                if (!seenTypes.add(type)) {
                    barf(parser, String.format("Type %d is defined more than once", type));
                }
                if (parser.nextToken() != JsonToken.START_ARRAY) {
                    barf(parser, String.format("\"%s\" must be an array of keywords", typeName));
                }
                library.addType(type);
                writeKeywords(library, type, parser);
            }
        } finally {
            parser.close();
        }
        return library.build();
    }

    private static int parseType(final JsonParser parser, final String typeName) throws IOException {
        try {
            return Integer.parseInt(typeName);
        } catch (NumberFormatException e) {
            barf(parser, String.format("Type selector \"%s\" is not an integer", typeName));
            return 0; // unreachable
        }
    }

    private static void writeKeywords(final StaticKeywordLibrary.Builder library,
                                      final int type,
                                      final JsonParser parser) throws IOException {
        JsonToken token;
        int position = 0;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            switch (token) {
            case VALUE_STRING:
                library.addKeyword(type, Keyword.of(position, parser.getText()));
                break;

            case START_OBJECT:
                library.addKeyword(type, processKeywordObject(parser, position));
                break;

            default:
                barf(parser, "Keyword must be a string or an object");
            }
            position++;
        }
    }

    // { "id": 7, "text": "his" } or { "hex": "686973" }
    private static Keyword processKeywordObject(final JsonParser parser, final int position) throws IOException {
        Integer id = null;
        String text = null;
        byte[] hex = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String fieldName = parser.getCurrentName();
            final JsonToken valueToken = parser.nextToken();
            if (ID.equals(fieldName)) {
                if (id != null) {
                    barf(parser, "\"id\" given more than once");
                }
                if (valueToken != JsonToken.VALUE_NUMBER_INT) {
                    barf(parser, "\"id\" must be an integer");
                }
                id = parser.getIntValue();
            } else if (TEXT.equals(fieldName) || HEX.equals(fieldName)) {
                if (text != null || hex != null) {
                    barf(parser, "Only one of \"text\" and \"hex\" allowed in a keyword");
                }
                if (valueToken != JsonToken.VALUE_STRING) {
                    barf(parser, String.format("\"%s\" must be a string", fieldName));
                }
                if (TEXT.equals(fieldName)) {
                    text = parser.getText();
                } else {
                    hex = decodeHex(parser, parser.getText());
                }
            } else {
                barf(parser, String.format("Unknown keyword field \"%s\"", fieldName));
            }
        }

        if (text == null && hex == null) {
            barf(parser, "Keyword object needs \"text\" or \"hex\"");
        }
        final int keywordId = id == null ? position : id;
        return text != null ? Keyword.of(keywordId, text) : Keyword.of(keywordId, hex);
    }

    private static byte[] decodeHex(final JsonParser parser, final String hex) throws IOException {
        if (hex.length() % 2 != 0) {
            barf(parser, "Hex keyword must have an even number of digits");
        }
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(hex.length() / 2);
        for (int i = 0; i < hex.length(); i += 2) {
            final int high = Character.digit(hex.charAt(i), 16);
            final int low = Character.digit(hex.charAt(i + 1), 16);
            if (high < 0 || low < 0) {
                barf(parser, String.format("Invalid hex digit at pos %d", high < 0 ? i : i + 1));
            }
            bytes.write((high << 4) | low);
        }
        return bytes.toByteArray();
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
