package org.ecschema.rdf.tool.rdf;

import org.ecschema.rdf.tool.MapperUtils;
import org.ecschema.rdf.tool.exception.ContainedException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * Builds Turtle string literals. Escaping follows JSON so every literal also
 * decodes with a JSON parser.
 */
public final class TurtleLiterals {
    /**
     * Quote and escape a string.
     */
    public static String quote(String value) {
        StringBuilder literal = new StringBuilder(value.length() + 2);
        literal.append('"');
        JsonStringEncoder.getInstance().quoteAsString(value, literal);
        return literal.append('"').toString();
    }

    /**
     * Encode a value as JSON and quote the result. Decoding the literal once
     * gives back the JSON text, decoding that gives back the value.
     *
     * @throws ContainedException if the value can't be encoded as JSON
     */
    public static String quoteJson(Object value) {
        try {
            return quote(MapperUtils.getObjectMapper().writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new ContainedException("Can't encode " + value.getClass().getName() + " as JSON", e);
        }
    }

    private TurtleLiterals() {
        // Utility class.
    }
}
