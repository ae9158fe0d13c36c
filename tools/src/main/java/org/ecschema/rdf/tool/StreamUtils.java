package org.ecschema.rdf.tool;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;

/**
 * Utilities for working with streams.
 */
public final class StreamUtils {
    /**
     * Wrap an output stream in a writer that writes UTF_8 characters.
     */
    public static Writer utf8(OutputStream stream) {
        return new OutputStreamWriter(stream, UTF_8);
    }

    private StreamUtils() {
        // Uncallable util constructor
    }
}
